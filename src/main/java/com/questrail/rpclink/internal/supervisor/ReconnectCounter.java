package com.questrail.rpclink.internal.supervisor;

/**
 * Backoff counter driving the reconnect delay.
 *
 * - Increases by one per failed session, clamped to the configured maximum
 * - Decreases by one per successful probe, never below zero
 * - Does not encode the delay policy itself
 */
final class ReconnectCounter {

    private int value;

    int value() {
        return value;
    }

    /**
     * Returns the value to hand to the backoff policy for a failure that is
     * about to be recorded, clamped to {@code max} in case the maximum was
     * lowered since the last failure.
     */
    int current(int max) {
        return Math.min(value, max);
    }

    /**
     * Record a failed session.
     *
     * @return the updated value
     */
    int recordFailure(int max) {
        value = Math.min(current(max) + 1, max);
        return value;
    }

    /**
     * Record a successful liveness probe.
     *
     * @return the updated value
     */
    int decay() {
        value = Math.max(0, value - 1);
        return value;
    }
}
