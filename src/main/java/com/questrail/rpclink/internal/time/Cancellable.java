package com.questrail.rpclink.internal.time;

/**
 * Cancellable
 * =============================================================================
 * Handle for a timer armed through {@link MonotonicScheduler}.
 *
 * <p>
 * The link keeps one of these for each pending connect timeout, reconnect
 * delay, probe interval and call timeout. Cancellation is cooperative: a task
 * that is already running is not interrupted, so every callback re-checks the
 * session it was armed for before acting.
 * </p>
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if cancellation succeeded; {@code false} if the task
     *         already ran or was cancelled before.
     */
    boolean cancel();
}
