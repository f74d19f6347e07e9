package com.questrail.rpclink.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for every operational delay of the link: connect timeouts,
 * reconnect backoff, probe cadence and probe round-trip measurement.
 *
 * <p>
 * Wall-clock time ({@link WallClock}) only stamps events for observers; it is
 * never used to decide when something fires.
 * </p>
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     * Values are only meaningful for elapsed time computations.
     */
    long nowNanos();
}
