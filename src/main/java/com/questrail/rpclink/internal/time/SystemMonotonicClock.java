package com.questrail.rpclink.internal.time;

/**
 * {@link MonotonicClock} backed by {@link System#nanoTime()}.
 *
 * <p>Unaffected by NTP or manual clock changes, which matters for probe
 * round-trip measurement: a wall-clock jump must never produce a negative
 * probe delay or a reconnect that fires hours late.</p>
 */
public enum SystemMonotonicClock implements MonotonicClock {
    INSTANCE;

    @Override
    public long nowNanos() {
        return System.nanoTime();
    }
}
