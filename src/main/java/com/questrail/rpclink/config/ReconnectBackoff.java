package com.questrail.rpclink.config;

import java.time.Duration;

/**
 * ReconnectBackoff
 * -----------------------------------------------------------------------------
 * Maps the current reconnect counter to the delay before the next connect
 * attempt.
 *
 * <p>The counter passed in is the value <em>before</em> it is incremented for
 * the failure being handled, so it is always within
 * {@code 0..reconnectCounterMax}. It grows by one per failed session and
 * shrinks by one per successful liveness probe, so a healthy link slowly earns
 * back short reconnect delays.</p>
 *
 * <p>Implementations should be pure and fast; they run inside the link's
 * execution context.</p>
 */
@FunctionalInterface
public interface ReconnectBackoff
{
    Duration delayFor(int counter);

    /**
     * {@code 2^counter * 100ms}, scaled by a uniformly random factor in
     * {@code [0.5, 1.0)}.
     */
    static ReconnectBackoff exponentialWithJitter()
    {
        return ExponentialJitterBackoff.DEFAULT;
    }
}
