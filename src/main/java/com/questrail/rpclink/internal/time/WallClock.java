package com.questrail.rpclink.internal.time;

import java.time.Instant;

/**
 * Wall-clock source used to timestamp {@code LinkEvent}s.
 * It MUST NOT drive timeouts or backoff.
 */
public interface WallClock
{
    Instant now();
}
