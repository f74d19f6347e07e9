package com.questrail.rpclink.transport;

import java.net.URI;

/**
 * Creates a new {@link Transport} for each connect attempt.
 *
 * <p>The returned transport starts connecting immediately and reports to
 * {@code listener}. Factories may throw; the supervisor treats that as a
 * failed attempt.</p>
 */
@FunctionalInterface
public interface TransportFactory
{
    Transport create(URI address, TransportListener listener);
}
