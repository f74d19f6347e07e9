package com.questrail.rpclink.observability;

import com.questrail.rpclink.events.LinkEvent;

/**
 * Receives {@link LinkEvent}s from a link.
 * Implementations can provide logging, metrics, or application reactions.
 *
 * <p>Sinks are invoked synchronously from the link's execution context and
 * must not block. A sink that throws does not disturb the link: the exception
 * is re-delivered to every sink as {@link LinkEvent.UnhandledError}.</p>
 */
@FunctionalInterface
public interface LinkEventSink {
    void onEvent(LinkEvent event);
}
