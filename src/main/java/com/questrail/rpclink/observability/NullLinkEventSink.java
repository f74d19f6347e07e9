package com.questrail.rpclink.observability;

import com.questrail.rpclink.events.LinkEvent;

/**
 * No-op implementation of {@link LinkEventSink}.
 */
public final class NullLinkEventSink implements LinkEventSink {
    public static final NullLinkEventSink INSTANCE = new NullLinkEventSink();

    private NullLinkEventSink() {}

    @Override
    public void onEvent(LinkEvent event) {}
}
