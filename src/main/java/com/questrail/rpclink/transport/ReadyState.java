package com.questrail.rpclink.transport;

/**
 * Readiness of a {@link Transport}, mirroring the WebSocket {@code readyState}.
 */
public enum ReadyState
{
    CONNECTING,
    OPEN,
    CLOSING,
    CLOSED
}
