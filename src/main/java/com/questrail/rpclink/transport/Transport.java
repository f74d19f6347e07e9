package com.questrail.rpclink.transport;

/**
 * Transport
 * -----------------------------------------------------------------------------
 * One session-oriented connection to the peer.
 *
 * <p>A transport starts connecting as soon as its factory creates it and is
 * never reused: once closed, the supervisor asks the factory for a new one.
 * Lifecycle and inbound traffic are reported to the {@link TransportListener}
 * supplied at creation.</p>
 */
public interface Transport
{
    /**
     * Send a single frame. Only legal while {@link #readyState()} is
     * {@link ReadyState#OPEN}.
     *
     * @throws IllegalStateException if the transport is not open
     */
    void send(Frame frame);

    /**
     * Begin closing the transport.
     *
     * <p>If the transport is open the close code and reason are sent to the peer.
     * If it is still connecting the attempt is abandoned. Closing an already
     * closed transport has no effect. The listener's {@code onClose} follows
     * asynchronously once the transport has actually gone down.</p>
     *
     * @param code   {@code 1000} or within {@code 3000..4999}
     * @param reason human readable reason, at most 123 UTF-8 bytes
     */
    void close(int code, String reason);

    ReadyState readyState();
}
