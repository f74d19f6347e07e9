package com.questrail.rpclink.transport;

/**
 * TransportListener
 * -----------------------------------------------------------------------------
 * Callback sink for a single {@link Transport}.
 *
 * <p>Callbacks may arrive on any thread; the consumer is responsible for
 * serializing them. Implementations must deliver them in order for a given
 * transport.</p>
 */
public interface TransportListener
{
    /** The transport became usable. */
    void onOpen();

    /**
     * The transport reported a failure.
     *
     * <p>This is a diagnostic signal only. A transport that fails also reports
     * {@link #onClose(int, String)}, and only that ends the session.</p>
     */
    void onError(Throwable cause);

    /**
     * The transport is closed, by either side.
     *
     * @param code   close code received from the peer, or the locally chosen one;
     *               {@code 1006} when the connection dropped without a close handshake
     * @param reason close reason, possibly empty
     */
    void onClose(int code, String reason);

    /** A complete inbound frame arrived. */
    void onMessage(Frame frame);
}
