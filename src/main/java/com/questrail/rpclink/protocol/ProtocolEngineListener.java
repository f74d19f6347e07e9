package com.questrail.rpclink.protocol;

import com.questrail.rpclink.transport.Frame;

/**
 * Callbacks from a {@link ProtocolEngine} to the connection supervisor.
 */
public interface ProtocolEngineListener
{
    /**
     * The engine wants exactly one frame transmitted. Only called while the
     * engine is resumed.
     */
    void onOutboundFrame(Frame frame);

    /**
     * The peer sent something the engine could not parse. The session stays up.
     */
    void onProtocolError(Throwable cause);

    /**
     * The engine hit an unexpected internal failure. The supervisor closes the
     * session with the internal-error close code.
     */
    void onInternalError(Throwable cause);
}
