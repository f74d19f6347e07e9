package com.questrail.rpclink.transport;

import com.questrail.rpclink.api.RpcException;

/**
 * Failure raised by a {@link Transport} implementation, for example a refused
 * connection or a failed handshake.
 */
public class TransportException extends RpcException
{
    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
