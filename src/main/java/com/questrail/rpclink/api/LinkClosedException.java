package com.questrail.rpclink.api;

/**
 * The client was closed while a call was still outstanding.
 */
public final class LinkClosedException extends RpcException
{
    public LinkClosedException(String message) {
        super(message);
    }
}
