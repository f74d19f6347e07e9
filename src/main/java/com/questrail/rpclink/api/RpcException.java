package com.questrail.rpclink.api;

/**
 * Base type for failures surfaced to callers of the link.
 */
public class RpcException extends RuntimeException
{
    public RpcException(String message) {
        super(message);
    }

    public RpcException(String message, Throwable cause) {
        super(message, cause);
    }
}
