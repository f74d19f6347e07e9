package com.questrail.rpclink.protocol.jsonrpc;

import com.questrail.rpclink.api.RpcException;

/**
 * An inbound frame that is not a valid JSON-RPC 2.0 message.
 */
public final class JsonRpcProtocolException extends RpcException
{
    private final int code;

    public JsonRpcProtocolException(int code, String message) {
        super(message);
        this.code = code;
    }

    public JsonRpcProtocolException(int code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    /** The JSON-RPC error code describing the problem. */
    public int code() {
        return code;
    }
}
