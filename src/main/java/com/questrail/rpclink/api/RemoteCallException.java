package com.questrail.rpclink.api;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * The peer answered a call with an error object.
 *
 * <p>{@link #code()} and {@link #data()} are copied verbatim from the JSON-RPC
 * error object; {@code data} may be {@code null}.</p>
 */
public final class RemoteCallException extends RpcException
{
    private final int code;
    private final JsonNode data;

    public RemoteCallException(int code, String message, JsonNode data) {
        super(message);
        this.code = code;
        this.data = data;
    }

    public int code() {
        return code;
    }

    public JsonNode data() {
        return data;
    }
}
