package com.questrail.rpclink.protocol.jsonrpc;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Handler for an inbound JSON-RPC request.
 *
 * <p>Invoked from the link's execution context and must not block. The
 * returned value is converted to JSON with the engine's {@code ObjectMapper}.
 * Throw a {@link com.questrail.rpclink.api.RemoteCallException} to answer with
 * a specific error code; any other exception is answered as an internal
 * error.</p>
 */
@FunctionalInterface
public interface RpcMethod
{
    Object invoke(JsonNode params) throws Exception;
}
