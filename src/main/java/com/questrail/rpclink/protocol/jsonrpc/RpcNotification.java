package com.questrail.rpclink.protocol.jsonrpc;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Handler for an inbound JSON-RPC notification. Nothing is sent back, not
 * even on failure.
 */
@FunctionalInterface
public interface RpcNotification
{
    void accept(JsonNode params) throws Exception;
}
