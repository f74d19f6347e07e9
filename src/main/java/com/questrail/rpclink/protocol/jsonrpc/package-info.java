/**
 * JSON-RPC 2.0 protocol engine.
 *
 * <p>Sits between the connection supervisor and application code:</p>
 *
 * <pre>
 *   Frame (text)
 *        → JsonRpcEngine.receive     (parse, dispatch, settle pending calls)
 *            → RpcMethod / RpcNotification handlers
 *            → CompletableFuture of an earlier call
 * </pre>
 *
 * <p>The engine knows nothing about sessions. It only sees frames, a pause
 * gate, and a listener for outbound frames and errors. Batch requests are
 * not supported and are reported as protocol errors.</p>
 */
package com.questrail.rpclink.protocol.jsonrpc;
