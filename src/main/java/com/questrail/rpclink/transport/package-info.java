/**
 * Transport Ports
 * =============================================================================
 *
 * <p>These interfaces are the framework-agnostic boundary between a concrete
 * connection implementation (the Netty WebSocket client, or a test double) and
 * the connection supervisor.</p>
 *
 * <p>Everything above a transport sees only:</p>
 * <ul>
 *   <li>Opaque {@link com.questrail.rpclink.transport.Frame}s, text or binary</li>
 *   <li>Lifecycle notifications: open, error, close with code and reason</li>
 *   <li>A {@link com.questrail.rpclink.transport.ReadyState}</li>
 * </ul>
 *
 * <h2>Constraints</h2>
 * Implementations MUST:
 * <ul>
 *   <li>Perform transport I/O only, never interpret payloads</li>
 *   <li>Not reconnect on their own</li>
 *   <li>Not arm timeouts on behalf of the supervisor</li>
 *   <li>Report every close exactly once through {@code onClose}</li>
 * </ul>
 */
package com.questrail.rpclink.transport;
