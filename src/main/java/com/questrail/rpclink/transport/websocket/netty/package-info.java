/**
 * Netty WebSocket client adapter.
 *
 * <p>The only package that depends on Netty. Everything it hands upward is a
 * {@link com.questrail.rpclink.transport.Frame} or a plain lifecycle call.</p>
 */
package com.questrail.rpclink.transport.websocket.netty;
