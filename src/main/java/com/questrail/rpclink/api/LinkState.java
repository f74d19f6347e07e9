package com.questrail.rpclink.api;

/**
 * LinkState
 * -----------------------------------------------------------------------------
 * Coarse lifecycle state of a supervised link.
 *
 * <pre>
 *   IDLE ──start()──▶ CONNECTING ──open──▶ OPEN
 *                        ▲                   │ close (any source)
 *                        │                   ▼
 *                        └──timer fires── WAITING ──stop()──▶ IDLE
 * </pre>
 *
 * <p>Closing is handled synchronously, so there is no observable "closing"
 * state: a close either leaves the link {@link #WAITING} for a reconnect or
 * returns it to {@link #IDLE}.</p>
 */
public enum LinkState
{
    /** Not started, or stopped. */
    IDLE,

    /** A transport has been requested but is not yet open. */
    CONNECTING,

    /** The transport is open, outbound traffic flows and liveness probes run. */
    OPEN,

    /** The previous session ended; a reconnect timer is armed. */
    WAITING
}
