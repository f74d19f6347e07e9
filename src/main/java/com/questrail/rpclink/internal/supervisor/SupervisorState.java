package com.questrail.rpclink.internal.supervisor;

import com.questrail.rpclink.internal.time.Cancellable;

/**
 * Mutable state of a {@link ConnectionSupervisor}, grouped in one place.
 *
 * <p>Owned exclusively by the supervisor and only touched from its execution
 * context. Nothing outside the supervisor's operations reads or writes it.</p>
 */
final class SupervisorState {

    boolean started;

    /** Id of the most recently created session; ids are never reused. */
    long lastSessionId;

    /** At most one session is active at any time. */
    Session activeSession;

    final ReconnectCounter reconnectCounter = new ReconnectCounter();

    /** Present only while waiting to reconnect. */
    Cancellable reconnectTimer;

    /** Bumped whenever the reconnect timer is armed or cancelled. */
    long reconnectTicket;
}
