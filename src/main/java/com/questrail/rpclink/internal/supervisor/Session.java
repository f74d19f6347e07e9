package com.questrail.rpclink.internal.supervisor;

import com.questrail.rpclink.internal.time.Cancellable;
import com.questrail.rpclink.transport.Transport;

import java.util.Objects;

/**
 * One connect attempt, from the transport request until its close has been
 * handled.
 *
 * <p>The id is the identity token every asynchronous callback is compared
 * against; a callback carrying any other id belongs to a superseded session
 * and is ignored.</p>
 */
final class Session {

    private final long id;
    private final Transport transport;

    private boolean opened;
    private boolean closeHandled;
    private Cancellable connectTimeout;

    Session(long id, Transport transport) {
        this.id = id;
        this.transport = Objects.requireNonNull(transport, "transport");
    }

    long id() {
        return id;
    }

    Transport transport() {
        return transport;
    }

    boolean opened() {
        return opened;
    }

    void markOpened() {
        opened = true;
    }

    boolean closeHandled() {
        return closeHandled;
    }

    void markCloseHandled() {
        closeHandled = true;
    }

    void armConnectTimeout(Cancellable timer) {
        cancelConnectTimeout();
        connectTimeout = timer;
    }

    void cancelConnectTimeout() {
        if (connectTimeout != null) {
            connectTimeout.cancel();
            connectTimeout = null;
        }
    }

    @Override
    public String toString() {
        return "Session[" + id + ", opened=" + opened + ", closeHandled=" + closeHandled + "]";
    }
}
