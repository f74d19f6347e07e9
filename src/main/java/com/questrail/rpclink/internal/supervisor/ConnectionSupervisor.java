package com.questrail.rpclink.internal.supervisor;

import com.questrail.rpclink.api.CloseCodes;
import com.questrail.rpclink.api.LinkState;
import com.questrail.rpclink.config.LinkSettings;
import com.questrail.rpclink.config.ReconnectBackoff;
import com.questrail.rpclink.events.LinkEvent;
import com.questrail.rpclink.internal.exec.SerializedContext;
import com.questrail.rpclink.internal.liveness.LivenessMonitor;
import com.questrail.rpclink.internal.time.MonotonicClock;
import com.questrail.rpclink.internal.time.MonotonicScheduler;
import com.questrail.rpclink.internal.time.WallClock;
import com.questrail.rpclink.observability.LinkEventSink;
import com.questrail.rpclink.protocol.ProtocolEngine;
import com.questrail.rpclink.protocol.ProtocolEngineListener;
import com.questrail.rpclink.transport.Frame;
import com.questrail.rpclink.transport.ReadyState;
import com.questrail.rpclink.transport.Transport;
import com.questrail.rpclink.transport.TransportFactory;
import com.questrail.rpclink.transport.TransportListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * ConnectionSupervisor
 * =============================================================================
 * Owns the lifecycle of the link: creates one transport per connect attempt,
 * gates the protocol engine on transport readiness, closes sessions that
 * stay connecting too long or stop answering probes, and schedules
 * reconnects with backoff.
 *
 * <h2>Sessions</h2>
 * <p>Each connect attempt is a session with a fresh id. Transport and timer
 * callbacks carry the id they were created for and are ignored once their
 * session is no longer the active one. The first path that ends a session
 * (remote close, local close, connect timeout, probe exhaustion, engine
 * failure) handles it; later paths find the session already handled and do
 * nothing. Exactly one {@link LinkEvent.Closed} is emitted per session.</p>
 *
 * <h2>Engine gating</h2>
 * <p>The engine is paused whenever no session is open. Outbound frames it
 * queues while paused are flushed on {@code resume()} when the next session
 * opens.</p>
 *
 * <h2>Threading</h2>
 * <p>Every public method and every callback runs inside the shared
 * {@link SerializedContext}. Event sinks are invoked synchronously from that
 * context and may call back into the supervisor.</p>
 */
public final class ConnectionSupervisor {

    private static final Logger log = LoggerFactory.getLogger(ConnectionSupervisor.class);

    static final Duration FIRST_PROBE_DELAY = Duration.ofMillis(1);

    public static final String NORMAL_CLOSURE_REASON = "Normal Closure";
    static final String PROBE_TIMEOUT_REASON = "Timeout: No responses received to probe calls";
    static final String INTERNAL_ERROR_REASON = "Internal protocol engine error";

    private final LinkSettings settings;
    private final ProtocolEngine engine;
    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final WallClock wallClock;
    private final SerializedContext context;
    private final LivenessMonitor livenessMonitor;

    private final List<LinkEventSink> sinks = new CopyOnWriteArrayList<>();
    private final SupervisorState state = new SupervisorState();

    public ConnectionSupervisor(LinkSettings settings,
                                ProtocolEngine engine,
                                MonotonicClock clock,
                                MonotonicScheduler scheduler,
                                WallClock wallClock,
                                SerializedContext context) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.context = Objects.requireNonNull(context, "context");
        this.livenessMonitor = new LivenessMonitor(engine, clock, scheduler, context, settings, new ProbeOutcomes());

        context.execute(() -> {
            engine.bind(new EngineEvents());
            engine.pause();
        });
    }

    public void addEventSink(LinkEventSink sink) {
        sinks.add(Objects.requireNonNull(sink, "sink"));
    }

    public void removeEventSink(LinkEventSink sink) {
        sinks.remove(sink);
    }

    public LinkSettings settings() {
        return settings;
    }

    // -------------------------------------------------------------------------
    // Control
    // -------------------------------------------------------------------------

    /**
     * Marks the link started and begins the first connect attempt.
     *
     * @throws IllegalStateException if already started, or if address or
     *                               transport factory are not configured
     */
    public void start() {
        context.execute(() -> {
            if (state.started) {
                throw new IllegalStateException("start(): already started");
            }
            if (settings.address() == null) {
                throw new IllegalStateException("start(): no address configured");
            }
            if (settings.transportFactory() == null) {
                throw new IllegalStateException("start(): no transport factory configured");
            }
            state.started = true;
            log.debug("Starting link to {}", settings.address());
            connect();
        });
    }

    public void stop() {
        stop(CloseCodes.NORMAL, NORMAL_CLOSURE_REASON);
    }

    /**
     * Stops supervising and closes the active session, if any. Idempotent.
     *
     * @throws IllegalArgumentException if {@code code} is not a valid outgoing close code
     */
    public void stop(int code, String reason) {
        CloseCodes.requireValidOutgoing(code, "stop()");
        context.execute(() -> {
            halt();
            closeActiveSession(code, reason);
        });
    }

    /**
     * Closes the active session without stopping. If started and reconnect is
     * enabled, a new attempt is scheduled with backoff.
     *
     * @return {@code true} if there was a session to close
     */
    public boolean closeConnection(int code, String reason) {
        CloseCodes.requireValidOutgoing(code, "closeConnection()");
        return context.call(() -> closeActiveSession(code, reason));
    }

    // -------------------------------------------------------------------------
    // Queries
    // -------------------------------------------------------------------------

    public boolean isStarted() {
        return context.call(() -> state.started);
    }

    /**
     * Started, with a session whose transport is open and an engine that
     * is not paused.
     */
    public boolean hasActiveConnection() {
        return context.call(() -> {
            Session session = state.activeSession;
            return state.started
                && session != null
                && session.transport().readyState() == ReadyState.OPEN
                && !engine.isPaused();
        });
    }

    public int reconnectCounter() {
        return context.call(state.reconnectCounter::value);
    }

    public LinkState state() {
        return context.call(() -> {
            if (!state.started) {
                return LinkState.IDLE;
            }
            Session session = state.activeSession;
            if (session != null) {
                return session.opened() ? LinkState.OPEN : LinkState.CONNECTING;
            }
            return state.reconnectTimer != null ? LinkState.WAITING : LinkState.CONNECTING;
        });
    }

    // -------------------------------------------------------------------------
    // Session lifecycle (context-confined)
    // -------------------------------------------------------------------------

    private void connect() {
        if (!state.started) {
            throw new IllegalStateException("connect(): not started");
        }
        if (state.activeSession != null) {
            throw new IllegalStateException("connect(): a session is already active");
        }
        cancelReconnectTimer();

        URI address = settings.address();
        TransportFactory factory = settings.transportFactory();
        Duration connectTimeout = settings.connectTimeout();
        long sessionId = ++state.lastSessionId;

        Transport transport;
        try {
            transport = Objects.requireNonNull(
                factory.create(address, new SessionTransportListener(sessionId)),
                "transport factory returned null");
        }
        catch (RuntimeException e) {
            log.warn("Transport factory failed for session {}", sessionId, e);
            emitError(e);
            afterFailedAttempt();
            return;
        }

        Session session = new Session(sessionId, transport);
        state.activeSession = session;
        session.armConnectTimeout(scheduler.scheduleAfter(connectTimeout, clock,
            guarded(() -> onConnectTimeout(sessionId, connectTimeout))));

        emit(new LinkEvent.Connecting(wallClock.now(), sessionId));
    }

    private void afterFailedAttempt() {
        if (state.started && settings.reconnect()) {
            Duration delay = scheduleReconnect();
            log.debug("Retrying connect in {}ms", delay.toMillis());
        }
        else {
            halt();
        }
    }

    private void onConnectTimeout(long sessionId, Duration connectTimeout) {
        Session session = activeSession(sessionId);
        if (session == null || session.opened()) {
            return;
        }
        log.debug("Session {} still connecting after {}", sessionId, connectTimeout);
        closeActiveSession(settings.timeoutCloseCode(),
            "Timeout: Opening connection took longer than " + connectTimeout.toMillis() + "ms");
    }

    private void onTransportOpen(long sessionId) {
        Session session = activeSession(sessionId);
        if (session == null) {
            return;
        }
        session.markOpened();
        session.cancelConnectTimeout();
        cancelReconnectTimer();

        livenessMonitor.reset();
        engine.resume();
        livenessMonitor.start(FIRST_PROBE_DELAY);

        emit(new LinkEvent.Opened(wallClock.now(), sessionId));
    }

    private boolean closeActiveSession(int code, String reason) {
        Session session = state.activeSession;
        if (session == null) {
            return false;
        }
        try {
            session.transport().close(code, reason);
        }
        catch (RuntimeException e) {
            emitError(e);
        }
        sessionEnded(session, code, reason, false);
        return true;
    }

    private void sessionEnded(Session session, int code, String reason, boolean closedByRemote) {
        if (session.closeHandled() || state.activeSession != session) {
            return;
        }
        session.markCloseHandled();
        state.activeSession = null;
        session.cancelConnectTimeout();
        livenessMonitor.stop();
        engine.pause();

        if (state.started && settings.reconnect()) {
            Duration delay = scheduleReconnect();
            emit(new LinkEvent.Closed(wallClock.now(), session.id(), code, reason, closedByRemote,
                true, Optional.of(delay)));
        }
        else {
            halt();
            emit(new LinkEvent.Closed(wallClock.now(), session.id(), code, reason, closedByRemote,
                false, Optional.empty()));
        }
    }

    /** Everything {@code stop()} does except closing the session. */
    private void halt() {
        state.started = false;
        cancelReconnectTimer();
        livenessMonitor.stop();
    }

    private Duration scheduleReconnect() {
        int max = settings.reconnectCounterMax();
        Duration delay = backoffDelay(state.reconnectCounter.current(max));
        state.reconnectCounter.recordFailure(max);

        cancelReconnectTimer();
        long ticket = ++state.reconnectTicket;
        state.reconnectTimer = scheduler.scheduleAfter(delay, clock, guarded(() -> onReconnectTimer(ticket)));
        return delay;
    }

    private Duration backoffDelay(int counter) {
        try {
            Duration delay = settings.reconnectBackoff().delayFor(counter);
            if (delay == null || delay.isNegative()) {
                throw new IllegalStateException("reconnect backoff returned " + delay + " for counter " + counter);
            }
            return delay;
        }
        catch (RuntimeException e) {
            emitError(e);
            return ReconnectBackoff.exponentialWithJitter().delayFor(counter);
        }
    }

    private void onReconnectTimer(long ticket) {
        if (ticket != state.reconnectTicket || state.reconnectTimer == null) {
            return;
        }
        state.reconnectTimer = null;
        if (state.started && state.activeSession == null) {
            connect();
        }
    }

    private void cancelReconnectTimer() {
        state.reconnectTicket++;
        if (state.reconnectTimer != null) {
            state.reconnectTimer.cancel();
            state.reconnectTimer = null;
        }
    }

    private Session activeSession(long sessionId) {
        Session session = state.activeSession;
        return session != null && session.id() == sessionId ? session : null;
    }

    private void sendFrame(Frame frame) {
        Session session = state.activeSession;
        if (session == null || !session.opened() || session.transport().readyState() != ReadyState.OPEN) {
            throw new IllegalStateException("Cannot send frame: no open session");
        }
        session.transport().send(frame);
    }

    // -------------------------------------------------------------------------
    // Event delivery
    // -------------------------------------------------------------------------

    private void emit(LinkEvent event) {
        for (LinkEventSink sink : sinks) {
            try {
                sink.onEvent(event);
            }
            catch (RuntimeException e) {
                if (event instanceof LinkEvent.UnhandledError) {
                    log.error("Event sink failed while handling an unhandled error", e);
                }
                else {
                    emitError(e);
                }
            }
        }
    }

    private void emitError(Throwable cause) {
        emit(new LinkEvent.UnhandledError(wallClock.now(), cause));
    }

    /**
     * Wraps a callback so it runs in the context and reports what it throws
     * instead of letting it escape into a timer or I/O thread.
     */
    private Runnable guarded(Runnable body) {
        return () -> context.execute(() -> {
            try {
                body.run();
            }
            catch (RuntimeException e) {
                log.warn("Link callback failed", e);
                emitError(e);
            }
        });
    }

    // -------------------------------------------------------------------------
    // Callbacks
    // -------------------------------------------------------------------------

    private final class SessionTransportListener implements TransportListener {
        private final long sessionId;

        SessionTransportListener(long sessionId) {
            this.sessionId = sessionId;
        }

        @Override
        public void onOpen() {
            guarded(() -> onTransportOpen(sessionId)).run();
        }

        @Override
        public void onError(Throwable cause) {
            guarded(() -> {
                if (activeSession(sessionId) != null) {
                    emit(new LinkEvent.TransportFailed(wallClock.now(), sessionId, cause));
                }
            }).run();
        }

        @Override
        public void onClose(int code, String reason) {
            guarded(() -> {
                Session session = activeSession(sessionId);
                if (session != null) {
                    sessionEnded(session, code, reason, true);
                }
            }).run();
        }

        @Override
        public void onMessage(Frame frame) {
            guarded(() -> {
                if (activeSession(sessionId) != null) {
                    engine.receive(frame);
                }
            }).run();
        }
    }

    private final class EngineEvents implements ProtocolEngineListener {
        @Override
        public void onOutboundFrame(Frame frame) {
            context.execute(() -> sendFrame(frame));
        }

        @Override
        public void onProtocolError(Throwable cause) {
            context.execute(() -> emit(new LinkEvent.ProtocolError(wallClock.now(), cause)));
        }

        @Override
        public void onInternalError(Throwable cause) {
            context.execute(() -> {
                log.error("Protocol engine failed", cause);
                closeActiveSession(settings.internalErrorCloseCode(), INTERNAL_ERROR_REASON);
                emitError(cause);
            });
        }
    }

    private final class ProbeOutcomes implements LivenessMonitor.Listener {
        @Override
        public void onProbeSucceeded(Duration delay) {
            state.reconnectCounter.decay();
            emit(new LinkEvent.ProbeSucceeded(wallClock.now(), delay));
        }

        @Override
        public void onProbeFailed(int consecutiveFailures, Throwable cause) {
            emit(new LinkEvent.ProbeFailed(wallClock.now(), consecutiveFailures, cause));
        }

        @Override
        public void onFailureThresholdReached(int consecutiveFailures) {
            log.debug("{} consecutive probe failures, closing session", consecutiveFailures);
            closeActiveSession(settings.timeoutCloseCode(), PROBE_TIMEOUT_REASON);
        }
    }
}
