package com.questrail.rpclink;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.rpclink.api.LinkClosedException;
import com.questrail.rpclink.api.LinkState;
import com.questrail.rpclink.config.LinkSettings;
import com.questrail.rpclink.internal.exec.SerializedContext;
import com.questrail.rpclink.internal.supervisor.ConnectionSupervisor;
import com.questrail.rpclink.internal.time.MonotonicClock;
import com.questrail.rpclink.internal.time.MonotonicScheduler;
import com.questrail.rpclink.internal.time.ScheduledExecutorScheduler;
import com.questrail.rpclink.internal.time.SystemMonotonicClock;
import com.questrail.rpclink.internal.time.SystemWallClock;
import com.questrail.rpclink.internal.time.WallClock;
import com.questrail.rpclink.observability.LinkEventSink;
import com.questrail.rpclink.observability.NullLinkEventSink;
import com.questrail.rpclink.observability.Slf4jLinkEventSink;
import com.questrail.rpclink.protocol.jsonrpc.JsonRpcEngine;
import com.questrail.rpclink.protocol.jsonrpc.JsonRpcSettings;
import com.questrail.rpclink.protocol.jsonrpc.RpcMethod;
import com.questrail.rpclink.protocol.jsonrpc.RpcNotification;
import com.questrail.rpclink.transport.TransportFactory;
import com.questrail.rpclink.transport.websocket.netty.NettyWebSocketTransportFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * RpcLinkClient
 * =============================================================================
 * Composition root and public surface of a self-healing JSON-RPC link.
 *
 * <p>Wires a {@link ConnectionSupervisor}, a {@link JsonRpcEngine} and a
 * transport factory around one {@link SerializedContext}, and exposes
 * lifecycle control, remote calls and event subscription.</p>
 *
 * <pre>{@code
 * RpcLinkClient client = RpcLinkClient.builder()
 *     .withAddress(URI.create("ws://localhost:8080/rpc"))
 *     .build();
 * client.start();
 * client.call("add", 1, 2).thenAccept(sum -> ...);
 * }</pre>
 *
 * <p>Calls made while no session is open are queued and sent once the next
 * session opens. They are not failed by a closed session; use a call timeout
 * to bound how long they may wait.</p>
 *
 * <p>Remote calls, event sinks and method handlers run inside the link's
 * execution context. Handlers and sinks must not block.</p>
 */
public final class RpcLinkClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RpcLinkClient.class);

    private final SerializedContext context;
    private final ConnectionSupervisor supervisor;
    private final JsonRpcEngine engine;
    private final ScheduledExecutorService ownedExecutor;
    private final NettyWebSocketTransportFactory ownedTransportFactory;

    private boolean closed;

    private RpcLinkClient(SerializedContext context,
                          ConnectionSupervisor supervisor,
                          JsonRpcEngine engine,
                          ScheduledExecutorService ownedExecutor,
                          NettyWebSocketTransportFactory ownedTransportFactory) {
        this.context = context;
        this.supervisor = supervisor;
        this.engine = engine;
        this.ownedExecutor = ownedExecutor;
        this.ownedTransportFactory = ownedTransportFactory;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Live configuration. Changes apply to the next operation that reads them.
     */
    public LinkSettings settings() {
        return supervisor.settings();
    }

    // -------------------------------------------------------------------------
    // Lifecycle
    // -------------------------------------------------------------------------

    public void start() {
        context.execute(() -> {
            requireOpen();
            supervisor.start();
        });
    }

    public void stop() {
        supervisor.stop();
    }

    public void stop(int code, String reason) {
        supervisor.stop(code, reason);
    }

    public boolean closeConnection(int code, String reason) {
        return supervisor.closeConnection(code, reason);
    }

    public boolean isStarted() {
        return supervisor.isStarted();
    }

    public boolean hasActiveConnection() {
        return supervisor.hasActiveConnection();
    }

    public int reconnectCounter() {
        return supervisor.reconnectCounter();
    }

    public LinkState state() {
        return supervisor.state();
    }

    public void addListener(LinkEventSink sink) {
        supervisor.addEventSink(sink);
    }

    public void removeListener(LinkEventSink sink) {
        supervisor.removeEventSink(sink);
    }

    // -------------------------------------------------------------------------
    // JSON-RPC
    // -------------------------------------------------------------------------

    /**
     * Calls a remote method with the default call timeout.
     */
    public CompletableFuture<JsonNode> call(String method, Object... params) {
        return context.call(() -> {
            requireOpen();
            return engine.call(method, params);
        });
    }

    /**
     * Calls a remote method. A zero timeout waits until a response arrives or
     * the client is closed.
     */
    public CompletableFuture<JsonNode> call(Duration timeout, String method, Object... params) {
        return context.call(() -> {
            requireOpen();
            return engine.call(timeout, method, params);
        });
    }

    public void notify(String method, Object... params) {
        context.execute(() -> {
            requireOpen();
            engine.notify(method, params);
        });
    }

    public void method(String name, RpcMethod handler) {
        engine.method(name, handler);
    }

    public void notification(String name, RpcNotification handler) {
        engine.notification(name, handler);
    }

    public Duration defaultTimeout() {
        return engine.settings().defaultTimeout();
    }

    public void setDefaultTimeout(Duration timeout) {
        engine.setSettings(engine.settings().withDefaultTimeout(timeout));
    }

    // -------------------------------------------------------------------------
    // Shutdown
    // -------------------------------------------------------------------------

    /**
     * Stops the link, rejects outstanding calls with {@link LinkClosedException}
     * and releases the scheduler thread and event loop this client created.
     * Idempotent.
     */
    @Override
    public void close() {
        boolean first = context.call(() -> {
            if (closed) {
                return false;
            }
            closed = true;
            supervisor.stop();
            engine.failPending(new LinkClosedException("RpcLinkClient closed"));
            return true;
        });
        if (!first) {
            return;
        }

        if (ownedTransportFactory != null) {
            ownedTransportFactory.close();
        }
        if (ownedExecutor != null) {
            ownedExecutor.shutdown();
            try {
                if (!ownedExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                    ownedExecutor.shutdownNow();
                }
            }
            catch (InterruptedException e) {
                ownedExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.debug("RpcLinkClient closed");
    }

    private void requireOpen() {
        if (closed) {
            throw new LinkClosedException("RpcLinkClient is closed");
        }
    }

    /**
     * Builder
     * -------------------------------------------------------------------------
     * Anything not supplied gets a production default: a Netty WebSocket
     * transport factory, a single-threaded scheduler, the system clocks and
     * an SLF4J event sink.
     */
    public static final class Builder {
        private LinkSettings settings = new LinkSettings();
        private JsonRpcSettings jsonRpcSettings = JsonRpcSettings.defaults();
        private ObjectMapper objectMapper;
        private LinkEventSink eventSink = new Slf4jLinkEventSink();
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private MonotonicScheduler scheduler;

        public Builder withSettings(LinkSettings settings) {
            this.settings = Objects.requireNonNull(settings, "settings");
            return this;
        }

        public Builder withAddress(URI address) {
            settings.setAddress(address);
            return this;
        }

        public Builder withTransportFactory(TransportFactory factory) {
            settings.setTransportFactory(factory);
            return this;
        }

        public Builder withJsonRpcSettings(JsonRpcSettings settings) {
            this.jsonRpcSettings = Objects.requireNonNull(settings, "jsonRpcSettings");
            return this;
        }

        public Builder withObjectMapper(ObjectMapper mapper) {
            this.objectMapper = Objects.requireNonNull(mapper, "objectMapper");
            return this;
        }

        /**
         * Replaces the default SLF4J sink; {@code null} silences events.
         * Further sinks can be added with {@link RpcLinkClient#addListener(LinkEventSink)}.
         */
        public Builder withEventSink(LinkEventSink sink) {
            this.eventSink = Objects.requireNonNullElse(sink, NullLinkEventSink.INSTANCE);
            return this;
        }

        public Builder withClock(MonotonicClock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
            return this;
        }

        /**
         * Supplies the timer facade. The caller keeps ownership of whatever
         * backs it.
         */
        public Builder withScheduler(MonotonicScheduler scheduler) {
            this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
            return this;
        }

        public RpcLinkClient build() {
            SerializedContext context = new SerializedContext();

            // 1. Timers
            ScheduledExecutorService ownedExecutor = null;
            MonotonicScheduler effectiveScheduler = scheduler;
            if (effectiveScheduler == null) {
                ownedExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
                    Thread t = new Thread(r, "rpclink-scheduler");
                    t.setDaemon(true);
                    return t;
                });
                effectiveScheduler = new ScheduledExecutorScheduler(ownedExecutor, clock);
            }

            // 2. Transport
            NettyWebSocketTransportFactory ownedFactory = null;
            if (settings.transportFactory() == null) {
                ownedFactory = new NettyWebSocketTransportFactory();
                settings.setTransportFactory(ownedFactory);
            }

            // 3. Protocol engine and supervisor sharing one context
            JsonRpcEngine engine = new JsonRpcEngine(
                objectMapper != null ? objectMapper : new ObjectMapper(),
                jsonRpcSettings,
                clock,
                effectiveScheduler,
                context
            );
            ConnectionSupervisor supervisor = new ConnectionSupervisor(
                settings,
                engine,
                clock,
                effectiveScheduler,
                wallClock,
                context
            );
            supervisor.addEventSink(eventSink);

            return new RpcLinkClient(context, supervisor, engine, ownedExecutor, ownedFactory);
        }
    }
}
