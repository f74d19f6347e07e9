package com.questrail.rpclink.protocol.jsonrpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.rpclink.api.CallTimeoutException;
import com.questrail.rpclink.api.RemoteCallException;
import com.questrail.rpclink.internal.time.Cancellable;
import com.questrail.rpclink.internal.time.MonotonicClock;
import com.questrail.rpclink.internal.time.MonotonicScheduler;
import com.questrail.rpclink.protocol.ProtocolEngine;
import com.questrail.rpclink.protocol.ProtocolEngineListener;
import com.questrail.rpclink.transport.Frame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * JsonRpcEngine
 * =============================================================================
 * JSON-RPC 2.0 implementation of {@link ProtocolEngine}.
 *
 * <h2>Outbound</h2>
 * <p>Calls and notifications are encoded as text frames and handed to the
 * bound listener. While paused, frames are queued in order and flushed on
 * {@link #resume()}. A call stays pending until its response arrives, its
 * timeout fires, or {@link #failPending(Throwable)} rejects it; a closed
 * session alone does not fail it.</p>
 *
 * <h2>Inbound</h2>
 * <ul>
 *   <li>Requests are dispatched to registered {@link RpcMethod}s and answered.</li>
 *   <li>Notifications are dispatched to registered {@link RpcNotification}s.</li>
 *   <li>Responses settle the matching pending call; unknown ids are ignored.</li>
 *   <li>Unparseable or invalid messages are reported as protocol errors and,
 *       where JSON-RPC requires it, answered with an error response.</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * <p>Not thread-safe. All methods except handler registration must be called
 * from the link's execution context; timeouts re-enter it through the
 * supplied executor.</p>
 */
public final class JsonRpcEngine implements ProtocolEngine
{
    private static final Logger log = LoggerFactory.getLogger(JsonRpcEngine.class);

    public static final int PARSE_ERROR = -32700;
    public static final int INVALID_REQUEST = -32600;
    public static final int METHOD_NOT_FOUND = -32601;
    public static final int INTERNAL_ERROR = -32603;

    private static final String VERSION = "2.0";

    private final ObjectMapper mapper;
    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final Executor context;

    private final Map<String, RpcMethod> methods = new ConcurrentHashMap<>();
    private final Map<String, RpcNotification> notifications = new ConcurrentHashMap<>();

    private final Map<Long, PendingCall> pending = new HashMap<>();
    private final Queue<Frame> queued = new ArrayDeque<>();

    private volatile JsonRpcSettings settings;
    private ProtocolEngineListener listener;
    private boolean paused;
    private long nextId;

    public JsonRpcEngine(ObjectMapper mapper,
                         JsonRpcSettings settings,
                         MonotonicClock clock,
                         MonotonicScheduler scheduler,
                         Executor context) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.context = Objects.requireNonNull(context, "context");
    }

    public JsonRpcSettings settings() {
        return settings;
    }

    public void setSettings(JsonRpcSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    // -------------------------------------------------------------------------
    // Registration
    // -------------------------------------------------------------------------

    public void method(String name, RpcMethod handler) {
        methods.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(handler, "handler"));
    }

    public void notification(String name, RpcNotification handler) {
        notifications.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(handler, "handler"));
    }

    // -------------------------------------------------------------------------
    // ProtocolEngine
    // -------------------------------------------------------------------------

    @Override
    public void bind(ProtocolEngineListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void pause() {
        paused = true;
    }

    @Override
    public void resume() {
        paused = false;
        Frame frame;
        while (!paused && (frame = queued.poll()) != null) {
            requireListener().onOutboundFrame(frame);
        }
    }

    @Override
    public boolean isPaused() {
        return paused;
    }

    @Override
    public void receive(Frame frame) {
        JsonNode message;
        try {
            message = mapper.readTree(frame.asText());
        }
        catch (JsonProcessingException e) {
            reject(null, new JsonRpcProtocolException(PARSE_ERROR, "Parse error", e));
            return;
        }

        if (message == null || message.isMissingNode()) {
            reject(null, new JsonRpcProtocolException(INVALID_REQUEST, "Invalid Request: empty message"));
        }
        else if (message.isArray()) {
            reject(null, new JsonRpcProtocolException(INVALID_REQUEST, "Invalid Request: batch messages are not supported"));
        }
        else if (!message.isObject()) {
            reject(null, new JsonRpcProtocolException(INVALID_REQUEST, "Invalid Request: expected an object"));
        }
        else if (message.hasNonNull("method")) {
            if (message.has("id")) {
                handleRequest(message);
            }
            else {
                handleNotification(message);
            }
        }
        else if (message.has("id") && (message.has("result") || message.has("error"))) {
            handleResponse(message);
        }
        else {
            reject(message.get("id"), new JsonRpcProtocolException(INVALID_REQUEST, "Invalid Request"));
        }
    }

    /**
     * Calls the ping method and completes with the round-trip delay.
     */
    @Override
    public CompletableFuture<Duration> probe(Duration timeout) {
        long sentAt = clock.nowNanos();
        return call(timeout, settings.pingMethod())
            .thenApply(ignored -> Duration.ofNanos(clock.nowNanos() - sentAt));
    }

    // -------------------------------------------------------------------------
    // Outbound
    // -------------------------------------------------------------------------

    /**
     * Calls {@code method} with the default timeout.
     */
    public CompletableFuture<JsonNode> call(String method, Object... params) {
        return call(settings.defaultTimeout(), method, params);
    }

    /**
     * Calls {@code method}. A zero {@code timeout} waits indefinitely.
     */
    public CompletableFuture<JsonNode> call(Duration timeout, String method, Object... params) {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be >= 0");
        }

        CompletableFuture<JsonNode> result = new CompletableFuture<>();
        long id = ++nextId;

        ObjectNode request = envelope();
        request.put("id", id);
        request.put("method", method);
        try {
            putParams(request, params);
        }
        catch (IllegalArgumentException e) {
            result.completeExceptionally(e);
            return result;
        }

        PendingCall call = new PendingCall(method, result);
        pending.put(id, call);
        if (!timeout.isZero()) {
            call.timer = scheduler.scheduleAfter(timeout, clock, () -> context.execute(() -> expire(id, timeout)));
        }

        try {
            call.frame = send(request);
        }
        catch (RuntimeException e) {
            settle(id).ifPresent(c -> c.result.completeExceptionally(e));
        }
        return result;
    }

    /**
     * Sends a notification. Nothing comes back.
     */
    public void notify(String method, Object... params) {
        Objects.requireNonNull(method, "method");
        ObjectNode notification = envelope();
        notification.put("method", method);
        putParams(notification, params);
        send(notification);
    }

    /**
     * Rejects every pending call with {@code cause}.
     */
    public void failPending(Throwable cause) {
        List<PendingCall> calls = new ArrayList<>(pending.values());
        pending.clear();
        for (PendingCall call : calls) {
            call.cancelTimer();
            call.result.completeExceptionally(cause);
        }
        queued.clear();
    }

    public int pendingCalls() {
        return pending.size();
    }

    public int queuedFrames() {
        return queued.size();
    }

    private void putParams(ObjectNode message, Object[] params) {
        if (params == null || params.length == 0) {
            return;
        }
        ArrayNode array = message.putArray("params");
        for (Object param : params) {
            JsonNode node = mapper.valueToTree(param);
            array.add(node == null ? NullNode.getInstance() : node);
        }
    }

    /**
     * Returns the frame if it was queued, {@code null} if it went out or could not be encoded.
     */
    private Frame send(ObjectNode message) {
        String text;
        try {
            text = mapper.writeValueAsString(message);
        }
        catch (JsonProcessingException e) {
            requireListener().onInternalError(e);
            return null;
        }

        Frame frame = Frame.text(text);
        if (paused) {
            queued.add(frame);
            return frame;
        }
        requireListener().onOutboundFrame(frame);
        return null;
    }

    private ProtocolEngineListener requireListener() {
        if (listener == null) {
            throw new IllegalStateException("JsonRpcEngine is not bound");
        }
        return listener;
    }

    // -------------------------------------------------------------------------
    // Inbound
    // -------------------------------------------------------------------------

    private void handleRequest(JsonNode message) {
        JsonNode id = message.get("id");
        String method = message.get("method").asText();
        JsonNode params = message.path("params");

        JsonRpcSettings current = settings;
        if (current.respondToPings() && current.pingMethod().equals(method)) {
            respond(id, JsonNodeFactory.instance.booleanNode(true));
            return;
        }

        RpcMethod handler = methods.get(method);
        if (handler == null) {
            respondError(id, METHOD_NOT_FOUND, "Method not found", null);
            return;
        }

        Object value;
        try {
            value = handler.invoke(params);
        }
        catch (RemoteCallException e) {
            respondError(id, e.code(), e.getMessage(), e.data());
            return;
        }
        catch (Exception e) {
            log.warn("Method {} failed", method, e);
            respondError(id, INTERNAL_ERROR, "Internal error", null);
            return;
        }

        JsonNode result;
        try {
            result = value == null ? NullNode.getInstance() : mapper.valueToTree(value);
        }
        catch (IllegalArgumentException e) {
            log.warn("Result of method {} is not serializable", method, e);
            respondError(id, INTERNAL_ERROR, "Internal error", null);
            return;
        }
        respond(id, result);
    }

    private void handleNotification(JsonNode message) {
        String method = message.get("method").asText();
        RpcNotification handler = notifications.get(method);
        if (handler == null) {
            log.debug("No handler for notification {}", method);
            return;
        }
        try {
            handler.accept(message.path("params"));
        }
        catch (Exception e) {
            log.warn("Notification {} failed", method, e);
        }
    }

    private void handleResponse(JsonNode message) {
        JsonNode idNode = message.get("id");
        if (!idNode.canConvertToLong()) {
            log.debug("Ignoring response with foreign id {}", idNode);
            return;
        }
        settle(idNode.asLong()).ifPresentOrElse(call -> {
            JsonNode error = message.get("error");
            if (error != null && !error.isNull()) {
                call.result.completeExceptionally(new RemoteCallException(
                    error.path("code").asInt(INTERNAL_ERROR),
                    error.path("message").asText(""),
                    error.get("data")));
            }
            else {
                call.result.complete(message.get("result"));
            }
        }, () -> log.debug("Ignoring response to unknown or expired call {}", idNode));
    }

    private void reject(JsonNode id, JsonRpcProtocolException problem) {
        log.debug("Rejecting inbound message: {}", problem.getMessage());
        respondError(id, problem.code(), problem.getMessage(), null);
        requireListener().onProtocolError(problem);
    }

    private void respond(JsonNode id, JsonNode result) {
        ObjectNode response = envelope();
        response.set("id", id);
        response.set("result", result);
        send(response);
    }

    private void respondError(JsonNode id, int code, String message, JsonNode data) {
        ObjectNode response = envelope();
        response.set("id", id == null ? NullNode.getInstance() : id);
        ObjectNode error = response.putObject("error");
        error.put("code", code);
        error.put("message", message);
        if (data != null) {
            error.set("data", data);
        }
        send(response);
    }

    private static ObjectNode envelope() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("jsonrpc", VERSION);
        return node;
    }

    // -------------------------------------------------------------------------
    // Pending calls
    // -------------------------------------------------------------------------

    private void expire(long id, Duration timeout) {
        settle(id).ifPresent(call ->
            call.result.completeExceptionally(new CallTimeoutException(call.method, timeout)));
    }

    private Optional<PendingCall> settle(long id) {
        PendingCall call = pending.remove(id);
        if (call != null) {
            call.cancelTimer();
            call.unqueue(queued);
        }
        return Optional.ofNullable(call);
    }

    private static final class PendingCall {
        final String method;
        final CompletableFuture<JsonNode> result;
        Cancellable timer;
        Frame frame;

        PendingCall(String method, CompletableFuture<JsonNode> result) {
            this.method = method;
            this.result = result;
        }

        void cancelTimer() {
            if (timer != null) {
                timer.cancel();
                timer = null;
            }
        }

        // a settled call must not reach the peer on the next flush
        void unqueue(Queue<Frame> queued) {
            if (frame != null) {
                Frame own = frame;
                queued.removeIf(f -> f == own);
                frame = null;
            }
        }
    }
}
