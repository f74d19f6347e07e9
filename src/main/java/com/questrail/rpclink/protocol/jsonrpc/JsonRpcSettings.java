package com.questrail.rpclink.protocol.jsonrpc;

import java.time.Duration;
import java.util.Objects;

/**
 * Behaviour of the {@link JsonRpcEngine}.
 *
 * @param defaultTimeout  timeout of calls made without an explicit one; {@link Duration#ZERO} disables it
 * @param pingMethod      method name used for liveness probes, both sent and answered
 * @param respondToPings  whether inbound calls to {@code pingMethod} are answered by the engine itself
 */
public record JsonRpcSettings(
    Duration defaultTimeout,
    String pingMethod,
    boolean respondToPings
) {
    public static final String DEFAULT_PING_METHOD = "rpclink.ping";

    public JsonRpcSettings {
        Objects.requireNonNull(defaultTimeout, "defaultTimeout");
        Objects.requireNonNull(pingMethod, "pingMethod");
        if (defaultTimeout.isNegative()) {
            throw new IllegalArgumentException("defaultTimeout must be >= 0");
        }
        if (pingMethod.isBlank()) {
            throw new IllegalArgumentException("pingMethod must not be blank");
        }
    }

    public static JsonRpcSettings defaults() {
        return new JsonRpcSettings(Duration.ZERO, DEFAULT_PING_METHOD, true);
    }

    public static Builder builder() {
        return new Builder();
    }

    public JsonRpcSettings withDefaultTimeout(Duration timeout) {
        return new JsonRpcSettings(timeout, pingMethod, respondToPings);
    }

    public static final class Builder {
        private Duration defaultTimeout = Duration.ZERO;
        private String pingMethod = DEFAULT_PING_METHOD;
        private boolean respondToPings = true;

        public Builder defaultTimeout(Duration timeout) {
            this.defaultTimeout = timeout;
            return this;
        }

        public Builder pingMethod(String method) {
            this.pingMethod = method;
            return this;
        }

        public Builder respondToPings(boolean respond) {
            this.respondToPings = respond;
            return this;
        }

        public JsonRpcSettings build() {
            return new JsonRpcSettings(defaultTimeout, pingMethod, respondToPings);
        }
    }
}
