package com.questrail.rpclink.config;

import com.questrail.rpclink.api.CloseCodes;
import com.questrail.rpclink.transport.TransportFactory;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * LinkSettings
 * -----------------------------------------------------------------------------
 * Operational configuration of a supervised link.
 *
 * <p>Settings may be changed at any time, from any thread. A change applies to
 * the next operation that reads it: a new connect timeout affects the next
 * connect attempt, not the one already in progress, and a new probe interval
 * takes effect after the currently pending probe.</p>
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>address</b>: where the transport factory connects to. Required before start.</li>
 *   <li><b>transportFactory</b>: creates one transport per connect attempt. Required before start.</li>
 *   <li><b>reconnect</b>: if {@code true} (default), any session end is followed by a new
 *       attempt after a backoff delay.</li>
 *   <li><b>reconnectBackoff</b>: maps the reconnect counter to a delay.</li>
 *   <li><b>reconnectCounterMax</b>: upper bound of the reconnect counter (default 8).</li>
 *   <li><b>connectTimeout</b>: how long a transport may stay connecting (default 10s).</li>
 *   <li><b>consecutiveProbeFailClose</b>: number of consecutive failed probes after which the
 *       session is closed (default 4).</li>
 *   <li><b>probeInterval</b>: pause between a settled probe and the next (default 2s).</li>
 *   <li><b>probeTimeout</b>: how long a probe may wait for its answer; must be positive (default 1s).</li>
 *   <li><b>timeoutCloseCode</b> / <b>internalErrorCloseCode</b>: codes sent when the link
 *       itself closes a session (defaults 4100 / 4101).</li>
 * </ul>
 */
public final class LinkSettings
{
    private volatile URI address;
    private volatile TransportFactory transportFactory;
    private volatile boolean reconnect = true;
    private volatile ReconnectBackoff reconnectBackoff = ReconnectBackoff.exponentialWithJitter();
    private volatile int reconnectCounterMax = 8;
    private volatile Duration connectTimeout = Duration.ofSeconds(10);
    private volatile int consecutiveProbeFailClose = 4;
    private volatile Duration probeInterval = Duration.ofSeconds(2);
    private volatile Duration probeTimeout = Duration.ofSeconds(1);
    private volatile int timeoutCloseCode = CloseCodes.DEFAULT_TIMEOUT;
    private volatile int internalErrorCloseCode = CloseCodes.DEFAULT_INTERNAL_ERROR;

    /**
     * Creates settings holding the defaults. Address and transport factory are unset.
     */
    public LinkSettings() {}

    public static Builder builder() {
        return new Builder();
    }

    public URI address() {
        return address;
    }

    public LinkSettings setAddress(URI address) {
        this.address = Objects.requireNonNull(address, "address");
        return this;
    }

    public TransportFactory transportFactory() {
        return transportFactory;
    }

    public LinkSettings setTransportFactory(TransportFactory transportFactory) {
        this.transportFactory = Objects.requireNonNull(transportFactory, "transportFactory");
        return this;
    }

    public boolean reconnect() {
        return reconnect;
    }

    public LinkSettings setReconnect(boolean reconnect) {
        this.reconnect = reconnect;
        return this;
    }

    public ReconnectBackoff reconnectBackoff() {
        return reconnectBackoff;
    }

    public LinkSettings setReconnectBackoff(ReconnectBackoff reconnectBackoff) {
        this.reconnectBackoff = Objects.requireNonNull(reconnectBackoff, "reconnectBackoff");
        return this;
    }

    public int reconnectCounterMax() {
        return reconnectCounterMax;
    }

    public LinkSettings setReconnectCounterMax(int reconnectCounterMax) {
        if (reconnectCounterMax < 0) {
            throw new IllegalArgumentException("reconnectCounterMax must be non-negative");
        }
        this.reconnectCounterMax = reconnectCounterMax;
        return this;
    }

    public Duration connectTimeout() {
        return connectTimeout;
    }

    public LinkSettings setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = requireNonNegative(connectTimeout, "connectTimeout");
        return this;
    }

    public int consecutiveProbeFailClose() {
        return consecutiveProbeFailClose;
    }

    public LinkSettings setConsecutiveProbeFailClose(int consecutiveProbeFailClose) {
        if (consecutiveProbeFailClose < 1) {
            throw new IllegalArgumentException("consecutiveProbeFailClose must be at least 1");
        }
        this.consecutiveProbeFailClose = consecutiveProbeFailClose;
        return this;
    }

    public Duration probeInterval() {
        return probeInterval;
    }

    public LinkSettings setProbeInterval(Duration probeInterval) {
        this.probeInterval = requireNonNegative(probeInterval, "probeInterval");
        return this;
    }

    public Duration probeTimeout() {
        return probeTimeout;
    }

    public LinkSettings setProbeTimeout(Duration probeTimeout) {
        this.probeTimeout = requirePositive(probeTimeout, "probeTimeout");
        return this;
    }

    public int timeoutCloseCode() {
        return timeoutCloseCode;
    }

    public LinkSettings setTimeoutCloseCode(int timeoutCloseCode) {
        this.timeoutCloseCode = CloseCodes.requireValidOutgoing(timeoutCloseCode, "timeoutCloseCode");
        return this;
    }

    public int internalErrorCloseCode() {
        return internalErrorCloseCode;
    }

    public LinkSettings setInternalErrorCloseCode(int internalErrorCloseCode) {
        this.internalErrorCloseCode = CloseCodes.requireValidOutgoing(internalErrorCloseCode, "internalErrorCloseCode");
        return this;
    }

    private static Duration requireNonNegative(Duration value, String name) {
        Objects.requireNonNull(value, name);
        if (value.isNegative()) {
            throw new IllegalArgumentException(name + " must be non-negative");
        }
        return value;
    }

    private static Duration requirePositive(Duration value, String name) {
        Objects.requireNonNull(value, name);
        if (value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return value;
    }

    @Override
    public String toString() {
        return "LinkSettings{address=" + address
                + ", reconnect=" + reconnect
                + ", reconnectCounterMax=" + reconnectCounterMax
                + ", connectTimeout=" + connectTimeout
                + ", consecutiveProbeFailClose=" + consecutiveProbeFailClose
                + ", probeInterval=" + probeInterval
                + ", probeTimeout=" + probeTimeout
                + ", timeoutCloseCode=" + timeoutCloseCode
                + ", internalErrorCloseCode=" + internalErrorCloseCode
                + '}';
    }

    /**
     * Fluent construction of {@link LinkSettings}. Each {@code with} method
     * validates exactly as the matching setter does.
     */
    public static final class Builder {
        private final LinkSettings settings = new LinkSettings();

        public Builder withAddress(URI address) {
            settings.setAddress(address);
            return this;
        }

        public Builder withTransportFactory(TransportFactory factory) {
            settings.setTransportFactory(factory);
            return this;
        }

        public Builder withReconnect(boolean reconnect) {
            settings.setReconnect(reconnect);
            return this;
        }

        public Builder withReconnectBackoff(ReconnectBackoff backoff) {
            settings.setReconnectBackoff(backoff);
            return this;
        }

        public Builder withReconnectCounterMax(int max) {
            settings.setReconnectCounterMax(max);
            return this;
        }

        public Builder withConnectTimeout(Duration timeout) {
            settings.setConnectTimeout(timeout);
            return this;
        }

        public Builder withConsecutiveProbeFailClose(int count) {
            settings.setConsecutiveProbeFailClose(count);
            return this;
        }

        public Builder withProbeInterval(Duration interval) {
            settings.setProbeInterval(interval);
            return this;
        }

        public Builder withProbeTimeout(Duration timeout) {
            settings.setProbeTimeout(timeout);
            return this;
        }

        public Builder withTimeoutCloseCode(int code) {
            settings.setTimeoutCloseCode(code);
            return this;
        }

        public Builder withInternalErrorCloseCode(int code) {
            settings.setInternalErrorCloseCode(code);
            return this;
        }

        public LinkSettings build() {
            return settings;
        }
    }
}
