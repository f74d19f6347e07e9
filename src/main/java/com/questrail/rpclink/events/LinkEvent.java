package com.questrail.rpclink.events;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * LinkEvent
 * -----------------------------------------------------------------------------
 * Closed set of lifecycle and health notifications emitted by a link.
 *
 * <p>Events are immutable and carry a wall-clock timestamp for observers only.
 * Consumers are expected to switch over the concrete types; the set is sealed
 * so the compiler can check that a handler covers every case.</p>
 *
 * <h2>Ordering</h2>
 * For one session the order is always
 * {@code Connecting → [Opened] → ... → Closed}, with {@link TransportFailed},
 * probe events and errors interleaved. Exactly one {@link Closed} is emitted
 * per session, whatever combination of remote close, local close, timeout or
 * probe exhaustion ended it.
 */
public sealed interface LinkEvent
        permits LinkEvent.Connecting,
                LinkEvent.Opened,
                LinkEvent.TransportFailed,
                LinkEvent.Closed,
                LinkEvent.ProbeSucceeded,
                LinkEvent.ProbeFailed,
                LinkEvent.UnhandledError,
                LinkEvent.ProtocolError
{
    Instant timestamp();

    /** A transport has been requested and is connecting. */
    record Connecting(Instant timestamp, long sessionId) implements LinkEvent {
        public Connecting {
            Objects.requireNonNull(timestamp, "timestamp");
        }
    }

    /** The transport is open; queued outbound calls are being flushed. */
    record Opened(Instant timestamp, long sessionId) implements LinkEvent {
        public Opened {
            Objects.requireNonNull(timestamp, "timestamp");
        }
    }

    /**
     * The transport reported a failure. Informational: the session ends only
     * when the matching {@link Closed} is emitted.
     */
    record TransportFailed(Instant timestamp, long sessionId, Throwable cause) implements LinkEvent {
        public TransportFailed {
            Objects.requireNonNull(timestamp, "timestamp");
        }
    }

    /**
     * A session ended.
     *
     * @param code           close code sent or received
     * @param reason         close reason, possibly empty
     * @param closedByRemote {@code true} if the close originated from the peer or the network
     * @param reconnect      {@code true} if a new connect attempt has been scheduled
     * @param reconnectDelay the scheduled delay; present if and only if {@code reconnect}
     */
    record Closed(Instant timestamp,
                  long sessionId,
                  int code,
                  String reason,
                  boolean closedByRemote,
                  boolean reconnect,
                  Optional<Duration> reconnectDelay) implements LinkEvent {
        public Closed {
            Objects.requireNonNull(timestamp, "timestamp");
            Objects.requireNonNull(reconnectDelay, "reconnectDelay");
            reason = reason == null ? "" : reason;
            if (reconnect != reconnectDelay.isPresent()) {
                throw new IllegalArgumentException("reconnectDelay must be present exactly when reconnect is true");
            }
        }
    }

    /** The most recent liveness probe succeeded. */
    record ProbeSucceeded(Instant timestamp, Duration delay) implements LinkEvent {
        public ProbeSucceeded {
            Objects.requireNonNull(timestamp, "timestamp");
            Objects.requireNonNull(delay, "delay");
        }
    }

    /** The most recent liveness probe timed out or was answered with an error. */
    record ProbeFailed(Instant timestamp, int consecutiveFailures, Throwable cause) implements LinkEvent {
        public ProbeFailed {
            Objects.requireNonNull(timestamp, "timestamp");
        }
    }

    /**
     * Something failed that no caller could be told about directly: a listener
     * threw, the transport factory or backoff callback threw, or the protocol
     * engine failed internally.
     */
    record UnhandledError(Instant timestamp, Throwable cause) implements LinkEvent {
        public UnhandledError {
            Objects.requireNonNull(timestamp, "timestamp");
            Objects.requireNonNull(cause, "cause");
        }
    }

    /** The peer sent something the protocol engine could not parse. */
    record ProtocolError(Instant timestamp, Throwable cause) implements LinkEvent {
        public ProtocolError {
            Objects.requireNonNull(timestamp, "timestamp");
            Objects.requireNonNull(cause, "cause");
        }
    }
}
