package com.questrail.rpclink.observability;

import com.questrail.rpclink.events.LinkEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of {@link LinkEventSink} that emits logs via SLF4J.
 */
public final class Slf4jLinkEventSink implements LinkEventSink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jLinkEventSink.class);

    @Override
    public void onEvent(LinkEvent event) {
        if (event instanceof LinkEvent.Connecting connecting) {
            log.info("Link session {}: connecting", connecting.sessionId());
        }
        else if (event instanceof LinkEvent.Opened opened) {
            log.info("Link session {}: open", opened.sessionId());
        }
        else if (event instanceof LinkEvent.TransportFailed failed) {
            log.warn("Link session {}: transport error: {}", failed.sessionId(), describe(failed.cause()));
        }
        else if (event instanceof LinkEvent.Closed closed) {
            if (closed.reconnect()) {
                log.info("Link session {}: closed ({} {}{}), reconnecting in {}ms",
                    closed.sessionId(),
                    closed.code(),
                    closed.reason(),
                    closed.closedByRemote() ? ", by remote" : "",
                    closed.reconnectDelay().orElseThrow().toMillis());
            }
            else {
                log.info("Link session {}: closed ({} {}{}), not reconnecting",
                    closed.sessionId(),
                    closed.code(),
                    closed.reason(),
                    closed.closedByRemote() ? ", by remote" : "");
            }
        }
        else if (event instanceof LinkEvent.ProbeSucceeded succeeded) {
            log.debug("Probe succeeded in {}ms", succeeded.delay().toMillis());
        }
        else if (event instanceof LinkEvent.ProbeFailed failed) {
            log.debug("Probe failed ({} consecutive): {}", failed.consecutiveFailures(), describe(failed.cause()));
        }
        else if (event instanceof LinkEvent.ProtocolError protocolError) {
            log.warn("Protocol error: {}", describe(protocolError.cause()));
        }
        else if (event instanceof LinkEvent.UnhandledError error) {
            log.error("Link error", error.cause());
        }
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
