package com.questrail.rpclink.internal.supervisor;

import com.questrail.rpclink.api.LinkState;
import com.questrail.rpclink.config.LinkSettings;
import com.questrail.rpclink.events.LinkEvent;
import com.questrail.rpclink.internal.exec.SerializedContext;
import com.questrail.rpclink.observability.RecordingLinkEventSink;
import com.questrail.rpclink.protocol.FakeProtocolEngine;
import com.questrail.rpclink.time.DeterministicScheduler;
import com.questrail.rpclink.time.ManualMonotonicClock;
import com.questrail.rpclink.transport.FakeTransport;
import com.questrail.rpclink.transport.FakeTransportFactory;
import com.questrail.rpclink.transport.Frame;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class ConnectionSupervisorTest {

    private ManualMonotonicClock clock;
    private DeterministicScheduler scheduler;
    private FakeProtocolEngine engine;
    private FakeTransportFactory factory;
    private RecordingLinkEventSink events;
    private LinkSettings settings;
    private ConnectionSupervisor supervisor;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        scheduler = new DeterministicScheduler(clock);
        engine = new FakeProtocolEngine();
        factory = new FakeTransportFactory();
        events = new RecordingLinkEventSink();
        settings = LinkSettings.builder()
            .withAddress(URI.create("ws://example.test/rpc"))
            .withTransportFactory(factory)
            .withReconnectBackoff(counter -> Duration.ofMillis((counter + 1) * 1111L))
            .build();
        supervisor = newSupervisor(settings);
    }

    private ConnectionSupervisor newSupervisor(LinkSettings s) {
        ConnectionSupervisor sup = new ConnectionSupervisor(
            s, engine, clock, scheduler, () -> Instant.EPOCH, new SerializedContext());
        sup.addEventSink(events);
        return sup;
    }

    private FakeTransport startAndOpen() {
        supervisor.start();
        FakeTransport transport = factory.last();
        transport.open();
        return transport;
    }

    // -------------------------------------------------------------------------
    // start / stop
    // -------------------------------------------------------------------------

    @Test
    void startCreatesTransportAndEmitsConnecting() {
        supervisor.start();

        assertEquals(1, factory.count());
        assertEquals(URI.create("ws://example.test/rpc"), factory.last().address());
        assertEquals(1, events.ofType(LinkEvent.Connecting.class).size());
        assertTrue(supervisor.isStarted());
        assertEquals(LinkState.CONNECTING, supervisor.state());
        assertTrue(engine.isPaused());
        assertFalse(supervisor.hasActiveConnection());
    }

    @Test
    void startTwiceIsRejected() {
        supervisor.start();
        assertThrows(IllegalStateException.class, supervisor::start);
        assertEquals(1, factory.count());
    }

    @Test
    void startWithoutAddressIsRejected() {
        ConnectionSupervisor sup = newSupervisor(new LinkSettings().setTransportFactory(factory));

        assertThrows(IllegalStateException.class, sup::start);
        assertFalse(sup.isStarted());
    }

    @Test
    void doubleStopEmitsSingleClosed() {
        FakeTransport transport = startAndOpen();

        supervisor.stop();
        supervisor.stop();
        transport.remoteClose(1000, "");

        List<LinkEvent.Closed> closed = events.ofType(LinkEvent.Closed.class);
        assertEquals(1, closed.size());
        assertEquals(1000, closed.get(0).code());
        assertEquals("Normal Closure", closed.get(0).reason());
        assertFalse(closed.get(0).reconnect());
        assertTrue(closed.get(0).reconnectDelay().isEmpty());
        assertFalse(closed.get(0).closedByRemote());
        assertEquals(List.of(1000), transport.closeCodes());
        assertFalse(supervisor.isStarted());
        assertEquals(LinkState.IDLE, supervisor.state());
    }

    @Test
    void startAfterFullStopConnectsAgain() {
        FakeTransport first = startAndOpen();
        supervisor.stop();
        first.remoteClose(1000, "");

        supervisor.start();

        assertTrue(supervisor.isStarted());
        assertEquals(2, factory.count());
        assertNotSame(first, factory.last());
        assertEquals(2, events.ofType(LinkEvent.Connecting.class).size());
        assertEquals(LinkState.CONNECTING, supervisor.state());

        factory.last().open();
        assertTrue(supervisor.hasActiveConnection());
    }

    @Test
    void noActiveConnectionAfterCloseUntilNextOpen() {
        FakeTransport first = startAndOpen();
        assertTrue(supervisor.hasActiveConnection());

        assertTrue(supervisor.closeConnection(1000, "bye"));
        assertFalse(supervisor.hasActiveConnection());
        first.remoteClose(1000, "bye");
        assertFalse(supervisor.hasActiveConnection());

        scheduler.advance(Duration.ofSeconds(5));
        assertEquals(2, factory.count());
        assertFalse(supervisor.hasActiveConnection());

        FakeTransport second = factory.last();
        second.open();
        assertTrue(supervisor.hasActiveConnection());

        second.remoteClose(1006, "");
        assertFalse(supervisor.hasActiveConnection());
    }

    @Test
    void stopWhileWaitingCancelsReconnect() {
        supervisor.start();
        factory.last().remoteClose(1006, "");
        assertEquals(LinkState.WAITING, supervisor.state());

        supervisor.stop();
        scheduler.advance(Duration.ofSeconds(10));

        assertEquals(1, factory.count());
        assertEquals(1, events.ofType(LinkEvent.Closed.class).size());
        assertEquals(LinkState.IDLE, supervisor.state());
    }

    @Test
    void invalidCloseCodesAreRejected() {
        supervisor.start();

        assertThrows(IllegalArgumentException.class, () -> supervisor.stop(1006, "abnormal"));
        assertThrows(IllegalArgumentException.class, () -> supervisor.stop(5000, "too high"));
        assertThrows(IllegalArgumentException.class, () -> supervisor.closeConnection(2999, "too low"));

        assertTrue(supervisor.isStarted());
        assertTrue(factory.last().closeCodes().isEmpty());
    }

    @Test
    void closeConnectionReportsWhetherSessionExisted() {
        assertFalse(supervisor.closeConnection(4000, "nothing"));

        FakeTransport transport = startAndOpen();
        assertTrue(supervisor.closeConnection(4000, "bye"));
        assertFalse(supervisor.closeConnection(4000, "again"));

        LinkEvent.Closed closed = events.last(LinkEvent.Closed.class);
        assertEquals(4000, closed.code());
        assertEquals("bye", closed.reason());
        assertFalse(closed.closedByRemote());
        assertTrue(closed.reconnect());
        assertEquals(List.of(4000), transport.closeCodes());
        assertTrue(supervisor.isStarted());
    }

    // -------------------------------------------------------------------------
    // open / frames
    // -------------------------------------------------------------------------

    @Test
    void openResumesEngineAndProbesAfterOneMillisecond() {
        startAndOpen();

        assertEquals(1, events.ofType(LinkEvent.Opened.class).size());
        assertFalse(engine.isPaused());
        assertTrue(supervisor.hasActiveConnection());
        assertEquals(LinkState.OPEN, supervisor.state());
        assertEquals(0, engine.outstandingProbes());

        scheduler.advance(Duration.ofMillis(1));

        assertEquals(1, engine.outstandingProbes());
        assertEquals(List.of(settings.probeTimeout()), engine.probeTimeouts());
    }

    @Test
    void framesQueuedWhileConnectingAreFlushedOnOpen() {
        supervisor.start();
        engine.send(Frame.text("early"));
        FakeTransport transport = factory.last();
        assertTrue(transport.sent().isEmpty());

        transport.open();
        engine.send(Frame.text("late"));

        assertEquals(List.of("early", "late"), transport.sentText());
    }

    @Test
    void inboundFramesReachEngineUnchanged() {
        FakeTransport transport = startAndOpen();
        Frame binary = Frame.binary(new byte[]{1, 2, 3});

        transport.receiveText("hello");
        transport.receive(binary);

        assertEquals(List.of(Frame.text("hello"), binary), engine.received());
    }

    @Test
    void outboundFrameWithoutOpenSessionIsRejected() {
        engine.resume();
        assertThrows(IllegalStateException.class, () -> engine.send(Frame.text("nowhere")));
    }

    @Test
    void transportErrorIsInformationalOnly() {
        supervisor.start();
        IOException cause = new IOException("connection reset");

        factory.last().fail(cause);

        assertSame(cause, events.last(LinkEvent.TransportFailed.class).cause());
        assertTrue(events.ofType(LinkEvent.Closed.class).isEmpty());
        assertEquals(LinkState.CONNECTING, supervisor.state());
    }

    // -------------------------------------------------------------------------
    // reconnect and backoff
    // -------------------------------------------------------------------------

    @Test
    void reconnectDelaysFollowBackoffCallback() {
        supervisor.start();

        factory.last().remoteClose(1006, "");
        LinkEvent.Closed first = events.last(LinkEvent.Closed.class);
        assertTrue(first.closedByRemote());
        assertEquals(Duration.ofMillis(1111), first.reconnectDelay().orElseThrow());
        assertEquals(1, supervisor.reconnectCounter());

        scheduler.advance(Duration.ofMillis(1110));
        assertEquals(1, factory.count());
        scheduler.advance(Duration.ofMillis(1));
        assertEquals(2, factory.count());

        factory.last().remoteClose(1006, "");
        assertEquals(Duration.ofMillis(2222), events.last(LinkEvent.Closed.class).reconnectDelay().orElseThrow());
        assertEquals(2, supervisor.reconnectCounter());

        scheduler.advance(Duration.ofMillis(2222));
        assertEquals(3, factory.count());

        factory.last().remoteClose(1006, "");
        assertEquals(Duration.ofMillis(3333), events.last(LinkEvent.Closed.class).reconnectDelay().orElseThrow());
        assertEquals(3, supervisor.reconnectCounter());
    }

    @Test
    void reconnectCounterIsClampedToMaximum() {
        List<Integer> counters = new ArrayList<>();
        settings.setReconnectCounterMax(2);
        settings.setReconnectBackoff(counter -> {
            counters.add(counter);
            return Duration.ofMillis(10);
        });
        supervisor.start();

        for (int i = 0; i < 4; i++) {
            factory.last().remoteClose(1006, "");
            scheduler.advance(Duration.ofMillis(10));
        }

        assertEquals(List.of(0, 1, 2, 2), counters);
        assertEquals(2, supervisor.reconnectCounter());
        assertEquals(5, factory.count());
    }

    @Test
    void successfulProbesDecayCounterToZero() {
        supervisor.start();
        for (int i = 1; i <= 5; i++) {
            factory.last().remoteClose(1006, "");
            scheduler.advance(Duration.ofMillis(i * 1111L));
        }
        assertEquals(5, supervisor.reconnectCounter());

        factory.last().open();
        scheduler.advance(Duration.ofMillis(1));

        for (int expected = 4; expected >= 0; expected--) {
            engine.succeedProbe(Duration.ofMillis(3));
            assertEquals(expected, supervisor.reconnectCounter());
            scheduler.advance(settings.probeInterval());
        }
        engine.succeedProbe(Duration.ofMillis(3));

        assertEquals(0, supervisor.reconnectCounter());
        assertEquals(Duration.ofMillis(3), events.last(LinkEvent.ProbeSucceeded.class).delay());
        assertEquals(6, events.ofType(LinkEvent.ProbeSucceeded.class).size());
    }

    @Test
    void reconnectDisabledStopsOnClose() {
        settings.setReconnect(false);
        supervisor.start();

        factory.last().remoteClose(1001, "going away");

        LinkEvent.Closed closed = events.last(LinkEvent.Closed.class);
        assertFalse(closed.reconnect());
        assertTrue(closed.reconnectDelay().isEmpty());
        assertFalse(supervisor.isStarted());
        scheduler.advance(Duration.ofSeconds(30));
        assertEquals(1, factory.count());
    }

    @Test
    void factoryFailureCountsAsFailedAttempt() {
        factory.failNext(1);

        supervisor.start();

        assertEquals(1, events.ofType(LinkEvent.UnhandledError.class).size());
        assertTrue(events.ofType(LinkEvent.Connecting.class).isEmpty());
        assertTrue(events.ofType(LinkEvent.Closed.class).isEmpty());
        assertEquals(1, supervisor.reconnectCounter());
        assertEquals(LinkState.WAITING, supervisor.state());

        scheduler.advance(Duration.ofMillis(1111));

        assertEquals(1, factory.count());
        assertEquals(1, events.ofType(LinkEvent.Connecting.class).size());
    }

    @Test
    void factoryFailureWithoutReconnectStops() {
        settings.setReconnect(false);
        factory.failNext(1);

        supervisor.start();

        assertEquals(1, events.ofType(LinkEvent.UnhandledError.class).size());
        assertFalse(supervisor.isStarted());
        assertEquals(LinkState.IDLE, supervisor.state());
    }

    @Test
    void failingBackoffFallsBackToDefaultPolicy() {
        settings.setReconnectBackoff(counter -> {
            throw new IllegalArgumentException("broken backoff");
        });
        supervisor.start();

        factory.last().remoteClose(1006, "");

        assertEquals("broken backoff", events.last(LinkEvent.UnhandledError.class).cause().getMessage());
        Duration delay = events.last(LinkEvent.Closed.class).reconnectDelay().orElseThrow();
        assertTrue(delay.toMillis() >= 50 && delay.toMillis() <= 100, "delay was " + delay);
    }

    // -------------------------------------------------------------------------
    // timeouts and liveness
    // -------------------------------------------------------------------------

    @Test
    void connectTimeoutClosesWithTimeoutCode() {
        settings.setConnectTimeout(Duration.ofMillis(500));
        supervisor.start();
        FakeTransport transport = factory.last();

        scheduler.advance(Duration.ofMillis(499));
        assertTrue(transport.closeCodes().isEmpty());

        scheduler.advance(Duration.ofMillis(1));

        assertEquals(List.of(4100), transport.closeCodes());
        assertEquals(List.of("Timeout: Opening connection took longer than 500ms"), transport.closeReasons());
        LinkEvent.Closed closed = events.last(LinkEvent.Closed.class);
        assertEquals(4100, closed.code());
        assertTrue(closed.reconnect());
    }

    @Test
    void openCancelsConnectTimeout() {
        settings.setConnectTimeout(Duration.ofMillis(500));
        FakeTransport transport = startAndOpen();

        scheduler.advance(Duration.ofMillis(600));

        assertTrue(transport.closeCodes().isEmpty());
        assertTrue(supervisor.hasActiveConnection());
    }

    @Test
    void consecutiveProbeFailuresCloseSession() {
        settings.setConsecutiveProbeFailClose(3);
        FakeTransport transport = startAndOpen();
        scheduler.advance(Duration.ofMillis(1));

        engine.failProbe(new TimeoutException("probe 1"));
        scheduler.advance(settings.probeInterval());
        engine.failProbe(new TimeoutException("probe 2"));
        scheduler.advance(settings.probeInterval());
        assertTrue(events.ofType(LinkEvent.Closed.class).isEmpty());

        engine.failProbe(new TimeoutException("probe 3"));

        List<LinkEvent.ProbeFailed> failures = events.ofType(LinkEvent.ProbeFailed.class);
        assertEquals(3, failures.size());
        assertEquals(3, failures.get(2).consecutiveFailures());
        assertEquals("probe 3", failures.get(2).cause().getMessage());

        assertEquals(List.of(4100), transport.closeCodes());
        assertEquals(List.of("Timeout: No responses received to probe calls"), transport.closeReasons());
        LinkEvent.Closed closed = events.last(LinkEvent.Closed.class);
        assertTrue(closed.reconnect());
        assertTrue(engine.isPaused());

        transport.remoteClose(4100, "");
        assertEquals(1, events.ofType(LinkEvent.Closed.class).size());

        scheduler.advance(Duration.ofMillis(1111));
        assertEquals(2, factory.count());
    }

    @Test
    void probingStopsWhenSessionEnds() {
        FakeTransport transport = startAndOpen();
        transport.remoteClose(1000, "");

        scheduler.advance(Duration.ofMillis(1));

        assertEquals(0, engine.outstandingProbes());
    }

    // -------------------------------------------------------------------------
    // engine errors
    // -------------------------------------------------------------------------

    @Test
    void internalEngineErrorClosesWithInternalErrorCode() {
        FakeTransport transport = startAndOpen();
        RuntimeException boom = new RuntimeException("boom");

        engine.internalError(boom);

        assertEquals(List.of(4101), transport.closeCodes());
        assertEquals(List.of("Internal protocol engine error"), transport.closeReasons());
        assertTrue(events.last(LinkEvent.Closed.class).reconnect());
        assertSame(boom, events.last(LinkEvent.UnhandledError.class).cause());
    }

    @Test
    void protocolErrorKeepsSession() {
        startAndOpen();
        IllegalArgumentException garbage = new IllegalArgumentException("garbage");

        engine.protocolError(garbage);

        assertSame(garbage, events.last(LinkEvent.ProtocolError.class).cause());
        assertTrue(events.ofType(LinkEvent.Closed.class).isEmpty());
        assertTrue(supervisor.hasActiveConnection());
    }

    // -------------------------------------------------------------------------
    // session identity
    // -------------------------------------------------------------------------

    @Test
    void callbacksFromSupersededSessionAreIgnored() {
        supervisor.start();
        FakeTransport stale = factory.last();
        supervisor.closeConnection(4000, "replace");
        scheduler.advance(Duration.ofMillis(1111));
        assertEquals(2, factory.count());

        stale.open();
        stale.receiveText("late");
        stale.remoteClose(1006, "");

        assertTrue(events.ofType(LinkEvent.Opened.class).isEmpty());
        assertTrue(engine.received().isEmpty());
        assertEquals(1, events.ofType(LinkEvent.Closed.class).size());
        assertEquals(LinkState.CONNECTING, supervisor.state());
    }

    @Test
    void exactlyOneClosedPerSession() {
        FakeTransport transport = startAndOpen();

        supervisor.closeConnection(4000, "local");
        transport.remoteClose(4000, "echo");
        supervisor.closeConnection(4000, "again");

        List<LinkEvent.Closed> closed = events.ofType(LinkEvent.Closed.class);
        assertEquals(1, closed.size());
        assertEquals("local", closed.get(0).reason());
    }

    // -------------------------------------------------------------------------
    // listeners
    // -------------------------------------------------------------------------

    @Test
    void listenerExceptionsAreReportedAsUnhandledError() {
        RuntimeException failure = new RuntimeException("listener failed");
        supervisor.addEventSink(event -> {
            throw failure;
        });

        supervisor.start();

        List<LinkEvent.UnhandledError> errors = events.ofType(LinkEvent.UnhandledError.class);
        assertEquals(1, errors.size());
        assertSame(failure, errors.get(0).cause());
        assertEquals(1, factory.count());
    }

    @Test
    void listenerMayStopFromClosedEvent() {
        supervisor.addEventSink(event -> {
            if (event instanceof LinkEvent.Closed) {
                supervisor.stop();
            }
        });
        supervisor.start();

        factory.last().remoteClose(1006, "");
        scheduler.advance(Duration.ofSeconds(5));

        assertFalse(supervisor.isStarted());
        assertEquals(1, factory.count());
        assertEquals(1, events.ofType(LinkEvent.Closed.class).size());
    }
}
