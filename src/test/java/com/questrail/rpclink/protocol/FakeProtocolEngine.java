package com.questrail.rpclink.protocol;

import com.questrail.rpclink.transport.Frame;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Protocol engine double. Probes stay outstanding until the test settles them.
 */
public final class FakeProtocolEngine implements ProtocolEngine {

    private final List<Frame> received = new ArrayList<>();
    private final List<Frame> queued = new ArrayList<>();
    private final Deque<CompletableFuture<Duration>> probes = new ArrayDeque<>();
    private final List<Duration> probeTimeouts = new ArrayList<>();

    private ProtocolEngineListener listener;
    private boolean paused;
    private RuntimeException probeFailure;

    @Override
    public void bind(ProtocolEngineListener listener) {
        this.listener = listener;
    }

    @Override
    public void pause() {
        paused = true;
    }

    @Override
    public void resume() {
        paused = false;
        List<Frame> flush = new ArrayList<>(queued);
        queued.clear();
        for (Frame frame : flush) {
            listener.onOutboundFrame(frame);
        }
    }

    @Override
    public boolean isPaused() {
        return paused;
    }

    @Override
    public void receive(Frame frame) {
        received.add(frame);
    }

    @Override
    public CompletableFuture<Duration> probe(Duration timeout) {
        if (probeFailure != null) {
            throw probeFailure;
        }
        CompletableFuture<Duration> probe = new CompletableFuture<>();
        probes.addLast(probe);
        probeTimeouts.add(timeout);
        return probe;
    }

    // -- driven by the test --------------------------------------------------

    public void send(Frame frame) {
        if (paused) {
            queued.add(frame);
        }
        else {
            listener.onOutboundFrame(frame);
        }
    }

    public void protocolError(Throwable cause) {
        listener.onProtocolError(cause);
    }

    public void internalError(Throwable cause) {
        listener.onInternalError(cause);
    }

    /** Makes every following {@link #probe(Duration)} call throw instead of returning. */
    public void throwOnProbe(RuntimeException failure) {
        probeFailure = failure;
    }

    public void succeedProbe(Duration delay) {
        nextProbe().complete(delay);
    }

    public void failProbe(Throwable cause) {
        nextProbe().completeExceptionally(cause);
    }

    public int outstandingProbes() {
        return probes.size();
    }

    public List<Duration> probeTimeouts() {
        return probeTimeouts;
    }

    public List<Frame> received() {
        return received;
    }

    private CompletableFuture<Duration> nextProbe() {
        CompletableFuture<Duration> probe = probes.pollFirst();
        if (probe == null) {
            throw new AssertionError("No probe outstanding");
        }
        return probe;
    }
}
