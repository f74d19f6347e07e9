package com.questrail.rpclink.internal.liveness;

import com.questrail.rpclink.config.LinkSettings;
import com.questrail.rpclink.internal.time.Cancellable;
import com.questrail.rpclink.internal.time.MonotonicClock;
import com.questrail.rpclink.internal.time.MonotonicScheduler;
import com.questrail.rpclink.protocol.ProtocolEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * LivenessMonitor
 * =============================================================================
 * Periodically asks the protocol engine for a probe round-trip and judges the
 * peer's responsiveness from the outcome.
 *
 * <h2>Cadence</h2>
 * <p>Probes never overlap. The next probe is scheduled {@code probeInterval}
 * after the previous one settled, so a slow peer stretches the cadence
 * instead of accumulating outstanding probes.</p>
 *
 * <h2>Failure threshold</h2>
 * <p>Each failed probe increments a consecutive-failure counter; a success
 * resets it. Once the counter reaches {@code consecutiveProbeFailClose}, the
 * listener is asked to close the session. The counter is not reset at that
 * point: the session is about to end and the next session restarts the
 * monitor from zero.</p>
 *
 * <h2>Staleness</h2>
 * <p>Every {@link #start(Duration)} and {@link #stop()} begins a new
 * generation. Timer firings and probe outcomes from an older generation are
 * discarded, so a probe answered after its session closed cannot affect the
 * next session.</p>
 *
 * <h2>Threading</h2>
 * <p>Not thread-safe. All methods must be called from the link's execution
 * context, which is also where timer and probe callbacks are re-entered.</p>
 */
public final class LivenessMonitor {

    private static final Logger log = LoggerFactory.getLogger(LivenessMonitor.class);

    /**
     * Receives probe outcomes. Called from the execution context.
     */
    public interface Listener {
        void onProbeSucceeded(Duration delay);

        void onProbeFailed(int consecutiveFailures, Throwable cause);

        void onFailureThresholdReached(int consecutiveFailures);
    }

    private final ProtocolEngine engine;
    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final Executor context;
    private final LinkSettings settings;
    private final Listener listener;

    private long generation;
    private boolean running;
    private int consecutiveFailures;
    private Cancellable pendingProbe;

    public LivenessMonitor(ProtocolEngine engine,
                           MonotonicClock clock,
                           MonotonicScheduler scheduler,
                           Executor context,
                           LinkSettings settings,
                           Listener listener) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.context = Objects.requireNonNull(context, "context");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    /**
     * Starts probing. The first probe fires after {@code firstDelay}; later
     * probes use the configured interval. Restarting resets the failure count.
     */
    public void start(Duration firstDelay) {
        Objects.requireNonNull(firstDelay, "firstDelay");
        stop();
        running = true;
        reset();
        scheduleProbe(firstDelay);
    }

    /**
     * Cancels the pending probe. Outcomes of a probe already in flight are ignored.
     */
    public void stop() {
        generation++;
        running = false;
        if (pendingProbe != null) {
            pendingProbe.cancel();
            pendingProbe = null;
        }
    }

    /**
     * Zeroes the consecutive-failure count without touching the probe schedule.
     */
    public void reset() {
        consecutiveFailures = 0;
    }

    public boolean isRunning() {
        return running;
    }

    public int consecutiveFailures() {
        return consecutiveFailures;
    }

    private void scheduleProbe(Duration delay) {
        long scheduledGeneration = generation;
        pendingProbe = scheduler.scheduleAfter(delay, clock,
                () -> context.execute(() -> probe(scheduledGeneration)));
    }

    private void probe(long probeGeneration) {
        if (probeGeneration != generation) {
            return;
        }
        pendingProbe = null;

        CompletableFuture<Duration> outcome;
        try {
            outcome = engine.probe(settings.probeTimeout());
        } catch (RuntimeException e) {
            outcome = CompletableFuture.failedFuture(e);
        }
        outcome.whenComplete((delay, error) -> context.execute(() -> settle(probeGeneration, delay, error)));
    }

    private void settle(long probeGeneration, Duration delay, Throwable error) {
        if (probeGeneration != generation) {
            log.trace("Discarding probe outcome from generation {}", probeGeneration);
            return;
        }

        if (error == null) {
            consecutiveFailures = 0;
            listener.onProbeSucceeded(delay);
        }
        else {
            consecutiveFailures++;
            int failures = consecutiveFailures;
            listener.onProbeFailed(failures, unwrap(error));

            if (probeGeneration == generation && failures >= settings.consecutiveProbeFailClose()) {
                listener.onFailureThresholdReached(failures);
            }
        }

        // the listener may have stopped us
        if (probeGeneration == generation && running) {
            scheduleProbe(settings.probeInterval());
        }
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }
}
