package com.questrail.rpclink.internal.time;

import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * ScheduledExecutorScheduler
 * =============================================================================
 * Production {@link MonotonicScheduler} backed by a
 * {@link ScheduledExecutorService}.
 *
 * <p>Deadlines are converted into relative delays using the supplied clock at
 * scheduling time; the same clock must be used by callers computing deadlines.
 * A deadline in the past runs with zero delay.</p>
 *
 * <p>This class does not own the executor. {@code RpcLinkClient} shuts down
 * the executor it created when it is closed.</p>
 *
 * <p>Once the executor has been shut down, scheduling returns an
 * already-cancelled handle instead of throwing, so a late reconnect decision
 * racing with client shutdown is simply dropped.</p>
 */
public final class ScheduledExecutorScheduler implements MonotonicScheduler {

    private static final Cancellable REJECTED = () -> false;

    private final ScheduledExecutorService executor;
    private final MonotonicClock clock;

    public ScheduledExecutorScheduler(ScheduledExecutorService executor, MonotonicClock clock) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Objects.requireNonNull(task, "task");

        long delayNanos = Math.max(0, deadlineNanos - clock.nowNanos());

        final ScheduledFuture<?> future;
        try {
            future = executor.schedule(task, delayNanos, TimeUnit.NANOSECONDS);
        } catch (RejectedExecutionException e) {
            if (executor.isShutdown()) {
                return REJECTED;
            }
            throw e;
        }
        return () -> future.cancel(false);
    }
}
