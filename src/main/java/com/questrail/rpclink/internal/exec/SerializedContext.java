package com.questrail.rpclink.internal.exec;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * SerializedContext
 * =============================================================================
 * The single logical execution context of a link.
 *
 * <h2>Threading model</h2>
 * Events reach the link from several threads: the Netty event loop delivers
 * transport callbacks, the scheduler thread fires timers, and application
 * threads call {@code start()}, {@code stop()} or {@code call()}. Every one of
 * those entry points funnels through this context, so supervisor, liveness and
 * engine state are only ever mutated by one thread at a time.
 *
 * <p>Execution is synchronous on the calling thread and reentrant: a listener
 * reacting to a {@code Closed} event may call {@code stop()} without
 * deadlocking.</p>
 *
 * <p>Tasks must not block. Everything that waits is expressed as a scheduled
 * callback that re-enters the context.</p>
 */
public final class SerializedContext implements Executor {

    private final Object lock = new Object();

    @Override
    public void execute(Runnable task) {
        Objects.requireNonNull(task, "task");
        synchronized (lock) {
            task.run();
        }
    }

    /**
     * Runs {@code action} inside the context and returns its result.
     */
    public <T> T call(Supplier<T> action) {
        Objects.requireNonNull(action, "action");
        synchronized (lock) {
            return action.get();
        }
    }

    /**
     * Returns {@code true} if the current thread is executing inside this context.
     */
    public boolean inContext() {
        return Thread.holdsLock(lock);
    }
}
