package com.questrail.rpclink.internal.exec;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SerializedContextTest {

    private final SerializedContext context = new SerializedContext();

    @Test
    void runsOnCallingThread() {
        Thread caller = Thread.currentThread();
        List<Thread> seen = new ArrayList<>();

        context.execute(() -> seen.add(Thread.currentThread()));

        assertEquals(List.of(caller), seen);
    }

    @Test
    void isReentrant() {
        List<String> order = new ArrayList<>();

        context.execute(() -> {
            order.add("outer");
            context.execute(() -> order.add("inner"));
            order.add(context.call(() -> "call"));
        });

        assertEquals(List.of("outer", "inner", "call"), order);
    }

    @Test
    void reportsWhetherInsideContext() {
        assertFalse(context.inContext());
        assertTrue(context.call(context::inContext));
    }

    @Test
    void exceptionsPropagateToCaller() {
        IllegalStateException failure = new IllegalStateException("nope");

        IllegalStateException thrown = assertThrows(IllegalStateException.class,
            () -> context.execute(() -> { throw failure; }));

        assertSame(failure, thrown);
        assertFalse(context.inContext());
    }

    @Test
    void tasksFromManyThreadsNeverOverlap() throws InterruptedException {
        int threads = 8;
        int perThread = 1_000;
        int[] counter = {0};
        boolean[] overlapped = {false};
        boolean[] inside = {false};
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch done = new CountDownLatch(threads);

        for (int t = 0; t < threads; t++) {
            pool.execute(() -> {
                for (int i = 0; i < perThread; i++) {
                    context.execute(() -> {
                        if (inside[0]) {
                            overlapped[0] = true;
                        }
                        inside[0] = true;
                        counter[0]++;
                        inside[0] = false;
                    });
                }
                done.countDown();
            });
        }

        assertTrue(done.await(10, TimeUnit.SECONDS));
        pool.shutdown();
        assertEquals(threads * perThread, context.call(() -> counter[0]));
        assertFalse(context.call(() -> overlapped[0]));
    }
}
