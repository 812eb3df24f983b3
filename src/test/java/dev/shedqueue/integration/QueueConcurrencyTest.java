package dev.shedqueue.integration;

import dev.shedqueue.api.Criticality;
import dev.shedqueue.api.QueueStats;
import dev.shedqueue.config.QueueConfig;
import dev.shedqueue.context.CancellableContext;
import dev.shedqueue.core.DeadlineShedQueue;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicIntegerArray;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Real threads, real clock, queue-owned watcher pool. Verifies that under concurrent insert, remove and
 * cancellation every element is either dequeued once or shed once, never both and never twice.
 */
public class QueueConcurrencyTest {

    private DeadlineShedQueue<Integer> queue;

    @AfterEach
    void tearDown() {
        if (queue != null) queue.close();
    }

    private static void waitUntil(BooleanSupplier condition, long timeoutMs) throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMs;
        while (System.currentTimeMillis() < deadline) {
            if (condition.getAsBoolean()) return;
            Thread.sleep(5);
        }
    }

    @Test
    void concurrentInsertRemoveCancel_eachElementDequeuedOrShedExactlyOnce() throws Exception {
        queue = new DeadlineShedQueue<>("concurrency", new QueueConfig());

        final int producers = 4;
        final int perProducer = 2_000;
        final int total = producers * perProducer;

        AtomicIntegerArray cancelCalls = new AtomicIntegerArray(total);
        AtomicIntegerArray dequeueCalls = new AtomicIntegerArray(total);
        ConcurrentLinkedQueue<CancellableContext> toCancel = new ConcurrentLinkedQueue<>();

        ExecutorService exec = Executors.newFixedThreadPool(producers + 2);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch doneProducers = new CountDownLatch(producers);
        AtomicInteger dequeued = new AtomicInteger();

        List<Future<?>> futures = new ArrayList<>();
        for (int p = 0; p < producers; p++) {
            final int pid = p;
            futures.add(exec.submit(() -> {
                try {
                    Random rnd = new Random(42L + pid);
                    start.await();
                    for (int i = 0; i < perProducer; i++) {
                        int id = pid * perProducer + i;
                        CancellableContext ctx = CancellableContext.create();
                        Criticality crit = Criticality.values()[rnd.nextInt(Criticality.values().length)];
                        queue.insert(ctx, crit, id, () -> cancelCalls.incrementAndGet(id));
                        if (rnd.nextInt(3) == 0) {
                            toCancel.add(ctx);
                        }
                    }
                    return null;
                } finally {
                    doneProducers.countDown();
                }
            }));
        }

        // Canceller
        futures.add(exec.submit(() -> {
            start.await();
            while (doneProducers.getCount() > 0 || !toCancel.isEmpty()) {
                CancellableContext ctx = toCancel.poll();
                if (ctx == null) {
                    Thread.sleep(1);
                    continue;
                }
                ctx.cancel();
            }
            return null;
        }));

        // Consumer
        futures.add(exec.submit(() -> {
            start.await();
            while (doneProducers.getCount() > 0 || queue.len() > 0) {
                Optional<Integer> v = queue.remove();
                if (v.isPresent()) {
                    dequeueCalls.incrementAndGet(v.get());
                    dequeued.incrementAndGet();
                } else {
                    Thread.sleep(1);
                }
            }
            return null;
        }));

        start.countDown();
        exec.shutdown();
        assertTrue(exec.awaitTermination(60, TimeUnit.SECONDS), "workers did not finish in time");
        for (Future<?> f : futures) {
            f.get();
        }

        waitUntil(() -> queue.stats().activeWatchers() == 0, 5_000);
        QueueStats stats = queue.stats();

        assertEquals(0, queue.len());
        assertEquals(0, stats.activeWatchers(), "every watcher should have exited");
        assertEquals(total, stats.inserted());
        assertEquals(dequeued.get(), stats.dequeued());
        assertEquals(total, stats.dequeued() + stats.shedTotal());

        int shed = 0;
        for (int id = 0; id < total; id++) {
            int c = cancelCalls.get(id);
            int d = dequeueCalls.get(id);
            assertTrue(c <= 1, "cancel invoked " + c + " times for " + id);
            assertTrue(d <= 1, "dequeued " + d + " times for " + id);
            assertEquals(1, c + d, "element " + id + " must be dequeued or shed, not both");
            shed += c;
        }
        assertEquals(stats.shedTotal(), shed);
        assertEquals(0, stats.shedDeadline(), "no deadlines, so nothing is shed for lateness");
    }

    @Test
    void cancelledElementIsEvictedByItsWatcherWithoutAConsumer() throws Exception {
        queue = new DeadlineShedQueue<>("watcher", new QueueConfig());
        AtomicInteger cancelled = new AtomicInteger();

        CancellableContext ctx = CancellableContext.create();
        queue.insert(ctx, Criticality.CRITICAL, 1, cancelled::incrementAndGet);
        queue.insert(CancellableContext.create(), Criticality.CRITICAL, 2, () -> { });
        assertEquals(2, queue.len());

        ctx.cancel();
        waitUntil(() -> queue.len() == 1, 5_000);

        assertEquals(1, queue.len());
        assertEquals(1, cancelled.get());
        assertEquals(Optional.of(2), queue.remove());
        waitUntil(() -> queue.stats().activeWatchers() == 0, 5_000);
        assertEquals(0, queue.stats().activeWatchers());
    }
}
