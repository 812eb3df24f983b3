package dev.shedqueue.api;

import java.time.Duration;
import java.util.Optional;

/**
 * Admission-control queue semantics:
 * - Items are kept in arrival order and dequeued FIFO. Shedding only deletes items, it never reorders them.
 * - Before every dequeue the queue drops items whose context already terminated, and, once a dequeue rate
 *   estimate exists, items that are not expected to reach the head before their deadline.
 * - When capacity is short, lower-criticality items lose their slot before higher-criticality ones.
 * - A shed item is reported to its owner only through the {@code cancel} callback given at insert time.
 */
public interface SheddingQueue<T> extends AutoCloseable {
    /**
     * Append an item at the tail of the queue.
     *
     * @param context     the caller's request context, watched for cancellation and deadline
     * @param criticality importance tier used when capacity must be shared
     * @param payload     the item (must not be null)
     * @param cancel      invoked exactly once if the item is shed, never if it is dequeued
     */
    void insert(RequestContext context, Criticality criticality, T payload, Runnable cancel);

    /**
     * Shed, then pop the head of the queue.
     *
     * @return the head payload, or {@link Optional#empty()} if the queue is empty
     */
    Optional<T> remove();

    int len();

    /**
     * Run one shed pass without dequeuing.
     */
    void shed();

    /**
     * @return the estimated per-item service interval, {@link Duration#ZERO} while still warming up
     */
    Duration expectedWait();

    QueueStats stats();

    @Override
    void close();
}
