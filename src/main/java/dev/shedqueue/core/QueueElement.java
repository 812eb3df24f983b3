package dev.shedqueue.core;

import dev.shedqueue.api.Criticality;
import dev.shedqueue.api.RequestContext;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One buffered item. Owned by the queue from insert until it is dequeued or shed.
 *
 * @param <T> payload type
 */
final class QueueElement<T> {
    private final RequestContext context;
    private final Runnable cancel;
    private final Criticality criticality;
    private final T payload;
    private final Instant enqueuedAt;
    private final long sequence;

    private final CompletableFuture<Void> removed = new CompletableFuture<>();
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    QueueElement(RequestContext context, Runnable cancel, Criticality criticality, T payload,
                 Instant enqueuedAt, long sequence) {
        this.context = Objects.requireNonNull(context, "context cannot be null");
        this.cancel = Objects.requireNonNull(cancel, "cancel cannot be null");
        this.criticality = Objects.requireNonNull(criticality, "criticality cannot be null");
        this.payload = Objects.requireNonNull(payload, "payload cannot be null");
        this.enqueuedAt = Objects.requireNonNull(enqueuedAt, "enqueuedAt cannot be null");
        this.sequence = sequence;
    }

    RequestContext context() {
        return context;
    }

    Criticality criticality() {
        return criticality;
    }

    T payload() {
        return payload;
    }

    Instant enqueuedAt() {
        return enqueuedAt;
    }

    long sequence() {
        return sequence;
    }

    /**
     * Completes once the element has left the buffer, whether dequeued or shed.
     */
    CompletionStage<Void> removedSignal() {
        return removed;
    }

    boolean isRemoved() {
        return removed.isDone();
    }

    void markRemoved() {
        removed.complete(null);
    }

    /**
     * Runs the owner's cancel callback unless it already ran.
     *
     * @return false if the callback had already been invoked
     */
    boolean invokeCancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        cancel.run();
        return true;
    }

    @Override
    public String toString() {
        return "QueueElement{seq=" + sequence + ", criticality=" + criticality + ", enqueuedAt=" + enqueuedAt + "}";
    }
}
