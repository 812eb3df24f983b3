package dev.shedqueue.context;

import dev.shedqueue.api.RequestContext;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A request context that terminates on an explicit {@link #cancel()} or when its deadline passes.
 *
 * <p>The deadline is judged against the supplied {@link Clock}, so a test clock controls expiry.
 * Expiry is noticed lazily by {@link #isTerminated()}; use {@link #scheduleExpiry(ScheduledExecutorService)}
 * to also fire {@link #done()} on time when nobody polls.
 *
 * <p>Typical use, with the context's own cancel doubling as the queue's shed callback:
 * <pre>{@code
 * CancellableContext ctx = CancellableContext.withTimeout(clock, Duration.ofMillis(250));
 * queue.insert(ctx, Criticality.CRITICAL, request, ctx::cancel);
 * }</pre>
 */
public final class CancellableContext implements RequestContext {
    private final Clock clock;
    private final Instant deadline;
    private final AtomicReference<TerminationCause> cause = new AtomicReference<>();
    private final CompletableFuture<Void> done = new CompletableFuture<>();

    private CancellableContext(Clock clock, Instant deadline) {
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.deadline = deadline;
    }

    /**
     * Creates a context without a deadline that terminates only when cancelled.
     */
    public static CancellableContext create() {
        return new CancellableContext(Clock.systemUTC(), null);
    }

    public static CancellableContext withDeadline(Clock clock, Instant deadline) {
        return new CancellableContext(clock, Objects.requireNonNull(deadline, "deadline cannot be null"));
    }

    public static CancellableContext withTimeout(Clock clock, Duration timeout) {
        Objects.requireNonNull(timeout, "timeout cannot be null");
        return withDeadline(clock, clock.instant().plus(timeout));
    }

    /**
     * Cancels the request. Idempotent; a context that already expired keeps {@link TerminationCause#DEADLINE_EXCEEDED}.
     */
    public void cancel() {
        terminate(TerminationCause.CANCELLED);
    }

    @Override
    public boolean isTerminated() {
        if (cause.get() != null) {
            return true;
        }
        if (deadline != null && !clock.instant().isBefore(deadline)) {
            terminate(TerminationCause.DEADLINE_EXCEEDED);
            return true;
        }
        return false;
    }

    /**
     * @return why the context terminated, or empty while it is still live
     */
    public Optional<TerminationCause> cause() {
        isTerminated();
        return Optional.ofNullable(cause.get());
    }

    @Override
    public CompletionStage<Void> done() {
        return done;
    }

    @Override
    public Optional<Instant> deadline() {
        return Optional.ofNullable(deadline);
    }

    /**
     * Arranges for the deadline to terminate this context even if nobody calls {@link #isTerminated()}.
     * The delay is computed from the context clock at call time. No-op for contexts without a deadline.
     *
     * @return this context
     */
    public CancellableContext scheduleExpiry(ScheduledExecutorService scheduler) {
        Objects.requireNonNull(scheduler, "scheduler cannot be null");
        if (deadline == null || done.isDone()) {
            return this;
        }
        long delayNanos = Math.max(0L, Duration.between(clock.instant(), deadline).toNanos());
        scheduler.schedule(() -> terminate(TerminationCause.DEADLINE_EXCEEDED), delayNanos, TimeUnit.NANOSECONDS);
        return this;
    }

    private void terminate(TerminationCause c) {
        if (cause.compareAndSet(null, c)) {
            done.complete(null);
        }
    }

    @Override
    public String toString() {
        return "CancellableContext{deadline=" + deadline + ", cause=" + cause.get() + "}";
    }
}
