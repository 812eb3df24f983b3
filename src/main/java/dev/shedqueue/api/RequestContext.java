package dev.shedqueue.api;

import dev.shedqueue.context.BackgroundContext;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletionStage;

/**
 * The caller-side view of a request that the queue watches while the request is buffered.
 *
 * Implementations must answer {@link #isTerminated()} and {@link #deadline()} without blocking:
 * the queue calls them while holding its lock.
 */
public interface RequestContext {

    /**
     * @return true once the caller cancelled the request or its deadline has elapsed
     */
    boolean isTerminated();

    /**
     * Signal that completes when the request terminates. Never completes for requests that cannot be cancelled.
     */
    CompletionStage<Void> done();

    Optional<Instant> deadline();

    /**
     * A context that is never cancelled and has no deadline.
     */
    static RequestContext background() {
        return BackgroundContext.INSTANCE;
    }
}
