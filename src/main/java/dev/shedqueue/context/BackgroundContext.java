package dev.shedqueue.context;

import dev.shedqueue.api.RequestContext;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Context for work that can neither be cancelled nor expire.
 */
public final class BackgroundContext implements RequestContext {
    public static final BackgroundContext INSTANCE = new BackgroundContext();

    private BackgroundContext() {
    }

    @Override
    public boolean isTerminated() {
        return false;
    }

    /**
     * Returns a fresh, never-completing stage per call so that waiters do not pile up on a shared instance.
     */
    @Override
    public CompletionStage<Void> done() {
        return new CompletableFuture<>();
    }

    @Override
    public Optional<Instant> deadline() {
        return Optional.empty();
    }

    @Override
    public String toString() {
        return "BackgroundContext";
    }
}
