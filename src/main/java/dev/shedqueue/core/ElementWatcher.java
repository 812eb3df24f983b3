package dev.shedqueue.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Bridges one element's external cancellation into queue shed passes.
 *
 * <p>On start it runs a shed pass so that an element born unviable is dropped right away. It then waits
 * for whichever comes first, the element's context terminating or the element leaving the buffer. In the
 * first case it runs one more shed pass to evict the abandoned element promptly; in the second there is
 * nothing left to watch. Either way the watcher then exits, so dequeued elements never leave a parked task.
 */
final class ElementWatcher {
    private static final Logger logger = LoggerFactory.getLogger(ElementWatcher.class);

    private final QueueElement<?> element;
    private final Runnable shedPass;
    private final Executor executor;
    private final Runnable onExit;
    private final CompletableFuture<Void> completion = new CompletableFuture<>();

    /**
     * @param element  the watched element
     * @param shedPass runs one shed pass on the owning queue
     * @param executor runs the watcher's steps
     * @param onExit   invoked once when the watcher has finished
     */
    ElementWatcher(QueueElement<?> element, Runnable shedPass, Executor executor, Runnable onExit) {
        this.element = Objects.requireNonNull(element, "element cannot be null");
        this.shedPass = Objects.requireNonNull(shedPass, "shedPass cannot be null");
        this.executor = Objects.requireNonNull(executor, "executor cannot be null");
        this.onExit = Objects.requireNonNull(onExit, "onExit cannot be null");
    }

    /**
     * Schedules the watcher.
     *
     * @return completes when the watcher has exited
     */
    CompletionStage<Void> start() {
        try {
            executor.execute(this::watch);
        } catch (RejectedExecutionException e) {
            // queue closed between insert and start; close() already shed the element
            logger.debug("Watcher for {} rejected by executor: {}", element, e.getMessage());
            finish();
        }
        return completion;
    }

    private void watch() {
        runShedPass("insert");

        CompletableFuture<Void> wake = new CompletableFuture<>();
        element.context().done().whenComplete((r, t) -> wake.complete(null));
        element.removedSignal().whenComplete((r, t) -> wake.complete(null));

        wake.thenRunAsync(this::afterWake, executor)
                .whenComplete((r, t) -> {
                    if (t != null) {
                        logger.debug("Watcher for {} ended without a final pass: {}", element, t.getMessage());
                    }
                    finish();
                });
    }

    private void afterWake() {
        if (element.isRemoved()) {
            return;
        }
        runShedPass("cancellation");
    }

    private void runShedPass(String trigger) {
        try {
            shedPass.run();
        } catch (RuntimeException e) {
            logger.warn("Shed pass on {} for {} failed: {}", trigger, element, e.getMessage(), e);
        }
    }

    private void finish() {
        if (completion.complete(null)) {
            onExit.run();
        }
    }
}
