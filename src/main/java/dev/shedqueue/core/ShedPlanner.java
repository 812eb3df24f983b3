package dev.shedqueue.core;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Decides which buffered elements a shed pass evicts.
 *
 * <p>Phase 1 drops every element whose context has already terminated. Phase 2 runs only when a dequeue
 * rate estimate exists: elements are projected onto future dequeue slots most-critical first (ties by
 * arrival), slot {@code k} completing at {@code now + k * expectedWait}. An element whose deadline falls
 * before its projected completion is shed and frees its slot for the elements behind it, so less critical
 * work never pushes more critical work past its deadline.
 *
 * <p>The projection order only drives the decision; the kept elements are returned in arrival order.
 */
final class ShedPlanner {

    private ShedPlanner() {
    }

    /**
     * Most critical first, then oldest first.
     */
    static <T> Comparator<QueueElement<T>> projectionOrder() {
        return Comparator.comparing((QueueElement<T> e) -> e.criticality(), Comparator.reverseOrder())
                .thenComparingLong(QueueElement::sequence);
    }

    /**
     * @param buffer       current buffer in arrival order; not modified
     * @param expectedWait per-item service estimate, zero or negative disables deadline shedding
     * @param now          reference time for projected completions
     */
    static <T> ShedPlan<T> plan(List<QueueElement<T>> buffer, Duration expectedWait, Instant now) {
        List<QueueElement<T>> live = new ArrayList<>(buffer.size());
        List<QueueElement<T>> dead = new ArrayList<>();
        for (QueueElement<T> e : buffer) {
            if (e.context().isTerminated()) {
                dead.add(e);
            } else {
                live.add(e);
            }
        }

        if (expectedWait.isZero() || expectedWait.isNegative() || live.isEmpty()) {
            return new ShedPlan<>(live, dead, List.of());
        }

        List<QueueElement<T>> projection = new ArrayList<>(live);
        projection.sort(projectionOrder());

        List<QueueElement<T>> late = new ArrayList<>();
        Set<QueueElement<T>> lateSet = new HashSet<>();
        long slot = 0;
        for (QueueElement<T> e : projection) {
            Instant projectedCompletion = now.plus(expectedWait.multipliedBy(slot));
            Optional<Instant> deadline = e.context().deadline();
            if (deadline.isPresent() && deadline.get().isBefore(projectedCompletion)) {
                late.add(e);
                lateSet.add(e);
                continue;
            }
            slot++;
        }

        if (late.isEmpty()) {
            return new ShedPlan<>(live, dead, late);
        }
        List<QueueElement<T>> kept = new ArrayList<>(live.size() - late.size());
        for (QueueElement<T> e : live) {
            if (!lateSet.contains(e)) {
                kept.add(e);
            }
        }
        return new ShedPlan<>(kept, dead, late);
    }
}
