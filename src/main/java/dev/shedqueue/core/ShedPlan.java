package dev.shedqueue.core;

import java.util.List;

/**
 * Outcome of one shed pass. Every planned element lands in exactly one list.
 *
 * @param kept elements that stay buffered, in arrival order
 * @param dead elements whose context had already terminated
 * @param late elements projected to miss their deadline
 */
record ShedPlan<T>(List<QueueElement<T>> kept, List<QueueElement<T>> dead, List<QueueElement<T>> late) {
    ShedPlan {
        kept = List.copyOf(kept);
        dead = List.copyOf(dead);
        late = List.copyOf(late);
    }

    boolean shedsNothing() {
        return dead.isEmpty() && late.isEmpty();
    }

    int shedCount() {
        return dead.size() + late.size();
    }
}
