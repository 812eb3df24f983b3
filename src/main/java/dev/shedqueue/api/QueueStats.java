package dev.shedqueue.api;

import java.time.Duration;

/**
 * Point-in-time snapshot of a queue, taken under the queue lock.
 *
 * @param size           elements currently buffered
 * @param expectedWait   current per-item service estimate, zero while warming up
 * @param inserted       total inserts accepted
 * @param dequeued       total payloads returned by remove
 * @param shedDead       elements dropped because their context had already terminated
 * @param shedDeadline   elements dropped because they were projected to miss their deadline
 * @param shedOnClose    elements dropped when the queue was closed
 * @param activeWatchers cancellation watchers that have not exited yet
 */
public record QueueStats(int size,
                         Duration expectedWait,
                         long inserted,
                         long dequeued,
                         long shedDead,
                         long shedDeadline,
                         long shedOnClose,
                         int activeWatchers) {

    public long shedTotal() {
        return shedDead + shedDeadline + shedOnClose;
    }
}
