package dev.shedqueue.core;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.Objects;

/**
 * Rolling trimmed-mean estimate of the interval between successful dequeues.
 *
 * <p>The estimate stays at {@link Duration#ZERO} until {@code historySize} intervals have been observed,
 * which keeps deadline shedding off until the queue has a usable rate. Once warm, the estimate is recomputed
 * lazily, at most once per recorded dequeue: the history is sorted, {@code discardOutliers} samples are
 * dropped from each end and the rest are averaged. Dequeues are counted rather than compared by timestamp,
 * so two dequeues stamped with the same instant still invalidate the estimate.
 *
 * <p><strong>Thread Safety:</strong> not thread-safe. The owning queue calls it only while holding its lock.
 */
final class TimingEstimator {
    private final int historySize;
    private final int discardOutliers;

    private final Deque<Duration> intervals;
    private Instant lastDequeueAt;
    private long dequeues;
    private Duration expectedWait = Duration.ZERO;
    // dequeue count the estimate was computed at; -1 when never computed
    private long expectedWaitComputedAt = -1;

    /**
     * @param historySize     number of intervals averaged
     * @param discardOutliers samples dropped from each end of the sorted history
     * @param start           reference point for the first interval
     */
    TimingEstimator(int historySize, int discardOutliers, Instant start) {
        if (historySize <= 2 * discardOutliers || discardOutliers < 0) {
            throw new IllegalArgumentException("historySize (" + historySize
                    + ") must exceed 2 * discardOutliers (" + discardOutliers + ")");
        }
        this.historySize = historySize;
        this.discardOutliers = discardOutliers;
        this.intervals = new ArrayDeque<>(historySize);
        this.lastDequeueAt = Objects.requireNonNull(start, "start cannot be null");
    }

    /**
     * Records a dequeue at {@code now}, evicting the oldest interval if the history is full.
     */
    void recordDequeue(Instant now) {
        Duration interval = Duration.between(lastDequeueAt, now);
        if (interval.isNegative()) {
            // clock went backwards; count it as an instantaneous dequeue
            interval = Duration.ZERO;
        }
        lastDequeueAt = now;
        dequeues++;
        while (intervals.size() >= historySize) {
            intervals.pollFirst();
        }
        intervals.addLast(interval);
    }

    /**
     * Brings the estimate up to date and returns it.
     */
    Duration update() {
        if (intervals.size() < historySize) {
            expectedWait = Duration.ZERO;
            return expectedWait;
        }
        if (expectedWaitComputedAt == dequeues) {
            return expectedWait;
        }

        long[] sorted = new long[intervals.size()];
        int i = 0;
        for (Duration d : intervals) {
            sorted[i++] = d.toNanos();
        }
        Arrays.sort(sorted);

        long total = 0;
        int from = discardOutliers;
        int to = sorted.length - discardOutliers;
        for (int j = from; j < to; j++) {
            total += sorted[j];
        }
        expectedWait = Duration.ofNanos(total / (to - from));
        expectedWaitComputedAt = dequeues;
        return expectedWait;
    }

    int samples() {
        return intervals.size();
    }

    boolean isWarm() {
        return intervals.size() >= historySize;
    }
}
