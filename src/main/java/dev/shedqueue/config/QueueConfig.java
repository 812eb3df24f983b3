package dev.shedqueue.config;

import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;

import java.time.Clock;
import java.util.concurrent.Executor;

@Getter
@Setter
@Accessors(chain = true)
public class QueueConfig {
    public static final int DEFAULT_TIMING_HISTORY_SIZE = 100;
    public static final int DEFAULT_DISCARD_OUTLIERS = 1;

    // System property helpers for test configurability (safe fallbacks)
    private static int intProp(String key, int def) {
        String v = System.getProperty(key);
        if (v == null) return def;
        try { return Integer.parseInt(v.trim()); } catch (NumberFormatException e) { return def; }
    }

    // Time source for enqueue stamps, dequeue intervals and deadline projection
    private Clock clock = Clock.systemUTC();

    // Rate estimation
    private int timingHistorySize = intProp("sq.timingHistorySize", DEFAULT_TIMING_HISTORY_SIZE); // dequeue intervals needed before deadline shedding starts
    private int discardOutliers = intProp("sq.discardOutliers", DEFAULT_DISCARD_OUTLIERS);      // samples dropped from each end before averaging

    // Cancellation watchers; null means the queue owns a fixed daemon pool of watcherThreads and shuts it down on close
    private Executor watcherExecutor = null;
    private int watcherThreads = intProp("sq.watcherThreads", Math.max(2, Runtime.getRuntime().availableProcessors()));

    /**
     * Checks the settings a queue cannot run with.
     *
     * @throws IllegalArgumentException if the clock is missing, the owned pool would be empty or the trimmed mean would be empty
     */
    public void validate() {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (timingHistorySize < 1) {
            throw new IllegalArgumentException("timingHistorySize must be positive, got " + timingHistorySize);
        }
        if (discardOutliers < 0) {
            throw new IllegalArgumentException("discardOutliers cannot be negative, got " + discardOutliers);
        }
        if (watcherExecutor == null && watcherThreads < 1) {
            throw new IllegalArgumentException("watcherThreads must be positive, got " + watcherThreads);
        }
        if (timingHistorySize <= 2 * discardOutliers) {
            throw new IllegalArgumentException(String.format(
                    "timingHistorySize (%d) must exceed 2 * discardOutliers (%d)",
                    timingHistorySize, discardOutliers));
        }
    }
}
