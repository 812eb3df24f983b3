package dev.shedqueue.core;

import dev.shedqueue.api.Criticality;
import dev.shedqueue.api.QueueStats;
import dev.shedqueue.api.RequestContext;
import dev.shedqueue.api.SheddingQueue;
import dev.shedqueue.config.QueueConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * An in-memory FIFO admission queue that sheds work it cannot serve in time.
 *
 * <p>This implementation provides:
 * <ul>
 *   <li>Strict arrival-order dequeue; shedding deletes elements but never reorders them</li>
 *   <li>A trimmed-mean estimate of the dequeue interval, learned from the consumer's own pace</li>
 *   <li>Two-phase shedding before every dequeue: terminated contexts first, then elements projected to
 *       miss their deadline, with lower criticalities giving up their slots first</li>
 *   <li>One watcher per element that turns caller cancellation into a prompt shed pass</li>
 * </ul>
 *
 * <p>Deadline shedding stays off until {@link QueueConfig#getTimingHistorySize()} dequeues have been
 * observed; until then only elements whose context already terminated are dropped.
 *
 * <p><strong>Thread Safety:</strong> this class is thread-safe. A single monitor guards the buffer and the
 * timing state for insert, remove, len and every shed pass. Cancel callbacks of shed elements run on the
 * shedding thread while the monitor is held, so they must be cheap and must not block.
 *
 * <p><strong>Resource Management:</strong> when no watcher executor is configured the queue owns a daemon
 * thread pool; {@link #close()} sheds whatever is still buffered and releases the pool.
 *
 * <p><strong>Usage Example:</strong>
 * <pre>{@code
 * try (DeadlineShedQueue<Request> queue = new DeadlineShedQueue<>("frontend", new QueueConfig())) {
 *     CancellableContext ctx = CancellableContext.withTimeout(Clock.systemUTC(), Duration.ofMillis(300));
 *     queue.insert(ctx, Criticality.CRITICAL, request, ctx::cancel);
 *
 *     // consumer side
 *     queue.remove().ifPresent(this::serve);
 * }
 * }</pre>
 *
 * @param <T> the type of payloads held in the queue
 */
public class DeadlineShedQueue<T> implements SheddingQueue<T> {
    private static final Logger logger = LoggerFactory.getLogger(DeadlineShedQueue.class);

    private final String name;
    private final Clock clock;
    private final Object lock = new Object();

    // guarded by lock
    private final Deque<QueueElement<T>> buffer = new ArrayDeque<>();
    private final TimingEstimator timing;
    private long nextSequence = 0;
    private long inserted = 0;
    private long dequeued = 0;
    private long shedDead = 0;
    private long shedDeadline = 0;
    private long shedOnClose = 0;

    private final Executor watcherExecutor;
    private final ExecutorService ownedExecutor;
    private final AtomicInteger activeWatchers = new AtomicInteger();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * Creates a queue with the given configuration.
     *
     * @param name   queue name used in logs and watcher thread names
     * @param config the queue configuration, validated eagerly
     * @throws IllegalArgumentException if the configuration is invalid
     */
    public DeadlineShedQueue(String name, QueueConfig config) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(config, "config cannot be null");
        if (name.trim().isEmpty()) {
            throw new IllegalArgumentException("name cannot be empty or whitespace");
        }
        config.validate();

        this.clock = config.getClock();
        this.timing = new TimingEstimator(config.getTimingHistorySize(), config.getDiscardOutliers(), clock.instant());

        if (config.getWatcherExecutor() != null) {
            this.watcherExecutor = config.getWatcherExecutor();
            this.ownedExecutor = null;
        } else {
            this.ownedExecutor = Executors.newFixedThreadPool(config.getWatcherThreads(), watcherThreadFactory(name));
            this.watcherExecutor = ownedExecutor;
        }

        MDC.put("queueName", name);
        try {
            logger.info("Initialized DeadlineShedQueue '{}' with timingHistorySize={}, discardOutliers={}, ownedWatcherThreads={}",
                    name, config.getTimingHistorySize(), config.getDiscardOutliers(),
                    ownedExecutor != null ? config.getWatcherThreads() : 0);
        } finally {
            MDC.clear();
        }
    }

    /**
     * Creates a queue named {@code "default"}.
     */
    public DeadlineShedQueue(QueueConfig config) {
        this("default", config);
    }

    /**
     * Appends an element at the tail and starts its watcher.
     *
     * @throws IllegalStateException if the queue is closed
     * @throws NullPointerException  if any argument is null
     */
    @Override
    public void insert(RequestContext context, Criticality criticality, T payload, Runnable cancel) {
        Objects.requireNonNull(context, "context cannot be null");
        Objects.requireNonNull(criticality, "criticality cannot be null");
        Objects.requireNonNull(payload, "payload cannot be null");
        Objects.requireNonNull(cancel, "cancel cannot be null");

        QueueElement<T> element;
        synchronized (lock) {
            if (closed.get()) {
                throw new IllegalStateException("Queue is closed: " + name);
            }
            element = new QueueElement<>(context, cancel, criticality, payload, clock.instant(), nextSequence++);
            buffer.addLast(element);
            inserted++;
        }

        activeWatchers.incrementAndGet();
        new ElementWatcher(element, this::shed, watcherExecutor, activeWatchers::decrementAndGet).start();
    }

    /**
     * Runs a shed pass, then dequeues the head element.
     *
     * <p>Only a successful dequeue feeds the rate estimate; polling an empty queue does not.
     *
     * @return the head payload, or empty if the queue is empty or closed
     */
    @Override
    public Optional<T> remove() {
        if (closed.get()) {
            logger.debug("Remove called on closed queue '{}'", name);
            return Optional.empty();
        }
        synchronized (lock) {
            shedLocked();

            QueueElement<T> head = buffer.pollFirst();
            if (head == null) {
                logger.trace("No elements available in queue '{}'", name);
                return Optional.empty();
            }
            head.markRemoved();
            Instant now = clock.instant();
            timing.recordDequeue(now);
            dequeued++;
            if (logger.isTraceEnabled()) {
                logger.trace("Dequeued {} from queue '{}' after {}", head, name, Duration.between(head.enqueuedAt(), now));
            }
            return Optional.of(head.payload());
        }
    }

    /**
     * Current buffer size as left by the last shed pass. Does not shed.
     */
    @Override
    public int len() {
        synchronized (lock) {
            return buffer.size();
        }
    }

    @Override
    public void shed() {
        synchronized (lock) {
            shedLocked();
        }
    }

    @Override
    public Duration expectedWait() {
        synchronized (lock) {
            return timing.update();
        }
    }

    @Override
    public QueueStats stats() {
        synchronized (lock) {
            return new QueueStats(buffer.size(), timing.update(), inserted, dequeued,
                    shedDead, shedDeadline, shedOnClose, activeWatchers.get());
        }
    }

    /**
     * Closes this queue. Every element still buffered is shed, so its owner is notified through its cancel
     * callback and its watcher exits. Idempotent.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            logger.debug("Close called on already closed queue '{}'", name);
            return;
        }

        MDC.put("queueName", name);
        try {
            logger.info("Closing DeadlineShedQueue '{}'", name);
            synchronized (lock) {
                List<QueueElement<T>> remaining = new ArrayList<>(buffer);
                buffer.clear();
                shedOnClose += remaining.size();
                if (!remaining.isEmpty()) {
                    logger.info("Shedding {} buffered elements on close of queue '{}'", remaining.size(), name);
                }
                notifyShed(remaining);
            }
            if (ownedExecutor != null) {
                ownedExecutor.shutdown();
                logger.debug("Shut down watcher pool of queue '{}'", name);
            }
        } finally {
            MDC.clear();
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    public String getName() {
        return name;
    }

    /**
     * One shed pass. Caller holds {@link #lock}.
     */
    private void shedLocked() {
        if (buffer.isEmpty()) {
            return;
        }
        Duration expectedWait = timing.update();
        Instant now = clock.instant();
        ShedPlan<T> plan = ShedPlanner.plan(new ArrayList<>(buffer), expectedWait, now);
        if (plan.shedsNothing()) {
            return;
        }

        buffer.clear();
        buffer.addAll(plan.kept());
        shedDead += plan.dead().size();
        shedDeadline += plan.late().size();

        if (logger.isDebugEnabled()) {
            logger.debug("Shed {} terminated and {} late elements from queue '{}' (expectedWait={}, remaining={})",
                    plan.dead().size(), plan.late().size(), name, expectedWait, buffer.size());
        }

        List<QueueElement<T>> shed = new ArrayList<>(plan.shedCount());
        shed.addAll(plan.dead());
        shed.addAll(plan.late());
        notifyShed(shed);
    }

    /**
     * Marks every element removed before running any callback, so a callback that cancels its own context
     * cannot wake a watcher into shedding the same element again.
     */
    private void notifyShed(List<QueueElement<T>> shed) {
        for (QueueElement<T> e : shed) {
            e.markRemoved();
        }
        for (QueueElement<T> e : shed) {
            try {
                e.invokeCancel();
            } catch (RuntimeException ex) {
                logger.warn("Cancel callback of {} failed in queue '{}': {}", e, name, ex.getMessage(), ex);
            }
        }
    }

    private static ThreadFactory watcherThreadFactory(String queueName) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "shed-watcher-" + queueName + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
