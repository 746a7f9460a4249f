package eventbus.publisher;

import eventbus.EventEnvelope;
import eventbus.Priority;
import eventbus.Publisher;
import eventbus.model.DeliveryConfig;
import eventbus.model.DeliveryMode;
import eventbus.model.EventRecord;
import eventbus.model.EventStatus;
import eventbus.purge.EventPurgeScheduler;
import eventbus.registry.HandlerRegistry;
import eventbus.spi.EventStore;
import eventbus.spi.MetricsExporter;
import eventbus.sweep.EventSweeper;
import eventbus.util.DaemonThreadFactory;
import eventbus.util.TaskTracker;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Persists published events and delivers them to a {@link HandlerRegistry} with retries and
 * dead-lettering.
 *
 * <p>Every event is first saved as {@code PENDING}; {@link #publish} then follows the
 * {@link DeliveryMode} of its {@link DeliveryConfig}:
 * <ul>
 *   <li>{@code IMMEDIATE}: dispatched on the calling thread before {@code publish} returns</li>
 *   <li>{@code ASYNC}: dispatched on a worker thread; {@code LOW} priority events wait a short
 *       delay first</li>
 *   <li>{@code BATCH}: grouped by priority and type, flushed on size or window</li>
 *   <li>{@code PERSISTENT}: left for the background sweep</li>
 * </ul>
 * A failed dispatch in any mode enters the retry state machine: the record goes
 * {@code FAILED -> RETRYING} and returns to {@code PENDING} after the configured backoff, until
 * retries are exhausted and it moves to {@code DEAD_LETTER}.
 *
 * <p>{@link #start()} launches the sweep loop (pending and due-retry records) and the purge loop
 * (old terminal records). {@link #close()} stops both, waits for detached dispatches, flushes
 * open batches and releases the thread pools; errors during shutdown are logged.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * EventPublisher publisher = EventPublisher.builder()
 *     .store(new InMemoryEventStore())
 *     .registry(registry)
 *     .build();
 * publisher.start();
 *
 * String id = publisher.publish(EventEnvelope.of("PlantWatered", Map.of("plantId", "p-1")));
 * }</pre>
 *
 * <p>This class is thread-safe.
 */
public final class EventPublisher implements Publisher, AutoCloseable {
    private static final Logger logger = Logger.getLogger(EventPublisher.class.getName());

    public static final int QUEUE_STATUS_SAMPLE = 1000;

    private final EventStore store;
    private final HandlerRegistry registry;
    private final DeliveryConfig defaultConfig;
    private final MetricsExporter metrics;
    private final InFlightTracker inFlight;
    private final long lowPriorityDelayMs;
    private final Duration shutdownTimeout;
    private final boolean sweepEnabled;
    private final Duration sweepInterval;
    private final int sweepBatchSize;
    private final Duration processingTimeout;
    private final boolean purgeEnabled;
    private final Duration purgeInterval;
    private final Duration purgeRetention;

    private final ExecutorService workers;
    private final ScheduledExecutorService scheduler;
    private final TaskTracker tasks = new TaskTracker();
    private final EventProcessor processor;
    private final BatchAccumulator batches;
    private final AtomicLong published = new AtomicLong();

    private EventSweeper sweeper;
    private EventPurgeScheduler purger;
    private volatile boolean started;
    private volatile boolean closed;

    private EventPublisher(Builder builder) {
        this.store = Objects.requireNonNull(builder.store, "store");
        this.registry = Objects.requireNonNull(builder.registry, "registry");
        this.defaultConfig = builder.defaultConfig != null ? builder.defaultConfig : DeliveryConfig.defaults();
        Objects.requireNonNull(builder.lowPriorityDelay, "lowPriorityDelay");
        Objects.requireNonNull(builder.shutdownTimeout, "shutdownTimeout");
        Objects.requireNonNull(builder.batchWindow, "batchWindow");
        Objects.requireNonNull(builder.sweepInterval, "sweepInterval");
        Objects.requireNonNull(builder.processingTimeout, "processingTimeout");
        Objects.requireNonNull(builder.purgeInterval, "purgeInterval");
        Objects.requireNonNull(builder.purgeRetention, "purgeRetention");
        if (builder.workerCount <= 0) {
            throw new IllegalArgumentException("workerCount must be > 0");
        }
        if (builder.lowPriorityDelay.isNegative()) {
            throw new IllegalArgumentException("lowPriorityDelay must be >= 0");
        }
        if (builder.shutdownTimeout.isNegative()) {
            throw new IllegalArgumentException("shutdownTimeout must be >= 0");
        }
        if (builder.sweepBatchSize <= 0) {
            throw new IllegalArgumentException("sweepBatchSize must be > 0");
        }
        if (builder.sweepInterval.isZero() || builder.sweepInterval.isNegative()) {
            throw new IllegalArgumentException("sweepInterval must be positive");
        }
        if (builder.processingTimeout.isZero() || builder.processingTimeout.isNegative()) {
            throw new IllegalArgumentException("processingTimeout must be positive");
        }
        if (builder.purgeInterval.isZero() || builder.purgeInterval.isNegative()) {
            throw new IllegalArgumentException("purgeInterval must be positive");
        }
        if (builder.purgeRetention.isNegative()) {
            throw new IllegalArgumentException("purgeRetention must be >= 0");
        }
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.inFlight = builder.inFlightTracker != null ? builder.inFlightTracker : new DefaultInFlightTracker();
        this.lowPriorityDelayMs = builder.lowPriorityDelay.toMillis();
        this.shutdownTimeout = builder.shutdownTimeout;
        this.sweepEnabled = builder.sweepEnabled;
        this.sweepInterval = builder.sweepInterval;
        this.sweepBatchSize = builder.sweepBatchSize;
        this.processingTimeout = builder.processingTimeout;
        this.purgeEnabled = builder.purgeEnabled;
        this.purgeInterval = builder.purgeInterval;
        this.purgeRetention = builder.purgeRetention;

        this.workers = Executors.newFixedThreadPool(builder.workerCount, new DaemonThreadFactory("eventbus-worker-"));
        this.scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("eventbus-scheduler-"));
        this.processor = new EventProcessor(store, registry, metrics, inFlight, builder.interceptors,
                workers, scheduler, tasks);
        this.batches = new BatchAccumulator(builder.batchWindow, builder.batchMaxSize, scheduler, this::flushBatch);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts the sweep and purge loops, as configured. Subsequent calls are no-ops.
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("EventPublisher has been closed");
        }
        if (started) {
            return;
        }
        started = true;
        if (sweepEnabled) {
            sweeper = EventSweeper.builder()
                    .store(store)
                    .handler(processor)
                    .batchSize(sweepBatchSize)
                    .interval(sweepInterval)
                    .processingTimeout(processingTimeout)
                    .metrics(metrics)
                    .build();
            sweeper.start();
        }
        if (purgeEnabled) {
            purger = EventPurgeScheduler.builder()
                    .store(store)
                    .retention(purgeRetention)
                    .interval(purgeInterval)
                    .build();
            purger.start();
        }
        logger.log(Level.INFO, "Event publisher started (sweep={0}, purge={1})",
                new Object[]{sweepEnabled, purgeEnabled});
    }

    @Override
    public String publish(EventEnvelope event) {
        return publish(event, defaultConfig);
    }

    @Override
    public String publish(EventEnvelope event, DeliveryConfig config) {
        Objects.requireNonNull(event, "event");
        Objects.requireNonNull(config, "config");
        if (closed) {
            throw new IllegalStateException("EventPublisher has been closed");
        }
        String eventId = event.eventId();
        store.save(EventRecord.pending(event, config, Instant.now()));
        published.incrementAndGet();
        metrics.incrementPublished(config.mode());

        switch (config.mode()) {
            case IMMEDIATE -> {
                if (inFlight.tryAcquire(eventId)) {
                    processor.processClaimed(eventId);
                }
            }
            case ASYNC -> processor.submit(eventId,
                    config.priority() == Priority.LOW ? lowPriorityDelayMs : 0L);
            case BATCH -> {
                if (inFlight.tryAcquire(eventId)) {
                    batches.add(config.priority(), event.eventType(), eventId);
                    metrics.recordBatchedEvents(batches.batchedEventCount());
                }
            }
            case PERSISTENT -> logger.log(Level.FINE, "Event {0} persisted for background delivery", eventId);
        }
        return eventId;
    }

    private void flushBatch(List<String> eventIds) {
        logger.log(Level.FINE, "Flushing batch of {0} events", eventIds.size());
        for (String eventId : eventIds) {
            processor.submitClaimed(eventId, 0L);
        }
        metrics.recordBatchedEvents(batches.batchedEventCount());
    }

    /**
     * Runs one sweep now, whether or not the sweep loop is running.
     */
    public void sweepNow() {
        EventSweeper running = sweeper;
        if (running != null) {
            running.sweep();
        } else {
            EventSweeper.builder().store(store).handler(processor).batchSize(sweepBatchSize)
                    .processingTimeout(processingTimeout).metrics(metrics).build().sweep();
        }
    }

    // ── Query and administration ────────────────────────────────────

    public Optional<EventRecord> getEventStatus(String eventId) {
        return store.get(eventId);
    }

    /**
     * Resets a {@code FAILED} or {@code DEAD_LETTER} event to {@code PENDING} with a zero retry
     * count. The sweep delivers it again.
     *
     * @param eventId the event id
     * @return {@code true} if the event was reset
     */
    public boolean retryFailedEvent(String eventId) {
        Optional<EventRecord> current = store.get(eventId);
        if (current.isEmpty()) {
            return false;
        }
        EventRecord record = current.get();
        if (record.status() != EventStatus.FAILED && record.status() != EventStatus.DEAD_LETTER) {
            return false;
        }
        EventRecord reset = record.withRetryCount(0).transitionTo(EventStatus.PENDING, Instant.now(), null);
        boolean updated = store.compareAndSet(eventId, record.status(), reset);
        if (updated) {
            logger.log(Level.INFO, "Manually scheduled retry for event {0}", eventId);
        }
        return updated;
    }

    /**
     * Moves a {@code PENDING} event to {@code DEAD_LETTER}.
     *
     * @param eventId the event id
     * @return {@code true} if the event was cancelled
     */
    public boolean cancelEvent(String eventId) {
        Optional<EventRecord> current = store.get(eventId);
        if (current.isEmpty() || current.get().status() != EventStatus.PENDING) {
            return false;
        }
        EventRecord cancelled = current.get().transitionTo(EventStatus.DEAD_LETTER, Instant.now(), "Manually cancelled");
        boolean updated = store.compareAndSet(eventId, EventStatus.PENDING, cancelled);
        if (updated) {
            logger.log(Level.INFO, "Cancelled event {0}", eventId);
        }
        return updated;
    }

    public QueueStatus getQueueStatus() {
        List<EventRecord> pending = store.listPending(QUEUE_STATUS_SAMPLE);
        List<EventRecord> failed = store.listFailed(QUEUE_STATUS_SAMPLE);
        Map<String, Integer> pendingByPriority = new LinkedHashMap<>();
        Map<String, Integer> pendingByType = new LinkedHashMap<>();
        Map<String, Integer> failedByType = new LinkedHashMap<>();
        for (EventRecord r : pending) {
            pendingByPriority.merge(r.config().priority().name(), 1, Integer::sum);
            pendingByType.merge(r.eventType(), 1, Integer::sum);
        }
        for (EventRecord r : failed) {
            failedByType.merge(r.eventType(), 1, Integer::sum);
        }
        return new QueueStatus(pending.size(), failed.size(), pendingByPriority, pendingByType, failedByType,
                pending.isEmpty() ? null : pending.get(0).createdAt(),
                failed.isEmpty() ? null : failed.get(0).createdAt());
    }

    public PublisherMetrics getPublisherMetrics() {
        EventSweeper s = sweeper;
        EventPurgeScheduler p = purger;
        return new PublisherMetrics(
                published.get(),
                processor.processedCount(),
                processor.failedCount(),
                successRate(),
                inFlight.size(),
                tasks.size(),
                batches.activeBatches(),
                batches.batchedEventCount(),
                processor.lastProcessingTime(),
                s == null ? null : s.lastSweepAt(),
                s != null && s.isRunning(),
                p != null && p.isRunning());
    }

    /**
     * Deletes dead-letter events created more than {@code olderThanHours} hours ago.
     *
     * @param olderThanHours age threshold
     * @return number of deleted events
     */
    public int purgeDeadLetterEvents(long olderThanHours) {
        if (olderThanHours < 0) {
            throw new IllegalArgumentException("olderThanHours must be >= 0");
        }
        Instant cutoff = Instant.now().minus(Duration.ofHours(olderThanHours));
        int deleted = store.delete(EnumSet.of(EventStatus.DEAD_LETTER), cutoff);
        logger.log(Level.INFO, "Purged {0} dead letter events older than {1}", new Object[]{deleted, cutoff});
        return deleted;
    }

    public PublisherHealth health() {
        return PublisherHealth.classify(successRate(),
                store.countByStatus(EventStatus.PENDING),
                store.countByStatus(EventStatus.FAILED));
    }

    private double successRate() {
        long total = published.get();
        return total == 0 ? 1.0 : (double) processor.processedCount() / total;
    }

    public DeliveryConfig defaultConfig() {
        return defaultConfig;
    }

    public EventStore store() {
        return store;
    }

    // ── Lifecycle ───────────────────────────────────────────────────

    /**
     * Stops the loops, waits up to the shutdown timeout for detached dispatches, flushes open
     * batches on the calling thread and releases the thread pools. Errors are logged, not thrown.
     */
    @Override
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
        }
        logger.log(Level.INFO, "Shutting down event publisher");
        closeQuietly(sweeper, "sweeper");
        closeQuietly(purger, "purge scheduler");

        if (!tasks.awaitAll(shutdownTimeout)) {
            logger.log(Level.WARNING, "{0} dispatch tasks did not complete within {1} ms",
                    new Object[]{tasks.size(), shutdownTimeout.toMillis()});
        }

        List<String> remaining = batches.drainAll();
        for (String eventId : remaining) {
            processor.processClaimed(eventId);
        }
        if (!remaining.isEmpty()) {
            logger.log(Level.INFO, "Flushed {0} batched events on shutdown", remaining.size());
        }

        scheduler.shutdownNow();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        logger.log(Level.INFO, "Event publisher stopped");
    }

    private static void closeQuietly(AutoCloseable closeable, String name) {
        if (closeable == null) {
            return;
        }
        try {
            closeable.close();
        } catch (Exception e) {
            logger.log(Level.SEVERE, "Failed to stop " + name, e);
        }
    }

    /**
     * Builder for {@link EventPublisher}.
     */
    public static final class Builder {
        private EventStore store;
        private HandlerRegistry registry;
        private DeliveryConfig defaultConfig;
        private MetricsExporter metrics;
        private InFlightTracker inFlightTracker;
        private final List<EventInterceptor> interceptors = new ArrayList<>();
        private int workerCount = 4;
        private Duration lowPriorityDelay = Duration.ofMillis(100);
        private Duration batchWindow = Duration.ofSeconds(5);
        private int batchMaxSize = 10;
        private boolean sweepEnabled = true;
        private Duration sweepInterval = Duration.ofSeconds(5);
        private int sweepBatchSize = 50;
        private Duration processingTimeout = Duration.ofMinutes(5);
        private boolean purgeEnabled = true;
        private Duration purgeInterval = Duration.ofHours(1);
        private Duration purgeRetention = Duration.ofDays(7);
        private Duration shutdownTimeout = Duration.ofSeconds(30);

        private Builder() {
        }

        /**
         * Sets the store that holds event records.
         *
         * <p><b>Required.</b>
         *
         * @param store the event store
         * @return this builder
         */
        public Builder store(EventStore store) {
            this.store = store;
            return this;
        }

        /**
         * Sets the registry events are dispatched to.
         *
         * <p><b>Required.</b>
         *
         * @param registry the handler registry
         * @return this builder
         */
        public Builder registry(HandlerRegistry registry) {
            this.registry = registry;
            return this;
        }

        /**
         * Sets the configuration used by {@link EventPublisher#publish(EventEnvelope)}.
         *
         * <p>Optional. Defaults to {@link DeliveryConfig#defaults()}.
         *
         * @param defaultConfig the default delivery configuration
         * @return this builder
         */
        public Builder defaultConfig(DeliveryConfig defaultConfig) {
            this.defaultConfig = defaultConfig;
            return this;
        }

        /**
         * Sets the metrics exporter.
         *
         * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
         *
         * @param metrics the metrics exporter
         * @return this builder
         */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Sets the in-flight tracker.
         *
         * <p>Optional. Defaults to a {@link DefaultInFlightTracker} without expiry.
         *
         * @param inFlightTracker the tracker
         * @return this builder
         */
        public Builder inFlightTracker(InFlightTracker inFlightTracker) {
            this.inFlightTracker = inFlightTracker;
            return this;
        }

        /**
         * Adds a dispatch interceptor. Interceptors run in the order they are added.
         *
         * @param interceptor the interceptor
         * @return this builder
         */
        public Builder interceptor(EventInterceptor interceptor) {
            this.interceptors.add(Objects.requireNonNull(interceptor, "interceptor"));
            return this;
        }

        public Builder interceptors(List<EventInterceptor> interceptors) {
            Objects.requireNonNull(interceptors, "interceptors");
            interceptors.forEach(this::interceptor);
            return this;
        }

        /**
         * Sets the number of worker threads for async and batch dispatch.
         *
         * <p>Optional. Defaults to {@code 4}. Must be &gt; 0.
         *
         * @param workerCount worker threads
         * @return this builder
         */
        public Builder workerCount(int workerCount) {
            this.workerCount = workerCount;
            return this;
        }

        /**
         * Sets the scheduling delay applied to {@link Priority#LOW} async events.
         *
         * <p>Optional. Defaults to 100 ms.
         *
         * @param lowPriorityDelay the delay
         * @return this builder
         */
        public Builder lowPriorityDelay(Duration lowPriorityDelay) {
            this.lowPriorityDelay = lowPriorityDelay;
            return this;
        }

        /**
         * Sets how long a batch stays open after its first event.
         *
         * <p>Optional. Defaults to 5 seconds.
         *
         * @param batchWindow the batch window
         * @return this builder
         */
        public Builder batchWindow(Duration batchWindow) {
            this.batchWindow = batchWindow;
            return this;
        }

        /**
         * Sets the batch size that triggers an immediate flush.
         *
         * <p>Optional. Defaults to {@code 10}.
         *
         * @param batchMaxSize the size ceiling
         * @return this builder
         */
        public Builder batchMaxSize(int batchMaxSize) {
            this.batchMaxSize = batchMaxSize;
            return this;
        }

        public Builder sweepEnabled(boolean sweepEnabled) {
            this.sweepEnabled = sweepEnabled;
            return this;
        }

        /**
         * Sets the pause between sweeps.
         *
         * <p>Optional. Defaults to 5 seconds.
         *
         * @param sweepInterval the sweep interval
         * @return this builder
         */
        public Builder sweepInterval(Duration sweepInterval) {
            this.sweepInterval = sweepInterval;
            return this;
        }

        /**
         * Sets the maximum number of pending records fetched per sweep.
         *
         * <p>Optional. Defaults to {@code 50}.
         *
         * @param sweepBatchSize records per sweep
         * @return this builder
         */
        public Builder sweepBatchSize(int sweepBatchSize) {
            this.sweepBatchSize = sweepBatchSize;
            return this;
        }

        /**
         * Sets how long an event may stay {@code PROCESSING} before a sweep returns it to
         * {@code PENDING}, recovering events left behind by a crashed process.
         *
         * <p>Optional. Defaults to 5 minutes.
         *
         * @param processingTimeout stale-claim timeout
         * @return this builder
         */
        public Builder processingTimeout(Duration processingTimeout) {
            this.processingTimeout = processingTimeout;
            return this;
        }

        public Builder purgeEnabled(boolean purgeEnabled) {
            this.purgeEnabled = purgeEnabled;
            return this;
        }

        /**
         * Sets the pause between purge cycles.
         *
         * <p>Optional. Defaults to 1 hour.
         *
         * @param purgeInterval the purge interval
         * @return this builder
         */
        public Builder purgeInterval(Duration purgeInterval) {
            this.purgeInterval = purgeInterval;
            return this;
        }

        /**
         * Sets how long completed and dead-letter records are kept.
         *
         * <p>Optional. Defaults to 7 days.
         *
         * @param purgeRetention the retention period
         * @return this builder
         */
        public Builder purgeRetention(Duration purgeRetention) {
            this.purgeRetention = purgeRetention;
            return this;
        }

        /**
         * Sets how long {@link EventPublisher#close()} waits for detached dispatches.
         *
         * <p>Optional. Defaults to 30 seconds.
         *
         * @param shutdownTimeout the grace period
         * @return this builder
         */
        public Builder shutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
            return this;
        }

        public EventPublisher build() {
            return new EventPublisher(this);
        }
    }
}
