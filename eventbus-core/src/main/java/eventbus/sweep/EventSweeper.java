package eventbus.sweep;

import eventbus.model.EventRecord;
import eventbus.model.EventStatus;
import eventbus.spi.EventStore;
import eventbus.spi.MetricsExporter;
import eventbus.util.DaemonThreadFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scheduled scanner that hands pending records to a {@link PendingEventHandler}.
 *
 * <p>Each sweep first returns {@code PROCESSING} records to {@code PENDING} when their processing
 * started more than {@code processingTimeout} ago and the handler no longer has them in flight
 * (a crashed process or a lost status write leaves such records behind). It then moves
 * {@code RETRYING} records whose next attempt is due back to {@code PENDING}, then fetches up to {@code batchSize} pending records, oldest first, and offers
 * each to the handler. The handler rejects records that are already in flight, so overlapping
 * sweeps never dispatch a record twice.
 *
 * <p>Create instances via {@link #builder()}.
 *
 * <p>This class is thread-safe. The {@link #start()} and {@link #close()} methods are
 * synchronized to prevent concurrent lifecycle transitions.
 *
 * @see EventSweeper.Builder
 */
public final class EventSweeper implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(EventSweeper.class.getName());

    private final EventStore store;
    private final PendingEventHandler handler;
    private final int batchSize;
    private final long intervalMs;
    private final Duration processingTimeout;
    private final MetricsExporter metrics;

    private ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> sweepTask;
    private volatile boolean closed;
    private volatile Instant lastSweepAt;

    private EventSweeper(Builder builder) {
        this.store = Objects.requireNonNull(builder.store, "store");
        this.handler = Objects.requireNonNull(builder.handler, "handler");
        if (builder.batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        Objects.requireNonNull(builder.interval, "interval");
        if (builder.interval.isZero() || builder.interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive");
        }
        Objects.requireNonNull(builder.processingTimeout, "processingTimeout");
        if (builder.processingTimeout.isZero() || builder.processingTimeout.isNegative()) {
            throw new IllegalArgumentException("processingTimeout must be positive");
        }
        this.processingTimeout = builder.processingTimeout;
        this.batchSize = builder.batchSize;
        this.intervalMs = builder.interval.toMillis();
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts the scheduled sweep loop. Subsequent calls are no-ops if already started.
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("EventSweeper has been closed");
        }
        if (sweepTask != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("eventbus-sweep-"));
        sweepTask = scheduler.scheduleWithFixedDelay(this::sweep, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Executes a single sweep. Called automatically by the scheduler, but may also be invoked directly.
     */
    public void sweep() {
        if (closed) {
            return;
        }
        try {
            Instant now = Instant.now();
            int recovered = recoverStaleProcessing(now);
            int reactivated = reactivateDueRetries(now);
            List<EventRecord> pending = store.listPending(batchSize);
            lastSweepAt = now;
            if (pending.isEmpty()) {
                metrics.recordOldestPendingLagMs(0);
                return;
            }
            long lagMs = Duration.between(pending.get(0).createdAt(), now).toMillis();
            metrics.recordOldestPendingLagMs(Math.max(0L, lagMs));

            int accepted = 0;
            for (EventRecord record : pending) {
                if (handler.handle(record)) {
                    accepted++;
                }
            }
            logger.log(Level.FINE, "Sweep accepted {0} of {1} pending events ({2} re-activated, {3} recovered)",
                    new Object[]{accepted, pending.size(), reactivated, recovered});
        } catch (Throwable t) {
            logger.log(Level.SEVERE, "Sweep cycle failed", t);
        }
    }

    private int recoverStaleProcessing(Instant now) {
        int count = 0;
        for (EventRecord record : store.listStaleProcessing(now.minus(processingTimeout), batchSize)) {
            if (handler.isInFlight(record.eventId())) {
                continue;
            }
            EventRecord pending = record.transitionTo(EventStatus.PENDING, now,
                    "Processing not finished within " + processingTimeout);
            if (store.compareAndSet(record.eventId(), EventStatus.PROCESSING, pending)) {
                logger.log(Level.WARNING, "Recovered stale PROCESSING event {0}", record.eventId());
                count++;
            }
        }
        return count;
    }

    private int reactivateDueRetries(Instant now) {
        int count = 0;
        for (EventRecord record : store.listRetryDue(now, batchSize)) {
            EventRecord pending = record.transitionTo(EventStatus.PENDING, now, null);
            if (store.compareAndSet(record.eventId(), EventStatus.RETRYING, pending)) {
                count++;
            }
        }
        return count;
    }

    public boolean isRunning() {
        return sweepTask != null && !closed;
    }

    /**
     * Returns the start time of the last sweep that reached the store.
     *
     * @return the time, or {@code null} before the first sweep
     */
    public Instant lastSweepAt() {
        return lastSweepAt;
    }

    /**
     * Cancels the sweep schedule and shuts down the scheduler thread.
     */
    @Override
    public synchronized void close() {
        closed = true;
        if (sweepTask != null) {
            sweepTask.cancel(false);
            sweepTask = null;
        }
        if (scheduler != null) {
            scheduler.shutdownNow();
            try {
                scheduler.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Builder for {@link EventSweeper}.
     */
    public static final class Builder {
        private EventStore store;
        private PendingEventHandler handler;
        private int batchSize = 50;
        private Duration interval = Duration.ofSeconds(5);
        private Duration processingTimeout = Duration.ofMinutes(5);
        private MetricsExporter metrics;

        private Builder() {
        }

        /**
         * Sets the store to scan.
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
         * Sets the handler that receives pending records.
         *
         * <p><b>Required.</b>
         *
         * @param handler the pending-event handler
         * @return this builder
         */
        public Builder handler(PendingEventHandler handler) {
            this.handler = handler;
            return this;
        }

        /**
         * Sets the maximum number of records fetched per sweep.
         *
         * <p>Optional. Defaults to {@code 50}. Must be &gt; 0.
         *
         * @param batchSize max records per sweep
         * @return this builder
         */
        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        /**
         * Sets the pause between sweeps.
         *
         * <p>Optional. Defaults to 5 seconds. Must be positive.
         *
         * @param interval sweep interval
         * @return this builder
         */
        public Builder interval(Duration interval) {
            this.interval = interval;
            return this;
        }

        /**
         * Sets how long a record may stay {@code PROCESSING} before a sweep returns it to
         * {@code PENDING}. Records still in flight in this process are never reclaimed.
         *
         * <p>Optional. Defaults to 5 minutes. Must be positive and longer than the slowest
         * expected dispatch.
         *
         * @param processingTimeout stale-claim timeout
         * @return this builder
         */
        public Builder processingTimeout(Duration processingTimeout) {
            this.processingTimeout = processingTimeout;
            return this;
        }

        /**
         * Sets the metrics exporter for the oldest-pending lag gauge.
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

        public EventSweeper build() {
            return new EventSweeper(this);
        }
    }
}
