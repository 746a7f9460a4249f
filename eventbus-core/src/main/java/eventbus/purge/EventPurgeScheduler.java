package eventbus.purge;

import eventbus.spi.EventStore;
import eventbus.util.DaemonThreadFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scheduled component that deletes completed and dead-letter records older than a retention
 * period, using {@link EventStore#cleanup}.
 *
 * <p>Modeled after {@link eventbus.sweep.EventSweeper}: builder pattern, {@link AutoCloseable},
 * daemon threads, synchronized lifecycle.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class EventPurgeScheduler implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(EventPurgeScheduler.class.getName());

  private final EventStore store;
  private final Duration retention;
  private final long intervalMs;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> purgeTask;
  private volatile boolean closed;

  private EventPurgeScheduler(Builder builder) {
    this.store = Objects.requireNonNull(builder.store, "store");
    Objects.requireNonNull(builder.retention, "retention");
    Objects.requireNonNull(builder.interval, "interval");
    if (builder.retention.isNegative()) {
      throw new IllegalArgumentException("retention must be >= 0");
    }
    if (builder.interval.isZero() || builder.interval.isNegative()) {
      throw new IllegalArgumentException("interval must be positive");
    }
    this.retention = builder.retention;
    this.intervalMs = builder.interval.toMillis();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the scheduled purge loop. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("EventPurgeScheduler has been closed");
    }
    if (purgeTask != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("eventbus-purge-"));
    purgeTask = scheduler.scheduleWithFixedDelay(this::runOnce, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Executes a single purge cycle. May be invoked directly for testing or one-off purges.
   *
   * @return number of deleted records, 0 if the cycle failed
   */
  public int runOnce() {
    if (closed) {
      return 0;
    }
    try {
      Instant cutoff = Instant.now().minus(retention);
      int deleted = store.cleanup(cutoff);
      if (deleted > 0) {
        logger.log(Level.INFO, "Purged {0} terminal events older than {1}", new Object[]{deleted, cutoff});
      }
      return deleted;
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Purge cycle failed", t);
      return 0;
    }
  }

  public boolean isRunning() {
    return purgeTask != null && !closed;
  }

  /** Cancels the purge schedule and shuts down the scheduler thread. */
  @Override
  public synchronized void close() {
    closed = true;
    if (purgeTask != null) {
      purgeTask.cancel(false);
      purgeTask = null;
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

  /** Builder for {@link EventPurgeScheduler}. */
  public static final class Builder {
    private EventStore store;
    private Duration retention = Duration.ofDays(7);
    private Duration interval = Duration.ofHours(1);

    private Builder() {
    }

    /**
     * Sets the store to purge.
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
     * Sets how long terminal records are kept.
     *
     * <p>Optional. Defaults to 7 days. Must be &ge; 0.
     *
     * @param retention the retention period
     * @return this builder
     */
    public Builder retention(Duration retention) {
      this.retention = retention;
      return this;
    }

    /**
     * Sets the pause between purge cycles.
     *
     * <p>Optional. Defaults to 1 hour. Must be positive.
     *
     * @param interval the purge interval
     * @return this builder
     */
    public Builder interval(Duration interval) {
      this.interval = interval;
      return this;
    }

    public EventPurgeScheduler build() {
      return new EventPurgeScheduler(this);
    }
  }
}
