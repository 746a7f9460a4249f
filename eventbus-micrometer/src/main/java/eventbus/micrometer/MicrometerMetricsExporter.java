package eventbus.micrometer;

import eventbus.model.DeliveryMode;
import eventbus.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters, gauges and distribution summaries with a {@link MeterRegistry} for export
 * to Prometheus, Grafana, Datadog, and other monitoring backends.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code eventbus.published} (tag {@code mode}): events accepted by the publisher</li>
 *   <li>{@code eventbus.dispatch.success}: dispatches in which every counted handler succeeded</li>
 *   <li>{@code eventbus.dispatch.failure}: failed dispatches</li>
 *   <li>{@code eventbus.retry.scheduled}: event-level retries scheduled</li>
 *   <li>{@code eventbus.dead.letter}: events moved to DEAD_LETTER</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code eventbus.inflight}: events currently being dispatched</li>
 *   <li>{@code eventbus.batch.events}: events waiting in batch accumulators</li>
 *   <li>{@code eventbus.lag.oldest.ms}: age of the oldest pending event seen by the sweep</li>
 * </ul>
 *
 * <h3>Distribution summaries</h3>
 * <ul>
 *   <li>{@code eventbus.handler.duration.ms} (tag {@code handler}): handler execution time</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {
  public static final String DEFAULT_PREFIX = "eventbus";

  private final MeterRegistry registry;
  private final String namePrefix;
  private final Map<DeliveryMode, Counter> published = new EnumMap<>(DeliveryMode.class);
  private final Counter dispatchSuccess;
  private final Counter dispatchFailure;
  private final Counter retryScheduled;
  private final Counter deadLettered;
  private final Gauge inFlightGauge;
  private final Gauge batchedGauge;
  private final Gauge lagGauge;
  private final Map<String, DistributionSummary> handlerDurations = new ConcurrentHashMap<>();

  private final AtomicInteger inFlight = new AtomicInteger();
  private final AtomicInteger batchedEvents = new AtomicInteger();
  private final AtomicLong oldestLagMs = new AtomicLong();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "eventbus"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, DEFAULT_PREFIX);
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "orders.eventbus"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.namePrefix = namePrefix;
    for (DeliveryMode mode : DeliveryMode.values()) {
      published.put(mode, Counter.builder(namePrefix + ".published")
          .description("Events accepted by the publisher")
          .tag("mode", mode.name().toLowerCase(Locale.ROOT))
          .register(registry));
    }
    this.dispatchSuccess = Counter.builder(namePrefix + ".dispatch.success")
        .description("Dispatches in which every counted handler succeeded")
        .register(registry);
    this.dispatchFailure = Counter.builder(namePrefix + ".dispatch.failure")
        .description("Failed dispatches")
        .register(registry);
    this.retryScheduled = Counter.builder(namePrefix + ".retry.scheduled")
        .description("Event-level retries scheduled")
        .register(registry);
    this.deadLettered = Counter.builder(namePrefix + ".dead.letter")
        .description("Events moved to DEAD_LETTER")
        .register(registry);

    this.inFlightGauge = Gauge.builder(namePrefix + ".inflight", inFlight, AtomicInteger::get)
        .register(registry);
    this.batchedGauge = Gauge.builder(namePrefix + ".batch.events", batchedEvents, AtomicInteger::get)
        .register(registry);
    this.lagGauge = Gauge.builder(namePrefix + ".lag.oldest.ms", oldestLagMs, AtomicLong::get)
        .register(registry);
  }

  @Override
  public void incrementPublished(DeliveryMode mode) {
    if (closed) return;
    published.get(mode).increment();
  }

  @Override
  public void incrementDispatchSuccess() {
    if (closed) return;
    dispatchSuccess.increment();
  }

  @Override
  public void incrementDispatchFailure() {
    if (closed) return;
    dispatchFailure.increment();
  }

  @Override
  public void incrementRetryScheduled() {
    if (closed) return;
    retryScheduled.increment();
  }

  @Override
  public void incrementDeadLettered() {
    if (closed) return;
    deadLettered.increment();
  }

  @Override
  public void recordHandlerDurationMs(String handlerId, long durationMs) {
    if (closed) return;
    handlerDurations.computeIfAbsent(handlerId, id -> DistributionSummary
            .builder(namePrefix + ".handler.duration.ms")
            .description("Handler execution time in milliseconds")
            .baseUnit("milliseconds")
            .tag("handler", id)
            .register(registry))
        .record(durationMs);
  }

  @Override
  public void recordInFlight(int count) {
    if (closed) return;
    inFlight.set(count);
  }

  @Override
  public void recordBatchedEvents(int count) {
    if (closed) return;
    batchedEvents.set(count);
  }

  @Override
  public void recordOldestPendingLagMs(long lagMs) {
    if (closed) return;
    oldestLagMs.set(lagMs);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Call this when the exporter is no longer needed (e.g. when the
   * {@link eventbus.publisher.EventPublisher} is closed) to prevent stale gauges.
   */
  @Override
  public void close() {
    closed = true;
    List<Meter> meters = new ArrayList<>(published.values());
    meters.addAll(List.of(dispatchSuccess, dispatchFailure, retryScheduled, deadLettered,
        inFlightGauge, batchedGauge, lagGauge));
    meters.addAll(handlerDurations.values());
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    handlerDurations.clear();
    if (first != null) throw first;
  }
}
