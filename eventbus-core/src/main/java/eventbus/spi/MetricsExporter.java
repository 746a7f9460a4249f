package eventbus.spi;

import eventbus.model.DeliveryMode;

/**
 * Observability hook for exporting event bus counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of accepted events.
     *
     * @param mode the delivery mode the event was published with
     */
    void incrementPublished(DeliveryMode mode);

    /**
     * Increments the count of dispatches in which every counted handler succeeded.
     */
    void incrementDispatchSuccess();

    /**
     * Increments the count of failed dispatches.
     */
    void incrementDispatchFailure();

    /**
     * Increments the count of event-level retries scheduled.
     */
    void incrementRetryScheduled();

    /**
     * Increments the count of events moved to DEAD_LETTER.
     */
    void incrementDeadLettered();

    /**
     * Records the time spent in one handler invocation.
     *
     * @param handlerId  the handler
     * @param durationMs execution time in milliseconds (always non-negative)
     */
    default void recordHandlerDurationMs(String handlerId, long durationMs) {
    }

    /**
     * Records how many events are currently being dispatched.
     *
     * @param count in-flight events
     */
    default void recordInFlight(int count) {
    }

    /**
     * Records how many events are waiting in batch accumulators.
     *
     * @param count batched events
     */
    default void recordBatchedEvents(int count) {
    }

    /**
     * Records the age (in milliseconds) of the oldest pending event seen by a sweep.
     *
     * @param lagMs lag in milliseconds (always non-negative)
     */
    default void recordOldestPendingLagMs(long lagMs) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementPublished(DeliveryMode mode) {
        }

        @Override
        public void incrementDispatchSuccess() {
        }

        @Override
        public void incrementDispatchFailure() {
        }

        @Override
        public void incrementRetryScheduled() {
        }

        @Override
        public void incrementDeadLettered() {
        }
    }
}
