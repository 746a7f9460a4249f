package eventbus.model;

import eventbus.EventEnvelope;
import eventbus.handler.HandlerExecutionResult;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Persisted state of a published event.
 *
 * <p>Instances are immutable; every change produces a copy. {@link #transitionTo} appends to the
 * transition log and maintains the lifecycle timestamps.
 *
 * @param envelope            the event
 * @param config              its delivery configuration
 * @param status              current status
 * @param createdAt           when the event was accepted
 * @param processingStartedAt start of the most recent processing attempt, may be {@code null}
 * @param completedAt         set once, when the event first completes
 * @param nextAttemptAt       when a {@link EventStatus#RETRYING} record becomes pending again
 * @param retryCount          event-level retries performed
 * @param lastError           most recent failure, may be {@code null}
 * @param handlerResults      results of the most recent dispatch, keyed by handler id
 * @param transitions         every status entered, oldest first
 */
public record EventRecord(
        EventEnvelope envelope,
        DeliveryConfig config,
        EventStatus status,
        Instant createdAt,
        Instant processingStartedAt,
        Instant completedAt,
        Instant nextAttemptAt,
        int retryCount,
        String lastError,
        Map<String, HandlerExecutionResult> handlerResults,
        List<StatusTransition> transitions) {

    public EventRecord {
        Objects.requireNonNull(envelope, "envelope");
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(createdAt, "createdAt");
        if (retryCount < 0) {
            throw new IllegalArgumentException("retryCount must be >= 0");
        }
        handlerResults = handlerResults == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(handlerResults));
        transitions = transitions == null ? List.of() : List.copyOf(transitions);
    }

    /**
     * Creates a new {@link EventStatus#PENDING} record.
     *
     * @param envelope the event
     * @param config   the delivery configuration
     * @param now      acceptance time
     * @return the record
     */
    public static EventRecord pending(EventEnvelope envelope, DeliveryConfig config, Instant now) {
        return new EventRecord(envelope, config, EventStatus.PENDING, now, null, null, null, 0, null,
                Map.of(), List.of(new StatusTransition(EventStatus.PENDING, now, null)));
    }

    public String eventId() {
        return envelope.eventId();
    }

    public String eventType() {
        return envelope.eventType();
    }

    /**
     * Returns a copy in {@code target} status. Re-applying the current status returns this record
     * unchanged. The transition edge is not validated here.
     *
     * @param target the new status
     * @param at     transition time
     * @param error  failure that caused the transition, may be {@code null}
     * @return the updated record
     */
    public EventRecord transitionTo(EventStatus target, Instant at, String error) {
        Objects.requireNonNull(target, "target");
        if (target == status) {
            return this;
        }
        List<StatusTransition> log = new ArrayList<>(transitions);
        log.add(new StatusTransition(target, at, error));
        Instant started = target == EventStatus.PROCESSING ? at : processingStartedAt;
        Instant completed = target == EventStatus.COMPLETED && completedAt == null ? at : completedAt;
        Instant next = target == EventStatus.RETRYING ? nextAttemptAt : null;
        String lastErr = error != null ? error : lastError;
        return new EventRecord(envelope, config, target, createdAt, started, completed, next, retryCount,
                lastErr, handlerResults, log);
    }

    public EventRecord withRetryCount(int retryCount) {
        return new EventRecord(envelope.withRetryCount(retryCount), config, status, createdAt,
                processingStartedAt, completedAt, nextAttemptAt, retryCount, lastError, handlerResults,
                transitions);
    }

    public EventRecord withNextAttemptAt(Instant nextAttemptAt) {
        return new EventRecord(envelope, config, status, createdAt, processingStartedAt, completedAt,
                nextAttemptAt, retryCount, lastError, handlerResults, transitions);
    }

    public EventRecord withHandlerResults(Map<String, HandlerExecutionResult> handlerResults) {
        return new EventRecord(envelope, config, status, createdAt, processingStartedAt, completedAt,
                nextAttemptAt, retryCount, lastError, handlerResults, transitions);
    }

    public EventRecord withEnvelope(EventEnvelope envelope) {
        return new EventRecord(envelope, config, status, createdAt, processingStartedAt, completedAt,
                nextAttemptAt, retryCount, lastError, handlerResults, transitions);
    }
}
