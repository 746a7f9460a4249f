package eventbus.publisher;

import eventbus.EventEnvelope;
import eventbus.handler.HandlerExecutionResult;
import eventbus.model.DeliveryMode;
import eventbus.model.EventRecord;
import eventbus.model.EventStatus;
import eventbus.registry.DispatchOutcome;
import eventbus.registry.HandlerRegistry;
import eventbus.retry.RetryDecision;
import eventbus.spi.EventStore;
import eventbus.spi.MetricsExporter;
import eventbus.sweep.PendingEventHandler;
import eventbus.util.TaskTracker;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drives one event through the status state machine.
 *
 * <p>Processing claims a {@code PENDING} record with a compare-and-set to {@code PROCESSING},
 * dispatches it through the interceptors and the registry, then moves it to {@code COMPLETED}
 * or applies the retry policy: {@code FAILED -> RETRYING} with a deferred re-activation, or
 * {@code FAILED -> DEAD_LETTER} (or terminal {@code FAILED}) once retries are exhausted.
 *
 * <p>Callers must hold the event's in-flight token; {@link #processClaimed} releases it.
 */
final class EventProcessor implements PendingEventHandler {
    private static final Logger logger = Logger.getLogger(EventProcessor.class.getName());

    private final EventStore store;
    private final HandlerRegistry registry;
    private final MetricsExporter metrics;
    private final InFlightTracker inFlight;
    private final List<EventInterceptor> interceptors;
    private final ExecutorService workers;
    private final ScheduledExecutorService scheduler;
    private final TaskTracker tasks;

    private final AtomicLong processed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private volatile Instant lastProcessingTime = Instant.now();

    EventProcessor(EventStore store, HandlerRegistry registry, MetricsExporter metrics,
                   InFlightTracker inFlight, List<EventInterceptor> interceptors,
                   ExecutorService workers, ScheduledExecutorService scheduler, TaskTracker tasks) {
        this.store = store;
        this.registry = registry;
        this.metrics = metrics;
        this.inFlight = inFlight;
        this.interceptors = List.copyOf(interceptors);
        this.workers = workers;
        this.scheduler = scheduler;
        this.tasks = tasks;
    }

    @Override
    public boolean handle(EventRecord record) {
        return submit(record.eventId(), 0L);
    }

    @Override
    public boolean isInFlight(String eventId) {
        return inFlight.isInFlight(eventId);
    }

    /**
     * Claims the event's in-flight token and processes it on a worker after {@code delayMs}.
     *
     * @return {@code false} if the event is already in flight
     */
    boolean submit(String eventId, long delayMs) {
        if (!inFlight.tryAcquire(eventId)) {
            return false;
        }
        submitClaimed(eventId, delayMs);
        return true;
    }

    /**
     * Processes an event whose in-flight token the caller already holds, on a worker thread.
     */
    void submitClaimed(String eventId, long delayMs) {
        metrics.recordInFlight(inFlight.size());
        CompletableFuture<Void> task = tasks.track(new CompletableFuture<>());
        Runnable run = () -> {
            try {
                processClaimed(eventId);
            } finally {
                task.complete(null);
            }
        };
        try {
            if (delayMs > 0) {
                scheduler.schedule(() -> execute(eventId, run, task), delayMs, TimeUnit.MILLISECONDS);
            } else {
                execute(eventId, run, task);
            }
        } catch (RejectedExecutionException e) {
            rejected(eventId, task, e);
        }
    }

    private void execute(String eventId, Runnable run, CompletableFuture<Void> task) {
        try {
            workers.execute(run);
        } catch (RejectedExecutionException e) {
            rejected(eventId, task, e);
        }
    }

    private void rejected(String eventId, CompletableFuture<Void> task, RejectedExecutionException e) {
        inFlight.release(eventId);
        task.completeExceptionally(e);
        logger.log(Level.WARNING, "Worker pool rejected event {0}; it stays PENDING for the sweep", eventId);
    }

    /**
     * Processes an event on the calling thread and releases its in-flight token.
     */
    void processClaimed(String eventId) {
        try {
            process(eventId);
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Processing failed for event " + eventId, e);
        } finally {
            inFlight.release(eventId);
            metrics.recordInFlight(inFlight.size());
        }
    }

    private boolean process(String eventId) {
        Optional<EventRecord> current = store.get(eventId);
        if (current.isEmpty() || current.get().status() != EventStatus.PENDING) {
            return false;
        }
        Instant now = Instant.now();
        EventRecord processing = current.get().transitionTo(EventStatus.PROCESSING, now, null);
        if (!store.compareAndSet(eventId, EventStatus.PENDING, processing)) {
            logger.log(Level.FINE, "Event {0} was claimed concurrently", eventId);
            return false;
        }
        lastProcessingTime = now;
        dispatch(processing);
        return true;
    }

    private void dispatch(EventRecord processing) {
        EventEnvelope event = processing.envelope();
        Exception error = null;
        Map<String, HandlerExecutionResult> results = Map.of();
        int entered = 0;
        try {
            for (EventInterceptor interceptor : interceptors) {
                interceptor.beforeDispatch(event);
                entered++;
            }
            DispatchOutcome outcome = registry.dispatch(event);
            results = outcome.results();
            error = outcome.toException();
        } catch (Exception e) {
            error = e;
        }
        for (int i = entered - 1; i >= 0; i--) {
            try {
                interceptors.get(i).afterDispatch(event, error);
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "afterDispatch interceptor failed for event " + event.eventId(), e);
            }
        }

        EventRecord withResults = processing.withHandlerResults(results);
        if (error == null) {
            complete(withResults);
        } else {
            failed.incrementAndGet();
            metrics.incrementDispatchFailure();
            handleFailure(withResults, describe(error));
        }
    }

    private void complete(EventRecord record) {
        EventRecord done = record.transitionTo(EventStatus.COMPLETED, Instant.now(), null);
        if (store.compareAndSet(record.eventId(), EventStatus.PROCESSING, done)) {
            processed.incrementAndGet();
            metrics.incrementDispatchSuccess();
            logger.log(Level.FINE, "Event {0} completed", record.eventId());
        } else {
            logger.log(Level.WARNING, "Event {0} changed status while processing; completion dropped",
                    record.eventId());
        }
    }

    private void handleFailure(EventRecord record, String error) {
        Instant now = Instant.now();
        int retryNumber = record.retryCount() + 1;
        EventRecord failedRecord = record.withRetryCount(retryNumber).transitionTo(EventStatus.FAILED, now, error);
        RetryDecision decision = record.config().retryPolicy().decide(retryNumber);

        if (decision instanceof RetryDecision.Retry retry) {
            EventRecord retrying = failedRecord.transitionTo(EventStatus.RETRYING, now, null)
                    .withNextAttemptAt(now.plusMillis(retry.delayMs()));
            if (store.compareAndSet(record.eventId(), EventStatus.PROCESSING, retrying)) {
                metrics.incrementRetryScheduled();
                logger.log(Level.INFO, "Event {0} failed (retry {1}/{2}), retrying in {3} ms: {4}",
                        new Object[]{record.eventId(), retryNumber, record.config().maxRetries(),
                                retry.delayMs(), error});
                scheduleReactivation(record.eventId(), retry.delayMs());
            }
        } else if (record.config().deadLetterEnabled()) {
            EventRecord dead = failedRecord.transitionTo(EventStatus.DEAD_LETTER, now, null);
            if (store.compareAndSet(record.eventId(), EventStatus.PROCESSING, dead)) {
                metrics.incrementDeadLettered();
                logger.log(Level.SEVERE, "Event {0} ({1}) moved to dead letter after {2} attempts: {3}",
                        new Object[]{record.eventId(), record.eventType(), retryNumber, error});
            }
        } else if (store.compareAndSet(record.eventId(), EventStatus.PROCESSING, failedRecord)) {
            logger.log(Level.SEVERE, "Event {0} ({1}) failed permanently after {2} attempts: {3}",
                    new Object[]{record.eventId(), record.eventType(), retryNumber, error});
        }
    }

    private void scheduleReactivation(String eventId, long delayMs) {
        try {
            scheduler.schedule(() -> reactivate(eventId), delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            logger.log(Level.FINE, "Scheduler stopped; event {0} stays RETRYING for the sweep", eventId);
        }
    }

    /**
     * Moves a due {@code RETRYING} record back to {@code PENDING} and, unless it was published in
     * persistent mode, processes it right away. Persistent events wait for the sweep.
     */
    void reactivate(String eventId) {
        try {
            Optional<EventRecord> current = store.get(eventId);
            if (current.isEmpty() || current.get().status() != EventStatus.RETRYING) {
                return;
            }
            EventRecord record = current.get();
            EventRecord pending = record.transitionTo(EventStatus.PENDING, Instant.now(), null);
            if (!store.compareAndSet(eventId, EventStatus.RETRYING, pending)) {
                return;
            }
            if (record.config().mode() != DeliveryMode.PERSISTENT) {
                submit(eventId, 0L);
            }
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to re-activate event " + eventId, e);
        }
    }

    long processedCount() {
        return processed.get();
    }

    long failedCount() {
        return failed.get();
    }

    Instant lastProcessingTime() {
        return lastProcessingTime;
    }

    private static String describe(Exception error) {
        String message = error.getMessage();
        return message == null ? error.getClass().getName() : message;
    }
}
