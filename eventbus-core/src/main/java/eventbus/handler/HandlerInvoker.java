package eventbus.handler;

import eventbus.EventEnvelope;
import eventbus.EventHandler;
import eventbus.retry.RetryDecision;
import eventbus.retry.RetryPolicy;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs one registered {@link EventHandler} under its {@link HandlerOptions}.
 *
 * <p>Each {@link #execute} call:
 * <ol>
 *   <li>checks the rate limit and fails fast with {@link ErrorKind#RATE_LIMITED} without
 *       invoking the handler when the window is full</li>
 *   <li>runs the handler on the handler executor, retrying failures with doubling delays</li>
 *   <li>bounds the whole invocation, retries included, by the handler timeout and interrupts
 *       the attempt still running when it expires</li>
 *   <li>records the outcome in the handler's {@link HandlerStats}</li>
 * </ol>
 *
 * <p>Failures are returned as {@link HandlerExecutionResult}s; {@link #executeOrThrow} turns them
 * into {@link HandlerException}s for callers that want exceptions.
 *
 * <p>This class is thread-safe.
 */
public final class HandlerInvoker {
    private static final Logger logger = Logger.getLogger(HandlerInvoker.class.getName());

    private final String handlerId;
    private final String eventType;
    private final EventHandler handler;
    private final HandlerOptions options;
    private final RetryPolicy retryPolicy;
    private final SlidingWindowRateLimiter rateLimiter;
    private final HandlerStats stats;
    private final ExecutorService executor;

    public HandlerInvoker(String handlerId, String eventType, EventHandler handler,
                          HandlerOptions options, ExecutorService executor) {
        this(handlerId, eventType, handler, options, executor,
                options.isRateLimited() ? new SlidingWindowRateLimiter(options.rateLimitPerMinute()) : null);
    }

    public HandlerInvoker(String handlerId, String eventType, EventHandler handler,
                          HandlerOptions options, ExecutorService executor,
                          SlidingWindowRateLimiter rateLimiter) {
        this.handlerId = Objects.requireNonNull(handlerId, "handlerId");
        this.eventType = Objects.requireNonNull(eventType, "eventType");
        this.handler = Objects.requireNonNull(handler, "handler");
        this.options = Objects.requireNonNull(options, "options");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.retryPolicy = options.retryPolicy();
        this.rateLimiter = rateLimiter;
        this.stats = new HandlerStats();
    }

    public String handlerId() {
        return handlerId;
    }

    public String eventType() {
        return eventType;
    }

    public HandlerOptions options() {
        return options;
    }

    public HandlerStats stats() {
        return stats;
    }

    /**
     * Invokes the handler and returns a structured result. Never throws for handler failures.
     *
     * @param event the event to handle
     * @return the execution result
     */
    public HandlerExecutionResult execute(EventEnvelope event) {
        Instant startedAt = Instant.now();
        long startNanos = System.nanoTime();

        if (rateLimiter != null && !rateLimiter.tryAcquire()) {
            HandlerExecutionResult result = HandlerExecutionResult.failure(handlerId, elapsed(startNanos),
                    ErrorKind.RATE_LIMITED,
                    "Rate limit exceeded: " + rateLimiter.maxCalls() + " calls per minute", 0, startedAt);
            if (options.ignoreErrors()) {
                stats.recordUncounted(result);
            } else {
                stats.record(result);
                logger.log(Level.WARNING, "Handler {0} rate limited for event {1}",
                        new Object[]{handlerId, event.eventId()});
            }
            return result;
        }

        AtomicInteger retries = new AtomicInteger();
        HandlerExecutionResult result;
        Future<?> future = null;
        try {
            future = executor.submit(() -> {
                runWithRetries(event, retries);
                return null;
            });
            future.get(options.timeout().toMillis(), TimeUnit.MILLISECONDS);
            result = HandlerExecutionResult.success(handlerId, elapsed(startNanos), retries.get(), startedAt);
        } catch (TimeoutException e) {
            future.cancel(true);
            result = HandlerExecutionResult.failure(handlerId, elapsed(startNanos), ErrorKind.TIMEOUT,
                    "Handler timed out after " + options.timeout().toMillis() + " ms", retries.get(), startedAt);
        } catch (ExecutionException e) {
            result = HandlerExecutionResult.failure(handlerId, elapsed(startNanos), ErrorKind.HANDLER_ERROR,
                    describe(e.getCause()), retries.get(), startedAt);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            result = HandlerExecutionResult.failure(handlerId, elapsed(startNanos), ErrorKind.HANDLER_ERROR,
                    "Interrupted while waiting for handler", retries.get(), startedAt);
        } catch (RejectedExecutionException e) {
            result = HandlerExecutionResult.failure(handlerId, elapsed(startNanos), ErrorKind.HANDLER_ERROR,
                    "Handler executor rejected the task", 0, startedAt);
        }

        stats.record(result);
        if (!result.success() && !options.ignoreErrors()) {
            logger.log(Level.WARNING, "Handler {0} failed for event {1}: {2}",
                    new Object[]{handlerId, event.eventId(), result.errorMessage()});
        }
        return result;
    }

    /**
     * Invokes the handler and throws if it did not succeed.
     *
     * @param event the event to handle
     * @return the successful result
     * @throws HandlerException describing the failure
     */
    public HandlerExecutionResult executeOrThrow(EventEnvelope event) {
        HandlerExecutionResult result = execute(event);
        if (!result.success()) {
            throw HandlerException.from(result, eventType);
        }
        return result;
    }

    public HandlerMetrics metrics() {
        return new HandlerMetrics(handlerId, eventType, options.priority(), options.mode(),
                stats.total(), stats.successful(), stats.failed(), stats.successRate(), stats.averageMs(),
                stats.lastError(), stats.lastExecutionAt(), options.rateLimitPerMinute(), stats.history(10));
    }

    private void runWithRetries(EventEnvelope event, AtomicInteger retries) throws Exception {
        int attempt = 0;
        while (true) {
            try {
                handler.handle(event);
                return;
            } catch (Exception e) {
                RetryDecision decision = retryPolicy.decide(attempt + 1);
                if (!(decision instanceof RetryDecision.Retry retry)) {
                    throw e;
                }
                attempt++;
                retries.set(attempt);
                logger.log(Level.FINE, "Handler {0} attempt {1} failed, retrying in {2} ms",
                        new Object[]{handlerId, attempt, retry.delayMs()});
                Thread.sleep(retry.delayMs());
            }
        }
    }

    private static Duration elapsed(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    static String describe(Throwable t) {
        if (t == null) {
            return "unknown error";
        }
        String message = t.getMessage();
        return message == null ? t.getClass().getName() : t.getClass().getSimpleName() + ": " + message;
    }
}
