package eventbus.handler;

import eventbus.EventEnvelope;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HandlerInvokerTest {

    private final ExecutorService executor = Executors.newCachedThreadPool();
    private final EventEnvelope event = EventEnvelope.of("PlantWatered", Map.of("plantId", "p-1"));

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private HandlerInvoker invoker(eventbus.EventHandler handler, HandlerOptions options) {
        return new HandlerInvoker("h1", "PlantWatered", handler, options, executor);
    }

    @Test
    void successRecordsStats() {
        HandlerInvoker invoker = invoker(e -> { }, HandlerOptions.defaults());

        HandlerExecutionResult result = invoker.execute(event);

        assertTrue(result.success());
        assertNull(result.errorKind());
        assertEquals(0, result.retriesUsed());
        assertEquals(1, invoker.stats().total());
        assertEquals(1.0, invoker.stats().successRate());
    }

    @Test
    void retriesThenSucceeds() {
        AtomicInteger calls = new AtomicInteger();
        HandlerOptions options = HandlerOptions.builder()
                .retryCount(3)
                .retryBaseDelay(Duration.ofMillis(5))
                .build();
        HandlerInvoker invoker = invoker(e -> {
            if (calls.incrementAndGet() < 3) {
                throw new IllegalStateException("flaky");
            }
        }, options);

        HandlerExecutionResult result = invoker.execute(event);

        assertTrue(result.success());
        assertEquals(3, calls.get());
        assertEquals(2, result.retriesUsed());
    }

    @Test
    void exhaustedRetriesReportHandlerError() {
        AtomicInteger calls = new AtomicInteger();
        HandlerOptions options = HandlerOptions.builder()
                .retryCount(2)
                .retryBaseDelay(Duration.ofMillis(1))
                .build();
        HandlerInvoker invoker = invoker(e -> {
            calls.incrementAndGet();
            throw new IllegalStateException("boom");
        }, options);

        HandlerExecutionResult result = invoker.execute(event);

        assertFalse(result.success());
        assertEquals(ErrorKind.HANDLER_ERROR, result.errorKind());
        assertTrue(result.errorMessage().contains("boom"));
        assertEquals(3, calls.get());
        assertEquals(1, invoker.stats().failed());
        assertEquals(result.errorMessage(), invoker.stats().lastError());
    }

    @Test
    void timeoutCancelsHandler() {
        HandlerOptions options = HandlerOptions.builder()
                .retryCount(0)
                .timeout(Duration.ofMillis(50))
                .build();
        HandlerInvoker invoker = invoker(e -> Thread.sleep(5_000), options);

        HandlerExecutionResult result = invoker.execute(event);

        assertFalse(result.success());
        assertEquals(ErrorKind.TIMEOUT, result.errorKind());
    }

    @Test
    void rateLimitRejectsWithoutInvokingHandler() {
        AtomicInteger calls = new AtomicInteger();
        HandlerOptions options = HandlerOptions.builder().rateLimitPerMinute(1).build();
        HandlerInvoker invoker = invoker(e -> calls.incrementAndGet(), options);

        HandlerExecutionResult first = invoker.execute(event);
        HandlerExecutionResult second = invoker.execute(event);

        assertTrue(first.success());
        assertFalse(second.success());
        assertEquals(ErrorKind.RATE_LIMITED, second.errorKind());
        assertEquals(1, calls.get());
        assertEquals(2, invoker.stats().total());
        assertEquals(1, invoker.stats().successful());
        assertEquals(1, invoker.stats().failed());
    }

    @Test
    void ignoredRateLimitRejectionIsUncounted() {
        HandlerOptions options = HandlerOptions.builder()
                .rateLimitPerMinute(1)
                .ignoreErrors(true)
                .build();
        HandlerInvoker invoker = invoker(e -> { }, options);

        invoker.execute(event);
        invoker.execute(event);

        assertEquals(2, invoker.stats().total());
        assertEquals(1, invoker.stats().successful());
        assertEquals(0, invoker.stats().failed());
    }

    @Test
    void executeOrThrowMapsErrorKind() {
        HandlerOptions options = HandlerOptions.builder().retryCount(0).build();
        HandlerInvoker invoker = invoker(e -> {
            throw new IllegalStateException("boom");
        }, options);

        HandlerException e = assertThrows(HandlerException.class, () -> invoker.executeOrThrow(event));

        assertInstanceOf(HandlerExecutionException.class, e);
        assertEquals("h1", e.handlerId());
        assertEquals("PlantWatered", e.eventType());
        assertEquals(ErrorKind.HANDLER_ERROR, e.errorKind());
    }

    @Test
    void metricsSnapshot() {
        HandlerInvoker invoker = invoker(e -> { }, HandlerOptions.defaults());
        invoker.execute(event);
        invoker.execute(event);

        HandlerMetrics metrics = invoker.metrics();

        assertEquals("h1", metrics.handlerId());
        assertEquals(2, metrics.totalExecutions());
        assertEquals(2, metrics.recentResults().size());
    }
}
