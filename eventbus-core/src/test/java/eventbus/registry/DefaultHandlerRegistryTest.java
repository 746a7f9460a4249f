package eventbus.registry;

import eventbus.EventEnvelope;
import eventbus.HealthStatus;
import eventbus.Priority;
import eventbus.handler.ErrorKind;
import eventbus.handler.HandlerException;
import eventbus.handler.HandlerMode;
import eventbus.handler.HandlerOptions;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DefaultHandlerRegistryTest {

    private final DefaultHandlerRegistry registry = new DefaultHandlerRegistry();
    private final EventEnvelope event = EventEnvelope.of("PlantWatered", Map.of("plantId", "p-1"));

    @AfterEach
    void tearDown() {
        registry.close();
    }

    private static HandlerOptions sync(String name, Priority priority) {
        return HandlerOptions.builder().name(name).mode(HandlerMode.SYNC).priority(priority).retryCount(0).build();
    }

    private static HandlerOptions async(String name, Priority priority) {
        return HandlerOptions.builder().name(name).mode(HandlerMode.ASYNC).priority(priority).retryCount(0).build();
    }

    @Test
    void syncHandlersRunInPriorityOrder() {
        List<String> calls = new CopyOnWriteArrayList<>();
        registry.register("PlantWatered", e -> calls.add("low"), sync("low", Priority.LOW));
        registry.register("PlantWatered", e -> calls.add("critical"), sync("critical", Priority.CRITICAL));
        registry.register("PlantWatered", e -> calls.add("normal"), sync("normal", Priority.NORMAL));

        DispatchOutcome outcome = registry.dispatch(event);

        assertTrue(outcome.isSuccess());
        assertEquals(List.of("critical", "normal", "low"), calls);
    }

    @Test
    void wildcardHandlersRunAfterSpecificOnesOfSamePriority() {
        List<String> calls = new CopyOnWriteArrayList<>();
        registry.registerAll(e -> calls.add("wildcard"), sync("wildcard", Priority.NORMAL));
        registry.register("PlantWatered", e -> calls.add("specific"), sync("specific", Priority.NORMAL));

        registry.dispatch(event);
        registry.dispatch(EventEnvelope.of("Other", Map.of()));

        assertEquals(List.of("specific", "wildcard", "wildcard"), calls);
    }

    @Test
    void syncHandlersRunBeforeAsyncHandlers() {
        List<String> calls = new CopyOnWriteArrayList<>();
        registry.register("PlantWatered", e -> calls.add("async"),
                HandlerOptions.builder().name("async").priority(Priority.CRITICAL).build());
        registry.register("PlantWatered", e -> calls.add("sync"), sync("sync", Priority.LOW));

        DispatchOutcome outcome = registry.dispatch(event);

        assertEquals(List.of("sync", "async"), calls);
        assertEquals(2, outcome.results().size());
    }

    @Test
    void failureIsReportedButDoesNotStopOtherHandlers() {
        List<String> calls = new CopyOnWriteArrayList<>();
        registry.register("PlantWatered", e -> {
            throw new IllegalStateException("boom");
        }, sync("failing", Priority.HIGH));
        registry.register("PlantWatered", e -> calls.add("ok"), sync("ok", Priority.LOW));

        DispatchOutcome outcome = registry.dispatch(event);

        assertFalse(outcome.isSuccess());
        assertEquals(List.of("failing"), outcome.failedHandlers());
        assertEquals(List.of("ok"), calls);
        assertTrue(outcome.errorSummary().startsWith("failing: "));
        HandlerException e = outcome.toException();
        assertEquals(ErrorKind.HANDLER_ERROR, e.errorKind());
        assertThrows(HandlerException.class, outcome::throwIfFailed);
    }

    @Test
    void ignoredErrorsDoNotFailDispatch() {
        registry.register("PlantWatered", e -> {
            throw new IllegalStateException("boom");
        }, HandlerOptions.builder().name("ignored").mode(HandlerMode.SYNC).retryCount(0).ignoreErrors(true).build());

        DispatchOutcome outcome = registry.dispatch(event);

        assertTrue(outcome.isSuccess());
        assertNull(outcome.toException());
        assertFalse(outcome.results().get("ignored").success());
    }

    @Test
    void backgroundHandlersAreNotAwaited() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(1);
        registry.register("PlantWatered", e -> {
            release.await(5, TimeUnit.SECONDS);
            done.countDown();
        }, HandlerOptions.builder().name("bg").mode(HandlerMode.BACKGROUND).build());

        DispatchOutcome outcome = registry.dispatch(event);

        assertEquals(1, outcome.backgroundLaunched());
        assertTrue(outcome.results().isEmpty());
        assertFalse(outcome.isEmpty());
        release.countDown();
        assertTrue(done.await(5, TimeUnit.SECONDS));
    }

    @Test
    void asyncHandlersLaunchInPriorityOrder() {
        DefaultHandlerRegistry serial = DefaultHandlerRegistry.builder().dispatchPoolSize(1).build();
        try {
            List<String> started = new CopyOnWriteArrayList<>();
            serial.register("PlantWatered", e -> started.add("low"), async("low", Priority.LOW));
            serial.register("PlantWatered", e -> started.add("high"), async("high", Priority.HIGH));
            serial.register("PlantWatered", e -> started.add("critical"), async("critical", Priority.CRITICAL));
            serial.register("PlantWatered", e -> started.add("normal"), async("normal", Priority.NORMAL));

            DispatchOutcome outcome = serial.dispatch(event);

            assertTrue(outcome.isSuccess());
            assertEquals(List.of("critical", "high", "normal", "low"), started);
        } finally {
            serial.close();
        }
    }

    @Test
    void slowBackgroundHandlersDoNotDelayAsyncDispatch() throws Exception {
        DefaultHandlerRegistry pools = DefaultHandlerRegistry.builder()
                .dispatchPoolSize(2)
                .backgroundPoolSize(2)
                .shutdownTimeout(Duration.ofSeconds(5))
                .build();
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch bothBlocked = new CountDownLatch(2);
        try {
            for (String name : List.of("bg-1", "bg-2")) {
                pools.register("PlantWatered", e -> {
                    bothBlocked.countDown();
                    release.await(10, TimeUnit.SECONDS);
                }, HandlerOptions.builder().name(name).mode(HandlerMode.BACKGROUND).build());
            }
            pools.register("SoilChecked", e -> { }, async("noop", Priority.NORMAL));

            pools.dispatch(event);
            assertTrue(bothBlocked.await(5, TimeUnit.SECONDS));

            long start = System.nanoTime();
            DispatchOutcome outcome = pools.dispatch(EventEnvelope.of("SoilChecked", Map.of()));
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            assertTrue(outcome.isSuccess());
            assertTrue(elapsedMs < 1_000, "async dispatch took " + elapsedMs + " ms");
            assertEquals(2, pools.backgroundTaskCount());
        } finally {
            release.countDown();
            pools.close();
        }
    }

    @Test
    void builderRejectsEmptyBackgroundPool() {
        assertThrows(IllegalArgumentException.class, () ->
                DefaultHandlerRegistry.builder().backgroundPoolSize(0).build());
    }

    @Test
    void noHandlersGivesEmptyOutcome() {
        DispatchOutcome outcome = registry.dispatch(event);

        assertTrue(outcome.isEmpty());
        assertTrue(outcome.isSuccess());
        assertFalse(registry.hasHandlers("PlantWatered"));
    }

    @Test
    void duplicateNameIsRejected() {
        registry.register("PlantWatered", e -> { }, sync("dup", Priority.NORMAL));

        assertThrows(IllegalArgumentException.class, () ->
                registry.register("Other", e -> { }, sync("dup", Priority.NORMAL)));
    }

    @Test
    void generatedNamesAndUnregister() {
        String id = registry.register("PlantWatered", e -> { });

        assertTrue(id.startsWith("PlantWatered-handler-"));
        assertTrue(registry.hasHandlers("PlantWatered"));
        assertFalse(registry.unregister("Other", id));
        assertTrue(registry.unregister("PlantWatered", id));
        assertFalse(registry.hasHandlers("PlantWatered"));
        assertEquals(0, registry.handlerCount());
    }

    @Test
    void healthDegradesBelowThreshold() {
        registry.register("PlantWatered", e -> {
            throw new IllegalStateException("boom");
        }, sync("failing", Priority.NORMAL));
        registry.register("PlantWatered", e -> { }, sync("fine", Priority.NORMAL));

        assertEquals(HealthStatus.HEALTHY, registry.health().status());
        registry.dispatch(event);

        HandlerHealth health = registry.health();
        assertEquals(HealthStatus.DEGRADED, health.status());
        assertEquals(List.of("failing"), health.unhealthyHandlers());
        assertEquals(2, health.handlerCount());
    }

    @Test
    void metricsAndHistory() {
        registry.register("PlantWatered", e -> { }, sync("h", Priority.NORMAL));
        registry.dispatch(event);
        registry.dispatch(event);

        assertEquals(2, registry.metrics("h").orElseThrow().totalExecutions());
        assertEquals(1, registry.history("h", 1).size());
        assertEquals(1, registry.metrics().size());
        assertTrue(registry.history("unknown", 5).isEmpty());
    }

    @Test
    void registerAfterCloseFails() {
        DefaultHandlerRegistry closed = DefaultHandlerRegistry.builder().shutdownTimeout(Duration.ofMillis(10)).build();
        closed.close();

        assertThrows(IllegalStateException.class, () -> closed.register("PlantWatered", e -> { }));
    }
}
