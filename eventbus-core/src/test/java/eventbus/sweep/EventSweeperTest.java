package eventbus.sweep;

import eventbus.EventEnvelope;
import eventbus.model.DeliveryConfig;
import eventbus.model.EventRecord;
import eventbus.model.EventStatus;
import eventbus.store.InMemoryEventStore;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventSweeperTest {

    private final InMemoryEventStore store = new InMemoryEventStore();
    private final List<String> handled = new CopyOnWriteArrayList<>();

    private EventRecord pending(Instant createdAt) {
        EventRecord record = EventRecord.pending(EventEnvelope.of("A", Map.of()), DeliveryConfig.defaults(), createdAt);
        store.save(record);
        return record;
    }

    private EventSweeper sweeper(int batchSize) {
        return EventSweeper.builder()
                .store(store)
                .handler(record -> handled.add(record.eventId()))
                .batchSize(batchSize)
                .build();
    }

    @Test
    void handsPendingRecordsOldestFirst() {
        Instant now = Instant.now();
        EventRecord newer = pending(now.minusSeconds(1));
        EventRecord older = pending(now.minusSeconds(10));
        pending(now);

        EventSweeper sweeper = sweeper(2);
        assertNull(sweeper.lastSweepAt());
        sweeper.sweep();

        assertEquals(List.of(older.eventId(), newer.eventId()), handled);
        assertNotNull(sweeper.lastSweepAt());
    }

    @Test
    void reactivatesDueRetries() {
        Instant now = Instant.now();
        EventRecord due = pending(now.minusSeconds(5));
        EventRecord notDue = pending(now.minusSeconds(5));
        store.save(due.transitionTo(EventStatus.RETRYING, now, null).withNextAttemptAt(now.minusSeconds(1)));
        store.save(notDue.transitionTo(EventStatus.RETRYING, now, null).withNextAttemptAt(now.plusSeconds(60)));

        sweeper(10).sweep();

        assertEquals(EventStatus.PENDING, store.get(due.eventId()).orElseThrow().status());
        assertEquals(EventStatus.RETRYING, store.get(notDue.eventId()).orElseThrow().status());
        assertEquals(List.of(due.eventId()), handled);
    }

    @Test
    void returnsStaleProcessingRecordsToPending() {
        Instant now = Instant.now();
        EventRecord stale = pending(now.minusSeconds(3600));
        EventRecord fresh = pending(now.minusSeconds(3600));
        store.save(stale.transitionTo(EventStatus.PROCESSING, now.minusSeconds(600), null));
        store.save(fresh.transitionTo(EventStatus.PROCESSING, now.minusSeconds(5), null));

        EventSweeper.builder()
                .store(store)
                .handler(record -> handled.add(record.eventId()))
                .processingTimeout(Duration.ofMinutes(1))
                .build()
                .sweep();

        EventRecord recovered = store.get(stale.eventId()).orElseThrow();
        assertEquals(EventStatus.PENDING, recovered.status());
        assertTrue(recovered.lastError().startsWith("Processing not finished within"));
        assertEquals(EventStatus.PROCESSING, store.get(fresh.eventId()).orElseThrow().status());
        assertEquals(List.of(stale.eventId()), handled);
    }

    @Test
    void leavesStaleRecordsThatAreStillInFlight() {
        Instant now = Instant.now();
        EventRecord busy = pending(now.minusSeconds(3600));
        store.save(busy.transitionTo(EventStatus.PROCESSING, now.minusSeconds(600), null));
        PendingEventHandler stillRunning = new PendingEventHandler() {
            @Override
            public boolean handle(EventRecord record) {
                return handled.add(record.eventId());
            }

            @Override
            public boolean isInFlight(String eventId) {
                return true;
            }
        };

        EventSweeper.builder()
                .store(store)
                .handler(stillRunning)
                .processingTimeout(Duration.ofMinutes(1))
                .build()
                .sweep();

        assertEquals(EventStatus.PROCESSING, store.get(busy.eventId()).orElseThrow().status());
        assertTrue(handled.isEmpty());
    }

    @Test
    void handlerFailureDoesNotEscape() {
        pending(Instant.now());
        EventSweeper sweeper = EventSweeper.builder()
                .store(store)
                .handler(record -> {
                    throw new IllegalStateException("boom");
                })
                .build();

        assertDoesNotThrow(sweeper::sweep);
    }

    @Test
    void scheduledLoopRuns() throws Exception {
        CountDownLatch latch = new CountDownLatch(1);
        pending(Instant.now());
        EventSweeper sweeper = EventSweeper.builder()
                .store(store)
                .handler(record -> {
                    latch.countDown();
                    return true;
                })
                .interval(Duration.ofMillis(20))
                .build();

        sweeper.start();
        try {
            assertTrue(sweeper.isRunning());
            assertTrue(latch.await(5, TimeUnit.SECONDS));
        } finally {
            sweeper.close();
        }
        assertFalse(sweeper.isRunning());
    }

    @Test
    void closedSweeperDoesNothing() {
        pending(Instant.now());
        EventSweeper sweeper = sweeper(10);
        sweeper.close();

        sweeper.sweep();

        assertTrue(handled.isEmpty());
        assertThrows(IllegalStateException.class, sweeper::start);
    }

    @Test
    void builderValidation() {
        assertThrows(NullPointerException.class, () ->
                EventSweeper.builder().handler(record -> true).build());
        assertThrows(IllegalArgumentException.class, () ->
                EventSweeper.builder().store(store).handler(record -> true).batchSize(0).build());
        assertThrows(IllegalArgumentException.class, () ->
                EventSweeper.builder().store(store).handler(record -> true)
                        .processingTimeout(Duration.ofSeconds(-1)).build());
    }
}
