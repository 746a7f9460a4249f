package eventbus.store;

import eventbus.EventEnvelope;
import eventbus.model.DeliveryConfig;
import eventbus.model.EventRecord;
import eventbus.model.EventStatus;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryEventStoreTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private static EventRecord record(String type, Instant createdAt) {
        return EventRecord.pending(EventEnvelope.of(type, Map.of()), DeliveryConfig.defaults(), createdAt);
    }

    @Test
    void saveAndGet() {
        InMemoryEventStore store = new InMemoryEventStore();
        EventRecord record = record("A", T0);

        store.save(record);

        assertEquals(record, store.get(record.eventId()).orElseThrow());
        assertTrue(store.get("missing").isEmpty());
    }

    @Test
    void updateStatusIsIdempotent() {
        InMemoryEventStore store = new InMemoryEventStore();
        EventRecord record = record("A", T0);
        store.save(record);

        assertTrue(store.updateStatus(record.eventId(), EventStatus.PROCESSING, null));
        assertTrue(store.updateStatus(record.eventId(), EventStatus.COMPLETED, null));
        Instant completedAt = store.get(record.eventId()).orElseThrow().completedAt();
        assertNotNull(completedAt);

        assertTrue(store.updateStatus(record.eventId(), EventStatus.COMPLETED, null));

        EventRecord stored = store.get(record.eventId()).orElseThrow();
        assertEquals(completedAt, stored.completedAt());
        assertEquals(3, stored.transitions().size());
        assertFalse(store.updateStatus("missing", EventStatus.COMPLETED, null));
    }

    @Test
    void compareAndSetChecksExpectedStatus() {
        InMemoryEventStore store = new InMemoryEventStore();
        EventRecord record = record("A", T0);
        store.save(record);
        EventRecord processing = record.transitionTo(EventStatus.PROCESSING, T0, null);

        assertTrue(store.compareAndSet(record.eventId(), EventStatus.PENDING, processing));
        assertFalse(store.compareAndSet(record.eventId(), EventStatus.PENDING, processing));
        assertEquals(EventStatus.PROCESSING, store.get(record.eventId()).orElseThrow().status());
    }

    @Test
    void listsOldestFirstWithLimit() {
        InMemoryEventStore store = new InMemoryEventStore();
        EventRecord newer = record("A", T0.plusSeconds(10));
        EventRecord older = record("A", T0);
        store.save(newer);
        store.save(older);

        assertEquals(List.of(older, newer), store.listPending(10));
        assertEquals(List.of(older), store.listPending(1));
        assertEquals(2, store.countByStatus(EventStatus.PENDING));
        assertTrue(store.listFailed(10).isEmpty());
    }

    @Test
    void listRetryDueHonoursNextAttempt() {
        InMemoryEventStore store = new InMemoryEventStore();
        EventRecord due = record("A", T0).transitionTo(EventStatus.PROCESSING, T0, null)
                .transitionTo(EventStatus.FAILED, T0, "x")
                .transitionTo(EventStatus.RETRYING, T0, null)
                .withNextAttemptAt(T0.plusSeconds(1));
        EventRecord later = record("A", T0).transitionTo(EventStatus.RETRYING, T0, null)
                .withNextAttemptAt(T0.plusSeconds(100));
        store.save(due);
        store.save(later);

        assertEquals(List.of(due), store.listRetryDue(T0.plusSeconds(5), 10));
    }

    @Test
    void evictsOldestAtCapacity() {
        InMemoryEventStore store = new InMemoryEventStore(2);
        EventRecord first = record("A", T0);
        EventRecord second = record("A", T0.plusSeconds(1));
        EventRecord third = record("A", T0.plusSeconds(2));

        store.save(first);
        store.save(second);
        store.save(third);

        assertEquals(2, store.size());
        assertTrue(store.get(first.eventId()).isEmpty());
        assertTrue(store.get(third.eventId()).isPresent());
    }

    @Test
    void cleanupDeletesOnlyOldTerminalRecords() {
        InMemoryEventStore store = new InMemoryEventStore();
        EventRecord oldCompleted = record("A", T0).transitionTo(EventStatus.COMPLETED, T0, null);
        EventRecord oldDead = record("A", T0).transitionTo(EventStatus.DEAD_LETTER, T0, "x");
        EventRecord oldPending = record("A", T0);
        EventRecord newCompleted = record("A", T0.plusSeconds(3600)).transitionTo(EventStatus.COMPLETED, T0, null);
        List.of(oldCompleted, oldDead, oldPending, newCompleted).forEach(store::save);

        int deleted = store.cleanup(T0.plusSeconds(60));

        assertEquals(2, deleted);
        assertTrue(store.get(oldPending.eventId()).isPresent());
        assertTrue(store.get(newCompleted.eventId()).isPresent());
    }

    @Test
    void deleteBySelectedStatuses() {
        InMemoryEventStore store = new InMemoryEventStore();
        EventRecord completed = record("A", T0).transitionTo(EventStatus.COMPLETED, T0, null);
        EventRecord dead = record("A", T0).transitionTo(EventStatus.DEAD_LETTER, T0, "x");
        store.save(completed);
        store.save(dead);

        assertEquals(1, store.delete(EnumSet.of(EventStatus.DEAD_LETTER), T0.plusSeconds(1)));
        assertTrue(store.get(completed.eventId()).isPresent());
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new InMemoryEventStore(0));
    }
}
