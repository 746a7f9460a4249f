package eventbus.dead;

import eventbus.EventEnvelope;
import eventbus.model.DeliveryConfig;
import eventbus.model.EventRecord;
import eventbus.model.EventStatus;
import eventbus.store.InMemoryEventStore;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DeadLetterManagerTest {

  private final InMemoryEventStore store = new InMemoryEventStore();
  private final DeadLetterManager manager = new DeadLetterManager(store);

  private EventRecord dead(String type, Instant createdAt) {
    EventRecord record = EventRecord.pending(EventEnvelope.of(type, Map.of()), DeliveryConfig.defaults(), createdAt)
        .withRetryCount(4)
        .transitionTo(EventStatus.DEAD_LETTER, createdAt, "boom");
    store.save(record);
    return record;
  }

  @Test
  void queryFiltersByType() {
    Instant now = Instant.now();
    EventRecord a = dead("A", now.minusSeconds(2));
    dead("B", now.minusSeconds(1));

    assertEquals(2, manager.query(null, 10).size());
    assertEquals(List.of(a), manager.query("A", 10));
    assertEquals(1, manager.count("B"));
    assertEquals(2, manager.count(null));
  }

  @Test
  void replayResetsToPending() {
    EventRecord record = dead("A", Instant.now());

    assertTrue(manager.replay(record.eventId()));

    EventRecord replayed = store.get(record.eventId()).orElseThrow();
    assertEquals(EventStatus.PENDING, replayed.status());
    assertEquals(0, replayed.retryCount());
    assertFalse(manager.replay(record.eventId()));
  }

  @Test
  void replayReturnsFalseForUnknown() {
    assertFalse(manager.replay("missing"));
  }

  @Test
  void replayAllProcessesBatches() {
    Instant now = Instant.now();
    for (int i = 0; i < 5; i++) {
      dead("A", now.minusSeconds(i));
    }
    dead("B", now);

    assertEquals(5, manager.replayAll("A", 2));
    assertEquals(1, manager.count(null));
  }

  @Test
  void purgeDeletesOnlyOldDeadLetters() {
    Instant now = Instant.now();
    dead("A", now.minusSeconds(3600));
    EventRecord recent = dead("A", now);
    EventRecord completed = EventRecord.pending(EventEnvelope.of("A", Map.of()), DeliveryConfig.defaults(),
        now.minusSeconds(3600)).transitionTo(EventStatus.COMPLETED, now, null);
    store.save(completed);

    assertEquals(1, manager.purge(now.minusSeconds(60)));
    assertTrue(store.get(recent.eventId()).isPresent());
    assertTrue(store.get(completed.eventId()).isPresent());
  }

  @Test
  void constructorRejectsNull() {
    assertThrows(NullPointerException.class, () -> new DeadLetterManager(null));
  }
}
