package eventbus.purge;

import eventbus.EventEnvelope;
import eventbus.model.DeliveryConfig;
import eventbus.model.EventRecord;
import eventbus.model.EventStatus;
import eventbus.store.InMemoryEventStore;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventPurgeSchedulerTest {

  private final InMemoryEventStore store = new InMemoryEventStore();

  private EventRecord save(EventStatus status, Instant createdAt) {
    EventRecord record = EventRecord.pending(EventEnvelope.of("A", Map.of()), DeliveryConfig.defaults(), createdAt)
        .transitionTo(status, createdAt, null);
    store.save(record);
    return record;
  }

  @Test
  void runOnceDeletesExpiredTerminalRecords() {
    Instant old = Instant.now().minus(Duration.ofDays(8));
    EventRecord oldCompleted = save(EventStatus.COMPLETED, old);
    EventRecord oldDead = save(EventStatus.DEAD_LETTER, old);
    EventRecord oldFailed = save(EventStatus.FAILED, old);
    EventRecord recentCompleted = save(EventStatus.COMPLETED, Instant.now());

    EventPurgeScheduler scheduler = EventPurgeScheduler.builder().store(store).build();

    assertEquals(2, scheduler.runOnce());
    assertTrue(store.get(oldCompleted.eventId()).isEmpty());
    assertTrue(store.get(oldDead.eventId()).isEmpty());
    assertTrue(store.get(oldFailed.eventId()).isPresent());
    assertTrue(store.get(recentCompleted.eventId()).isPresent());
  }

  @Test
  void customRetention() {
    save(EventStatus.COMPLETED, Instant.now().minus(Duration.ofHours(2)));

    EventPurgeScheduler scheduler = EventPurgeScheduler.builder()
        .store(store)
        .retention(Duration.ofHours(1))
        .build();

    assertEquals(1, scheduler.runOnce());
  }

  @Test
  void startAndClose() {
    EventPurgeScheduler scheduler = EventPurgeScheduler.builder()
        .store(store)
        .interval(Duration.ofMillis(50))
        .build();

    scheduler.start();
    assertTrue(scheduler.isRunning());

    scheduler.close();
    assertFalse(scheduler.isRunning());
    assertEquals(0, scheduler.runOnce());
  }

  @Test
  void builderRejectsNullStore() {
    assertThrows(NullPointerException.class, () -> EventPurgeScheduler.builder().build());
  }

  @Test
  void builderRejectsNonPositiveInterval() {
    assertThrows(IllegalArgumentException.class, () ->
        EventPurgeScheduler.builder().store(store).interval(Duration.ZERO).build());
  }
}
