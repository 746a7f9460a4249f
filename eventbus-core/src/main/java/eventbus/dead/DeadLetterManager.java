package eventbus.dead;

import eventbus.model.EventRecord;
import eventbus.model.EventStatus;
import eventbus.spi.EventStore;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Convenience facade for querying, counting, replaying and purging DEAD_LETTER events.
 *
 * <p>Replay resets a record to PENDING with a zero retry count; the publisher's sweep delivers it
 * again. Store failures propagate as {@link eventbus.spi.EventStoreException}.
 *
 * @see EventStore#listByStatus
 * @see EventStore#compareAndSet
 */
public final class DeadLetterManager {
  private static final Logger logger = Logger.getLogger(DeadLetterManager.class.getName());

  private final EventStore store;

  public DeadLetterManager(EventStore store) {
    this.store = Objects.requireNonNull(store, "store");
  }

  /**
   * Queries dead-letter events with an optional type filter.
   *
   * @param eventType optional event type filter ({@code null} for all)
   * @param limit     maximum number of events to return
   * @return dead-letter records, oldest first
   */
  public List<EventRecord> query(String eventType, int limit) {
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0");
    }
    if (eventType == null) {
      return store.listByStatus(EventStatus.DEAD_LETTER, limit);
    }
    return store.listByStatus(EventStatus.DEAD_LETTER, Integer.MAX_VALUE).stream()
        .filter(r -> eventType.equals(r.eventType()))
        .limit(limit)
        .toList();
  }

  /**
   * Replays a single dead-letter event by resetting it to PENDING.
   *
   * @param eventId the event ID to replay
   * @return {@code true} if the event was replayed, {@code false} if not found or not dead
   */
  public boolean replay(String eventId) {
    Optional<EventRecord> current = store.get(eventId);
    if (current.isEmpty() || current.get().status() != EventStatus.DEAD_LETTER) {
      return false;
    }
    EventRecord reset = current.get().withRetryCount(0)
        .transitionTo(EventStatus.PENDING, Instant.now(), null);
    boolean replayed = store.compareAndSet(eventId, EventStatus.DEAD_LETTER, reset);
    if (replayed) {
      logger.log(Level.INFO, "Replayed dead letter event {0}", eventId);
    }
    return replayed;
  }

  /**
   * Replays all dead-letter events matching the filter, processing in batches.
   *
   * @param eventType optional event type filter ({@code null} for all)
   * @param batchSize number of events to process per batch
   * @return total number of events replayed
   */
  public int replayAll(String eventType, int batchSize) {
    int totalReplayed = 0;
    List<EventRecord> batch;
    int batchReplayed;
    do {
      batchReplayed = 0;
      batch = query(eventType, batchSize);
      for (EventRecord record : batch) {
        if (replay(record.eventId())) {
          batchReplayed++;
        }
      }
      totalReplayed += batchReplayed;
    } while (batch.size() >= batchSize && batchReplayed > 0);
    return totalReplayed;
  }

  /**
   * Counts dead-letter events, optionally filtered by event type.
   *
   * @param eventType optional event type filter ({@code null} for all)
   * @return the number of dead-letter events matching the filter
   */
  public long count(String eventType) {
    if (eventType == null) {
      return store.countByStatus(EventStatus.DEAD_LETTER);
    }
    return store.listByStatus(EventStatus.DEAD_LETTER, Integer.MAX_VALUE).stream()
        .filter(r -> eventType.equals(r.eventType()))
        .count();
  }

  /**
   * Deletes dead-letter events created before {@code olderThan}.
   *
   * @param olderThan creation-time cutoff (exclusive)
   * @return number of deleted events
   */
  public int purge(Instant olderThan) {
    Objects.requireNonNull(olderThan, "olderThan");
    int deleted = store.delete(EnumSet.of(EventStatus.DEAD_LETTER), olderThan);
    logger.log(Level.INFO, "Purged {0} dead letter events created before {1}", new Object[]{deleted, olderThan});
    return deleted;
  }
}
