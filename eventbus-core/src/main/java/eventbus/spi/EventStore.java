package eventbus.spi;

import eventbus.model.EventRecord;
import eventbus.model.EventStatus;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Persistence contract for published-event records.
 *
 * <p>Implementations must make {@link #compareAndSet} atomic: the background sweep and the
 * administration operations may race on the same record, and only one of them may win a
 * transition. All methods throw {@link EventStoreException} when the backing storage fails.
 *
 * <p>List operations return records oldest first (by {@code createdAt}).
 *
 * @see eventbus.store.InMemoryEventStore
 */
public interface EventStore {

    /**
     * Inserts or replaces a record.
     *
     * @param record the record to store
     */
    void save(EventRecord record);

    Optional<EventRecord> get(String eventId);

    /**
     * Sets a record's status without checking the transition edge. Re-applying the current status
     * is a no-op, so {@code completedAt} is set only once.
     *
     * @param eventId the event id
     * @param status  the new status
     * @param error   failure description, may be {@code null}
     * @return {@code false} if the record does not exist
     */
    boolean updateStatus(String eventId, EventStatus status, String error);

    /**
     * Replaces a record only if its stored status still equals {@code expected}.
     *
     * @param eventId  the event id
     * @param expected the status the caller observed
     * @param updated  the replacement record
     * @return {@code true} if the replacement happened
     */
    boolean compareAndSet(String eventId, EventStatus expected, EventRecord updated);

    List<EventRecord> listByStatus(EventStatus status, int limit);

    default List<EventRecord> listPending(int limit) {
        return listByStatus(EventStatus.PENDING, limit);
    }

    default List<EventRecord> listFailed(int limit) {
        return listByStatus(EventStatus.FAILED, limit);
    }

    /**
     * Returns {@link EventStatus#RETRYING} records whose next attempt is due.
     *
     * @param now   the current time
     * @param limit maximum number of records
     * @return due records, oldest first
     */
    default List<EventRecord> listRetryDue(Instant now, int limit) {
        return listByStatus(EventStatus.RETRYING, Integer.MAX_VALUE).stream()
                .filter(r -> r.nextAttemptAt() == null || !r.nextAttemptAt().isAfter(now))
                .limit(limit)
                .toList();
    }

    /**
     * Returns {@link EventStatus#PROCESSING} records whose processing started before
     * {@code startedBefore}, or whose start time is unknown.
     *
     * @param startedBefore processing-start cutoff (exclusive)
     * @param limit         maximum number of records
     * @return stale records, oldest first
     */
    default List<EventRecord> listStaleProcessing(Instant startedBefore, int limit) {
        return listByStatus(EventStatus.PROCESSING, Integer.MAX_VALUE).stream()
                .filter(r -> r.processingStartedAt() == null || r.processingStartedAt().isBefore(startedBefore))
                .limit(limit)
                .toList();
    }

    long countByStatus(EventStatus status);

    /**
     * Deletes records in one of {@code statuses} created before {@code olderThan}.
     *
     * @param statuses  statuses eligible for deletion
     * @param olderThan creation-time cutoff (exclusive)
     * @return number of deleted records
     */
    int delete(Set<EventStatus> statuses, Instant olderThan);

    /**
     * Deletes completed and dead-letter records created before {@code olderThan}.
     *
     * @param olderThan creation-time cutoff (exclusive)
     * @return number of deleted records
     */
    default int cleanup(Instant olderThan) {
        return delete(EnumSet.of(EventStatus.COMPLETED, EventStatus.DEAD_LETTER), olderThan);
    }
}
