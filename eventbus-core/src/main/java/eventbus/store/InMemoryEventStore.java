package eventbus.store;

import eventbus.model.EventRecord;
import eventbus.model.EventStatus;
import eventbus.spi.EventStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Bounded, in-process {@link EventStore}.
 *
 * <p>Keeps at most {@code capacity} records; when a new record would exceed it, the oldest
 * inserted record is evicted regardless of status. Suitable for development, tests and
 * deployments that accept losing undelivered events on restart.
 *
 * <p>This class is thread-safe. All operations hold the store's monitor, which makes
 * {@link #compareAndSet} atomic.
 */
public final class InMemoryEventStore implements EventStore {
    private static final Logger logger = Logger.getLogger(InMemoryEventStore.class.getName());
    public static final int DEFAULT_CAPACITY = 10_000;

    private static final Comparator<EventRecord> OLDEST_FIRST =
            Comparator.comparing(EventRecord::createdAt).thenComparing(EventRecord::eventId);

    private final int capacity;
    private final Map<String, EventRecord> records = new LinkedHashMap<>();

    public InMemoryEventStore() {
        this(DEFAULT_CAPACITY);
    }

    public InMemoryEventStore(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.capacity = capacity;
    }

    @Override
    public synchronized void save(EventRecord record) {
        Objects.requireNonNull(record, "record");
        records.put(record.eventId(), record);
        if (records.size() > capacity) {
            Iterator<Map.Entry<String, EventRecord>> it = records.entrySet().iterator();
            Map.Entry<String, EventRecord> oldest = it.next();
            it.remove();
            if (!oldest.getValue().status().isTerminal()) {
                logger.log(Level.WARNING, "Evicted {0} event {1} at capacity {2}",
                        new Object[]{oldest.getValue().status(), oldest.getKey(), capacity});
            }
        }
    }

    @Override
    public synchronized Optional<EventRecord> get(String eventId) {
        return Optional.ofNullable(records.get(eventId));
    }

    @Override
    public synchronized boolean updateStatus(String eventId, EventStatus status, String error) {
        EventRecord current = records.get(eventId);
        if (current == null) {
            return false;
        }
        if (current.status() != status) {
            records.put(eventId, current.transitionTo(status, Instant.now(), error));
        }
        return true;
    }

    @Override
    public synchronized boolean compareAndSet(String eventId, EventStatus expected, EventRecord updated) {
        EventRecord current = records.get(eventId);
        if (current == null || current.status() != expected) {
            return false;
        }
        records.put(eventId, updated);
        return true;
    }

    @Override
    public synchronized List<EventRecord> listByStatus(EventStatus status, int limit) {
        return records.values().stream()
                .filter(r -> r.status() == status)
                .sorted(OLDEST_FIRST)
                .limit(Math.max(0, limit))
                .toList();
    }

    @Override
    public synchronized long countByStatus(EventStatus status) {
        return records.values().stream().filter(r -> r.status() == status).count();
    }

    @Override
    public synchronized int delete(Set<EventStatus> statuses, Instant olderThan) {
        List<String> doomed = new ArrayList<>();
        for (EventRecord record : records.values()) {
            if (statuses.contains(record.status()) && record.createdAt().isBefore(olderThan)) {
                doomed.add(record.eventId());
            }
        }
        doomed.forEach(records::remove);
        return doomed.size();
    }

    public synchronized int size() {
        return records.size();
    }

    public int capacity() {
        return capacity;
    }
}
