package eventbus.publisher;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link ConcurrentHashMap}-based in-flight tracker with optional time-based expiry.
 *
 * <p>When {@code ttlMs} is zero (the default), an event remains tracked until explicitly
 * released. When positive, stale entries become reclaimable after the TTL elapses, so an event
 * stuck in a dead worker can be picked up again by the sweep.
 *
 * <p>This class is thread-safe.
 */
public final class DefaultInFlightTracker implements InFlightTracker {
    private final Map<String, Long> inflight = new ConcurrentHashMap<>();
    private final long ttlMs;
    private final AtomicInteger evictCounter = new AtomicInteger();

    public DefaultInFlightTracker() {
        this(0L);
    }

    /**
     * Creates a tracker with a time-to-live for stale entries.
     *
     * @param ttlMs time-to-live in milliseconds; 0 disables expiry
     */
    public DefaultInFlightTracker(long ttlMs) {
        if (ttlMs < 0) {
            throw new IllegalArgumentException("ttlMs must be >= 0");
        }
        this.ttlMs = ttlMs;
    }

    @Override
    public boolean tryAcquire(String eventId) {
        long now = System.currentTimeMillis();
        maybeEvictExpired(now);
        while (true) {
            Long existing = inflight.putIfAbsent(eventId, now);
            if (existing == null) {
                return true;
            }
            if (ttlMs <= 0 || now - existing <= ttlMs) {
                return false;
            }
            if (inflight.replace(eventId, existing, now)) {
                return true;
            }
            now = System.currentTimeMillis();
        }
    }

    private void maybeEvictExpired(long now) {
        if (ttlMs <= 0) return;
        // sample roughly every 1024 acquires
        if ((evictCounter.incrementAndGet() & 0x3FF) != 0) return;
        inflight.entrySet().removeIf(e -> now - e.getValue() > ttlMs * 2);
    }

    @Override
    public void release(String eventId) {
        inflight.remove(eventId);
    }

    @Override
    public boolean isInFlight(String eventId) {
        Long acquiredAt = inflight.get(eventId);
        if (acquiredAt == null) {
            return false;
        }
        return ttlMs <= 0 || System.currentTimeMillis() - acquiredAt <= ttlMs;
    }

    @Override
    public int size() {
        return inflight.size();
    }
}
