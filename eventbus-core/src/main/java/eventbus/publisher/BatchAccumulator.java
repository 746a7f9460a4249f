package eventbus.publisher;

import eventbus.Priority;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Groups batch-mode event ids by priority and event type.
 *
 * <p>A batch is flushed when it reaches {@code maxSize} ids, on the adding thread, or when its
 * window elapses after the first id was added, on the scheduler thread, whichever comes first.
 * The flusher receives the ids in arrival order.
 *
 * <p>This class is thread-safe. The flusher is always called without holding the lock.
 */
public final class BatchAccumulator {
    private static final Logger logger = Logger.getLogger(BatchAccumulator.class.getName());

    private final Duration window;
    private final int maxSize;
    private final ScheduledExecutorService scheduler;
    private final Consumer<List<String>> flusher;
    private final Map<String, Batch> batches = new LinkedHashMap<>();

    public BatchAccumulator(Duration window, int maxSize, ScheduledExecutorService scheduler,
                            Consumer<List<String>> flusher) {
        this.window = Objects.requireNonNull(window, "window");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.flusher = Objects.requireNonNull(flusher, "flusher");
        if (window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive");
        }
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be > 0");
        }
        this.maxSize = maxSize;
    }

    static String keyOf(Priority priority, String eventType) {
        return priority.name() + "_" + eventType;
    }

    /**
     * Adds an event id to the batch for its priority and type.
     *
     * @param priority  delivery priority
     * @param eventType event type
     * @param eventId   the event id
     */
    public void add(Priority priority, String eventType, String eventId) {
        String key = keyOf(priority, eventType);
        List<String> full = null;
        synchronized (this) {
            Batch batch = batches.computeIfAbsent(key, k -> new Batch());
            batch.ids.add(eventId);
            if (batch.ids.size() >= maxSize) {
                full = take(key);
            } else if (batch.timer == null) {
                batch.timer = scheduleFlush(key);
            }
        }
        if (full != null) {
            logger.log(Level.FINE, "Batch {0} reached {1} events, flushing", new Object[]{key, full.size()});
            flusher.accept(full);
        }
    }

    private ScheduledFuture<?> scheduleFlush(String key) {
        try {
            return scheduler.schedule(() -> flush(key), window.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            logger.log(Level.WARNING, "Cannot schedule flush for batch {0}; it will flush on shutdown", key);
            return null;
        }
    }

    /**
     * Flushes one batch now, if it has any ids.
     *
     * @param key the batch key
     */
    void flush(String key) {
        List<String> ids;
        synchronized (this) {
            ids = take(key);
        }
        if (!ids.isEmpty()) {
            logger.log(Level.FINE, "Batch {0} window elapsed, flushing {1} events", new Object[]{key, ids.size()});
            flusher.accept(ids);
        }
    }

    /**
     * Removes every batch and returns their ids without calling the flusher.
     *
     * @return all buffered ids
     */
    public synchronized List<String> drainAll() {
        List<String> all = new ArrayList<>();
        for (String key : new ArrayList<>(batches.keySet())) {
            all.addAll(take(key));
        }
        return all;
    }

    public synchronized int activeBatches() {
        return batches.size();
    }

    public synchronized int batchedEventCount() {
        int count = 0;
        for (Batch batch : batches.values()) {
            count += batch.ids.size();
        }
        return count;
    }

    private List<String> take(String key) {
        Batch batch = batches.remove(key);
        if (batch == null) {
            return List.of();
        }
        if (batch.timer != null) {
            batch.timer.cancel(false);
        }
        return batch.ids;
    }

    private static final class Batch {
        final List<String> ids = new ArrayList<>();
        ScheduledFuture<?> timer;
    }
}
