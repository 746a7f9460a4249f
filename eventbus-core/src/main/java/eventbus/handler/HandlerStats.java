package eventbus.handler;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Mutable execution counters for one handler.
 *
 * <p>Keeps a bounded history of the most recent results and an exponential moving average of
 * execution time (alpha 0.1, seeded by the first execution). This class is thread-safe.
 */
public final class HandlerStats {
    public static final int DEFAULT_HISTORY_SIZE = 100;
    static final double EMA_ALPHA = 0.1;

    private final int historySize;
    private final Deque<HandlerExecutionResult> history = new ArrayDeque<>();
    private long total;
    private long successful;
    private long failed;
    private double averageMs;
    private String lastError;
    private Instant lastExecutionAt;

    public HandlerStats() {
        this(DEFAULT_HISTORY_SIZE);
    }

    public HandlerStats(int historySize) {
        if (historySize <= 0) {
            throw new IllegalArgumentException("historySize must be > 0");
        }
        this.historySize = historySize;
    }

    /**
     * Records a counted outcome: success or failure.
     *
     * @param result the outcome
     */
    public synchronized void record(HandlerExecutionResult result) {
        if (result.success()) {
            successful++;
        } else {
            failed++;
            lastError = result.errorMessage();
        }
        recordCommon(result);
    }

    /**
     * Records an outcome that counts toward the total only, such as a rate-limit rejection of a
     * handler whose errors are ignored.
     *
     * @param result the outcome
     */
    public synchronized void recordUncounted(HandlerExecutionResult result) {
        if (!result.success()) {
            lastError = result.errorMessage();
        }
        recordCommon(result);
    }

    private void recordCommon(HandlerExecutionResult result) {
        double elapsedMs = result.executionTime().toNanos() / 1_000_000.0;
        averageMs = total == 0 ? elapsedMs : EMA_ALPHA * elapsedMs + (1 - EMA_ALPHA) * averageMs;
        total++;
        lastExecutionAt = result.startedAt();
        history.addLast(result);
        while (history.size() > historySize) {
            history.removeFirst();
        }
    }

    public synchronized long total() {
        return total;
    }

    public synchronized long successful() {
        return successful;
    }

    public synchronized long failed() {
        return failed;
    }

    public synchronized double successRate() {
        return total == 0 ? 0.0 : (double) successful / total;
    }

    public synchronized double averageMs() {
        return averageMs;
    }

    public synchronized String lastError() {
        return lastError;
    }

    public synchronized Instant lastExecutionAt() {
        return lastExecutionAt;
    }

    /**
     * Returns up to {@code limit} of the newest results, oldest first.
     *
     * @param limit maximum number of results
     * @return a copy of the newest results
     */
    public synchronized List<HandlerExecutionResult> history(int limit) {
        List<HandlerExecutionResult> all = new ArrayList<>(history);
        int from = Math.max(0, all.size() - Math.max(0, limit));
        return List.copyOf(all.subList(from, all.size()));
    }
}
