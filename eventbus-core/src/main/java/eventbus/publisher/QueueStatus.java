package eventbus.publisher;

import java.time.Instant;
import java.util.Map;

/**
 * Snapshot of pending and failed records, sampled over at most
 * {@value EventPublisher#QUEUE_STATUS_SAMPLE} records of each status.
 *
 * @param pendingCount      pending records sampled
 * @param failedCount       failed records sampled
 * @param pendingByPriority pending counts keyed by priority name
 * @param pendingByType     pending counts keyed by event type
 * @param failedByType      failed counts keyed by event type
 * @param oldestPending     creation time of the oldest pending record, may be {@code null}
 * @param oldestFailed      creation time of the oldest failed record, may be {@code null}
 */
public record QueueStatus(
        int pendingCount,
        int failedCount,
        Map<String, Integer> pendingByPriority,
        Map<String, Integer> pendingByType,
        Map<String, Integer> failedByType,
        Instant oldestPending,
        Instant oldestFailed) {

    public QueueStatus {
        pendingByPriority = Map.copyOf(pendingByPriority);
        pendingByType = Map.copyOf(pendingByType);
        failedByType = Map.copyOf(failedByType);
    }
}
