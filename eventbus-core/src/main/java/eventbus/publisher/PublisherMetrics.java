package eventbus.publisher;

import java.time.Instant;

/**
 * Publisher counters.
 *
 * @param publishedCount       events accepted
 * @param processedCount       events completed
 * @param failedCount          failed dispatch attempts
 * @param successRate          processed / published, 1.0 before anything was published
 * @param inFlightCount        events currently owned by a processing path
 * @param backgroundTaskCount  detached dispatch tasks still running
 * @param activeBatches        open batches
 * @param batchedEventCount    events waiting in batches
 * @param lastProcessingTime   when the last dispatch started
 * @param lastSweepAt          when the last sweep ran, may be {@code null}
 * @param sweepRunning         whether the sweep loop is scheduled
 * @param purgeRunning         whether the purge loop is scheduled
 */
public record PublisherMetrics(
        long publishedCount,
        long processedCount,
        long failedCount,
        double successRate,
        int inFlightCount,
        int backgroundTaskCount,
        int activeBatches,
        int batchedEventCount,
        Instant lastProcessingTime,
        Instant lastSweepAt,
        boolean sweepRunning,
        boolean purgeRunning) {
}
