package eventbus.publisher;

import eventbus.HealthStatus;

/**
 * Publisher health.
 *
 * <ul>
 *   <li>{@code HEALTHY}: success rate &ge; 0.95, fewer than 100 pending and fewer than 10 failed</li>
 *   <li>{@code DEGRADED}: success rate &ge; 0.8, fewer than 500 pending and fewer than 50 failed</li>
 *   <li>{@code UNHEALTHY}: anything worse</li>
 * </ul>
 *
 * @param status       classification
 * @param successRate  processed / published
 * @param pendingCount pending records
 * @param failedCount  failed records
 */
public record PublisherHealth(HealthStatus status, double successRate, long pendingCount, long failedCount) {

    static PublisherHealth classify(double successRate, long pendingCount, long failedCount) {
        HealthStatus status;
        if (successRate >= 0.95 && pendingCount < 100 && failedCount < 10) {
            status = HealthStatus.HEALTHY;
        } else if (successRate >= 0.8 && pendingCount < 500 && failedCount < 50) {
            status = HealthStatus.DEGRADED;
        } else {
            status = HealthStatus.UNHEALTHY;
        }
        return new PublisherHealth(status, successRate, pendingCount, failedCount);
    }
}
