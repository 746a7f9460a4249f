package eventbus.handler;

import eventbus.Priority;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time snapshot of one handler's execution statistics.
 *
 * @param handlerId             handler name
 * @param eventType             event type the handler is bound to
 * @param priority              handler priority
 * @param mode                  execution mode
 * @param totalExecutions       all invocations, rate-limited ones included
 * @param successfulExecutions  successful invocations
 * @param failedExecutions      failed invocations
 * @param successRate           successful / total, 0 when nothing ran yet
 * @param averageExecutionMs    exponential moving average of execution time
 * @param lastError             most recent error message, may be {@code null}
 * @param lastExecutionAt       start of the most recent invocation, may be {@code null}
 * @param rateLimitPerMinute    configured rate limit, 0 when unlimited
 * @param recentResults         newest results last, at most 10
 */
public record HandlerMetrics(
        String handlerId,
        String eventType,
        Priority priority,
        HandlerMode mode,
        long totalExecutions,
        long successfulExecutions,
        long failedExecutions,
        double successRate,
        double averageExecutionMs,
        String lastError,
        Instant lastExecutionAt,
        int rateLimitPerMinute,
        List<HandlerExecutionResult> recentResults) {

    public HandlerMetrics {
        recentResults = recentResults == null ? List.of() : List.copyOf(recentResults);
    }
}
