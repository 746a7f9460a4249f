package eventbus.handler;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Outcome of one handler invocation for one event.
 *
 * @param handlerId     the handler that ran
 * @param success       whether the invocation succeeded
 * @param executionTime wall-clock time spent, retries included
 * @param errorMessage  failure description, {@code null} on success
 * @param errorKind     failure classification, {@code null} on success
 * @param retriesUsed   in-call retries performed
 * @param startedAt     when the invocation started
 */
public record HandlerExecutionResult(
        String handlerId,
        boolean success,
        Duration executionTime,
        String errorMessage,
        ErrorKind errorKind,
        int retriesUsed,
        Instant startedAt) {

    public HandlerExecutionResult {
        Objects.requireNonNull(handlerId, "handlerId");
        Objects.requireNonNull(executionTime, "executionTime");
        Objects.requireNonNull(startedAt, "startedAt");
        if (!success && errorKind == null) {
            throw new IllegalArgumentException("failed result requires an errorKind");
        }
    }

    public static HandlerExecutionResult success(String handlerId, Duration executionTime,
                                                 int retriesUsed, Instant startedAt) {
        return new HandlerExecutionResult(handlerId, true, executionTime, null, null, retriesUsed, startedAt);
    }

    public static HandlerExecutionResult failure(String handlerId, Duration executionTime, ErrorKind errorKind,
                                                 String errorMessage, int retriesUsed, Instant startedAt) {
        return new HandlerExecutionResult(handlerId, false, executionTime, errorMessage, errorKind,
                retriesUsed, startedAt);
    }
}
