package eventbus;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Processing, tracing and routing metadata carried by every {@link EventEnvelope}.
 *
 * @param timestamp     when the event occurred
 * @param correlationId links all events of one causal chain, may be {@code null}
 * @param causationId   id of the event that triggered this one, may be {@code null}
 * @param priority      delivery priority
 * @param retryCount    number of delivery retries already performed
 * @param maxRetries    retry ceiling suggested by the producer
 * @param timeout       processing timeout suggested by the producer, informational only
 * @param category      routing category
 * @param tags          routing tags, sorted and unmodifiable
 * @param source        name of the producing system
 * @param version       schema version of the event
 * @param userId        acting user, may be {@code null}
 * @param sessionId     session of the acting user, may be {@code null}
 * @param requestId     request that produced the event, may be {@code null}
 */
public record EventMetadata(
        Instant timestamp,
        String correlationId,
        String causationId,
        Priority priority,
        int retryCount,
        int maxRetries,
        Duration timeout,
        String category,
        Set<String> tags,
        String source,
        String version,
        String userId,
        String sessionId,
        String requestId) {

    public static final String DEFAULT_SOURCE = "eventbus";
    public static final String DEFAULT_VERSION = "1.0";
    public static final String DEFAULT_CATEGORY = "general";
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    public EventMetadata {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(priority, "priority");
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(version, "version");
        if (retryCount < 0) {
            throw new EventValidationException("retryCount must be >= 0");
        }
        if (maxRetries < 0) {
            throw new EventValidationException("maxRetries must be >= 0");
        }
        if (timeout.isZero() || timeout.isNegative()) {
            throw new EventValidationException("timeout must be positive");
        }
        if (tags == null) {
            tags = Set.of();
        } else {
            for (String tag : tags) {
                if (tag == null) {
                    throw new EventValidationException("tags cannot contain null");
                }
            }
            tags = Collections.unmodifiableSortedSet(new TreeSet<>(tags));
        }
    }

    public boolean hasTag(String tag) {
        return tags.contains(tag);
    }

    EventMetadata withRetryCount(int retryCount) {
        return new EventMetadata(timestamp, correlationId, causationId, priority, retryCount, maxRetries,
                timeout, category, tags, source, version, userId, sessionId, requestId);
    }

    EventMetadata withTag(String tag) {
        Set<String> next = new TreeSet<>(tags);
        next.add(Objects.requireNonNull(tag, "tag"));
        return new EventMetadata(timestamp, correlationId, causationId, priority, retryCount, maxRetries,
                timeout, category, next, source, version, userId, sessionId, requestId);
    }

    EventMetadata withCorrelation(String correlationId, String causationId) {
        return new EventMetadata(timestamp, correlationId, causationId, priority, retryCount, maxRetries,
                timeout, category, tags, source, version, userId, sessionId, requestId);
    }
}
