package eventbus;

import com.github.f4b6a3.ulid.UlidCreator;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable event: identity, type, payload and {@link EventMetadata}.
 *
 * <p>Each envelope is assigned a monotonic ULID {@code eventId} by default, so ids sort by
 * creation time. The payload is a string-keyed map owned by the producing module; it is
 * deep-copied and made unmodifiable at build time. Only the retry count, tags and correlation
 * ids can change afterwards, and only through the copying {@code with*} methods.
 *
 * <p>{@link #toMap()} and {@link #fromMap(Map)} convert to and from the canonical form used for
 * persistence: timestamps as ISO-8601 strings, durations as ISO-8601 durations, enums by name and
 * tags as a sorted list.
 *
 * @see EventType
 * @see EventMetadata
 */
public final class EventEnvelope {
    private final String eventId;
    private final String eventType;
    private final Map<String, Object> payload;
    private final EventMetadata metadata;

    private EventEnvelope(String eventId, String eventType, Map<String, Object> payload, EventMetadata metadata) {
        this.eventId = eventId;
        this.eventType = eventType;
        this.payload = payload;
        this.metadata = metadata;
    }

    private EventEnvelope(Builder builder) {
        if (builder.eventType == null || builder.eventType.isEmpty()) {
            throw new EventValidationException("eventType cannot be empty");
        }
        if (builder.payload == null) {
            throw new EventValidationException("payload must be a map");
        }
        for (String key : builder.payload.keySet()) {
            if (key == null) {
                throw new EventValidationException("payload cannot contain null keys");
            }
        }
        Set<String> missing = new TreeSet<>();
        for (String field : builder.requiredFields) {
            if (builder.payload.get(field) == null) {
                missing.add(field);
            }
        }
        if (!missing.isEmpty()) {
            throw new EventValidationException(
                    "Event " + builder.eventType + " is missing required fields " + missing);
        }
        if (builder.eventId != null && builder.eventId.isEmpty()) {
            throw new EventValidationException("eventId cannot be empty");
        }

        this.eventId = builder.eventId == null ? newEventId() : builder.eventId;
        this.eventType = builder.eventType;
        this.payload = deepCopy(builder.payload);
        this.metadata = new EventMetadata(
                builder.timestamp == null ? Instant.now() : builder.timestamp,
                builder.correlationId,
                builder.causationId,
                builder.priority == null ? Priority.NORMAL : builder.priority,
                builder.retryCount,
                builder.maxRetries,
                builder.timeout == null ? EventMetadata.DEFAULT_TIMEOUT : builder.timeout,
                builder.category == null ? EventMetadata.DEFAULT_CATEGORY : builder.category,
                builder.tags,
                builder.source == null ? EventMetadata.DEFAULT_SOURCE : builder.source,
                builder.version == null ? EventMetadata.DEFAULT_VERSION : builder.version,
                builder.userId,
                builder.sessionId,
                builder.requestId);
    }

    /**
     * Creates a builder with a type-safe event type. Required fields declared by the type are
     * checked at build time.
     *
     * @param eventType the event type
     * @return a new builder
     */
    public static Builder builder(EventType eventType) {
        Objects.requireNonNull(eventType, "eventType");
        return new Builder(eventType.name(), eventType.requiredFields());
    }

    /**
     * Creates a builder with a string event type and no required fields.
     *
     * @param eventType the event type name
     * @return a new builder
     */
    public static Builder builder(String eventType) {
        return new Builder(eventType, Set.of());
    }

    public static EventEnvelope of(String eventType, Map<String, ?> payload) {
        return builder(eventType).payload(payload).build();
    }

    public static EventEnvelope of(EventType eventType, Map<String, ?> payload) {
        return builder(eventType).payload(payload).build();
    }

    public String eventId() {
        return eventId;
    }

    public String eventType() {
        return eventType;
    }

    public Map<String, Object> payload() {
        return payload;
    }

    public EventMetadata metadata() {
        return metadata;
    }

    public Priority priority() {
        return metadata.priority();
    }

    public Instant timestamp() {
        return metadata.timestamp();
    }

    public String correlationId() {
        return metadata.correlationId();
    }

    public String causationId() {
        return metadata.causationId();
    }

    public int retryCount() {
        return metadata.retryCount();
    }

    /**
     * Returns a copy with the given retry count. Type, payload and id are shared.
     *
     * @param retryCount the new retry count
     * @return a new envelope
     */
    public EventEnvelope withRetryCount(int retryCount) {
        if (retryCount == metadata.retryCount()) {
            return this;
        }
        return new EventEnvelope(eventId, eventType, payload, metadata.withRetryCount(retryCount));
    }

    /**
     * Returns a copy carrying one more routing tag.
     *
     * @param tag the tag to add
     * @return a new envelope, or this one if the tag is already present
     */
    public EventEnvelope withTag(String tag) {
        if (metadata.hasTag(tag)) {
            return this;
        }
        return new EventEnvelope(eventId, eventType, payload, metadata.withTag(tag));
    }

    /**
     * Returns a copy with the given correlation and causation ids.
     *
     * @param correlationId the correlation id, may be {@code null}
     * @param causationId   the causation id, may be {@code null}
     * @return a new envelope
     */
    public EventEnvelope withCorrelation(String correlationId, String causationId) {
        return new EventEnvelope(eventId, eventType, payload, metadata.withCorrelation(correlationId, causationId));
    }

    /**
     * Returns the canonical map form of this envelope. Absent optional values are omitted.
     *
     * @return an ordered, mutable map safe to hand to a JSON encoder
     */
    public Map<String, Object> toMap() {
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("timestamp", metadata.timestamp().toString());
        putIfNotNull(meta, "correlationId", metadata.correlationId());
        putIfNotNull(meta, "causationId", metadata.causationId());
        meta.put("priority", metadata.priority().name());
        meta.put("retryCount", metadata.retryCount());
        meta.put("maxRetries", metadata.maxRetries());
        meta.put("timeout", metadata.timeout().toString());
        meta.put("category", metadata.category());
        meta.put("tags", new ArrayList<>(metadata.tags()));
        meta.put("source", metadata.source());
        meta.put("version", metadata.version());
        putIfNotNull(meta, "userId", metadata.userId());
        putIfNotNull(meta, "sessionId", metadata.sessionId());
        putIfNotNull(meta, "requestId", metadata.requestId());

        Map<String, Object> map = new LinkedHashMap<>();
        map.put("eventId", eventId);
        map.put("eventType", eventType);
        map.put("payload", new LinkedHashMap<>(payload));
        map.put("metadata", meta);
        return map;
    }

    /**
     * Rebuilds an envelope from its {@linkplain #toMap() canonical map form}.
     *
     * <p>Type-specific required fields are not re-checked; they were validated when the event
     * was first built.
     *
     * @param map the canonical map
     * @return the envelope
     * @throws EventValidationException if the map is not a valid canonical envelope
     */
    @SuppressWarnings("unchecked")
    public static EventEnvelope fromMap(Map<String, ?> map) {
        Objects.requireNonNull(map, "map");
        Object payload = map.get("payload");
        if (payload != null && !(payload instanceof Map)) {
            throw new EventValidationException("payload must be a map");
        }
        Object rawMeta = map.get("metadata");
        Map<String, Object> meta = rawMeta instanceof Map
                ? (Map<String, Object>) rawMeta
                : Map.of();
        try {
            Builder builder = builder(stringValue(map.get("eventType")))
                    .eventId(stringValue(map.get("eventId")))
                    .payload((Map<String, ?>) payload)
                    .correlationId(stringValue(meta.get("correlationId")))
                    .causationId(stringValue(meta.get("causationId")))
                    .category(stringValue(meta.get("category")))
                    .source(stringValue(meta.get("source")))
                    .version(stringValue(meta.get("version")))
                    .userId(stringValue(meta.get("userId")))
                    .sessionId(stringValue(meta.get("sessionId")))
                    .requestId(stringValue(meta.get("requestId")));
            if (meta.get("timestamp") != null) {
                builder.timestamp(Instant.parse(meta.get("timestamp").toString()));
            }
            if (meta.get("priority") != null) {
                builder.priority(Priority.valueOf(meta.get("priority").toString()));
            }
            if (meta.get("retryCount") instanceof Number n) {
                builder.retryCount(n.intValue());
            }
            if (meta.get("maxRetries") instanceof Number n) {
                builder.maxRetries(n.intValue());
            }
            if (meta.get("timeout") != null) {
                builder.timeout(Duration.parse(meta.get("timeout").toString()));
            }
            if (meta.get("tags") instanceof Collection<?> tags) {
                Set<String> tagSet = new LinkedHashSet<>();
                for (Object tag : tags) {
                    tagSet.add(String.valueOf(tag));
                }
                builder.tags(tagSet);
            }
            return builder.build();
        } catch (EventValidationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new EventValidationException("Malformed event map: " + e.getMessage());
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EventEnvelope that)) return false;
        return eventId.equals(that.eventId)
                && eventType.equals(that.eventType)
                && payload.equals(that.payload)
                && metadata.equals(that.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventId, eventType, payload, metadata);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("EventEnvelope{eventId=").append(eventId)
                .append(", eventType=").append(eventType)
                .append(", priority=").append(metadata.priority());
        if (metadata.correlationId() != null) {
            sb.append(", correlationId=").append(metadata.correlationId());
        }
        if (metadata.retryCount() > 0) {
            sb.append(", retryCount=").append(metadata.retryCount());
        }
        return sb.append('}').toString();
    }

    /**
     * Builder for {@link EventEnvelope}.
     */
    public static final class Builder {
        private final String eventType;
        private final Set<String> requiredFields;
        private String eventId;
        private Map<String, ?> payload = Map.of();
        private Instant timestamp;
        private String correlationId;
        private String causationId;
        private Priority priority;
        private int retryCount;
        private int maxRetries = EventMetadata.DEFAULT_MAX_RETRIES;
        private Duration timeout;
        private String category;
        private Set<String> tags;
        private String source;
        private String version;
        private String userId;
        private String sessionId;
        private String requestId;

        private Builder(String eventType, Set<String> requiredFields) {
            this.eventType = eventType;
            this.requiredFields = requiredFields == null ? Set.of() : requiredFields;
        }

        /**
         * Sets a custom event identifier.
         *
         * <p>Optional. Defaults to a monotonic ULID.
         *
         * @param eventId the event identifier
         * @return this builder
         */
        public Builder eventId(String eventId) {
            this.eventId = eventId;
            return this;
        }

        /**
         * Sets the payload. The map is deep-copied at build time; nested maps and lists become
         * unmodifiable. {@code Integer}, {@code Short} and {@code Byte} values become {@code Long}
         * and {@code Float} values become {@code Double}, so a payload survives JSON storage intact.
         *
         * <p>Optional. Defaults to an empty map. {@code null} is rejected at build time.
         *
         * @param payload the payload
         * @return this builder
         */
        public Builder payload(Map<String, ?> payload) {
            this.payload = payload;
            return this;
        }

        /**
         * Sets the event timestamp.
         *
         * <p>Optional. Defaults to {@link Instant#now()}.
         *
         * @param timestamp the event timestamp
         * @return this builder
         */
        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Builder causationId(String causationId) {
            this.causationId = causationId;
            return this;
        }

        /**
         * Sets the priority.
         *
         * <p>Optional. Defaults to {@link Priority#NORMAL}.
         *
         * @param priority the priority
         * @return this builder
         */
        public Builder priority(Priority priority) {
            this.priority = priority;
            return this;
        }

        public Builder retryCount(int retryCount) {
            this.retryCount = retryCount;
            return this;
        }

        /**
         * Sets the retry ceiling suggested by the producer.
         *
         * <p>Optional. Defaults to {@value EventMetadata#DEFAULT_MAX_RETRIES}.
         *
         * @param maxRetries the retry ceiling
         * @return this builder
         */
        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        /**
         * Sets the processing timeout suggested by the producer.
         *
         * <p>Optional. Defaults to 30 seconds. Must be positive.
         *
         * @param timeout the timeout
         * @return this builder
         */
        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        /**
         * Sets the routing category.
         *
         * <p>Optional. Defaults to {@value EventMetadata#DEFAULT_CATEGORY}.
         *
         * @param category the category
         * @return this builder
         */
        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder tags(Set<String> tags) {
            this.tags = tags;
            return this;
        }

        public Builder tag(String tag) {
            Set<String> next = tags == null ? new LinkedHashSet<>() : new LinkedHashSet<>(tags);
            next.add(tag);
            this.tags = next;
            return this;
        }

        /**
         * Sets the name of the producing system.
         *
         * <p>Optional. Defaults to {@value EventMetadata#DEFAULT_SOURCE}.
         *
         * @param source the source name
         * @return this builder
         */
        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        /**
         * Builds an immutable {@link EventEnvelope}.
         *
         * @return a new event envelope
         * @throws EventValidationException if the event type is empty, the payload is missing or
         *                                  lacks a required field, or a metadata value is out of range
         */
        public EventEnvelope build() {
            return new EventEnvelope(this);
        }
    }

    private static void putIfNotNull(Map<String, Object> map, String key, Object value) {
        if (value != null) {
            map.put(key, value);
        }
    }

    private static String stringValue(Object value) {
        return value == null ? null : value.toString();
    }

    private static Map<String, Object> deepCopy(Map<String, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : source.entrySet()) {
            copy.put(entry.getKey(), deepCopyValue(entry.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }

    private static Object deepCopyValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                copy.put(String.valueOf(entry.getKey()), deepCopyValue(entry.getValue()));
            }
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof Collection<?> collection) {
            List<Object> copy = new ArrayList<>(collection.size());
            for (Object element : collection) {
                copy.add(deepCopyValue(element));
            }
            return Collections.unmodifiableList(copy);
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float f) {
            return f.doubleValue();
        }
        return value;
    }

    private static String newEventId() {
        return UlidCreator.getMonotonicUlid().toString();
    }
}
