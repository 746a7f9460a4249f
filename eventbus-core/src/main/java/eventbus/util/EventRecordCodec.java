package eventbus.util;

import eventbus.EventEnvelope;
import eventbus.Priority;
import eventbus.handler.ErrorKind;
import eventbus.handler.HandlerExecutionResult;
import eventbus.model.DeliveryConfig;
import eventbus.model.DeliveryMode;
import eventbus.model.EventRecord;
import eventbus.model.EventStatus;
import eventbus.model.StatusTransition;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Converts {@link EventRecord}s to and from JSON for durable stores.
 *
 * <p>The JSON document holds the canonical envelope map, the delivery configuration, the status,
 * every lifecycle timestamp (ISO-8601), the retry count, the last error, the handler results and
 * the transition log. Decoding rebuilds the envelope generically with
 * {@link EventEnvelope#fromMap}.
 */
public final class EventRecordCodec {
    private final JsonCodec jsonCodec;

    public EventRecordCodec() {
        this(JsonCodec.getDefault());
    }

    public EventRecordCodec(JsonCodec jsonCodec) {
        this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    }

    public String encode(EventRecord record) {
        return jsonCodec.toJson(toMap(record));
    }

    /**
     * Decodes a record.
     *
     * @param json the JSON document
     * @return the record
     * @throws IllegalArgumentException if the document is malformed
     */
    public EventRecord decode(String json) {
        return fromMap(jsonCodec.parseObject(json));
    }

    public Map<String, Object> toMap(EventRecord record) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("envelope", record.envelope().toMap());
        map.put("config", configToMap(record.config()));
        map.put("status", record.status().name());
        map.put("createdAt", record.createdAt().toString());
        map.put("processingStartedAt", instantString(record.processingStartedAt()));
        map.put("completedAt", instantString(record.completedAt()));
        map.put("nextAttemptAt", instantString(record.nextAttemptAt()));
        map.put("retryCount", record.retryCount());
        map.put("lastError", record.lastError());

        Map<String, Object> results = new LinkedHashMap<>();
        record.handlerResults().forEach((id, result) -> results.put(id, resultToMap(result)));
        map.put("handlerResults", results);

        List<Map<String, Object>> transitions = new ArrayList<>();
        for (StatusTransition t : record.transitions()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("status", t.status().name());
            entry.put("at", t.at().toString());
            entry.put("error", t.error());
            transitions.add(entry);
        }
        map.put("transitions", transitions);
        return map;
    }

    @SuppressWarnings("unchecked")
    public EventRecord fromMap(Map<String, Object> map) {
        try {
            EventEnvelope envelope = EventEnvelope.fromMap((Map<String, Object>) map.get("envelope"));
            DeliveryConfig config = configFromMap((Map<String, Object>) map.get("config"));

            Map<String, HandlerExecutionResult> results = new LinkedHashMap<>();
            Object rawResults = map.get("handlerResults");
            if (rawResults instanceof Map<?, ?> resultMap) {
                for (Map.Entry<?, ?> e : resultMap.entrySet()) {
                    results.put(String.valueOf(e.getKey()), resultFromMap((Map<String, Object>) e.getValue()));
                }
            }

            List<StatusTransition> transitions = new ArrayList<>();
            Object rawTransitions = map.get("transitions");
            if (rawTransitions instanceof List<?> list) {
                for (Object o : list) {
                    Map<String, Object> t = (Map<String, Object>) o;
                    transitions.add(new StatusTransition(
                            EventStatus.valueOf(t.get("status").toString()),
                            Instant.parse(t.get("at").toString()),
                            stringOrNull(t.get("error"))));
                }
            }

            return new EventRecord(
                    envelope,
                    config,
                    EventStatus.valueOf(map.get("status").toString()),
                    Instant.parse(map.get("createdAt").toString()),
                    instantOrNull(map.get("processingStartedAt")),
                    instantOrNull(map.get("completedAt")),
                    instantOrNull(map.get("nextAttemptAt")),
                    ((Number) map.getOrDefault("retryCount", 0)).intValue(),
                    stringOrNull(map.get("lastError")),
                    results,
                    transitions);
        } catch (IllegalArgumentException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Malformed event record: " + e, e);
        }
    }

    private static Map<String, Object> configToMap(DeliveryConfig config) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("mode", config.mode().name());
        map.put("priority", config.priority().name());
        map.put("maxRetries", config.maxRetries());
        map.put("retryDelay", config.retryDelay().toString());
        map.put("backoffMultiplier", config.backoffMultiplier());
        map.put("maxRetryDelay", config.maxRetryDelay().toString());
        map.put("timeout", config.timeout().toString());
        map.put("deadLetterEnabled", config.deadLetterEnabled());
        return map;
    }

    private static DeliveryConfig configFromMap(Map<String, Object> map) {
        if (map == null) {
            return DeliveryConfig.defaults();
        }
        DeliveryConfig.Builder builder = DeliveryConfig.builder();
        if (map.get("mode") != null) {
            builder.mode(DeliveryMode.valueOf(map.get("mode").toString()));
        }
        if (map.get("priority") != null) {
            builder.priority(Priority.valueOf(map.get("priority").toString()));
        }
        if (map.get("maxRetries") instanceof Number n) {
            builder.maxRetries(n.intValue());
        }
        if (map.get("retryDelay") != null) {
            builder.retryDelay(Duration.parse(map.get("retryDelay").toString()));
        }
        if (map.get("backoffMultiplier") instanceof Number n) {
            builder.backoffMultiplier(n.doubleValue());
        }
        if (map.get("maxRetryDelay") != null) {
            builder.maxRetryDelay(Duration.parse(map.get("maxRetryDelay").toString()));
        }
        if (map.get("timeout") != null) {
            builder.timeout(Duration.parse(map.get("timeout").toString()));
        }
        if (map.get("deadLetterEnabled") instanceof Boolean b) {
            builder.deadLetterEnabled(b);
        }
        return builder.build();
    }

    private static Map<String, Object> resultToMap(HandlerExecutionResult result) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("handlerId", result.handlerId());
        map.put("success", result.success());
        map.put("executionTime", result.executionTime().toString());
        map.put("errorMessage", result.errorMessage());
        map.put("errorKind", result.errorKind() == null ? null : result.errorKind().name());
        map.put("retriesUsed", result.retriesUsed());
        map.put("startedAt", result.startedAt().toString());
        return map;
    }

    private static HandlerExecutionResult resultFromMap(Map<String, Object> map) {
        Object kind = map.get("errorKind");
        return new HandlerExecutionResult(
                map.get("handlerId").toString(),
                Boolean.TRUE.equals(map.get("success")),
                Duration.parse(map.get("executionTime").toString()),
                stringOrNull(map.get("errorMessage")),
                kind == null ? null : ErrorKind.valueOf(kind.toString()),
                ((Number) map.getOrDefault("retriesUsed", 0)).intValue(),
                Instant.parse(map.get("startedAt").toString()));
    }

    private static String instantString(Instant instant) {
        return instant == null ? null : instant.toString();
    }

    private static Instant instantOrNull(Object value) {
        return value == null ? null : Instant.parse(value.toString());
    }

    private static String stringOrNull(Object value) {
        return value == null ? null : value.toString();
    }
}
