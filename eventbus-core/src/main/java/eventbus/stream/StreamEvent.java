package eventbus.stream;

import eventbus.EventEnvelope;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * An event as observed on the stream.
 *
 * @param eventId    the event id returned by publish
 * @param eventType  the event type
 * @param payload    the event payload
 * @param metadata   canonical metadata map, as in {@link EventEnvelope#toMap()}
 * @param receivedAt when the stream accepted the event
 */
public record StreamEvent(
        String eventId,
        String eventType,
        Map<String, Object> payload,
        Map<String, Object> metadata,
        Instant receivedAt) {

    public StreamEvent {
        Objects.requireNonNull(eventId, "eventId");
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(metadata, "metadata");
        Objects.requireNonNull(receivedAt, "receivedAt");
    }

    @SuppressWarnings("unchecked")
    static StreamEvent of(String eventId, EventEnvelope event, Instant receivedAt) {
        Object metadata = event.toMap().get("metadata");
        return new StreamEvent(eventId, event.eventType(), event.payload(),
                metadata instanceof Map<?, ?> m ? (Map<String, Object>) m : Map.of(), receivedAt);
    }
}
