package eventbus;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventEnvelopeTest {

    private static final EventType PLANT_WATERED = StringEventType.of("PlantWatered", "plantId", "amountMl");

    @Test
    void appliesMetadataDefaults() {
        EventEnvelope event = EventEnvelope.of("PlantWatered", Map.of("plantId", "p-1"));

        assertEquals(26, event.eventId().length());
        assertEquals(Priority.NORMAL, event.priority());
        assertEquals(0, event.retryCount());
        assertEquals(EventMetadata.DEFAULT_MAX_RETRIES, event.metadata().maxRetries());
        assertEquals(EventMetadata.DEFAULT_TIMEOUT, event.metadata().timeout());
        assertEquals("general", event.metadata().category());
        assertEquals("eventbus", event.metadata().source());
        assertEquals("1.0", event.metadata().version());
        assertNull(event.correlationId());
        assertTrue(event.metadata().tags().isEmpty());
    }

    @Test
    void eventIdsAreUniqueAndSortable() {
        EventEnvelope first = EventEnvelope.of("A", Map.of());
        EventEnvelope second = EventEnvelope.of("A", Map.of());

        assertNotEquals(first.eventId(), second.eventId());
        assertTrue(first.eventId().compareTo(second.eventId()) < 0);
    }

    @Test
    void rejectsEmptyEventType() {
        assertThrows(EventValidationException.class, () -> EventEnvelope.of("", Map.of()));
    }

    @Test
    void rejectsMissingPayload() {
        assertThrows(EventValidationException.class, () ->
                EventEnvelope.builder("PlantWatered").payload(null).build());
    }

    @Test
    void rejectsMissingRequiredFields() {
        EventValidationException e = assertThrows(EventValidationException.class, () ->
                EventEnvelope.of(PLANT_WATERED, Map.of("plantId", "p-1")));

        assertTrue(e.getMessage().contains("amountMl"));
    }

    @Test
    void requiredFieldWithNullValueCountsAsMissing() {
        Map<String, Object> payload = new HashMap<>();
        payload.put("plantId", "p-1");
        payload.put("amountMl", null);

        assertThrows(EventValidationException.class, () -> EventEnvelope.of(PLANT_WATERED, payload));
    }

    @Test
    void rejectsNegativeRetryCount() {
        assertThrows(EventValidationException.class, () ->
                EventEnvelope.builder("A").payload(Map.of()).retryCount(-1).build());
    }

    @Test
    void validationExceptionIsIllegalArgument() {
        assertTrue(IllegalArgumentException.class.isAssignableFrom(EventValidationException.class));
    }

    @Test
    void payloadIsDefensivelyCopied() {
        Map<String, Object> payload = new HashMap<>();
        payload.put("plantId", "p-1");
        EventEnvelope event = EventEnvelope.of("PlantWatered", payload);

        payload.put("plantId", "p-2");

        assertEquals("p-1", event.payload().get("plantId"));
        assertThrows(UnsupportedOperationException.class, () -> event.payload().put("x", 1));
    }

    @Test
    void payloadNumbersAreWidened() {
        EventEnvelope event = EventEnvelope.of("PlantWatered", Map.of(
                "amountMl", 250,
                "readings", List.of((short) 3, 4.5f),
                "totalMl", 9_000_000_000L));

        assertEquals(250L, event.payload().get("amountMl"));
        assertEquals(List.of(3L, 4.5d), event.payload().get("readings"));
        assertEquals(9_000_000_000L, event.payload().get("totalMl"));
    }

    @Test
    void copyMethodsKeepIdentity() {
        EventEnvelope event = EventEnvelope.builder("PlantWatered")
                .payload(Map.of("plantId", "p-1"))
                .tag("garden")
                .build();

        EventEnvelope retried = event.withRetryCount(2);
        EventEnvelope tagged = event.withTag("urgent");
        EventEnvelope correlated = event.withCorrelation("corr-1", "cause-1");

        assertEquals(event.eventId(), retried.eventId());
        assertEquals(2, retried.retryCount());
        assertEquals(0, event.retryCount());
        assertTrue(tagged.metadata().hasTag("urgent"));
        assertTrue(tagged.metadata().hasTag("garden"));
        assertFalse(event.metadata().hasTag("urgent"));
        assertEquals("corr-1", correlated.correlationId());
        assertEquals("cause-1", correlated.causationId());
    }

    @Test
    void canonicalMapRoundTrip() {
        Instant timestamp = Instant.parse("2024-05-01T10:15:30Z");
        EventEnvelope event = EventEnvelope.builder(PLANT_WATERED)
                .payload(Map.of("plantId", "p-1", "amountMl", 250, "sensors", List.of("s1", "s2")))
                .timestamp(timestamp)
                .priority(Priority.HIGH)
                .correlationId("corr-1")
                .timeout(Duration.ofSeconds(5))
                .tag("b")
                .tag("a")
                .userId("user-7")
                .build();

        Map<String, Object> map = event.toMap();
        @SuppressWarnings("unchecked")
        Map<String, Object> meta = (Map<String, Object>) map.get("metadata");

        assertEquals("2024-05-01T10:15:30Z", meta.get("timestamp"));
        assertEquals("HIGH", meta.get("priority"));
        assertEquals(List.of("a", "b"), meta.get("tags"));
        assertFalse(meta.containsKey("causationId"));

        EventEnvelope restored = EventEnvelope.fromMap(map);
        assertEquals(event, restored);
        assertEquals(event.metadata(), restored.metadata());
        assertEquals(event.payload(), restored.payload());
    }

    @Test
    void fromMapDoesNotRecheckRequiredFields() {
        Map<String, Object> map = Map.of(
                "eventId", "01HXYZ",
                "eventType", "PlantWatered",
                "payload", Map.of());

        EventEnvelope restored = EventEnvelope.fromMap(map);

        assertEquals("01HXYZ", restored.eventId());
    }

    @Test
    void fromMapRejectsMalformedMetadata() {
        Map<String, Object> map = Map.of(
                "eventType", "PlantWatered",
                "payload", Map.of(),
                "metadata", Map.of("priority", "URGENT"));

        assertThrows(EventValidationException.class, () -> EventEnvelope.fromMap(map));
    }
}
