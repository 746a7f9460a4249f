package eventbus.util;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JacksonJsonCodecTest {

    private final JsonCodec codec = JsonCodec.getDefault();

    @Test
    void defaultIsJackson() {
        assertSame(JacksonJsonCodec.INSTANCE, codec);
    }

    @Test
    void instantsAreIsoStrings() {
        String json = codec.toJson(Map.of("at", Instant.parse("2024-01-01T00:00:00Z")));

        assertEquals("{\"at\":\"2024-01-01T00:00:00Z\"}", json);
    }

    @Test
    void parsesNestedObjects() {
        Map<String, Object> parsed = codec.parseObject("{\"a\":1,\"b\":[\"x\",\"y\"],\"c\":{\"d\":true}}");

        assertEquals(1L, parsed.get("a"));
        assertEquals(List.of("x", "y"), parsed.get("b"));
        assertEquals(Map.of("d", true), parsed.get("c"));
    }

    @Test
    void blankIsEmptyObject() {
        assertTrue(codec.parseObject(" ").isEmpty());
    }

    @Test
    void invalidJsonIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> codec.parseObject("[1,2]"));
        assertThrows(IllegalArgumentException.class, () -> codec.parseObject("{"));
    }
}
