package eventbus.util;

import java.util.Map;

/**
 * JSON encoder/decoder for the canonical map forms of envelopes and records.
 *
 * <p>The default implementation ({@link JacksonJsonCodec}) uses a Jackson {@code ObjectMapper}
 * with Java time support. Values are plain maps, lists, strings, numbers and booleans.
 *
 * @see #getDefault()
 */
public interface JsonCodec {

    /**
     * Returns the default singleton implementation.
     *
     * @return the default {@link JsonCodec}
     */
    static JsonCodec getDefault() {
        return JacksonJsonCodec.INSTANCE;
    }

    /**
     * Encodes a value as JSON.
     *
     * @param value the value to encode
     * @return JSON text
     * @throws IllegalArgumentException if the value cannot be encoded
     */
    String toJson(Object value);

    /**
     * Parses a JSON object. Returns an empty map for {@code null} or blank input.
     *
     * @param json the JSON text
     * @return parsed map (never {@code null})
     * @throws IllegalArgumentException if the input is not a valid JSON object
     */
    Map<String, Object> parseObject(String json);
}
