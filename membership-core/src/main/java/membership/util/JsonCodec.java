package membership.util;

import java.util.Map;

/**
 * Codec for flat {@code Map<String, String>} payloads, used for the audit log's
 * JSON column.
 *
 * <p>The default implementation ({@link DefaultJsonCodec}) has no dependencies and
 * only supports flat string-to-string objects. Applications that already use a JSON
 * library can implement this interface to delegate to it.
 *
 * @see #getDefault()
 */
public interface JsonCodec {

    /**
     * Returns the shared default implementation.
     *
     * @return the default {@link JsonCodec}
     */
    static JsonCodec getDefault() {
        return DefaultJsonCodec.INSTANCE;
    }

    /**
     * Encodes a map as a JSON object. A {@code null} or empty map encodes as {@code "{}"}.
     *
     * @param values the values to encode
     * @return JSON object text
     * @throws IllegalArgumentException if the map contains a {@code null} key
     */
    String toJson(Map<String, String> values);

    /**
     * Parses a JSON object into a map, preserving key order. {@code null} values are
     * dropped. Blank input or {@code "null"} yields an empty map.
     *
     * @param json the JSON text
     * @return parsed map (never {@code null})
     * @throws IllegalArgumentException if the input is not a flat JSON object of strings
     */
    Map<String, String> parseObject(String json);
}
