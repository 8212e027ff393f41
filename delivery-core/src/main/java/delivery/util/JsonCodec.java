package delivery.util;

import java.util.Map;

/**
 * Codec between stored payload records and their JSON text.
 *
 * <p>Records are single JSON objects whose values are strings, integral numbers,
 * booleans, or one level of nested string-to-string objects (payload headers).
 * The default implementation ({@link DefaultJsonCodec}) handles exactly that shape
 * without external dependencies.
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
    return DefaultJsonCodec.INSTANCE;
  }

  /**
   * Encodes a record as a JSON object string.
   *
   * @param record field map; values must be {@link String}, {@link Integer}, {@link Long},
   *               {@link Boolean}, {@code null}, or a {@code Map<String, String>}
   * @return JSON text
   * @throws IllegalArgumentException on unsupported value types or null keys
   */
  String toJson(Map<String, ?> record);

  /**
   * Parses a JSON object string. Integral numbers decode as {@link Long}, nested objects
   * as {@code Map<String, String>}; {@code null} values are dropped.
   *
   * @param json the JSON text
   * @return parsed fields in document order (never {@code null})
   * @throws IllegalArgumentException if the text is not an object of the supported shape
   */
  Map<String, Object> parseObject(String json);
}
