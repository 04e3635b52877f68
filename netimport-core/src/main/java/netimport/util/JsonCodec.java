package netimport.util;

import java.util.Map;

/**
 * Encodes flat {@code Map<String, String>} values (job settings) to and from JSON text.
 *
 * <p>{@link #getDefault()} returns a dependency-free implementation. Applications with a
 * JSON library on the classpath may supply their own.
 */
public interface JsonCodec {

  static JsonCodec getDefault() {
    return DefaultJsonCodec.INSTANCE;
  }

  /**
   * Encodes a map as a JSON object. {@code null} or empty input yields {@code "{}"}.
   *
   * @param values map to encode
   * @return JSON object text
   */
  String toJson(Map<String, String> values);

  /**
   * Parses a JSON object whose values are strings or {@code null}; {@code null} members
   * are dropped. {@code null}, blank and {@code "null"} input yield an empty map.
   *
   * @param json JSON object text
   * @return parsed map in document order (never {@code null})
   * @throws IllegalArgumentException if the input is not such an object
   */
  Map<String, String> parseObject(String json);
}
