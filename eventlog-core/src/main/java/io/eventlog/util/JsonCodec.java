package io.eventlog.util;

import java.util.Map;

/**
 * Codec for event metadata maps to and from JSON text.
 *
 * <p>The default implementation ({@link DefaultJsonCodec}) has no dependencies and
 * handles flat string-to-string objects only. Applications that already ship Jackson
 * or Gson can implement this interface and hand it to the event record codec.
 *
 * @see #getDefault()
 * @see io.eventlog.codec.EventRecordCodec
 */
public interface JsonCodec {

  /**
   * Returns the shared default implementation.
   */
  static JsonCodec getDefault() {
    return DefaultJsonCodec.INSTANCE;
  }

  /**
   * Encodes a string map as a JSON object. Returns {@code null} for a null or empty map.
   *
   * @param values the entries to encode
   * @return JSON text, or {@code null}
   */
  String toJson(Map<String, String> values);

  /**
   * Parses a JSON object into a string map. {@code null}, blank or {@code "null"} input
   * yields an empty map.
   *
   * @param json the JSON text
   * @return parsed entries in document order, never {@code null}
   * @throws IllegalArgumentException if the input is not a flat JSON object of strings
   */
  Map<String, String> parseObject(String json);
}
