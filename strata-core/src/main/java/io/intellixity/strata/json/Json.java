package io.intellixity.strata.json;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shared JSON codec for values stored as TEXT columns (field lists, settings, scopes, document payloads).\n
 */
public final class Json {
  private static final ObjectMapper JSON = new ObjectMapper()
      .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  private static final TypeReference<LinkedHashMap<String, Object>> MAP = new TypeReference<>() {};

  private Json() {}

  public static ObjectMapper mapper() { return JSON; }

  public static String write(Object value) {
    try {
      return JSON.writeValueAsString(value);
    } catch (Exception e) {
      throw new IllegalArgumentException("Failed to JSON-encode value of type "
          + (value == null ? "null" : value.getClass().getName()), e);
    }
  }

  public static JsonNode tree(String s) {
    if (s == null || s.isBlank()) return JSON.nullNode();
    try {
      return JSON.readTree(s);
    } catch (Exception e) {
      throw new IllegalArgumentException("Failed to JSON-decode value (len=" + s.length() + ")", e);
    }
  }

  public static <T> T read(String s, TypeReference<T> type, T fallback) {
    if (s == null || s.isBlank()) return fallback;
    try {
      T v = JSON.readValue(s, type);
      return v == null ? fallback : v;
    } catch (Exception e) {
      throw new IllegalArgumentException("Failed to JSON-decode value (len=" + s.length() + ")", e);
    }
  }

  /** Decodes a JSON object; blank input yields an empty map. */
  public static Map<String, Object> readMap(String s) {
    return read(s, MAP, new LinkedHashMap<>());
  }

  public static List<String> readStrings(String s) {
    return read(s, new TypeReference<List<String>>() {}, List.of());
  }

  public static <T> T convert(Object value, TypeReference<T> type) {
    return JSON.convertValue(value, type);
  }

  public static Map<String, Object> toMap(JsonNode node) {
    return JSON.convertValue(node, MAP);
  }

  public static JsonNode toTree(Object value) {
    return JSON.valueToTree(value);
  }
}
