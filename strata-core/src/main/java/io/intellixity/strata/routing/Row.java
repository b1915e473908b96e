package io.intellixity.strata.routing;

import io.intellixity.strata.json.Json;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One result row keyed by column label, with lenient typed accessors.\n
 *
 * SQLite stores booleans as integers and JSON as text; {@link #bool} and {@link #jsonMap} undo that.\n
 */
public final class Row {
  private final Map<String, Object> values;

  public Row(Map<String, Object> values) {
    this.values = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(values, "values")));
  }

  public boolean has(String column) { return values.containsKey(column); }
  public Object get(String column) { return values.get(column); }
  public Map<String, Object> asMap() { return values; }

  public String string(String column) {
    Object v = values.get(column);
    return v == null ? null : String.valueOf(v);
  }

  public Long longValue(String column) {
    Object v = values.get(column);
    if (v == null) return null;
    if (v instanceof Number n) return n.longValue();
    return Long.parseLong(String.valueOf(v).trim());
  }

  public long longValue(String column, long fallback) {
    Long v = longValue(column);
    return v == null ? fallback : v;
  }

  public Double doubleValue(String column) {
    Object v = values.get(column);
    if (v == null) return null;
    if (v instanceof Number n) return n.doubleValue();
    return Double.parseDouble(String.valueOf(v).trim());
  }

  public boolean bool(String column) {
    Object v = values.get(column);
    if (v == null) return false;
    if (v instanceof Boolean b) return b;
    if (v instanceof Number n) return n.longValue() != 0;
    String s = String.valueOf(v).trim();
    return "1".equals(s) || "true".equalsIgnoreCase(s);
  }

  public Map<String, Object> jsonMap(String column) {
    return Json.readMap(string(column));
  }

  public List<String> jsonStrings(String column) {
    return Json.readStrings(string(column));
  }

  @Override
  public String toString() {
    return "Row" + values.keySet();
  }
}
