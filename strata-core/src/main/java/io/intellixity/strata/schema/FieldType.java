package io.intellixity.strata.schema;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

/**
 * Closed set of declarable field types.\n
 *
 * The six core types are {@code string, number, boolean, date, array, object}; the remaining
 * constants are the extended types the admin UI offers, each validated through exactly one {@link Kind}.\n
 */
public enum FieldType {
  STRING("string", Kind.STRING),
  NUMBER("number", Kind.NUMBER),
  BOOLEAN("boolean", Kind.BOOLEAN),
  DATE("date", Kind.DATE),
  ARRAY("array", Kind.ARRAY),
  OBJECT("object", Kind.OBJECT),

  TEXT("text", Kind.STRING),
  PHONE("phone", Kind.STRING),
  EMAIL("email", Kind.EMAIL),
  URL("url", Kind.URL),
  UUID("uuid", Kind.UUID),
  UNIQUE_ID("uniqueID", Kind.STRING),
  INTEGER("integer", Kind.INTEGER),
  FLOAT("float", Kind.NUMBER),
  DECIMAL("decimal", Kind.NUMBER),
  DATETIME("datetime", Kind.DATE),
  TIMESTAMP("timestamp", Kind.DATE),
  REFERENCE("reference", Kind.STRING),
  FILE("file", Kind.STRING),
  RELATION("relation", Kind.ANY),
  JSON("json", Kind.ANY);

  /** Validation family; every {@link FieldType} maps to exactly one. */
  public enum Kind {
    STRING,
    EMAIL,
    URL,
    UUID,
    NUMBER,
    INTEGER,
    BOOLEAN,
    DATE,
    ARRAY,
    OBJECT,
    ANY
  }

  private final String wire;
  private final Kind kind;

  FieldType(String wire, Kind kind) {
    this.wire = wire;
    this.kind = kind;
  }

  @JsonValue
  public String wire() { return wire; }

  public Kind kind() { return kind; }

  public boolean isCore() { return ordinal() <= OBJECT.ordinal(); }

  /** Exact, case-sensitive lookup by wire name. */
  public static Optional<FieldType> fromWire(String wire) {
    if (wire == null) return Optional.empty();
    for (FieldType t : values()) {
      if (t.wire.equals(wire)) return Optional.of(t);
    }
    return Optional.empty();
  }

  @JsonCreator
  public static FieldType of(String wire) {
    return fromWire(wire).orElseThrow(() -> new IllegalArgumentException("Invalid field type: " + wire));
  }
}
