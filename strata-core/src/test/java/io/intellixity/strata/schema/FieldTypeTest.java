package io.intellixity.strata.schema;

import io.intellixity.strata.json.Json;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class FieldTypeTest {

  @Test
  void wireLookupIsExact() {
    assertEquals(FieldType.UNIQUE_ID, FieldType.fromWire("uniqueID").orElseThrow());
    assertTrue(FieldType.fromWire("String").isEmpty());
    assertTrue(FieldType.STRING.isCore());
    assertFalse(FieldType.EMAIL.isCore());
  }

  @Test
  void fieldListSurvivesStorageFormat() {
    List<FieldDef> fields = List.of(
        FieldDef.required("age", FieldType.NUMBER).withValidation(FieldValidation.range(0.0, 120.0)),
        FieldDef.of("status", FieldType.STRING).withDefault("new"));
    String stored = Json.write(fields);
    assertTrue(stored.contains("\"type\":\"number\""));
    assertTrue(stored.contains("\"default\":\"new\""));

    List<FieldDef> back = Json.convert(Json.tree(stored), new com.fasterxml.jackson.core.type.TypeReference<List<FieldDef>>() {});
    assertEquals(fields, back);
  }
}
