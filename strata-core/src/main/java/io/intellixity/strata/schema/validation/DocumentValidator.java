package io.intellixity.strata.schema.validation;

import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.strata.json.Json;
import io.intellixity.strata.schema.FieldDef;
import io.intellixity.strata.schema.FieldValidation;
import io.intellixity.strata.schema.Identifiers;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.net.URI;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Pure check of a document payload against a collection's fields.\n
 *
 * - Required fields are checked first, in declaration order.\n
 * - Present fields are then type-checked in declaration order.\n
 * - Undeclared keys are allowed. {@code unique} is not checked here.\n
 * - The first failure wins.\n
 */
public final class DocumentValidator {
  private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");
  private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
      DateTimeFormatter.ISO_INSTANT,
      DateTimeFormatter.ISO_OFFSET_DATE_TIME,
      DateTimeFormatter.ISO_ZONED_DATE_TIME,
      DateTimeFormatter.ISO_LOCAL_DATE_TIME,
      DateTimeFormatter.ISO_LOCAL_DATE,
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm[:ss][.SSS]"),
      DateTimeFormatter.RFC_1123_DATE_TIME);

  private DocumentValidator() {}

  public static ValidationResult validate(JsonNode document, List<FieldDef> fields) {
    if (document == null || !document.isObject()) return ValidationResult.fail("Document must be an object");
    return validate(Json.toMap(document), fields);
  }

  public static ValidationResult validate(Map<String, ?> document, List<FieldDef> fields) {
    if (document == null) return ValidationResult.fail("Document must be an object");
    if (fields == null || fields.isEmpty()) return ValidationResult.ok();

    for (FieldDef f : fields) {
      if (f.required() && !document.containsKey(f.name())) {
        return ValidationResult.fail("Missing required field: " + f.name());
      }
    }
    for (FieldDef f : fields) {
      if (!document.containsKey(f.name())) continue;
      String err = check(f, document.get(f.name()));
      if (err != null) return ValidationResult.fail(err);
    }
    return ValidationResult.ok();
  }

  private static String check(FieldDef f, Object value) {
    FieldValidation v = f.validation() == null ? FieldValidation.none() : f.validation();
    String n = f.name();
    return switch (f.type().kind()) {
      case STRING -> checkString(n, value, v);
      case EMAIL -> {
        String err = checkString(n, value, v);
        if (err == null && !EMAIL.matcher((String) value).matches()) err = "Field " + n + " must be a valid email address";
        yield err;
      }
      case URL -> {
        String err = checkString(n, value, v);
        if (err == null && !isHttpUrl((String) value)) err = "Field " + n + " must be a valid URL";
        yield err;
      }
      case UUID -> {
        String err = checkString(n, value, v);
        if (err == null && !Identifiers.isUuid((String) value)) err = "Field " + n + " must be a valid UUID";
        yield err;
      }
      case NUMBER -> checkNumber(n, value, v, false);
      case INTEGER -> checkNumber(n, value, v, true);
      case BOOLEAN -> value instanceof Boolean ? null : "Field " + n + " must be a boolean";
      case DATE -> (value instanceof String s && isDate(s)) ? null : "Field " + n + " must be a valid date string";
      case ARRAY -> checkArray(n, value, v);
      case OBJECT -> value instanceof Map<?, ?> ? null : "Field " + n + " must be an object";
      case ANY -> null;
    };
  }

  private static String checkString(String n, Object value, FieldValidation v) {
    if (!(value instanceof String s)) return "Field " + n + " must be a string";
    if (v.minLength() != null && s.length() < v.minLength()) {
      return "Field " + n + " must be at least " + v.minLength() + " characters";
    }
    if (v.maxLength() != null && s.length() > v.maxLength()) {
      return "Field " + n + " must be at most " + v.maxLength() + " characters";
    }
    if (v.pattern() != null && !v.pattern().isEmpty() && !matches(v.pattern(), s)) {
      return "Field " + n + " does not match the required pattern";
    }
    return null;
  }

  private static String checkNumber(String n, Object value, FieldValidation v, boolean integral) {
    if (!(value instanceof Number num) || !isFinite(num)) return "Field " + n + " must be a number";
    if (integral && !isIntegral(num)) return "Field " + n + " must be an integer";
    double d = num.doubleValue();
    if (v.min() != null && d < v.min()) return "Field " + n + " must be at least " + format(v.min());
    if (v.max() != null && d > v.max()) return "Field " + n + " must be at most " + format(v.max());
    return null;
  }

  private static String checkArray(String n, Object value, FieldValidation v) {
    int size;
    if (value instanceof Collection<?> c) size = c.size();
    else if (value instanceof Object[] arr) size = arr.length;
    else return "Field " + n + " must be an array";

    if (v.minItems() != null && size < v.minItems()) {
      return "Field " + n + " must have at least " + v.minItems() + " items";
    }
    if (v.maxItems() != null && size > v.maxItems()) {
      return "Field " + n + " must have at most " + v.maxItems() + " items";
    }
    return null;
  }

  private static boolean matches(String pattern, String s) {
    try {
      return Pattern.compile(pattern).matcher(s).find();
    } catch (PatternSyntaxException e) {
      return false;
    }
  }

  private static boolean isFinite(Number num) {
    if (num instanceof Double d) return Double.isFinite(d);
    if (num instanceof Float f) return Float.isFinite(f);
    return true;
  }

  private static boolean isIntegral(Number num) {
    if (num instanceof Integer || num instanceof Long || num instanceof Short
        || num instanceof Byte || num instanceof BigInteger) {
      return true;
    }
    if (num instanceof BigDecimal bd) return bd.stripTrailingZeros().scale() <= 0;
    double d = num.doubleValue();
    return d == Math.rint(d);
  }

  private static boolean isHttpUrl(String s) {
    try {
      URI u = URI.create(s);
      return u.isAbsolute() && ("http".equalsIgnoreCase(u.getScheme()) || "https".equalsIgnoreCase(u.getScheme()))
          && u.getHost() != null;
    } catch (IllegalArgumentException e) {
      return false;
    }
  }

  static boolean isDate(String s) {
    String t = s.trim();
    if (t.isEmpty()) return false;
    for (DateTimeFormatter f : DATE_FORMATS) {
      if (parses(t, f)) return true;
    }
    return false;
  }

  private static boolean parses(String s, DateTimeFormatter f) {
    try {
      f.parse(s);
      return true;
    } catch (DateTimeParseException e) {
      return false;
    }
  }

  /** Renders whole numbers without a trailing ".0". */
  private static String format(double d) {
    if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 1e15) return Long.toString((long) d);
    return Double.toString(d);
  }
}
