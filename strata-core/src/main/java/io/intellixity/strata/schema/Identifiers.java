package io.intellixity.strata.schema;

import java.util.regex.Pattern;

/** Name rules shared by collections and fields. */
public final class Identifiers {
  private static final Pattern NAME = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");
  private static final Pattern UUID = Pattern.compile(
      "^[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}$", Pattern.CASE_INSENSITIVE);

  private Identifiers() {}

  public static boolean isName(String s) {
    return s != null && NAME.matcher(s).matches();
  }

  public static boolean isUuid(String s) {
    return s != null && UUID.matcher(s).matches();
  }
}
