package io.intellixity.strata.sqlite;

import io.intellixity.strata.error.ConflictException;
import io.intellixity.strata.error.SchemaDriftException;
import io.intellixity.strata.error.StorageException;
import io.intellixity.strata.error.StrataException;
import io.intellixity.strata.routing.DatabaseTarget;
import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;

import java.sql.SQLException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps driver errors onto the error taxonomy.\n
 *
 * - missing table/column: {@link SchemaDriftException}\n
 * - UNIQUE/PRIMARY KEY violation: {@link ConflictException}\n
 * - anything else: {@link StorageException}\n
 */
public final class SqliteErrors {
  private static final Pattern NO_SUCH = Pattern.compile("no such (?:column|table): ([\\w.\"]+)", Pattern.CASE_INSENSITIVE);
  private static final Pattern NO_COLUMN_NAMED = Pattern.compile("table (\\w+) has no column named (\\w+)", Pattern.CASE_INSENSITIVE);

  private SqliteErrors() {}

  public static StrataException translate(SQLException e, DatabaseTarget target, String op) {
    String msg = e.getMessage() == null ? "" : e.getMessage();
    if (isDrift(msg)) {
      return new SchemaDriftException("Schema drift on " + target + " during " + op + ": " + msg, missingObject(msg), e);
    }
    if (isUniqueViolation(e, msg)) {
      return new ConflictException(ConflictException.UNIQUE_CONSTRAINT,
          "Unique constraint violated on " + target + ": " + msg, e);
    }
    return new StorageException("Storage failure on " + target + " during " + op + ": " + msg, e);
  }

  static boolean isDrift(String msg) {
    String m = msg.toLowerCase(Locale.ROOT);
    return m.contains("no such column") || m.contains("has no column named") || m.contains("no such table");
  }

  private static boolean isUniqueViolation(SQLException e, String msg) {
    if (e instanceof SQLiteException se) {
      SQLiteErrorCode code = se.getResultCode();
      if (code == SQLiteErrorCode.SQLITE_CONSTRAINT_UNIQUE || code == SQLiteErrorCode.SQLITE_CONSTRAINT_PRIMARYKEY) {
        return true;
      }
    }
    return msg.contains("UNIQUE constraint failed");
  }

  static String missingObject(String msg) {
    Matcher m = NO_COLUMN_NAMED.matcher(msg);
    if (m.find()) return m.group(1) + "." + m.group(2);
    m = NO_SUCH.matcher(msg);
    if (m.find()) return m.group(1).replace("\"", "");
    return null;
  }
}
