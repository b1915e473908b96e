package io.intellixity.strata.sqlite;

import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.strata.json.Json;
import io.intellixity.strata.routing.DatabaseTarget;
import io.intellixity.strata.routing.ExecuteResult;
import io.intellixity.strata.routing.Row;
import io.intellixity.strata.routing.SqlExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * {@link SqlExecutor} over one already-acquired connection.\n
 *
 * Does not own the connection: acquisition, release and transaction boundaries belong to the caller.\n
 */
public final class ConnectionExecutor implements SqlExecutor {
  private static final Logger log = LoggerFactory.getLogger(ConnectionExecutor.class);

  private final DatabaseTarget target;
  private final Connection conn;

  public ConnectionExecutor(DatabaseTarget target, Connection conn) {
    this.target = Objects.requireNonNull(target, "target");
    this.conn = Objects.requireNonNull(conn, "conn");
  }

  @Override public DatabaseTarget target() { return target; }

  @Override
  public List<Row> query(String sql, Object... params) {
    long start = System.nanoTime();
    debugSql("QUERY", sql, params);
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bindAll(ps, params);
      try (ResultSet rs = ps.executeQuery()) {
        List<Row> out = readRows(rs);
        debugDone("QUERY", out.size(), System.nanoTime() - start);
        return out;
      }
    } catch (SQLException e) {
      throw SqliteErrors.translate(e, target, "query");
    }
  }

  @Override
  public Row queryOne(String sql, Object... params) {
    List<Row> rows = query(sql, params);
    return rows.isEmpty() ? null : rows.get(0);
  }

  @Override
  public ExecuteResult execute(String sql, Object... params) {
    long start = System.nanoTime();
    debugSql("EXECUTE", sql, params);
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bindAll(ps, params);
      long changed = ps.executeUpdate();
      Long insertedId = (changed > 0 && isInsert(sql)) ? lastInsertRowId() : null;
      debugDone("EXECUTE", changed, System.nanoTime() - start);
      return new ExecuteResult(changed, insertedId);
    } catch (SQLException e) {
      throw SqliteErrors.translate(e, target, "execute");
    }
  }

  /** Runs a {@code ;}-separated script statement by statement. Statements must not embed literal semicolons. */
  public void script(String script) {
    for (String stmt : script.split(";")) {
      String s = stmt.trim();
      if (s.isEmpty()) continue;
      debugSql("SCRIPT", s, null);
      try (Statement st = conn.createStatement()) {
        st.executeUpdate(s);
      } catch (SQLException e) {
        throw SqliteErrors.translate(e, target, "script");
      }
    }
  }

  private Long lastInsertRowId() throws SQLException {
    try (Statement st = conn.createStatement(); ResultSet rs = st.executeQuery("SELECT last_insert_rowid()")) {
      return rs.next() ? rs.getLong(1) : null;
    }
  }

  private static boolean isInsert(String sql) {
    String s = sql.stripLeading().toUpperCase(Locale.ROOT);
    return s.startsWith("INSERT") || s.startsWith("REPLACE");
  }

  private static List<Row> readRows(ResultSet rs) throws SQLException {
    ResultSetMetaData md = rs.getMetaData();
    int cols = md.getColumnCount();
    List<Row> out = new ArrayList<>();
    while (rs.next()) {
      Map<String, Object> values = new LinkedHashMap<>();
      for (int i = 1; i <= cols; i++) values.put(md.getColumnLabel(i), rs.getObject(i));
      out.add(new Row(values));
    }
    return out;
  }

  static void bindAll(PreparedStatement ps, Object[] params) throws SQLException {
    if (params == null) return;
    for (int i = 0; i < params.length; i++) {
      int idx = i + 1;
      Object v = params[i];
      if (v == null) ps.setNull(idx, Types.NULL);
      else if (v instanceof Boolean b) ps.setInt(idx, b ? 1 : 0);
      else if (v instanceof JsonNode n) ps.setString(idx, n.toString());
      else if (v instanceof Map<?, ?> || v instanceof Collection<?>) ps.setString(idx, Json.write(v));
      else if (v instanceof TemporalAccessor || v instanceof UUID) ps.setString(idx, v.toString());
      else if (v instanceof Enum<?> e) ps.setString(idx, e.name());
      else ps.setObject(idx, v);
    }
  }

  private void debugSql(String op, String sql, Object[] params) {
    if (!log.isDebugEnabled()) return;
    log.debug("strata.sql op={} target={} bindCount={} sql={}", op, target, params == null ? 0 : params.length, sql);

    // TRACE: bind summary only (no raw values)
    if (log.isTraceEnabled() && params != null) {
      for (int i = 0; i < params.length; i++) {
        Object v = params[i];
        int len = (v instanceof CharSequence cs) ? cs.length() : -1;
        log.trace("strata.sql bind index={} valueType={} valueLen={}",
            i + 1, v == null ? "null" : v.getClass().getSimpleName(), len);
      }
    }
  }

  private void debugDone(String op, long result, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("strata.sql_done op={} target={} durationMs={} result={}", op, target, durationNanos / 1_000_000.0, result);
  }
}
