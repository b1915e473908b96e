package io.intellixity.strata.sqlite.catalog;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** Expected shape of one table plus the indexes that belong to it. */
public record TableDef(String name, List<ColumnDef> columns, List<String> constraints, List<String> indexes) {
  public TableDef {
    Objects.requireNonNull(name, "name");
    columns = List.copyOf(columns);
    constraints = constraints == null ? List.of() : List.copyOf(constraints);
    indexes = indexes == null ? List.of() : List.copyOf(indexes);
  }

  public String createSql() {
    StringBuilder sb = new StringBuilder("CREATE TABLE IF NOT EXISTS ").append(name).append(" (");
    for (int i = 0; i < columns.size(); i++) {
      if (i > 0) sb.append(", ");
      sb.append(columns.get(i).name()).append(' ').append(columns.get(i).definition());
    }
    for (String c : constraints) sb.append(", ").append(c);
    return sb.append(')').toString();
  }

  public Optional<ColumnDef> column(String columnName) {
    for (ColumnDef c : columns) {
      if (c.name().equalsIgnoreCase(columnName)) return Optional.of(c);
    }
    return Optional.empty();
  }

  public static Builder table(String name) { return new Builder(name); }

  public static final class Builder {
    private final String name;
    private final List<ColumnDef> columns = new ArrayList<>();
    private final List<String> constraints = new ArrayList<>();
    private final List<String> indexes = new ArrayList<>();

    private Builder(String name) { this.name = Objects.requireNonNull(name, "name"); }

    public Builder col(String column, String definition) {
      columns.add(new ColumnDef(column, definition));
      return this;
    }

    public Builder constraint(String sql) {
      constraints.add(sql);
      return this;
    }

    public Builder index(String createIndexSql) {
      indexes.add(createIndexSql);
      return this;
    }

    public TableDef build() { return new TableDef(name, columns, constraints, indexes); }
  }
}
