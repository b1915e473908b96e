package io.intellixity.strata.routing;

import java.util.Objects;

/**
 * Routing key: the shared main database, or one project's database.\n
 *
 * A null {@code projectId} means main.\n
 */
public record DatabaseTarget(String projectId) {
  public static final DatabaseTarget MAIN = new DatabaseTarget(null);

  public static DatabaseTarget project(String projectId) {
    return new DatabaseTarget(Objects.requireNonNull(projectId, "projectId"));
  }

  public boolean isMain() { return projectId == null; }

  @Override
  public String toString() {
    return isMain() ? "main" : "project:" + projectId;
  }
}
