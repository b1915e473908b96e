package io.intellixity.strata.sqlite;

import io.intellixity.strata.error.ValidationException;

import java.nio.file.Path;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Deterministic layout of database files under one data directory.\n
 *
 * - main: {@code <dataDir>/main.db}\n
 * - project: {@code <dataDir>/projects/<projectId>/database.db} with a sibling {@code files/} folder\n
 */
public record StoragePaths(Path dataDir) {
  private static final Pattern PROJECT_ID = Pattern.compile("^[A-Za-z0-9_-]+$");

  public static final String MAIN_FILE = "main.db";
  public static final String PROJECT_FILE = "database.db";

  public StoragePaths {
    dataDir = Objects.requireNonNull(dataDir, "dataDir").toAbsolutePath().normalize();
  }

  public Path mainDb() { return dataDir.resolve(MAIN_FILE); }
  public Path projectsDir() { return dataDir.resolve("projects"); }

  public Path projectDir(String projectId) {
    return projectsDir().resolve(requireProjectId(projectId));
  }

  public Path projectDb(String projectId) { return projectDir(projectId).resolve(PROJECT_FILE); }
  public Path projectFilesDir(String projectId) { return projectDir(projectId).resolve("files"); }

  /** Rejects ids that could escape the projects directory. */
  public static String requireProjectId(String projectId) {
    if (projectId == null || !PROJECT_ID.matcher(projectId).matches()) {
      throw new ValidationException("Invalid project id: " + projectId);
    }
    return projectId;
  }
}
