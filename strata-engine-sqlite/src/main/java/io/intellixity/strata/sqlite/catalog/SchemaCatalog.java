package io.intellixity.strata.sqlite.catalog;

import java.util.List;
import java.util.Optional;

/**
 * Expected tables of the main database and of every project database.\n
 *
 * Columns listed here are the target of additive repair; nothing outside this catalog is ever dropped.\n
 */
public final class SchemaCatalog {
  private SchemaCatalog() {}

  public static final List<String> CRITICAL_MAIN_TABLES = List.of("admin_users", "projects", "sessions", "api_keys");

  public static final TableDef ADMIN_USERS = TableDef.table("admin_users")
      .col("id", "TEXT PRIMARY KEY")
      .col("username", "TEXT UNIQUE NOT NULL")
      .col("email", "TEXT UNIQUE NOT NULL")
      .col("password_hash", "TEXT NOT NULL DEFAULT ''")
      .col("role", "TEXT NOT NULL DEFAULT 'admin'")
      .col("access_level", "TEXT NOT NULL DEFAULT 'read_only'")
      .col("permissions", "TEXT DEFAULT '[]'")
      .col("scopes", "TEXT DEFAULT '[]'")
      .col("is_active", "INTEGER DEFAULT 1")
      .col("created_at", "TEXT DEFAULT CURRENT_TIMESTAMP")
      .col("updated_at", "TEXT DEFAULT CURRENT_TIMESTAMP")
      .col("last_login", "TEXT")
      .col("login_count", "INTEGER DEFAULT 0")
      .col("api_key", "TEXT")
      .index("CREATE UNIQUE INDEX IF NOT EXISTS idx_admin_users_api_key ON admin_users(api_key)")
      .build();

  public static final TableDef PROJECTS = TableDef.table("projects")
      .col("id", "TEXT PRIMARY KEY")
      .col("name", "TEXT UNIQUE NOT NULL")
      .col("description", "TEXT")
      .col("owner_id", "TEXT")
      .col("api_key", "TEXT UNIQUE NOT NULL")
      .col("project_url", "TEXT")
      .col("allowed_origins", "TEXT DEFAULT '[]'")
      .col("settings", "TEXT DEFAULT '{}'")
      .col("is_active", "INTEGER DEFAULT 1")
      .col("created_at", "TEXT DEFAULT CURRENT_TIMESTAMP")
      .col("updated_at", "TEXT DEFAULT CURRENT_TIMESTAMP")
      .col("storage_used", "INTEGER DEFAULT 0")
      .col("api_calls_count", "INTEGER DEFAULT 0")
      .col("last_api_call", "TEXT")
      .col("created_by", "TEXT")
      .build();

  public static final TableDef PROJECT_ADMINS = TableDef.table("project_admins")
      .col("id", "TEXT PRIMARY KEY")
      .col("project_id", "TEXT NOT NULL")
      .col("admin_user_id", "TEXT NOT NULL")
      .col("role", "TEXT NOT NULL DEFAULT 'viewer'")
      .col("created_at", "TEXT DEFAULT CURRENT_TIMESTAMP")
      .constraint("UNIQUE(project_id, admin_user_id)")
      .build();

  public static final TableDef SESSIONS = TableDef.table("sessions")
      .col("id", "TEXT PRIMARY KEY")
      .col("token", "TEXT UNIQUE NOT NULL")
      .col("user_id", "TEXT NOT NULL")
      .col("project_id", "TEXT")
      .col("type", "TEXT")
      .col("user_type", "TEXT")
      .col("scopes", "TEXT NOT NULL DEFAULT '[]'")
      .col("metadata", "TEXT DEFAULT '{}'")
      .col("created_at", "TEXT DEFAULT CURRENT_TIMESTAMP")
      .col("expires_at", "TEXT NOT NULL")
      .col("consumed", "INTEGER DEFAULT 0")
      .col("consumed_at", "TEXT")
      .col("last_activity", "TEXT DEFAULT CURRENT_TIMESTAMP")
      .col("last_used_at", "TEXT DEFAULT CURRENT_TIMESTAMP")
      .col("is_active", "INTEGER DEFAULT 1")
      .col("ip_address", "TEXT")
      .col("user_agent", "TEXT")
      .index("CREATE INDEX IF NOT EXISTS idx_sessions_token ON sessions(token)")
      .build();

  public static final TableDef MAIN_API_KEYS = TableDef.table("api_keys")
      .col("id", "TEXT PRIMARY KEY")
      .col("key", "TEXT UNIQUE NOT NULL")
      .col("name", "TEXT")
      .col("type", "TEXT DEFAULT 'admin'")
      .col("owner_id", "TEXT")
      .col("scopes", "TEXT DEFAULT '[]'")
      .col("project_ids", "TEXT DEFAULT '[]'")
      .col("expires_at", "TEXT")
      .col("rate_limit", "INTEGER")
      .col("metadata", "TEXT DEFAULT '{}'")
      .col("is_active", "INTEGER DEFAULT 1")
      .col("created_at", "TEXT DEFAULT CURRENT_TIMESTAMP")
      .col("last_used_at", "TEXT")
      .col("usage_count", "INTEGER DEFAULT 0")
      .index("CREATE INDEX IF NOT EXISTS idx_api_keys_owner ON api_keys(owner_id)")
      .build();

  public static final TableDef SYSTEM_CHECKS = TableDef.table("system_checks")
      .col("id", "TEXT PRIMARY KEY")
      .col("check_type", "TEXT NOT NULL")
      .col("status", "TEXT NOT NULL")
      .col("details", "TEXT DEFAULT '{}'")
      .col("last_checked", "TEXT DEFAULT CURRENT_TIMESTAMP")
      .constraint("UNIQUE(check_type)")
      .build();

  public static final TableDef ACTIVITY_LOGS = TableDef.table("activity_logs")
      .col("id", "TEXT PRIMARY KEY")
      .col("user_id", "TEXT")
      .col("user_type", "TEXT")
      .col("project_id", "TEXT")
      .col("action", "TEXT NOT NULL")
      .col("entity_type", "TEXT")
      .col("entity_id", "TEXT")
      .col("details", "TEXT DEFAULT '{}'")
      .col("metadata", "TEXT DEFAULT '{}'")
      .col("ip_address", "TEXT")
      .col("user_agent", "TEXT")
      .col("session_id", "TEXT")
      .col("created_at", "TEXT DEFAULT CURRENT_TIMESTAMP")
      .index("CREATE INDEX IF NOT EXISTS idx_activity_logs_user ON activity_logs(user_id)")
      .index("CREATE INDEX IF NOT EXISTS idx_activity_logs_project ON activity_logs(project_id)")
      .index("CREATE INDEX IF NOT EXISTS idx_activity_logs_created ON activity_logs(created_at)")
      .build();

  public static final List<TableDef> MAIN_TABLES =
      List.of(ADMIN_USERS, PROJECTS, PROJECT_ADMINS, SESSIONS, MAIN_API_KEYS, SYSTEM_CHECKS, ACTIVITY_LOGS);

  public static final TableDef COLLECTIONS = TableDef.table("collections")
      .col("id", "TEXT PRIMARY KEY")
      .col("project_id", "TEXT NOT NULL")
      .col("name", "TEXT NOT NULL")
      .col("description", "TEXT")
      .col("fields", "TEXT NOT NULL DEFAULT '[]'")
      .col("indexes", "TEXT DEFAULT '[]'")
      .col("created_at", "TEXT DEFAULT CURRENT_TIMESTAMP")
      .col("updated_at", "TEXT DEFAULT CURRENT_TIMESTAMP")
      .col("created_by", "TEXT")
      .constraint("UNIQUE(project_id, name)")
      .index("CREATE INDEX IF NOT EXISTS idx_collections_project ON collections(project_id)")
      .build();

  public static final TableDef DOCUMENTS = TableDef.table("documents")
      .col("id", "TEXT PRIMARY KEY")
      .col("collection_id", "TEXT NOT NULL")
      .col("project_id", "TEXT NOT NULL")
      .col("data", "TEXT NOT NULL DEFAULT '{}'")
      .col("version", "INTEGER DEFAULT 1")
      .col("is_deleted", "INTEGER DEFAULT 0")
      .col("created_at", "TEXT DEFAULT CURRENT_TIMESTAMP")
      .col("updated_at", "TEXT DEFAULT CURRENT_TIMESTAMP")
      .col("created_by", "TEXT")
      .col("updated_by", "TEXT")
      .index("CREATE INDEX IF NOT EXISTS idx_documents_collection ON documents(collection_id)")
      .index("CREATE INDEX IF NOT EXISTS idx_documents_created ON documents(created_at)")
      .build();

  public static final TableDef FILES = TableDef.table("files")
      .col("id", "TEXT PRIMARY KEY")
      .col("project_id", "TEXT NOT NULL")
      .col("filename", "TEXT")
      .col("original_name", "TEXT")
      .col("path", "TEXT")
      .col("size", "INTEGER NOT NULL DEFAULT 0")
      .col("mime_type", "TEXT NOT NULL DEFAULT 'application/octet-stream'")
      .col("folder_id", "TEXT")
      .col("is_public", "INTEGER DEFAULT 0")
      .col("is_deleted", "INTEGER DEFAULT 0")
      .col("tags", "TEXT DEFAULT '[]'")
      .col("metadata", "TEXT DEFAULT '{}'")
      .col("created_by", "TEXT")
      .col("created_at", "TEXT DEFAULT CURRENT_TIMESTAMP")
      .col("updated_at", "TEXT DEFAULT CURRENT_TIMESTAMP")
      .index("CREATE INDEX IF NOT EXISTS idx_files_project ON files(project_id)")
      .index("CREATE INDEX IF NOT EXISTS idx_files_folder ON files(folder_id)")
      .build();

  public static final TableDef FOLDERS = TableDef.table("folders")
      .col("id", "TEXT PRIMARY KEY")
      .col("project_id", "TEXT NOT NULL")
      .col("name", "TEXT NOT NULL")
      .col("path", "TEXT NOT NULL")
      .col("parent_id", "TEXT")
      .col("created_by", "TEXT")
      .col("created_at", "TEXT DEFAULT CURRENT_TIMESTAMP")
      .col("updated_at", "TEXT DEFAULT CURRENT_TIMESTAMP")
      .index("CREATE INDEX IF NOT EXISTS idx_folders_parent ON folders(parent_id)")
      .build();

  public static final TableDef PROJECT_API_KEYS = TableDef.table("api_keys")
      .col("id", "TEXT PRIMARY KEY")
      .col("key", "TEXT UNIQUE NOT NULL")
      .col("name", "TEXT")
      .col("type", "TEXT DEFAULT 'project'")
      .col("owner_id", "TEXT")
      .col("scopes", "TEXT DEFAULT '[]'")
      .col("project_ids", "TEXT DEFAULT '[]'")
      .col("expires_at", "TEXT")
      .col("rate_limit", "INTEGER")
      .col("last_used_at", "TEXT")
      .col("created_at", "TEXT DEFAULT CURRENT_TIMESTAMP")
      .col("updated_at", "TEXT DEFAULT CURRENT_TIMESTAMP")
      .col("is_active", "INTEGER DEFAULT 1")
      .col("metadata", "TEXT DEFAULT '{}'")
      .build();

  public static final TableDef PROJECT_USERS = TableDef.table("project_users")
      .col("id", "TEXT PRIMARY KEY")
      .col("project_id", "TEXT NOT NULL")
      .col("username", "TEXT NOT NULL")
      .col("email", "TEXT NOT NULL")
      .col("password_hash", "TEXT")
      .col("role", "TEXT DEFAULT 'user'")
      .col("scopes", "TEXT DEFAULT '[]'")
      .col("is_active", "INTEGER DEFAULT 1")
      .col("metadata", "TEXT DEFAULT '{}'")
      .col("created_at", "TEXT DEFAULT CURRENT_TIMESTAMP")
      .col("updated_at", "TEXT DEFAULT CURRENT_TIMESTAMP")
      .constraint("UNIQUE(project_id, email)")
      .build();

  public static final TableDef CHANGELOG = TableDef.table("changelog")
      .col("id", "TEXT PRIMARY KEY")
      .col("project_id", "TEXT NOT NULL")
      .col("collection_id", "TEXT")
      .col("action", "TEXT NOT NULL")
      .col("entity_type", "TEXT NOT NULL")
      .col("entity_id", "TEXT NOT NULL")
      .col("changes", "TEXT DEFAULT '{}'")
      .col("user_id", "TEXT")
      .col("created_at", "TEXT DEFAULT CURRENT_TIMESTAMP")
      .index("CREATE INDEX IF NOT EXISTS idx_changelog_entity ON changelog(entity_type, entity_id)")
      .index("CREATE INDEX IF NOT EXISTS idx_changelog_created ON changelog(created_at)")
      .build();

  public static final List<TableDef> PROJECT_TABLES =
      List.of(COLLECTIONS, DOCUMENTS, FILES, FOLDERS, PROJECT_API_KEYS, PROJECT_USERS, CHANGELOG);

  public static Optional<TableDef> mainTable(String name) { return find(MAIN_TABLES, name); }

  public static Optional<TableDef> projectTable(String name) { return find(PROJECT_TABLES, name); }

  private static Optional<TableDef> find(List<TableDef> tables, String name) {
    for (TableDef t : tables) {
      if (t.name().equalsIgnoreCase(name)) return Optional.of(t);
    }
    return Optional.empty();
  }
}
