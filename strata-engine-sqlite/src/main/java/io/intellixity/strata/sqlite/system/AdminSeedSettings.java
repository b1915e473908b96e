package io.intellixity.strata.sqlite.system;

import java.util.Objects;

/**
 * Identity of the default administrative account.\n
 *
 * Password hashing belongs to the external auth layer; the seeded hash defaults to an unusable value
 * that locks password login until it is set there.\n
 */
public record AdminSeedSettings(String username, String email, String passwordHash) {
  public static final String UNUSABLE_HASH = "!";
  public static final AdminSeedSettings DEFAULTS = new AdminSeedSettings("admin", "admin@localhost", UNUSABLE_HASH);

  public AdminSeedSettings {
    Objects.requireNonNull(username, "username");
    Objects.requireNonNull(email, "email");
    passwordHash = (passwordHash == null || passwordHash.isBlank()) ? UNUSABLE_HASH : passwordHash;
  }
}
