package io.intellixity.strata.spring;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "strata")
public class StrataProperties {
  /** Root of main.db and the projects/ tree. */
  private String dataDir = "./data";
  private final Pool pool = new Pool();
  private final Admin admin = new Admin();
  private final Repair repair = new Repair();

  public String getDataDir() { return dataDir; }
  public void setDataDir(String dataDir) { this.dataDir = dataDir; }
  public Pool getPool() { return pool; }
  public Admin getAdmin() { return admin; }
  public Repair getRepair() { return repair; }

  public static class Pool {
    private int maxPoolSize = 4;
    private Duration maxIdle = Duration.ofMinutes(10);
    private Duration busyTimeout = Duration.ofSeconds(10);
    private Duration connectionTimeout = Duration.ofSeconds(30);

    public int getMaxPoolSize() { return maxPoolSize; }
    public void setMaxPoolSize(int maxPoolSize) { this.maxPoolSize = maxPoolSize; }
    public Duration getMaxIdle() { return maxIdle; }
    public void setMaxIdle(Duration maxIdle) { this.maxIdle = maxIdle; }
    public Duration getBusyTimeout() { return busyTimeout; }
    public void setBusyTimeout(Duration busyTimeout) { this.busyTimeout = busyTimeout; }
    public Duration getConnectionTimeout() { return connectionTimeout; }
    public void setConnectionTimeout(Duration connectionTimeout) { this.connectionTimeout = connectionTimeout; }
  }

  public static class Admin {
    private String username = "admin";
    private String email = "admin@localhost";

    /** Pre-hashed password; blank seeds an unusable hash. */
    private String passwordHash;

    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }
    public String getEmail() { return email; }
    public void setEmail(String email) { this.email = email; }
    public String getPasswordHash() { return passwordHash; }
    public void setPasswordHash(String passwordHash) { this.passwordHash = passwordHash; }
  }

  public static class Repair {
    private boolean onStartup = true;

    public boolean isOnStartup() { return onStartup; }
    public void setOnStartup(boolean onStartup) { this.onStartup = onStartup; }
  }
}
