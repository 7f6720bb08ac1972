package com.chatroom.config;

import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;
import java.sql.Connection;
import java.util.Locale;
import java.util.Map;

/**
 * Connection settings for the PostgreSQL store.
 *
 * <p>Built from the process environment by {@link #fromEnvironment()}:
 *
 * <ul>
 *   <li>{@code DB_URL} - JDBC URL, required
 *   <li>{@code DB_USER}, {@code DB_PASSWORD} - credentials
 *   <li>{@code DB_POOL_SIZE} - maximum pool size, default {@value #DEFAULT_POOL_SIZE}
 *   <li>{@code DB_ISOLATION} - one of {@link IsolationLevel}, default {@code READ_COMMITTED}
 *   <li>{@code DB_INIT_SCHEMA} - apply {@code db/01-schema.sql} at startup, default true
 *   <li>{@code DOCKER_DB} - when true, a {@code localhost} host in the URL is replaced by the
 *       compose service name {@code postgres}
 * </ul>
 *
 * @param jdbcUrl the JDBC URL of the database
 * @param username the database user
 * @param password the database password
 * @param maxPoolSize the maximum number of pooled connections
 * @param isolationLevel the isolation level every pooled connection uses
 * @param initSchema whether the schema script is applied when the controller is created
 */
public record DatabaseConfig(
    String jdbcUrl,
    String username,
    String password,
    int maxPoolSize,
    IsolationLevel isolationLevel,
    boolean initSchema) {

  public static final int DEFAULT_POOL_SIZE = 10;

  static final String DOCKER_DB_HOST = "postgres";

  /** Transaction isolation levels a deployment may choose. */
  public enum IsolationLevel {
    READ_COMMITTED(Connection.TRANSACTION_READ_COMMITTED),
    REPEATABLE_READ(Connection.TRANSACTION_REPEATABLE_READ),
    SERIALIZABLE(Connection.TRANSACTION_SERIALIZABLE);

    private final int jdbcLevel;

    IsolationLevel(int jdbcLevel) {
      this.jdbcLevel = jdbcLevel;
    }

    /** Returns the matching {@link Connection} constant. */
    public int jdbcLevel() {
      return jdbcLevel;
    }

    /** Returns the name HikariCP expects, e.g. {@code TRANSACTION_READ_COMMITTED}. */
    public String hikariName() {
      return "TRANSACTION_" + name();
    }
  }

  public DatabaseConfig {
    if (Strings.isNullOrEmpty(jdbcUrl)) {
      throw new IllegalArgumentException("DB_URL must be set");
    }
    if (maxPoolSize <= 0) {
      throw new IllegalArgumentException("DB_POOL_SIZE must be positive, got " + maxPoolSize);
    }
    if (isolationLevel == null) {
      isolationLevel = IsolationLevel.READ_COMMITTED;
    }
  }

  /** Reads the configuration from the process environment. */
  public static DatabaseConfig fromEnvironment() {
    return fromMap(System.getenv());
  }

  /** Reads the configuration from the given variables, using the same names as the environment. */
  public static DatabaseConfig fromMap(Map<String, String> env) {
    boolean docker = Boolean.parseBoolean(env.get("DOCKER_DB"));
    return new DatabaseConfig(
        resolveJdbcUrl(env.get("DB_URL"), docker),
        env.get("DB_USER"),
        env.get("DB_PASSWORD"),
        parsePoolSize(env.get("DB_POOL_SIZE")),
        parseIsolation(env.get("DB_ISOLATION")),
        Strings.isNullOrEmpty(env.get("DB_INIT_SCHEMA"))
            || Boolean.parseBoolean(env.get("DB_INIT_SCHEMA")));
  }

  /**
   * Returns the URL to connect to. Inside the compose network the database is reachable by its
   * service name rather than {@code localhost}.
   */
  static String resolveJdbcUrl(String url, boolean docker) {
    if (!docker || url == null) {
      return url;
    }
    return url.replace("//localhost", "//" + DOCKER_DB_HOST)
        .replace("@localhost", "@" + DOCKER_DB_HOST);
  }

  private static int parsePoolSize(String value) {
    if (Strings.isNullOrEmpty(value)) {
      return DEFAULT_POOL_SIZE;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("DB_POOL_SIZE must be an integer, got '" + value + "'", e);
    }
  }

  private static IsolationLevel parseIsolation(String value) {
    if (Strings.isNullOrEmpty(value)) {
      return IsolationLevel.READ_COMMITTED;
    }
    try {
      return IsolationLevel.valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown DB_ISOLATION '" + value + "'", e);
    }
  }

  /** Returns a string representation without the password, safe for logs. */
  public String toSecureString() {
    return MoreObjects.toStringHelper(this)
        .add("jdbcUrl", jdbcUrl)
        .add("username", username)
        .add("maxPoolSize", maxPoolSize)
        .add("isolationLevel", isolationLevel)
        .add("initSchema", initSchema)
        .toString();
  }
}
