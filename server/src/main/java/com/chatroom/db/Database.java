package com.chatroom.db;

import com.chatroom.config.DatabaseConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.sql.SQLException;
import javax.annotation.Nonnull;
import javax.sql.DataSource;
import org.tinylog.Logger;

/**
 * The process-wide connection pool. Opened once at startup, handed to the controller, and closed
 * at shutdown.
 */
public class Database implements AutoCloseable {

  private final DatabaseConfig config;
  private final HikariDataSource dataSource;

  private Database(DatabaseConfig config, HikariDataSource dataSource) {
    this.config = config;
    this.dataSource = dataSource;
  }

  /**
   * Creates the HikariCP pool described by {@code config}. Connections are opened lazily, so this
   * does not prove the store is reachable; see {@link ChatDAO#verifyConnectivity()}.
   */
  @Nonnull
  public static Database open(DatabaseConfig config) {
    HikariConfig hikari = new HikariConfig();
    hikari.setJdbcUrl(config.jdbcUrl());
    hikari.setUsername(config.username());
    hikari.setPassword(config.password());
    hikari.setMaximumPoolSize(config.maxPoolSize());
    hikari.setMinimumIdle(Math.min(2, config.maxPoolSize()));
    hikari.setIdleTimeout(30000);
    hikari.setMaxLifetime(1800000);
    hikari.setConnectionTimeout(30000);
    // Ambient reads run in auto-commit mode; Transaction switches it off per business operation.
    hikari.setAutoCommit(true);
    hikari.setTransactionIsolation(config.isolationLevel().hikariName());
    hikari.setPoolName("ChatroomPool");
    hikari.addDataSourceProperty("cachePrepStmts", "true");
    hikari.addDataSourceProperty("prepStmtCacheSize", "250");
    hikari.addDataSourceProperty("prepStmtCacheSqlLimit", "2048");

    Logger.info("Initializing database connection pool: {}", config.toSecureString());
    return new Database(config, new HikariDataSource(hikari));
  }

  @Nonnull
  public DatabaseConfig config() {
    return config;
  }

  /** Returns the pool, for statements that run outside a transaction. */
  @Nonnull
  public DataSource dataSource() {
    return dataSource;
  }

  /**
   * Borrows a connection and starts a transaction on it. The caller owns the result and must
   * close it.
   */
  @Nonnull
  public Transaction beginTransaction() throws SQLException {
    return new Transaction(dataSource.getConnection());
  }

  @Override
  public void close() {
    if (!dataSource.isClosed()) {
      Logger.info("Closing database connection pool");
      dataSource.close();
    }
  }
}
