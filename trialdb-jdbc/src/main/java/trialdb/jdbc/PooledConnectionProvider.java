package trialdb.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import trialdb.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.util.Objects;

/**
 * {@link ConnectionProvider} backed by a bounded HikariCP pool.
 *
 * <p>At most {@link DatabaseConfig#getMaxPoolSize()} connections are borrowed at once.
 * A borrower that finds the pool empty waits up to
 * {@link DatabaseConfig#getConnectionTimeoutMs()} and then fails with
 * {@link PoolExhaustedException}.
 *
 * <p>The pool starts even if the store is unreachable; use {@link ConnectionCheck} to
 * probe it at startup.
 */
public final class PooledConnectionProvider implements ConnectionProvider, AutoCloseable {
  private final HikariDataSource dataSource;
  private final int maxPoolSize;
  private final long connectionTimeoutMs;

  public PooledConnectionProvider(DatabaseConfig config) {
    Objects.requireNonNull(config, "config");
    config.validate();
    HikariConfig hikari = new HikariConfig();
    hikari.setJdbcUrl(config.getUrl());
    if (config.getUsername() != null) {
      hikari.setUsername(config.getUsername());
    }
    if (config.getPassword() != null) {
      hikari.setPassword(config.getPassword());
    }
    hikari.setMaximumPoolSize(config.getMaxPoolSize());
    hikari.setMinimumIdle(Math.min(config.getMinimumIdle(), config.getMaxPoolSize()));
    hikari.setConnectionTimeout(config.getConnectionTimeoutMs());
    hikari.setPoolName(config.getPoolName());
    hikari.setInitializationFailTimeout(-1);
    this.dataSource = new HikariDataSource(hikari);
    this.maxPoolSize = config.getMaxPoolSize();
    this.connectionTimeoutMs = config.getConnectionTimeoutMs();
  }

  @Override
  public Connection getConnection() throws SQLException {
    try {
      return dataSource.getConnection();
    } catch (SQLTransientConnectionException e) {
      if (activeConnections() >= maxPoolSize) {
        throw new PoolExhaustedException(maxPoolSize, connectionTimeoutMs, e);
      }
      throw e;
    }
  }

  public int maxPoolSize() {
    return maxPoolSize;
  }

  /**
   * Returns the number of connections currently borrowed from the pool.
   */
  public int activeConnections() {
    HikariPoolMXBean pool = dataSource.getHikariPoolMXBean();
    return pool == null ? 0 : pool.getActiveConnections();
  }

  public boolean isClosed() {
    return dataSource.isClosed();
  }

  @Override
  public void close() {
    dataSource.close();
  }
}
