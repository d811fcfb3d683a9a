package trialdb.jdbc;

import java.sql.SQLTransientConnectionException;

/**
 * Thrown when every pooled connection is borrowed and none was returned within the
 * pool's connection timeout.
 */
public final class PoolExhaustedException extends SQLTransientConnectionException {
  private final int maxPoolSize;

  public PoolExhaustedException(int maxPoolSize, long timeoutMs, Throwable cause) {
    super("Connection pool exhausted: all " + maxPoolSize
        + " connections in use, none released within " + timeoutMs + "ms", cause);
    this.maxPoolSize = maxPoolSize;
  }

  public int maxPoolSize() {
    return maxPoolSize;
  }
}
