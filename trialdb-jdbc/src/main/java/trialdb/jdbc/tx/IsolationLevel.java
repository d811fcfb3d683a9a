package trialdb.jdbc.tx;

import java.sql.Connection;

/**
 * Transaction isolation applied when a session begins.
 */
public enum IsolationLevel {
  /** Leave the connection's isolation as configured by the driver or pool. */
  DEFAULT(-1),
  READ_COMMITTED(Connection.TRANSACTION_READ_COMMITTED),
  REPEATABLE_READ(Connection.TRANSACTION_REPEATABLE_READ),
  SERIALIZABLE(Connection.TRANSACTION_SERIALIZABLE);

  private final int jdbcLevel;

  IsolationLevel(int jdbcLevel) {
    this.jdbcLevel = jdbcLevel;
  }

  /**
   * Returns the {@link Connection} constant, or {@code -1} for {@link #DEFAULT}.
   */
  public int jdbcLevel() {
    return jdbcLevel;
  }
}
