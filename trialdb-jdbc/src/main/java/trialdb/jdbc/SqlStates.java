package trialdb.jdbc;

import java.sql.SQLException;
import java.sql.SQLTransactionRollbackException;
import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Classifies JDBC failures by SQLSTATE.
 */
public final class SqlStates {
  /** Class 40: transaction rollback (serialization failure, deadlock). */
  public static final String TRANSACTION_ROLLBACK_CLASS = "40";
  /** Serialization failure under SERIALIZABLE isolation. */
  public static final String SERIALIZATION_FAILURE = "40001";
  /** Class 28: invalid authorization specification. */
  public static final String INVALID_AUTHORIZATION_CLASS = "28";

  private SqlStates() {
  }

  /**
   * Returns {@code true} if {@code error}, or anything in its cause chain, reports that the
   * store rolled the transaction back because of concurrent activity and it may succeed if
   * run again.
   */
  public static boolean isSerializationFailure(Throwable error) {
    Map<Throwable, Boolean> seen = new IdentityHashMap<>();
    for (Throwable t = error; t != null && seen.put(t, Boolean.TRUE) == null; t = t.getCause()) {
      if (t instanceof SQLTransactionRollbackException) {
        return true;
      }
      if (t instanceof SQLException sql && hasClass(sql.getSQLState(), TRANSACTION_ROLLBACK_CLASS)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Returns {@code true} if {@code error}, or anything in its cause chain, reports that the
   * store rejected the credentials.
   */
  public static boolean isAuthenticationFailure(Throwable error) {
    Map<Throwable, Boolean> seen = new IdentityHashMap<>();
    for (Throwable t = error; t != null && seen.put(t, Boolean.TRUE) == null; t = t.getCause()) {
      if (t instanceof SQLException sql && hasClass(sql.getSQLState(), INVALID_AUTHORIZATION_CLASS)) {
        return true;
      }
      String message = t.getMessage();
      if (message != null && message.contains("password authentication failed")) {
        return true;
      }
    }
    return false;
  }

  private static boolean hasClass(String sqlState, String stateClass) {
    return sqlState != null && sqlState.startsWith(stateClass);
  }
}
