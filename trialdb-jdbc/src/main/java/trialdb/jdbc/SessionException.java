package trialdb.jdbc;

/**
 * Unchecked exception wrapping JDBC errors raised where a method cannot declare
 * {@link java.sql.SQLException}.
 */
public final class SessionException extends RuntimeException {
  public SessionException(String message, Throwable cause) {
    super(message, cause);
  }
}
