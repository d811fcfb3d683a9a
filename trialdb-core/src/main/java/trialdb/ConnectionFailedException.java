package trialdb;

/**
 * Thrown when the configured store cannot be reached, rejects the credentials, or does
 * not answer within the health-check timeout.
 *
 * <p>This is a startup failure; it is never retried automatically.
 */
public final class ConnectionFailedException extends RuntimeException {
  public ConnectionFailedException(String message, Throwable cause) {
    super(message, cause);
  }
}
