package trialdb.notify;

/**
 * A message could not be relayed.
 */
public final class MessengerException extends RuntimeException {
  public MessengerException(String message, Throwable cause) {
    super(message, cause);
  }
}
