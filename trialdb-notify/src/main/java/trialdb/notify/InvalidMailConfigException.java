package trialdb.notify;

/**
 * The configuration contained missing or invalid mail-related values.
 */
public final class InvalidMailConfigException extends IllegalArgumentException {
  public InvalidMailConfigException(String message) {
    super(message);
  }
}
