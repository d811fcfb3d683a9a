package trialdb;

/**
 * Unchecked exception raised by {@link trialdb.spi.MessageBus} implementations when a
 * message cannot be handed to the broker.
 */
public final class MessageBusException extends RuntimeException {
  public MessageBusException(String message, Throwable cause) {
    super(message, cause);
  }

  public MessageBusException(String message) {
    super(message);
  }
}
