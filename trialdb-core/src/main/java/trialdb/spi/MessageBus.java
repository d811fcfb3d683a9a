package trialdb.spi;

/**
 * Pub/sub bus that receives outbox messages after their transaction commits.
 *
 * <p>Implementations throw {@link trialdb.MessageBusException} (or any other runtime
 * exception) when a message cannot be handed to the broker.
 *
 * @see trialdb.outbox.OutboxPublisher
 */
public interface MessageBus {

  /**
   * Publishes a single message.
   *
   * @param channel channel (subject) name
   * @param message payload
   */
  void publish(String channel, String message);

  /**
   * Blocks until previously published messages have been handed to the broker.
   * Called once after each committed batch.
   */
  default void flush() {
  }
}
