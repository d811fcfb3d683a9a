package trialdb.bus;

import trialdb.OutboxMessage;
import trialdb.spi.MessageBus;
import trialdb.util.RecentHistory;

import java.util.List;
import java.util.logging.Logger;

/**
 * {@link MessageBus} that logs each message instead of sending it anywhere.
 * Used in debug mode and when no broker is configured. Only the most recent
 * {@value RecentHistory#DEFAULT_CAPACITY} messages are kept for {@link #published()}.
 */
public final class LoggingMessageBus implements MessageBus {
  private static final Logger logger = Logger.getLogger(LoggingMessageBus.class.getName());

  private final RecentHistory<OutboxMessage> published = new RecentHistory<>();

  @Override
  public void publish(String channel, String message) {
    OutboxMessage entry = new OutboxMessage(channel, message);
    logger.info("Publish to " + channel + ": " + message);
    published.add(entry);
  }

  /**
   * Returns the most recently logged messages, in publish order.
   */
  public List<OutboxMessage> published() {
    return published.snapshot();
  }
}
