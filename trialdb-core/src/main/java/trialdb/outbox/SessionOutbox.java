package trialdb.outbox;

import trialdb.OutboxMessage;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Per-session buffer of messages to publish once the session's transaction commits.
 *
 * <p>Owned by exactly one session and therefore not thread-safe. Entries are kept in
 * insertion order.
 */
public final class SessionOutbox {
  private static final Logger logger = Logger.getLogger(SessionOutbox.class.getName());

  private final List<OutboxMessage> entries = new ArrayList<>();

  /**
   * Appends a message. No side effect beyond buffering.
   */
  public void add(String channel, String message) {
    OutboxMessage entry = new OutboxMessage(channel, message);
    if (logger.isLoggable(Level.FINE)) {
      logger.fine("Enqueueing message to " + channel + ": " + message);
    }
    entries.add(entry);
  }

  /**
   * Discards every buffered message. Called when a transaction begins and on any rollback.
   */
  public void reset() {
    entries.clear();
  }

  /**
   * Returns the buffered messages in insertion order and empties the buffer.
   */
  public List<OutboxMessage> drain() {
    List<OutboxMessage> drained = List.copyOf(entries);
    entries.clear();
    return drained;
  }

  /**
   * Returns an immutable snapshot of the buffered messages.
   */
  public List<OutboxMessage> entries() {
    return List.copyOf(entries);
  }

  public int size() {
    return entries.size();
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }
}
