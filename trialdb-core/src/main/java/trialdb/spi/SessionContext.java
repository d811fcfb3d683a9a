package trialdb.spi;

import java.sql.Connection;

/**
 * Gives code deep in a call stack access to the session bound to the current worker,
 * without having the session handle passed to it.
 *
 * <p>Implementation: {@code trialdb.jdbc.tx.ThreadLocalSessionContext}.
 */
public interface SessionContext {

  /**
   * Returns {@code true} if a session is bound to the current thread.
   */
  boolean isSessionActive();

  /**
   * Returns the JDBC connection of the bound session, starting a new transaction on it
   * if the previous one has ended.
   *
   * @throws IllegalStateException if no session is bound
   */
  Connection currentConnection();

  /**
   * Queues a message in the bound session's outbox. It is published after the
   * session's current transaction commits and discarded if it rolls back.
   *
   * @param channel bus channel
   * @param message payload
   * @throws IllegalStateException if no session is bound
   */
  void queueMessage(String channel, String message);
}
