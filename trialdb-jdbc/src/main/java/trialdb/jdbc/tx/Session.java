package trialdb.jdbc.tx;

import trialdb.OutboxMessage;
import trialdb.model.SessionState;
import trialdb.outbox.OutboxPublisher;
import trialdb.outbox.SessionOutbox;
import trialdb.spi.MetricsExporter;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A unit-of-work handle bound to one borrowed connection and to the thread that opened it.
 *
 * <p>The session starts a transaction when it is opened. After {@link #commit()} or
 * {@link #rollback()} the next call to {@link #connection()} or {@link #queueMessage}
 * starts a new one. Every transaction begins with an empty outbox; messages queued in it
 * are published after the commit succeeds and discarded on any rollback, including a
 * rollback to a savepoint.
 *
 * <p>Not thread-safe: only the owning worker may use, commit, or roll back a session.
 * Obtain instances from {@link SessionManager#begin()} and close them with
 * try-with-resources:
 * <pre>{@code
 * try (Session session = sessionManager.begin()) {
 *     insertInfo(session.connection(), info);
 *     session.queueMessage("chat", info.toJson());
 *     session.commit();
 * }
 * }</pre>
 */
public final class Session implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(Session.class.getName());

  private final Connection connection;
  private final ThreadLocalSessionContext context;
  private final OutboxPublisher publisher;
  private final MetricsExporter metrics;
  private final IsolationLevel isolationLevel;
  private final int originalIsolation;
  private final SessionOutbox outbox = new SessionOutbox();

  private SessionState state = SessionState.INACTIVE;
  private boolean closed;

  Session(Connection connection, ThreadLocalSessionContext context, OutboxPublisher publisher,
      MetricsExporter metrics, IsolationLevel isolationLevel, int originalIsolation) {
    this.connection = connection;
    this.context = context;
    this.publisher = publisher;
    this.metrics = metrics;
    this.isolationLevel = isolationLevel;
    this.originalIsolation = originalIsolation;
  }

  /**
   * Returns the connection, starting a new transaction if the previous one has ended.
   *
   * @throws IllegalStateException if the session is closed
   */
  public Connection connection() {
    ensureTransaction();
    return connection;
  }

  /**
   * Queues a message for publication after the current transaction commits.
   *
   * @throws IllegalStateException if the session is closed
   */
  public void queueMessage(String channel, String message) {
    ensureTransaction();
    outbox.add(channel, message);
  }

  /**
   * Returns the messages queued in the current transaction, in insertion order.
   */
  public List<OutboxMessage> pendingMessages() {
    return outbox.entries();
  }

  public SessionState state() {
    return state;
  }

  public IsolationLevel isolationLevel() {
    return isolationLevel;
  }

  public boolean isClosed() {
    return closed;
  }

  /**
   * Creates an unnamed savepoint in the current transaction.
   */
  public Savepoint setSavepoint() throws SQLException {
    ensureTransaction();
    return connection.setSavepoint();
  }

  /**
   * Rolls back to {@code savepoint} without ending the transaction. The outbox is
   * cleared: messages queued before the savepoint are discarded too.
   *
   * @throws IllegalStateException if no transaction is active
   */
  public void rollbackTo(Savepoint savepoint) throws SQLException {
    ensureOpen();
    if (state != SessionState.ACTIVE) {
      throw new IllegalStateException("No active transaction");
    }
    try {
      connection.rollback(savepoint);
    } finally {
      int discarded = outbox.size();
      outbox.reset();
      metrics.incrementSoftRolledBack();
      logger.fine("Rolled back to savepoint, discarded " + discarded + " queued message(s)");
    }
  }

  /**
   * Commits the current transaction, then publishes its outbox in insertion order.
   *
   * <p>If the commit fails the transaction is rolled back, nothing is published, and the
   * commit failure is thrown. Publishing failures after a successful commit are logged by
   * the {@link OutboxPublisher} and do not propagate. Does nothing if no transaction is
   * active.
   *
   * @throws IllegalStateException if the session is closed
   */
  public void commit() throws SQLException {
    ensureOpen();
    if (state != SessionState.ACTIVE) {
      return;
    }
    try {
      connection.commit();
    } catch (SQLException e) {
      safeRollback(e);
      endTransaction(SessionState.ROLLED_BACK);
      metrics.incrementRolledBack();
      throw e;
    }
    List<OutboxMessage> committed = outbox.drain();
    endTransaction(SessionState.COMMITTED);
    metrics.incrementCommitted();
    if (!committed.isEmpty()) {
      publisher.publishAll(committed);
    }
  }

  /**
   * Rolls back the current transaction and clears the outbox. Does nothing if the
   * session is closed or no transaction is active.
   */
  public void rollback() throws SQLException {
    if (closed || state != SessionState.ACTIVE) {
      return;
    }
    try {
      connection.rollback();
    } finally {
      endTransaction(SessionState.ROLLED_BACK);
      metrics.incrementRolledBack();
    }
  }

  /**
   * Rolls back anything uncommitted, restores the connection's isolation and auto-commit
   * settings, returns it to its provider, and unbinds the session from its thread.
   * The session is unbound even if the connection cannot be closed. Idempotent.
   */
  @Override
  public void close() throws SQLException {
    if (closed) {
      return;
    }
    closed = true;
    SQLException failure = null;
    try {
      boolean wasActive = state == SessionState.ACTIVE;
      try {
        connection.rollback();
        if (wasActive) {
          metrics.incrementRolledBack();
        }
      } catch (SQLException e) {
        failure = e;
      }
      outbox.reset();
      try {
        if (originalIsolation != Connection.TRANSACTION_NONE
            && isolationLevel != IsolationLevel.DEFAULT) {
          connection.setTransactionIsolation(originalIsolation);
        }
        connection.setAutoCommit(true);
      } catch (SQLException e) {
        failure = chain(failure, e);
      }
      try {
        connection.close();
      } catch (SQLException e) {
        failure = chain(failure, e);
      }
    } finally {
      state = SessionState.INACTIVE;
      context.unbind(this);
      logger.fine("Session complete, connection released");
    }
    if (failure != null) {
      throw failure;
    }
  }

  void begin() {
    outbox.reset();
    state = SessionState.ACTIVE;
  }

  private void ensureTransaction() {
    ensureOpen();
    if (state != SessionState.ACTIVE) {
      begin();
    }
  }

  private void ensureOpen() {
    if (closed) {
      throw new IllegalStateException("Session is closed");
    }
  }

  private void endTransaction(SessionState next) {
    outbox.reset();
    state = next;
  }

  private void safeRollback(SQLException commitFailure) {
    try {
      connection.rollback();
    } catch (SQLException e) {
      commitFailure.addSuppressed(e);
      logger.log(Level.WARNING, "Rollback after failed commit also failed", e);
    }
  }

  private static SQLException chain(SQLException first, SQLException next) {
    if (first == null) {
      return next;
    }
    first.addSuppressed(next);
    return first;
  }
}
