package trialdb.jdbc.tx;

import trialdb.outbox.OutboxPublisher;
import trialdb.spi.ConnectionProvider;
import trialdb.spi.MetricsExporter;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Opens {@link Session}s: borrows a connection, disables auto-commit, applies the
 * requested isolation level, and binds the session to the calling thread's
 * {@link ThreadLocalSessionContext}.
 *
 * @see ScopedSessions
 * @see SerializableRetryDriver
 */
public final class SessionManager {
  private final ConnectionProvider connectionProvider;
  private final ThreadLocalSessionContext context;
  private final OutboxPublisher publisher;
  private final MetricsExporter metrics;

  public SessionManager(ConnectionProvider connectionProvider, ThreadLocalSessionContext context,
      OutboxPublisher publisher) {
    this(connectionProvider, context, publisher, MetricsExporter.NOOP);
  }

  public SessionManager(ConnectionProvider connectionProvider, ThreadLocalSessionContext context,
      OutboxPublisher publisher, MetricsExporter metrics) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.context = Objects.requireNonNull(context, "context");
    this.publisher = Objects.requireNonNull(publisher, "publisher");
    this.metrics = metrics == null ? MetricsExporter.NOOP : metrics;
  }

  /**
   * Opens a session with the connection's default isolation level.
   *
   * @see #begin(IsolationLevel)
   */
  public Session begin() throws SQLException {
    return begin(IsolationLevel.DEFAULT);
  }

  /**
   * Opens a session and starts its first transaction.
   *
   * @param isolationLevel isolation for every transaction of this session
   * @return the new session, bound to the calling thread
   * @throws SQLException          if a connection cannot be obtained or configured;
   *                               {@link trialdb.jdbc.PoolExhaustedException} if the pool is exhausted
   * @throws IllegalStateException if a session is already bound to the calling thread
   */
  public Session begin(IsolationLevel isolationLevel) throws SQLException {
    Objects.requireNonNull(isolationLevel, "isolationLevel");
    if (context.isSessionActive()) {
      throw new IllegalStateException("Session already active on this thread");
    }
    Connection connection = connectionProvider.getConnection();
    Session session;
    try {
      int originalIsolation = connection.getTransactionIsolation();
      connection.setAutoCommit(false);
      if (isolationLevel != IsolationLevel.DEFAULT) {
        connection.setTransactionIsolation(isolationLevel.jdbcLevel());
      }
      session = new Session(connection, context, publisher, metrics, isolationLevel, originalIsolation);
      context.bind(session);
    } catch (SQLException | RuntimeException e) {
      try {
        connection.close();
      } catch (SQLException closeFailure) {
        e.addSuppressed(closeFailure);
      }
      throw e;
    }
    session.begin();
    return session;
  }

  public ThreadLocalSessionContext context() {
    return context;
  }
}
