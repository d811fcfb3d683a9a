package trialdb.jdbc.tx;

import trialdb.spi.SessionContext;

import java.sql.SQLException;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs units of work inside a session that is guaranteed to be rolled back on failure
 * and released on every exit path.
 *
 * <pre>{@code
 * ScopedSessions sessions = new ScopedSessions(sessionManager);
 *
 * // commit on normal completion
 * sessions.runScoped(session -> {
 *     recordTransmission(session.connection(), transmission);
 *     session.queueMessage("chat", transmission.toJson());
 *     return null;
 * }, true);
 *
 * // wrap a worker so each call gets its own session
 * ScopedFunction<Long, Void> worker = sessions.scopedFunction("process_node", (session, nodeId) -> {
 *     ...
 *     session.commit();
 *     return null;
 * });
 * }</pre>
 */
public final class ScopedSessions {
  private static final Logger logger = Logger.getLogger(ScopedSessions.class.getName());

  private final SessionManager sessionManager;

  public ScopedSessions(SessionManager sessionManager) {
    this.sessionManager = Objects.requireNonNull(sessionManager, "sessionManager");
  }

  /**
   * Runs {@code work} without committing; the work commits explicitly if it needs to.
   *
   * @see #runScoped(SessionWork, boolean)
   */
  public <T> T runScoped(SessionWork<T> work) throws Exception {
    return runScoped(work, false);
  }

  /**
   * Opens a session, runs {@code work} in it, and releases it.
   *
   * <p>If {@code work} completes and {@code commit} is {@code true}, the transaction is
   * committed and its outbox published. If {@code work} or the commit throws, the failure
   * is logged before anything else happens, the transaction is rolled back (clearing the
   * outbox), and the original exception is rethrown; a rollback or release failure is
   * attached to it as suppressed. In every case the session is unbound from the calling
   * thread before this method returns or throws.
   *
   * @param work   unit of work; receives the session
   * @param commit whether to commit after {@code work} returns normally
   * @return the result of {@code work}
   * @throws Exception whatever {@code work} threw, unchanged; or the {@link SQLException}
   *                   raised by opening, committing, or releasing the session
   */
  public <T> T runScoped(SessionWork<T> work, boolean commit) throws Exception {
    Objects.requireNonNull(work, "work");
    Session session = sessionManager.begin();
    T result;
    try {
      result = work.execute(session);
      if (commit) {
        session.commit();
        logger.fine("Session auto-committed as requested");
      }
    } catch (Throwable failure) {
      logger.log(Level.SEVERE, "Exception during scoped transaction, rolling back", failure);
      try {
        session.rollback();
      } catch (SQLException | RuntimeException rollbackFailure) {
        failure.addSuppressed(rollbackFailure);
      }
      try {
        session.close();
      } catch (SQLException | RuntimeException closeFailure) {
        failure.addSuppressed(closeFailure);
      }
      throw failure;
    }
    session.close();
    return result;
  }

  /**
   * Returns a {@link Callable} that runs {@code work} in a fresh scoped session, without
   * committing, each time it is called.
   */
  public <T> Callable<T> scoped(String name, SessionWork<T> work) {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(work, "work");
    return () -> {
      logger.fine("Running " + name + " in scoped session");
      return runScoped(work, false);
    };
  }

  /**
   * Returns a function that runs {@code function} in a fresh scoped session, without
   * committing, each time it is applied.
   */
  public <A, R> ScopedFunction<A, R> scopedFunction(String name, SessionFunction<A, R> function) {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(function, "function");
    return argument -> {
      logger.fine("Running " + name + " in scoped session");
      return runScoped(session -> function.apply(session, argument), false);
    };
  }

  /**
   * Queues a message in the session bound to the calling thread.
   *
   * @throws IllegalStateException if no session is bound
   * @see SessionContext#queueMessage(String, String)
   */
  public void queueMessage(String channel, String message) {
    sessionManager.context().queueMessage(channel, message);
  }
}
