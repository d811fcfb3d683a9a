package trialdb.jdbc.tx;

import trialdb.jdbc.SessionException;
import trialdb.spi.SessionContext;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Optional;

/**
 * {@link SessionContext} that binds at most one {@link Session} to each thread.
 *
 * <p>Binding is done by {@link SessionManager#begin()} and undone by {@link Session#close()},
 * so a session never outlives its scope on the thread. Code that holds the session handle
 * should use it directly; this context is for code further down the call stack.
 *
 * @see SessionManager
 */
public final class ThreadLocalSessionContext implements SessionContext {
  private final ThreadLocal<Session> current = new ThreadLocal<>();

  @Override
  public boolean isSessionActive() {
    return current.get() != null;
  }

  @Override
  public Connection currentConnection() {
    return currentSession().connection();
  }

  @Override
  public void queueMessage(String channel, String message) {
    currentSession().queueMessage(channel, message);
  }

  /**
   * Returns the session bound to this thread.
   *
   * @throws IllegalStateException if none is bound
   */
  public Session currentSession() {
    Session session = current.get();
    if (session == null) {
      throw new IllegalStateException("No active session");
    }
    return session;
  }

  public Optional<Session> findSession() {
    return Optional.ofNullable(current.get());
  }

  /**
   * Closes and unbinds whatever session is bound to this thread, rolling back its
   * uncommitted work. Does nothing if none is bound.
   *
   * @throws SessionException if the session's connection could not be released cleanly;
   *                          the thread is unbound regardless
   */
  public void remove() {
    Session session = current.get();
    if (session == null) {
      return;
    }
    try {
      session.close();
    } catch (SQLException e) {
      throw new SessionException("Failed to release session", e);
    } finally {
      current.remove();
    }
  }

  void bind(Session session) {
    if (current.get() != null) {
      throw new IllegalStateException("Session already active on this thread");
    }
    current.set(session);
  }

  void unbind(Session session) {
    if (current.get() == session) {
      current.remove();
    }
  }
}
