package trialdb.jdbc;

import trialdb.ConnectionFailedException;
import trialdb.spi.ConnectionProvider;
import trialdb.util.DaemonThreadFactory;

import java.io.PrintStream;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Startup probe that opens a connection, validates it, and closes it again.
 *
 * <p>The probe runs on a daemon thread and is bounded by an explicit timeout so a
 * store that accepts TCP connections but never answers cannot hang startup. It is
 * not meant to be called inside retry loops.
 */
public final class ConnectionCheck {
  private static final Logger logger = Logger.getLogger(ConnectionCheck.class.getName());

  private final ConnectionProvider connectionProvider;
  private final Duration timeout;
  private final String databaseRole;

  public ConnectionCheck(ConnectionProvider connectionProvider, Duration timeout) {
    this(connectionProvider, timeout, null);
  }

  /**
   * @param connectionProvider where to obtain the probe connection
   * @param timeout            bound on the whole probe
   * @param databaseRole       role named in the remediation message; {@code null} for a generic message
   */
  public ConnectionCheck(ConnectionProvider connectionProvider, Duration timeout, String databaseRole) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.timeout = Objects.requireNonNull(timeout, "timeout");
    if (timeout.isZero() || timeout.isNegative()) {
      throw new IllegalArgumentException("timeout must be positive, got: " + timeout);
    }
    this.databaseRole = databaseRole;
  }

  public Duration timeout() {
    return timeout;
  }

  /**
   * Opens and closes one connection.
   *
   * @throws ConnectionFailedException if the store is unreachable, rejects the credentials,
   *                                   returns an invalid connection, or does not answer in time
   */
  public void check() {
    ExecutorService executor = Executors.newSingleThreadExecutor(
        new DaemonThreadFactory("trialdb-connection-check-"));
    Future<Void> probe = executor.submit(() -> {
      probeOnce();
      return null;
    });
    try {
      probe.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      logger.fine("Database connection check passed");
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      throw new ConnectionFailedException("Could not connect to the database: " + cause.getMessage(), cause);
    } catch (TimeoutException e) {
      probe.cancel(true);
      throw new ConnectionFailedException(
          "Database did not answer within " + timeout.toMillis() + "ms", e);
    } catch (InterruptedException e) {
      probe.cancel(true);
      Thread.currentThread().interrupt();
      throw new ConnectionFailedException("Interrupted while checking the database connection", e);
    } finally {
      executor.shutdownNow();
    }
  }

  /**
   * Like {@link #check()}, but when the store rejects the credentials first writes a
   * remediation message for the operator to {@code err}.
   */
  public void checkOrExplain(PrintStream err) {
    Objects.requireNonNull(err, "err");
    try {
      check();
    } catch (ConnectionFailedException e) {
      logger.log(Level.SEVERE, "Database connection check failed", e);
      if (SqlStates.isAuthenticationFailure(e)) {
        err.print(remediationMessage(databaseRole));
        err.flush();
      }
      throw e;
    }
  }

  private void probeOnce() throws SQLException {
    int validSeconds = (int) Math.max(1L, (timeout.toMillis() + 999) / 1000);
    try (Connection connection = connectionProvider.getConnection()) {
      if (!connection.isValid(validSeconds)) {
        throw new SQLException("Database returned a connection that failed validation");
      }
    }
  }

  static String remediationMessage(String role) {
    String name = role == null || role.isBlank() ? "<role>" : role;
    return "\n"
        + "*********************************************************\n"
        + "*********************************************************\n"
        + "\n"
        + "The database rejected the credentials for role \"" + name + "\".\n"
        + "\n"
        + "Create the role with:\n"
        + "\n"
        + "    createuser -P " + name + " --createdb\n"
        + "\n"
        + "and make sure DATABASE_URL carries the same password.\n"
        + "\n"
        + "*********************************************************\n"
        + "*********************************************************\n"
        + "\n";
  }
}
