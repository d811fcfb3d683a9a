package trialdb.jdbc;

import trialdb.jdbc.tx.ScopedSessions;
import trialdb.jdbc.tx.SerializableRetryDriver;
import trialdb.jdbc.tx.SessionManager;
import trialdb.jdbc.tx.SessionWork;
import trialdb.jdbc.tx.ThreadLocalSessionContext;
import trialdb.outbox.OutboxPublisher;
import trialdb.retry.RetryPolicy;
import trialdb.retry.Sleeper;
import trialdb.spi.ConnectionProvider;
import trialdb.spi.MessageBus;
import trialdb.spi.MetricsExporter;

import java.io.PrintStream;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.logging.Logger;

/**
 * Main entry point: wires the connection pool, session manager, scoped sessions, and
 * serializable retry driver around one message bus.
 *
 * <pre>{@code
 * try (TrialDb db = TrialDb.builder()
 *     .config(DatabaseConfig.from(Settings.fromEnvironment()))
 *     .messageBus(bus)
 *     .build()) {
 *   db.checkConnection();
 *   db.runScoped(session -> { ... }, true);
 * }
 * }</pre>
 *
 * <p>{@link #close()} closes the pool if this instance created it, and the message bus
 * if it is {@link AutoCloseable}.
 */
public final class TrialDb implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(TrialDb.class.getName());

  private final ConnectionProvider connectionProvider;
  private final PooledConnectionProvider ownedPool;
  private final MessageBus messageBus;
  private final SessionManager sessionManager;
  private final ScopedSessions scopedSessions;
  private final SerializableRetryDriver retryDriver;
  private final ConnectionCheck connectionCheck;

  private TrialDb(Builder builder, ConnectionProvider connectionProvider,
      PooledConnectionProvider ownedPool, ConnectionCheck connectionCheck) {
    this.connectionProvider = connectionProvider;
    this.ownedPool = ownedPool;
    this.messageBus = builder.messageBus;
    MetricsExporter metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;

    OutboxPublisher publisher = OutboxPublisher.builder()
        .messageBus(builder.messageBus)
        .maxAttempts(builder.publishMaxAttempts)
        .metrics(metrics)
        .sleeper(builder.sleeper)
        .build();
    this.sessionManager = new SessionManager(
        connectionProvider, new ThreadLocalSessionContext(), publisher, metrics);
    this.scopedSessions = new ScopedSessions(sessionManager);
    this.retryDriver = SerializableRetryDriver.builder()
        .sessionManager(sessionManager)
        .maxAttempts(builder.maxAttempts)
        .retryPolicy(builder.retryPolicy)
        .sleeper(builder.sleeper)
        .metrics(metrics)
        .build();
    this.connectionCheck = connectionCheck;
  }

  public static Builder builder() {
    return new Builder();
  }

  public SessionManager sessions() {
    return sessionManager;
  }

  public ScopedSessions scopedSessions() {
    return scopedSessions;
  }

  public SerializableRetryDriver retryDriver() {
    return retryDriver;
  }

  public ConnectionProvider connectionProvider() {
    return connectionProvider;
  }

  ConnectionCheck connectionCheck() {
    return connectionCheck;
  }

  /**
   * @see ScopedSessions#runScoped(SessionWork, boolean)
   */
  public <T> T runScoped(SessionWork<T> work, boolean commit) throws Exception {
    return scopedSessions.runScoped(work, commit);
  }

  /**
   * @see ScopedSessions#runScoped(SessionWork)
   */
  public <T> T runScoped(SessionWork<T> work) throws Exception {
    return scopedSessions.runScoped(work);
  }

  /**
   * @see SerializableRetryDriver#execute(SessionWork)
   */
  public <T> T executeSerialized(SessionWork<T> work) throws Exception {
    return retryDriver.execute(work);
  }

  /**
   * @see SerializableRetryDriver#serialized(SessionWork)
   */
  public <T> Callable<T> serialized(SessionWork<T> work) {
    return retryDriver.serialized(work);
  }

  /**
   * Queues a message in the session bound to the calling thread.
   *
   * @throws IllegalStateException if no session is bound
   */
  public void queueMessage(String channel, String message) {
    sessionManager.context().queueMessage(channel, message);
  }

  /**
   * Probes the store once, explaining credential failures on {@code System.err}.
   *
   * @throws trialdb.ConnectionFailedException if the store cannot be reached in time
   */
  public void checkConnection() {
    checkConnection(System.err);
  }

  /**
   * @see ConnectionCheck#checkOrExplain(PrintStream)
   */
  public void checkConnection(PrintStream err) {
    connectionCheck.checkOrExplain(err);
  }

  @Override
  public void close() {
    RuntimeException first = null;
    if (ownedPool != null) {
      try {
        ownedPool.close();
      } catch (RuntimeException e) {
        first = e;
      }
    }
    if (messageBus instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    logger.fine("TrialDb closed");
    if (first != null) {
      throw first;
    }
  }

  /**
   * Builder for {@link TrialDb}. Exactly one of {@link #config} and
   * {@link #connectionProvider} must be set.
   */
  public static final class Builder {
    private static final long DEFAULT_HEALTH_CHECK_TIMEOUT_MS = 5_000L;

    private DatabaseConfig config;
    private ConnectionProvider connectionProvider;
    private MessageBus messageBus;
    private MetricsExporter metrics;
    private int maxAttempts = SerializableRetryDriver.DEFAULT_MAX_ATTEMPTS;
    private RetryPolicy retryPolicy;
    private Sleeper sleeper;
    private int publishMaxAttempts = 3;
    private Long healthCheckTimeoutMs;
    private String databaseRole;

    private Builder() {
    }

    /**
     * Creates a {@link PooledConnectionProvider} owned by the built instance. The
     * connection check bypasses the pool and connects directly with the config's URL and
     * credentials. The config also supplies the health-check timeout and the database
     * role unless they are set on this builder.
     */
    public Builder config(DatabaseConfig config) {
      this.config = config;
      return this;
    }

    /**
     * Uses an existing provider. The built instance does not close it.
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    public Builder messageBus(MessageBus messageBus) {
      this.messageBus = messageBus;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Attempt budget of the serializable retry driver.
     */
    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Used for both serialization-conflict backoff and publish retries.
     */
    public Builder sleeper(Sleeper sleeper) {
      this.sleeper = sleeper;
      return this;
    }

    public Builder publishMaxAttempts(int publishMaxAttempts) {
      this.publishMaxAttempts = publishMaxAttempts;
      return this;
    }

    /**
     * Bound on {@link TrialDb#checkConnection()}. Defaults to the config's value, or
     * 5000 ms with an existing provider.
     */
    public Builder healthCheckTimeoutMs(long healthCheckTimeoutMs) {
      this.healthCheckTimeoutMs = healthCheckTimeoutMs;
      return this;
    }

    public Builder databaseRole(String databaseRole) {
      this.databaseRole = databaseRole;
      return this;
    }

    public TrialDb build() {
      Objects.requireNonNull(messageBus, "messageBus");
      if ((config == null) == (connectionProvider == null)) {
        throw new IllegalStateException("Exactly one of config and connectionProvider must be set");
      }
      if (connectionProvider != null) {
        long timeoutMs = healthCheckTimeoutMs != null ? healthCheckTimeoutMs : DEFAULT_HEALTH_CHECK_TIMEOUT_MS;
        ConnectionCheck check = new ConnectionCheck(
            connectionProvider, Duration.ofMillis(timeoutMs), databaseRole);
        return new TrialDb(this, connectionProvider, null, check);
      }
      long timeoutMs = healthCheckTimeoutMs != null ? healthCheckTimeoutMs : config.getHealthCheckTimeoutMs();
      String role = databaseRole != null ? databaseRole : config.getUsername();
      PooledConnectionProvider pool = new PooledConnectionProvider(config);
      try {
        ConnectionCheck check = new ConnectionCheck(
            DriverManagerConnectionProvider.forConfig(config), Duration.ofMillis(timeoutMs), role);
        return new TrialDb(this, pool, pool, check);
      } catch (RuntimeException e) {
        pool.close();
        throw e;
      }
    }
  }
}
