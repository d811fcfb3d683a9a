package trialdb.jdbc.tx;

import trialdb.RetriesExhaustedException;
import trialdb.jdbc.SqlStates;
import trialdb.retry.RandomExponentialRetryPolicy;
import trialdb.retry.RetryPolicy;
import trialdb.retry.Sleeper;
import trialdb.spi.MetricsExporter;

import java.sql.SQLException;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs units of work under SERIALIZABLE isolation, re-running them when the store
 * reports a serialization conflict.
 *
 * <p>With SERIALIZABLE isolation a commit fails if the transaction read data that a
 * concurrent transaction has since modified. Each attempt runs in a fresh session; a
 * conflicting attempt is rolled back, released, and retried after a randomized backoff,
 * up to {@code maxAttempts} attempts in total. Any other failure is rethrown after the
 * first attempt. No backoff happens after a successful attempt.
 *
 * <pre>{@code
 * SerializableRetryDriver driver = SerializableRetryDriver.builder()
 *     .sessionManager(sessionManager)
 *     .build();
 *
 * int seat = driver.execute(session -> claimNextFreeSeat(session.connection()));
 * }</pre>
 */
public final class SerializableRetryDriver {
  private static final Logger logger = Logger.getLogger(SerializableRetryDriver.class.getName());

  /** Default attempt budget. */
  public static final int DEFAULT_MAX_ATTEMPTS = 100;

  private final SessionManager sessionManager;
  private final int maxAttempts;
  private final RetryPolicy retryPolicy;
  private final Sleeper sleeper;
  private final Predicate<Throwable> conflictClassifier;
  private final MetricsExporter metrics;

  private SerializableRetryDriver(Builder builder) {
    this.sessionManager = Objects.requireNonNull(builder.sessionManager, "sessionManager");
    if (builder.maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    this.maxAttempts = builder.maxAttempts;
    this.retryPolicy = builder.retryPolicy != null
        ? builder.retryPolicy : new RandomExponentialRetryPolicy();
    this.sleeper = builder.sleeper != null ? builder.sleeper : Sleeper.SYSTEM;
    this.conflictClassifier = builder.conflictClassifier != null
        ? builder.conflictClassifier : SqlStates::isSerializationFailure;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Runs {@code work} until one attempt commits, and returns that attempt's result.
   *
   * <p>Any session already bound to the calling thread is released (its uncommitted work
   * rolled back) before the first attempt.
   *
   * @param work unit of work; must not commit or close the session itself
   * @return the result of the attempt that committed
   * @throws RetriesExhaustedException if every attempt ended in a serialization conflict
   * @throws InterruptedException      if interrupted during backoff; the last conflict is suppressed
   * @throws Exception                 any non-conflict failure from {@code work} or the commit, unchanged
   */
  public <T> T execute(SessionWork<T> work) throws Exception {
    Objects.requireNonNull(work, "work");
    sessionManager.context().remove();

    for (int attempt = 1; ; attempt++) {
      Session session = sessionManager.begin(IsolationLevel.SERIALIZABLE);
      T result;
      try {
        result = work.execute(session);
        session.commit();
      } catch (Throwable failure) {
        abandon(session, failure);
        if (!(failure instanceof Exception) || !conflictClassifier.test(failure)) {
          throw failure;
        }
        metrics.incrementSerializationConflict();
        if (attempt >= maxAttempts) {
          metrics.incrementRetriesExhausted();
          logger.log(Level.WARNING, "Serialized transaction still conflicting after "
              + attempt + " attempts, giving up", failure);
          throw new RetriesExhaustedException(attempt, failure);
        }
        long delayMs = retryPolicy.computeDelayMs(attempt);
        logger.fine("Serialization conflict on attempt " + attempt + "/" + maxAttempts
            + ", retrying in " + delayMs + "ms");
        backoff(delayMs, failure);
        continue;
      }
      session.close();
      if (attempt > 1) {
        logger.fine("Serialized transaction committed on attempt " + attempt);
      }
      return result;
    }
  }

  /**
   * Returns a {@link Callable} that runs {@code work} through {@link #execute} each time
   * it is called.
   */
  public <T> Callable<T> serialized(SessionWork<T> work) {
    Objects.requireNonNull(work, "work");
    return () -> execute(work);
  }

  public int maxAttempts() {
    return maxAttempts;
  }

  private void backoff(long delayMs, Throwable conflict) throws InterruptedException {
    try {
      sleeper.sleep(delayMs);
    } catch (InterruptedException e) {
      e.addSuppressed(conflict);
      throw e;
    }
  }

  private static void abandon(Session session, Throwable failure) {
    try {
      session.rollback();
    } catch (SQLException | RuntimeException e) {
      failure.addSuppressed(e);
    }
    try {
      session.close();
    } catch (SQLException | RuntimeException e) {
      failure.addSuppressed(e);
    }
  }

  /**
   * Builder for {@link SerializableRetryDriver}.
   */
  public static final class Builder {
    private SessionManager sessionManager;
    private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
    private RetryPolicy retryPolicy;
    private Sleeper sleeper;
    private Predicate<Throwable> conflictClassifier;
    private MetricsExporter metrics;

    private Builder() {
    }

    public Builder sessionManager(SessionManager sessionManager) {
      this.sessionManager = sessionManager;
      return this;
    }

    /**
     * Total attempts, including the first. Defaults to {@value #DEFAULT_MAX_ATTEMPTS}.
     */
    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    /**
     * Delay before each retry. Defaults to {@link RandomExponentialRetryPolicy} with a
     * mean of two seconds.
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    public Builder sleeper(Sleeper sleeper) {
      this.sleeper = sleeper;
      return this;
    }

    /**
     * Decides which failures are serialization conflicts. Defaults to
     * {@link SqlStates#isSerializationFailure(Throwable)}.
     */
    public Builder conflictClassifier(Predicate<Throwable> conflictClassifier) {
      this.conflictClassifier = conflictClassifier;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public SerializableRetryDriver build() {
      return new SerializableRetryDriver(this);
    }
  }
}
