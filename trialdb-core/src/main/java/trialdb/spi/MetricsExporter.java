package trialdb.spi;

/**
 * Observability hook for exporting session and outbox counters to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Increments the count of committed transactions.
   */
  void incrementCommitted();

  /**
   * Increments the count of transactions rolled back in full.
   */
  void incrementRolledBack();

  /**
   * Increments the count of rollbacks to a savepoint.
   */
  default void incrementSoftRolledBack() {
  }

  /**
   * Increments the count of outbox messages published to the bus.
   */
  void incrementPublished();

  /**
   * Increments the count of outbox messages that could not be published after all attempts.
   */
  void incrementPublishFailed();

  /**
   * Increments the count of serialization conflicts seen by the retry driver.
   */
  void incrementSerializationConflict();

  /**
   * Increments the count of serializable transactions that ran out of attempts.
   */
  void incrementRetriesExhausted();

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementCommitted() {
    }

    @Override
    public void incrementRolledBack() {
    }

    @Override
    public void incrementPublished() {
    }

    @Override
    public void incrementPublishFailed() {
    }

    @Override
    public void incrementSerializationConflict() {
    }

    @Override
    public void incrementRetriesExhausted() {
    }
  }
}
