package trialdb.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import trialdb.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code trialdb.session.committed}: transactions committed</li>
 *   <li>{@code trialdb.session.rolled_back}: transactions rolled back in full</li>
 *   <li>{@code trialdb.session.soft_rolled_back}: rollbacks to a savepoint</li>
 *   <li>{@code trialdb.outbox.published}: messages handed to the bus</li>
 *   <li>{@code trialdb.outbox.publish_failed}: messages dropped after all publish attempts</li>
 *   <li>{@code trialdb.serializable.conflict}: serialization conflicts seen by the retry driver</li>
 *   <li>{@code trialdb.serializable.exhausted}: serializable work that ran out of attempts</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter committed;
  private final Counter rolledBack;
  private final Counter softRolledBack;
  private final Counter published;
  private final Counter publishFailed;
  private final Counter serializationConflict;
  private final Counter retriesExhausted;
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "trialdb"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "trialdb");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "lab.trialdb"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.committed = Counter.builder(namePrefix + ".session.committed")
        .description("Transactions committed")
        .register(registry);
    this.rolledBack = Counter.builder(namePrefix + ".session.rolled_back")
        .description("Transactions rolled back in full")
        .register(registry);
    this.softRolledBack = Counter.builder(namePrefix + ".session.soft_rolled_back")
        .description("Rollbacks to a savepoint")
        .register(registry);
    this.published = Counter.builder(namePrefix + ".outbox.published")
        .description("Outbox messages handed to the bus")
        .register(registry);
    this.publishFailed = Counter.builder(namePrefix + ".outbox.publish_failed")
        .description("Outbox messages dropped after all publish attempts")
        .register(registry);
    this.serializationConflict = Counter.builder(namePrefix + ".serializable.conflict")
        .description("Serialization conflicts seen by the retry driver")
        .register(registry);
    this.retriesExhausted = Counter.builder(namePrefix + ".serializable.exhausted")
        .description("Serializable transactions that ran out of attempts")
        .register(registry);
  }

  @Override
  public void incrementCommitted() {
    if (closed) return;
    committed.increment();
  }

  @Override
  public void incrementRolledBack() {
    if (closed) return;
    rolledBack.increment();
  }

  @Override
  public void incrementSoftRolledBack() {
    if (closed) return;
    softRolledBack.increment();
  }

  @Override
  public void incrementPublished() {
    if (closed) return;
    published.increment();
  }

  @Override
  public void incrementPublishFailed() {
    if (closed) return;
    publishFailed.increment();
  }

  @Override
  public void incrementSerializationConflict() {
    if (closed) return;
    serializationConflict.increment();
  }

  @Override
  public void incrementRetriesExhausted() {
    if (closed) return;
    retriesExhausted.increment();
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(committed, rolledBack, softRolledBack, published,
        publishFailed, serializationConflict, retriesExhausted)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
