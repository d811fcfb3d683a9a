package trialdb.outbox;

import trialdb.OutboxMessage;
import trialdb.retry.ExponentialBackoffRetryPolicy;
import trialdb.retry.RetryPolicy;
import trialdb.retry.Sleeper;
import trialdb.spi.MessageBus;
import trialdb.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Publishes a committed session's outbox to the {@link MessageBus}.
 *
 * <p>Runs only after the commit has succeeded, so a failure here cannot undo the
 * transaction. Each message is attempted up to {@code maxAttempts} times with backoff;
 * a message that still fails is logged and skipped, and the remaining messages are
 * still published in order. {@link #publishAll} never throws for bus failures.
 *
 * @see SessionOutbox
 */
public final class OutboxPublisher {
  private static final Logger logger = Logger.getLogger(OutboxPublisher.class.getName());

  private final MessageBus messageBus;
  private final RetryPolicy retryPolicy;
  private final int maxAttempts;
  private final MetricsExporter metrics;
  private final Sleeper sleeper;

  public OutboxPublisher(MessageBus messageBus) {
    this(builder().messageBus(messageBus));
  }

  private OutboxPublisher(Builder builder) {
    this.messageBus = Objects.requireNonNull(builder.messageBus, "messageBus");
    this.retryPolicy = builder.retryPolicy != null
        ? builder.retryPolicy : new ExponentialBackoffRetryPolicy(50, 1_000);
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.sleeper = builder.sleeper != null ? builder.sleeper : Sleeper.SYSTEM;
    if (builder.maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    this.maxAttempts = builder.maxAttempts;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Publishes messages in order, then flushes the bus.
   *
   * @param messages messages drained from a committed session's outbox
   * @return the messages that could not be published (empty on full success)
   */
  public List<OutboxMessage> publishAll(List<OutboxMessage> messages) {
    Objects.requireNonNull(messages, "messages");
    if (messages.isEmpty()) {
      return List.of();
    }
    List<OutboxMessage> undelivered = new ArrayList<>();
    for (OutboxMessage entry : messages) {
      if (publishWithRetry(entry)) {
        metrics.incrementPublished();
      } else {
        metrics.incrementPublishFailed();
        undelivered.add(entry);
      }
    }
    try {
      messageBus.flush();
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Message bus flush failed after publishing "
          + (messages.size() - undelivered.size()) + " message(s)", e);
    }
    return undelivered;
  }

  private boolean publishWithRetry(OutboxMessage entry) {
    for (int attempt = 1; ; attempt++) {
      try {
        if (logger.isLoggable(Level.FINE)) {
          logger.fine("Publishing message to " + entry.channel() + ": " + entry.message());
        }
        messageBus.publish(entry.channel(), entry.message());
        return true;
      } catch (RuntimeException e) {
        if (attempt >= maxAttempts) {
          logger.log(Level.SEVERE, "Dropping message to " + entry.channel()
              + " after " + attempt + " failed publish attempt(s)", e);
          return false;
        }
        logger.log(Level.WARNING, "Publish to " + entry.channel()
            + " failed (attempt " + attempt + "/" + maxAttempts + "), retrying", e);
        try {
          sleeper.sleep(retryPolicy.computeDelayMs(attempt));
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          logger.log(Level.SEVERE, "Interrupted while retrying publish to " + entry.channel(), ie);
          return false;
        }
      }
    }
  }

  /**
   * Builder for {@link OutboxPublisher}.
   */
  public static final class Builder {
    private MessageBus messageBus;
    private RetryPolicy retryPolicy;
    private int maxAttempts = 3;
    private MetricsExporter metrics;
    private Sleeper sleeper;

    private Builder() {
    }

    public Builder messageBus(MessageBus messageBus) {
      this.messageBus = messageBus;
      return this;
    }

    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Attempts per message, including the first. Defaults to 3.
     */
    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public Builder sleeper(Sleeper sleeper) {
      this.sleeper = sleeper;
      return this;
    }

    public OutboxPublisher build() {
      return new OutboxPublisher(this);
    }
  }
}
