package trialdb.nats;

import io.nats.client.Connection;
import io.nats.client.Nats;
import io.nats.client.Options;
import trialdb.MessageBusException;
import trialdb.spi.MessageBus;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link MessageBus} that publishes each outbox message as a core NATS message on the
 * subject named by its channel. Payloads are sent as UTF-8 bytes.
 *
 * <p>{@link #flush()} waits until the server has received everything published so far,
 * bounded by the flush timeout. An instance created with {@link #connect(String)} owns its
 * connection and closes it in {@link #close()}; one built around an existing
 * {@link Connection} leaves it open.
 */
public final class NatsMessageBus implements MessageBus, AutoCloseable {
  private static final Logger logger = Logger.getLogger(NatsMessageBus.class.getName());

  public static final Duration DEFAULT_FLUSH_TIMEOUT = Duration.ofSeconds(5);
  public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(5);

  private final Connection connection;
  private final Duration flushTimeout;
  private final boolean ownsConnection;

  public NatsMessageBus(Connection connection) {
    this(connection, DEFAULT_FLUSH_TIMEOUT);
  }

  public NatsMessageBus(Connection connection, Duration flushTimeout) {
    this(connection, flushTimeout, false);
  }

  private NatsMessageBus(Connection connection, Duration flushTimeout, boolean ownsConnection) {
    this.connection = Objects.requireNonNull(connection, "connection");
    this.flushTimeout = Objects.requireNonNull(flushTimeout, "flushTimeout");
    if (flushTimeout.isZero() || flushTimeout.isNegative()) {
      throw new IllegalArgumentException("flushTimeout must be positive, got: " + flushTimeout);
    }
    this.ownsConnection = ownsConnection;
  }

  /**
   * Connects to the NATS server at {@code url}. The returned bus owns the connection.
   *
   * @throws MessageBusException if the server cannot be reached
   */
  public static NatsMessageBus connect(String url) {
    Objects.requireNonNull(url, "url");
    Options options = new Options.Builder()
        .server(url)
        .connectionTimeout(DEFAULT_CONNECT_TIMEOUT)
        .build();
    try {
      Connection connection = Nats.connect(options);
      logger.info("Connected to NATS at " + url);
      return new NatsMessageBus(connection, DEFAULT_FLUSH_TIMEOUT, true);
    } catch (IOException e) {
      throw new MessageBusException("Could not connect to NATS at " + url, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new MessageBusException("Interrupted while connecting to NATS at " + url, e);
    }
  }

  @Override
  public void publish(String channel, String message) {
    Objects.requireNonNull(channel, "channel");
    Objects.requireNonNull(message, "message");
    try {
      connection.publish(channel, message.getBytes(StandardCharsets.UTF_8));
    } catch (RuntimeException e) {
      throw new MessageBusException("Failed to publish to " + channel, e);
    }
  }

  @Override
  public void flush() {
    try {
      connection.flush(flushTimeout);
    } catch (TimeoutException e) {
      throw new MessageBusException("NATS flush did not complete within " + flushTimeout.toMillis() + "ms", e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new MessageBusException("Interrupted while flushing NATS connection", e);
    } catch (RuntimeException e) {
      throw new MessageBusException("NATS flush failed", e);
    }
  }

  public Connection connection() {
    return connection;
  }

  @Override
  public void close() {
    if (!ownsConnection) {
      return;
    }
    try {
      connection.close();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      logger.log(Level.WARNING, "Interrupted while closing NATS connection", e);
    }
  }
}
