package trialdb;

import java.util.Objects;

/**
 * A message queued in a session's outbox, published to {@code channel} once the
 * owning transaction commits.
 *
 * @param channel bus channel (subject) to publish to
 * @param message opaque payload, usually serialized JSON
 */
public record OutboxMessage(String channel, String message) {

  public OutboxMessage {
    Objects.requireNonNull(channel, "channel");
    Objects.requireNonNull(message, "message");
    if (channel.isEmpty()) {
      throw new IllegalArgumentException("channel must not be empty");
    }
  }
}
