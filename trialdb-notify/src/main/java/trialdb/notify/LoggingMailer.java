package trialdb.notify;

import trialdb.util.RecentHistory;

import java.util.List;
import java.util.logging.Logger;

/**
 * {@link Mailer} that writes each message to the log instead of sending it.
 * Selected in debug mode and when the mail settings are incomplete.
 */
public final class LoggingMailer implements Mailer {
  private static final Logger logger = Logger.getLogger(LoggingMailer.class.getName());

  private final String reason;
  private final RecentHistory<String> sent = new RecentHistory<>();

  public LoggingMailer() {
    this(null);
  }

  /**
   * @param reason why messages are logged rather than sent; may be {@code null}
   */
  public LoggingMailer(String reason) {
    this.reason = reason;
  }

  @Override
  public void send(String subject, String sender, List<String> recipients, String body) {
    String formatted = "LoggingMailer:\n"
        + "Subject: " + subject + "\n"
        + "Sender: " + sender + "\n"
        + "Recipients: " + String.join(", ", recipients) + "\n"
        + "Body:\n"
        + body;
    logger.info(formatted);
    sent.add(formatted);
  }

  /**
   * Returns the most recent {@value RecentHistory#DEFAULT_CAPACITY} formatted messages,
   * oldest first.
   */
  public List<String> sent() {
    return sent.snapshot();
  }

  public String reason() {
    return reason;
  }
}
