package trialdb.notify;

import trialdb.util.RecentHistory;

import java.util.List;
import java.util.Objects;

/**
 * Logs administrator notices instead of emailing them. Used in debug mode.
 */
public final class LoggingAdminNotifier implements AdminNotifier {
  private final String fromAddress;
  private final String toAddress;
  private final LoggingMailer mailer;
  private final RecentHistory<String> sent = new RecentHistory<>();

  public LoggingAdminNotifier(MailConfig config, LoggingMailer mailer) {
    Objects.requireNonNull(config, "config");
    this.fromAddress = config.platformEmailAddress();
    this.toAddress = config.contactEmailOnError();
    this.mailer = Objects.requireNonNull(mailer, "mailer");
  }

  @Override
  public void send(String subject, String body) {
    sent.add(subject + ": " + body);
    mailer.send(subject, String.valueOf(fromAddress), List.of(String.valueOf(toAddress)), body);
  }

  /**
   * Returns {@code "subject: body"} for the most recent notices, oldest first.
   */
  public List<String> sent() {
    return sent.snapshot();
  }

  public LoggingMailer mailer() {
    return mailer;
  }
}
