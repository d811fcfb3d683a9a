package trialdb.notify;

import java.util.List;
import java.util.Objects;

/**
 * Emails the administrator from {@code platform_email_address} to
 * {@code contact_email_on_error}.
 */
public final class EmailAdminNotifier implements AdminNotifier {
  private final String fromAddress;
  private final String toAddress;
  private final Mailer mailer;

  public EmailAdminNotifier(MailConfig config, Mailer mailer) {
    Objects.requireNonNull(config, "config");
    this.fromAddress = config.platformEmailAddress();
    this.toAddress = config.contactEmailOnError();
    this.mailer = Objects.requireNonNull(mailer, "mailer");
  }

  @Override
  public void send(String subject, String body) {
    mailer.send(subject, fromAddress, List.of(toAddress), body);
  }

  public Mailer mailer() {
    return mailer;
  }
}
