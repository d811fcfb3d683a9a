package trialdb.notify;

import trialdb.config.Settings;

import java.util.Optional;
import java.util.logging.Logger;

/**
 * Picks an {@link AdminNotifier} for a configuration, following the same rules as
 * {@link Mailers#forConfig(Settings)}.
 */
public final class AdminNotifiers {
  private static final Logger logger = Logger.getLogger(AdminNotifiers.class.getName());

  private AdminNotifiers() {
  }

  public static AdminNotifier forConfig(Settings settings) {
    MailConfig config = MailConfig.from(settings);
    if (settings.isDebug()) {
      return new LoggingAdminNotifier(config, new LoggingMailer("debug mode"));
    }
    Optional<String> problems = config.validate();
    if (problems.isPresent()) {
      logger.info(problems.get() + Mailers.FALLBACK_NOTICE);
      return new LoggingAdminNotifier(config, new LoggingMailer(problems.get()));
    }
    return new EmailAdminNotifier(config,
        new SmtpMailer(config.smtpHost(), config.smtpUsername(), config.smtpPassword()));
  }
}
