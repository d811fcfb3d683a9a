package trialdb.notify;

import trialdb.config.Settings;

import java.util.Optional;
import java.util.logging.Logger;

/**
 * Picks a {@link Mailer} for a configuration.
 */
public final class Mailers {
  private static final Logger logger = Logger.getLogger(Mailers.class.getName());

  static final String FALLBACK_NOTICE = " Will log messages instead of emailing them.";

  private Mailers() {
  }

  /**
   * Same as {@code forConfig(settings, false)}.
   */
  public static Mailer forConfig(Settings settings) {
    return forConfig(settings, false);
  }

  /**
   * Returns a {@link LoggingMailer} in debug mode or when the mail settings are incomplete,
   * and an {@link SmtpMailer} otherwise.
   *
   * @param strict throw instead of falling back to logging when the settings are incomplete
   * @throws InvalidMailConfigException if {@code strict} and the settings are incomplete
   */
  public static Mailer forConfig(Settings settings, boolean strict) {
    if (settings.isDebug()) {
      return new LoggingMailer("debug mode");
    }
    MailConfig config = MailConfig.from(settings);
    Optional<String> problems = config.validate();
    if (problems.isPresent()) {
      if (strict) {
        throw new InvalidMailConfigException(problems.get());
      }
      logger.info(problems.get() + FALLBACK_NOTICE);
      return new LoggingMailer(problems.get());
    }
    return new SmtpMailer(config.smtpHost(), config.smtpUsername(), config.smtpPassword());
  }
}
