package trialdb.notify;

import org.junit.jupiter.api.Test;
import trialdb.config.Settings;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MailersTest {

  static Settings completeMailSettings() {
    return Settings.of(Map.of(
        "smtp_host", "smtp.example.com:587",
        "smtp_username", "platform",
        "smtp_password", "secret-password",
        "contact_email_on_error", "admin@example.com",
        "platform_email_address", "noreply@example.com"));
  }

  @Test
  void debugModeWithoutSmtpSettingsLogsInstead() {
    Mailer mailer = Mailers.forConfig(Settings.of(Map.of("mode", "debug")));

    LoggingMailer logging = assertInstanceOf(LoggingMailer.class, mailer);
    assertEquals("debug mode", logging.reason());

    logging.send("Experiment error", "noreply@example.com", List.of("a@example.com", "b@example.com"), "Stack trace");
    assertEquals(List.of("LoggingMailer:\n"
        + "Subject: Experiment error\n"
        + "Sender: noreply@example.com\n"
        + "Recipients: a@example.com, b@example.com\n"
        + "Body:\n"
        + "Stack trace"), logging.sent());
  }

  @Test
  void debugModeWinsOverCompleteSettings() {
    Mailer mailer = Mailers.forConfig(completeMailSettings().with("mode", "debug"));

    assertInstanceOf(LoggingMailer.class, mailer);
  }

  @Test
  void completeSettingsOutsideDebugSelectSmtp() {
    Mailer mailer = Mailers.forConfig(completeMailSettings().with("mode", "live"));

    SmtpMailer smtp = assertInstanceOf(SmtpMailer.class, mailer);
    assertEquals("smtp.example.com", smtp.host());
    assertEquals(587, smtp.port());
    assertEquals("platform", smtp.username());
    assertEquals(0, smtp.sentCount());
  }

  @Test
  void incompleteSettingsFallBackToLogging() {
    Settings settings = Settings.of(Map.of(
        "smtp_host", "smtp.example.com",
        "smtp_password", "???"));

    LoggingMailer mailer = assertInstanceOf(LoggingMailer.class, Mailers.forConfig(settings));

    assertEquals("Missing or invalid config values: contact_email_on_error, "
        + "platform_email_address, smtp_password, smtp_username", mailer.reason());
  }

  @Test
  void strictModeRejectsIncompleteSettings() {
    InvalidMailConfigException e = assertThrows(InvalidMailConfigException.class,
        () -> Mailers.forConfig(Settings.empty(), true));

    assertTrue(e.getMessage().startsWith("Missing or invalid config values: "));
    assertTrue(e.getMessage().contains("smtp_host"));
  }

  @Test
  void strictModeAcceptsCompleteSettings() {
    assertInstanceOf(SmtpMailer.class, Mailers.forConfig(completeMailSettings(), true));
  }
}
