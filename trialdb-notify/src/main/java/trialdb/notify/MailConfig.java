package trialdb.notify;

import trialdb.config.Settings;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Mail-related values extracted from {@link Settings}.
 */
public final class MailConfig {
  public static final String SMTP_HOST = "smtp_host";
  public static final String SMTP_USERNAME = "smtp_username";
  public static final String SMTP_PASSWORD = "smtp_password";
  public static final String CONTACT_EMAIL_ON_ERROR = "contact_email_on_error";
  public static final String PLATFORM_EMAIL_ADDRESS = "platform_email_address";

  /** Value written by config templates for settings the operator has not filled in. */
  public static final String PLACEHOLDER = "???";

  private final String smtpHost;
  private final String smtpUsername;
  private final String smtpPassword;
  private final String contactEmailOnError;
  private final String platformEmailAddress;

  private MailConfig(Settings settings) {
    this.smtpHost = settings.get(SMTP_HOST, null);
    this.smtpUsername = settings.get(SMTP_USERNAME, null);
    this.smtpPassword = settings.get(SMTP_PASSWORD, null);
    this.contactEmailOnError = settings.get(CONTACT_EMAIL_ON_ERROR, null);
    this.platformEmailAddress = settings.get(PLATFORM_EMAIL_ADDRESS, null);
  }

  public static MailConfig from(Settings settings) {
    return new MailConfig(settings);
  }

  public String smtpHost() {
    return smtpHost;
  }

  public String smtpUsername() {
    return smtpUsername;
  }

  public String smtpPassword() {
    return smtpPassword;
  }

  public String contactEmailOnError() {
    return contactEmailOnError;
  }

  public String platformEmailAddress() {
    return platformEmailAddress;
  }

  /**
   * Could this config be used to send a real email?
   *
   * @return a description of the missing or placeholder values, or empty if none
   */
  public Optional<String> validate() {
    List<String> missing = new ArrayList<>();
    for (Map.Entry<String, String> entry : values().entrySet()) {
      if (!isSet(entry.getValue())) {
        missing.add(entry.getKey());
      }
    }
    if (missing.isEmpty()) {
      return Optional.empty();
    }
    Collections.sort(missing);
    return Optional.of("Missing or invalid config values: " + String.join(", ", missing));
  }

  /**
   * Returns the values keyed by setting name, with the password masked. Safe to log.
   */
  public Map<String, String> asMap() {
    Map<String, String> cleaned = values();
    if (smtpPassword != null && !smtpPassword.isEmpty() && !PLACEHOLDER.equals(smtpPassword)) {
      cleaned.put(SMTP_PASSWORD, mask(smtpPassword));
    }
    return Collections.unmodifiableMap(cleaned);
  }

  @Override
  public String toString() {
    return "MailConfig" + asMap();
  }

  private Map<String, String> values() {
    Map<String, String> values = new LinkedHashMap<>();
    values.put(SMTP_HOST, smtpHost);
    values.put(SMTP_USERNAME, smtpUsername);
    values.put(SMTP_PASSWORD, smtpPassword);
    values.put(CONTACT_EMAIL_ON_ERROR, contactEmailOnError);
    values.put(PLATFORM_EMAIL_ADDRESS, platformEmailAddress);
    return values;
  }

  private static boolean isSet(String value) {
    return value != null && !value.isEmpty() && !PLACEHOLDER.equals(value);
  }

  // first three characters and the last one
  private static String mask(String password) {
    String head = password.substring(0, Math.min(3, password.length()));
    return head + "......" + password.charAt(password.length() - 1);
  }
}
