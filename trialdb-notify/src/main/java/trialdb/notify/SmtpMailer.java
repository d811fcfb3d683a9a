package trialdb.notify;

import jakarta.mail.Authenticator;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.PasswordAuthentication;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/**
 * {@link Mailer} that relays through an SMTP server with STARTTLS and password
 * authentication.
 *
 * <p>{@code host} may carry a {@code :port} suffix; the port defaults to 25. Connecting,
 * reading, and writing are each bounded by the connect timeout (8 seconds by default).
 * A failed send is not retried.
 */
public final class SmtpMailer implements Mailer {
  private static final Logger logger = Logger.getLogger(SmtpMailer.class.getName());

  public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(8);
  static final int DEFAULT_PORT = 25;

  private final String host;
  private final int port;
  private final String username;
  private final Duration connectTimeout;
  private final Session session;
  private final AtomicInteger sentCount = new AtomicInteger();

  public SmtpMailer(String host, String username, String password) {
    this(host, username, password, DEFAULT_CONNECT_TIMEOUT);
  }

  public SmtpMailer(String host, String username, String password, Duration connectTimeout) {
    Objects.requireNonNull(host, "host");
    Objects.requireNonNull(username, "username");
    Objects.requireNonNull(password, "password");
    this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
    int colon = host.lastIndexOf(':');
    if (colon > 0) {
      this.host = host.substring(0, colon);
      try {
        this.port = Integer.parseInt(host.substring(colon + 1));
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Invalid SMTP port in host: " + host, e);
      }
    } else {
      this.host = host;
      this.port = DEFAULT_PORT;
    }
    this.username = username;
    this.session = Session.getInstance(properties(), new Authenticator() {
      @Override
      protected PasswordAuthentication getPasswordAuthentication() {
        return new PasswordAuthentication(username, password);
      }
    });
  }

  @Override
  public void send(String subject, String sender, List<String> recipients, String body) {
    try {
      MimeMessage message = new MimeMessage(session);
      message.setSubject(subject, "UTF-8");
      message.setFrom(new InternetAddress(sender));
      message.setRecipients(Message.RecipientType.TO,
          InternetAddress.parse(String.join(",", recipients)));
      message.setText(body, "UTF-8");
      Transport.send(message);
    } catch (MessagingException e) {
      throw new MessengerException("SMTP error sending notification email.", e);
    } catch (RuntimeException e) {
      throw new MessengerException("Unknown error sending notification email.", e);
    }
    sentCount.incrementAndGet();
    logger.fine("Sent \"" + subject + "\" to " + recipients + " via " + host + ":" + port);
  }

  public String host() {
    return host;
  }

  public int port() {
    return port;
  }

  public String username() {
    return username;
  }

  /**
   * Returns the number of messages relayed successfully.
   */
  public int sentCount() {
    return sentCount.get();
  }

  private Properties properties() {
    String timeout = String.valueOf(connectTimeout.toMillis());
    Properties props = new Properties();
    props.put("mail.smtp.host", host);
    props.put("mail.smtp.port", String.valueOf(port));
    props.put("mail.smtp.auth", "true");
    props.put("mail.smtp.starttls.enable", "true");
    props.put("mail.smtp.starttls.required", "true");
    props.put("mail.smtp.connectiontimeout", timeout);
    props.put("mail.smtp.timeout", timeout);
    props.put("mail.smtp.writetimeout", timeout);
    return props;
  }
}
