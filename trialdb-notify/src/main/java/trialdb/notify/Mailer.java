package trialdb.notify;

import java.util.List;

/**
 * Delivers a rendered notification.
 *
 * @see Mailers#forConfig(trialdb.config.Settings)
 */
public interface Mailer {

  /**
   * Sends one message.
   *
   * @param subject    subject line
   * @param sender     sender address
   * @param recipients recipient addresses
   * @param body       plain-text body
   * @throws MessengerException if the message could not be relayed
   */
  void send(String subject, String sender, List<String> recipients, String body);
}
