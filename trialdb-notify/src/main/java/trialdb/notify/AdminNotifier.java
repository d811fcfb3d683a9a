package trialdb.notify;

/**
 * Sends a short notice to the platform administrator, with addresses taken from
 * configuration.
 *
 * @see AdminNotifiers#forConfig(trialdb.config.Settings)
 */
public interface AdminNotifier {

  void send(String subject, String body);
}
