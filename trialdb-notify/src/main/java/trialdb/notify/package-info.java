/**
 * Notification delivery: SMTP and logging {@link trialdb.notify.Mailer}s, mail settings
 * validation, and administrator notices.
 *
 * <p>{@link trialdb.notify.Mailers} and {@link trialdb.notify.AdminNotifiers} choose the
 * logging variant in debug mode or when the settings are incomplete, so development setups
 * never need an SMTP server.
 */
package trialdb.notify;
