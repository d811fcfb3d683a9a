/**
 * Service provider interfaces.
 *
 * <ul>
 *   <li>{@link trialdb.spi.ConnectionProvider}: where connections come from</li>
 *   <li>{@link trialdb.spi.SessionContext}: access to the session bound to the current worker</li>
 *   <li>{@link trialdb.spi.MessageBus}: where committed outbox messages go</li>
 *   <li>{@link trialdb.spi.MetricsExporter}: counters for commits, publishes and retries</li>
 * </ul>
 */
package trialdb.spi;
