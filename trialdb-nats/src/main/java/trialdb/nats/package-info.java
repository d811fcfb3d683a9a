/**
 * NATS-backed {@link trialdb.spi.MessageBus}.
 *
 * @see trialdb.nats.NatsMessageBus
 */
package trialdb.nats;
