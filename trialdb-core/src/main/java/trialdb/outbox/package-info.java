/**
 * Publish-on-commit outbox.
 *
 * <p>A {@link trialdb.outbox.SessionOutbox} buffers {@code (channel, message)} pairs for one
 * session. It is reset whenever a transaction begins or rolls back (in full or to a
 * savepoint) and drained into the {@link trialdb.outbox.OutboxPublisher} only after a
 * commit returns successfully.
 */
package trialdb.outbox;
