/**
 * Transactional sessions bound to the calling thread.
 *
 * <p>{@link trialdb.jdbc.tx.SessionManager} opens a {@link trialdb.jdbc.tx.Session} and binds
 * it to a {@link trialdb.jdbc.tx.ThreadLocalSessionContext}. {@link trialdb.jdbc.tx.ScopedSessions}
 * guarantees rollback and release on every exit path, and
 * {@link trialdb.jdbc.tx.SerializableRetryDriver} re-runs SERIALIZABLE work on conflicts.
 */
package trialdb.jdbc.tx;
