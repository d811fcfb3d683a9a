/**
 * JDBC connection providers and the {@link trialdb.jdbc.TrialDb} entry point.
 *
 * <p>{@link trialdb.jdbc.PooledConnectionProvider} wraps a bounded HikariCP pool configured
 * from {@link trialdb.jdbc.DatabaseConfig}; {@link trialdb.jdbc.DatabaseUrls} translates
 * {@code postgres://} URLs into JDBC form. {@link trialdb.jdbc.ConnectionCheck} is the
 * startup probe. {@link trialdb.jdbc.SqlStates} classifies serialization and
 * authentication failures by SQLState.
 *
 * @see trialdb.jdbc.TrialDb
 * @see trialdb.jdbc.tx.SessionManager
 */
package trialdb.jdbc;
