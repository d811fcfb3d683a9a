package trialdb.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Provides JDBC connections to the configured store.
 *
 * <p>Callers are responsible for closing the returned connection; with a pooled
 * provider closing returns it to the pool.
 *
 * @see trialdb.jdbc.DataSourceConnectionProvider
 * @see trialdb.jdbc.PooledConnectionProvider
 */
@FunctionalInterface
public interface ConnectionProvider {

    /**
     * Obtains a connection.
     *
     * @return an open connection; the caller must close it
     * @throws SQLException if a connection cannot be obtained
     */
    Connection getConnection() throws SQLException;
}
