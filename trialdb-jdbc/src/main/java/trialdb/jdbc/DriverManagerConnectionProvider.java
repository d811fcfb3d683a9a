package trialdb.jdbc;

import trialdb.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Objects;

/**
 * {@link ConnectionProvider} that opens a fresh, unpooled connection on every call.
 *
 * <p>{@link TrialDb} probes the store through this provider, so a rejected credential or
 * refused connection reaches {@link ConnectionCheck} directly instead of surfacing as a
 * pool wait timeout.
 */
public final class DriverManagerConnectionProvider implements ConnectionProvider {
  private final String url;
  private final String username;
  private final String password;

  /**
   * @param username user name, or {@code null} to rely on the URL
   * @param password password, or {@code null} to rely on the URL
   */
  public DriverManagerConnectionProvider(String url, String username, String password) {
    this.url = Objects.requireNonNull(url, "url");
    this.username = username;
    this.password = password;
  }

  public static DriverManagerConnectionProvider forConfig(DatabaseConfig config) {
    Objects.requireNonNull(config, "config");
    return new DriverManagerConnectionProvider(config.getUrl(), config.getUsername(), config.getPassword());
  }

  @Override
  public Connection getConnection() throws SQLException {
    return DriverManager.getConnection(url, username, password);
  }
}
