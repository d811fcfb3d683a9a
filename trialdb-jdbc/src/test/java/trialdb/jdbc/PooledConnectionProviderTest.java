package trialdb.jdbc;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class PooledConnectionProviderTest {
  private PooledConnectionProvider pool;

  @AfterEach
  void tearDown() {
    if (pool != null) {
      pool.close();
    }
  }

  private static DatabaseConfig h2Config() {
    return new DatabaseConfig()
        .setUrl("jdbc:h2:mem:pool_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1")
        .setPoolName("trialdb-test-pool");
  }

  @Test
  void borrowsAndReturnsConnections() throws SQLException {
    pool = new PooledConnectionProvider(h2Config().setMaxPoolSize(2));

    try (Connection conn = pool.getConnection()) {
      assertTrue(conn.isValid(1));
      assertEquals(1, pool.activeConnections());
    }

    assertEquals(0, pool.activeConnections());
    assertEquals(2, pool.maxPoolSize());
  }

  @Test
  void exhaustedPoolFailsAfterConnectionTimeout() throws SQLException {
    pool = new PooledConnectionProvider(h2Config()
        .setMaxPoolSize(1)
        .setConnectionTimeoutMs(250));

    try (Connection held = pool.getConnection()) {
      long start = System.nanoTime();
      PoolExhaustedException e = assertThrows(PoolExhaustedException.class, pool::getConnection);
      long waitedMs = (System.nanoTime() - start) / 1_000_000;

      assertTrue(waitedMs >= 200, "waited only " + waitedMs + "ms");
      assertEquals(1, e.maxPoolSize());
      assertNotNull(held);
    }

    try (Connection again = pool.getConnection()) {
      assertNotNull(again);
    }
  }

  @Test
  void startsEvenWhenStoreIsUnreachable() {
    pool = new PooledConnectionProvider(new DatabaseConfig()
        .setUrl("jdbc:postgresql://127.0.0.1:1/trialdb")
        .setMaxPoolSize(1)
        .setMinimumIdle(0)
        .setConnectionTimeoutMs(250));

    assertThrows(SQLException.class, pool::getConnection);
  }

  @Test
  void closeShutsThePoolDown() {
    pool = new PooledConnectionProvider(h2Config());

    pool.close();

    assertTrue(pool.isClosed());
    assertThrows(SQLException.class, pool::getConnection);
  }

  @Test
  void invalidConfigIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> new PooledConnectionProvider(h2Config().setMaxPoolSize(0)));
    assertThrows(NullPointerException.class, () -> new PooledConnectionProvider(null));
  }
}
