package trialdb.jdbc;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import trialdb.ConnectionFailedException;
import trialdb.jdbc.tx.SerializableRetryDriver;
import trialdb.jdbc.tx.SessionManager;
import trialdb.jdbc.tx.ThreadLocalSessionContext;
import trialdb.outbox.OutboxPublisher;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.Statement;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DockerAvailable
@Testcontainers
class PostgresSerializableIntegrationTest {

  @Container
  static final PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine")
      .withDatabaseName("trialdb_test")
      .withUsername("trialdb")
      .withPassword("trialdb");

  private static PooledConnectionProvider pool;

  @BeforeAll
  static void initSchema() throws Exception {
    pool = new PooledConnectionProvider(new DatabaseConfig()
        .setUrl(postgres.getJdbcUrl())
        .setUsername(postgres.getUsername())
        .setPassword(postgres.getPassword())
        .setMaxPoolSize(4));
    try (Connection conn = pool.getConnection(); Statement st = conn.createStatement()) {
      st.execute("CREATE TABLE seat (id INT PRIMARY KEY, claimed INT NOT NULL)");
      st.execute("INSERT INTO seat (id, claimed) VALUES (1, 0)");
    }
  }

  @AfterAll
  static void closePool() {
    if (pool != null) {
      pool.close();
    }
  }

  @Test
  void concurrentIncrementsBothCommitAfterRetry() throws Exception {
    RecordingMessageBus bus = new RecordingMessageBus();
    SessionManager sessions = new SessionManager(pool, new ThreadLocalSessionContext(), new OutboxPublisher(bus));
    AtomicInteger conflicts = new AtomicInteger();
    SerializableRetryDriver driver = SerializableRetryDriver.builder()
        .sessionManager(sessions)
        .sleeper(millis -> {
        })
        .conflictClassifier(t -> {
          boolean conflict = SqlStates.isSerializationFailure(t);
          if (conflict) {
            conflicts.incrementAndGet();
          }
          return conflict;
        })
        .build();
    CyclicBarrier bothRead = new CyclicBarrier(2);

    ExecutorService executor = Executors.newFixedThreadPool(2);
    try {
      List<Future<Integer>> results = List.of(
          executor.submit(() -> claimSeat(driver, bothRead, "a")),
          executor.submit(() -> claimSeat(driver, bothRead, "b")));
      for (Future<Integer> result : results) {
        result.get(60, TimeUnit.SECONDS);
      }
    } finally {
      executor.shutdownNow();
    }

    try (Connection conn = pool.getConnection();
         Statement st = conn.createStatement();
         ResultSet rs = st.executeQuery("SELECT claimed FROM seat WHERE id = 1")) {
      rs.next();
      assertEquals(2, rs.getInt(1));
    }
    assertTrue(conflicts.get() >= 1, "expected at least one serialization conflict");
    assertEquals(2, bus.published().size());
  }

  private static int claimSeat(SerializableRetryDriver driver, CyclicBarrier bothRead, String who)
      throws Exception {
    AtomicInteger attempt = new AtomicInteger();
    return driver.execute(session -> {
      Connection conn = session.connection();
      int claimed;
      try (Statement st = conn.createStatement();
           ResultSet rs = st.executeQuery("SELECT claimed FROM seat WHERE id = 1")) {
        rs.next();
        claimed = rs.getInt(1);
      }
      if (attempt.incrementAndGet() == 1) {
        bothRead.await(30, TimeUnit.SECONDS);
      }
      try (PreparedStatement ps = conn.prepareStatement("UPDATE seat SET claimed = ? WHERE id = 1")) {
        ps.setInt(1, claimed + 1);
        ps.executeUpdate();
      }
      session.queueMessage("seat", who + " claimed " + (claimed + 1));
      return claimed + 1;
    });
  }

  @Test
  void rejectedCredentialsPrintRemediation() {
    try (PooledConnectionProvider wrong = new PooledConnectionProvider(new DatabaseConfig()
        .setUrl(postgres.getJdbcUrl())
        .setUsername("trialdb")
        .setPassword("not-the-password")
        .setMinimumIdle(0)
        .setConnectionTimeoutMs(2_000))) {
      ConnectionCheck check = new ConnectionCheck(wrong, Duration.ofSeconds(10), "trialdb");
      ByteArrayOutputStream err = new ByteArrayOutputStream();

      assertThrows(ConnectionFailedException.class,
          () -> check.checkOrExplain(new PrintStream(err, true, StandardCharsets.UTF_8)));

      assertTrue(err.toString(StandardCharsets.UTF_8).contains("createuser -P trialdb --createdb"));
    }
  }
}
