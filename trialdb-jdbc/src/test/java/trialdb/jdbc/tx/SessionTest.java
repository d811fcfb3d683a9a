package trialdb.jdbc.tx;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import trialdb.OutboxMessage;
import trialdb.jdbc.ConnectionStubs;
import trialdb.jdbc.DataSourceConnectionProvider;
import trialdb.jdbc.H2;
import trialdb.jdbc.RecordingMessageBus;
import trialdb.model.SessionState;
import trialdb.outbox.OutboxPublisher;
import trialdb.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SessionTest {

  private JdbcDataSource dataSource;
  private RecordingMessageBus bus;
  private ThreadLocalSessionContext context;

  @BeforeEach
  void setUp() throws SQLException {
    dataSource = H2.newDatabase();
    bus = new RecordingMessageBus();
    context = new ThreadLocalSessionContext();
  }

  private SessionManager manager(ConnectionProvider provider) {
    return new SessionManager(provider, context, new OutboxPublisher(bus));
  }

  private SessionManager manager() {
    return manager(new DataSourceConnectionProvider(dataSource));
  }

  @Test
  void commitPublishesQueuedMessagesInOrderAfterCommit() throws Exception {
    try (Session session = manager().begin()) {
      H2.insertParticipant(session.connection(), 1, "working");
      session.queueMessage("chat", "hello");
      session.queueMessage("chat", "world");

      assertEquals(List.of(), bus.published());
      assertEquals(0, H2.countParticipants(dataSource));

      session.commit();

      assertEquals(SessionState.COMMITTED, session.state());
    }

    assertEquals(List.of(new OutboxMessage("chat", "hello"), new OutboxMessage("chat", "world")),
        bus.published());
    assertEquals(1, bus.flushes());
    assertEquals(1, H2.countParticipants(dataSource));
  }

  @Test
  void commitWithEmptyOutboxPublishesNothing() throws Exception {
    try (Session session = manager().begin()) {
      H2.insertParticipant(session.connection(), 1, "working");
      session.commit();
    }

    assertEquals(List.of(), bus.published());
    assertEquals(0, bus.flushes());
  }

  @Test
  void rollbackClearsOutboxAndDiscardsWrites() throws Exception {
    try (Session session = manager().begin()) {
      H2.insertParticipant(session.connection(), 1, "working");
      session.queueMessage("chat", "discarded");

      session.rollback();

      assertEquals(SessionState.ROLLED_BACK, session.state());
      assertEquals(List.of(), session.pendingMessages());
      session.commit();
    }

    assertEquals(List.of(), bus.published());
    assertEquals(0, H2.countParticipants(dataSource));
  }

  @Test
  void sessionStartsNewTransactionAfterCommitOrRollback() throws Exception {
    try (Session session = manager().begin()) {
      session.queueMessage("chat", "first");
      session.commit();

      session.queueMessage("chat", "rolled back");
      session.rollback();

      H2.insertParticipant(session.connection(), 2, "returned");
      assertEquals(SessionState.ACTIVE, session.state());
      session.queueMessage("chat", "third");
      session.commit();
    }

    assertEquals(List.of("first", "third"), bus.messages());
    assertEquals(1, H2.countParticipants(dataSource));
  }

  @Test
  void rollbackToSavepointDiscardsEarlierMessagesAndKeepsTransactionOpen() throws Exception {
    try (Session session = manager().begin()) {
      H2.insertParticipant(session.connection(), 1, "working");
      session.queueMessage("chat", "before savepoint");
      Savepoint savepoint = session.setSavepoint();
      H2.insertParticipant(session.connection(), 2, "working");
      session.queueMessage("chat", "after savepoint");

      session.rollbackTo(savepoint);

      assertEquals(SessionState.ACTIVE, session.state());
      assertTrue(session.pendingMessages().isEmpty());
      session.queueMessage("chat", "after soft rollback");
      session.commit();
    }

    assertEquals(List.of("after soft rollback"), bus.messages());
    assertEquals(1, H2.countParticipants(dataSource));
  }

  @Test
  void rollbackToRequiresActiveTransaction() throws Exception {
    try (Session session = manager().begin()) {
      Savepoint savepoint = session.setSavepoint();
      session.commit();

      assertThrows(IllegalStateException.class, () -> session.rollbackTo(savepoint));
    }
  }

  @Test
  void failedCommitPublishesNothingAndRollsBack() throws Exception {
    ConnectionStubs.Scripted provider = ConnectionStubs.scripted(new DataSourceConnectionProvider(dataSource))
        .fail("commit", 1, "08006");
    Session session = manager(provider).begin();
    session.queueMessage("chat", "never sent");

    SQLException e = assertThrows(SQLException.class, session::commit);
    assertEquals("08006", e.getSQLState());
    assertEquals(SessionState.ROLLED_BACK, session.state());
    assertTrue(session.pendingMessages().isEmpty());

    session.close();

    assertEquals(List.of(), bus.published());
    assertFalse(context.isSessionActive());
    assertTrue(provider.calls().contains("rollback"));
  }

  @Test
  void closeRollsBackUncommittedWorkAndReleasesConnection() throws Exception {
    Session session = manager().begin();
    Connection connection = session.connection();
    H2.insertParticipant(connection, 1, "working");
    session.queueMessage("chat", "uncommitted");

    session.close();

    assertTrue(session.isClosed());
    assertTrue(connection.isClosed());
    assertEquals(SessionState.INACTIVE, session.state());
    assertEquals(0, H2.countParticipants(dataSource));
    assertEquals(List.of(), bus.published());
    assertFalse(context.isSessionActive());
  }

  @Test
  void closeRestoresIsolationAndAutoCommit() throws Exception {
    ConnectionStubs.Scripted provider = ConnectionStubs.scripted(new DataSourceConnectionProvider(dataSource));
    Session session = manager(provider).begin(IsolationLevel.SERIALIZABLE);
    assertEquals(Connection.TRANSACTION_SERIALIZABLE, session.connection().getTransactionIsolation());

    session.close();

    assertEquals(List.of(
        "setAutoCommit[false]",
        "setTransactionIsolation[" + Connection.TRANSACTION_SERIALIZABLE + "]",
        "rollback",
        "setTransactionIsolation[" + Connection.TRANSACTION_READ_COMMITTED + "]",
        "setAutoCommit[true]",
        "close"), provider.calls());
  }

  @Test
  void closeIsIdempotentAndUnbindsEvenWhenConnectionCloseFails() throws Exception {
    ConnectionStubs.Scripted provider = ConnectionStubs.scripted(new DataSourceConnectionProvider(dataSource))
        .fail("close", 1, "08003");
    Session session = manager(provider).begin();

    assertThrows(SQLException.class, session::close);
    assertFalse(context.isSessionActive());

    session.close();
    assertEquals(1, provider.count("close"));
  }

  @Test
  void rollbackWithoutActiveTransactionDoesNothing() throws Exception {
    ConnectionStubs.Scripted provider = ConnectionStubs.scripted(new DataSourceConnectionProvider(dataSource));
    try (Session session = manager(provider).begin()) {
      session.queueMessage("chat", "kept");
      session.commit();

      session.rollback();

      assertEquals(SessionState.COMMITTED, session.state());
      assertEquals(0, provider.count("rollback"));
    }
    assertEquals(List.of("kept"), bus.messages());
  }

  @Test
  void closedSessionRejectsUse() throws Exception {
    Session session = manager().begin();
    session.close();

    assertThrows(IllegalStateException.class, session::connection);
    assertThrows(IllegalStateException.class, () -> session.queueMessage("chat", "late"));
    assertThrows(IllegalStateException.class, session::commit);
    session.rollback();
  }
}
