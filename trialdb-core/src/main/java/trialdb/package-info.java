/**
 * Root API of trialdb: transactional sessions with a publish-on-commit outbox and a
 * serializable retry driver, for the data-access layer of an experiment platform.
 *
 * <h2>Core design</h2>
 * <p>Application code runs inside a <em>session</em>, one per worker thread. Business logic
 * queues {@code (channel, message)} pairs in the session's outbox; when the transaction
 * commits, the outbox is drained to the {@linkplain trialdb.spi.MessageBus message bus} in
 * insertion order. Any rollback, full or to a savepoint, clears the outbox. Transactions that
 * need SERIALIZABLE isolation run through a retry driver that re-executes the work when the
 * store reports a serialization conflict.
 *
 * <h2>Module layout</h2>
 * <ul>
 *   <li><b>trialdb-core</b>: SPIs, outbox buffer and publisher, retry policies, settings (zero external deps)</li>
 *   <li><b>trialdb-jdbc</b>: connection providers, session manager, scoped sessions, retry driver</li>
 *   <li><b>trialdb-nats</b>: NATS-backed {@link trialdb.spi.MessageBus}</li>
 *   <li><b>trialdb-notify</b>: SMTP and logging mailers</li>
 *   <li><b>trialdb-micrometer</b>: Micrometer {@link trialdb.spi.MetricsExporter}</li>
 * </ul>
 *
 * <h2>Quick start</h2>
 * <pre>{@code
 * try (TrialDb db = TrialDb.builder()
 *     .config(DatabaseConfig.from(Settings.fromEnvironment()))
 *     .messageBus(NatsMessageBus.connect("nats://localhost:4222"))
 *     .build()) {
 *
 *   db.checkConnection();
 *
 *   db.runScoped(session -> {
 *     insertParticipant(session.connection(), participant);
 *     session.queueMessage("chat", "participant joined");
 *     return null;
 *   }, true);
 *
 *   Integer seat = db.executeSerialized(session -> claimNextSeat(session.connection()));
 * }
 * }</pre>
 *
 * @see trialdb.OutboxMessage
 * @see trialdb.outbox.OutboxPublisher
 */
package trialdb;
