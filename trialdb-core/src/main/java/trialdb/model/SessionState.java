package trialdb.model;

/**
 * Transaction state of a session.
 */
public enum SessionState {
  /** No transaction has been started, or the session has been closed. */
  INACTIVE,
  /** A transaction is open and accepting work. */
  ACTIVE,
  /** The last transaction committed; the next use starts a new one. */
  COMMITTED,
  /** The last transaction rolled back; the next use starts a new one. */
  ROLLED_BACK
}
