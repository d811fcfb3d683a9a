package trialdb;

/**
 * Thrown when a serializable transaction kept conflicting with concurrent commits until
 * its attempt budget ran out. The cause is the conflict reported by the last attempt.
 */
public final class RetriesExhaustedException extends RuntimeException {
  private final int attempts;

  public RetriesExhaustedException(int attempts, Throwable lastConflict) {
    super("Could not commit serialized transaction after " + attempts + " attempts.", lastConflict);
    this.attempts = attempts;
  }

  /**
   * Returns the number of attempts made before giving up.
   */
  public int attempts() {
    return attempts;
  }
}
