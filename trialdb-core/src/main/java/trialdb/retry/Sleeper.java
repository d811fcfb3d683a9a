package trialdb.retry;

/**
 * Blocks the calling thread between retry attempts. Tests substitute a recording sleeper.
 */
@FunctionalInterface
public interface Sleeper {

  /** Sleeper backed by {@link Thread#sleep(long)}. */
  Sleeper SYSTEM = millis -> {
    if (millis > 0) {
      Thread.sleep(millis);
    }
  };

  /**
   * Sleeps for the given number of milliseconds.
   *
   * @throws InterruptedException if the thread is interrupted while sleeping
   */
  void sleep(long millis) throws InterruptedException;
}
