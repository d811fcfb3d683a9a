package trialdb.retry;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Retry policy whose delays are drawn from an exponential distribution, independent of
 * the attempt number.
 *
 * <p>With rate {@code λ} (events per second) the mean delay is {@code 1/λ} seconds. The
 * default rate of 0.5 gives a mean of two seconds.
 */
public final class RandomExponentialRetryPolicy implements RetryPolicy {
  /** Default rate, in retries per second. */
  public static final double DEFAULT_RATE_PER_SECOND = 0.5;

  private final double ratePerSecond;
  private final long maxDelayMs;

  public RandomExponentialRetryPolicy() {
    this(DEFAULT_RATE_PER_SECOND);
  }

  /**
   * @param ratePerSecond rate of the exponential distribution; must be positive
   */
  public RandomExponentialRetryPolicy(double ratePerSecond) {
    this(ratePerSecond, Long.MAX_VALUE);
  }

  /**
   * @param ratePerSecond rate of the exponential distribution; must be positive
   * @param maxDelayMs    upper bound on any single delay (milliseconds)
   */
  public RandomExponentialRetryPolicy(double ratePerSecond, long maxDelayMs) {
    if (!(ratePerSecond > 0) || Double.isInfinite(ratePerSecond)) {
      throw new IllegalArgumentException("ratePerSecond must be > 0, got: " + ratePerSecond);
    }
    if (maxDelayMs < 0) {
      throw new IllegalArgumentException("maxDelayMs must be >= 0, got: " + maxDelayMs);
    }
    this.ratePerSecond = ratePerSecond;
    this.maxDelayMs = maxDelayMs;
  }

  public double ratePerSecond() {
    return ratePerSecond;
  }

  @Override
  public long computeDelayMs(int attempts) {
    if (attempts <= 0) {
      return 0L;
    }
    // nextDouble() is in [0, 1), so 1 - u is in (0, 1] and the log is finite
    double u = ThreadLocalRandom.current().nextDouble();
    double seconds = -Math.log(1.0 - u) / ratePerSecond;
    double millis = seconds * 1000.0;
    if (millis >= maxDelayMs) {
      return maxDelayMs;
    }
    return Math.max(0L, Math.round(millis));
  }
}
