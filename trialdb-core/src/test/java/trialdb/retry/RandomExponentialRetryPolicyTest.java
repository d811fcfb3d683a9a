package trialdb.retry;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RandomExponentialRetryPolicyTest {

  @Test
  void defaultRateIsHalfPerSecond() {
    assertEquals(0.5, new RandomExponentialRetryPolicy().ratePerSecond());
  }

  @Test
  void delaysAreNonNegative() {
    RandomExponentialRetryPolicy policy = new RandomExponentialRetryPolicy();

    for (int attempt = 1; attempt <= 1000; attempt++) {
      assertTrue(policy.computeDelayMs(attempt) >= 0);
    }
  }

  @Test
  void sampleMeanIsCloseToInverseRate() {
    RandomExponentialRetryPolicy policy = new RandomExponentialRetryPolicy(0.5);

    int samples = 20_000;
    double total = 0;
    for (int i = 0; i < samples; i++) {
      total += policy.computeDelayMs(1);
    }
    double mean = total / samples;

    // mean 2000ms, standard error about 14ms
    assertTrue(mean > 1800 && mean < 2200, "mean was " + mean);
  }

  @Test
  void delayDoesNotGrowWithAttemptNumber() {
    RandomExponentialRetryPolicy policy = new RandomExponentialRetryPolicy(10.0);

    int samples = 5_000;
    double late = 0;
    for (int i = 0; i < samples; i++) {
      late += policy.computeDelayMs(99);
    }

    assertTrue(late / samples < 150, "mean was " + (late / samples));
  }

  @Test
  void maxDelayCapsEveryDraw() {
    RandomExponentialRetryPolicy policy = new RandomExponentialRetryPolicy(0.001, 250);

    for (int i = 0; i < 100; i++) {
      assertTrue(policy.computeDelayMs(1) <= 250);
    }
  }

  @Test
  void nonPositiveAttemptsReturnZero() {
    assertEquals(0L, new RandomExponentialRetryPolicy().computeDelayMs(0));
  }

  @Test
  void rejectsInvalidRate() {
    assertThrows(IllegalArgumentException.class, () -> new RandomExponentialRetryPolicy(0));
    assertThrows(IllegalArgumentException.class, () -> new RandomExponentialRetryPolicy(-1));
    assertThrows(IllegalArgumentException.class, () -> new RandomExponentialRetryPolicy(Double.NaN));
    assertThrows(IllegalArgumentException.class, () -> new RandomExponentialRetryPolicy(0.5, -1));
  }
}
