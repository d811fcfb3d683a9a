package trialdb.retry;

/**
 * Strategy for computing the delay before retrying a failed attempt.
 *
 * @see ExponentialBackoffRetryPolicy
 * @see RandomExponentialRetryPolicy
 */
@FunctionalInterface
public interface RetryPolicy {

    /**
     * Computes the delay in milliseconds before the next attempt.
     *
     * @param attempts the number of attempts that have failed so far (1-based)
     * @return delay in milliseconds (non-negative)
     */
    long computeDelayMs(int attempts);
}
