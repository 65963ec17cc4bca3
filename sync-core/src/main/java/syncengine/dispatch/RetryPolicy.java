package syncengine.dispatch;

/**
 * Computes how long a failed sync event waits before the health monitor retries it.
 *
 * @see ExponentialBackoffRetryPolicy
 */
public interface RetryPolicy {

  /**
   * @param attempts retry attempts made so far, including the one that just failed (1-based)
   * @return delay in milliseconds before the next attempt (non-negative)
   */
  long computeDelayMs(int attempts);
}
