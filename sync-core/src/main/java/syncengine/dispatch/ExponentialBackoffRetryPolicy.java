package syncengine.dispatch;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with jitter: {@code baseDelay * 2^(attempts-1)}, capped at
 * {@code maxDelay}, multiplied by a random factor in [0.5, 1.5) and capped again.
 *
 * <p>The engine default is 1 s base and 30 s cap. With the 60 s health tick every parked
 * event is due on every tick; the delay only matters when the tick is shortened.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  private final long baseDelayMs;
  private final long maxDelayMs;

  /**
   * @param baseDelayMs delay before the first retry; must be &gt; 0
   * @param maxDelayMs  upper bound of every delay; must be &ge; {@code baseDelayMs}
   */
  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs) {
    if (baseDelayMs <= 0) {
      throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
    }
    if (maxDelayMs < baseDelayMs) {
      throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
    }
    this.baseDelayMs = baseDelayMs;
    this.maxDelayMs = maxDelayMs;
  }

  public long baseDelayMs() {
    return baseDelayMs;
  }

  public long maxDelayMs() {
    return maxDelayMs;
  }

  @Override
  public long computeDelayMs(int attempts) {
    if (attempts <= 0) {
      return 0L;
    }
    long uncapped;
    if (attempts >= 31 || (1L << (attempts - 1)) > maxDelayMs / baseDelayMs) {
      uncapped = maxDelayMs;
    } else {
      uncapped = baseDelayMs * (1L << (attempts - 1));
    }
    long capped = Math.min(maxDelayMs, uncapped);
    double jitter = ThreadLocalRandom.current().nextDouble(0.5, 1.5);
    return Math.min(maxDelayMs, Math.max(0L, (long) (capped * jitter)));
  }
}
