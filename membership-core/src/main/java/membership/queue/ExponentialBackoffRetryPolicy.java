package membership.queue;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Retry policy using exponential backoff with optional jitter.
 *
 * <p>Delay formula: {@code baseDelay * 2^(attempt-1)}, capped at {@code maxDelay}, then
 * scaled by a random factor in {@code [1 - jitter, 1 + jitter)}. A jitter of 0 gives
 * deterministic delays.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  /** One minute base delay. */
  public static final long DEFAULT_BASE_DELAY_MS = Duration.ofMinutes(1).toMillis();
  /** One day cap. */
  public static final long DEFAULT_MAX_DELAY_MS = Duration.ofDays(1).toMillis();
  public static final double DEFAULT_JITTER = 0.1;

  private final long baseDelayMs;
  private final long maxDelayMs;
  private final double jitter;

  public ExponentialBackoffRetryPolicy() {
    this(DEFAULT_BASE_DELAY_MS, DEFAULT_MAX_DELAY_MS, DEFAULT_JITTER);
  }

  /**
   * @param baseDelayMs base delay for the first retry (milliseconds)
   * @param maxDelayMs  maximum delay cap (milliseconds)
   * @param jitter      relative jitter, from 0 (none) up to but excluding 1
   */
  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs, double jitter) {
    if (baseDelayMs <= 0) {
      throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
    }
    if (maxDelayMs < baseDelayMs) {
      throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
    }
    if (jitter < 0 || jitter >= 1) {
      throw new IllegalArgumentException("jitter must be in [0, 1), got: " + jitter);
    }
    this.baseDelayMs = baseDelayMs;
    this.maxDelayMs = maxDelayMs;
    this.jitter = jitter;
  }

  @Override
  public long computeDelayMs(int attempts) {
    if (attempts <= 0) {
      return 0L;
    }
    long expDelay;
    if (attempts >= 63) {
      expDelay = Long.MAX_VALUE;
    } else {
      long shift = 1L << (attempts - 1);
      // shift beyond maxDelayMs / baseDelayMs would overflow; the cap applies anyway
      expDelay = shift > maxDelayMs / baseDelayMs ? Long.MAX_VALUE : baseDelayMs * shift;
    }
    long capped = Math.min(maxDelayMs, expDelay);
    if (jitter == 0) {
      return capped;
    }
    double factor = ThreadLocalRandom.current().nextDouble(1 - jitter, 1 + jitter);
    return Math.min(maxDelayMs, Math.max(0L, (long) (capped * factor)));
  }
}
