package membership.queue;

import java.time.Instant;

/**
 * Computes the delay before the next attempt of a failed queue item.
 *
 * @see ExponentialBackoffRetryPolicy
 */
public interface RetryPolicy {

  /**
   * @param attempts number of failed attempts so far (1 after the first failure)
   * @return delay in milliseconds before the next attempt
   */
  long computeDelayMs(int attempts);

  /**
   * Returns the time of the next attempt after {@code attempts} failures.
   */
  default Instant nextAttemptAt(Instant now, int attempts) {
    return now.plusMillis(computeDelayMs(attempts));
  }
}
