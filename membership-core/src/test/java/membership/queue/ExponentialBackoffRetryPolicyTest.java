package membership.queue;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class ExponentialBackoffRetryPolicyTest {

  @Test
  void withoutJitterDelayDoublesPerAttempt() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(1000, 1_000_000, 0);

    assertEquals(1000, policy.computeDelayMs(1));
    assertEquals(2000, policy.computeDelayMs(2));
    assertEquals(4000, policy.computeDelayMs(3));
    assertEquals(8000, policy.computeDelayMs(4));
  }

  @Test
  void jitterStaysWithinBounds() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(1000, 1_000_000, 0.1);

    for (int i = 0; i < 50; i++) {
      long delay = policy.computeDelayMs(2);
      assertTrue(delay >= 1800 && delay < 2200, "delay out of range: " + delay);
    }
  }

  @Test
  void delayIsCappedAtMaxDelay() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(100, 500, 0.5);

    for (int attempt = 1; attempt < 20; attempt++) {
      assertTrue(policy.computeDelayMs(attempt) <= 500);
    }
  }

  @Test
  void handlesAttemptCountAtOverflowBoundary() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(100, 60000, 0);

    assertEquals(60000, policy.computeDelayMs(31));
    assertEquals(60000, policy.computeDelayMs(63));
    assertEquals(60000, policy.computeDelayMs(1000));
  }

  @Test
  void nonPositiveAttemptsReturnZero() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy();

    assertEquals(0L, policy.computeDelayMs(0));
    assertEquals(0L, policy.computeDelayMs(-1));
  }

  @Test
  void nextAttemptAtAddsDelay() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(60_000, 86_400_000, 0);
    Instant now = Instant.parse("2025-06-15T12:00:00Z");

    assertEquals(Instant.parse("2025-06-15T12:04:00Z"), policy.nextAttemptAt(now, 3));
  }

  @Test
  void rejectsInvalidSettings() {
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(0, 1000, 0));
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(1000, 999, 0));
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(1000, 2000, 1.0));
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(1000, 2000, -0.1));
  }
}
