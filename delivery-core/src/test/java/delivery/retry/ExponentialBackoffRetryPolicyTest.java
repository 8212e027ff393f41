package delivery.retry;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ExponentialBackoffRetryPolicyTest {

  @Test
  void firstRetryUsesBaseDelay() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(100, 10000);

    long delay = policy.computeDelayMs(1);

    assertTrue(delay >= 50 && delay < 150, "Expected delay between 50-150, got: " + delay);
  }

  @Test
  void delayDoublesPerRetry() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(100, 100000);

    long delay1 = policy.computeDelayMs(1);
    long delay2 = policy.computeDelayMs(2);
    long delay3 = policy.computeDelayMs(3);

    assertTrue(delay1 >= 50 && delay1 < 150, "delay1 range: got " + delay1);
    assertTrue(delay2 >= 100 && delay2 < 300, "delay2 range: got " + delay2);
    assertTrue(delay3 >= 200 && delay3 < 600, "delay3 range: got " + delay3);
  }

  @Test
  void delayIsCappedAtMaxDelay() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(1000, 300000);

    for (int retries : new int[]{10, 31, 32, 62, 63, 100, Integer.MAX_VALUE}) {
      long delay = policy.computeDelayMs(retries);
      assertTrue(delay > 0 && delay <= 300000, "retries=" + retries + " delay=" + delay);
    }
  }

  @Test
  void noRetriesMeansNoDelay() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(100, 1000);
    assertEquals(0L, policy.computeDelayMs(0));
  }

  @Test
  void retryAfterReplacesBackoffUpToCeiling() {
    ExponentialBackoffRetryPolicy policy = new ExponentialBackoffRetryPolicy(100, 1000, 60_000);

    assertEquals(30_000L, policy.delayMs(1, Duration.ofSeconds(30)));
    assertEquals(60_000L, policy.delayMs(1, Duration.ofHours(2)));
    assertEquals(60_000L, policy.delayMs(1, Duration.ofSeconds(Long.MAX_VALUE)));
    long backoff = policy.delayMs(1, null);
    assertTrue(backoff >= 50 && backoff < 150, "backoff: " + backoff);
  }

  @Test
  void defaultRetryAfterHandlingSaturates() {
    RetryPolicy fixed = retries -> 5L;

    assertEquals(5L, fixed.delayMs(3, null));
    assertEquals(2_000L, fixed.delayMs(3, Duration.ofSeconds(2)));
    assertEquals(Long.MAX_VALUE, fixed.delayMs(3, Duration.ofSeconds(Long.MAX_VALUE)));
    assertEquals(0L, RetryPolicy.toMillisSaturated(Duration.ofMillis(-5)));
  }

  @Test
  void invalidArguments() {
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(0, 100));
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(100, 50));
    assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoffRetryPolicy(100, 500, -1));
  }
}
