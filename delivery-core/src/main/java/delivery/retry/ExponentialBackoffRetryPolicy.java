package delivery.retry;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Doubling backoff between drain passes of a queue whose head keeps failing.
 *
 * <p>The n-th retry waits {@code baseDelay * 2^(n-1)}, capped at {@code maxDelay} and
 * spread by a jitter factor in [0.5, 1.5) that never pushes it past the cap. A
 * {@code Retry-After} from the collector replaces the backoff but is clamped to
 * {@code maxRetryAfter}, so a hostile or broken server cannot park a queue forever.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  /** Default ceiling for server-requested delays: one hour. */
  public static final long DEFAULT_MAX_RETRY_AFTER_MS = 3_600_000L;

  private final long baseDelayMs;
  private final long maxDelayMs;
  private final long maxRetryAfterMs;

  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs) {
    this(baseDelayMs, maxDelayMs, DEFAULT_MAX_RETRY_AFTER_MS);
  }

  /**
   * @param baseDelayMs     delay before the first retry (milliseconds)
   * @param maxDelayMs      ceiling for the computed backoff (milliseconds)
   * @param maxRetryAfterMs ceiling for server-requested delays (milliseconds)
   */
  public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs, long maxRetryAfterMs) {
    if (baseDelayMs <= 0) {
      throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
    }
    if (maxDelayMs < baseDelayMs) {
      throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
    }
    if (maxRetryAfterMs < 0) {
      throw new IllegalArgumentException("maxRetryAfterMs must be >= 0, got: " + maxRetryAfterMs);
    }
    this.baseDelayMs = baseDelayMs;
    this.maxDelayMs = maxDelayMs;
    this.maxRetryAfterMs = maxRetryAfterMs;
  }

  @Override
  public long computeDelayMs(int retries) {
    if (retries <= 0) {
      return 0L;
    }
    long ceiling = backoff(retries);
    long jittered = (long) (ceiling * ThreadLocalRandom.current().nextDouble(0.5, 1.5));
    return Math.min(maxDelayMs, Math.max(0L, jittered));
  }

  @Override
  public long delayMs(int retries, Duration retryAfter) {
    if (retryAfter == null) {
      return computeDelayMs(retries);
    }
    return Math.min(maxRetryAfterMs, RetryPolicy.toMillisSaturated(retryAfter));
  }

  public long maxRetryAfterMs() {
    return maxRetryAfterMs;
  }

  private long backoff(int retries) {
    long delay = baseDelayMs;
    // stops once the cap is reached, so large retry counts cost at most ~63 steps
    for (int i = 1; i < retries && delay < maxDelayMs; i++) {
      delay = delay > maxDelayMs / 2 ? maxDelayMs : delay * 2;
    }
    return Math.min(delay, maxDelayMs);
  }
}
