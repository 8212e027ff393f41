package delivery.retry;

import java.time.Duration;

/**
 * Strategy for computing how long the drain loop waits before re-attempting a payload
 * that failed with a retryable outcome.
 *
 * @see ExponentialBackoffRetryPolicy
 */
public interface RetryPolicy {

  /**
   * Computes the delay in milliseconds before the next attempt.
   *
   * @param retries the number of retryable failures recorded so far (1-based)
   * @return delay in milliseconds (non-negative)
   */
  long computeDelayMs(int retries);

  /**
   * Computes the delay before the next attempt, honouring a server-requested
   * {@code Retry-After} when one was given.
   *
   * @param retries    the number of retryable failures recorded so far (1-based)
   * @param retryAfter the server-requested delay, or {@code null}
   * @return delay in milliseconds (non-negative)
   */
  default long delayMs(int retries, Duration retryAfter) {
    return retryAfter != null ? toMillisSaturated(retryAfter) : computeDelayMs(retries);
  }

  /**
   * Converts a non-negative duration to milliseconds, saturating at {@link Long#MAX_VALUE}.
   */
  static long toMillisSaturated(Duration duration) {
    if (duration.isNegative()) {
      return 0L;
    }
    return duration.compareTo(Duration.ofMillis(Long.MAX_VALUE)) >= 0 ? Long.MAX_VALUE : duration.toMillis();
  }
}
