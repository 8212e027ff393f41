package delivery;

import java.time.Duration;
import java.util.Objects;

/**
 * Classified result of one delivery attempt, returned by a {@link Transport}.
 *
 * <ul>
 *   <li>{@link Success}: the collector accepted the payload; it is removed.</li>
 *   <li>{@link RetryableFailure}: transient condition (no network, 5xx, timeout,
 *       rate limiting); the payload stays at the head of its queue and its
 *       {@code retries} counter is incremented.</li>
 *   <li>{@link PermanentFailure}: the collector will never accept it (4xx); the
 *       payload is removed and reported.</li>
 * </ul>
 */
public sealed interface DeliveryOutcome
    permits DeliveryOutcome.Success, DeliveryOutcome.RetryableFailure, DeliveryOutcome.PermanentFailure {

  /**
   * Singleton success result.
   */
  Success SUCCESS = new Success();

  static Success success() {
    return SUCCESS;
  }

  /**
   * @param reason short description of the transient failure
   * @return a retryable failure without a server-requested delay
   */
  static RetryableFailure retryable(String reason) {
    return new RetryableFailure(reason, null);
  }

  /**
   * @param reason     short description of the transient failure
   * @param retryAfter server-requested delay before the next attempt
   * @return a retryable failure
   */
  static RetryableFailure retryable(String reason, Duration retryAfter) {
    return new RetryableFailure(reason, retryAfter);
  }

  static PermanentFailure permanent(String reason) {
    return new PermanentFailure(reason);
  }

  /** Delivery succeeded. */
  record Success() implements DeliveryOutcome {
  }

  /**
   * Delivery failed for a transient reason.
   *
   * @param reason     description of the failure
   * @param retryAfter server-requested delay, or {@code null} to use the retry policy
   */
  record RetryableFailure(String reason, Duration retryAfter) implements DeliveryOutcome {
    public RetryableFailure {
      Objects.requireNonNull(reason, "reason");
      if (retryAfter != null && retryAfter.isNegative()) {
        throw new IllegalArgumentException("retryAfter must not be negative");
      }
    }
  }

  /**
   * Delivery was rejected and must not be retried.
   *
   * @param reason description of the rejection
   */
  record PermanentFailure(String reason) implements DeliveryOutcome {
    public PermanentFailure {
      Objects.requireNonNull(reason, "reason");
    }
  }
}
