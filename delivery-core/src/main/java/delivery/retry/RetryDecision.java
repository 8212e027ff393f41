package delivery.retry;

/**
 * What {@link RetryCoordinator#settle} did with a payload after a delivery attempt.
 */
public enum RetryDecision {
  /** Delivered; removed from the queue. */
  DELIVERED(true),
  /** Retryable failure; kept in place with {@code retries} incremented. */
  RETAINED(false),
  /** Permanent failure; removed and reported. */
  DISCARDED(true),
  /** Retry ceiling reached; removed and reported. */
  EXHAUSTED(true);

  private final boolean removed;

  RetryDecision(boolean removed) {
    this.removed = removed;
  }

  /**
   * @return {@code true} if the payload left the queue
   */
  public boolean removed() {
    return removed;
  }
}
