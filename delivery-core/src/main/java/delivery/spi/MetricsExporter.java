package delivery.spi;

import delivery.ResourceType;

/**
 * Observability hook for exporting queue and delivery counters to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Increments the count of payloads durably enqueued.
   */
  void incrementEnqueued(ResourceType type);

  /**
   * Increments the count of enqueue calls that failed to persist their payload.
   */
  void incrementEnqueueFailed(ResourceType type);

  /**
   * Adds to the count of payloads evicted by truncation.
   *
   * @param type  the resource type
   * @param count number of payloads evicted in one pass
   */
  void incrementTruncated(ResourceType type, int count);

  /**
   * Increments the count of corrupt entries deleted by {@code peek}.
   */
  default void incrementCorruptRemoved(ResourceType type) {
  }

  /**
   * Increments the count of payloads delivered successfully.
   */
  void incrementDeliverySuccess(ResourceType type);

  /**
   * Increments the count of retryable delivery failures.
   */
  void incrementDeliveryRetry(ResourceType type);

  /**
   * Increments the count of payloads discarded after a permanent failure or retry exhaustion.
   */
  void incrementDeliveryDropped(ResourceType type);

  /**
   * Records the number of queued payloads observed for a resource type.
   *
   * @param type  the resource type
   * @param depth queued payload count
   */
  default void recordQueueDepth(ResourceType type, int depth) {
  }

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementEnqueued(ResourceType type) {
    }

    @Override
    public void incrementEnqueueFailed(ResourceType type) {
    }

    @Override
    public void incrementTruncated(ResourceType type, int count) {
    }

    @Override
    public void incrementDeliverySuccess(ResourceType type) {
    }

    @Override
    public void incrementDeliveryRetry(ResourceType type) {
    }

    @Override
    public void incrementDeliveryDropped(ResourceType type) {
    }
  }
}
