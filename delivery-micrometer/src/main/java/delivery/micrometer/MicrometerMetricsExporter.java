package delivery.micrometer;

import delivery.ResourceType;
import delivery.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Every meter carries a {@code resource} tag with the {@link ResourceType#id()}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code delivery.enqueue}: payloads durably enqueued</li>
 *   <li>{@code delivery.enqueue.failed}: enqueues that could not be persisted</li>
 *   <li>{@code delivery.truncated}: payloads evicted by the capacity bound</li>
 *   <li>{@code delivery.corrupt.removed}: unreadable entries deleted by peek</li>
 *   <li>{@code delivery.attempt.success}: payloads delivered</li>
 *   <li>{@code delivery.attempt.retry}: retryable failures (payload kept)</li>
 *   <li>{@code delivery.attempt.dropped}: payloads discarded (permanent or exhausted)</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code delivery.queue.depth}: last observed queue length</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  static final String RESOURCE_TAG = "resource";

  private final MeterRegistry registry;
  private final Map<ResourceType, Meters> meters = new EnumMap<>(ResourceType.class);
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "delivery"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "delivery");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "crash.delivery"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }
    this.registry = registry;
    for (ResourceType type : ResourceType.values()) {
      meters.put(type, new Meters(registry, namePrefix, type));
    }
  }

  @Override
  public void incrementEnqueued(ResourceType type) {
    if (closed) return;
    meters.get(type).enqueued.increment();
  }

  @Override
  public void incrementEnqueueFailed(ResourceType type) {
    if (closed) return;
    meters.get(type).enqueueFailed.increment();
  }

  @Override
  public void incrementTruncated(ResourceType type, int count) {
    if (closed || count <= 0) return;
    meters.get(type).truncated.increment(count);
  }

  @Override
  public void incrementCorruptRemoved(ResourceType type) {
    if (closed) return;
    meters.get(type).corruptRemoved.increment();
  }

  @Override
  public void incrementDeliverySuccess(ResourceType type) {
    if (closed) return;
    meters.get(type).success.increment();
  }

  @Override
  public void incrementDeliveryRetry(ResourceType type) {
    if (closed) return;
    meters.get(type).retry.increment();
  }

  @Override
  public void incrementDeliveryDropped(ResourceType type) {
    if (closed) return;
    meters.get(type).dropped.increment();
  }

  @Override
  public void recordQueueDepth(ResourceType type, int depth) {
    if (closed) return;
    meters.get(type).depth.set(depth);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Call this when the exporter is no longer needed (e.g. when the
   * {@link delivery.Delivery} is closed) to prevent stale gauges.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meters m : meters.values()) {
      for (Meter meter : m.all()) {
        try {
          registry.remove(meter);
        } catch (RuntimeException e) {
          if (first == null) first = e; else first.addSuppressed(e);
        }
      }
    }
    if (first != null) throw first;
  }

  private static final class Meters {
    final Counter enqueued;
    final Counter enqueueFailed;
    final Counter truncated;
    final Counter corruptRemoved;
    final Counter success;
    final Counter retry;
    final Counter dropped;
    final AtomicInteger depth = new AtomicInteger();
    final Gauge depthGauge;

    Meters(MeterRegistry registry, String prefix, ResourceType type) {
      String tag = type.id();
      enqueued = counter(registry, prefix + ".enqueue", tag, "Payloads durably enqueued");
      enqueueFailed = counter(registry, prefix + ".enqueue.failed", tag, "Enqueues that could not be persisted");
      truncated = counter(registry, prefix + ".truncated", tag, "Payloads evicted by the capacity bound");
      corruptRemoved = counter(registry, prefix + ".corrupt.removed", tag, "Corrupt entries deleted");
      success = counter(registry, prefix + ".attempt.success", tag, "Payloads delivered");
      retry = counter(registry, prefix + ".attempt.retry", tag, "Retryable delivery failures");
      dropped = counter(registry, prefix + ".attempt.dropped", tag, "Payloads discarded after delivery failure");
      depthGauge = Gauge.builder(prefix + ".queue.depth", depth, AtomicInteger::get)
          .description("Last observed queue length")
          .tag(RESOURCE_TAG, tag)
          .register(registry);
    }

    private static Counter counter(MeterRegistry registry, String name, String resource, String description) {
      return Counter.builder(name)
          .description(description)
          .tag(RESOURCE_TAG, resource)
          .register(registry);
    }

    List<Meter> all() {
      List<Meter> all = new ArrayList<>(List.of(enqueued, enqueueFailed, truncated, corruptRemoved,
          success, retry, dropped));
      all.add(depthGauge);
      return all;
    }
  }
}
