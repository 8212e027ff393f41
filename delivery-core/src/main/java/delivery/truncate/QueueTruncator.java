package delivery.truncate;

import delivery.DeliveryError;
import delivery.ErrorSink;
import delivery.ResourceType;
import delivery.spi.MetricsExporter;
import delivery.spi.PayloadStore;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Keeps each resource type's queue within {@code maxItems} by evicting the oldest
 * payloads.
 *
 * <p>Passes are single-flight per resource type: a trigger that arrives while a pass is
 * scheduled or running is dropped, not queued. A burst of enqueues may therefore run
 * fewer passes than triggers, but every pass that does run restores the bound for the
 * entries it listed.
 *
 * <p>This class is thread-safe.
 */
public final class QueueTruncator {
  private static final Logger logger = Logger.getLogger(QueueTruncator.class.getName());

  /** Default capacity bound per resource type. */
  public static final int DEFAULT_MAX_ITEMS = 64;

  private final PayloadStore store;
  private final int maxItems;
  private final Executor executor;
  private final ErrorSink errorSink;
  private final MetricsExporter metrics;
  private final Map<ResourceType, AtomicBoolean> guards = new EnumMap<>(ResourceType.class);

  /**
   * @param store     the store to truncate
   * @param maxItems  capacity bound per resource type (&ge; 1)
   * @param executor  runs asynchronous passes
   * @param errorSink receives pass failures; {@code null} defaults to {@link ErrorSink#LOGGING}
   * @param metrics   metrics exporter; {@code null} defaults to {@link MetricsExporter#NOOP}
   */
  public QueueTruncator(PayloadStore store, int maxItems, Executor executor,
      ErrorSink errorSink, MetricsExporter metrics) {
    this.store = Objects.requireNonNull(store, "store");
    this.executor = Objects.requireNonNull(executor, "executor");
    if (maxItems < 1) {
      throw new IllegalArgumentException("maxItems must be >= 1, got: " + maxItems);
    }
    this.maxItems = maxItems;
    this.errorSink = ErrorSink.guarded(errorSink);
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
    for (ResourceType type : ResourceType.values()) {
      guards.put(type, new AtomicBoolean(false));
    }
  }

  public int maxItems() {
    return maxItems;
  }

  /**
   * Schedules an asynchronous pass unless one is already in flight for this type.
   * Never blocks on the pass itself.
   *
   * @param type the resource type to truncate
   * @return {@code true} if a pass was scheduled
   */
  public boolean trigger(ResourceType type) {
    AtomicBoolean guard = guards.get(Objects.requireNonNull(type, "type"));
    if (!guard.compareAndSet(false, true)) {
      return false;
    }
    try {
      executor.execute(() -> runPass(type, guard));
      return true;
    } catch (RejectedExecutionException e) {
      guard.set(false);
      logger.log(Level.FINE, "Truncation executor rejected pass for " + type.id(), e);
      return false;
    }
  }

  /**
   * Runs a pass on the calling thread unless one is already in flight for this type.
   *
   * @param type the resource type to truncate
   * @return number of payloads evicted, or {@code -1} if another pass was in flight
   */
  public int truncate(ResourceType type) {
    AtomicBoolean guard = guards.get(Objects.requireNonNull(type, "type"));
    if (!guard.compareAndSet(false, true)) {
      return -1;
    }
    return runPass(type, guard);
  }

  /**
   * @param type the resource type
   * @return {@code true} while a pass is scheduled or running
   */
  public boolean isTruncating(ResourceType type) {
    return guards.get(Objects.requireNonNull(type, "type")).get();
  }

  private int runPass(ResourceType type, AtomicBoolean guard) {
    try {
      return evictOverflow(type);
    } catch (RuntimeException e) {
      errorSink.report(new DeliveryError(DeliveryError.Kind.STORAGE_FAILURE, type, null,
          "Truncation pass failed", e));
      return 0;
    } finally {
      guard.set(false);
    }
  }

  private int evictOverflow(ResourceType type) {
    List<String> ids = store.list(type);
    int overflow = ids.size() - maxItems;
    if (overflow <= 0) {
      metrics.recordQueueDepth(type, ids.size());
      return 0;
    }
    int removed = 0;
    for (String id : ids.subList(0, overflow)) {
      try {
        store.remove(id);
        removed++;
      } catch (RuntimeException e) {
        // keep going: one failed eviction must not leave the rest of the overflow in place
        errorSink.report(new DeliveryError(DeliveryError.Kind.STORAGE_FAILURE, type, id,
            "Failed to evict payload during truncation", e));
      }
    }
    metrics.incrementTruncated(type, removed);
    metrics.recordQueueDepth(type, ids.size() - removed);
    logger.log(Level.FINE, "Evicted {0} oldest {1} payloads (limit {2})",
        new Object[]{removed, type.id(), maxItems});
    return removed;
  }
}
