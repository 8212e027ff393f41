package delivery;

import delivery.drain.DrainScheduler;
import delivery.drain.QueueDrainer;
import delivery.retry.ExponentialBackoffRetryPolicy;
import delivery.retry.RetryCoordinator;
import delivery.retry.RetryPolicy;
import delivery.spi.MetricsExporter;
import delivery.spi.PayloadStore;
import delivery.store.FilePayloadStore;
import delivery.truncate.QueueTruncator;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Composite entry point that wires a {@link PayloadStore}, {@link QueueDrainer} and
 * {@link DrainScheduler} into a single {@link AutoCloseable} unit.
 *
 * <p>Enqueued payloads are written to disk first and then handed to the drain loop, so a
 * payload survives a crash at any point after {@link #enqueue} returns its id.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (Delivery delivery = Delivery.builder()
 *     .storeDirectory(Path.of("/var/lib/app/delivery"))
 *     .transport(HttpTransport.builder()
 *         .endpoint(ResourceType.ERRORS, URI.create("https://collector.example.com/errors"))
 *         .build())
 *     .build()) {
 *   delivery.enqueue(ResourceType.ERRORS, reportJson);
 * }
 * }</pre>
 *
 * @see FilePayloadStore
 * @see QueueDrainer
 */
public final class Delivery implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(Delivery.class.getName());

  private final PayloadStore store;
  private final AutoCloseable ownedStore;
  private final QueueDrainer drainer;
  private final DrainScheduler scheduler;
  private final MetricsExporter metrics;

  private Delivery(PayloadStore store, AutoCloseable ownedStore, QueueDrainer drainer,
      DrainScheduler scheduler, MetricsExporter metrics) {
    this.store = store;
    this.ownedStore = ownedStore;
    this.drainer = drainer;
    this.scheduler = scheduler;
    this.metrics = metrics;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Persists a payload and triggers delivery of its queue.
   *
   * @param type    the resource type
   * @param body    serialized payload body
   * @param headers transport metadata stored with the payload
   * @return the payload id, or {@code null} if it could not be persisted
   */
  public String enqueue(ResourceType type, byte[] body, Map<String, String> headers) {
    String id = store.enqueue(type, body, headers);
    if (id != null) {
      drainer.trigger(type);
    }
    return id;
  }

  public String enqueue(ResourceType type, byte[] body) {
    return enqueue(type, body, Map.of());
  }

  /**
   * Starts a drain pass for one resource type unless one is already running.
   *
   * @param type the resource type
   * @return {@code true} if a pass was started
   */
  public boolean flush(ResourceType type) {
    return drainer.trigger(type);
  }

  /**
   * Starts a drain pass for every resource type.
   */
  public void flushAll() {
    drainer.triggerAll();
  }

  /**
   * Notifies the queue of a connectivity change. Regaining connectivity flushes every
   * resource type; losing it has no effect, since in-flight attempts fail as retryable.
   *
   * @param online whether the network is now reachable
   */
  public void onConnectivityChanged(boolean online) {
    if (online) {
      logger.log(Level.FINE, "Connectivity restored; flushing all queues");
      flushAll();
    }
  }

  public PayloadStore store() {
    return store;
  }

  public QueueDrainer drainer() {
    return drainer;
  }

  /**
   * Shuts down components in order: scheduler, drainer, store, metrics.
   */
  @Override
  public void close() {
    RuntimeException first = null;
    if (scheduler != null) {
      try {
        scheduler.close();
      } catch (RuntimeException e) {
        first = e;
      }
    }
    try {
      drainer.close();
    } catch (RuntimeException e) {
      if (first == null) first = e; else first.addSuppressed(e);
    }
    first = closeQuietly(ownedStore, first);
    if (metrics instanceof AutoCloseable closeable) {
      first = closeQuietly(closeable, first);
    }
    if (first != null) {
      throw first;
    }
  }

  private static RuntimeException closeQuietly(AutoCloseable closeable, RuntimeException first) {
    if (closeable == null) {
      return first;
    }
    try {
      closeable.close();
    } catch (Exception e) {
      RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
      if (first == null) {
        return re;
      }
      first.addSuppressed(re);
    }
    return first;
  }

  /** Builder for {@link Delivery}. */
  public static final class Builder {
    private Path storeDirectory;
    private PayloadStore payloadStore;
    private Transport transport;
    private ErrorSink errorSink;
    private MetricsExporter metrics;
    private int maxItems = QueueTruncator.DEFAULT_MAX_ITEMS;
    private int maxRetries = RetryCoordinator.UNBOUNDED;
    private RetryPolicy retryPolicy;
    private long tickIntervalMs = DrainScheduler.DEFAULT_INTERVAL_MS;
    private Executor drainExecutor;
    private long drainTimeoutMs = 5000L;
    private boolean flushOnStart = true;
    private final AtomicBoolean built = new AtomicBoolean(false);

    private Builder() {}

    /**
     * Sets the directory of the default {@link FilePayloadStore}.
     *
     * <p>Exactly one of {@code storeDirectory} and {@link #payloadStore} is required.
     *
     * @param storeDirectory the queue root directory
     * @return this builder
     */
    public Builder storeDirectory(Path storeDirectory) {
      this.storeDirectory = storeDirectory;
      return this;
    }

    /**
     * Sets a custom store. The caller keeps ownership; {@link #maxItems} is ignored.
     *
     * @param payloadStore the store
     * @return this builder
     */
    public Builder payloadStore(PayloadStore payloadStore) {
      this.payloadStore = payloadStore;
      return this;
    }

    /**
     * Sets the transport performing delivery attempts.
     *
     * <p><b>Required.</b>
     *
     * @param transport the transport
     * @return this builder
     */
    public Builder transport(Transport transport) {
      this.transport = transport;
      return this;
    }

    /**
     * Sets the sink receiving every internal failure.
     *
     * <p>Optional. Defaults to {@link ErrorSink#LOGGING}.
     *
     * @param errorSink the error sink
     * @return this builder
     */
    public Builder errorSink(ErrorSink errorSink) {
      this.errorSink = errorSink;
      return this;
    }

    /**
     * Sets the metrics exporter. An {@link AutoCloseable} exporter is closed with the
     * composite.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets the per-resource-type capacity bound of the default store.
     *
     * <p>Optional. Defaults to {@code 64}.
     *
     * @param maxItems maximum queued payloads per resource type
     * @return this builder
     */
    public Builder maxItems(int maxItems) {
      this.maxItems = maxItems;
      return this;
    }

    /**
     * Sets the retry ceiling.
     *
     * <p>Optional. Defaults to {@code 0} (unbounded).
     *
     * @param maxRetries maximum retries per payload
     * @return this builder
     */
    public Builder maxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    /**
     * Sets the delay policy for re-draining after a retryable failure.
     *
     * <p>Optional. Defaults to exponential backoff from 1 s to 5 min.
     *
     * @param retryPolicy the retry policy
     * @return this builder
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Sets the periodic drain interval; {@code 0} disables the scheduler.
     *
     * <p>Optional. Defaults to {@code 30000} ms.
     *
     * @param tickIntervalMs interval in milliseconds
     * @return this builder
     */
    public Builder tickIntervalMs(long tickIntervalMs) {
      this.tickIntervalMs = tickIntervalMs;
      return this;
    }

    /**
     * Sets the executor running drain passes.
     *
     * <p>Optional. Defaults to a daemon pool owned by the drainer.
     *
     * @param drainExecutor the executor
     * @return this builder
     */
    public Builder drainExecutor(Executor drainExecutor) {
      this.drainExecutor = drainExecutor;
      return this;
    }

    /**
     * Sets the maximum time to wait for in-flight deliveries during shutdown.
     *
     * <p>Optional. Defaults to {@code 5000} ms.
     *
     * @param drainTimeoutMs timeout in milliseconds
     * @return this builder
     */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * Whether {@link #build()} flushes payloads left over from a previous run.
     *
     * <p>Optional. Defaults to {@code true}.
     *
     * @param flushOnStart flush on start
     * @return this builder
     */
    public Builder flushOnStart(boolean flushOnStart) {
      this.flushOnStart = flushOnStart;
      return this;
    }

    /**
     * Builds and starts the composite.
     *
     * @return a new {@link Delivery}
     * @throws NullPointerException if {@code transport} is null
     * @throws IllegalArgumentException if neither or both store options are set, or a
     *     numeric option is out of range
     * @throws IllegalStateException if called twice
     */
    public Delivery build() {
      Objects.requireNonNull(transport, "transport");
      if ((storeDirectory == null) == (payloadStore == null)) {
        throw new IllegalArgumentException("exactly one of storeDirectory or payloadStore must be set");
      }
      if (tickIntervalMs < 0) {
        throw new IllegalArgumentException("tickIntervalMs must be >= 0");
      }
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }

      PayloadStore store = payloadStore;
      FilePayloadStore ownedStore = null;
      if (store == null) {
        ownedStore = FilePayloadStore.builder()
            .root(storeDirectory)
            .maxItems(maxItems)
            .errorSink(errorSink)
            .metrics(metrics)
            .build();
        store = ownedStore;
      }

      QueueDrainer drainer;
      try {
        drainer = QueueDrainer.builder()
            .store(store)
            .transport(transport)
            .coordinator(new RetryCoordinator(store, errorSink, metrics, maxRetries))
            .retryPolicy(retryPolicy != null
                ? retryPolicy
                : new ExponentialBackoffRetryPolicy(1_000L, 300_000L))
            .executor(drainExecutor)
            .drainTimeoutMs(drainTimeoutMs)
            .build();
      } catch (RuntimeException e) {
        closeQuietly(ownedStore, null);
        throw e;
      }

      DrainScheduler scheduler = null;
      if (tickIntervalMs > 0) {
        try {
          scheduler = DrainScheduler.builder().drainer(drainer).intervalMs(tickIntervalMs).build();
          scheduler.start();
        } catch (RuntimeException e) {
          if (scheduler != null) {
            scheduler.close();
          }
          drainer.close();
          closeQuietly(ownedStore, null);
          throw e;
        }
      }

      Delivery delivery = new Delivery(store, ownedStore, drainer, scheduler, metrics);
      if (flushOnStart) {
        delivery.flushAll();
      }
      return delivery;
    }
  }
}
