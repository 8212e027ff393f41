package delivery.drain;

import delivery.DeliveryOutcome;
import delivery.ErrorSink;
import delivery.ResourceType;
import delivery.Transport;
import delivery.model.Payload;
import delivery.retry.RetryCoordinator;
import delivery.retry.RetryDecision;
import delivery.retry.RetryPolicy;
import delivery.spi.MetricsExporter;
import delivery.spi.PayloadStore;
import delivery.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Delivers queued payloads oldest-first, one at a time per resource type.
 *
 * <p>Each resource type runs its own state machine
 * ({@link DrainState#IDLE} &rarr; {@link DrainState#ATTEMPTING} &rarr;
 * {@link DrainState#SETTLING}). A {@link #trigger} while a pass is in flight does not
 * start a second one, so at most one payload per type is ever being delivered; it only
 * marks the type for one more pass once the current pass ends without a retained
 * payload. Types drain independently.
 *
 * <p>A pass keeps going while payloads are removed (delivered or discarded) and ends at
 * the first retained payload. If a {@link RetryPolicy} is configured, the drainer then
 * schedules its own re-trigger after the policy delay, or after the transport's
 * {@code retryAfter} hint when one is given. Without a policy, retained payloads wait for
 * the next external trigger.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe.
 *
 * @see QueueDrainer.Builder
 * @see DrainScheduler
 */
public final class QueueDrainer implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(QueueDrainer.class.getName());

  private final PayloadStore store;
  private final Transport transport;
  private final RetryCoordinator coordinator;
  private final RetryPolicy retryPolicy;
  private final Executor executor;
  private final ExecutorService ownedExecutor;
  private final ScheduledExecutorService retryTimer;
  private final long drainTimeoutMs;
  private final Map<ResourceType, AtomicReference<DrainState>> states = new EnumMap<>(ResourceType.class);
  private final Map<ResourceType, AtomicBoolean> missed = new EnumMap<>(ResourceType.class);

  private volatile boolean closed;

  private QueueDrainer(Builder builder) {
    this.store = Objects.requireNonNull(builder.store, "store");
    this.transport = Objects.requireNonNull(builder.transport, "transport");
    if (builder.drainTimeoutMs < 0) {
      throw new IllegalArgumentException("drainTimeoutMs must be >= 0");
    }
    this.coordinator = builder.coordinator != null
        ? builder.coordinator
        : new RetryCoordinator(store, builder.errorSink, builder.metrics, builder.maxRetries);
    this.retryPolicy = builder.retryPolicy;
    this.drainTimeoutMs = builder.drainTimeoutMs;
    if (builder.executor != null) {
      this.executor = builder.executor;
      this.ownedExecutor = null;
    } else {
      this.ownedExecutor = Executors.newCachedThreadPool(new DaemonThreadFactory("delivery-drain-"));
      this.executor = ownedExecutor;
    }
    this.retryTimer = retryPolicy != null
        ? Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("delivery-retry-"))
        : null;
    for (ResourceType type : ResourceType.values()) {
      states.put(type, new AtomicReference<>(DrainState.IDLE));
      missed.put(type, new AtomicBoolean(false));
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts a drain pass for {@code type} unless one is already in flight.
   *
   * @param type the resource type to drain
   * @return {@code true} if a pass was started
   */
  public boolean trigger(ResourceType type) {
    AtomicReference<DrainState> state = states.get(Objects.requireNonNull(type, "type"));
    if (closed) {
      return false;
    }
    AtomicBoolean rerun = missed.get(type);
    // raised before the CAS: a pass that ends after a failed CAS is certain to see it
    rerun.set(true);
    if (!state.compareAndSet(DrainState.IDLE, DrainState.ATTEMPTING)) {
      return false;
    }
    rerun.set(false);
    try {
      executor.execute(() -> drain(type, state));
      return true;
    } catch (RejectedExecutionException e) {
      state.set(DrainState.IDLE);
      logger.log(Level.FINE, "Drain executor rejected pass for " + type.id(), e);
      return false;
    }
  }

  /**
   * Starts a drain pass for every resource type.
   *
   * @return number of passes started
   */
  public int triggerAll() {
    int started = 0;
    for (ResourceType type : ResourceType.values()) {
      if (trigger(type)) {
        started++;
      }
    }
    return started;
  }

  /**
   * @param type the resource type
   * @return the current state of the type's drain loop
   */
  public DrainState state(ResourceType type) {
    return states.get(Objects.requireNonNull(type, "type")).get();
  }

  public RetryCoordinator coordinator() {
    return coordinator;
  }

  private void drain(ResourceType type, AtomicReference<DrainState> state) {
    DeliveryOutcome retained = null;
    int retries = 0;
    try {
      String lastRemoved = null;
      while (!closed) {
        state.set(DrainState.ATTEMPTING);
        Payload payload = store.peek(type);
        if (payload == null) {
          break;
        }
        if (payload.id().equals(lastRemoved)) {
          // remove() failed and already reported; stop instead of re-sending it in a loop
          logger.log(Level.WARNING, "Payload {0} is still queued after removal; ending drain pass",
              payload.id());
          break;
        }
        DeliveryOutcome outcome = coordinator.attempt(transport, payload);
        state.set(DrainState.SETTLING);
        RetryDecision decision = coordinator.settle(payload, outcome);
        if (!decision.removed()) {
          retained = outcome;
          retries = payload.retries() + 1;
          break;
        }
        lastRemoved = payload.id();
      }
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Drain pass failed for " + type.id(), t);
    } finally {
      state.set(DrainState.IDLE);
    }
    // scheduled only once IDLE, so an early re-trigger cannot be dropped
    boolean triggeredDuringPass = missed.get(type).getAndSet(false);
    if (retained != null) {
      scheduleRetry(type, retries, retained);
    } else if (triggeredDuringPass) {
      trigger(type);
    }
  }

  private void scheduleRetry(ResourceType type, int retries, DeliveryOutcome outcome) {
    if (retryTimer == null || closed) {
      return;
    }
    try {
      Duration retryAfter = outcome instanceof DeliveryOutcome.RetryableFailure retryable
          ? retryable.retryAfter()
          : null;
      long delayMs = retryPolicy.delayMs(retries, retryAfter);
      retryTimer.schedule(() -> {
        trigger(type);
      }, delayMs, TimeUnit.MILLISECONDS);
      logger.log(Level.FINE, "Retrying {0} queue in {1} ms", new Object[]{type.id(), delayMs});
    } catch (RejectedExecutionException e) {
      logger.log(Level.FINE, "Retry timer rejected re-trigger for " + type.id(), e);
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to schedule retry for " + type.id(), e);
    }
  }

  /**
   * Stops accepting triggers, cancels pending retries and waits up to
   * {@code drainTimeoutMs} for in-flight passes when the executor is owned.
   */
  @Override
  public void close() {
    closed = true;
    if (retryTimer != null) {
      retryTimer.shutdownNow();
    }
    if (ownedExecutor == null) {
      return;
    }
    ownedExecutor.shutdown();
    try {
      if (!ownedExecutor.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
        ownedExecutor.shutdownNow();
      }
    } catch (InterruptedException e) {
      ownedExecutor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  /** Builder for {@link QueueDrainer}. */
  public static final class Builder {
    private PayloadStore store;
    private Transport transport;
    private RetryCoordinator coordinator;
    private ErrorSink errorSink;
    private MetricsExporter metrics;
    private int maxRetries = RetryCoordinator.UNBOUNDED;
    private RetryPolicy retryPolicy;
    private Executor executor;
    private long drainTimeoutMs = 5000L;

    private Builder() {}

    /**
     * Sets the store to drain.
     *
     * <p><b>Required.</b>
     *
     * @param store the payload store
     * @return this builder
     */
    public Builder store(PayloadStore store) {
      this.store = store;
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
     * Sets a pre-built retry coordinator. When set, {@link #errorSink}, {@link #metrics}
     * and {@link #maxRetries} are ignored.
     *
     * <p>Optional.
     *
     * @param coordinator the retry coordinator
     * @return this builder
     */
    public Builder coordinator(RetryCoordinator coordinator) {
      this.coordinator = coordinator;
      return this;
    }

    /**
     * Sets the sink receiving permanent delivery failures.
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
     * Sets the metrics exporter.
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
     * Sets the retry ceiling.
     *
     * <p>Optional. Defaults to {@link RetryCoordinator#UNBOUNDED}.
     *
     * @param maxRetries maximum retries per payload, or {@code 0} for unbounded
     * @return this builder
     */
    public Builder maxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    /**
     * Sets the policy used to re-trigger a pass after a retained payload.
     *
     * <p>Optional. Without a policy the drainer never re-triggers itself.
     *
     * @param retryPolicy the retry policy
     * @return this builder
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Sets the executor running drain passes.
     *
     * <p>Optional. Defaults to a cached pool of daemon threads owned by the drainer.
     *
     * @param executor the executor
     * @return this builder
     */
    public Builder executor(Executor executor) {
      this.executor = executor;
      return this;
    }

    /**
     * Sets how long {@link #close()} waits for in-flight passes on the owned executor.
     *
     * <p>Optional. Defaults to 5000 ms.
     *
     * @param drainTimeoutMs timeout in milliseconds
     * @return this builder
     */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * @return a new {@link QueueDrainer}
     * @throws NullPointerException if {@code store} or {@code transport} is null
     * @throws IllegalArgumentException if {@code maxRetries} or {@code drainTimeoutMs} is negative
     */
    public QueueDrainer build() {
      return new QueueDrainer(this);
    }
  }
}
