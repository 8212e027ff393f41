package delivery.drain;

import delivery.util.DaemonThreadFactory;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodically triggers a drain pass for every resource type, so payloads queued while
 * offline (or left over from a previous process) are delivered without a fresh enqueue.
 *
 * <p>Create instances via {@link #builder()}. {@link #start()} and {@link #close()} are
 * synchronized.
 */
public final class DrainScheduler implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(DrainScheduler.class.getName());

  /** Default tick interval. */
  public static final long DEFAULT_INTERVAL_MS = 30_000L;

  private final QueueDrainer drainer;
  private final long intervalMs;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> tickTask;
  private volatile boolean closed;

  private DrainScheduler(Builder builder) {
    this.drainer = Objects.requireNonNull(builder.drainer, "drainer");
    if (builder.intervalMs <= 0L) {
      throw new IllegalArgumentException("intervalMs must be > 0");
    }
    this.intervalMs = builder.intervalMs;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the periodic tick. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("DrainScheduler has been closed");
    }
    if (tickTask != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("delivery-drain-scheduler-"));
    tickTask = scheduler.scheduleWithFixedDelay(this::tick, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Triggers one drain pass per resource type. Called by the scheduler, but may also be
   * invoked directly.
   */
  public void tick() {
    if (closed) {
      return;
    }
    try {
      drainer.triggerAll();
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Drain tick failed", t);
    }
  }

  public long intervalMs() {
    return intervalMs;
  }

  @Override
  public synchronized void close() {
    closed = true;
    if (tickTask != null) {
      tickTask.cancel(false);
      tickTask = null;
    }
    if (scheduler != null) {
      scheduler.shutdownNow();
      try {
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /** Builder for {@link DrainScheduler}. */
  public static final class Builder {
    private QueueDrainer drainer;
    private long intervalMs = DEFAULT_INTERVAL_MS;

    private Builder() {}

    /**
     * <p><b>Required.</b>
     *
     * @param drainer the drainer to trigger
     * @return this builder
     */
    public Builder drainer(QueueDrainer drainer) {
      this.drainer = drainer;
      return this;
    }

    /**
     * Sets the delay between ticks.
     *
     * <p>Optional. Defaults to 30 seconds.
     *
     * @param intervalMs interval in milliseconds
     * @return this builder
     */
    public Builder intervalMs(long intervalMs) {
      this.intervalMs = intervalMs;
      return this;
    }

    public DrainScheduler build() {
      return new DrainScheduler(this);
    }
  }
}
