package delivery.retry;

import delivery.DeliveryError;
import delivery.DeliveryOutcome;
import delivery.ErrorSink;
import delivery.Transport;
import delivery.model.Payload;
import delivery.spi.MetricsExporter;
import delivery.spi.PayloadStore;

import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns a delivery outcome into a queue mutation.
 *
 * <ul>
 *   <li>{@link DeliveryOutcome.Success} removes the payload.</li>
 *   <li>{@link DeliveryOutcome.RetryableFailure} increments {@code retries} in place. The
 *       payload keeps its position, so later payloads never overtake it.</li>
 *   <li>{@link DeliveryOutcome.PermanentFailure} removes the payload and reports it once,
 *       so a poison payload cannot block the queue.</li>
 * </ul>
 *
 * <p>By default retries are unbounded and the store's capacity bound is the only limit.
 * A positive {@code maxRetries} discards a payload whose next retryable failure would
 * exceed it.
 *
 * <p>This class is stateless apart from its collaborators and is thread-safe.
 */
public final class RetryCoordinator {
  private static final Logger logger = Logger.getLogger(RetryCoordinator.class.getName());

  /** {@code maxRetries} value meaning "never give up on retryable failures". */
  public static final int UNBOUNDED = 0;

  private final PayloadStore store;
  private final ErrorSink errorSink;
  private final MetricsExporter metrics;
  private final int maxRetries;

  public RetryCoordinator(PayloadStore store, ErrorSink errorSink) {
    this(store, errorSink, null, UNBOUNDED);
  }

  /**
   * @param store      the store holding the payloads
   * @param errorSink  receives permanent failures; {@code null} defaults to {@link ErrorSink#LOGGING}
   * @param metrics    metrics exporter; {@code null} defaults to {@link MetricsExporter#NOOP}
   * @param maxRetries retry ceiling, or {@link #UNBOUNDED}
   */
  public RetryCoordinator(PayloadStore store, ErrorSink errorSink, MetricsExporter metrics, int maxRetries) {
    this.store = Objects.requireNonNull(store, "store");
    this.errorSink = ErrorSink.guarded(errorSink);
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
    if (maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must be >= 0, got: " + maxRetries);
    }
    this.maxRetries = maxRetries;
  }

  public int maxRetries() {
    return maxRetries;
  }

  /**
   * Runs one transport attempt. A transport that throws or returns {@code null} breaks its
   * contract; the attempt is then classified as retryable.
   *
   * @param transport the transport
   * @param payload   the payload to send
   * @return the classified outcome (never {@code null})
   */
  public DeliveryOutcome attempt(Transport transport, Payload payload) {
    try {
      DeliveryOutcome outcome = transport.send(payload);
      if (outcome == null) {
        logger.log(Level.WARNING, "Transport returned no outcome for payloadId={0}", payload.id());
        return DeliveryOutcome.retryable("Transport returned no outcome");
      }
      return outcome;
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Transport threw for payloadId=" + payload.id() + "; treating as retryable", e);
      return DeliveryOutcome.retryable("Transport threw " + e.getClass().getName() + ": " + e.getMessage());
    }
  }

  /**
   * Applies the queue mutation for an outcome.
   *
   * @param payload the payload that was attempted, as returned by {@code peek}
   * @param outcome the classified outcome
   * @return what happened to the payload
   */
  public RetryDecision settle(Payload payload, DeliveryOutcome outcome) {
    Objects.requireNonNull(payload, "payload");
    Objects.requireNonNull(outcome, "outcome");
    String id = payload.id();

    if (outcome instanceof DeliveryOutcome.Success) {
      store.remove(id);
      metrics.incrementDeliverySuccess(payload.resourceType());
      return RetryDecision.DELIVERED;
    }

    if (outcome instanceof DeliveryOutcome.PermanentFailure permanent) {
      store.remove(id);
      metrics.incrementDeliveryDropped(payload.resourceType());
      errorSink.report(new DeliveryError(DeliveryError.Kind.DELIVERY_PERMANENT,
          payload.resourceType(), id, "Delivery rejected permanently: " + permanent.reason(), null));
      return RetryDecision.DISCARDED;
    }

    DeliveryOutcome.RetryableFailure retryable = (DeliveryOutcome.RetryableFailure) outcome;
    int next = payload.retries() + 1;
    if (maxRetries != UNBOUNDED && next > maxRetries) {
      store.remove(id);
      metrics.incrementDeliveryDropped(payload.resourceType());
      errorSink.report(new DeliveryError(DeliveryError.Kind.RETRIES_EXHAUSTED,
          payload.resourceType(), id,
          "Giving up after " + payload.retries() + " retries: " + retryable.reason(), null));
      return RetryDecision.EXHAUSTED;
    }

    store.update(id, Map.of(PayloadStore.RETRIES_FIELD, next));
    metrics.incrementDeliveryRetry(payload.resourceType());
    logger.log(Level.FINE, "Delivery of {0} failed (retry {1}): {2}",
        new Object[]{id, next, retryable.reason()});
    return RetryDecision.RETAINED;
  }
}
