package delivery;

import java.util.Objects;

/**
 * One internal failure, as handed to an {@link ErrorSink}.
 *
 * @param kind         failure category
 * @param resourceType queue the failure concerns (may be {@code null} when unknown)
 * @param payloadId    payload the failure concerns (may be {@code null})
 * @param message      human-readable description
 * @param cause        underlying exception (may be {@code null})
 */
public record DeliveryError(
    Kind kind,
    ResourceType resourceType,
    String payloadId,
    String message,
    Throwable cause
) {

  public DeliveryError {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(message, "message");
  }

  /** Failure categories reported by the queue and the drain loop. */
  public enum Kind {
    /** The durable medium could not be read, written, listed or deleted. */
    STORAGE_FAILURE,
    /** A stored record could not be decoded and was deleted by {@code peek}. */
    CORRUPT_ENTRY,
    /** An update targeted a record that no longer exists. */
    MISSING_ENTRY,
    /** An update was refused because it would lower {@code retries} or corrupt the record. */
    INVALID_UPDATE,
    /** The transport rejected a payload for good; the payload was discarded. */
    DELIVERY_PERMANENT,
    /** A payload hit the configured retry ceiling and was discarded. */
    RETRIES_EXHAUSTED
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append(kind);
    if (resourceType != null) {
      sb.append(" [").append(resourceType.id()).append(']');
    }
    if (payloadId != null) {
      sb.append(" payloadId=").append(payloadId);
    }
    sb.append(": ").append(message);
    return sb.toString();
  }
}
