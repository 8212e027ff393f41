package delivery;

import delivery.model.Payload;

/**
 * Sends one payload to the remote collector.
 *
 * <p>Implementations must not throw for ordinary network conditions: those map to
 * {@link DeliveryOutcome.RetryableFailure}. They must also resolve eventually (apply a
 * timeout), since the drain loop for a resource type waits on each attempt before
 * moving on.
 *
 * @see delivery.transport.HttpTransport
 */
@FunctionalInterface
public interface Transport {

  /**
   * Attempts delivery of a single payload.
   *
   * @param payload the payload; {@link Payload#resourceType()} selects the endpoint
   * @return the classified outcome, never {@code null}
   */
  DeliveryOutcome send(Payload payload);
}
