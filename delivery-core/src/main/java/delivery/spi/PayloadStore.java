package delivery.spi;

import delivery.ResourceType;
import delivery.model.Payload;

import java.util.List;
import java.util.Map;

/**
 * Durable FIFO storage for undelivered payloads, one queue per {@link ResourceType}.
 *
 * <p>No method throws for storage problems. Failures are reported to the store's
 * {@link delivery.ErrorSink} and the method falls back to a safe result
 * ({@code null}, {@code false}, an empty list, or no change).
 *
 * @see delivery.store.FilePayloadStore
 */
public interface PayloadStore {

  /** Record field holding the retry counter, as accepted by {@link #update}. */
  String RETRIES_FIELD = "retries";

  /**
   * Ensures the durable location for a resource type exists. Idempotent and safe to call
   * before every operation.
   *
   * @param type the resource type
   * @return {@code true} if the location is ready
   */
  boolean init(ResourceType type);

  /**
   * Durably appends a payload with {@code retries = 0}.
   *
   * @param type    the queue to append to
   * @param body    opaque payload bytes
   * @param headers transport metadata stored with the payload (may be {@code null})
   * @return the new payload id, sorting after every id previously returned for this type;
   *     {@code null} if the write failed
   */
  String enqueue(ResourceType type, byte[] body, Map<String, String> headers);

  /**
   * Appends a payload without headers.
   *
   * @param type the queue to append to
   * @param body opaque payload bytes
   * @return the new payload id, or {@code null} if the write failed
   */
  default String enqueue(ResourceType type, byte[] body) {
    return enqueue(type, body, null);
  }

  /**
   * Returns the oldest payload without removing it. Entries that cannot be decoded are
   * deleted on the way and the next-oldest is tried.
   *
   * @param type the queue to inspect
   * @return the oldest readable payload, or {@code null} if the queue is empty
   */
  Payload peek(ResourceType type);

  /**
   * Deletes a payload. Removing an id that no longer exists is a no-op.
   *
   * @param id the payload id
   */
  void remove(String id);

  /**
   * Applies a shallow merge of {@code fields} over the stored record and rewrites it.
   *
   * @param id     the payload id
   * @param fields top-level record fields to replace, e.g. {@code retries}
   * @return {@code true} if the record was rewritten
   */
  boolean update(String id, Map<String, Object> fields);

  /**
   * Lists the ids currently queued for a resource type, oldest first.
   *
   * @param type the queue to list
   * @return ids in FIFO order (never {@code null})
   */
  List<String> list(ResourceType type);

  /**
   * @param type the queue to measure
   * @return number of queued payloads
   */
  default int size(ResourceType type) {
    return list(type).size();
  }
}
