/**
 * Capacity enforcement: {@link delivery.truncate.QueueTruncator} evicts the oldest
 * payloads once a queue exceeds its bound.
 */
package delivery.truncate;
