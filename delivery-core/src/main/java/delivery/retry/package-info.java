/**
 * Delivery outcome handling.
 *
 * <p>{@link delivery.retry.RetryCoordinator} maps each {@link delivery.DeliveryOutcome}
 * to remove / update-in-place / remove-and-report. {@link delivery.retry.RetryPolicy}
 * decides how long the drain loop waits before retrying a retained payload.
 *
 * @see delivery.retry.RetryCoordinator
 * @see delivery.retry.ExponentialBackoffRetryPolicy
 */
package delivery.retry;
