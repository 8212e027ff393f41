/**
 * The drain loop.
 *
 * <p>{@link delivery.drain.QueueDrainer} delivers each resource type's queue head-first
 * with at most one payload in flight per type. {@link delivery.drain.DrainScheduler}
 * re-triggers it periodically.
 */
package delivery.drain;
