/**
 * Read-only view of stored payloads.
 *
 * @see delivery.model.Payload
 */
package delivery.model;
