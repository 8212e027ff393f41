/**
 * Service provider interfaces: durable payload storage and metrics export.
 *
 * <p>{@link delivery.spi.PayloadStore} is implemented by
 * {@link delivery.store.FilePayloadStore}; {@link delivery.spi.MetricsExporter} by the
 * {@code delivery-micrometer} module.
 */
package delivery.spi;
