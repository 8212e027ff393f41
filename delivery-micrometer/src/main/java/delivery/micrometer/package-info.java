/**
 * Micrometer bridge for delivery queue metrics.
 *
 * @see delivery.micrometer.MicrometerMetricsExporter
 */
package delivery.micrometer;
