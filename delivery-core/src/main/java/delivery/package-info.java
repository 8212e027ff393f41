/**
 * Root API of the delivery queue: a persistent, bounded, per-resource-type FIFO of
 * outbound payloads with retrying, at-least-once delivery.
 *
 * <h2>Core Design</h2>
 * <p>Payloads are written to disk by the {@linkplain delivery.spi.PayloadStore store}
 * before any delivery is attempted, so they survive process death. Each resource type
 * (see {@link delivery.ResourceType}) has its own queue, bounded by a
 * {@linkplain delivery.truncate.QueueTruncator truncator} that evicts the oldest entries.
 * The {@linkplain delivery.drain.QueueDrainer drain loop} delivers the head of each queue
 * through a {@link delivery.Transport}, and the
 * {@linkplain delivery.retry.RetryCoordinator retry coordinator} removes, keeps or
 * discards it depending on the {@link delivery.DeliveryOutcome}.
 *
 * <p>Failures never surface as exceptions from queue operations. They are reported to an
 * {@link delivery.ErrorSink} as typed {@link delivery.DeliveryError}s.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>delivery-core</b>: store, truncation, retry, drain loop, HTTP transport</li>
 *   <li><b>delivery-micrometer</b>: {@code MetricsExporter} backed by Micrometer</li>
 *   <li><b>delivery-spring-boot-starter</b>: auto-configuration under {@code delivery.*}</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * Transport transport = HttpTransport.builder()
 *     .endpoint(ResourceType.ERRORS, URI.create("https://collector.example.com/errors"))
 *     .endpoint(ResourceType.SESSIONS, URI.create("https://collector.example.com/sessions"))
 *     .header("Api-Key", apiKey)
 *     .build();
 *
 * try (Delivery delivery = Delivery.builder()
 *     .storeDirectory(cacheDir.resolve("delivery"))
 *     .transport(transport)
 *     .build()) {
 *   delivery.enqueue(ResourceType.SESSIONS, sessionJson);
 *   delivery.onConnectivityChanged(true);
 * }
 * }</pre>
 */
package delivery;
