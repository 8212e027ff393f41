package delivery.micrometer;

import delivery.ResourceType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void countersAreTaggedByResource() {
    exporter.incrementEnqueued(ResourceType.ERRORS);
    exporter.incrementEnqueued(ResourceType.ERRORS);
    exporter.incrementEnqueued(ResourceType.SESSIONS);

    assertEquals(2.0, counter("delivery.enqueue", "errors").count());
    assertEquals(1.0, counter("delivery.enqueue", "sessions").count());
  }

  @Test
  void deliveryCounters() {
    exporter.incrementDeliverySuccess(ResourceType.ERRORS);
    exporter.incrementDeliveryRetry(ResourceType.ERRORS);
    exporter.incrementDeliveryRetry(ResourceType.ERRORS);
    exporter.incrementDeliveryDropped(ResourceType.SESSIONS);

    assertEquals(1.0, counter("delivery.attempt.success", "errors").count());
    assertEquals(2.0, counter("delivery.attempt.retry", "errors").count());
    assertEquals(1.0, counter("delivery.attempt.dropped", "sessions").count());
    assertEquals(0.0, counter("delivery.attempt.dropped", "errors").count());
  }

  @Test
  void storeCounters() {
    exporter.incrementEnqueueFailed(ResourceType.ERRORS);
    exporter.incrementCorruptRemoved(ResourceType.ERRORS);
    exporter.incrementTruncated(ResourceType.ERRORS, 3);
    exporter.incrementTruncated(ResourceType.ERRORS, 0);

    assertEquals(1.0, counter("delivery.enqueue.failed", "errors").count());
    assertEquals(1.0, counter("delivery.corrupt.removed", "errors").count());
    assertEquals(3.0, counter("delivery.truncated", "errors").count());
  }

  @Test
  void recordQueueDepth() {
    exporter.recordQueueDepth(ResourceType.SESSIONS, 42);
    assertEquals(42.0, gauge("delivery.queue.depth", "sessions").value());
    assertEquals(0.0, gauge("delivery.queue.depth", "errors").value());

    exporter.recordQueueDepth(ResourceType.SESSIONS, 0);
    assertEquals(0.0, gauge("delivery.queue.depth", "sessions").value());
  }

  @Test
  void customNamePrefix() {
    var custom = new MicrometerMetricsExporter(registry, "crash.delivery");
    custom.incrementEnqueued(ResourceType.ERRORS);
    custom.recordQueueDepth(ResourceType.ERRORS, 5);

    assertEquals(1.0, counter("crash.delivery.enqueue", "errors").count());
    assertEquals(5.0, gauge("crash.delivery.queue.depth", "errors").value());
  }

  @Test
  void closeRemovesMetersAndIgnoresLaterUpdates() {
    exporter.close();

    assertNull(registry.find("delivery.enqueue").counter());
    assertNull(registry.find("delivery.queue.depth").gauge());
    assertDoesNotThrow(() -> exporter.incrementEnqueued(ResourceType.ERRORS));
    assertNull(registry.find("delivery.enqueue").counter());
  }

  @Test
  void invalidPrefixThrows() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(registry, null));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "delivery."));
  }

  @Test
  void nullRegistryThrows() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
  }

  private Counter counter(String name, String resource) {
    Counter c = registry.find(name).tag("resource", resource).counter();
    assertNotNull(c, "Counter not found: " + name + " resource=" + resource);
    return c;
  }

  private Gauge gauge(String name, String resource) {
    Gauge g = registry.find(name).tag("resource", resource).gauge();
    assertNotNull(g, "Gauge not found: " + name + " resource=" + resource);
    return g;
  }
}
