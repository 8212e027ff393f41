package delivery.spring.boot;

import delivery.micrometer.MicrometerMetricsExporter;
import delivery.spi.MetricsExporter;
import io.micrometer.core.instrument.MeterRegistry;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for Micrometer metrics integration.
 *
 * <p>Creates a {@link MicrometerMetricsExporter} when Micrometer is on the classpath
 * and {@code delivery.metrics.enabled} is true (default).
 *
 * <p>Runs before {@link DeliveryAutoConfiguration} so the {@link MetricsExporter}
 * bean is available for injection into the Delivery composite.
 */
@AutoConfiguration(before = DeliveryAutoConfiguration.class)
@ConditionalOnClass({MicrometerMetricsExporter.class, MeterRegistry.class})
@ConditionalOnProperty(prefix = "delivery.metrics", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(DeliveryProperties.class)
public class DeliveryMicrometerAutoConfiguration {

  // the Delivery composite closes it; avoid a second close from the context
  @Bean(destroyMethod = "")
  @ConditionalOnMissingBean(MetricsExporter.class)
  public MicrometerMetricsExporter micrometerMetricsExporter(
      MeterRegistry meterRegistry, DeliveryProperties props) {
    return new MicrometerMetricsExporter(meterRegistry, props.getMetrics().getNamePrefix());
  }
}
