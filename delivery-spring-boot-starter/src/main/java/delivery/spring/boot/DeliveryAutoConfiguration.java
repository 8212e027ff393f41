package delivery.spring.boot;

import delivery.Delivery;
import delivery.ErrorSink;
import delivery.ResourceType;
import delivery.Transport;
import delivery.retry.ExponentialBackoffRetryPolicy;
import delivery.spi.MetricsExporter;
import delivery.spi.PayloadStore;
import delivery.transport.HttpTransport;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.net.URI;
import java.nio.file.Path;

/**
 * Auto-configuration for the delivery queue.
 *
 * <p>Wires a {@link Delivery} composite from {@link DeliveryProperties} once
 * {@code delivery.store-directory} is set. Without a user-defined {@link Transport}, an
 * {@link HttpTransport} is built from {@code delivery.http.*}.
 *
 * @see DeliveryProperties
 * @see DeliveryMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(Delivery.class)
@ConditionalOnProperty(prefix = "delivery", name = "store-directory")
@EnableConfigurationProperties(DeliveryProperties.class)
public class DeliveryAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(Transport.class)
  public HttpTransport httpTransport(DeliveryProperties props) {
    DeliveryProperties.Http http = props.getHttp();
    HttpTransport.Builder builder = HttpTransport.builder()
        .timeout(http.getTimeout())
        .headers(http.getHeaders());
    http.getEndpoints().forEach((resource, uri) ->
        builder.endpoint(ResourceType.fromId(resource), URI.create(uri)));
    return builder.build();
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public Delivery delivery(DeliveryProperties props,
      Transport transport,
      ObjectProvider<ErrorSink> errorSinkProvider,
      ObjectProvider<MetricsExporter> metricsProvider) {
    var builder = Delivery.builder()
        .storeDirectory(Path.of(props.getStoreDirectory()))
        .transport(transport)
        .maxItems(props.getMaxItems())
        .maxRetries(props.getMaxRetries())
        .retryPolicy(new ExponentialBackoffRetryPolicy(
            props.getRetry().getBaseDelayMs(),
            props.getRetry().getMaxDelayMs(),
            props.getRetry().getMaxRetryAfterMs()))
        .tickIntervalMs(props.getDrain().getTickIntervalMs())
        .drainTimeoutMs(props.getDrain().getDrainTimeoutMs())
        .flushOnStart(props.isFlushOnStart());
    ErrorSink errorSink = errorSinkProvider.getIfAvailable();
    if (errorSink != null) {
      builder.errorSink(errorSink);
    }
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    return builder.build();
  }

  // closed by the Delivery bean
  @Bean(destroyMethod = "")
  @ConditionalOnMissingBean
  public PayloadStore payloadStore(Delivery delivery) {
    return delivery.store();
  }
}
