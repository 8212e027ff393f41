package delivery.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for the delivery queue.
 *
 * @see DeliveryAutoConfiguration
 */
@ConfigurationProperties(prefix = "delivery")
public class DeliveryProperties {

  /**
   * Root directory of the persistent queue. The queue is only auto-configured when set.
   */
  private String storeDirectory;

  /**
   * Maximum queued payloads per resource type; the oldest are evicted beyond it.
   */
  private int maxItems = 64;

  /**
   * Retry ceiling per payload; 0 retries forever.
   */
  private int maxRetries = 0;

  /**
   * Whether payloads left over from a previous run are flushed at startup.
   */
  private boolean flushOnStart = true;

  private final Drain drain = new Drain();
  private final Retry retry = new Retry();
  private final Http http = new Http();
  private final Metrics metrics = new Metrics();

  public String getStoreDirectory() {
    return storeDirectory;
  }

  public void setStoreDirectory(String storeDirectory) {
    this.storeDirectory = storeDirectory;
  }

  public int getMaxItems() {
    return maxItems;
  }

  public void setMaxItems(int maxItems) {
    this.maxItems = maxItems;
  }

  public int getMaxRetries() {
    return maxRetries;
  }

  public void setMaxRetries(int maxRetries) {
    this.maxRetries = maxRetries;
  }

  public boolean isFlushOnStart() {
    return flushOnStart;
  }

  public void setFlushOnStart(boolean flushOnStart) {
    this.flushOnStart = flushOnStart;
  }

  public Drain getDrain() {
    return drain;
  }

  public Retry getRetry() {
    return retry;
  }

  public Http getHttp() {
    return http;
  }

  public Metrics getMetrics() {
    return metrics;
  }

  public static class Drain {
    /**
     * Delay between periodic drain passes; 0 disables the timer.
     */
    private long tickIntervalMs = 30000;
    private long drainTimeoutMs = 5000;

    public long getTickIntervalMs() {
      return tickIntervalMs;
    }

    public void setTickIntervalMs(long tickIntervalMs) {
      this.tickIntervalMs = tickIntervalMs;
    }

    public long getDrainTimeoutMs() {
      return drainTimeoutMs;
    }

    public void setDrainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
    }
  }

  public static class Retry {
    private long baseDelayMs = 1000;
    private long maxDelayMs = 300000;
    /**
     * Ceiling for server-requested {@code Retry-After} delays.
     */
    private long maxRetryAfterMs = 3600000;

    public long getBaseDelayMs() {
      return baseDelayMs;
    }

    public void setBaseDelayMs(long baseDelayMs) {
      this.baseDelayMs = baseDelayMs;
    }

    public long getMaxDelayMs() {
      return maxDelayMs;
    }

    public void setMaxDelayMs(long maxDelayMs) {
      this.maxDelayMs = maxDelayMs;
    }

    public long getMaxRetryAfterMs() {
      return maxRetryAfterMs;
    }

    public void setMaxRetryAfterMs(long maxRetryAfterMs) {
      this.maxRetryAfterMs = maxRetryAfterMs;
    }
  }

  public static class Http {
    /**
     * Collector endpoint per resource id ({@code errors}, {@code sessions}).
     */
    private Map<String, String> endpoints = new LinkedHashMap<>();

    /**
     * Headers sent with every request.
     */
    private Map<String, String> headers = new LinkedHashMap<>();

    private Duration timeout = Duration.ofSeconds(10);

    public Map<String, String> getEndpoints() {
      return endpoints;
    }

    public void setEndpoints(Map<String, String> endpoints) {
      this.endpoints = endpoints;
    }

    public Map<String, String> getHeaders() {
      return headers;
    }

    public void setHeaders(Map<String, String> headers) {
      this.headers = headers;
    }

    public Duration getTimeout() {
      return timeout;
    }

    public void setTimeout(Duration timeout) {
      this.timeout = timeout;
    }
  }

  public static class Metrics {
    private boolean enabled = true;
    private String namePrefix = "delivery";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getNamePrefix() {
      return namePrefix;
    }

    public void setNamePrefix(String namePrefix) {
      this.namePrefix = namePrefix;
    }
  }
}
