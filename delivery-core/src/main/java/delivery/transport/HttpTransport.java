package delivery.transport;

import delivery.DeliveryOutcome;
import delivery.ResourceType;
import delivery.Transport;
import delivery.model.Payload;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link Transport} that POSTs each payload body to a per-resource-type HTTP endpoint.
 *
 * <p>Status classification:
 * <ul>
 *   <li>2xx: {@link DeliveryOutcome.Success}</li>
 *   <li>408, 429, 5xx, other non-4xx statuses, I/O errors and timeouts:
 *       {@link DeliveryOutcome.RetryableFailure}, honouring a {@code Retry-After} given
 *       in seconds</li>
 *   <li>any other 4xx: {@link DeliveryOutcome.PermanentFailure}</li>
 * </ul>
 *
 * <p>A resource type without a configured endpoint is classified as retryable so its
 * payloads stay queued until the configuration is fixed.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe.
 */
public final class HttpTransport implements Transport {
  private static final Logger logger = Logger.getLogger(HttpTransport.class.getName());

  /** Default request timeout. */
  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

  static final String CONTENT_TYPE = "Content-Type";
  static final String RETRY_AFTER = "Retry-After";

  private final HttpClient client;
  private final Map<ResourceType, URI> endpoints;
  private final Map<String, String> headers;
  private final Duration timeout;

  private HttpTransport(Builder builder) {
    if (builder.timeout.isZero() || builder.timeout.isNegative()) {
      throw new IllegalArgumentException("timeout must be > 0");
    }
    this.timeout = builder.timeout;
    this.endpoints = Collections.unmodifiableMap(new EnumMap<>(builder.endpoints));
    this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
    this.client = builder.client != null
        ? builder.client
        : HttpClient.newBuilder().connectTimeout(timeout).build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public Map<ResourceType, URI> endpoints() {
    return endpoints;
  }

  @Override
  public DeliveryOutcome send(Payload payload) {
    URI endpoint = endpoints.get(payload.resourceType());
    if (endpoint == null) {
      logger.log(Level.SEVERE, "No endpoint configured for resource type {0}; keeping {1} queued",
          new Object[]{payload.resourceType().id(), payload.id()});
      return DeliveryOutcome.retryable("No endpoint configured for " + payload.resourceType().id());
    }

    HttpRequest request;
    try {
      request = buildRequest(endpoint, payload);
    } catch (IllegalArgumentException e) {
      // a restricted or malformed header can never be sent
      return DeliveryOutcome.permanent("Invalid request for " + payload.id() + ": " + e.getMessage());
    }

    try {
      HttpResponse<Void> response = client.send(request, HttpResponse.BodyHandlers.discarding());
      return classify(response.statusCode(), response.headers().firstValue(RETRY_AFTER).orElse(null));
    } catch (HttpTimeoutException e) {
      return DeliveryOutcome.retryable("Request to " + endpoint + " timed out");
    } catch (IOException e) {
      return DeliveryOutcome.retryable("I/O error sending to " + endpoint + ": " + e.getMessage());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return DeliveryOutcome.retryable("Interrupted while sending to " + endpoint);
    }
  }

  private HttpRequest buildRequest(URI endpoint, Payload payload) {
    Map<String, String> merged = new LinkedHashMap<>(headers);
    merged.putAll(payload.headers());
    HttpRequest.Builder request = HttpRequest.newBuilder(endpoint)
        .timeout(timeout)
        .POST(HttpRequest.BodyPublishers.ofByteArray(payload.body()));
    boolean hasContentType = false;
    for (Map.Entry<String, String> header : merged.entrySet()) {
      request.header(header.getKey(), header.getValue());
      hasContentType |= CONTENT_TYPE.equalsIgnoreCase(header.getKey());
    }
    if (!hasContentType) {
      request.header(CONTENT_TYPE, "application/json");
    }
    return request.build();
  }

  /**
   * Classifies an HTTP response status.
   *
   * @param status     the response status code
   * @param retryAfter the raw {@code Retry-After} header value, or {@code null}
   * @return the delivery outcome
   */
  public static DeliveryOutcome classify(int status, String retryAfter) {
    if (status >= 200 && status < 300) {
      return DeliveryOutcome.success();
    }
    if (status == 408 || status == 429 || status < 400 || status >= 500) {
      return DeliveryOutcome.retryable("HTTP " + status, parseRetryAfter(retryAfter));
    }
    return DeliveryOutcome.permanent("HTTP " + status);
  }

  /**
   * Parses a {@code Retry-After} value expressed in delta-seconds. HTTP-date values are
   * not supported and yield {@code null}.
   */
  static Duration parseRetryAfter(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      long seconds = Long.parseLong(value.trim());
      return seconds >= 0 ? Duration.ofSeconds(seconds) : null;
    } catch (NumberFormatException e) {
      return null;
    }
  }

  /** Builder for {@link HttpTransport}. */
  public static final class Builder {
    private final Map<ResourceType, URI> endpoints = new EnumMap<>(ResourceType.class);
    private final Map<String, String> headers = new LinkedHashMap<>();
    private Duration timeout = DEFAULT_TIMEOUT;
    private HttpClient client;

    private Builder() {}

    /**
     * Sets the endpoint for one resource type.
     *
     * @param type     the resource type
     * @param endpoint the collector URI
     * @return this builder
     */
    public Builder endpoint(ResourceType type, URI endpoint) {
      endpoints.put(Objects.requireNonNull(type, "type"), Objects.requireNonNull(endpoint, "endpoint"));
      return this;
    }

    public Builder endpoints(Map<ResourceType, URI> endpoints) {
      endpoints.forEach(this::endpoint);
      return this;
    }

    /**
     * Adds a header sent with every request. Payload headers with the same name win.
     *
     * @param name  header name
     * @param value header value
     * @return this builder
     */
    public Builder header(String name, String value) {
      headers.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
      return this;
    }

    public Builder headers(Map<String, String> headers) {
      headers.forEach(this::header);
      return this;
    }

    /**
     * Sets the connect and request timeout.
     *
     * <p>Optional. Defaults to 10 seconds.
     *
     * @param timeout the timeout
     * @return this builder
     */
    public Builder timeout(Duration timeout) {
      this.timeout = Objects.requireNonNull(timeout, "timeout");
      return this;
    }

    /**
     * Sets the HTTP client.
     *
     * <p>Optional. Defaults to a client created with the configured timeout.
     *
     * @param client the HTTP client
     * @return this builder
     */
    public Builder httpClient(HttpClient client) {
      this.client = client;
      return this;
    }

    public HttpTransport build() {
      return new HttpTransport(this);
    }
  }
}
