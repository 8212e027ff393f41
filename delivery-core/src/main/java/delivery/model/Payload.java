package delivery.model;

import delivery.ResourceType;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable snapshot of one stored payload as returned by
 * {@link delivery.spi.PayloadStore#peek}.
 *
 * <p>The body is opaque to the queue. It is copied on the way in and on the way out,
 * so a caller mutating its array cannot alter what is stored.
 */
public final class Payload {
  private final String id;
  private final ResourceType resourceType;
  private final byte[] body;
  private final Map<String, String> headers;
  private final int retries;
  private final Instant createdAt;

  public Payload(String id, ResourceType resourceType, byte[] body,
      Map<String, String> headers, int retries, Instant createdAt) {
    this.id = Objects.requireNonNull(id, "id");
    this.resourceType = Objects.requireNonNull(resourceType, "resourceType");
    this.body = Objects.requireNonNull(body, "body").clone();
    this.headers = headers == null || headers.isEmpty()
        ? Collections.emptyMap()
        : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    if (retries < 0) {
      throw new IllegalArgumentException("retries must be >= 0, got: " + retries);
    }
    this.retries = retries;
    this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
  }

  public String id() {
    return id;
  }

  public ResourceType resourceType() {
    return resourceType;
  }

  /**
   * @return a copy of the opaque body
   */
  public byte[] body() {
    return body.clone();
  }

  public int bodyLength() {
    return body.length;
  }

  public Map<String, String> headers() {
    return headers;
  }

  /**
   * @return number of retryable delivery failures recorded so far
   */
  public int retries() {
    return retries;
  }

  public Instant createdAt() {
    return createdAt;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Payload other)) return false;
    return retries == other.retries
        && id.equals(other.id)
        && resourceType == other.resourceType
        && Arrays.equals(body, other.body)
        && headers.equals(other.headers)
        && createdAt.equals(other.createdAt);
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(id, resourceType, headers, retries, createdAt);
    return 31 * result + Arrays.hashCode(body);
  }

  @Override
  public String toString() {
    return "Payload{id=" + id + ", resourceType=" + resourceType
        + ", bodyLength=" + body.length + ", retries=" + retries
        + ", createdAt=" + createdAt + "}";
  }
}
