package delivery.store;

import delivery.ResourceType;
import delivery.model.Payload;
import delivery.spi.PayloadStore;
import delivery.util.JsonCodec;

import java.time.Instant;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Maps payloads to the durable record layout:
 * <pre>{@code
 * {"resourceType":"errors","createdAt":"2026-01-01T00:00:00Z","retries":0,
 *  "headers":{"Api-Key":"..."},"body":"<base64>"}
 * }</pre>
 *
 * <p>Decoding failures surface as {@link IllegalArgumentException} or
 * {@link java.time.DateTimeException}; the store treats both as a corrupt entry.
 */
final class PayloadRecordCodec {
  static final String RESOURCE_TYPE = "resourceType";
  static final String CREATED_AT = "createdAt";
  static final String RETRIES = PayloadStore.RETRIES_FIELD;
  static final String HEADERS = "headers";
  static final String BODY = "body";

  private final JsonCodec jsonCodec;

  PayloadRecordCodec(JsonCodec jsonCodec) {
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
  }

  Map<String, Object> newRecord(ResourceType type, Instant createdAt,
      Map<String, String> headers, byte[] body) {
    Map<String, Object> record = new LinkedHashMap<>();
    record.put(RESOURCE_TYPE, type.id());
    record.put(CREATED_AT, createdAt.toString());
    record.put(RETRIES, 0);
    if (headers != null && !headers.isEmpty()) {
      record.put(HEADERS, new LinkedHashMap<>(headers));
    }
    record.put(BODY, Base64.getEncoder().encodeToString(body));
    return record;
  }

  String toJson(Map<String, ?> record) {
    return jsonCodec.toJson(record);
  }

  Map<String, Object> parse(String json) {
    return jsonCodec.parseObject(json);
  }

  Payload toPayload(String id, ResourceType type, Map<String, Object> record) {
    Object storedType = record.get(RESOURCE_TYPE);
    if (storedType != null && !type.id().equals(storedType)) {
      throw new IllegalArgumentException("Record resource type " + storedType
          + " does not match queue " + type.id());
    }
    return new Payload(id, type, body(record), headers(record), retries(record),
        Instant.parse(requireString(record, CREATED_AT)));
  }

  static int retries(Map<String, ?> record) {
    Object value = record.get(RETRIES);
    if (!(value instanceof Long) && !(value instanceof Integer)) {
      throw new IllegalArgumentException("Missing or non-integral retries");
    }
    long retries = ((Number) value).longValue();
    if (retries < 0 || retries > Integer.MAX_VALUE) {
      throw new IllegalArgumentException("retries out of range: " + retries);
    }
    return (int) retries;
  }

  private static byte[] body(Map<String, Object> record) {
    return Base64.getDecoder().decode(requireString(record, BODY));
  }

  @SuppressWarnings("unchecked")
  private static Map<String, String> headers(Map<String, Object> record) {
    Object value = record.get(HEADERS);
    if (value == null) {
      return Map.of();
    }
    if (!(value instanceof Map<?, ?>)) {
      throw new IllegalArgumentException("headers must be an object");
    }
    return (Map<String, String>) value;
  }

  private static String requireString(Map<String, Object> record, String field) {
    Object value = record.get(field);
    if (!(value instanceof String s)) {
      throw new IllegalArgumentException("Missing or non-string field: " + field);
    }
    return s;
  }
}
