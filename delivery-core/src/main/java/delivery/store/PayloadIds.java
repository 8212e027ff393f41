package delivery.store;

import com.github.f4b6a3.ulid.Ulid;
import delivery.ResourceType;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Payload id format: {@code <resourceId>-<ULID>}, stored as
 * {@code delivery-<resourceId>-<ULID>.json}.
 *
 * <p>A ULID is a 48-bit millisecond timestamp followed by 80 random bits in Crockford
 * base32, so for ids of one resource type lexicographic order equals creation order.
 */
public final class PayloadIds {
  static final String FILE_PREFIX = "delivery-";
  static final String FILE_SUFFIX = ".json";

  private static final Pattern ID = Pattern.compile("^([a-z]+)-([0-9A-HJKMNP-TV-Z]{26})$");
  private static final Pattern FILE_NAME =
      Pattern.compile("^delivery-([a-z]+-[0-9A-HJKMNP-TV-Z]{26})\\.json$");

  private PayloadIds() {
  }

  public static String format(ResourceType type, Ulid ulid) {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(ulid, "ulid");
    return type.id() + "-" + ulid;
  }

  /**
   * @param id a payload id
   * @return {@code true} if the id is well-formed and names a known resource type
   */
  public static boolean isValid(String id) {
    if (id == null) {
      return false;
    }
    Matcher m = ID.matcher(id);
    if (!m.matches()) {
      return false;
    }
    try {
      ResourceType.fromId(m.group(1));
      return true;
    } catch (IllegalArgumentException e) {
      return false;
    }
  }

  /**
   * @param id a payload id
   * @return the resource type embedded in the id
   * @throws IllegalArgumentException if the id is malformed
   */
  public static ResourceType resourceOf(String id) {
    return ResourceType.fromId(match(id).group(1));
  }

  /**
   * @param id a payload id
   * @return the ULID embedded in the id
   * @throws IllegalArgumentException if the id is malformed
   */
  public static Ulid ulidOf(String id) {
    return Ulid.from(match(id).group(2));
  }

  static String fileName(String id) {
    return FILE_PREFIX + id + FILE_SUFFIX;
  }

  /**
   * @return the payload id for a queue file name, or {@code null} if the name is not a queue file
   */
  static String idFromFileName(String fileName) {
    Matcher m = FILE_NAME.matcher(fileName);
    return m.matches() ? m.group(1) : null;
  }

  private static Matcher match(String id) {
    Objects.requireNonNull(id, "id");
    Matcher m = ID.matcher(id);
    if (!m.matches()) {
      throw new IllegalArgumentException("Malformed payload id: " + id);
    }
    return m;
  }
}
