package delivery;

import java.util.Objects;

/**
 * Logical queue a payload belongs to. Each resource type has its own directory,
 * capacity bound and FIFO ordering, and drains independently of the others.
 */
public enum ResourceType {
  /** Error and crash reports. */
  ERRORS("errors"),
  /** Session start notifications. */
  SESSIONS("sessions");

  private final String id;

  ResourceType(String id) {
    this.id = id;
  }

  /**
   * Returns the short lowercase identifier used in payload ids and directory names.
   *
   * @return the resource id, e.g. {@code "errors"}
   */
  public String id() {
    return id;
  }

  /**
   * Resolves a resource type from its {@link #id()}.
   *
   * @param id the resource id
   * @return the matching resource type
   * @throws IllegalArgumentException if no resource type has this id
   */
  public static ResourceType fromId(String id) {
    Objects.requireNonNull(id, "id");
    for (ResourceType type : values()) {
      if (type.id.equals(id)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown resource type: " + id);
  }
}
