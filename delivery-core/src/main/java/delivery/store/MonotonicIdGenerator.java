package delivery.store;

import com.github.f4b6a3.ulid.Ulid;
import com.github.f4b6a3.ulid.UlidCreator;
import delivery.ResourceType;

import java.util.EnumMap;
import java.util.Map;

/**
 * Per-resource-type ULID source that never goes backwards.
 *
 * <p>Within the process, monotonic ULIDs already increment the random part when two ids
 * share a millisecond. Across restarts the generator is seeded with the highest id the
 * store has ever issued, so a wall clock that moved backwards still yields ids sorting
 * after every queued payload.
 */
final class MonotonicIdGenerator {
  private final Map<ResourceType, Ulid> last = new EnumMap<>(ResourceType.class);

  synchronized Ulid next(ResourceType type) {
    Ulid candidate = UlidCreator.getMonotonicUlid();
    Ulid previous = last.get(type);
    if (previous != null && candidate.compareTo(previous) <= 0) {
      candidate = previous.increment();
    }
    last.put(type, candidate);
    return candidate;
  }

  synchronized void seed(ResourceType type, Ulid highWater) {
    if (highWater == null) {
      return;
    }
    Ulid previous = last.get(type);
    if (previous == null || highWater.compareTo(previous) > 0) {
      last.put(type, highWater);
    }
  }
}
