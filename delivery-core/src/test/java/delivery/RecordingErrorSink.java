package delivery;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Thread-safe {@link ErrorSink} that keeps every report for assertions.
 */
public final class RecordingErrorSink implements ErrorSink {
  private final List<DeliveryError> errors = new CopyOnWriteArrayList<>();

  @Override
  public void report(DeliveryError error) {
    errors.add(error);
  }

  public List<DeliveryError> errors() {
    return List.copyOf(errors);
  }

  public List<DeliveryError> ofKind(DeliveryError.Kind kind) {
    return errors.stream().filter(e -> e.kind() == kind).collect(Collectors.toList());
  }
}
