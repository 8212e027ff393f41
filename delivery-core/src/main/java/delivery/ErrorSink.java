package delivery;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Receives every internal failure of the delivery queue.
 *
 * <p>Queue operations never throw for storage or delivery problems; they report here
 * and fall back to a safe default (skip, drop or keep unchanged). What happens next
 * is up to the sink: log, count, forward, or ignore.
 *
 * <p>Implementations must be thread-safe. Exceptions thrown by a sink wrapped with
 * {@link #guarded(ErrorSink)} are logged and discarded.
 */
@FunctionalInterface
public interface ErrorSink {

  /**
   * Default sink: logs each error through {@code java.util.logging}.
   */
  ErrorSink LOGGING = new ErrorSink() {
    private final Logger logger = Logger.getLogger(ErrorSink.class.getName());

    @Override
    public void report(DeliveryError error) {
      Level level = error.kind() == DeliveryError.Kind.STORAGE_FAILURE ? Level.SEVERE : Level.WARNING;
      logger.log(level, error.toString(), error.cause());
    }
  };

  /**
   * Called once per internal failure.
   *
   * @param error the failure description
   */
  void report(DeliveryError error);

  /**
   * Wraps a sink so that a failure inside it never escapes into the queue.
   *
   * @param sink the sink to wrap; {@code null} yields {@link #LOGGING}
   * @return a sink that swallows and logs its delegate's exceptions
   */
  static ErrorSink guarded(ErrorSink sink) {
    if (sink == null) {
      return LOGGING;
    }
    if (sink == LOGGING || sink instanceof Guarded) {
      return sink;
    }
    return new Guarded(sink);
  }

  /** Wrapper returned by {@link #guarded(ErrorSink)}. */
  final class Guarded implements ErrorSink {
    private static final Logger logger = Logger.getLogger(Guarded.class.getName());

    private final ErrorSink delegate;

    private Guarded(ErrorSink delegate) {
      this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    @Override
    public void report(DeliveryError error) {
      try {
        delegate.report(error);
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "ErrorSink failed while reporting " + error, e);
      }
    }
  }
}
