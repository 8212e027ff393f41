package delivery.drain;

/** Drain loop state of one resource type. */
public enum DrainState {
  /** No pass in flight; the next trigger starts one. */
  IDLE,
  /** Peeking the head payload or waiting for the transport. */
  ATTEMPTING,
  /** Applying the retry decision for the attempted payload. */
  SETTLING
}
