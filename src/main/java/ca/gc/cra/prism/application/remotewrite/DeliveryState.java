package ca.gc.cra.prism.application.remotewrite;

/**
 * Lifecycle of one delivery call: {@code IDLE -> SENDING -> DELIVERED | FAILED}.
 *
 * @since 0.1.0
 */
public enum DeliveryState {
  /** No call has started yet. */
  IDLE,
  /** A request is in flight. */
  SENDING,
  /** The last call received a 2xx response. */
  DELIVERED,
  /** The last call failed; see the thrown {@link RemoteWriteException}. */
  FAILED
}
