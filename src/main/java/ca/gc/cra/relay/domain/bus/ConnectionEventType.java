package ca.gc.cra.relay.domain.bus;

/**
 * Lifecycle transitions reported to the connection event emitter.
 *
 * @since 0.1.0
 */
public enum ConnectionEventType {
  /** Publisher accepted a subscriber socket. */
  ACCEPTED,
  /** Publisher closed an incoming socket because {@code maxConnections} was reached. */
  REJECTED,
  /** Publisher dropped a subscriber whose outbound queue was full. */
  EVICTED,
  /** Publisher pruned a subscriber after a write failure or shutdown. */
  DISCONNECTED,
  /** Subscriber connected to its publisher. */
  CONNECTED,
  /** Subscriber connection attempt failed. */
  CONNECT_FAILED,
  /** Subscriber lost an established connection. */
  CONNECTION_LOST,
  /** Component stopped on request. */
  STOPPED
}
