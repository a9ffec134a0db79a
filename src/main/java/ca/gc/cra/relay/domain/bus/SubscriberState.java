package ca.gc.cra.relay.domain.bus;

/**
 * Connection state of a subscriber.
 *
 * @since 0.1.0
 */
public enum SubscriberState {
  /** No socket is open; a reconnect may be pending. */
  DISCONNECTED,
  /** A connection attempt is in flight. */
  CONNECTING,
  /** The socket is open and the read loop is running. */
  CONNECTED,
  /** {@code stop()} was called; terminal. */
  STOPPED
}
