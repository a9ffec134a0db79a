package ca.gc.cra.relay.domain.bus;

/**
 * Failure categories reported by publishers, subscribers, and the event codec.
 *
 * @since 0.1.0
 */
public enum BusErrorKind {
  /** Socket or stream failure. */
  IO("IO error"),
  /** Event or payload could not be encoded, including oversized payloads. */
  SERIALIZATION("Serialization error"),
  /** Bytes received from a peer did not decode into a valid event. */
  DESERIALIZATION("Deserialization error"),
  /** Connecting to a publisher failed. */
  CONNECTION_FAILED("Connection failed"),
  /** The internal hand-off channel was closed. */
  CHANNEL_CLOSED("Channel closed"),
  /** An address string could not be parsed or resolved. */
  INVALID_ADDRESS("Invalid address"),
  /** A caller-supplied deadline elapsed. */
  TIMEOUT("Operation timed out"),
  /** {@code start()} was called on a running component. */
  ALREADY_RUNNING("Bus already running"),
  /** The component is not running. */
  NOT_RUNNING("Bus not running"),
  /** Topic failed validation. */
  INVALID_TOPIC("Invalid topic"),
  /** Reserved for capability checks layered on top of the bus. */
  AUTH_FAILED("Authentication failed");

  private final String label;

  BusErrorKind(String label) {
    this.label = label;
  }

  /**
   * Returns the human readable prefix used in exception messages.
   *
   * @return label such as {@code "Invalid topic"}
   */
  public String label() {
    return label;
  }
}
