package ca.gc.cra.relay.domain.bus;

import java.util.Objects;

/**
 * <strong>What:</strong> Checked exception raised by every fallible bus operation.
 * <p><strong>Why:</strong> Callers branch on {@link #kind()} instead of parsing messages, so peer disconnects and
 * malformed frames always reach them as typed values.</p>
 * <p><strong>Thread-safety:</strong> Immutable once constructed.</p>
 *
 * @since 0.1.0
 */
public final class BusException extends Exception {
  private static final long serialVersionUID = 1L;

  private final BusErrorKind kind;

  /**
   * Creates an exception of the given kind.
   *
   * @param kind failure category; never {@code null}
   * @param detail optional detail appended to the kind label
   */
  public BusException(BusErrorKind kind, String detail) {
    this(kind, detail, null);
  }

  /**
   * Creates an exception of the given kind wrapping a cause.
   *
   * @param kind failure category; never {@code null}
   * @param detail optional detail appended to the kind label
   * @param cause underlying failure; may be {@code null}
   */
  public BusException(BusErrorKind kind, String detail, Throwable cause) {
    super(format(Objects.requireNonNull(kind, "kind"), detail), cause);
    this.kind = kind;
  }

  /**
   * Returns the failure category.
   *
   * @return error kind
   */
  public BusErrorKind kind() {
    return kind;
  }

  public static BusException io(String detail, Throwable cause) {
    return new BusException(BusErrorKind.IO, detail, cause);
  }

  public static BusException serialization(String detail) {
    return new BusException(BusErrorKind.SERIALIZATION, detail);
  }

  public static BusException serialization(String detail, Throwable cause) {
    return new BusException(BusErrorKind.SERIALIZATION, detail, cause);
  }

  public static BusException deserialization(String detail) {
    return new BusException(BusErrorKind.DESERIALIZATION, detail);
  }

  public static BusException deserialization(String detail, Throwable cause) {
    return new BusException(BusErrorKind.DESERIALIZATION, detail, cause);
  }

  public static BusException connectionFailed(String detail, Throwable cause) {
    return new BusException(BusErrorKind.CONNECTION_FAILED, detail, cause);
  }

  public static BusException invalidAddress(String detail, Throwable cause) {
    return new BusException(BusErrorKind.INVALID_ADDRESS, detail, cause);
  }

  public static BusException invalidTopic(String detail) {
    return new BusException(BusErrorKind.INVALID_TOPIC, detail);
  }

  public static BusException alreadyRunning() {
    return new BusException(BusErrorKind.ALREADY_RUNNING, null);
  }

  public static BusException notRunning(String detail) {
    return new BusException(BusErrorKind.NOT_RUNNING, detail);
  }

  public static BusException timeout(String detail) {
    return new BusException(BusErrorKind.TIMEOUT, detail);
  }

  private static String format(BusErrorKind kind, String detail) {
    if (detail == null || detail.isBlank()) {
      return kind.label();
    }
    return kind.label() + ": " + detail;
  }
}
