package ca.gc.cra.relay.domain.bus;

import java.time.Instant;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable notification describing a connection lifecycle change on either side of the bus.
 * <p><strong>Why:</strong> Lets an external logging collaborator observe accepts, evictions, and reconnects without
 * the bus depending on any particular sink.</p>
 * <p><strong>Thread-safety:</strong> Records are immutable and safe to share across threads.</p>
 *
 * @param timestamp time the transition was observed; never {@code null}
 * @param type transition type; never {@code null}
 * @param role {@code publisher} or {@code subscriber}; never {@code null}
 * @param connectionId publisher-side connection id, or {@code 0} on the subscriber side
 * @param peer remote address description; never {@code null}
 * @param detail optional free-form reason (for example the I/O error message); may be {@code null}
 * @since 0.1.0
 */
public record ConnectionEvent(
    Instant timestamp,
    ConnectionEventType type,
    String role,
    long connectionId,
    String peer,
    String detail) {

  /**
   * Validates mandatory fields.
   */
  public ConnectionEvent {
    timestamp = Objects.requireNonNull(timestamp, "timestamp");
    type = Objects.requireNonNull(type, "type");
    role = Objects.requireNonNull(role, "role");
    peer = Objects.requireNonNull(peer, "peer");
  }
}
