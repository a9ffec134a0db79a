package ca.gc.cra.relay.application.bus;

import ca.gc.cra.relay.application.port.ClockPort;
import ca.gc.cra.relay.application.port.ConnectionEventEmitter;
import ca.gc.cra.relay.domain.bus.ConnectionEvent;
import ca.gc.cra.relay.domain.bus.ConnectionEventType;
import java.time.Instant;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forwards lifecycle notifications to the emitter, isolating the bus from emitter failures.
 */
final class LifecycleNotifier {
  private static final Logger log = LoggerFactory.getLogger(LifecycleNotifier.class);

  private final ConnectionEventEmitter emitter;
  private final ClockPort clock;
  private final String role;

  LifecycleNotifier(ConnectionEventEmitter emitter, ClockPort clock, String role) {
    this.emitter = emitter == null ? ConnectionEventEmitter.NO_OP : emitter;
    this.clock = Objects.requireNonNull(clock, "clock");
    this.role = Objects.requireNonNull(role, "role");
  }

  void notify(ConnectionEventType type, long connectionId, String peer, String detail) {
    ConnectionEvent event = new ConnectionEvent(
        Instant.ofEpochMilli(clock.nowMillis()), type, role, connectionId, peer == null ? "" : peer, detail);
    try {
      emitter.emit(event);
    } catch (RuntimeException ex) {
      log.warn("Connection event emitter failed for {} {}", role, type, ex);
    }
  }
}
