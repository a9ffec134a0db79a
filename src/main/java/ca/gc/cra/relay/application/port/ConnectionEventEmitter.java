package ca.gc.cra.relay.application.port;

import ca.gc.cra.relay.domain.bus.ConnectionEvent;

/**
 * <strong>What:</strong> Outbound port receiving connect, disconnect, and eviction notifications from the bus.
 * <p><strong>Why:</strong> Keeps lifecycle observability outside the bus core; an absent collaborator is modelled
 * by {@link #NO_OP} so the bus never fails for lack of one.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate concurrent invocations from accept, writer,
 * and reader threads.</p>
 * <p><strong>Performance:</strong> Calls should be non-blocking and constant-time.</p>
 *
 * @since 0.1.0
 */
public interface ConnectionEventEmitter extends AutoCloseable {
  /**
   * Emits a lifecycle notification.
   *
   * @param event immutable event; never {@code null}
   */
  void emit(ConnectionEvent event);

  /** Default no-op implementation for tests or disabled observability. */
  ConnectionEventEmitter NO_OP = new ConnectionEventEmitter() {
    @Override public void emit(ConnectionEvent event) {}

    @Override public void close() {}
  };

  @Override
  default void close() {}
}
