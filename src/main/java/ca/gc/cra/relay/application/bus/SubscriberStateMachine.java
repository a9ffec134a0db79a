package ca.gc.cra.relay.application.bus;

import ca.gc.cra.relay.domain.bus.SubscriberState;

/**
 * Explicit subscriber connection state machine.
 *
 * <pre>
 *   DISCONNECTED --start--------&gt; CONNECTING
 *   CONNECTING   --connected----&gt; CONNECTED
 *   CONNECTING   --connectFailed&gt; DISCONNECTED
 *   CONNECTED    --ioError------&gt; DISCONNECTED
 *   DISCONNECTED --timerFired---&gt; CONNECTING     (auto-reconnect only)
 *   any          --stop---------&gt; STOPPED        (terminal)
 * </pre>
 *
 * <p>Each trigger returns whether it applied; a trigger that does not fit the current state leaves it unchanged.
 * Holds no sockets or threads, so it can be exercised directly in unit tests.</p>
 */
final class SubscriberStateMachine {
  private final boolean autoReconnect;
  private SubscriberState state = SubscriberState.DISCONNECTED;

  SubscriberStateMachine(boolean autoReconnect) {
    this.autoReconnect = autoReconnect;
  }

  synchronized SubscriberState state() {
    return state;
  }

  boolean autoReconnect() {
    return autoReconnect;
  }

  synchronized boolean start() {
    return move(SubscriberState.DISCONNECTED, SubscriberState.CONNECTING);
  }

  synchronized boolean connected() {
    return move(SubscriberState.CONNECTING, SubscriberState.CONNECTED);
  }

  synchronized boolean connectFailed() {
    return move(SubscriberState.CONNECTING, SubscriberState.DISCONNECTED);
  }

  synchronized boolean ioError() {
    return move(SubscriberState.CONNECTED, SubscriberState.DISCONNECTED);
  }

  synchronized boolean timerFired() {
    return autoReconnect && move(SubscriberState.DISCONNECTED, SubscriberState.CONNECTING);
  }

  /** Returns {@code false} if already stopped. */
  synchronized boolean stop() {
    if (state == SubscriberState.STOPPED) {
      return false;
    }
    state = SubscriberState.STOPPED;
    return true;
  }

  synchronized boolean isStopped() {
    return state == SubscriberState.STOPPED;
  }

  /** Whether the supervisor should wait and retry after landing in {@code DISCONNECTED}. */
  synchronized boolean shouldReconnect() {
    return autoReconnect && state == SubscriberState.DISCONNECTED;
  }

  private boolean move(SubscriberState from, SubscriberState to) {
    if (state != from) {
      return false;
    }
    state = to;
    return true;
  }
}
