/**
 * <strong>Purpose:</strong> The event bus itself: event construction, the TCP publisher with per-subscriber
 * queues, and the reconnecting subscriber.
 * <p><strong>Concurrency:</strong> {@code publish} never blocks on a slow subscriber; each connection has its own
 * bounded queue and writer thread. Subscribers run one supervisor thread that owns the read loop.
 * <p><strong>Observability:</strong> Lifecycle transitions go to the
 * {@link ca.gc.cra.relay.application.port.ConnectionEventEmitter}; counters go to the
 * {@link ca.gc.cra.relay.application.port.MetricsPort}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.relay.application.bus;
