/**
 * <strong>Purpose:</strong> Ports the bus core depends on: clocks, metrics, codecs, transports, and the
 * connection lifecycle collaborator.
 * <p><strong>Role:</strong> Application layer; infrastructure adapters implement these interfaces.</p>
 * <p><strong>Concurrency:</strong> Port implementations must be thread-safe unless documented otherwise.</p>
 * <p><strong>Observability:</strong> Ports expose hooks for metrics/logging but do not prescribe implementations.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.relay.application.port;
