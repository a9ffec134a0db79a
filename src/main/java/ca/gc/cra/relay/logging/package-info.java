/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity, tag worker threads, and bound untrusted text
 * before emission.
 * <p><strong>Concurrency:</strong> Stateless helpers; thread-safe.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no custom metrics.
 * <p><strong>Security:</strong> Event sources, peers, and payload previews are truncated before logging.
 *
 * @since 0.1.0
 */
package ca.gc.cra.relay.logging;
