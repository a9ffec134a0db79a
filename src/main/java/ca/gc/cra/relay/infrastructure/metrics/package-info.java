/**
 * Metrics adapters that bridge {@link ca.gc.cra.relay.application.port.MetricsPort} to OpenTelemetry or
 * discard observations.
 * <p><strong>Concurrency:</strong> Implementations are thread-safe and cache instruments per key.</p>
 * <p><strong>Metrics:</strong> Publishes under the {@code publisher.*} and {@code subscriber.*} namespaces.</p>
 * <p><strong>Security:</strong> Never exports topics or payloads; only counters keyed by metric name.</p>
 */
package ca.gc.cra.relay.infrastructure.metrics;
