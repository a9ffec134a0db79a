/**
 * Core domain model for the RELAY event bus.
 * <p><strong>Role:</strong> Domain layer types describing events, topics, endpoints, and bus failures without
 * infrastructure dependencies.</p>
 * <p><strong>Concurrency:</strong> Types are immutable unless noted; safe to share across threads.</p>
 * <p><strong>Metrics:</strong> Domain attributes feed tagging on {@code publisher.*} and {@code subscriber.*} metrics.</p>
 * <p><strong>Security:</strong> Event payloads are opaque; callers own redaction before logging.</p>
 */
package ca.gc.cra.relay.domain;
