/**
 * <strong>Purpose:</strong> MessagePack adapters for whole events and typed payloads.
 * <p><strong>Concurrency:</strong> Codecs hold only thread-safe Jackson factories and mappers.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.relay.infrastructure.codec;
