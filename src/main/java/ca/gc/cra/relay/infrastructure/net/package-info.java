/**
 * <strong>Purpose:</strong> TCP plumbing: length-prefixed framing and the socket-backed subscriber transport.
 * <p><strong>Wire format:</strong> {@code u32 big-endian length} followed by that many bytes of encoded event.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.relay.infrastructure.net;
