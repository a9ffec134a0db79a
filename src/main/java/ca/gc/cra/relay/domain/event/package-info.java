/**
 * Event envelope, topic matching, and per-process id minting.
 * <p><strong>Concurrency:</strong> {@link ca.gc.cra.relay.domain.event.Event} and
 * {@link ca.gc.cra.relay.domain.event.TopicMatcher} are immutable/stateless;
 * {@link ca.gc.cra.relay.domain.event.EventIdGenerator} is lock-free and thread-safe.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.relay.domain.event;
