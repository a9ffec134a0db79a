package ca.gc.cra.relay.application.port;

import ca.gc.cra.relay.domain.bus.BusException;
import ca.gc.cra.relay.domain.event.Event;

/**
 * <strong>What:</strong> Whole-event binary encoding used inside wire frames.
 * <p><strong>Why:</strong> Keeps the {@link Event} value free of serialization dependencies while giving the
 * publisher and subscriber a single, stable field order.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be stateless or otherwise thread-safe.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.relay.infrastructure.codec.MessagePackEventCodec
 */
public interface EventCodec {
  /**
   * Encodes an event to bytes.
   *
   * @param event event to encode; never {@code null}
   * @return encoded bytes
   * @throws BusException {@code SERIALIZATION} if encoding fails
   */
  byte[] encode(Event event) throws BusException;

  /**
   * Decodes bytes produced by {@link #encode(Event)}.
   *
   * @param bytes encoded event
   * @return decoded and re-validated event
   * @throws BusException {@code DESERIALIZATION} on malformed input, {@code INVALID_TOPIC} when the decoded
   *     topic is illegal
   */
  Event decode(byte[] bytes) throws BusException;
}
