package ca.gc.cra.relay.application.port;

import ca.gc.cra.relay.domain.bus.BusException;

/**
 * Converts typed application values to and from event payload bytes.
 *
 * @since 0.1.0
 * @see ca.gc.cra.relay.infrastructure.codec.MessagePackPayloadCodec
 */
public interface PayloadCodec {
  /**
   * Serializes a value.
   *
   * @param value value to serialize; may be {@code null} if the codec supports it
   * @return payload bytes
   * @throws BusException {@code SERIALIZATION} if the value cannot be written
   */
  byte[] encode(Object value) throws BusException;

  /**
   * Deserializes payload bytes into the requested type.
   *
   * @param payload payload bytes
   * @param type target type
   * @param <T> target type
   * @return decoded value
   * @throws BusException {@code DESERIALIZATION} if the payload does not fit the type
   */
  <T> T decode(byte[] payload, Class<T> type) throws BusException;
}
