package ca.gc.cra.relay.infrastructure.codec;

import ca.gc.cra.relay.application.port.PayloadCodec;
import ca.gc.cra.relay.domain.bus.BusException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.Objects;
import org.msgpack.jackson.dataformat.MessagePackFactory;

/**
 * {@link PayloadCodec} mapping typed values (records, POJOs, maps) to MessagePack with Jackson databind.
 *
 * @since 0.1.0
 */
public final class MessagePackPayloadCodec implements PayloadCodec {
  private final ObjectMapper mapper;

  /** Creates a codec with a default MessagePack {@link ObjectMapper}. */
  public MessagePackPayloadCodec() {
    this(new ObjectMapper(new MessagePackFactory()));
  }

  /**
   * Creates a codec around a caller-configured mapper.
   *
   * @param mapper mapper whose factory must be a {@link MessagePackFactory}
   */
  public MessagePackPayloadCodec(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  @Override
  public byte[] encode(Object value) throws BusException {
    try {
      return mapper.writeValueAsBytes(value);
    } catch (IOException ex) {
      throw BusException.serialization("failed to encode payload of type "
          + (value == null ? "null" : value.getClass().getName()), ex);
    }
  }

  @Override
  public <T> T decode(byte[] payload, Class<T> type) throws BusException {
    Objects.requireNonNull(type, "type");
    if (payload == null || payload.length == 0) {
      throw BusException.deserialization("empty payload");
    }
    try {
      return mapper.readValue(payload, type);
    } catch (IOException | RuntimeException ex) {
      throw BusException.deserialization("payload is not a " + type.getSimpleName(), ex);
    }
  }
}
