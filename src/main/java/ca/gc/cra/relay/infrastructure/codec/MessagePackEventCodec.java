package ca.gc.cra.relay.infrastructure.codec;

import ca.gc.cra.relay.application.port.EventCodec;
import ca.gc.cra.relay.domain.bus.BusException;
import ca.gc.cra.relay.domain.event.Event;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Objects;
import org.msgpack.core.MessageFormat;
import org.msgpack.core.MessagePack;
import org.msgpack.core.MessagePackException;
import org.msgpack.core.MessageUnpacker;
import org.msgpack.jackson.dataformat.MessagePackFactory;
import org.msgpack.value.ValueType;

/**
 * <strong>What:</strong> {@link EventCodec} writing events as a five-element MessagePack array.
 * <p><strong>Format:</strong> {@code [topic:str, id:int, timestamp:int, source:str, payload:bin]}, in that order.
 * Any MessagePack reader in another language can decode it without a schema.</p>
 * <p><strong>Thread-safety:</strong> Thread-safe; generators and unpackers are created per call.</p>
 *
 * @since 0.1.0
 */
public final class MessagePackEventCodec implements EventCodec {
  private static final int FIELD_COUNT = 5;

  private final JsonFactory factory;

  /** Creates a codec backed by a fresh {@link MessagePackFactory}. */
  public MessagePackEventCodec() {
    this(new MessagePackFactory());
  }

  MessagePackEventCodec(JsonFactory factory) {
    this.factory = Objects.requireNonNull(factory, "factory");
  }

  @Override
  public byte[] encode(Event event) throws BusException {
    Objects.requireNonNull(event, "event");
    ByteArrayOutputStream out = new ByteArrayOutputStream(64 + event.payloadSize());
    try (JsonGenerator generator = factory.createGenerator(out)) {
      generator.writeStartArray();
      generator.writeString(event.topic());
      generator.writeNumber(event.id());
      generator.writeNumber(event.timestamp());
      generator.writeString(event.source());
      generator.writeBinary(event.payload());
      generator.writeEndArray();
    } catch (IOException ex) {
      throw BusException.serialization("failed to encode event " + event.id(), ex);
    }
    return out.toByteArray();
  }

  /**
   * {@inheritDoc}
   *
   * <p>The payload may be MessagePack {@code bin} (what {@link #encode} writes) or an array of byte-sized
   * integers, which is how serde-based writers emit a plain byte vector. Integers written as unsigned 64-bit
   * values are read back bit-for-bit.</p>
   */
  @Override
  public Event decode(byte[] bytes) throws BusException {
    if (bytes == null || bytes.length == 0) {
      throw BusException.deserialization("empty event");
    }
    String topic;
    long id;
    long timestamp;
    String source;
    byte[] payload;
    try (MessageUnpacker unpacker = MessagePack.newDefaultUnpacker(bytes)) {
      int fields = unpacker.unpackArrayHeader();
      if (fields != FIELD_COUNT) {
        throw BusException.deserialization("expected " + FIELD_COUNT + " fields but found " + fields);
      }
      topic = readString(unpacker, "topic");
      id = readUnsignedLong(unpacker, "id");
      timestamp = readUnsignedLong(unpacker, "timestamp");
      source = readString(unpacker, "source");
      payload = readPayload(unpacker);
      if (unpacker.hasNext()) {
        throw BusException.deserialization("trailing content after event");
      }
    } catch (IOException | MessagePackException ex) {
      throw BusException.deserialization("malformed event: " + ex.getMessage(), ex);
    }
    return Event.of(topic, id, timestamp, source, payload);
  }

  private static String readString(MessageUnpacker unpacker, String field) throws IOException, BusException {
    expect(unpacker, ValueType.STRING, field);
    return unpacker.unpackString();
  }

  private static long readUnsignedLong(MessageUnpacker unpacker, String field)
      throws IOException, BusException {
    MessageFormat format = expect(unpacker, ValueType.INTEGER, field);
    if (format == MessageFormat.UINT64) {
      return unpacker.unpackBigInteger().longValue();
    }
    return unpacker.unpackLong();
  }

  private static byte[] readPayload(MessageUnpacker unpacker) throws IOException, BusException {
    MessageFormat format = unpacker.getNextFormat();
    if (format.getValueType() == ValueType.BINARY) {
      int length = unpacker.unpackBinaryHeader();
      return unpacker.readPayload(length);
    }
    if (format.getValueType() == ValueType.ARRAY) {
      int length = unpacker.unpackArrayHeader();
      if (length > Event.MAX_PAYLOAD_BYTES) {
        throw BusException.deserialization("payload exceeds " + Event.MAX_PAYLOAD_BYTES + " bytes");
      }
      byte[] payload = new byte[length];
      for (int i = 0; i < length; i++) {
        int value = unpacker.unpackInt();
        if (value < 0 || value > 0xFF) {
          throw BusException.deserialization("payload element " + i + " is not a byte: " + value);
        }
        payload[i] = (byte) value;
      }
      return payload;
    }
    throw BusException.deserialization("expected payload but found " + format.getValueType());
  }

  private static MessageFormat expect(MessageUnpacker unpacker, ValueType expected, String field)
      throws IOException, BusException {
    MessageFormat format = unpacker.getNextFormat();
    if (format.getValueType() != expected) {
      throw BusException.deserialization("expected " + field + " but found " + format.getValueType());
    }
    return format;
  }
}
