package ca.gc.cra.relay.infrastructure.codec;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.relay.domain.bus.BusErrorKind;
import ca.gc.cra.relay.domain.bus.BusException;
import ca.gc.cra.relay.domain.event.Event;
import ca.gc.cra.relay.infrastructure.net.FrameCodec;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import org.junit.jupiter.api.Test;
import org.msgpack.core.MessageBufferPacker;
import org.msgpack.core.MessagePack;

class MessagePackEventCodecTest {
  private final MessagePackEventCodec codec = new MessagePackEventCodec();

  @Test
  void decodeRestoresEveryField() throws BusException {
    Event event = Event.of("orders.created", 0xFFFF_0000_0001L, 1_700_000_000_123L, "checkout",
        "{\"id\":1}".getBytes(StandardCharsets.UTF_8));

    Event decoded = codec.decode(codec.encode(event));

    assertEquals(event, decoded);
    assertArrayEquals(event.payload(), decoded.payload());
  }

  @Test
  void encodesPositionalArrayWithBinaryPayload() throws Exception {
    Event event = Event.of("t", 5L, 6L, "s", new byte[] {1, 2, 3});

    byte[] bytes = codec.encode(event);

    try (var unpacker = MessagePack.newDefaultUnpacker(bytes)) {
      assertEquals(5, unpacker.unpackArrayHeader());
      assertEquals("t", unpacker.unpackString());
      assertEquals(5L, unpacker.unpackLong());
      assertEquals(6L, unpacker.unpackLong());
      assertEquals("s", unpacker.unpackString());
      int length = unpacker.unpackBinaryHeader();
      assertArrayEquals(new byte[] {1, 2, 3}, unpacker.readPayload(length));
    }
  }

  @Test
  void everyEncodedEventDecodesWithoutReadingPastTheEnd() throws BusException {
    for (String source : new String[] {"", "s", "checkout-service"}) {
      Event event = Event.of("t", 1L, 2L, source, new byte[] {7});

      assertEquals(event, codec.decode(codec.encode(event)));
    }
  }

  @Test
  void largestEventSurvivesFramingRoundTrip() throws Exception {
    byte[] payload = new byte[Event.MAX_PAYLOAD_BYTES];
    for (int i = 0; i < payload.length; i++) {
      payload[i] = (byte) i;
    }
    Event event = Event.of("t".repeat(Event.MAX_TOPIC_LENGTH), -1L, 1_700_000_000_000L, "svc", payload);
    FrameCodec frames = new FrameCodec();
    ByteArrayOutputStream wire = new ByteArrayOutputStream();

    frames.writeFrame(wire, codec.encode(event));
    Event decoded = codec.decode(frames.readFrame(new ByteArrayInputStream(wire.toByteArray())));

    assertEquals(event, decoded);
    assertArrayEquals(payload, decoded.payload());
  }

  @Test
  void unsignedIdOnTheWireKeepsAllBits() throws IOException, BusException {
    byte[] bytes = pack(packer -> {
      packer.packArrayHeader(5);
      packer.packString("t");
      packer.packBigInteger(new BigInteger("18446744073709551615"));
      packer.packLong(1L);
      packer.packString("s");
      packer.packBinaryHeader(0);
    });

    Event decoded = codec.decode(bytes);

    assertEquals(-1L, decoded.id());
    assertEquals("18446744073709551615", Long.toUnsignedString(decoded.id()));
  }

  @Test
  void payloadWrittenAsIntegerArrayIsAccepted() throws IOException, BusException {
    byte[] bytes = pack(packer -> {
      packer.packArrayHeader(5);
      packer.packString("t");
      packer.packLong(1L);
      packer.packLong(1L);
      packer.packString("s");
      packer.packArrayHeader(3);
      packer.packInt(0);
      packer.packInt(127);
      packer.packInt(255);
    });

    assertArrayEquals(new byte[] {0, 127, (byte) 255}, codec.decode(bytes).payload());
  }

  @Test
  void integerArrayPayloadOutsideByteRangeIsRejected() throws IOException {
    byte[] bytes = pack(packer -> {
      packer.packArrayHeader(5);
      packer.packString("t");
      packer.packLong(1L);
      packer.packLong(1L);
      packer.packString("s");
      packer.packArrayHeader(1);
      packer.packInt(256);
    });

    assertEquals(BusErrorKind.DESERIALIZATION,
        assertThrows(BusException.class, () -> codec.decode(bytes)).kind());
  }

  @Test
  void emptyPayloadSurvives() throws BusException {
    Event event = Event.of("t", 1L, 1L, "", new byte[0]);

    assertEquals(0, codec.decode(codec.encode(event)).payloadSize());
  }

  @Test
  void truncatedInputIsDeserializationError() throws BusException {
    byte[] bytes = codec.encode(Event.of("t", 1L, 1L, "s", new byte[] {9, 9, 9}));
    byte[] truncated = Arrays.copyOf(bytes, bytes.length - 2);

    BusException ex = assertThrows(BusException.class, () -> codec.decode(truncated));
    assertEquals(BusErrorKind.DESERIALIZATION, ex.kind());
  }

  @Test
  void garbageIsDeserializationError() {
    byte[] garbage = "hello world".getBytes(StandardCharsets.UTF_8);

    BusException ex = assertThrows(BusException.class, () -> codec.decode(garbage));
    assertEquals(BusErrorKind.DESERIALIZATION, ex.kind());
  }

  @Test
  void wrongFieldTypeIsDeserializationError() throws IOException {
    byte[] bytes = pack(packer -> {
      packer.packArrayHeader(5);
      packer.packString("t");
      packer.packString("not-a-number");
      packer.packLong(1L);
      packer.packString("s");
      packer.packBinaryHeader(0);
    });

    assertEquals(BusErrorKind.DESERIALIZATION,
        assertThrows(BusException.class, () -> codec.decode(bytes)).kind());
  }

  @Test
  void extraFieldsAreRejected() throws IOException {
    byte[] bytes = pack(packer -> {
      packer.packArrayHeader(6);
      packer.packString("t");
      packer.packLong(1L);
      packer.packLong(1L);
      packer.packString("s");
      packer.packBinaryHeader(0);
      packer.packInt(42);
    });

    assertEquals(BusErrorKind.DESERIALIZATION,
        assertThrows(BusException.class, () -> codec.decode(bytes)).kind());
  }

  @Test
  void trailingBytesAreRejected() throws BusException {
    byte[] bytes = codec.encode(Event.of("t", 1L, 1L, "s", null));
    ByteArrayOutputStream withTrailer = new ByteArrayOutputStream();
    withTrailer.writeBytes(bytes);
    withTrailer.write(0x01);

    assertEquals(BusErrorKind.DESERIALIZATION,
        assertThrows(BusException.class, () -> codec.decode(withTrailer.toByteArray())).kind());
  }

  @Test
  void invalidTopicOnTheWireIsRejected() throws IOException {
    byte[] bytes = pack(packer -> {
      packer.packArrayHeader(5);
      packer.packString("bad topic");
      packer.packLong(1L);
      packer.packLong(1L);
      packer.packString("s");
      packer.packBinaryHeader(0);
    });

    assertEquals(BusErrorKind.INVALID_TOPIC,
        assertThrows(BusException.class, () -> codec.decode(bytes)).kind());
  }

  private static byte[] pack(PackerBody body) throws IOException {
    try (MessageBufferPacker packer = MessagePack.newDefaultBufferPacker()) {
      body.write(packer);
      return packer.toByteArray();
    }
  }

  @FunctionalInterface
  private interface PackerBody {
    void write(MessageBufferPacker packer) throws IOException;
  }
}
