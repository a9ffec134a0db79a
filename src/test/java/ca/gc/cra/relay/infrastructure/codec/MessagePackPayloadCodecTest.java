package ca.gc.cra.relay.infrastructure.codec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.relay.domain.bus.BusErrorKind;
import ca.gc.cra.relay.domain.bus.BusException;
import java.util.Map;
import org.junit.jupiter.api.Test;

class MessagePackPayloadCodecTest {
  private final MessagePackPayloadCodec codec = new MessagePackPayloadCodec();

  @Test
  void decodesIntoRequestedType() throws BusException {
    byte[] bytes = codec.encode(new Order("A-1", 3));

    Order order = codec.decode(bytes, Order.class);

    assertEquals(new Order("A-1", 3), order);
  }

  @Test
  void decodesMapsForSchemalessReaders() throws BusException {
    byte[] bytes = codec.encode(Map.of("id", "A-1"));

    @SuppressWarnings("unchecked")
    Map<String, Object> map = codec.decode(bytes, Map.class);

    assertEquals("A-1", map.get("id"));
  }

  @Test
  void mismatchedTypeIsDeserializationError() throws BusException {
    byte[] bytes = codec.encode("just text");

    BusException ex = assertThrows(BusException.class, () -> codec.decode(bytes, Order.class));
    assertEquals(BusErrorKind.DESERIALIZATION, ex.kind());
  }

  @Test
  void emptyPayloadIsDeserializationError() {
    assertEquals(BusErrorKind.DESERIALIZATION,
        assertThrows(BusException.class, () -> codec.decode(new byte[0], Order.class)).kind());
  }

  record Order(String id, int quantity) {}
}
