package ca.gc.cra.relay.domain.event;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.relay.domain.bus.BusErrorKind;
import ca.gc.cra.relay.domain.bus.BusException;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class EventTest {

  @Test
  void acceptsTopicsBuiltFromAllowedCharacters() throws BusException {
    Event event = Event.of("orders.eu-west_1", 7L, 1_700_000_000_000L, "svc", bytes("hi"));

    assertEquals("orders.eu-west_1", event.topic());
    assertEquals(7L, event.id());
    assertEquals(1_700_000_000_000L, event.timestamp());
    assertEquals("svc", event.source());
    assertArrayEquals(bytes("hi"), event.payload());
    assertEquals(2, event.payloadSize());
  }

  @Test
  void rejectsEmptyTopic() {
    BusException ex = assertThrows(BusException.class, () -> Event.of("", 1L, 1L, "s", null));
    assertEquals(BusErrorKind.INVALID_TOPIC, ex.kind());
  }

  @Test
  void rejectsTopicWithSpaceOrSlash() {
    assertEquals(BusErrorKind.INVALID_TOPIC,
        assertThrows(BusException.class, () -> Event.requireValidTopic("a b")).kind());
    assertEquals(BusErrorKind.INVALID_TOPIC,
        assertThrows(BusException.class, () -> Event.requireValidTopic("a/b")).kind());
    assertEquals(BusErrorKind.INVALID_TOPIC,
        assertThrows(BusException.class, () -> Event.requireValidTopic("orders.*")).kind());
  }

  @Test
  void topicLengthLimitIsInclusive() throws BusException {
    String longest = "a".repeat(Event.MAX_TOPIC_LENGTH);
    assertEquals(longest, Event.requireValidTopic(longest));

    BusException ex = assertThrows(BusException.class, () -> Event.requireValidTopic(longest + "a"));
    assertEquals("Invalid topic: topic exceeds 256 chars", ex.getMessage());
  }

  @Test
  void oversizedPayloadIsSerializationError() {
    byte[] payload = new byte[Event.MAX_PAYLOAD_BYTES + 1];
    BusException ex = assertThrows(BusException.class, () -> Event.of("big", 1L, 1L, "s", payload));
    assertEquals(BusErrorKind.SERIALIZATION, ex.kind());
  }

  @Test
  void payloadLimitIsInclusive() throws BusException {
    Event event = Event.of("big", 1L, 1L, "s", new byte[Event.MAX_PAYLOAD_BYTES]);

    assertEquals(Event.MAX_PAYLOAD_BYTES, event.payloadSize());
  }

  @Test
  void nullSourceAndPayloadBecomeEmpty() throws BusException {
    Event event = Event.of("t", 1L, 1L, null, null);

    assertEquals("", event.source());
    assertEquals(0, event.payloadSize());
  }

  @Test
  void payloadIsDefensivelyCopied() throws BusException {
    byte[] original = bytes("abc");
    Event event = Event.of("t", 1L, 1L, "s", original);
    original[0] = 'z';

    byte[] exposed = event.payload();
    exposed[1] = 'z';

    assertArrayEquals(bytes("abc"), event.payload());
    assertNotSame(exposed, event.payload());
  }

  @Test
  void equalityCoversEveryField() throws BusException {
    Event a = Event.of("t", 1L, 2L, "s", bytes("x"));
    Event b = Event.of("t", 1L, 2L, "s", bytes("x"));
    Event c = Event.of("t", 1L, 2L, "s", bytes("y"));

    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
    assertFalse(a.equals(c));
  }

  @Test
  void matchesTopicDelegatesToPatternRules() throws BusException {
    Event event = Event.of("orders.created", 1L, 1L, "s", null);

    assertTrue(event.matchesTopic("*"));
    assertTrue(event.matchesTopic("orders.*"));
    assertFalse(event.matchesTopic("orders"));
  }

  private static byte[] bytes(String text) {
    return text.getBytes(StandardCharsets.UTF_8);
  }
}
