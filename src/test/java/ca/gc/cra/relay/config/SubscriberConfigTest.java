package ca.gc.cra.relay.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SubscriberConfigTest {

  @Test
  void defaultsReconnectAndAcceptAllTopics() {
    SubscriberConfig config = SubscriberConfig.defaults();

    assertEquals("127.0.0.1:9999", config.publisherAddress());
    assertTrue(config.topics().isEmpty());
    assertEquals(1000L, config.reconnectDelayMillis());
    assertTrue(config.autoReconnect());
    assertEquals(256, config.bufferCapacity());
  }

  @Test
  void fromMapSplitsTopicsAndParsesSwitches() {
    SubscriberConfig config = SubscriberConfig.fromMap(Map.of(
        "connect", "localhost:7000",
        "topics", "orders.*, audit ,",
        "reconnectDelayMs", "0",
        "autoReconnect", "off",
        "bufferCapacity", "8"));

    assertEquals("localhost:7000", config.publisherAddress());
    assertEquals(List.of("orders.*", "audit"), config.topics());
    assertEquals(0L, config.reconnectDelayMillis());
    assertFalse(config.autoReconnect());
    assertEquals(8, config.bufferCapacity());
  }

  @Test
  void rejectsAmbiguousBoolean() {
    assertThrows(IllegalArgumentException.class,
        () -> SubscriberConfig.fromMap(Map.of("autoReconnect", "maybe")));
  }

  @Test
  void rejectsInvalidTopicPattern() {
    assertThrows(IllegalArgumentException.class,
        () -> SubscriberConfig.fromMap(Map.of("topics", "orders.*.created")));
    assertThrows(IllegalArgumentException.class,
        () -> SubscriberConfig.defaults().withTopic("bad topic"));
  }

  @Test
  void rejectsPortZero() {
    assertThrows(IllegalArgumentException.class, () -> SubscriberConfig.forAddress("127.0.0.1:0"));
  }

  @Test
  void withersProduceUpdatedCopies() {
    SubscriberConfig base = SubscriberConfig.forAddress("127.0.0.1:7000");
    SubscriberConfig updated = base.withTopic("a.*").withTopic("b").withReconnect(false, 10).withBufferCapacity(4);

    assertEquals(List.of("a.*", "b"), updated.topics());
    assertFalse(updated.autoReconnect());
    assertEquals(10L, updated.reconnectDelayMillis());
    assertEquals(4, updated.bufferCapacity());
    assertTrue(base.topics().isEmpty());
    assertEquals(7000, updated.publisherEndpoint().port());
  }
}
