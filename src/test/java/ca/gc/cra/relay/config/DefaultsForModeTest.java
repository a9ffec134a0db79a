package ca.gc.cra.relay.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;
import org.junit.jupiter.api.Test;

class DefaultsForModeTest {

  @Test
  void publishDefaultsMatchTypedDefaults() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("PUBLISH");

    assertEquals(PublisherConfig.defaults(), PublisherConfig.fromMap(defaults));
    assertEquals("relay.lines", defaults.get("topic"));
    assertEquals("none", defaults.get("metricsExporter"));
    assertFalse(defaults.containsKey("connect"));
  }

  @Test
  void subscribeDefaultsMatchTypedDefaults() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("subscribe");

    assertEquals(SubscriberConfig.defaults(), SubscriberConfig.fromMap(defaults));
    assertEquals("0", defaults.get("max"));
  }

  @Test
  void unknownModeIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> DefaultsForMode.asFlatMap("replay"));
  }
}
