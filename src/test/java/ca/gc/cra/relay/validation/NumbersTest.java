package ca.gc.cra.relay.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeReturnsValueWithinBounds() {
    assertEquals(1024, Numbers.requireRange("channelCapacity", 1024, 1, 1_000_000));
  }

  @Test
  void requireRangeRejectsValuesOutsideBounds() {
    assertThrows(IllegalArgumentException.class,
        () -> Numbers.requireRange("channelCapacity", 0, 1, 10));
    assertThrows(IllegalArgumentException.class,
        () -> Numbers.requireRange("channelCapacity", 11, 1, 10));
  }

  @Test
  void parseRangeTrimsAndParses() {
    assertEquals(250L, Numbers.parseRange("reconnectDelayMs", " 250 ", 0, 1_000));
  }

  @Test
  void parseRangeRejectsNonNumericText() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Numbers.parseRange("max", "ten", 0, 100));
    assertTrue(ex.getMessage().startsWith("max must be numeric"));
  }

  @Test
  void parseRangeRejectsBlank() {
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseRange("max", " ", 0, 100));
  }
}
