package ca.gc.cra.relay.domain.event;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class TopicMatcherTest {

  @Test
  void starMatchesEverything() {
    assertTrue(TopicMatcher.matches("a", "*"));
    assertTrue(TopicMatcher.matches("a.b.c", "*"));
  }

  @Test
  void prefixWildcardRequiresDotBoundary() {
    assertTrue(TopicMatcher.matches("user.created", "user.*"));
    assertTrue(TopicMatcher.matches("user.profile.updated", "user.*"));
    assertFalse(TopicMatcher.matches("user", "user.*"));
    assertFalse(TopicMatcher.matches("users.created", "user.*"));
    assertFalse(TopicMatcher.matches("username", "user.*"));
  }

  @Test
  void exactPatternMatchesOnlyItself() {
    assertTrue(TopicMatcher.matches("orders", "orders"));
    assertFalse(TopicMatcher.matches("orders.created", "orders"));
    assertFalse(TopicMatcher.matches("Orders", "orders"));
  }

  @Test
  void emptyFilterListAcceptsEverything() {
    assertTrue(TopicMatcher.matchesAny("anything", List.of()));
  }

  @Test
  void filterListAcceptsWhenAnyPatternMatches() {
    List<String> patterns = List.of("orders.*", "audit");
    assertTrue(TopicMatcher.matchesAny("orders.shipped", patterns));
    assertTrue(TopicMatcher.matchesAny("audit", patterns));
    assertFalse(TopicMatcher.matchesAny("billing.paid", patterns));
  }

  @Test
  void validPatterns() {
    assertTrue(TopicMatcher.isValidPattern("*"));
    assertTrue(TopicMatcher.isValidPattern("a.*"));
    assertTrue(TopicMatcher.isValidPattern("a-b_c.d"));
    assertFalse(TopicMatcher.isValidPattern(""));
    assertFalse(TopicMatcher.isValidPattern(".*"));
    assertFalse(TopicMatcher.isValidPattern("a*"));
    assertFalse(TopicMatcher.isValidPattern(null));
  }
}
