package ca.gc.cra.relay.domain.event;

/**
 * Matches topics against subscription patterns.
 *
 * <p>Three pattern forms exist: {@code "*"} matches everything, {@code "prefix.*"} matches any topic that starts
 * with {@code prefix} followed by a dot, and anything else is compared for exact equality. There are no
 * multi-level wildcards and no regular expressions; every check is a constant number of string operations.</p>
 *
 * @since 0.1.0
 */
public final class TopicMatcher {
  /** Pattern that accepts every topic. */
  public static final String MATCH_ALL = "*";
  private static final String WILDCARD_SUFFIX = ".*";

  private TopicMatcher() {}

  /**
   * Tests {@code topic} against {@code pattern}.
   *
   * @param topic event topic; {@code null} never matches
   * @param pattern subscription pattern; {@code null} never matches
   * @return {@code true} when the topic matches the pattern
   */
  public static boolean matches(String topic, String pattern) {
    if (topic == null || pattern == null) {
      return false;
    }
    if (MATCH_ALL.equals(pattern)) {
      return true;
    }
    if (pattern.endsWith(WILDCARD_SUFFIX)) {
      String prefix = pattern.substring(0, pattern.length() - WILDCARD_SUFFIX.length());
      return topic.length() > prefix.length()
          && topic.startsWith(prefix)
          && topic.charAt(prefix.length()) == '.';
    }
    return topic.equals(pattern);
  }

  /**
   * Tests a topic against a list of patterns; an empty list accepts everything.
   *
   * @param topic event topic
   * @param patterns subscription patterns
   * @return {@code true} when the list is empty or any pattern matches
   */
  public static boolean matchesAny(String topic, Iterable<String> patterns) {
    boolean any = false;
    for (String pattern : patterns) {
      any = true;
      if (matches(topic, pattern)) {
        return true;
      }
    }
    return !any;
  }

  /**
   * Checks whether {@code pattern} is one of the supported forms with a well-formed topic part.
   *
   * @param pattern candidate pattern
   * @return {@code true} for {@code "*"}, a valid topic, or a valid topic followed by {@code ".*"}
   */
  public static boolean isValidPattern(String pattern) {
    if (pattern == null || pattern.isEmpty()) {
      return false;
    }
    if (MATCH_ALL.equals(pattern)) {
      return true;
    }
    String body = pattern.endsWith(WILDCARD_SUFFIX)
        ? pattern.substring(0, pattern.length() - WILDCARD_SUFFIX.length())
        : pattern;
    return !body.isEmpty() && body.length() <= Event.MAX_TOPIC_LENGTH && isTopicText(body);
  }

  static boolean isTopicText(String value) {
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      boolean allowed = (c >= 'a' && c <= 'z')
          || (c >= 'A' && c <= 'Z')
          || (c >= '0' && c <= '9')
          || c == '.'
          || c == '_'
          || c == '-';
      if (!allowed) {
        return false;
      }
    }
    return true;
  }
}
