package ca.gc.cra.relay.config;

import ca.gc.cra.relay.domain.net.Endpoint;
import ca.gc.cra.relay.validation.Numbers;
import ca.gc.cra.relay.validation.Strings;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Settings for a {@code Subscriber}: target publisher, topic filter, reconnect policy,
 * and receive buffer size.
 * <p><strong>Thread-safety:</strong> Immutable record; {@link #topics()} is an unmodifiable copy.</p>
 *
 * @param publisherAddress publisher {@code host:port}; port must be non-zero; a {@code tcp://} prefix is stripped
 * @param topics topic patterns; empty accepts every topic
 * @param reconnectDelayMillis wait between a lost connection and the next attempt
 * @param autoReconnect whether lost or failed connections are retried automatically
 * @param bufferCapacity receive buffer depth in events; the oldest event is dropped when full
 * @since 0.1.0
 */
public record SubscriberConfig(
    String publisherAddress,
    List<String> topics,
    long reconnectDelayMillis,
    boolean autoReconnect,
    int bufferCapacity) {
  /** Default publisher address. */
  public static final String DEFAULT_PUBLISHER = "127.0.0.1:9999";
  /** Default reconnect delay in milliseconds. */
  public static final long DEFAULT_RECONNECT_DELAY_MILLIS = 1_000L;
  /** Default receive buffer depth. */
  public static final int DEFAULT_BUFFER_CAPACITY = 256;

  static final long MAX_RECONNECT_DELAY_MILLIS = 3_600_000L;
  static final int MAX_BUFFER_CAPACITY = 1_000_000;

  public SubscriberConfig {
    publisherAddress =
        Endpoint.of(Strings.requireNonBlank("connect", publisherAddress), false).toString();
    topics = sanitizeTopics(topics);
    Numbers.requireRange("reconnectDelayMs", reconnectDelayMillis, 0, MAX_RECONNECT_DELAY_MILLIS);
    Numbers.requireRange("bufferCapacity", bufferCapacity, 1, MAX_BUFFER_CAPACITY);
  }

  /**
   * Returns the default subscriber settings.
   *
   * @return {@code 127.0.0.1:9999}, all topics, 1000 ms delay, auto-reconnect on, buffer 256
   */
  public static SubscriberConfig defaults() {
    return new SubscriberConfig(
        DEFAULT_PUBLISHER, List.of(), DEFAULT_RECONNECT_DELAY_MILLIS, true, DEFAULT_BUFFER_CAPACITY);
  }

  /**
   * Defaults pointed at another publisher.
   *
   * @param publisherAddress publisher {@code host:port}
   * @return settings
   * @throws IllegalArgumentException if the address is malformed
   */
  public static SubscriberConfig forAddress(String publisherAddress) {
    return defaults().withPublisherAddress(publisherAddress);
  }

  /**
   * Builds settings from flattened CLI/YAML keys {@code connect}, {@code topics} (comma separated),
   * {@code reconnectDelayMs}, {@code autoReconnect}, and {@code bufferCapacity}.
   *
   * @param options key/value options; never {@code null}
   * @return validated settings
   * @throws IllegalArgumentException if any value is malformed or out of range
   */
  public static SubscriberConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    SubscriberConfig defaults = defaults();
    String address = options.getOrDefault("connect", defaults.publisherAddress());
    if (address == null || address.isBlank()) {
      address = defaults.publisherAddress();
    }
    List<String> topics = splitTopics(options.get("topics"));
    long delay = defaults.reconnectDelayMillis();
    String delayRaw = options.get("reconnectDelayMs");
    if (delayRaw != null && !delayRaw.isBlank()) {
      delay = Numbers.parseRange("reconnectDelayMs", delayRaw, 0, MAX_RECONNECT_DELAY_MILLIS);
    }
    boolean autoReconnect = parseBoolean("autoReconnect", options.get("autoReconnect"), defaults.autoReconnect());
    int capacity = defaults.bufferCapacity();
    String capacityRaw = options.get("bufferCapacity");
    if (capacityRaw != null && !capacityRaw.isBlank()) {
      capacity = (int) Numbers.parseRange("bufferCapacity", capacityRaw, 1, MAX_BUFFER_CAPACITY);
    }
    return new SubscriberConfig(address, topics, delay, autoReconnect, capacity);
  }

  /**
   * Returns a copy targeting another publisher.
   *
   * @param address publisher {@code host:port}
   * @return updated settings
   */
  public SubscriberConfig withPublisherAddress(String address) {
    return new SubscriberConfig(address, topics, reconnectDelayMillis, autoReconnect, bufferCapacity);
  }

  /**
   * Returns a copy with one more topic pattern.
   *
   * @param pattern {@code *}, {@code prefix.*}, or an exact topic
   * @return updated settings
   * @throws IllegalArgumentException if the pattern is malformed
   */
  public SubscriberConfig withTopic(String pattern) {
    List<String> next = new ArrayList<>(topics);
    next.add(pattern);
    return new SubscriberConfig(publisherAddress, next, reconnectDelayMillis, autoReconnect, bufferCapacity);
  }

  /**
   * Returns a copy with a different reconnect policy.
   *
   * @param enabled whether to reconnect automatically
   * @param delayMillis delay before each attempt
   * @return updated settings
   */
  public SubscriberConfig withReconnect(boolean enabled, long delayMillis) {
    return new SubscriberConfig(publisherAddress, topics, delayMillis, enabled, bufferCapacity);
  }

  /**
   * Returns a copy with a different receive buffer depth.
   *
   * @param capacity buffer depth in events
   * @return updated settings
   */
  public SubscriberConfig withBufferCapacity(int capacity) {
    return new SubscriberConfig(publisherAddress, topics, reconnectDelayMillis, autoReconnect, capacity);
  }

  /**
   * Returns the parsed publisher endpoint.
   *
   * @return endpoint with a non-zero port
   */
  public Endpoint publisherEndpoint() {
    return Endpoint.of(publisherAddress, false);
  }

  private static List<String> sanitizeTopics(List<String> topics) {
    if (topics == null || topics.isEmpty()) {
      return List.of();
    }
    List<String> sanitized = new ArrayList<>(topics.size());
    for (String pattern : topics) {
      sanitized.add(Strings.requireTopicPattern("topics", pattern));
    }
    return List.copyOf(sanitized);
  }

  private static List<String> splitTopics(String raw) {
    if (raw == null || raw.isBlank()) {
      return List.of();
    }
    List<String> topics = new ArrayList<>();
    for (String token : raw.split(",")) {
      String trimmed = token.trim();
      if (!trimmed.isEmpty()) {
        topics.add(trimmed);
      }
    }
    return topics;
  }

  private static boolean parseBoolean(String name, String value, boolean defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "true", "yes", "on" -> true;
      case "false", "no", "off" -> false;
      default -> throw new IllegalArgumentException(name + " must be true or false (was " + value + ")");
    };
  }
}
