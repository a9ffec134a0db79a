package ca.gc.cra.relay.config;

import ca.gc.cra.relay.domain.net.Endpoint;
import ca.gc.cra.relay.validation.Numbers;
import ca.gc.cra.relay.validation.Strings;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Settings for a {@code Publisher}: listen address and per-subscriber limits.
 * <p><strong>Why:</strong> Validated once here so {@code start()} only has to bind.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param bindAddress {@code host:port} to listen on; port {@code 0} lets the OS choose; a {@code tcp://}
 *     prefix is stripped
 * @param channelCapacity per-subscriber outbound queue depth in events
 * @param maxConnections simultaneous subscriber limit; excess connections are closed on accept
 * @since 0.1.0
 */
public record PublisherConfig(String bindAddress, int channelCapacity, int maxConnections) {
  /** Default listen address (loopback, ephemeral port). */
  public static final String DEFAULT_BIND = "127.0.0.1:0";
  /** Default outbound queue depth per subscriber. */
  public static final int DEFAULT_CHANNEL_CAPACITY = 1024;
  /** Default connection limit. */
  public static final int DEFAULT_MAX_CONNECTIONS = 100;

  static final int MAX_CHANNEL_CAPACITY = 1_000_000;
  static final int MAX_CONNECTION_LIMIT = 65_536;

  public PublisherConfig {
    bindAddress = Endpoint.of(Strings.requireNonBlank("bind", bindAddress), true).toString();
    Numbers.requireRange("channelCapacity", channelCapacity, 1, MAX_CHANNEL_CAPACITY);
    Numbers.requireRange("maxConnections", maxConnections, 1, MAX_CONNECTION_LIMIT);
  }

  /**
   * Returns the default publisher settings.
   *
   * @return {@code 127.0.0.1:0}, capacity 1024, 100 connections
   */
  public static PublisherConfig defaults() {
    return new PublisherConfig(DEFAULT_BIND, DEFAULT_CHANNEL_CAPACITY, DEFAULT_MAX_CONNECTIONS);
  }

  /**
   * Builds settings from flattened CLI/YAML keys {@code bind}, {@code channelCapacity}, and
   * {@code maxConnections}; absent keys keep their defaults.
   *
   * @param options key/value options; never {@code null}
   * @return validated settings
   * @throws IllegalArgumentException if any value is malformed or out of range
   */
  public static PublisherConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    PublisherConfig defaults = defaults();
    String bind = firstNonBlank(options.get("bind"), defaults.bindAddress());
    int capacity = parseInt(options, "channelCapacity", defaults.channelCapacity(), MAX_CHANNEL_CAPACITY);
    int maxConnections = parseInt(options, "maxConnections", defaults.maxConnections(), MAX_CONNECTION_LIMIT);
    return new PublisherConfig(bind, capacity, maxConnections);
  }

  /**
   * Returns the parsed bind endpoint.
   *
   * @return endpoint, possibly with port {@code 0}
   */
  public Endpoint bindEndpoint() {
    return Endpoint.of(bindAddress, true);
  }

  private static int parseInt(Map<String, String> options, String key, int fallback, int max) {
    String raw = options.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    return (int) Numbers.parseRange(key, raw, 1, max);
  }

  private static String firstNonBlank(String value, String fallback) {
    return value == null || value.isBlank() ? fallback : value.trim();
  }
}
