package ca.gc.cra.relay.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Default flat option maps for each CLI mode, derived from the typed config defaults so both stay in sync.
 *
 * @since 0.1.0
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns the defaults for a mode, including the common telemetry and logging keys.
   *
   * @param mode {@code publish} or {@code subscribe}
   * @return immutable defaults
   * @throws IllegalArgumentException for an unknown mode
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "publish" -> buildPublishDefaults();
      case "subscribe" -> buildSubscribeDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("logLevel", "");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildPublishDefaults() {
    PublisherConfig defaults = PublisherConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("bind", defaults.bindAddress());
    map.put("channelCapacity", Integer.toString(defaults.channelCapacity()));
    map.put("maxConnections", Integer.toString(defaults.maxConnections()));
    map.put("topic", "relay.lines");
    map.put("source", "relay-cli");
    map.put("awaitSubscribers", "0");
    return map;
  }

  private static Map<String, String> buildSubscribeDefaults() {
    SubscriberConfig defaults = SubscriberConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("connect", defaults.publisherAddress());
    map.put("topics", String.join(",", defaults.topics()));
    map.put("reconnectDelayMs", Long.toString(defaults.reconnectDelayMillis()));
    map.put("autoReconnect", Boolean.toString(defaults.autoReconnect()));
    map.put("bufferCapacity", Integer.toString(defaults.bufferCapacity()));
    map.put("max", "0");
    return map;
  }
}
