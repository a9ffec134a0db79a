package ca.gc.cra.relay.config;

import ca.gc.cra.relay.domain.bus.BusException;
import ca.gc.cra.relay.domain.event.Event;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges defaults, YAML, and CLI options (in increasing precedence) into one effective option map.
 *
 * @since 0.1.0
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds the effective options for a mode.
   *
   * @param mode {@code publish} or {@code subscribe}
   * @param yaml flattened YAML options, if a file was loaded
   * @param cli CLI options; highest precedence
   * @param defaults mode defaults; lowest precedence
   * @param warn sink for override notices; may be {@code null}
   * @return immutable merged options
   * @throws IllegalArgumentException if cross-key validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlCopy);
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null || entry.getValue() == null) {
        continue;
      }
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      merged.put(key, entry.getValue());
    }

    validate(mode, merged);
    return Map.copyOf(merged);
  }

  private static void validate(String mode, Map<String, String> effective) {
    if ("publish".equalsIgnoreCase(mode.trim())) {
      String topic = effective.get("topic");
      try {
        Event.requireValidTopic(topic == null ? "" : topic.trim());
      } catch (BusException ex) {
        throw new IllegalArgumentException("topic: " + ex.getMessage(), ex);
      }
    }
  }
}
