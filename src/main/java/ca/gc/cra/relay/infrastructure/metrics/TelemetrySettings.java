package ca.gc.cra.relay.infrastructure.metrics;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Resolved OpenTelemetry export settings.
 *
 * @param exporter exporter mode
 * @param endpoint OTLP gRPC endpoint, e.g. {@code http://localhost:4317}
 * @param resourceAttributes comma separated {@code key=value} pairs merged into the resource; may be empty
 * @param exportInterval period between metric exports
 * @since 0.1.0
 */
public record TelemetrySettings(
    ExporterMode exporter, String endpoint, String resourceAttributes, Duration exportInterval) {
  /** Default OTLP gRPC endpoint. */
  public static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  /** Default export interval. */
  public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(30);

  public TelemetrySettings {
    Objects.requireNonNull(exporter, "exporter");
    endpoint = endpoint == null || endpoint.isBlank() ? DEFAULT_ENDPOINT : endpoint.trim();
    resourceAttributes = resourceAttributes == null ? "" : resourceAttributes.trim();
    exportInterval = exportInterval == null ? DEFAULT_INTERVAL : exportInterval;
    if (exportInterval.isNegative() || exportInterval.isZero()) {
      throw new IllegalArgumentException("exportInterval must be positive");
    }
  }

  /**
   * Settings that disable export entirely.
   *
   * @return disabled settings
   */
  public static TelemetrySettings disabled() {
    return new TelemetrySettings(ExporterMode.NONE, null, null, null);
  }

  /**
   * Resolves settings from {@code otel.*} system properties, then {@code OTEL_*} environment variables.
   *
   * @return resolved settings; exporter defaults to {@code none} so a missing collector costs nothing
   */
  public static TelemetrySettings fromEnvironment() {
    String exporter = firstNonBlank(
        System.getProperty("otel.metrics.exporter"), System.getenv("OTEL_METRICS_EXPORTER"), "none");
    String endpoint = firstNonBlank(
        System.getProperty("otel.exporter.otlp.endpoint"), System.getenv("OTEL_EXPORTER_OTLP_ENDPOINT"),
        DEFAULT_ENDPOINT);
    String attributes = firstNonBlank(
        System.getProperty("otel.resource.attributes"), System.getenv("OTEL_RESOURCE_ATTRIBUTES"), "");
    return new TelemetrySettings(ExporterMode.from(exporter), endpoint, attributes, DEFAULT_INTERVAL);
  }

  /**
   * Returns a copy with a different exporter.
   *
   * @param mode exporter mode
   * @return updated settings
   */
  public TelemetrySettings withExporter(ExporterMode mode) {
    return new TelemetrySettings(mode, endpoint, resourceAttributes, exportInterval);
  }

  /**
   * Returns a copy with a different endpoint.
   *
   * @param value OTLP endpoint
   * @return updated settings
   */
  public TelemetrySettings withEndpoint(String value) {
    return new TelemetrySettings(exporter, value, resourceAttributes, exportInterval);
  }

  /**
   * Returns a copy with different resource attributes.
   *
   * @param value comma separated {@code key=value} pairs
   * @return updated settings
   */
  public TelemetrySettings withResourceAttributes(String value) {
    return new TelemetrySettings(exporter, endpoint, value, exportInterval);
  }

  private static String firstNonBlank(String first, String second, String defaultValue) {
    if (first != null && !first.isBlank()) {
      return first.trim();
    }
    if (second != null && !second.isBlank()) {
      return second.trim();
    }
    return defaultValue;
  }

  /** Metric exporter choice. */
  public enum ExporterMode {
    OTLP,
    NONE;

    /**
     * Parses {@code otlp} or {@code none}, case-insensitively.
     *
     * @param raw exporter text
     * @return mode
     * @throws IllegalArgumentException for any other value
     */
    public static ExporterMode from(String raw) {
      if (raw == null || raw.isBlank()) {
        return NONE;
      }
      return switch (raw.trim().toLowerCase(Locale.ROOT)) {
        case "none" -> NONE;
        case "otlp" -> OTLP;
        default -> throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
      };
    }
  }
}
