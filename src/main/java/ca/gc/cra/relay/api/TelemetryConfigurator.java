package ca.gc.cra.relay.api;

import ca.gc.cra.relay.application.port.MetricsPort;
import ca.gc.cra.relay.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.relay.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.relay.infrastructure.metrics.TelemetrySettings;
import ca.gc.cra.relay.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the {@code metricsExporter}, {@code otelEndpoint}, and {@code otelResourceAttributes} options
 * into {@link TelemetrySettings}, layered over any {@code otel.*} properties or {@code OTEL_*} environment.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  private TelemetryConfigurator() {}

  static TelemetrySettings resolve(Map<String, String> options) {
    TelemetrySettings settings = TelemetrySettings.fromEnvironment();
    if (options == null || options.isEmpty()) {
      return settings;
    }

    String exporter = trimmed(options.get("metricsExporter"));
    if (exporter != null) {
      settings = settings.withExporter(TelemetrySettings.ExporterMode.from(exporter));
      log.debug("Configuring OpenTelemetry metrics exporter: {}", settings.exporter());
    }

    String endpoint = trimmed(options.get("otelEndpoint"));
    if (endpoint != null) {
      validateEndpoint(endpoint);
      log.debug("Configuring OTLP endpoint: {}", endpoint);
      settings = settings.withEndpoint(endpoint);
    }

    String resourceAttributes = trimmed(options.get("otelResourceAttributes"));
    if (resourceAttributes != null) {
      Strings.requirePrintableAscii(
          "otelResourceAttributes", resourceAttributes, MAX_RESOURCE_ATTRIBUTES_LENGTH);
      log.debug("Configuring OpenTelemetry resource attribute override");
      settings = settings.withResourceAttributes(resourceAttributes);
    }
    return settings;
  }

  static MetricsPort openMetrics(TelemetrySettings settings) {
    if (settings.exporter() == TelemetrySettings.ExporterMode.NONE) {
      return new NoOpMetricsAdapter();
    }
    log.info("Exporting metrics over OTLP to {}", settings.endpoint());
    return new OpenTelemetryMetricsAdapter(settings);
  }

  private static void validateEndpoint(String raw) {
    try {
      URI uri = new URI(raw);
      String scheme = uri.getScheme();
      if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException("otelEndpoint must include a host");
      }
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
  }

  private static String trimmed(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    return value.trim();
  }
}
