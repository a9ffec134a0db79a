package ca.gc.cra.relay.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class TelemetrySettingsTest {

  @Test
  void disabledUsesDefaults() {
    TelemetrySettings settings = TelemetrySettings.disabled();

    assertEquals(TelemetrySettings.ExporterMode.NONE, settings.exporter());
    assertEquals(TelemetrySettings.DEFAULT_ENDPOINT, settings.endpoint());
    assertEquals("", settings.resourceAttributes());
    assertEquals(TelemetrySettings.DEFAULT_INTERVAL, settings.exportInterval());
  }

  @Test
  void exporterModeParsesCaseInsensitively() {
    assertEquals(TelemetrySettings.ExporterMode.OTLP, TelemetrySettings.ExporterMode.from(" OTLP "));
    assertEquals(TelemetrySettings.ExporterMode.NONE, TelemetrySettings.ExporterMode.from(null));
    assertThrows(IllegalArgumentException.class, () -> TelemetrySettings.ExporterMode.from("prometheus"));
  }

  @Test
  void withersReplaceSingleFields() {
    TelemetrySettings settings = TelemetrySettings.disabled()
        .withExporter(TelemetrySettings.ExporterMode.OTLP)
        .withEndpoint("http://collector:4317")
        .withResourceAttributes("team=bus");

    assertEquals(TelemetrySettings.ExporterMode.OTLP, settings.exporter());
    assertEquals("http://collector:4317", settings.endpoint());
    assertEquals("team=bus", settings.resourceAttributes());
  }

  @Test
  void rejectsNonPositiveInterval() {
    assertThrows(IllegalArgumentException.class,
        () -> new TelemetrySettings(TelemetrySettings.ExporterMode.NONE, null, null, Duration.ZERO));
  }
}
