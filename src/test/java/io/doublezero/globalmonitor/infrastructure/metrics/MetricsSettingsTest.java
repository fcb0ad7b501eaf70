package io.doublezero.globalmonitor.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class MetricsSettingsTest {
  private static final Map<String, String> PROPS = Map.of(
      "otel.exporter.otlp.endpoint", "http://collector-prop:4317");
  private static final Map<String, String> ENV = Map.of(
      "OTEL_METRICS_EXPORTER", "none",
      "OTEL_EXPORTER_OTLP_ENDPOINT", "http://collector-env:4317",
      "OTEL_RESOURCE_ATTRIBUTES", "deployment.environment=test");

  @Test
  void explicitValuesWinOverPropertiesAndEnvironment() {
    MetricsSettings resolved = new MetricsSettings(" OTLP ", "http://explicit:4317", "")
        .resolve(PROPS::get, ENV::get);

    assertEquals("otlp", resolved.exporter());
    assertEquals("http://explicit:4317", resolved.endpoint());
    assertEquals("deployment.environment=test", resolved.resourceAttributes());
    assertTrue(resolved.enabled());
  }

  @Test
  void propertiesWinOverEnvironment() {
    MetricsSettings resolved = new MetricsSettings(null, null, null).resolve(PROPS::get, ENV::get);

    assertEquals("http://collector-prop:4317", resolved.endpoint());
    assertFalse(resolved.enabled());
  }

  @Test
  void nothingSetMeansOtlpOnLocalhost() {
    MetricsSettings resolved = new MetricsSettings("", "", "").resolve(k -> null, k -> null);

    assertEquals("otlp", resolved.exporter());
    assertEquals(MetricsSettings.DEFAULT_ENDPOINT, resolved.endpoint());
  }

  @Test
  void disabledExporterRecordsIntoNoopMeter() {
    try (OpenTelemetryMetricsAdapter adapter = new OpenTelemetryMetricsAdapter(new MetricsSettings("NONE", "", ""))) {
      assertFalse(adapter.exporting());
      assertDoesNotThrow(() -> {
        adapter.increment("gm.tick.total", Map.of("outcome", "ok"));
        adapter.observe("gm.tick.duration.ms", 5);
        adapter.gauge("gm.targets.current", 1);
      });
    }
  }
}
