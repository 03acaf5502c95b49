package ca.gc.cra.dualtap.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.dualtap.infrastructure.metrics.TelemetrySettings;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TelemetryConfiguratorTest {

  @Test
  void removesTelemetryKeysFromConfiguration() {
    Map<String, String> args = new HashMap<>(Map.of(
        "metricsExporter", "OTLP",
        "otelEndpoint", "http://collector:4317",
        "otelResourceAttributes", "deployment.environment=lab",
        "db", "/tmp/capture"));

    TelemetrySettings settings = TelemetryConfigurator.configureMetrics(args);

    assertEquals("otlp", settings.exporter());
    assertEquals("http://collector:4317", settings.endpoint());
    assertEquals("deployment.environment=lab", settings.resourceAttributes());
    assertEquals(Map.of("db", "/tmp/capture"), args);
  }

  @Test
  void noneDisablesExport() {
    assertTrue(TelemetryConfigurator.configureMetrics(new HashMap<>(Map.of("metricsExporter", "none"))).isDisabled());
    assertFalse(TelemetryConfigurator.configureMetrics(new HashMap<>(Map.of("metricsExporter", "otlp"))).isDisabled());
  }

  @Test
  void rejectsUnknownExporterAndBadEndpoint() {
    assertThrows(IllegalArgumentException.class,
        () -> TelemetryConfigurator.configureMetrics(new HashMap<>(Map.of("metricsExporter", "prometheus"))));
    assertThrows(IllegalArgumentException.class,
        () -> TelemetryConfigurator.configureMetrics(new HashMap<>(Map.of("otelEndpoint", "grpc://collector"))));
    assertThrows(IllegalArgumentException.class,
        () -> TelemetryConfigurator.configureMetrics(new HashMap<>(Map.of("otelEndpoint", "http:///path"))));
  }
}
