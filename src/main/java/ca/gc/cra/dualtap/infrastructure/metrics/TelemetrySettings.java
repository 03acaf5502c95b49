package ca.gc.cra.dualtap.infrastructure.metrics;

import java.util.Locale;
import java.util.Objects;

/**
 * Resolved OpenTelemetry exporter settings.
 *
 * @param exporter {@code otlp} or {@code none}
 * @param endpoint OTLP gRPC endpoint
 * @param resourceAttributes comma separated {@code key=value} resource attributes; may be blank
 * @since 0.1.0
 */
public record TelemetrySettings(String exporter, String endpoint, String resourceAttributes) {
  /** Default OTLP collector endpoint. */
  public static final String DEFAULT_ENDPOINT = "http://localhost:4317";

  public TelemetrySettings {
    exporter = exporter == null || exporter.isBlank() ? "otlp" : exporter.trim().toLowerCase(Locale.ROOT);
    endpoint = endpoint == null || endpoint.isBlank() ? DEFAULT_ENDPOINT : endpoint.trim();
    resourceAttributes = Objects.requireNonNullElse(resourceAttributes, "").trim();
  }

  /** @return settings that disable metric export */
  public static TelemetrySettings disabled() {
    return new TelemetrySettings("none", null, null);
  }

  /** @return {@code true} when metric export is disabled */
  public boolean isDisabled() {
    return "none".equals(exporter);
  }
}
