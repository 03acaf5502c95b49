package ca.gc.cra.dualtap.api;

import ca.gc.cra.dualtap.infrastructure.metrics.TelemetrySettings;
import ca.gc.cra.dualtap.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extracts telemetry settings from merged configuration so the remaining keys describe only the capture session.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  private TelemetryConfigurator() {}

  /**
   * Removes {@code metricsExporter}, {@code otelEndpoint} and {@code otelResourceAttributes} from {@code args}
   * and validates them.
   *
   * @param args mutable configuration map
   * @return resolved settings; defaults when the keys are absent
   * @throws IllegalArgumentException if the exporter or endpoint is invalid
   */
  static TelemetrySettings configureMetrics(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return new TelemetrySettings(null, null, null);
    }
    String exporter = trimToEmpty(args.remove("metricsExporter")).toLowerCase(Locale.ROOT);
    if (!exporter.isEmpty() && !exporter.equals("otlp") && !exporter.equals("none")) {
      throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
    }

    String endpoint = trimToEmpty(args.remove("otelEndpoint"));
    if (!endpoint.isEmpty()) {
      validateEndpoint(endpoint);
    }

    String resourceAttributes = trimToEmpty(args.remove("otelResourceAttributes"));
    if (!resourceAttributes.isEmpty()) {
      Strings.requirePrintableAscii("otelResourceAttributes", resourceAttributes, MAX_RESOURCE_ATTRIBUTES_LENGTH);
    }

    TelemetrySettings settings = new TelemetrySettings(exporter, endpoint, resourceAttributes);
    log.debug("Metrics exporter {} (endpoint {})", settings.exporter(),
        settings.isDisabled() ? "<none>" : settings.endpoint());
    return settings;
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

  private static String trimToEmpty(String value) {
    return value == null ? "" : value.trim();
  }
}
