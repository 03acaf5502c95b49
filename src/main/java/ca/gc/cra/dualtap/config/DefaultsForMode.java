package ca.gc.cra.dualtap.config;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each DUALTAP command.
 *
 * <p>The defaults remain the single source of truth for optional YAML keys; every value is derived from
 * {@link CaptureConfig#defaults()} so the two cannot drift.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested mode merged with common defaults.
   *
   * @param mode target command ({@code run}, {@code proxy}, {@code stats})
   * @return unmodifiable map of default key/value pairs as strings
   * @throws IllegalArgumentException if the mode is unknown
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "run" -> buildRunDefaults();
      case "proxy" -> buildProxyDefaults();
      case "stats" -> Map.of();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    CaptureConfig defaults = CaptureConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("db", defaults.database().toString());
    map.put("metricsExporter", "otlp");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildProxyDefaults() {
    CaptureConfig defaults = CaptureConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("listenHost", defaults.listenHost());
    map.put("listenPort", Integer.toString(defaults.listenPort()));
    map.put("targetDomains", String.join(",", defaults.targetDomains()));
    map.put("markerHeader", defaults.markerHeader());
    map.put("markerValue", defaults.markerValue());
    map.put("proxyGraceMs", millis(defaults.proxyGrace()));
    map.put("reportIntervalMs", millis(defaults.reportInterval()));
    map.put("upstreamTimeoutMs", millis(defaults.upstreamTimeout()));
    map.put("probeUrl", "");
    return map;
  }

  private static Map<String, String> buildRunDefaults() {
    CaptureConfig defaults = CaptureConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>(buildProxyDefaults());
    map.put("instrumentation", defaults.instrumentation().name().toLowerCase(Locale.ROOT));
    map.put("replayFile", "");
    map.put("replayProcesses", String.join(",", defaults.replayProcesses()));
    map.put("replayDelayMs", millis(defaults.replayDelay()));
    map.put("process", "");
    map.put("fallbackProcesses", String.join(",", defaults.fallbackProcesses()));
    map.put("spawnTarget", defaults.spawnTarget());
    map.put("deviceTimeoutMs", millis(defaults.deviceTimeout()));
    map.put("hookScript", "");
    return map;
  }

  private static String millis(Duration duration) {
    return Long.toString(duration.toMillis());
  }
}
