package ca.gc.cra.dualtap.config;

import ca.gc.cra.dualtap.application.capture.AttachSettings;
import ca.gc.cra.dualtap.application.capture.TrafficCaptureUseCase.MarkerHeader;
import ca.gc.cra.dualtap.validation.Net;
import ca.gc.cra.dualtap.validation.Numbers;
import ca.gc.cra.dualtap.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Configuration for a capture session: proxy binding, target domains, instrumentation engine selection, attach
 * policy, and orchestrator timing.
 *
 * @param database H2 database file prefix (H2 appends {@code .mv.db})
 * @param listenHost proxy bind address
 * @param listenPort proxy bind port; {@code 0} binds an ephemeral port
 * @param targetDomains hosts whose traffic is recorded
 * @param markerHeader header name stamped on forwarded target requests
 * @param markerValue header value stamped on forwarded target requests
 * @param instrumentation instrumentation engine selection
 * @param replayFile NDJSON recording consumed when {@code instrumentation=REPLAY}; otherwise {@code null}
 * @param replayProcesses process names the replay device reports as running
 * @param replayDelay pause between replayed messages
 * @param process explicit process to attach to; {@code null} selects from {@code fallbackProcesses}
 * @param fallbackProcesses candidates tried in order when no process is named
 * @param spawnTarget program spawned when every fallback is absent
 * @param deviceTimeout bound on device lookup
 * @param hookScript custom hook script; {@code null} uses the bundled script
 * @param proxyGrace delay between starting the proxy and attaching instrumentation
 * @param reportInterval delay between periodic capture reports
 * @param upstreamTimeout timeout applied to upstream requests relayed by the proxy
 * @param probeUrl URL fetched once through the proxy after start-up; {@code null} disables the probe
 * @since 0.1.0
 */
public record CaptureConfig(
    Path database,
    String listenHost,
    int listenPort,
    List<String> targetDomains,
    String markerHeader,
    String markerValue,
    InstrumentationMode instrumentation,
    Path replayFile,
    List<String> replayProcesses,
    Duration replayDelay,
    String process,
    List<String> fallbackProcesses,
    String spawnTarget,
    Duration deviceTimeout,
    Path hookScript,
    Duration proxyGrace,
    Duration reportInterval,
    Duration upstreamTimeout,
    URI probeUrl) {

  private static final List<String> DEFAULT_TARGET_DOMAINS = List.of("dawn.com", "www.dawn.com");
  private static final String DEFAULT_LISTEN_HOST = "127.0.0.1";
  private static final int DEFAULT_LISTEN_PORT = 8080;
  private static final int DEFAULT_REPLAY_DELAY_MILLIS = 0;
  private static final int DEFAULT_PROXY_GRACE_MILLIS = 2_000;
  private static final int DEFAULT_REPORT_INTERVAL_MILLIS = 10_000;
  private static final int DEFAULT_UPSTREAM_TIMEOUT_MILLIS = 30_000;
  private static final int MAX_PROCESS_NAME_LENGTH = 256;
  private static final int MAX_MARKER_VALUE_LENGTH = 256;
  private static final int MAX_DELAY_MILLIS = 60_000;
  private static final int MAX_GRACE_MILLIS = 60_000;
  private static final int MIN_REPORT_INTERVAL_MILLIS = 100;
  private static final int MAX_REPORT_INTERVAL_MILLIS = 3_600_000;
  private static final int MIN_TIMEOUT_MILLIS = 100;
  private static final int MAX_TIMEOUT_MILLIS = 300_000;

  /**
   * Canonical constructor enforcing invariants; collections are copied.
   */
  public CaptureConfig {
    Objects.requireNonNull(database, "database");
    listenHost = Net.validateHost("listenHost", listenHost);
    Net.validatePort("listenPort", listenPort);
    targetDomains = List.copyOf(Objects.requireNonNull(targetDomains, "targetDomains"));
    if (targetDomains.isEmpty()) {
      throw new IllegalArgumentException("targetDomains must name at least one domain");
    }
    markerHeader = Strings.requireHeaderName("markerHeader", markerHeader);
    markerValue = Strings.requirePrintableAscii("markerValue", markerValue, MAX_MARKER_VALUE_LENGTH);
    Objects.requireNonNull(instrumentation, "instrumentation");
    if (instrumentation == InstrumentationMode.REPLAY && replayFile == null) {
      throw new IllegalArgumentException("replayFile is required when instrumentation=REPLAY");
    }
    replayProcesses = List.copyOf(Objects.requireNonNull(replayProcesses, "replayProcesses"));
    Objects.requireNonNull(replayDelay, "replayDelay");
    if (process != null) {
      process = Strings.requirePrintableAscii("process", process, MAX_PROCESS_NAME_LENGTH);
    }
    fallbackProcesses = List.copyOf(Objects.requireNonNull(fallbackProcesses, "fallbackProcesses"));
    spawnTarget = Strings.requirePrintableAscii("spawnTarget", spawnTarget, MAX_PROCESS_NAME_LENGTH);
    Objects.requireNonNull(deviceTimeout, "deviceTimeout");
    Objects.requireNonNull(proxyGrace, "proxyGrace");
    Objects.requireNonNull(reportInterval, "reportInterval");
    Objects.requireNonNull(upstreamTimeout, "upstreamTimeout");
  }

  /**
   * Returns the default configuration used when no overrides are supplied.
   *
   * @return defaults rooted under {@code ~/.dualtap}
   */
  public static CaptureConfig defaults() {
    return new CaptureConfig(
        defaultDatabase(),
        DEFAULT_LISTEN_HOST,
        DEFAULT_LISTEN_PORT,
        DEFAULT_TARGET_DOMAINS,
        MarkerHeader.DEFAULT.name(),
        MarkerHeader.DEFAULT.value(),
        InstrumentationMode.NONE,
        null,
        List.of(AttachSettings.DEFAULT_SPAWN_TARGET),
        Duration.ofMillis(DEFAULT_REPLAY_DELAY_MILLIS),
        null,
        AttachSettings.DEFAULT_FALLBACKS,
        AttachSettings.DEFAULT_SPAWN_TARGET,
        AttachSettings.DEFAULT_DEVICE_TIMEOUT,
        null,
        Duration.ofMillis(DEFAULT_PROXY_GRACE_MILLIS),
        Duration.ofMillis(DEFAULT_REPORT_INTERVAL_MILLIS),
        Duration.ofMillis(DEFAULT_UPSTREAM_TIMEOUT_MILLIS),
        null);
  }

  /**
   * Builds a configuration from flattened {@code key=value} settings, falling back to {@link #defaults()}.
   *
   * @param args flattened settings; {@code null} yields defaults
   * @return validated configuration
   * @throws IllegalArgumentException when any value fails validation
   */
  public static CaptureConfig fromMap(Map<String, String> args) {
    Map<String, String> kv = args == null ? Map.of() : new HashMap<>(args);
    CaptureConfig defaults = defaults();

    Path database = parseOptionalPath("db", kv.get("db")).orElse(defaults.database());
    String listenHost = valueOrDefault(kv.get("listenHost"), defaults.listenHost());
    int listenPort = Numbers.parseBounded("listenPort", kv.get("listenPort"), defaults.listenPort(), 0, 65_535);

    List<String> targetDomains = parseDomains(kv.get("targetDomains"), defaults.targetDomains());

    String markerHeader = valueOrDefault(kv.get("markerHeader"), defaults.markerHeader());
    String markerValue = valueOrDefault(kv.get("markerValue"), defaults.markerValue());

    InstrumentationMode instrumentation =
        InstrumentationMode.parse(kv.get("instrumentation"), defaults.instrumentation());
    Path replayFile = parseOptionalPath("replayFile", kv.get("replayFile")).orElse(null);
    List<String> replayProcesses =
        parseProcessList("replayProcesses", kv.get("replayProcesses"), defaults.replayProcesses());
    Duration replayDelay = parseMillis(kv, "replayDelayMs", defaults.replayDelay(), 0, MAX_DELAY_MILLIS);

    String process = blankToNull(kv.get("process"));
    List<String> fallbackProcesses =
        parseProcessList("fallbackProcesses", kv.get("fallbackProcesses"), defaults.fallbackProcesses());
    String spawnTarget = valueOrDefault(kv.get("spawnTarget"), defaults.spawnTarget());
    Duration deviceTimeout =
        parseMillis(kv, "deviceTimeoutMs", defaults.deviceTimeout(), MIN_TIMEOUT_MILLIS, MAX_TIMEOUT_MILLIS);
    Path hookScript = parseOptionalPath("hookScript", kv.get("hookScript")).orElse(null);

    Duration proxyGrace = parseMillis(kv, "proxyGraceMs", defaults.proxyGrace(), 0, MAX_GRACE_MILLIS);
    Duration reportInterval = parseMillis(
        kv, "reportIntervalMs", defaults.reportInterval(), MIN_REPORT_INTERVAL_MILLIS, MAX_REPORT_INTERVAL_MILLIS);
    Duration upstreamTimeout = parseMillis(
        kv, "upstreamTimeoutMs", defaults.upstreamTimeout(), MIN_TIMEOUT_MILLIS, MAX_TIMEOUT_MILLIS);
    URI probeUrl = parseProbeUrl(kv.get("probeUrl"));

    return new CaptureConfig(
        database,
        listenHost,
        listenPort,
        targetDomains,
        markerHeader,
        markerValue,
        instrumentation,
        replayFile,
        replayProcesses,
        replayDelay,
        process,
        fallbackProcesses,
        spawnTarget,
        deviceTimeout,
        hookScript,
        proxyGrace,
        reportInterval,
        upstreamTimeout,
        probeUrl);
  }

  /** @return the marker header pair stamped on forwarded target requests */
  public MarkerHeader marker() {
    return new MarkerHeader(markerHeader, markerValue);
  }

  private static Path defaultDatabase() {
    String home = System.getProperty("user.home");
    Path base = (home == null || home.isBlank()) ? Path.of("dualtap-data") : Path.of(home, ".dualtap");
    return base.resolve("capture").toAbsolutePath().normalize();
  }

  private static List<String> parseDomains(String raw, List<String> fallback) {
    List<String> entries = Strings.splitList("targetDomains", raw);
    if (entries.isEmpty()) {
      return fallback;
    }
    List<String> domains = new ArrayList<>(entries.size());
    for (String entry : entries) {
      String host = Net.validateHost("targetDomains", entry);
      if (!domains.contains(host)) {
        domains.add(host);
      }
    }
    return domains;
  }

  private static List<String> parseProcessList(String name, String raw, List<String> fallback) {
    List<String> entries = Strings.splitList(name, raw);
    if (entries.isEmpty()) {
      return fallback;
    }
    for (String entry : entries) {
      Strings.requirePrintableAscii(name, entry, MAX_PROCESS_NAME_LENGTH);
    }
    return entries;
  }

  private static Duration parseMillis(
      Map<String, String> kv, String key, Duration fallback, int min, int max) {
    int millis = Numbers.parseBounded(key, kv.get(key), Math.toIntExact(fallback.toMillis()), min, max);
    return Duration.ofMillis(millis);
  }

  private static URI parseProbeUrl(String raw) {
    String value = blankToNull(raw);
    if (value == null) {
      return null;
    }
    try {
      URI uri = new URI(Strings.requirePrintableAscii("probeUrl", value, 2_048));
      String scheme = uri.getScheme();
      if (scheme == null || !scheme.toLowerCase(Locale.ROOT).equals("http")) {
        throw new IllegalArgumentException("probeUrl must use the http scheme (TLS is not intercepted)");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException("probeUrl must include a host");
      }
      return uri;
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("probeUrl must be a valid URI", ex);
    }
  }

  private static Optional<Path> parseOptionalPath(String name, String raw) {
    String value = blankToNull(raw);
    if (value == null) {
      return Optional.empty();
    }
    try {
      return Optional.of(Path.of(Strings.requireNonBlank(name, value)).toAbsolutePath().normalize());
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " must be a valid path", ex);
    }
  }

  private static String valueOrDefault(String raw, String fallback) {
    String value = blankToNull(raw);
    return value == null ? fallback : value;
  }

  private static String blankToNull(String raw) {
    if (raw == null) {
      return null;
    }
    String trimmed = raw.trim();
    return trimmed.isEmpty() ? null : trimmed;
  }
}
