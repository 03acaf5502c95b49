package ca.gc.cra.dualtap.api;

import ca.gc.cra.dualtap.config.CaptureConfig;
import ca.gc.cra.dualtap.config.ConfigMerger;
import ca.gc.cra.dualtap.config.DefaultsForMode;
import ca.gc.cra.dualtap.config.InstrumentationMode;
import ca.gc.cra.dualtap.config.YamlConfigLoader;
import ca.gc.cra.dualtap.infrastructure.metrics.TelemetrySettings;
import ca.gc.cra.dualtap.logging.LoggingConfigurator;
import ca.gc.cra.dualtap.logging.Logs;
import ca.gc.cra.dualtap.validation.Paths;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration resolution and path checks shared by the {@code run}, {@code proxy} and {@code stats} commands.
 */
final class CaptureCliSupport {
  private static final Logger log = LoggerFactory.getLogger(CaptureCliSupport.class);

  private CaptureCliSupport() {}

  /**
   * Resolves the effective configuration: CLI {@code key=value} over YAML ({@code config=PATH}) over defaults.
   *
   * @param mode command name used to select the YAML section and defaults
   * @param input parsed CLI input
   * @param usage summary usage printed on argument errors
   * @return validated capture and telemetry settings
   * @throws CliAbort after logging the failure
   */
  static ResolvedConfig resolve(String mode, CliInput input, String usage) throws CliAbort {
    Map<String, String> cliKv;
    try {
      cliKv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(usage);
      throw new CliAbort(ExitCode.INVALID_ARGS);
    }

    String configPath = ConfigCliUtils.extractConfigPath(cliKv);
    Optional<Map<String, String>> yaml = loadYaml(mode, configPath, usage);

    Map<String, String> effective;
    try {
      effective = new LinkedHashMap<>(ConfigMerger.buildEffectiveConfig(
          mode, yaml, cliKv, DefaultsForMode.asFlatMap(mode), log::warn));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} configuration: {}", mode, ex.getMessage());
      CliPrinter.println(usage);
      throw new CliAbort(ExitCode.INVALID_ARGS);
    }

    if (!input.verbose() && ConfigCliUtils.parseBoolean(effective, "verbose", false)) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled by configuration");
    }

    try {
      TelemetrySettings telemetry = TelemetryConfigurator.configureMetrics(effective);
      CaptureConfig capture = CaptureConfig.fromMap(effective);
      return new ResolvedConfig(capture, telemetry);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} arguments: {}", mode, ex.getMessage());
      CliPrinter.println(usage);
      throw new CliAbort(ExitCode.INVALID_ARGS);
    }
  }

  /**
   * Checks that input files exist and, unless {@code dryRun}, that the database directory can be created.
   *
   * @param config resolved configuration
   * @param withInstrumentation whether instrumentation inputs are used by the command
   * @param dryRun skip directory creation when {@code true}
   * @param usage summary usage printed on failures
   * @throws CliAbort after logging the failure
   */
  static void validatePaths(CaptureConfig config, boolean withInstrumentation, boolean dryRun, String usage)
      throws CliAbort {
    try {
      if (withInstrumentation && config.instrumentation() == InstrumentationMode.REPLAY) {
        Paths.requireReadableFile("replayFile", config.replayFile());
      }
      if (withInstrumentation && config.hookScript() != null) {
        Paths.requireReadableFile("hookScript", config.hookScript());
      }
      if (!dryRun) {
        Paths.prepareDatabaseFile("db", config.database());
      }
    } catch (IllegalArgumentException ex) {
      log.error("Invalid path configuration: {}", ex.getMessage());
      CliPrinter.println(usage);
      throw new CliAbort(ExitCode.IO_ERROR);
    }
  }

  /**
   * Prints the session plan without binding sockets or opening the database.
   *
   * @param mode command name
   * @param resolved resolved settings
   */
  static void printDryRunPlan(String mode, ResolvedConfig resolved) {
    CaptureConfig config = resolved.capture();
    TelemetrySettings telemetry = resolved.telemetry();
    boolean instrumented = "run".equals(mode);
    CliPrinter.printLines(
        "DUALTAP " + mode + " dry-run: no proxy will be started.",
        " Database         : " + config.database(),
        " Proxy            : " + config.listenHost() + ":" + config.listenPort(),
        " Target domains   : " + String.join(", ", config.targetDomains()),
        " Marker header    : " + config.markerHeader() + ": " + config.markerValue(),
        " Instrumentation  : " + (instrumented ? config.instrumentation() : "<disabled>"),
        " Replay file      : " + (instrumented && config.replayFile() != null ? config.replayFile() : "<none>"),
        " Process          : " + (instrumented ? Optional.ofNullable(config.process()).orElse("<fallback>") : "<n/a>"),
        " Fallbacks        : " + (instrumented ? String.join(", ", config.fallbackProcesses()) : "<n/a>"),
        " Spawn target     : " + (instrumented ? config.spawnTarget() : "<n/a>"),
        " Hook script      : " + (config.hookScript() == null ? "<bundled>" : config.hookScript()),
        " Report interval  : " + config.reportInterval().toMillis() + " ms",
        " Probe URL        : " + (config.probeUrl() == null ? "<none>" : Logs.truncate(config.probeUrl().toString(), 96)),
        " Metrics exporter : " + telemetry.exporter(),
        " Re-run without --dry-run to start capturing.");
  }

  private static Optional<Map<String, String>> loadYaml(String mode, String configPath, String usage)
      throws CliAbort {
    if (configPath == null) {
      return Optional.empty();
    }
    Path yamlPath = Path.of(configPath);
    if (!Files.exists(yamlPath)) {
      log.error("Configuration file does not exist: {}", yamlPath);
      CliPrinter.println(usage);
      throw new CliAbort(ExitCode.INVALID_ARGS);
    }
    try {
      return YamlConfigLoader.load(yamlPath, mode);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid YAML configuration: {}", ex.getMessage());
      CliPrinter.println(usage);
      throw new CliAbort(ExitCode.INVALID_ARGS);
    } catch (IOException ex) {
      log.error("Unable to read configuration file {}", yamlPath, ex);
      throw new CliAbort(ExitCode.IO_ERROR);
    }
  }

  /**
   * Capture settings plus the telemetry keys split off from them.
   *
   * @param capture capture session configuration
   * @param telemetry metrics exporter configuration
   */
  record ResolvedConfig(CaptureConfig capture, TelemetrySettings telemetry) {}
}
