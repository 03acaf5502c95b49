package ca.gc.cra.dualtap.api;

import ca.gc.cra.dualtap.api.CaptureCliSupport.ResolvedConfig;
import ca.gc.cra.dualtap.application.port.StorageFault;
import ca.gc.cra.dualtap.config.CompositionRoot;
import ca.gc.cra.dualtap.domain.capture.CaptureSummary;
import ca.gc.cra.dualtap.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.dualtap.logging.LoggingConfigurator;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prints one capture report for an existing database and exits.
 *
 * @since 0.1.0
 */
final class StatsCli {
  private static final Logger log = LoggerFactory.getLogger(StatsCli.class);

  static final String MODE_STATS = "stats";
  static final int RECENT_ARTIFACTS = 3;

  private static final String SUMMARY_USAGE = "usage: stats [config=PATH] [db=PATH] [--verbose]";
  private static final String HELP_TEXT = """
      DUALTAP capture statistics

      Usage:
        stats [options]

      Options:
        db=PATH                     H2 database file prefix (default ~/.dualtap/capture)
        config=PATH                 YAML file with common/stats sections
        metricsExporter=otlp|none   Metrics exporter (default otlp)
        --verbose                   Enable DEBUG logging
        --help                      Show this message
      """;

  private StatsCli() {}

  /**
   * Executes the stats command.
   *
   * @param args command arguments
   * @return exit code
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for stats command");
    }

    ResolvedConfig resolved;
    try {
      resolved = CaptureCliSupport.resolve(MODE_STATS, input, SUMMARY_USAGE);
      CaptureCliSupport.validatePaths(resolved.capture(), false, false, SUMMARY_USAGE);
    } catch (CliAbort abort) {
      return abort.exitCode();
    }

    Path database = resolved.capture().database();
    if (!Files.exists(Path.of(database + ".mv.db"))) {
      log.warn("No capture database at {}; reporting an empty store", database);
    }

    try (OpenTelemetryMetricsAdapter metrics = OpenTelemetryMetricsAdapter.create(resolved.telemetry());
         CompositionRoot root = new CompositionRoot(resolved.capture(), metrics)) {
      CaptureSummary summary = root.eventStore().summary(RECENT_ARTIFACTS);
      new ConsoleReportSink().publish(summary);
      return ExitCode.SUCCESS;
    } catch (StorageFault ex) {
      log.error("Unable to read capture database {}", database, ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in stats command", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
