package ca.gc.cra.dualtap.api;

import ca.gc.cra.dualtap.api.CaptureCliSupport.ResolvedConfig;
import ca.gc.cra.dualtap.application.capture.CaptureMode;
import ca.gc.cra.dualtap.application.capture.CaptureOrchestrator;
import ca.gc.cra.dualtap.application.port.StorageFault;
import ca.gc.cra.dualtap.config.CaptureConfig;
import ca.gc.cra.dualtap.config.CompositionRoot;
import ca.gc.cra.dualtap.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.dualtap.infrastructure.proxy.ProxyProbe;
import ca.gc.cra.dualtap.logging.LoggingConfigurator;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a capture session: the {@code run} command (proxy plus instrumentation) and the {@code proxy} command
 * (proxy only). Both report store statistics periodically until Ctrl+C, then print a final report.
 *
 * @since 0.1.0
 */
final class CaptureCli {
  private static final Logger log = LoggerFactory.getLogger(CaptureCli.class);

  static final String MODE_RUN = "run";
  static final String MODE_PROXY = "proxy";

  private static final Duration PROBE_READY_TIMEOUT = Duration.ofSeconds(5);
  private static final Duration SHUTDOWN_WAIT = Duration.ofSeconds(10);

  private static final String RUN_USAGE =
      "usage: run [config=PATH] [db=PATH] [listenHost=HOST] [listenPort=0-65535] [targetDomains=a,b] "
          + "[instrumentation=none|replay] [replayFile=PATH] [process=NAME] [fallbackProcesses=a,b] "
          + "[spawnTarget=NAME] [hookScript=PATH] [probeUrl=URL] [--dry-run] [--verbose]";
  private static final String PROXY_USAGE =
      "usage: proxy [config=PATH] [db=PATH] [listenHost=HOST] [listenPort=0-65535] [targetDomains=a,b] "
          + "[probeUrl=URL] [--dry-run] [--verbose]";
  private static final String RUN_HELP = """
      DUALTAP capture session (proxy + instrumentation)

      Usage:
        run [options]

      Proxy:
        listenHost=HOST             Proxy bind address (default 127.0.0.1)
        listenPort=0-65535          Proxy bind port (default 8080; 0 picks a free port)
        targetDomains=a,b           Hosts whose traffic is recorded (default dawn.com,www.dawn.com)
        markerHeader=NAME           Header stamped on target requests (default X-MITM-Agent)
        markerValue=TEXT            Header value (default DUALTAP-Agent)
        upstreamTimeoutMs=100-300000  Upstream request timeout (default 30000)

      Instrumentation:
        instrumentation=none|replay Engine selection (default none: traffic-only capture)
        replayFile=PATH             NDJSON recording of engine messages (required for replay)
        replayProcesses=a,b         Processes the replay device reports as running
        replayDelayMs=0-60000       Pause between replayed messages (default 0)
        process=NAME                Attach to this process only; no fallback when absent
        fallbackProcesses=a,b       Candidates tried in order when process is not set
        spawnTarget=NAME            Spawned when no candidate is running (default com.android.chrome)
        deviceTimeoutMs=100-300000  Device lookup bound (default 10000)
        hookScript=PATH             Custom hook script (default: bundled hooks)

      Session:
        db=PATH                     H2 database file prefix (default ~/.dualtap/capture)
        proxyGraceMs=0-60000        Wait before attaching instrumentation (default 2000)
        reportIntervalMs=100-3600000  Report period (default 10000)
        probeUrl=http://...         Fetch once through the proxy after start-up
        config=PATH                 YAML file with common/run sections
        metricsExporter=otlp|none   Metrics exporter (default otlp)
        otelEndpoint=URL            OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V  Comma-separated OTel resource attributes
        --dry-run                   Validate inputs and print the plan without capturing
        --verbose                   Enable DEBUG logging
        --help                      Show this message
      """;
  private static final String PROXY_HELP = """
      DUALTAP proxy-only capture session

      Usage:
        proxy [options]

      Options:
        listenHost=HOST             Proxy bind address (default 127.0.0.1)
        listenPort=0-65535          Proxy bind port (default 8080; 0 picks a free port)
        targetDomains=a,b           Hosts whose traffic is recorded (default dawn.com,www.dawn.com)
        markerHeader=NAME           Header stamped on target requests (default X-MITM-Agent)
        markerValue=TEXT            Header value (default DUALTAP-Agent)
        upstreamTimeoutMs=100-300000  Upstream request timeout (default 30000)
        db=PATH                     H2 database file prefix (default ~/.dualtap/capture)
        reportIntervalMs=100-3600000  Report period (default 10000)
        probeUrl=http://...         Fetch once through the proxy after start-up
        config=PATH                 YAML file with common/proxy sections
        metricsExporter=otlp|none   Metrics exporter (default otlp)
        --dry-run                   Validate inputs and print the plan without capturing
        --verbose                   Enable DEBUG logging
        --help                      Show this message
      """;

  private CaptureCli() {}

  /**
   * Executes {@code run} or {@code proxy}.
   *
   * @param mode {@link #MODE_RUN} or {@link #MODE_PROXY}
   * @param args command arguments
   * @return exit code
   */
  static ExitCode run(String mode, String[] args) {
    boolean instrumented = MODE_RUN.equals(mode);
    String usage = instrumented ? RUN_USAGE : PROXY_USAGE;
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println((instrumented ? RUN_HELP : PROXY_HELP).stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for {} command", mode);
    }

    ResolvedConfig resolved;
    try {
      resolved = CaptureCliSupport.resolve(mode, input, usage);
      CaptureCliSupport.validatePaths(resolved.capture(), instrumented, input.dryRun(), usage);
    } catch (CliAbort abort) {
      return abort.exitCode();
    }

    if (input.dryRun()) {
      CaptureCliSupport.printDryRunPlan(mode, resolved);
      return ExitCode.SUCCESS;
    }
    return executeSession(mode, instrumented, resolved);
  }

  private static ExitCode executeSession(String mode, boolean instrumented, ResolvedConfig resolved) {
    CaptureConfig config = resolved.capture();
    log.info("Starting {} session: proxy {}:{}, targets {}, database {}",
        mode, config.listenHost(), config.listenPort(), config.targetDomains(), config.database());
    CountDownLatch finished = new CountDownLatch(1);
    AtomicReference<CaptureOrchestrator> active = new AtomicReference<>();
    Thread hook = new Thread(() -> {
      log.info("Shutdown requested; writing final report");
      CaptureOrchestrator orchestrator = active.get();
      if (orchestrator != null) {
        orchestrator.cancel();
      }
      awaitQuietly(finished);
    }, "dualtap-shutdown");
    Runtime.getRuntime().addShutdownHook(hook);

    try (OpenTelemetryMetricsAdapter metrics = OpenTelemetryMetricsAdapter.create(resolved.telemetry());
         CompositionRoot root = new CompositionRoot(config, metrics);
         CaptureOrchestrator orchestrator = root.captureOrchestrator(instrumented, new ConsoleReportSink())) {
      active.set(orchestrator);
      CaptureMode captureMode = orchestrator.start();
      Optional<Exception> failure = orchestrator.engineFailure();
      if (failure.isPresent()) {
        log.error("Proxy failed to start on {}:{}", config.listenHost(), config.listenPort(), failure.get());
        return ExitCode.IO_ERROR;
      }
      log.info("Capture session running in {} mode; press Ctrl+C to stop", captureMode);
      if (config.probeUrl() != null) {
        runProbe(root, config);
      }
      orchestrator.runUntilCancelled();
      log.info("{} session stopped", mode);
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("{} session I/O failure", mode, ex);
      return ExitCode.IO_ERROR;
    } catch (StorageFault ex) {
      log.error("Capture store unavailable at {}", config.database(), ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("{} session configuration error: {}", mode, ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in {} session", mode, ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      finished.countDown();
      removeHook(hook);
    }
  }

  private static void runProbe(CompositionRoot root, CaptureConfig config) {
    try {
      InetSocketAddress proxy = root.proxyEngine().awaitReady(PROBE_READY_TIMEOUT);
      ProxyProbe.ProbeResult result = new ProxyProbe(proxy, config.upstreamTimeout()).probe(config.probeUrl());
      log.info("Proxy probe succeeded with status {} ({} chars)", result.statusCode(), result.bodyLength());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Proxy probe interrupted");
    } catch (IOException | IllegalStateException ex) {
      log.warn("Proxy probe of {} failed: {}", config.probeUrl(), ex.getMessage());
    }
  }

  private static void awaitQuietly(CountDownLatch finished) {
    try {
      if (!finished.await(SHUTDOWN_WAIT.toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("Capture session did not finish within {} ms", SHUTDOWN_WAIT.toMillis());
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
  }

  private static void removeHook(Thread hook) {
    try {
      Runtime.getRuntime().removeShutdownHook(hook);
    } catch (IllegalStateException ex) {
      log.debug("JVM shutdown in progress; shutdown hook stays registered");
    }
  }
}
