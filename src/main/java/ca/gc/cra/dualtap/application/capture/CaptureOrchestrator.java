package ca.gc.cra.dualtap.application.capture;

import ca.gc.cra.dualtap.application.port.EventStorePort;
import ca.gc.cra.dualtap.application.port.ReportSink;
import ca.gc.cra.dualtap.application.port.StorageFault;
import ca.gc.cra.dualtap.application.port.TrafficInterceptionEngine;
import ca.gc.cra.dualtap.application.port.TrafficListener;
import ca.gc.cra.dualtap.domain.capture.CaptureSummary;
import ca.gc.cra.dualtap.infrastructure.exec.ExecutorFactories;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Starts the interception engine and the instrumentation adapter, then reports store contents
 * on a fixed interval until cancelled.
 * <p><strong>Why:</strong> The two capture channels have independent lifecycles; the orchestrator degrades to
 * traffic-only capture when instrumentation cannot attach instead of aborting the session.</p>
 * <p><strong>Thread-safety:</strong> {@link #cancel()} and {@link #close()} may be called from any thread, including a
 * JVM shutdown hook; {@link #start()} and {@link #runUntilCancelled()} are meant for the CLI thread.</p>
 * <p><strong>Observability:</strong> MDC key {@code pipeline} is {@code report} while summaries are produced.</p>
 *
 * @since 0.1.0
 */
public final class CaptureOrchestrator implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CaptureOrchestrator.class);

  static final int RECENT_ARTIFACTS = 3;
  private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

  private final TrafficInterceptionEngine proxyEngine;
  private final TrafficListener trafficListener;
  private final InstrumentationCaptureUseCase instrumentation;
  private final String targetProcess;
  private final EventStorePort store;
  private final ReportSink reportSink;
  private final Settings settings;

  private final CountDownLatch cancelled = new CountDownLatch(1);
  private final AtomicBoolean started = new AtomicBoolean();
  private final AtomicBoolean closed = new AtomicBoolean();
  private final AtomicReference<Exception> engineFailure = new AtomicReference<>();
  private volatile ExecutorService engineExecutor;

  /**
   * @param proxyEngine interception engine
   * @param trafficListener traffic adapter receiving engine callbacks
   * @param instrumentation instrumentation adapter; {@code null} runs proxy-only
   * @param targetProcess explicit process name; {@code null} for fallback selection
   * @param store event store read by reports
   * @param reportSink destination for summaries
   * @param settings timing settings
   */
  public CaptureOrchestrator(
      TrafficInterceptionEngine proxyEngine,
      TrafficListener trafficListener,
      InstrumentationCaptureUseCase instrumentation,
      String targetProcess,
      EventStorePort store,
      ReportSink reportSink,
      Settings settings) {
    this.proxyEngine = Objects.requireNonNull(proxyEngine, "proxyEngine");
    this.trafficListener = Objects.requireNonNull(trafficListener, "trafficListener");
    this.instrumentation = instrumentation;
    this.targetProcess = targetProcess;
    this.store = Objects.requireNonNull(store, "store");
    this.reportSink = Objects.requireNonNull(reportSink, "reportSink");
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  /**
   * Launches the engine loop on a daemon thread, waits the proxy grace period, then attaches instrumentation.
   *
   * @return capability the session is running with
   * @throws IllegalStateException if already started
   */
  public CaptureMode start() {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("orchestrator already started");
    }
    ExecutorService executor = ExecutorFactories.newEngineExecutor("dualtap-proxy",
        (thread, ex) -> log.error("Uncaught failure on {}", thread.getName(), ex));
    this.engineExecutor = executor;
    executor.execute(this::runEngine);

    try {
      if (cancelled.await(settings.proxyGrace().toMillis(), TimeUnit.MILLISECONDS)) {
        log.info("Cancelled during proxy start-up");
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for the proxy to start");
    }

    if (instrumentation == null) {
      log.info("Instrumentation disabled; capturing traffic only");
      return CaptureMode.PROXY_ONLY;
    }
    AttachOutcome outcome = instrumentation.attach(targetProcess);
    if (outcome.success()) {
      log.info("Capture running in FULL mode (target {})", outcome.target());
      return CaptureMode.FULL;
    }
    log.warn("Instrumentation unavailable ({}); continuing with traffic capture only",
        outcome.fault().getMessage());
    return CaptureMode.TRAFFIC_ONLY;
  }

  /**
   * Reads a summary and publishes it. Store failures are logged and reported as empty.
   *
   * @return the published summary, or empty if the store could not be read
   */
  public Optional<CaptureSummary> report() {
    MDC.put("pipeline", "report");
    try {
      CaptureSummary summary = store.summary(RECENT_ARTIFACTS);
      reportSink.publish(summary);
      return Optional.of(summary);
    } catch (StorageFault fault) {
      log.warn("Capture report skipped: {}", fault.getMessage(), fault);
      return Optional.empty();
    } finally {
      MDC.remove("pipeline");
    }
  }

  /**
   * Reports every interval until {@link #cancel()} is called or the thread is interrupted, then reports once more.
   */
  public void runUntilCancelled() {
    long intervalMillis = settings.reportInterval().toMillis();
    try {
      while (!cancelled.await(intervalMillis, TimeUnit.MILLISECONDS)) {
        report();
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.info("Report loop interrupted");
    }
    report();
  }

  /** Requests the report loop to stop at its next wake-up. */
  public void cancel() {
    cancelled.countDown();
  }

  /** @return {@code true} once {@link #cancel()} has been called */
  public boolean isCancelled() {
    return cancelled.getCount() == 0;
  }

  /** @return failure raised by the engine loop, if it terminated abnormally */
  public Optional<Exception> engineFailure() {
    return Optional.ofNullable(engineFailure.get());
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    cancel();
    proxyEngine.stop();
    if (instrumentation != null) {
      instrumentation.detach();
    }
    ExecutorService executor = engineExecutor;
    if (executor != null) {
      executor.shutdown();
      try {
        if (!executor.awaitTermination(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
          log.warn("Proxy engine did not stop within {} ms", SHUTDOWN_TIMEOUT.toMillis());
          executor.shutdownNow();
        }
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        executor.shutdownNow();
      }
    }
  }

  private void runEngine() {
    MDC.put("pipeline", "traffic");
    try {
      proxyEngine.run(trafficListener);
    } catch (Exception ex) {
      engineFailure.set(ex);
      log.error("Interception engine stopped with an error", ex);
    } finally {
      MDC.remove("pipeline");
    }
  }

  /**
   * Orchestrator timing.
   *
   * @param proxyGrace delay between launching the engine and attaching instrumentation
   * @param reportInterval delay between periodic reports
   */
  public record Settings(Duration proxyGrace, Duration reportInterval) {
    /** Defaults: 2 s grace, 10 s report interval. */
    public static final Settings DEFAULTS = new Settings(Duration.ofSeconds(2), Duration.ofSeconds(10));

    public Settings {
      Objects.requireNonNull(proxyGrace, "proxyGrace");
      Objects.requireNonNull(reportInterval, "reportInterval");
      if (proxyGrace.isNegative()) {
        throw new IllegalArgumentException("proxyGrace must not be negative");
      }
      if (reportInterval.isZero() || reportInterval.isNegative()) {
        throw new IllegalArgumentException("reportInterval must be positive");
      }
    }
  }
}
