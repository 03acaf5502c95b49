package ca.gc.cra.dualtap.config;

import ca.gc.cra.dualtap.application.capture.AttachSettings;
import ca.gc.cra.dualtap.application.capture.CaptureOrchestrator;
import ca.gc.cra.dualtap.application.capture.HookMessageNormalizer;
import ca.gc.cra.dualtap.application.capture.InstrumentationCaptureUseCase;
import ca.gc.cra.dualtap.application.capture.TargetHostMatcher;
import ca.gc.cra.dualtap.application.capture.TrafficCaptureUseCase;
import ca.gc.cra.dualtap.application.port.ClockPort;
import ca.gc.cra.dualtap.application.port.ContentExtractor;
import ca.gc.cra.dualtap.application.port.EventStorePort;
import ca.gc.cra.dualtap.application.port.InstrumentationEngine;
import ca.gc.cra.dualtap.application.port.MetricsPort;
import ca.gc.cra.dualtap.application.port.ReportSink;
import ca.gc.cra.dualtap.infrastructure.extract.RegexTitleExtractor;
import ca.gc.cra.dualtap.infrastructure.instrument.DisabledInstrumentationEngine;
import ca.gc.cra.dualtap.infrastructure.instrument.HookPayloads;
import ca.gc.cra.dualtap.infrastructure.instrument.ReplayInstrumentationEngine;
import ca.gc.cra.dualtap.infrastructure.persistence.jdbc.JdbcEventStore;
import ca.gc.cra.dualtap.infrastructure.proxy.HttpForwardProxyEngine;
import ca.gc.cra.dualtap.infrastructure.time.SystemClockAdapter;
import java.io.IOException;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * <strong>What:</strong> Central composition root that wires DUALTAP use cases to concrete adapters.
 * <p><strong>Why:</strong> Provides a single place to translate a {@link CaptureConfig} into a runnable capture
 * session; nothing else in the code base constructs adapters or holds global state.</p>
 * <p><strong>Role:</strong> Adapter composition root spanning proxy, instrumentation, event store and reporting.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Open and initialize the shared event store exactly once.</li>
 *   <li>Select the instrumentation engine named by the configuration.</li>
 *   <li>Construct the orchestrator with or without the instrumentation channel.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Construct and use on the CLI thread during start-up; {@link #close()} may run
 * from a shutdown hook.</p>
 * <p><strong>Observability:</strong> Supplies the metrics port to every adapter it builds.</p>
 *
 * @since 0.1.0
 * @see CaptureOrchestrator
 */
public final class CompositionRoot implements AutoCloseable {
  private final CaptureConfig config;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final Supplier<EventStorePort> storeFactory;

  private EventStorePort store;
  private HttpForwardProxyEngine proxyEngine;

  /**
   * Creates a composition root backed by the configured H2 file database.
   *
   * @param config validated capture configuration
   * @param metrics metrics adapter shared by all use cases
   */
  public CompositionRoot(CaptureConfig config, MetricsPort metrics) {
    this(config, metrics, new SystemClockAdapter(),
        () -> JdbcEventStore.forFile(config.database(), metrics));
  }

  /**
   * Creates a composition root with explicit clock and store factory, used by tests to substitute in-memory stores.
   *
   * @param config validated capture configuration
   * @param metrics metrics adapter shared by all use cases
   * @param clock timestamp source
   * @param storeFactory creates the (uninitialized) event store on first use
   */
  public CompositionRoot(
      CaptureConfig config, MetricsPort metrics, ClockPort clock, Supplier<EventStorePort> storeFactory) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.clock = Objects.requireNonNull(clock, "clock");
    this.storeFactory = Objects.requireNonNull(storeFactory, "storeFactory");
  }

  /**
   * Returns the shared event store, opening and initializing it on first call.
   *
   * @return initialized store
   */
  public synchronized EventStorePort eventStore() {
    if (store == null) {
      EventStorePort created = storeFactory.get();
      created.initialize();
      store = created;
    }
    return store;
  }

  /**
   * Returns the proxy engine bound to the configured address, creating it on first call.
   *
   * @return proxy engine
   */
  public synchronized HttpForwardProxyEngine proxyEngine() {
    if (proxyEngine == null) {
      proxyEngine = new HttpForwardProxyEngine(
          config.listenHost(), config.listenPort(), config.upstreamTimeout(), metrics);
    }
    return proxyEngine;
  }

  /**
   * Builds the traffic adapter over the shared store.
   *
   * @return traffic capture use case
   */
  public TrafficCaptureUseCase trafficCapture() {
    ContentExtractor extractor = new RegexTitleExtractor();
    TargetHostMatcher matcher = new TargetHostMatcher(new LinkedHashSet<>(config.targetDomains()));
    return new TrafficCaptureUseCase(eventStore(), extractor, matcher, config.marker(), clock, metrics);
  }

  /**
   * Selects the instrumentation engine named by {@link CaptureConfig#instrumentation()}.
   *
   * @return engine adapter
   */
  public InstrumentationEngine instrumentationEngine() {
    return switch (config.instrumentation()) {
      case NONE -> new DisabledInstrumentationEngine();
      case REPLAY -> new ReplayInstrumentationEngine(
          config.replayFile(), new LinkedHashSet<>(config.replayProcesses()), config.replayDelay());
    };
  }

  /**
   * Builds the instrumentation adapter, loading the hook script from {@link CaptureConfig#hookScript()} or the
   * bundled resource.
   *
   * @param engine engine to attach through
   * @return instrumentation capture use case
   * @throws IOException if the hook script cannot be read
   */
  public InstrumentationCaptureUseCase instrumentationCapture(InstrumentationEngine engine) throws IOException {
    AttachSettings settings = new AttachSettings(
        config.deviceTimeout(),
        config.fallbackProcesses(),
        config.spawnTarget(),
        HookPayloads.load(config.hookScript()));
    return new InstrumentationCaptureUseCase(
        engine, eventStore(), new HookMessageNormalizer(), settings, clock, metrics);
  }

  /**
   * Builds the orchestrator for a capture session.
   *
   * @param withInstrumentation {@code false} for proxy-only sessions
   * @param reportSink destination for periodic summaries
   * @return orchestrator ready to {@link CaptureOrchestrator#start()}
   * @throws IOException if the hook script cannot be read
   */
  public CaptureOrchestrator captureOrchestrator(boolean withInstrumentation, ReportSink reportSink)
      throws IOException {
    InstrumentationCaptureUseCase instrumentation =
        withInstrumentation ? instrumentationCapture(instrumentationEngine()) : null;
    return new CaptureOrchestrator(
        proxyEngine(),
        trafficCapture(),
        instrumentation,
        config.process(),
        eventStore(),
        reportSink,
        new CaptureOrchestrator.Settings(config.proxyGrace(), config.reportInterval()));
  }

  /** @return metrics adapter shared by all use cases */
  public MetricsPort metrics() {
    return metrics;
  }

  /** Closes the event store if it was opened. */
  @Override
  public synchronized void close() {
    if (store != null) {
      store.close();
    }
  }
}
