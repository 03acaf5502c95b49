package ca.gc.cra.dualtap.application.capture;

import ca.gc.cra.dualtap.application.port.ClockPort;
import ca.gc.cra.dualtap.application.port.EventStorePort;
import ca.gc.cra.dualtap.application.port.InstrumentationDevice;
import ca.gc.cra.dualtap.application.port.InstrumentationEngine;
import ca.gc.cra.dualtap.application.port.InstrumentationException;
import ca.gc.cra.dualtap.application.port.InstrumentationScript;
import ca.gc.cra.dualtap.application.port.InstrumentationSession;
import ca.gc.cra.dualtap.application.port.MetricsPort;
import ca.gc.cra.dualtap.application.port.ProcessNotFoundException;
import ca.gc.cra.dualtap.domain.capture.HookRecord;
import ca.gc.cra.dualtap.domain.instrument.InstrumentationMessage;
import ca.gc.cra.dualtap.logging.Logs;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Instrumentation adapter that attaches hook code to a target process and records every hook
 * message it emits.
 * <p><strong>Why:</strong> Runtime hooks see events the proxy cannot, such as in-app WebView loads; storing them next to
 * the traffic rows lets both channels be read as one timeline.</p>
 * <p><strong>Attach selection:</strong> an explicit process name is tried once and any failure is terminal. Without a
 * name, each fallback candidate is tried in order; only {@link ProcessNotFoundException} moves on to the next one.
 * When every candidate is absent the spawn target is started suspended, attached by pid and resumed. Nothing is
 * retried.</p>
 * <p><strong>Thread-safety:</strong> {@link #attach(String)} and {@link #detach()} are serialized on this instance.
 * {@link #onMessage(InstrumentationMessage)} runs on the engine's delivery thread concurrently with proxy callbacks.</p>
 * <p><strong>Observability:</strong> Emits {@code instrumentation.*} counters; MDC key {@code pipeline} is
 * {@code instrumentation} while messages are handled.</p>
 *
 * @since 0.1.0
 */
public final class InstrumentationCaptureUseCase {
  private static final Logger log = LoggerFactory.getLogger(InstrumentationCaptureUseCase.class);

  private static final String PIPELINE = "instrumentation";
  private static final int LOG_PAYLOAD_CHARS = 256;

  private final InstrumentationEngine engine;
  private final EventStorePort store;
  private final HookMessageNormalizer normalizer;
  private final AttachSettings settings;
  private final ClockPort clock;
  private final MetricsPort metrics;

  private final AtomicReference<AttachState> state = new AtomicReference<>(AttachState.IDLE);
  private volatile InstrumentationSession session;
  private volatile InstrumentationScript script;

  /**
   * @param engine instrumentation toolkit
   * @param store event store receiving hook rows
   * @param normalizer payload normalizer
   * @param settings attach parameters
   * @param clock timestamp source
   * @param metrics metrics sink
   */
  public InstrumentationCaptureUseCase(
      InstrumentationEngine engine,
      EventStorePort store,
      HookMessageNormalizer normalizer,
      AttachSettings settings,
      ClockPort clock,
      MetricsPort metrics) {
    this.engine = Objects.requireNonNull(engine, "engine");
    this.store = Objects.requireNonNull(store, "store");
    this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Attaches to {@code processName}, or selects a target from the fallback list when {@code null}.
   *
   * @param processName explicit process name; {@code null} or blank for fallback selection
   * @return outcome describing the target or the terminal fault
   * @throws IllegalStateException if the adapter is already {@link AttachState#ACTIVE}
   */
  public synchronized AttachOutcome attach(String processName) {
    if (state.get() == AttachState.ACTIVE) {
      throw new IllegalStateException("instrumentation already active");
    }
    state.set(AttachState.IDLE);
    List<String> attempts = new ArrayList<>();

    state.set(AttachState.DEVICE_LOOKUP);
    InstrumentationDevice device;
    try {
      device = engine.findDevice(settings.deviceTimeout());
    } catch (InstrumentationException | RuntimeException ex) {
      return fail("no instrumentation device within " + settings.deviceTimeout().toMillis() + " ms", ex, attempts);
    }
    log.info("Using instrumentation device {}", device.id());

    String target;
    boolean spawned = false;
    InstrumentationSession attached;
    boolean explicit = processName != null && !processName.isBlank();
    if (explicit) {
      state.set(AttachState.EXPLICIT_ATTACH);
      target = processName.trim();
      attempts.add(target);
      try {
        attached = device.attach(target);
      } catch (InstrumentationException | RuntimeException ex) {
        return fail("attach to " + target + " failed: " + ex.getMessage(), ex, attempts);
      }
    } else {
      state.set(AttachState.FALLBACK_ATTACH);
      target = null;
      attached = null;
      for (String candidate : settings.fallbackProcesses()) {
        attempts.add(candidate);
        try {
          attached = device.attach(candidate);
          target = candidate;
          break;
        } catch (ProcessNotFoundException ex) {
          log.debug("Fallback candidate {} not running", candidate);
        } catch (InstrumentationException | RuntimeException ex) {
          return fail("attach to " + candidate + " failed: " + ex.getMessage(), ex, attempts);
        }
      }
      if (attached == null) {
        state.set(AttachState.SPAWN);
        String program = settings.spawnTarget();
        try {
          int pid = device.spawn(program);
          attached = device.attach(pid);
          device.resume(pid);
          target = program + " (pid " + pid + ")";
          spawned = true;
        } catch (InstrumentationException | RuntimeException ex) {
          if (attached != null) {
            detachQuietly(attached);
          }
          return fail("spawn of " + program + " failed: " + ex.getMessage(), ex, attempts);
        }
      }
    }

    state.set(AttachState.SCRIPTED);
    InstrumentationScript loaded;
    try {
      loaded = attached.createScript(settings.hookSource());
      loaded.onMessage(this::onMessage);
      loaded.load();
    } catch (InstrumentationException | RuntimeException ex) {
      detachQuietly(attached);
      return fail("hook script failed to load into " + target + ": " + ex.getMessage(), ex, attempts);
    }

    this.session = attached;
    this.script = loaded;
    state.set(AttachState.ACTIVE);
    metrics.increment(spawned ? "instrumentation.attach.spawned" : "instrumentation.attach.success");
    log.info("Instrumentation active on {}{}", target, spawned ? " (spawned)" : "");
    return AttachOutcome.attached(target, spawned, attempts);
  }

  /**
   * Handles one message from the hook script. Never throws.
   *
   * @param message engine message
   */
  public void onMessage(InstrumentationMessage message) {
    MDC.put("pipeline", PIPELINE);
    try {
      switch (message.kind()) {
        case SEND -> {
          HookRecord record = normalizer.normalize(message.payload(), clock.now());
          long id = store.append(record);
          metrics.increment("instrumentation.hook.recorded");
          log.debug("Recorded hook #{} {} {}", id, record.hookType(), record.functionName());
        }
        case ERROR -> {
          metrics.increment("instrumentation.script.error");
          log.warn("Hook script error: {}{}", message.payload(),
              message.stack() == null ? "" : System.lineSeparator() + message.stack());
        }
        default -> log.debug("Hook script {}: {}", message.kind(),
            Logs.truncate(String.valueOf(message.payload()), LOG_PAYLOAD_CHARS));
      }
    } catch (Exception ex) {
      metrics.increment("instrumentation.callback.error");
      log.warn("Failed to record hook message {}", message.kind(), ex);
    } finally {
      MDC.remove("pipeline");
    }
  }

  /** Unloads the script and detaches the session; safe to call repeatedly or before any attach. */
  public synchronized void detach() {
    InstrumentationScript currentScript = this.script;
    InstrumentationSession currentSession = this.session;
    this.script = null;
    this.session = null;
    if (currentScript != null) {
      try {
        currentScript.unload();
      } catch (InstrumentationException | RuntimeException ex) {
        log.warn("Failed to unload hook script", ex);
      }
    }
    if (currentSession != null) {
      detachQuietly(currentSession);
      log.info("Instrumentation detached");
    }
    if (state.get() == AttachState.ACTIVE) {
      state.set(AttachState.IDLE);
    }
  }

  /** @return current attach state */
  public AttachState state() {
    return state.get();
  }

  private AttachOutcome fail(String message, Throwable cause, List<String> attempts) {
    AttachFault fault = new AttachFault(state.get(), message, cause);
    state.set(AttachState.FAILED);
    metrics.increment("instrumentation.attach.failed");
    log.warn("Instrumentation attach failed in {}: {}", fault.failedIn(), message);
    return AttachOutcome.failed(fault, attempts);
  }

  private static void detachQuietly(InstrumentationSession target) {
    try {
      target.detach();
    } catch (InstrumentationException | RuntimeException ex) {
      log.warn("Failed to detach instrumentation session", ex);
    }
  }
}
