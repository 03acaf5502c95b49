package ca.gc.cra.dualtap.infrastructure.instrument;

import ca.gc.cra.dualtap.application.port.InstrumentationDevice;
import ca.gc.cra.dualtap.application.port.InstrumentationEngine;
import ca.gc.cra.dualtap.application.port.InstrumentationException;
import ca.gc.cra.dualtap.application.port.InstrumentationScript;
import ca.gc.cra.dualtap.application.port.InstrumentationSession;
import ca.gc.cra.dualtap.application.port.ProcessNotFoundException;
import ca.gc.cra.dualtap.domain.instrument.InstrumentationMessage;
import ca.gc.cra.dualtap.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.dualtap.infrastructure.json.JsonSupport;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Pseudo instrumentation engine that replays a recording of engine messages.
 * <p><strong>Why:</strong> Lets a capture session correlate previously recorded hook output with live traffic, and lets
 * the attach and delivery paths run without a device.</p>
 * <p><strong>Recording format:</strong> newline-delimited JSON, one wire message per line
 * ({@code {"type":"send","payload":{...}}} or {@code {"type":"error","description":...,"stack":...}}). Blank lines
 * are skipped; malformed lines are logged and skipped.</p>
 * <p><strong>Processes:</strong> only the configured process names are "running". Spawning any program succeeds and
 * yields a fresh pid.</p>
 * <p><strong>Thread-safety:</strong> Messages are delivered on a dedicated daemon thread per loaded script.</p>
 *
 * @since 0.1.0
 */
public final class ReplayInstrumentationEngine implements InstrumentationEngine {
  private static final Logger log = LoggerFactory.getLogger(ReplayInstrumentationEngine.class);

  private final Path recording;
  private final Set<String> runningProcesses;
  private final Duration messageDelay;
  private final JsonSupport json = new JsonSupport();
  private final AtomicInteger nextPid = new AtomicInteger(4_000);
  private final Map<Integer, String> spawned = new ConcurrentHashMap<>();
  private final ThreadFactory deliveryThreads = ExecutorFactories.daemonThreadFactory("dualtap-replay",
      (thread, ex) -> log.error("Uncaught failure on {}", thread.getName(), ex));
  private volatile CountDownLatch lastReplay = new CountDownLatch(0);

  /**
   * @param recording NDJSON recording
   * @param runningProcesses process names that can be attached by name
   * @param messageDelay pause between delivered messages
   */
  public ReplayInstrumentationEngine(Path recording, Set<String> runningProcesses, Duration messageDelay) {
    this.recording = Objects.requireNonNull(recording, "recording");
    this.runningProcesses = Set.copyOf(Objects.requireNonNull(runningProcesses, "runningProcesses"));
    this.messageDelay = Objects.requireNonNull(messageDelay, "messageDelay");
  }

  @Override
  public InstrumentationDevice findDevice(Duration timeout) throws InstrumentationException {
    if (!Files.isReadable(recording)) {
      throw new InstrumentationException("replay recording not readable: " + recording);
    }
    return new ReplayDevice();
  }

  /**
   * Waits for the most recently loaded script to finish replaying.
   *
   * @param timeout maximum wait
   * @return {@code true} if the replay completed in time
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean awaitReplay(Duration timeout) throws InterruptedException {
    return lastReplay.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  private final class ReplayDevice implements InstrumentationDevice {
    @Override
    public String id() {
      return "replay:" + recording.getFileName();
    }

    @Override
    public InstrumentationSession attach(String processName) throws InstrumentationException {
      if (!runningProcesses.contains(processName)) {
        throw new ProcessNotFoundException(processName);
      }
      return new ReplaySession(processName);
    }

    @Override
    public InstrumentationSession attach(int pid) throws InstrumentationException {
      String program = spawned.get(pid);
      if (program == null) {
        throw new InstrumentationException("no spawned process with pid " + pid);
      }
      return new ReplaySession(program + "#" + pid);
    }

    @Override
    public int spawn(String program) {
      int pid = nextPid.incrementAndGet();
      spawned.put(pid, program);
      log.info("Replay device spawned {} as pid {}", program, pid);
      return pid;
    }

    @Override
    public void resume(int pid) throws InstrumentationException {
      if (!spawned.containsKey(pid)) {
        throw new InstrumentationException("no spawned process with pid " + pid);
      }
    }
  }

  private final class ReplaySession implements InstrumentationSession {
    private final String target;
    private volatile ReplayScript script;

    private ReplaySession(String target) {
      this.target = target;
    }

    @Override
    public InstrumentationScript createScript(String source) throws InstrumentationException {
      if (source == null || source.isBlank()) {
        throw new InstrumentationException("hook script source is empty");
      }
      ReplayScript created = new ReplayScript(target);
      this.script = created;
      return created;
    }

    @Override
    public void detach() {
      ReplayScript current = script;
      if (current != null) {
        current.unload();
      }
    }
  }

  private final class ReplayScript implements InstrumentationScript {
    private final String target;
    private final AtomicBoolean running = new AtomicBoolean();
    private volatile Consumer<InstrumentationMessage> handler = message -> {};
    private volatile Thread delivery;

    private ReplayScript(String target) {
      this.target = target;
    }

    @Override
    public void onMessage(Consumer<InstrumentationMessage> handler) {
      this.handler = Objects.requireNonNull(handler, "handler");
    }

    @Override
    public void load() throws InstrumentationException {
      if (!running.compareAndSet(false, true)) {
        throw new InstrumentationException("script already loaded");
      }
      CountDownLatch done = new CountDownLatch(1);
      lastReplay = done;
      Thread thread = deliveryThreads.newThread(() -> replay(done));
      delivery = thread;
      thread.start();
    }

    @Override
    public void unload() {
      if (running.compareAndSet(true, false)) {
        Thread thread = delivery;
        if (thread != null) {
          thread.interrupt();
        }
      }
    }

    private void replay(CountDownLatch done) {
      int delivered = 0;
      int lineNumber = 0;
      try (BufferedReader reader = Files.newBufferedReader(recording, StandardCharsets.UTF_8)) {
        String line;
        while (running.get() && (line = reader.readLine()) != null) {
          lineNumber++;
          if (line.isBlank()) {
            continue;
          }
          InstrumentationMessage message;
          try {
            message = InstrumentationMessage.fromRaw(json.parseObject(line));
          } catch (IllegalArgumentException ex) {
            log.warn("Skipping malformed replay line {} of {}: {}", lineNumber, recording, ex.getMessage());
            continue;
          }
          handler.accept(message);
          delivered++;
          if (!messageDelay.isZero()) {
            Thread.sleep(messageDelay.toMillis());
          }
        }
        log.info("Replayed {} messages into {}", delivered, target);
      } catch (IOException ex) {
        log.warn("Replay of {} stopped: {}", recording, ex.getMessage());
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        log.debug("Replay into {} interrupted after {} messages", target, delivered);
      } finally {
        done.countDown();
      }
    }
  }
}
