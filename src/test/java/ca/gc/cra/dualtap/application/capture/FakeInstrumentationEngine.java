package ca.gc.cra.dualtap.application.capture;

import ca.gc.cra.dualtap.application.port.InstrumentationDevice;
import ca.gc.cra.dualtap.application.port.InstrumentationEngine;
import ca.gc.cra.dualtap.application.port.InstrumentationException;
import ca.gc.cra.dualtap.application.port.InstrumentationScript;
import ca.gc.cra.dualtap.application.port.InstrumentationSession;
import ca.gc.cra.dualtap.application.port.ProcessNotFoundException;
import ca.gc.cra.dualtap.domain.instrument.InstrumentationMessage;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Scriptable engine recording every device call in {@link #calls}.
 */
final class FakeInstrumentationEngine implements InstrumentationEngine {
  final List<String> calls = new CopyOnWriteArrayList<>();
  private final Set<String> running;
  boolean deviceAvailable = true;
  boolean failScriptLoad;
  boolean failResume;
  volatile Consumer<InstrumentationMessage> handler;
  volatile int unloads;
  volatile int detaches;

  FakeInstrumentationEngine(Set<String> running) {
    this.running = Set.copyOf(running);
  }

  /** Delivers a message as the engine's delivery thread would. */
  void emit(InstrumentationMessage message) {
    handler.accept(message);
  }

  @Override
  public InstrumentationDevice findDevice(Duration timeout) throws InstrumentationException {
    calls.add("findDevice");
    if (!deviceAvailable) {
      throw new InstrumentationException("no device");
    }
    return new Device();
  }

  private final class Device implements InstrumentationDevice {
    @Override
    public String id() {
      return "fake";
    }

    @Override
    public InstrumentationSession attach(String processName) throws InstrumentationException {
      calls.add("attach:" + processName);
      if (!running.contains(processName)) {
        throw new ProcessNotFoundException(processName);
      }
      return new Session();
    }

    @Override
    public InstrumentationSession attach(int pid) {
      calls.add("attachPid:" + pid);
      return new Session();
    }

    @Override
    public int spawn(String program) {
      calls.add("spawn:" + program);
      return 4242;
    }

    @Override
    public void resume(int pid) throws InstrumentationException {
      calls.add("resume:" + pid);
      if (failResume) {
        throw new InstrumentationException("process " + pid + " exited before resume");
      }
    }
  }

  private final class Session implements InstrumentationSession {
    @Override
    public InstrumentationScript createScript(String source) {
      calls.add("createScript");
      return new Script();
    }

    @Override
    public void detach() {
      calls.add("detach");
      detaches++;
    }
  }

  private final class Script implements InstrumentationScript {
    @Override
    public void onMessage(Consumer<InstrumentationMessage> messageHandler) {
      handler = messageHandler;
    }

    @Override
    public void load() throws InstrumentationException {
      calls.add("load");
      if (failScriptLoad) {
        throw new InstrumentationException("syntax error in hook script");
      }
    }

    @Override
    public void unload() {
      calls.add("unload");
      unloads++;
    }
  }
}
