package ca.gc.cra.dualtap.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.dualtap.application.capture.CaptureOrchestrator;
import ca.gc.cra.dualtap.application.port.EventStorePort;
import ca.gc.cra.dualtap.application.port.InstrumentationException;
import ca.gc.cra.dualtap.application.port.MetricsPort;
import ca.gc.cra.dualtap.application.port.StorageFault;
import ca.gc.cra.dualtap.domain.capture.RecordKind;
import ca.gc.cra.dualtap.infrastructure.instrument.DisabledInstrumentationEngine;
import ca.gc.cra.dualtap.infrastructure.instrument.ReplayInstrumentationEngine;
import ca.gc.cra.dualtap.infrastructure.persistence.jdbc.JdbcEventStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CompositionRootTest {

  private static CompositionRoot inMemoryRoot(CaptureConfig config, AtomicInteger opened) {
    return new CompositionRoot(config, MetricsPort.NO_OP, () -> Instant.EPOCH, () -> {
      opened.incrementAndGet();
      return JdbcEventStore.inMemory("root-" + UUID.randomUUID(), MetricsPort.NO_OP);
    });
  }

  @Test
  void storeIsOpenedOnceAndClosedWithRoot() {
    AtomicInteger opened = new AtomicInteger();
    CompositionRoot root = inMemoryRoot(CaptureConfig.defaults(), opened);

    EventStorePort store = root.eventStore();
    assertSame(store, root.eventStore());
    assertEquals(0, store.count(RecordKind.HOOK));
    root.close();

    assertEquals(1, opened.get());
    assertThrows(StorageFault.class, () -> store.count(RecordKind.HOOK));
  }

  @Test
  void closingUnopenedRootDoesNotOpenStore() {
    AtomicInteger opened = new AtomicInteger();

    inMemoryRoot(CaptureConfig.defaults(), opened).close();

    assertEquals(0, opened.get());
  }

  @Test
  void instrumentationSelectionFollowsConfig(@TempDir Path dir) throws Exception {
    Path recording = Files.writeString(dir.resolve("rec.ndjson"), "");
    CaptureConfig replay = CaptureConfig.fromMap(Map.of(
        "instrumentation", "replay", "replayFile", recording.toString()));

    try (CompositionRoot none = inMemoryRoot(CaptureConfig.defaults(), new AtomicInteger());
         CompositionRoot replaying = inMemoryRoot(replay, new AtomicInteger())) {
      assertTrue(none.instrumentationEngine() instanceof DisabledInstrumentationEngine);
      assertTrue(replaying.instrumentationEngine() instanceof ReplayInstrumentationEngine);
      assertThrows(InstrumentationException.class,
          () -> none.instrumentationEngine().findDevice(Duration.ofSeconds(1)));
    }
  }

  @Test
  void proxyEngineIsShared() {
    try (CompositionRoot root = inMemoryRoot(CaptureConfig.defaults(), new AtomicInteger())) {
      assertSame(root.proxyEngine(), root.proxyEngine());
    }
  }

  @Test
  void orchestratorReportsFromConfiguredStore() throws Exception {
    CaptureConfig config = CaptureConfig.fromMap(Map.of("listenPort", "0", "proxyGraceMs", "0"));
    try (CompositionRoot root = inMemoryRoot(config, new AtomicInteger());
         CaptureOrchestrator orchestrator = root.captureOrchestrator(false, summary -> {})) {
      assertEquals(0, orchestrator.report().orElseThrow().trafficCount());
    }
  }

  @Test
  void missingCustomHookScriptFailsInstrumentationWiring(@TempDir Path dir) {
    CaptureConfig config = CaptureConfig.fromMap(Map.of("hookScript", dir.resolve("absent.js").toString()));

    try (CompositionRoot root = inMemoryRoot(config, new AtomicInteger())) {
      assertThrows(java.io.IOException.class, () -> root.captureOrchestrator(true, summary -> {}));
    }
  }
}
