package ca.gc.cra.dualtap.infrastructure.persistence.jdbc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.dualtap.application.port.MetricsPort;
import ca.gc.cra.dualtap.domain.capture.HookRecord;
import ca.gc.cra.dualtap.domain.capture.NetworkTrafficRecord;
import ca.gc.cra.dualtap.domain.capture.RecordKind;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class JdbcEventStoreConcurrencyTest {
  private static final int WRITERS = 8;
  private static final int APPENDS_PER_WRITER = 25;

  @Test
  void concurrentAppendsFromBothChannelsAreAllStored() throws Exception {
    try (JdbcEventStore store = JdbcEventStore.inMemory("concurrency-" + UUID.randomUUID(), MetricsPort.NO_OP)) {
      store.initialize();
      ExecutorService pool = Executors.newFixedThreadPool(WRITERS);
      CountDownLatch go = new CountDownLatch(1);
      Set<Long> ids = ConcurrentHashMap.newKeySet();
      List<Future<?>> futures = new ArrayList<>();
      try {
        for (int w = 0; w < WRITERS; w++) {
          boolean hookWriter = w % 2 == 0;
          futures.add(pool.submit(() -> {
            go.await();
            for (int i = 0; i < APPENDS_PER_WRITER; i++) {
              Instant now = Instant.now();
              long id = hookWriter
                  ? store.append(new HookRecord(now, "webview_load", "unknown", Map.of("url", ""), null, null))
                  : store.append(NetworkTrafficRecord.request(now, "GET", "http://dawn.com/" + i, Map.of(), null));
              ids.add(id + (hookWriter ? 0 : 1_000_000L));
            }
            return null;
          }));
        }
        go.countDown();
        for (Future<?> future : futures) {
          future.get(30, TimeUnit.SECONDS);
        }
      } finally {
        pool.shutdownNow();
      }

      int perChannel = WRITERS / 2 * APPENDS_PER_WRITER;
      assertEquals(perChannel, store.count(RecordKind.HOOK));
      assertEquals(perChannel, store.count(RecordKind.NETWORK_TRAFFIC));
      assertEquals(WRITERS * APPENDS_PER_WRITER, ids.size(), "identifiers are unique per table");
      assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));
    }
  }
}
