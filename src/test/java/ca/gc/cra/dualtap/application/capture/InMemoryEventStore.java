package ca.gc.cra.dualtap.application.capture;

import ca.gc.cra.dualtap.application.port.EventStorePort;
import ca.gc.cra.dualtap.application.port.StorageFault;
import ca.gc.cra.dualtap.domain.capture.HookRecord;
import ca.gc.cra.dualtap.domain.capture.NetworkTrafficRecord;
import ca.gc.cra.dualtap.domain.capture.RecordKind;
import ca.gc.cra.dualtap.domain.capture.ScrapedArtifactRecord;
import ca.gc.cra.dualtap.domain.capture.StoredArtifact;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * List-backed store for use case tests. {@link #failWrites} and {@link #failReads} simulate a broken database.
 */
final class InMemoryEventStore implements EventStorePort {
  final List<NetworkTrafficRecord> traffic = new CopyOnWriteArrayList<>();
  final List<HookRecord> hooks = new CopyOnWriteArrayList<>();
  final List<StoredArtifact> artifacts = new CopyOnWriteArrayList<>();
  private final AtomicLong ids = new AtomicLong();
  volatile boolean failWrites;
  volatile boolean failReads;
  volatile boolean closed;

  @Override
  public void initialize() {}

  @Override
  public long append(NetworkTrafficRecord record) {
    checkWritable();
    traffic.add(record);
    return ids.incrementAndGet();
  }

  @Override
  public long append(HookRecord record) {
    checkWritable();
    hooks.add(record);
    return ids.incrementAndGet();
  }

  @Override
  public long append(ScrapedArtifactRecord record) {
    checkWritable();
    long id = ids.incrementAndGet();
    artifacts.add(new StoredArtifact(id, record));
    return id;
  }

  @Override
  public long count(RecordKind kind) {
    checkReadable();
    return switch (kind) {
      case NETWORK_TRAFFIC -> traffic.size();
      case HOOK -> hooks.size();
      case SCRAPED_ARTIFACT -> artifacts.size();
    };
  }

  @Override
  public List<StoredArtifact> recentArtifacts(int limit) {
    checkReadable();
    List<StoredArtifact> sorted = new ArrayList<>(artifacts);
    sorted.sort(Comparator.comparingLong(StoredArtifact::id).reversed());
    return sorted.subList(0, Math.min(Math.max(limit, 0), sorted.size()));
  }

  @Override
  public void close() {
    closed = true;
  }

  private void checkWritable() {
    if (failWrites) {
      throw new StorageFault("simulated write failure");
    }
  }

  private void checkReadable() {
    if (failReads) {
      throw new StorageFault("simulated read failure");
    }
  }
}
