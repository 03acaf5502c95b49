package ca.gc.cra.dualtap.application.port;

import ca.gc.cra.dualtap.domain.capture.CaptureSummary;
import ca.gc.cra.dualtap.domain.capture.HookRecord;
import ca.gc.cra.dualtap.domain.capture.NetworkTrafficRecord;
import ca.gc.cra.dualtap.domain.capture.RecordKind;
import ca.gc.cra.dualtap.domain.capture.ScrapedArtifactRecord;
import ca.gc.cra.dualtap.domain.capture.StoredArtifact;
import java.util.List;

/**
 * <strong>What:</strong> Durable, append-only store shared by the traffic and instrumentation adapters.
 * <p><strong>Why:</strong> Both capture channels write concurrently into one time-ordered record that the reporting
 * loop reads back.</p>
 * <p><strong>Role:</strong> Output port; the production adapter is
 * {@link ca.gc.cra.dualtap.infrastructure.persistence.jdbc.JdbcEventStore}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Insert each record as its own atomic unit and return the generated identifier.</li>
 *   <li>Serialize concurrent appends so that {@code N} appends yield exactly {@code N} rows.</li>
 *   <li>Answer counts and recent-artifact queries without blocking writers.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent use.</p>
 * <p><strong>Observability:</strong> Failures surface as {@link StorageFault}; implementations do not retry.</p>
 *
 * @since 0.1.0
 */
public interface EventStorePort extends AutoCloseable {
  /**
   * Creates the backing schema when missing. Idempotent.
   *
   * @throws StorageFault if the medium is unavailable
   */
  void initialize();

  /**
   * Appends a traffic row.
   *
   * @param record row to persist
   * @return generated identifier
   * @throws StorageFault if the insert fails
   */
  long append(NetworkTrafficRecord record);

  /**
   * Appends a hook row.
   *
   * @param record row to persist
   * @return generated identifier
   * @throws StorageFault if the insert fails
   */
  long append(HookRecord record);

  /**
   * Appends an artifact row.
   *
   * @param record row to persist
   * @return generated identifier
   * @throws StorageFault if the insert fails
   */
  long append(ScrapedArtifactRecord record);

  /**
   * Counts rows of the given kind.
   *
   * @param kind row kind
   * @return number of rows
   * @throws StorageFault if the query fails
   */
  long count(RecordKind kind);

  /**
   * Returns the newest artifacts, ordered by timestamp then identifier, descending.
   *
   * @param limit maximum rows; non-positive values yield an empty list
   * @return newest artifacts first
   * @throws StorageFault if the query fails
   */
  List<StoredArtifact> recentArtifacts(int limit);

  /**
   * Builds a summary from the three counts and the most recent artifacts.
   *
   * @param recentLimit number of recent artifacts to include
   * @return immutable summary
   * @throws StorageFault if any query fails
   */
  default CaptureSummary summary(int recentLimit) {
    return new CaptureSummary(
        count(RecordKind.NETWORK_TRAFFIC),
        count(RecordKind.HOOK),
        count(RecordKind.SCRAPED_ARTIFACT),
        recentArtifacts(recentLimit));
  }

  /**
   * Releases the medium. Idempotent.
   */
  @Override
  void close();
}
