package ca.gc.cra.dualtap.domain.capture;

import java.util.List;

/**
 * <strong>What:</strong> Point-in-time aggregate of the capture store used by periodic reports.
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param trafficCount number of network traffic rows
 * @param hookCount number of hook rows
 * @param artifactCount number of scraped artifact rows
 * @param recentArtifacts newest artifacts first
 * @since 0.1.0
 */
public record CaptureSummary(
    long trafficCount, long hookCount, long artifactCount, List<StoredArtifact> recentArtifacts) {

  public CaptureSummary {
    recentArtifacts = recentArtifacts == null ? List.of() : List.copyOf(recentArtifacts);
  }

  /**
   * Returns the count recorded for {@code kind}.
   *
   * @param kind row kind
   * @return row count
   */
  public long count(RecordKind kind) {
    return switch (kind) {
      case NETWORK_TRAFFIC -> trafficCount;
      case HOOK -> hookCount;
      case SCRAPED_ARTIFACT -> artifactCount;
    };
  }
}
