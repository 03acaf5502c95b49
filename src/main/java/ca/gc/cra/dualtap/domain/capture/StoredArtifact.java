package ca.gc.cra.dualtap.domain.capture;

import java.util.Objects;

/**
 * Persisted artifact together with its store-assigned identifier.
 *
 * @param id generated row identifier
 * @param record artifact contents
 * @since 0.1.0
 */
public record StoredArtifact(long id, ScrapedArtifactRecord record) {
  public StoredArtifact {
    Objects.requireNonNull(record, "record");
  }

  /** Convenience accessor for {@code record().title()}. */
  public String title() {
    return record.title();
  }
}
