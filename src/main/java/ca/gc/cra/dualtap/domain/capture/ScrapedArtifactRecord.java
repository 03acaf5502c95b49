package ca.gc.cra.dualtap.domain.capture;

import java.time.Instant;
import java.util.Objects;

/**
 * Content artifact extracted from an HTML response body.
 *
 * @param timestamp extraction instant
 * @param title extracted title, at most {@value #MAX_TITLE_LENGTH} code points
 * @param url URL of the response the title came from
 * @param content optional extracted content; unused by the default extractor
 * @param metadata optional extractor metadata
 * @param extractionMethod tag naming the strategy that matched, e.g. {@code html_title}
 * @since 0.1.0
 */
public record ScrapedArtifactRecord(
    Instant timestamp,
    String title,
    String url,
    String content,
    String metadata,
    String extractionMethod) {

  /** Upper bound on persisted title length, in code points. */
  public static final int MAX_TITLE_LENGTH = 500;

  public ScrapedArtifactRecord {
    Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(title, "title");
    Objects.requireNonNull(extractionMethod, "extractionMethod");
    title = clip(title, MAX_TITLE_LENGTH);
  }

  /**
   * Cuts {@code text} to at most {@code maxCodePoints} code points without splitting a surrogate pair.
   *
   * @param text text to cut
   * @param maxCodePoints upper bound, non-negative
   * @return {@code text} itself when short enough, otherwise its leading code points
   */
  public static String clip(String text, int maxCodePoints) {
    if (text.length() <= maxCodePoints || text.codePointCount(0, text.length()) <= maxCodePoints) {
      return text;
    }
    return text.substring(0, text.offsetByCodePoints(0, maxCodePoints));
  }
}
