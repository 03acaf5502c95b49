package ca.gc.cra.dualtap.application.capture;

import ca.gc.cra.dualtap.domain.capture.CaptureSummary;
import ca.gc.cra.dualtap.domain.capture.ScrapedArtifactRecord;
import ca.gc.cra.dualtap.domain.capture.StoredArtifact;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders a {@link CaptureSummary} as console lines: three counts, then recent titles. Titles longer than
 * {@value #TITLE_PREVIEW_CHARS} code points are cut and suffixed with {@code ...}.
 *
 * @since 0.1.0
 */
public final class CaptureReportFormatter {
  static final int TITLE_PREVIEW_CHARS = 80;

  /**
   * Formats a summary.
   *
   * @param summary store aggregate
   * @return printable lines
   */
  public List<String> format(CaptureSummary summary) {
    List<String> lines = new ArrayList<>();
    lines.add("Capture statistics:");
    lines.add("  Network requests: " + summary.trafficCount());
    lines.add("  Hook events: " + summary.hookCount());
    lines.add("  Scraped articles: " + summary.artifactCount());
    if (!summary.recentArtifacts().isEmpty()) {
      lines.add("  Recent articles:");
      for (StoredArtifact artifact : summary.recentArtifacts()) {
        lines.add("    - " + preview(artifact.title()));
      }
    }
    return lines;
  }

  static String preview(String title) {
    String clipped = ScrapedArtifactRecord.clip(title, TITLE_PREVIEW_CHARS);
    return clipped.equals(title) ? title : clipped + "...";
  }
}
