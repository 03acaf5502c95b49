package ca.gc.cra.dualtap.application.capture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.dualtap.domain.capture.CaptureSummary;
import ca.gc.cra.dualtap.domain.capture.ScrapedArtifactRecord;
import ca.gc.cra.dualtap.domain.capture.StoredArtifact;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class CaptureReportFormatterTest {
  private final CaptureReportFormatter formatter = new CaptureReportFormatter();

  private static StoredArtifact artifact(long id, String title) {
    return new StoredArtifact(id, new ScrapedArtifactRecord(
        Instant.EPOCH, title, "http://dawn.com/" + id, null, null, "html_title"));
  }

  @Test
  void emptyStoreOmitsRecentSection() {
    List<String> lines = formatter.format(new CaptureSummary(0, 0, 0, List.of()));

    assertEquals(List.of(
        "Capture statistics:",
        "  Network requests: 0",
        "  Hook events: 0",
        "  Scraped articles: 0"), lines);
  }

  @Test
  void recentTitlesAreListedAndLongOnesCut() {
    String longTitle = "L".repeat(81);
    List<String> lines = formatter.format(new CaptureSummary(4, 2, 2, List.of(
        artifact(2, "Hello World Example"), artifact(1, longTitle))));

    assertEquals("  Network requests: 4", lines.get(1));
    assertEquals("  Recent articles:", lines.get(4));
    assertEquals("    - Hello World Example", lines.get(5));
    assertEquals("    - " + "L".repeat(80) + "...", lines.get(6));
  }

  @Test
  void titleOfExactlyPreviewLengthIsNotSuffixed() {
    String title = "T".repeat(CaptureReportFormatter.TITLE_PREVIEW_CHARS);

    assertEquals(title, CaptureReportFormatter.preview(title));
  }

  @Test
  void previewNeverSplitsSurrogatePairs() {
    String title = "A" + "\uD83D\uDCF0".repeat(CaptureReportFormatter.TITLE_PREVIEW_CHARS);

    String preview = CaptureReportFormatter.preview(title);

    String kept = preview.substring(0, preview.length() - 3);
    assertEquals(CaptureReportFormatter.TITLE_PREVIEW_CHARS, kept.codePointCount(0, kept.length()));
    assertTrue(Character.isLowSurrogate(kept.charAt(kept.length() - 1)));
    assertTrue(preview.endsWith("..."));
  }
}
