package ca.gc.cra.dualtap.infrastructure.extract;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.dualtap.application.port.ContentExtractor.ExtractedTitle;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class RegexTitleExtractorTest {
  private final RegexTitleExtractor extractor = new RegexTitleExtractor();

  @Test
  void titleTagWins() {
    Optional<ExtractedTitle> title = extractor.extract(
        "<html><head><TITLE>Hello World Example</TITLE></head><body><h1>Another heading</h1></body></html>");

    assertEquals(new ExtractedTitle("Hello World Example", "html_title"), title.orElseThrow());
  }

  @Test
  void innerMarkupIsStrippedAndWhitespaceTrimmed() {
    Optional<ExtractedTitle> title = extractor.extract("<h1 class=\"story\">\n  <a href=\"/x\">Flood waters <b>rise</b></a>\n</h1>");

    assertEquals(new ExtractedTitle("Flood waters rise", "html_h1"), title.orElseThrow());
  }

  @Test
  void shortCandidatesFallThroughToHeadings() {
    Optional<ExtractedTitle> title = extractor.extract(
        "<title>Dawn</title><h1>Tiny</h1><h2>Budget debate continues</h2>");

    assertEquals(new ExtractedTitle("Budget debate continues", "html_h2"), title.orElseThrow());
  }

  @Test
  void laterMatchOfSamePatternIsConsidered() {
    Optional<ExtractedTitle> title = extractor.extract("<h1>Short</h1><h1>A much longer headline</h1>");

    assertEquals("A much longer headline", title.orElseThrow().title());
  }

  @Test
  void tenCharactersIsTooShort() {
    assertTrue(extractor.extract("<title>0123456789</title>").isEmpty());
    assertEquals("01234567890", extractor.extract("<title>01234567890</title>").orElseThrow().title());
  }

  @Test
  void longTitlesAreCutTo500Characters() {
    String body = "<title>" + "x".repeat(700) + "</title>";

    assertEquals(500, extractor.extract(body).orElseThrow().title().length());
  }

  @Test
  void cutKeepsSupplementaryCharactersWhole() {
    String body = "<title>" + "\uD83D\uDCF0".repeat(600) + "</title>";

    String title = extractor.extract(body).orElseThrow().title();

    assertEquals(500, title.codePointCount(0, title.length()));
    assertEquals(1000, title.length());
  }

  @Test
  void missesAreEmpty() {
    assertTrue(extractor.extract(null).isEmpty());
    assertTrue(extractor.extract("").isEmpty());
    assertTrue(extractor.extract("<p>no headings at all</p>").isEmpty());
    assertTrue(extractor.extract("<title>unterminated title that is long").isEmpty());
  }
}
