package ca.gc.cra.dualtap.infrastructure.extract;

import ca.gc.cra.dualtap.application.port.ContentExtractor;
import ca.gc.cra.dualtap.domain.capture.ScrapedArtifactRecord;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Pattern-based title extraction over raw HTML.
 * <p><strong>Why:</strong> Response bodies are untrusted and often malformed; a tolerant regex pass finds a usable
 * headline without a DOM parser.</p>
 * <p><strong>Behaviour:</strong> Patterns are tried in order {@code <title>}, {@code <h1>}, {@code <h2>}. Each match has
 * its inner markup stripped and is trimmed; the first candidate longer than {@value #MIN_TITLE_LENGTH} characters wins
 * and is cut to {@value ScrapedArtifactRecord#MAX_TITLE_LENGTH} characters.</p>
 * <p><strong>Thread-safety:</strong> Stateless; compiled patterns are shared.</p>
 *
 * @since 0.1.0
 */
public final class RegexTitleExtractor implements ContentExtractor {
  /** Candidates of this length or shorter are discarded. */
  public static final int MIN_TITLE_LENGTH = 10;

  private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.DOTALL;
  private static final Pattern MARKUP = Pattern.compile("<[^>]+>");

  private static final List<Strategy> STRATEGIES = List.of(
      new Strategy("html_title", Pattern.compile("<title>(.*?)</title>", FLAGS)),
      new Strategy("html_h1", Pattern.compile("<h1[^>]*>(.*?)</h1>", FLAGS)),
      new Strategy("html_h2", Pattern.compile("<h2[^>]*>(.*?)</h2>", FLAGS)));

  @Override
  public Optional<ExtractedTitle> extract(String html) {
    if (html == null || html.isEmpty()) {
      return Optional.empty();
    }
    for (Strategy strategy : STRATEGIES) {
      Matcher matcher = strategy.pattern().matcher(html);
      while (matcher.find()) {
        String candidate = MARKUP.matcher(matcher.group(1)).replaceAll("").trim();
        if (candidate.length() > MIN_TITLE_LENGTH) {
          return Optional.of(new ExtractedTitle(truncate(candidate), strategy.method()));
        }
      }
    }
    return Optional.empty();
  }

  private static String truncate(String title) {
    return ScrapedArtifactRecord.clip(title, ScrapedArtifactRecord.MAX_TITLE_LENGTH);
  }

  private record Strategy(String method, Pattern pattern) {}
}
