package ca.gc.cra.dualtap.application.port;

import java.util.Optional;

/**
 * Best-effort strategy that pulls a human readable title out of an HTML document.
 * <p>An empty result is a normal miss, not an error. Implementations must be stateless or thread-safe because the
 * proxy engine may deliver responses concurrently.</p>
 *
 * @since 0.1.0
 */
public interface ContentExtractor {
  /**
   * Extracts at most one title.
   *
   * @param html decoded document text; may be {@code null}
   * @return extracted title with its method tag, or empty on a miss
   */
  Optional<ExtractedTitle> extract(String html);

  /**
   * Extraction result.
   *
   * @param title cleaned title text
   * @param method tag naming the matching strategy
   */
  record ExtractedTitle(String title, String method) {}
}
