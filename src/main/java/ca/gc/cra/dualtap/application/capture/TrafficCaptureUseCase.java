package ca.gc.cra.dualtap.application.capture;

import ca.gc.cra.dualtap.application.port.ClockPort;
import ca.gc.cra.dualtap.application.port.ContentExtractor;
import ca.gc.cra.dualtap.application.port.ContentExtractor.ExtractedTitle;
import ca.gc.cra.dualtap.application.port.EventStorePort;
import ca.gc.cra.dualtap.application.port.InterceptedFlow;
import ca.gc.cra.dualtap.application.port.MetricsPort;
import ca.gc.cra.dualtap.application.port.TrafficListener;
import ca.gc.cra.dualtap.domain.capture.NetworkTrafficRecord;
import ca.gc.cra.dualtap.domain.capture.ScrapedArtifactRecord;
import ca.gc.cra.dualtap.logging.Logs;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Traffic adapter turning intercepted exchanges for target hosts into persisted rows.
 * <p><strong>Why:</strong> The interception engine relays everything; only allow-listed hosts are recorded, tagged
 * with a marker header, and mined for titles.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Write one request-time row per target request, then stamp the marker header on the outgoing request.</li>
 *   <li>Write one full row per target response.</li>
 *   <li>Run the {@link ContentExtractor} over {@code text/html} responses and persist at most one artifact.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from injected collaborators; the engine may call concurrently.</p>
 * <p><strong>Observability:</strong> Emits {@code traffic.*} counters. Callbacks never throw: failures, including
 * {@link ca.gc.cra.dualtap.application.port.StorageFault}, are logged, counted and swallowed.</p>
 *
 * @since 0.1.0
 */
public final class TrafficCaptureUseCase implements TrafficListener {
  private static final Logger log = LoggerFactory.getLogger(TrafficCaptureUseCase.class);

  private static final String PIPELINE = "traffic";
  private static final String HTML_CONTENT_TYPE = "text/html";
  private static final int LOG_URL_CHARS = 160;

  private final EventStorePort store;
  private final ContentExtractor extractor;
  private final TargetHostMatcher matcher;
  private final MarkerHeader marker;
  private final ClockPort clock;
  private final MetricsPort metrics;

  /**
   * @param store event store
   * @param extractor HTML title strategy
   * @param matcher target host allow-list
   * @param marker header stamped on target requests
   * @param clock timestamp source
   * @param metrics metrics sink
   */
  public TrafficCaptureUseCase(
      EventStorePort store,
      ContentExtractor extractor,
      TargetHostMatcher matcher,
      MarkerHeader marker,
      ClockPort clock,
      MetricsPort metrics) {
    this.store = Objects.requireNonNull(store, "store");
    this.extractor = Objects.requireNonNull(extractor, "extractor");
    this.matcher = Objects.requireNonNull(matcher, "matcher");
    this.marker = Objects.requireNonNull(marker, "marker");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public void onRequest(InterceptedFlow flow) {
    MDC.put("pipeline", PIPELINE);
    try {
      if (!matcher.matches(flow.host())) {
        metrics.increment("traffic.flow.ignored");
        return;
      }
      NetworkTrafficRecord row = NetworkTrafficRecord.request(
          clock.now(), flow.method(), flow.url(), flow.requestHeaders(), flow.requestBody());
      long id = store.append(row);
      flow.setRequestHeader(marker.name(), marker.value());
      metrics.increment("traffic.request.recorded");
      log.debug("Recorded request #{} {} {}", id, flow.method(), Logs.truncate(flow.url(), LOG_URL_CHARS));
    } catch (Exception ex) {
      metrics.increment("traffic.callback.error");
      log.warn("Request capture failed for {}", describe(flow), ex);
    } finally {
      MDC.remove("pipeline");
    }
  }

  @Override
  public void onResponse(InterceptedFlow flow) {
    MDC.put("pipeline", PIPELINE);
    try {
      if (!matcher.matches(flow.host())) {
        metrics.increment("traffic.flow.ignored");
        return;
      }
      NetworkTrafficRecord row = new NetworkTrafficRecord(
          clock.now(),
          flow.method(),
          flow.url(),
          flow.statusCode(),
          flow.requestHeaders(),
          flow.responseHeaders(),
          flow.requestBody(),
          flow.responseBody(),
          NetworkTrafficRecord.DEFAULT_SOURCE);
      long id = store.append(row);
      metrics.increment("traffic.response.recorded");
      log.debug("Recorded response #{} {} {}", id, flow.statusCode(), Logs.truncate(flow.url(), LOG_URL_CHARS));
      if (isHtml(flow.contentType())) {
        extractArtifact(flow);
      }
    } catch (Exception ex) {
      metrics.increment("traffic.callback.error");
      log.warn("Response capture failed for {}", describe(flow), ex);
    } finally {
      MDC.remove("pipeline");
    }
  }

  private void extractArtifact(InterceptedFlow flow) {
    Optional<ExtractedTitle> title;
    try {
      title = extractor.extract(flow.responseBody());
    } catch (RuntimeException ex) {
      log.debug("Title extraction failed for {}", Logs.truncate(flow.url(), LOG_URL_CHARS), ex);
      title = Optional.empty();
    }
    if (title.isEmpty()) {
      metrics.increment("traffic.artifact.miss");
      return;
    }
    ExtractedTitle extracted = title.get();
    store.append(new ScrapedArtifactRecord(
        clock.now(), extracted.title(), flow.url(), null, null, extracted.method()));
    metrics.increment("traffic.artifact.extracted");
    log.info("Extracted title via {}: {}", extracted.method(), Logs.truncate(extracted.title(), 80));
  }

  private static boolean isHtml(String contentType) {
    return contentType != null && contentType.toLowerCase(Locale.ROOT).contains(HTML_CONTENT_TYPE);
  }

  private static String describe(InterceptedFlow flow) {
    try {
      return flow.method() + " " + Logs.truncate(flow.url(), LOG_URL_CHARS);
    } catch (RuntimeException ex) {
      return "<unreadable flow>";
    }
  }

  /**
   * Header stamped on every recorded request.
   *
   * @param name header name
   * @param value header value
   */
  public record MarkerHeader(String name, String value) {
    /** Default marker used when none is configured. */
    public static final MarkerHeader DEFAULT = new MarkerHeader("X-MITM-Agent", "DUALTAP-Agent");

    public MarkerHeader {
      Objects.requireNonNull(name, "name");
      Objects.requireNonNull(value, "value");
    }
  }
}
