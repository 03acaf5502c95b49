package ca.gc.cra.dualtap.application.capture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.dualtap.application.capture.TrafficCaptureUseCase.MarkerHeader;
import ca.gc.cra.dualtap.application.port.ContentExtractor;
import ca.gc.cra.dualtap.domain.capture.NetworkTrafficRecord;
import ca.gc.cra.dualtap.domain.capture.ScrapedArtifactRecord;
import ca.gc.cra.dualtap.infrastructure.extract.RegexTitleExtractor;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TrafficCaptureUseCaseTest {
  private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

  private InMemoryEventStore store;
  private RecordingMetricsPort metrics;
  private TrafficCaptureUseCase useCase;

  @BeforeEach
  void setUp() {
    store = new InMemoryEventStore();
    metrics = new RecordingMetricsPort();
    useCase = newUseCase(new RegexTitleExtractor(), Set.of("example.com", "dawn.com"));
  }

  private TrafficCaptureUseCase newUseCase(ContentExtractor extractor, Set<String> domains) {
    return new TrafficCaptureUseCase(
        store, extractor, new TargetHostMatcher(domains), MarkerHeader.DEFAULT, () -> NOW, metrics);
  }

  @Test
  void nonTargetHostIsNeitherStoredNorMarked() {
    FakeFlow flow = FakeFlow.get("http://other.org/", "other.org")
        .respond(200, "text/html", "<title>Some other page title</title>");

    useCase.onRequest(flow);
    useCase.onResponse(flow);

    assertTrue(store.traffic.isEmpty());
    assertTrue(store.artifacts.isEmpty());
    assertFalse(flow.requestHeaders().containsKey("X-MITM-Agent"));
    assertEquals(2, metrics.count("traffic.flow.ignored"));
  }

  @Test
  void targetExchangeProducesRequestAndResponseRows() {
    FakeFlow flow = new FakeFlow("POST", "http://www.dawn.com/api", "www.dawn.com").withRequestBody("q=1");

    useCase.onRequest(flow);
    flow.respond(201, "application/json", "{\"ok\":true}");
    useCase.onResponse(flow);

    assertEquals(2, store.traffic.size());
    NetworkTrafficRecord request = store.traffic.get(0);
    NetworkTrafficRecord response = store.traffic.get(1);
    assertNull(request.statusCode());
    assertNull(request.responseHeaders());
    assertEquals("q=1", request.requestBody());
    assertEquals(201, response.statusCode());
    assertEquals("{\"ok\":true}", response.responseBody());
    assertEquals("mitm", response.source());
    assertEquals(NOW, response.timestamp());
    assertTrue(store.artifacts.isEmpty(), "non-HTML responses are not scraped");
  }

  @Test
  void markerHeaderIsStampedAfterTheRequestRowIsWritten() {
    FakeFlow flow = FakeFlow.get("http://dawn.com/", "dawn.com");

    useCase.onRequest(flow);

    assertEquals("DUALTAP-Agent", flow.requestHeaders().get("X-MITM-Agent"));
    assertFalse(store.traffic.get(0).requestHeaders().containsKey("X-MITM-Agent"));
  }

  @Test
  void exampleDotComEndToEnd() {
    FakeFlow flow = FakeFlow.get("http://example.com/", "example.com");

    useCase.onRequest(flow);
    flow.respond(200, "text/html; charset=UTF-8",
        "<html><head><title>Hello World Example</title></head><body><h1>Hi</h1></body></html>");
    useCase.onResponse(flow);

    assertEquals(2, store.traffic.size());
    assertEquals(200, store.traffic.get(1).statusCode());
    assertEquals(1, store.artifacts.size());
    ScrapedArtifactRecord artifact = store.artifacts.get(0).record();
    assertEquals("Hello World Example", artifact.title());
    assertEquals("html_title", artifact.extractionMethod());
    assertEquals("http://example.com/", artifact.url());
    assertEquals(1, metrics.count("traffic.artifact.extracted"));
  }

  @Test
  void htmlWithoutUsableTitleCountsAsMiss() {
    FakeFlow flow = FakeFlow.get("http://dawn.com/", "dawn.com").respond(200, "text/html", "<title>Short</title>");

    useCase.onResponse(flow);

    assertEquals(1, store.traffic.size());
    assertTrue(store.artifacts.isEmpty());
    assertEquals(1, metrics.count("traffic.artifact.miss"));
  }

  @Test
  void storageFailureIsContainedAndLeavesRequestUnmarked() {
    store.failWrites = true;
    FakeFlow flow = FakeFlow.get("http://dawn.com/", "dawn.com");

    useCase.onRequest(flow);
    flow.respond(200, "text/html", "<title>A perfectly fine headline</title>");
    useCase.onResponse(flow);

    assertFalse(flow.requestHeaders().containsKey("X-MITM-Agent"));
    assertEquals(2, metrics.count("traffic.callback.error"));
  }

  @Test
  void extractorFailureStillRecordsResponse() {
    useCase = newUseCase(html -> {
      throw new IllegalStateException("boom");
    }, Set.of("dawn.com"));
    FakeFlow flow = FakeFlow.get("http://dawn.com/", "dawn.com").respond(200, "text/html", "<title>x</title>");

    useCase.onResponse(flow);

    assertEquals(1, store.traffic.size());
    assertEquals(0, metrics.count("traffic.callback.error"));
    assertEquals(1, metrics.count("traffic.artifact.miss"));
  }

  @Test
  void extractorIsOnlyConsultedForHtml() {
    int[] calls = {0};
    useCase = newUseCase(html -> {
      calls[0]++;
      return Optional.empty();
    }, Set.of("dawn.com"));

    useCase.onResponse(FakeFlow.get("http://dawn.com/a.css", "dawn.com").respond(200, "text/css", "body{}"));
    useCase.onResponse(FakeFlow.get("http://dawn.com/b", "dawn.com").respond(204, null, null));
    useCase.onResponse(FakeFlow.get("http://dawn.com/", "dawn.com").respond(200, "TEXT/HTML", "<p></p>"));

    assertEquals(1, calls[0]);
  }
}
