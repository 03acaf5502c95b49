package ca.gc.cra.dualtap.application.capture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;

import ca.gc.cra.dualtap.domain.capture.HookRecord;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class HookMessageNormalizerTest {
  private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
  private final HookMessageNormalizer normalizer = new HookMessageNormalizer();

  @Test
  void okhttpPayloadKeepsTypeMethodAndUrl() {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("type", "okhttp_request");
    payload.put("url", "https://www.dawn.com/news/1");
    payload.put("method", "GET");
    payload.put("headers", "Accept: */*");

    HookRecord record = normalizer.normalize(payload, NOW);

    assertEquals("okhttp_request", record.hookType());
    assertEquals("GET", record.functionName());
    assertEquals(Map.of("url", "https://www.dawn.com/news/1"), record.parameters());
    assertSame(payload, record.additionalData());
  }

  @Test
  void missingFieldsDefaultToUnknownAndEmptyUrl() {
    HookRecord record = normalizer.normalize(Map.of("returnValue", 42), NOW);

    assertEquals("unknown", record.hookType());
    assertEquals("unknown", record.functionName());
    assertEquals(Map.of("url", ""), record.parameters());
    assertEquals("42", record.returnValue());
  }

  @Test
  void nonObjectPayloadIsKeptVerbatim() {
    List<Object> payload = List.of(1, "two");

    HookRecord record = normalizer.normalize(payload, NOW);

    assertEquals("unknown", record.hookType());
    assertEquals("unknown", record.functionName());
    assertNull(record.parameters());
    assertSame(payload, record.additionalData());
  }

  @Test
  void nullPayloadIsAccepted() {
    HookRecord record = normalizer.normalize(null, NOW);

    assertEquals("unknown", record.hookType());
    assertNull(record.additionalData());
  }
}
