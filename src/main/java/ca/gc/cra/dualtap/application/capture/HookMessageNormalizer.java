package ca.gc.cra.dualtap.application.capture;

import ca.gc.cra.dualtap.domain.capture.HookRecord;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps a hook payload onto a {@link HookRecord}.
 * <p>Object payloads contribute {@code type}, {@code method}, {@code url} and {@code returnValue}; anything else is
 * recorded with {@code unknown} type and function. The payload itself is always kept verbatim as additional data.</p>
 *
 * @since 0.1.0
 */
public final class HookMessageNormalizer {
  static final String UNKNOWN = "unknown";

  /**
   * Normalizes one payload.
   *
   * @param payload hook payload of any shape, may be {@code null}
   * @param receivedAt receipt instant
   * @return record ready for persistence
   */
  public HookRecord normalize(Object payload, Instant receivedAt) {
    if (!(payload instanceof Map<?, ?> map)) {
      return new HookRecord(receivedAt, UNKNOWN, UNKNOWN, null, null, payload);
    }
    Map<String, Object> parameters = new LinkedHashMap<>();
    Object url = map.get("url");
    parameters.put("url", url == null ? "" : url.toString());
    Object returnValue = map.get("returnValue");
    return new HookRecord(
        receivedAt,
        textOrUnknown(map.get("type")),
        textOrUnknown(map.get("method")),
        parameters,
        returnValue == null ? null : returnValue.toString(),
        payload);
  }

  private static String textOrUnknown(Object value) {
    if (value == null) {
      return UNKNOWN;
    }
    String text = value.toString();
    return text.isBlank() ? UNKNOWN : text;
  }
}
