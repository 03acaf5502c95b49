package ca.gc.cra.dualtap.domain.capture;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable transcription of one runtime hook event delivered by injected instrumentation.
 * <p><strong>Why:</strong> Hook payloads have no fixed shape; the full payload is kept in {@code additionalData} so
 * nothing is lost when a script emits fields the normalizer does not know about.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; {@code additionalData} is stored as received and must not be
 * mutated by callers after construction.</p>
 *
 * @param timestamp receipt instant
 * @param hookType payload {@code type}, or {@code unknown}
 * @param functionName payload {@code method}, or {@code unknown}
 * @param parameters extracted call parameters; {@code null} when the payload was not an object
 * @param returnValue stringified return value; may be {@code null}
 * @param additionalData verbatim payload; may be {@code null}
 * @since 0.1.0
 */
public record HookRecord(
    Instant timestamp,
    String hookType,
    String functionName,
    Map<String, Object> parameters,
    String returnValue,
    Object additionalData) {

  public HookRecord {
    Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(hookType, "hookType");
    Objects.requireNonNull(functionName, "functionName");
    parameters = parameters == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
  }
}
