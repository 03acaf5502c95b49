package ca.gc.cra.dualtap.domain.capture;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable row describing one side of an intercepted HTTP exchange.
 * <p><strong>Why:</strong> Requests and responses are persisted as separate rows; a request-time row carries no
 * status, response headers or response body.</p>
 * <p><strong>Role:</strong> Domain value written through {@link ca.gc.cra.dualtap.application.port.EventStorePort}.</p>
 * <p><strong>Thread-safety:</strong> Immutable; header maps are copied on construction.</p>
 *
 * @param timestamp capture instant
 * @param method HTTP method
 * @param url absolute request URL
 * @param statusCode response status; {@code null} for request-time rows
 * @param requestHeaders request headers in arrival order
 * @param responseHeaders response headers; {@code null} for request-time rows
 * @param requestBody decoded request body; {@code null} when empty
 * @param responseBody decoded response body; {@code null} when empty or absent
 * @param source origin tag, {@value #DEFAULT_SOURCE} unless supplied
 * @since 0.1.0
 */
public record NetworkTrafficRecord(
    Instant timestamp,
    String method,
    String url,
    Integer statusCode,
    Map<String, String> requestHeaders,
    Map<String, String> responseHeaders,
    String requestBody,
    String responseBody,
    String source) {

  /** Source tag used for rows produced by the interception proxy. */
  public static final String DEFAULT_SOURCE = "mitm";

  public NetworkTrafficRecord {
    Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(method, "method");
    Objects.requireNonNull(url, "url");
    requestHeaders = requestHeaders == null ? Map.of() : copy(requestHeaders);
    responseHeaders = responseHeaders == null ? null : copy(responseHeaders);
    requestBody = emptyToNull(requestBody);
    responseBody = emptyToNull(responseBody);
    source = (source == null || source.isBlank()) ? DEFAULT_SOURCE : source;
  }

  /**
   * Builds a request-time row.
   *
   * @param timestamp capture instant
   * @param method HTTP method
   * @param url request URL
   * @param requestHeaders request headers
   * @param requestBody request body, may be {@code null}
   * @return row without response fields
   */
  public static NetworkTrafficRecord request(
      Instant timestamp, String method, String url, Map<String, String> requestHeaders, String requestBody) {
    return new NetworkTrafficRecord(
        timestamp, method, url, null, requestHeaders, null, requestBody, null, DEFAULT_SOURCE);
  }

  /** Returns {@code true} when this row was written at response time. */
  public boolean hasResponse() {
    return statusCode != null;
  }

  private static Map<String, String> copy(Map<String, String> source) {
    return Collections.unmodifiableMap(new LinkedHashMap<>(source));
  }

  private static String emptyToNull(String value) {
    return (value == null || value.isEmpty()) ? null : value;
  }
}
