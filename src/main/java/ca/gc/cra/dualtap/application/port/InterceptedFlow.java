package ca.gc.cra.dualtap.application.port;

import java.util.Locale;
import java.util.Map;

/**
 * <strong>What:</strong> One decoded HTTP exchange as seen by the interception engine.
 * <p><strong>Why:</strong> The capture core never parses HTTP or handles TLS; engines hand it this view instead.</p>
 * <p><strong>Role:</strong> Callback argument of {@link TrafficListener}. Response accessors return {@code null}
 * until the engine has received the upstream response.</p>
 * <p><strong>Thread-safety:</strong> A flow is confined to the engine thread that delivers it.</p>
 *
 * @since 0.1.0
 */
public interface InterceptedFlow {
  /** @return HTTP method, e.g. {@code GET} */
  String method();

  /** @return absolute request URL */
  String url();

  /** @return request host without port */
  String host();

  /** @return request headers in arrival order */
  Map<String, String> requestHeaders();

  /** @return decoded request body, or {@code null} */
  String requestBody();

  /** @return response status, or {@code null} before the response arrives */
  Integer statusCode();

  /** @return response headers, or {@code null} before the response arrives */
  Map<String, String> responseHeaders();

  /** @return decoded response body, or {@code null} */
  String responseBody();

  /**
   * Sets or replaces a header on the request before it is forwarded upstream.
   *
   * @param name header name
   * @param value header value
   */
  void setRequestHeader(String name, String value);

  /**
   * Returns the response content type by case-insensitive header lookup.
   *
   * @return content type, or {@code null} when absent
   */
  default String contentType() {
    Map<String, String> headers = responseHeaders();
    if (headers == null) {
      return null;
    }
    for (Map.Entry<String, String> entry : headers.entrySet()) {
      if (entry.getKey() != null && entry.getKey().toLowerCase(Locale.ROOT).equals("content-type")) {
        return entry.getValue();
      }
    }
    return null;
  }
}
