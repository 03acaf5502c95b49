package ca.gc.cra.dualtap.infrastructure.proxy;

import ca.gc.cra.dualtap.application.port.InterceptedFlow;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Mutable {@link InterceptedFlow} for one proxied exchange, confined to the handler thread.
 */
final class ProxiedExchange implements InterceptedFlow {
  private final String method;
  private final String url;
  private final String host;
  private final Map<String, String> requestHeaders;
  private final String requestBody;

  private Integer statusCode;
  private Map<String, String> responseHeaders;
  private String responseBody;

  ProxiedExchange(String method, String url, String host, Map<String, String> requestHeaders, String requestBody) {
    this.method = Objects.requireNonNull(method, "method");
    this.url = Objects.requireNonNull(url, "url");
    this.host = host;
    this.requestHeaders = new LinkedHashMap<>(requestHeaders);
    this.requestBody = requestBody;
  }

  void completeWith(int status, Map<String, String> headers, String body) {
    this.statusCode = status;
    this.responseHeaders = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    this.responseBody = body;
  }

  @Override
  public String method() {
    return method;
  }

  @Override
  public String url() {
    return url;
  }

  @Override
  public String host() {
    return host;
  }

  @Override
  public Map<String, String> requestHeaders() {
    return Collections.unmodifiableMap(requestHeaders);
  }

  @Override
  public String requestBody() {
    return requestBody;
  }

  @Override
  public Integer statusCode() {
    return statusCode;
  }

  @Override
  public Map<String, String> responseHeaders() {
    return responseHeaders;
  }

  @Override
  public String responseBody() {
    return responseBody;
  }

  @Override
  public void setRequestHeader(String name, String value) {
    Objects.requireNonNull(name, "name");
    requestHeaders.keySet().removeIf(existing -> existing.equalsIgnoreCase(name));
    requestHeaders.put(name, value);
  }
}
