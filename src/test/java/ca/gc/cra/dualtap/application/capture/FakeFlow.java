package ca.gc.cra.dualtap.application.capture;

import ca.gc.cra.dualtap.application.port.InterceptedFlow;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Mutable {@link InterceptedFlow} for driving the traffic adapter directly.
 */
final class FakeFlow implements InterceptedFlow {
  private final String method;
  private final String url;
  private final String host;
  private final Map<String, String> requestHeaders = new LinkedHashMap<>();
  private String requestBody;
  private Integer statusCode;
  private Map<String, String> responseHeaders;
  private String responseBody;

  FakeFlow(String method, String url, String host) {
    this.method = method;
    this.url = url;
    this.host = host;
  }

  static FakeFlow get(String url, String host) {
    return new FakeFlow("GET", url, host);
  }

  FakeFlow respond(int status, String contentType, String body) {
    this.statusCode = status;
    this.responseHeaders = new LinkedHashMap<>();
    if (contentType != null) {
      responseHeaders.put("Content-Type", contentType);
    }
    this.responseBody = body;
    return this;
  }

  FakeFlow withRequestBody(String body) {
    this.requestBody = body;
    return this;
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
    return requestHeaders;
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
    requestHeaders.put(name, value);
  }
}
