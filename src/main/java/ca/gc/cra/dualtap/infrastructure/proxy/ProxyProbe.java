package ca.gc.cra.dualtap.infrastructure.proxy;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ProxySelector;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends one request through the running proxy so an operator can confirm the capture path end to end.
 *
 * @since 0.1.0
 */
public final class ProxyProbe {
  private static final Logger log = LoggerFactory.getLogger(ProxyProbe.class);
  static final String USER_AGENT = "DUALTAP-Probe/1.0";

  private final HttpClient client;
  private final Duration timeout;

  /**
   * @param proxy address of the running proxy
   * @param timeout request timeout
   */
  public ProxyProbe(InetSocketAddress proxy, Duration timeout) {
    Objects.requireNonNull(proxy, "proxy");
    this.timeout = Objects.requireNonNull(timeout, "timeout");
    this.client = HttpClient.newBuilder()
        .version(HttpClient.Version.HTTP_1_1)
        .proxy(ProxySelector.of(proxy))
        .connectTimeout(timeout)
        .build();
  }

  /**
   * Issues a {@code GET} for {@code url} through the proxy.
   *
   * @param url probe target
   * @return status and body size
   * @throws IOException if the request fails
   * @throws InterruptedException if interrupted while waiting
   */
  public ProbeResult probe(URI url) throws IOException, InterruptedException {
    HttpRequest request = HttpRequest.newBuilder(url)
        .timeout(timeout)
        .header("User-Agent", USER_AGENT)
        .GET()
        .build();
    HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
    ProbeResult result = new ProbeResult(response.statusCode(), response.body() == null ? 0 : response.body().length());
    log.info("Probe {} returned {} ({} chars)", url, result.statusCode(), result.bodyLength());
    return result;
  }

  /**
   * @param statusCode response status
   * @param bodyLength decoded body length in characters
   */
  public record ProbeResult(int statusCode, int bodyLength) {}
}
