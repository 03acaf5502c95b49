package ca.gc.cra.dualtap.infrastructure.proxy;

import ca.gc.cra.dualtap.application.port.MetricsPort;
import ca.gc.cra.dualtap.application.port.TrafficInterceptionEngine;
import ca.gc.cra.dualtap.application.port.TrafficListener;
import ca.gc.cra.dualtap.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.dualtap.logging.Logs;
import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.zip.GZIPInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Plain-HTTP forward proxy that relays client requests upstream and reports every exchange to a
 * {@link TrafficListener}.
 * <p><strong>Why:</strong> Gives the capture core a concrete interception engine for cleartext traffic. TLS tunnels
 * ({@code CONNECT}) are refused with {@code 501}; certificate handling is outside this engine.</p>
 * <p><strong>Role:</strong> Infrastructure adapter implementing {@link TrafficInterceptionEngine} on the JDK
 * {@link HttpServer} and {@link HttpClient}.</p>
 * <p><strong>Thread-safety:</strong> Exchanges are handled on a fixed daemon pool; each exchange is confined to one
 * worker. {@link #stop()} may be called from any thread.</p>
 * <p><strong>Observability:</strong> Emits {@code proxy.exchange.relayed}, {@code proxy.upstream.error} and
 * {@code proxy.connect.rejected}.</p>
 *
 * @since 0.1.0
 */
public final class HttpForwardProxyEngine implements TrafficInterceptionEngine {
  private static final Logger log = LoggerFactory.getLogger(HttpForwardProxyEngine.class);

  private static final Set<String> HOP_BY_HOP = Set.of(
      "connection", "keep-alive", "proxy-authenticate", "proxy-authorization", "proxy-connection", "te",
      "trailer", "transfer-encoding", "upgrade");
  // HttpClient rejects these when set explicitly
  private static final Set<String> CLIENT_MANAGED = Set.of("host", "content-length", "expect");
  private static final int WORKERS = 8;
  private static final int LOG_URL_CHARS = 160;

  private final InetSocketAddress bindAddress;
  private final Duration upstreamTimeout;
  private final MetricsPort metrics;
  private final HttpClient client;
  private final CountDownLatch ready = new CountDownLatch(1);
  private final CountDownLatch stopped = new CountDownLatch(1);
  private volatile InetSocketAddress boundAddress;

  /**
   * @param host bind host
   * @param port bind port; {@code 0} selects an ephemeral port
   * @param upstreamTimeout connect and response timeout for upstream requests
   * @param metrics metrics sink
   */
  public HttpForwardProxyEngine(String host, int port, Duration upstreamTimeout, MetricsPort metrics) {
    this.bindAddress = new InetSocketAddress(Objects.requireNonNull(host, "host"), port);
    this.upstreamTimeout = Objects.requireNonNull(upstreamTimeout, "upstreamTimeout");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.client = HttpClient.newBuilder()
        .version(HttpClient.Version.HTTP_1_1)
        .followRedirects(HttpClient.Redirect.NEVER)
        .proxy(HttpClient.Builder.NO_PROXY)
        .connectTimeout(upstreamTimeout)
        .build();
  }

  @Override
  public void run(TrafficListener listener) throws IOException {
    Objects.requireNonNull(listener, "listener");
    HttpServer server = HttpServer.create(bindAddress, 0);
    ExecutorService workers = ExecutorFactories.newDaemonPool(WORKERS, "dualtap-proxy-worker",
        (thread, ex) -> log.error("Uncaught failure on {}", thread.getName(), ex));
    server.createContext("/", exchange -> handle(exchange, listener));
    server.setExecutor(workers);
    server.start();
    boundAddress = server.getAddress();
    log.info("Forward proxy listening on {}:{}", boundAddress.getHostString(), boundAddress.getPort());
    ready.countDown();
    try {
      stopped.await();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    } finally {
      server.stop(0);
      workers.shutdownNow();
      log.info("Forward proxy stopped");
    }
  }

  @Override
  public void stop() {
    stopped.countDown();
  }

  /**
   * Waits until the listening socket is bound.
   *
   * @param timeout maximum wait
   * @return bound address
   * @throws InterruptedException if interrupted while waiting
   * @throws IllegalStateException if the proxy did not bind in time
   */
  public InetSocketAddress awaitReady(Duration timeout) throws InterruptedException {
    if (!ready.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
      throw new IllegalStateException("proxy did not start within " + timeout.toMillis() + " ms");
    }
    return boundAddress;
  }

  private void handle(HttpExchange exchange, TrafficListener listener) throws IOException {
    try {
      String method = exchange.getRequestMethod().toUpperCase(Locale.ROOT);
      if ("CONNECT".equals(method)) {
        metrics.increment("proxy.connect.rejected");
        sendPlain(exchange, 501, "CONNECT tunnelling is not supported by this proxy");
        return;
      }
      URI target;
      try {
        target = absoluteTarget(exchange);
      } catch (URISyntaxException | IllegalArgumentException ex) {
        sendPlain(exchange, 400, "Malformed request target");
        return;
      }

      byte[] requestBytes = exchange.getRequestBody().readAllBytes();
      Map<String, String> requestHeaders = flatten(exchange.getRequestHeaders());
      ProxiedExchange flow = new ProxiedExchange(
          method, target.toString(), target.getHost(), requestHeaders, decode(requestBytes, requestHeaders));
      listener.onRequest(flow);

      HttpResponse<byte[]> upstream;
      try {
        upstream = client.send(buildUpstreamRequest(method, target, flow.requestHeaders(), requestBytes),
            HttpResponse.BodyHandlers.ofByteArray());
      } catch (IOException ex) {
        metrics.increment("proxy.upstream.error");
        log.warn("Upstream request failed for {}: {}", Logs.truncate(target.toString(), LOG_URL_CHARS),
            ex.getMessage());
        sendPlain(exchange, 502, "Upstream request failed");
        return;
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        sendPlain(exchange, 503, "Proxy shutting down");
        return;
      }

      byte[] responseBytes = upstream.body() == null ? new byte[0] : upstream.body();
      Map<String, String> responseHeaders = flatten(upstream.headers().map());
      flow.completeWith(upstream.statusCode(), responseHeaders, decode(responseBytes, responseHeaders));
      listener.onResponse(flow);

      relayResponse(exchange, method, upstream, responseBytes);
      metrics.increment("proxy.exchange.relayed");
    } finally {
      exchange.close();
    }
  }

  private HttpRequest buildUpstreamRequest(
      String method, URI target, Map<String, String> headers, byte[] body) {
    HttpRequest.BodyPublisher publisher = body.length == 0
        ? HttpRequest.BodyPublishers.noBody()
        : HttpRequest.BodyPublishers.ofByteArray(body);
    HttpRequest.Builder builder = HttpRequest.newBuilder(target)
        .timeout(upstreamTimeout)
        .method(method, publisher);
    for (Map.Entry<String, String> header : headers.entrySet()) {
      String lower = header.getKey().toLowerCase(Locale.ROOT);
      if (HOP_BY_HOP.contains(lower) || CLIENT_MANAGED.contains(lower)) {
        continue;
      }
      try {
        builder.header(header.getKey(), header.getValue());
      } catch (IllegalArgumentException ex) {
        log.debug("Dropping header {} not accepted by the upstream client", header.getKey());
      }
    }
    return builder.build();
  }

  private static void relayResponse(
      HttpExchange exchange, String method, HttpResponse<byte[]> upstream, byte[] body) throws IOException {
    Headers out = exchange.getResponseHeaders();
    upstream.headers().map().forEach((name, values) -> {
      String lower = name.toLowerCase(Locale.ROOT);
      if (!HOP_BY_HOP.contains(lower) && !"content-length".equals(lower) && !lower.startsWith(":")) {
        out.put(name, List.copyOf(values));
      }
    });
    int status = upstream.statusCode();
    boolean bodyless = "HEAD".equals(method) || status == 204 || status == 304 || body.length == 0;
    exchange.sendResponseHeaders(status, bodyless ? -1 : body.length);
    if (!bodyless) {
      try (OutputStream os = exchange.getResponseBody()) {
        os.write(body);
      }
    }
  }

  private static URI absoluteTarget(HttpExchange exchange) throws URISyntaxException {
    URI uri = exchange.getRequestURI();
    if (uri.isAbsolute()) {
      if (uri.getHost() == null) {
        throw new IllegalArgumentException("request target has no host");
      }
      return uri;
    }
    String host = exchange.getRequestHeaders().getFirst("Host");
    if (host == null || host.isBlank()) {
      throw new IllegalArgumentException("origin-form request without Host header");
    }
    return new URI("http://" + host.trim() + uri.getRawPath()
        + (uri.getRawQuery() == null ? "" : "?" + uri.getRawQuery()));
  }

  private static Map<String, String> flatten(Map<String, List<String>> headers) {
    Map<String, String> flat = new LinkedHashMap<>();
    headers.forEach((name, values) -> {
      if (name != null && !name.startsWith(":")) {
        flat.put(name, String.join(", ", values));
      }
    });
    return flat;
  }

  static String decode(byte[] body, Map<String, String> headers) {
    if (body == null || body.length == 0) {
      return null;
    }
    byte[] plain = body;
    String encoding = headerValue(headers, "content-encoding");
    if (encoding != null && encoding.toLowerCase(Locale.ROOT).contains("gzip")) {
      try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(body))) {
        plain = in.readAllBytes();
      } catch (IOException ex) {
        log.debug("Unable to gunzip captured body; storing raw bytes", ex);
      }
    }
    return new String(plain, charsetOf(headerValue(headers, "content-type")));
  }

  private static Charset charsetOf(String contentType) {
    if (contentType != null) {
      for (String part : contentType.split(";")) {
        String trimmed = part.trim();
        if (trimmed.toLowerCase(Locale.ROOT).startsWith("charset=")) {
          try {
            return Charset.forName(trimmed.substring("charset=".length()).replace("\"", "").trim());
          } catch (IllegalArgumentException ex) {
            log.debug("Unknown charset in {}; using UTF-8", contentType);
          }
        }
      }
    }
    return StandardCharsets.UTF_8;
  }

  private static String headerValue(Map<String, String> headers, String name) {
    for (Map.Entry<String, String> entry : headers.entrySet()) {
      if (entry.getKey().equalsIgnoreCase(name)) {
        return entry.getValue();
      }
    }
    return null;
  }

  private static void sendPlain(HttpExchange exchange, int status, String message) throws IOException {
    byte[] bytes = message.getBytes(StandardCharsets.UTF_8);
    exchange.getResponseHeaders().set("Content-Type", "text/plain; charset=utf-8");
    exchange.sendResponseHeaders(status, bytes.length);
    try (OutputStream os = exchange.getResponseBody()) {
      os.write(bytes);
    }
  }
}
