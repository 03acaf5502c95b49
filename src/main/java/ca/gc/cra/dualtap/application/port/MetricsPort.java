package ca.gc.cra.dualtap.application.port;

/**
 * <strong>What:</strong> Port abstracting DUALTAP metrics emission.
 * <p><strong>Why:</strong> Capture adapters count recorded, ignored and failed callbacks without binding to a vendor
 * SDK.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent updates from the proxy, instrumentation
 * delivery and reporting threads.</p>
 *
 * @implNote Metric keys use dotted names such as {@code traffic.request.recorded}.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier; must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value, e.g. nanoseconds spent in a store append
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
