package ca.gc.cra.dualtap.application.capture;

/**
 * Capability a capture session ended up running with.
 *
 * @since 0.1.0
 */
public enum CaptureMode {
  /** Proxy running and instrumentation attached. */
  FULL,
  /** Proxy running; instrumentation was requested but the attach failed. */
  TRAFFIC_ONLY,
  /** Proxy running; instrumentation disabled by configuration. */
  PROXY_ONLY
}
