package ca.gc.cra.dualtap.application.port;

/**
 * <strong>What:</strong> Port for an interposed proxy that relays client traffic and reports each exchange.
 * <p><strong>Role:</strong> Driven by {@link ca.gc.cra.dualtap.application.capture.CaptureOrchestrator} on a
 * dedicated daemon thread.</p>
 * <p><strong>Thread-safety:</strong> {@link #stop()} may be called from any thread while {@link #run} blocks.</p>
 *
 * @since 0.1.0
 */
public interface TrafficInterceptionEngine {
  /**
   * Runs the interception loop until {@link #stop()} is called.
   *
   * @param listener callbacks for each relayed exchange
   * @throws Exception if the engine cannot bind or fails irrecoverably
   */
  void run(TrafficListener listener) throws Exception;

  /** Stops the loop; idempotent. */
  void stop();
}
