package ca.gc.cra.dualtap.application.port;

/**
 * Callbacks invoked by a {@link TrafficInterceptionEngine} for every exchange it relays.
 * <p>Implementations must not throw; the engine loop keeps running regardless.</p>
 *
 * @since 0.1.0
 */
public interface TrafficListener {
  /**
   * Invoked before the request is forwarded upstream. Header changes made here are sent upstream.
   *
   * @param flow request-side view of the exchange
   */
  void onRequest(InterceptedFlow flow);

  /**
   * Invoked once the upstream response has been received, before it is returned to the client.
   *
   * @param flow complete exchange
   */
  void onResponse(InterceptedFlow flow);
}
