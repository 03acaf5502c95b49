/**
 * <strong>Purpose:</strong> Ports between the DUALTAP capture core and its collaborators: the interception proxy,
 * the instrumentation engine, the event store, content extraction, metrics and reporting.
 * <p><strong>Concurrency:</strong> Port implementations must be thread-safe unless documented otherwise; the proxy
 * loop, the instrumentation delivery thread and the report loop call into them in parallel.</p>
 * <p><strong>Observability:</strong> Ports expose hooks for metrics/logging but do not prescribe implementations.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.dualtap.application.port;
