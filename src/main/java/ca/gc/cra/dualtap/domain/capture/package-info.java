/**
 * Capture rows persisted by DUALTAP: intercepted traffic, hook events and scraped artifacts.
 * <p><strong>Concurrency:</strong> Records are immutable and safe to share between the proxy, instrumentation and
 * reporting threads.
 * <p><strong>Security:</strong> Rows carry raw headers and bodies from the target application, cookies included;
 * log them through {@link ca.gc.cra.dualtap.logging.Logs#truncate(String, int)} only.
 */
package ca.gc.cra.dualtap.domain.capture;
