package ca.gc.cra.dualtap.application.port;

import ca.gc.cra.dualtap.domain.capture.CaptureSummary;

/**
 * Destination for periodic capture summaries.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ReportSink {
  /**
   * Publishes one summary.
   *
   * @param summary point-in-time store aggregate
   */
  void publish(CaptureSummary summary);
}
