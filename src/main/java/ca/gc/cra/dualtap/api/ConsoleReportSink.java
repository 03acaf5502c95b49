package ca.gc.cra.dualtap.api;

import ca.gc.cra.dualtap.application.capture.CaptureReportFormatter;
import ca.gc.cra.dualtap.application.port.ReportSink;
import ca.gc.cra.dualtap.domain.capture.CaptureSummary;

/**
 * Prints capture summaries to stdout.
 */
final class ConsoleReportSink implements ReportSink {
  private final CaptureReportFormatter formatter = new CaptureReportFormatter();

  @Override
  public void publish(CaptureSummary summary) {
    CliPrinter.printLines(formatter.format(summary));
  }
}
