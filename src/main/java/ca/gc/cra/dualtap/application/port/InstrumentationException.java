package ca.gc.cra.dualtap.application.port;

/**
 * Checked failure raised by instrumentation engine ports.
 *
 * @since 0.1.0
 */
public class InstrumentationException extends Exception {
  private static final long serialVersionUID = 1L;

  public InstrumentationException(String message) {
    super(message);
  }

  public InstrumentationException(String message, Throwable cause) {
    super(message, cause);
  }
}
