package ca.gc.cra.dualtap.application.port;

/**
 * Raised when no running process matches the requested name.
 * <p>This is the only attach failure that lets fallback selection move on to the next candidate.</p>
 *
 * @since 0.1.0
 */
public class ProcessNotFoundException extends InstrumentationException {
  private static final long serialVersionUID = 1L;

  private final String processName;

  /**
   * @param processName name that could not be resolved
   */
  public ProcessNotFoundException(String processName) {
    super("process not found: " + processName);
    this.processName = processName;
  }

  /** @return the name that could not be resolved */
  public String processName() {
    return processName;
  }
}
