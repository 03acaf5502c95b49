package ca.gc.cra.dualtap.api;

/**
 * <strong>What:</strong> Process exit codes shared by the DUALTAP commands.
 * <p><strong>Why:</strong> Wrapper scripts distinguish bad arguments from unreadable files and from a capture
 * session that was stopped with Ctrl+C.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Command completed, or a capture session ended after cancellation. */
  SUCCESS(0),
  /** Command-line arguments or merged configuration were invalid. */
  INVALID_ARGS(2),
  /** The proxy could not bind, or a database, recording or hook file could not be read. */
  IO_ERROR(3),
  /** Configuration was readable but unusable at runtime. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure. */
  RUNTIME_FAILURE(5),
  /** Start-up was interrupted before the capture session was running. */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value passed to {@link System#exit(int)}.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
