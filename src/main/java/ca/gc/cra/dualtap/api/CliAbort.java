package ca.gc.cra.dualtap.api;

/**
 * Signals that a CLI step already logged its failure and the command should exit with {@link #exitCode()}.
 */
final class CliAbort extends Exception {
  private static final long serialVersionUID = 1L;

  private final transient ExitCode exitCode;

  CliAbort(ExitCode exitCode) {
    super(null, null, false, false);
    this.exitCode = exitCode;
  }

  ExitCode exitCode() {
    return exitCode;
  }
}
