package ca.gc.cra.dualtap.application.capture;

import java.util.Objects;

/**
 * Terminal attach failure, tagged with the state the attempt was in when it failed.
 *
 * @since 0.1.0
 */
public class AttachFault extends Exception {
  private static final long serialVersionUID = 1L;

  private final AttachState failedIn;

  /**
   * @param failedIn state in which the attempt failed
   * @param message description
   * @param cause underlying engine failure, may be {@code null}
   */
  public AttachFault(AttachState failedIn, String message, Throwable cause) {
    super(message, cause);
    this.failedIn = Objects.requireNonNull(failedIn, "failedIn");
  }

  /** @return state in which the attempt failed */
  public AttachState failedIn() {
    return failedIn;
  }
}
