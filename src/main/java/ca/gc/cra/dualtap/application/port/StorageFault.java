package ca.gc.cra.dualtap.application.port;

/**
 * Raised when the capture store cannot complete a write or read.
 * <p>The store never retries; callers decide whether to log and continue or to abort.</p>
 *
 * @since 0.1.0
 */
public class StorageFault extends RuntimeException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates a fault with a message.
   *
   * @param message description
   */
  public StorageFault(String message) {
    super(message);
  }

  /**
   * Creates a fault wrapping the underlying cause.
   *
   * @param message description
   * @param cause underlying failure, typically a {@link java.sql.SQLException}
   */
  public StorageFault(String message, Throwable cause) {
    super(message, cause);
  }
}
