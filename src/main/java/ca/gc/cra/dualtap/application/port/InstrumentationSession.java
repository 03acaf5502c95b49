package ca.gc.cra.dualtap.application.port;

/**
 * Attachment to a single target process.
 *
 * @since 0.1.0
 */
public interface InstrumentationSession {
  /**
   * Compiles hook source into a script bound to this session.
   *
   * @param source hook script source
   * @return unloaded script
   * @throws InstrumentationException if the engine rejects the source
   */
  InstrumentationScript createScript(String source) throws InstrumentationException;

  /**
   * Detaches from the target process.
   *
   * @throws InstrumentationException if the engine reports a failure
   */
  void detach() throws InstrumentationException;
}
