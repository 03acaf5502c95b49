package ca.gc.cra.dualtap.application.port;

/**
 * Device exposing processes that can be attached to or spawned.
 *
 * @since 0.1.0
 */
public interface InstrumentationDevice {
  /** @return device identifier used in logs */
  String id();

  /**
   * Attaches to a running process by name.
   *
   * @param processName process or package name
   * @return attached session
   * @throws ProcessNotFoundException if no process carries that name
   * @throws InstrumentationException for any other attach failure
   */
  InstrumentationSession attach(String processName) throws InstrumentationException;

  /**
   * Attaches to a process by pid.
   *
   * @param pid process identifier
   * @return attached session
   * @throws InstrumentationException if the attach fails
   */
  InstrumentationSession attach(int pid) throws InstrumentationException;

  /**
   * Spawns a program suspended.
   *
   * @param program program or package name
   * @return pid of the suspended process
   * @throws InstrumentationException if the spawn fails
   */
  int spawn(String program) throws InstrumentationException;

  /**
   * Resumes a process previously returned by {@link #spawn(String)}.
   *
   * @param pid process identifier
   * @throws InstrumentationException if the resume fails
   */
  void resume(int pid) throws InstrumentationException;
}
