package ca.gc.cra.dualtap.application.port;

import java.time.Duration;

/**
 * <strong>What:</strong> Entry point to a dynamic instrumentation toolkit able to inject hook code into a running
 * process.
 * <p><strong>Role:</strong> Driven port used by
 * {@link ca.gc.cra.dualtap.application.capture.InstrumentationCaptureUseCase}.</p>
 *
 * @since 0.1.0
 * @see InstrumentationDevice
 */
public interface InstrumentationEngine {
  /**
   * Locates the device hosting target processes.
   *
   * @param timeout upper bound on the lookup
   * @return device handle
   * @throws InstrumentationException if no device is reachable within {@code timeout}
   */
  InstrumentationDevice findDevice(Duration timeout) throws InstrumentationException;
}
