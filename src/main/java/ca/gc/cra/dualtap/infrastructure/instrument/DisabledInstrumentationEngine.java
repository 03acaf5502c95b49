package ca.gc.cra.dualtap.infrastructure.instrument;

import ca.gc.cra.dualtap.application.port.InstrumentationDevice;
import ca.gc.cra.dualtap.application.port.InstrumentationEngine;
import ca.gc.cra.dualtap.application.port.InstrumentationException;
import java.time.Duration;

/**
 * Engine used when no instrumentation toolkit is configured. Device lookup always fails, so a capture session
 * started with it degrades to traffic-only mode.
 */
public final class DisabledInstrumentationEngine implements InstrumentationEngine {
  @Override
  public InstrumentationDevice findDevice(Duration timeout) throws InstrumentationException {
    throw new InstrumentationException("instrumentation engine not configured (instrumentation=none)");
  }
}
