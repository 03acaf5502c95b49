package ca.gc.cra.dualtap.application.port;

import java.time.Instant;

/**
 * Source of capture timestamps.
 * <p>Tests substitute fixed or stepping clocks so ordering by timestamp is deterministic.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.dualtap.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current instant.
   *
   * @return wall-clock instant; subject to system clock adjustments
   */
  Instant now();

  /** Default clock backed by {@link Instant#now()}. */
  ClockPort SYSTEM = Instant::now;
}
