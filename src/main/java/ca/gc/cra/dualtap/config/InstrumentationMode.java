package ca.gc.cra.dualtap.config;

import java.util.Locale;

/**
 * Instrumentation engine selection for the {@code run} command.
 *
 * @since 0.1.0
 */
public enum InstrumentationMode {
  /** No instrumentation device; the session degrades to traffic-only capture. */
  NONE,
  /** Pseudo device replaying recorded engine messages from an NDJSON file. */
  REPLAY;

  /**
   * Parses a mode name case-insensitively.
   *
   * @param raw mode name; blank yields {@code fallback}
   * @param fallback value used when {@code raw} is blank
   * @return parsed mode
   * @throws IllegalArgumentException if the name is unknown
   */
  public static InstrumentationMode parse(String raw, InstrumentationMode fallback) {
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    try {
      return InstrumentationMode.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("instrumentation must be NONE or REPLAY (was '" + raw + "')", ex);
    }
  }
}
