package ca.gc.cra.dualtap.application.capture;

/**
 * Lifecycle of an instrumentation attach attempt.
 * <p>{@code IDLE -> DEVICE_LOOKUP -> (EXPLICIT_ATTACH | FALLBACK_ATTACH [-> SPAWN]) -> SCRIPTED -> ACTIVE}.
 * {@link #FAILED} is reachable from every non-terminal state.</p>
 *
 * @since 0.1.0
 */
public enum AttachState {
  IDLE,
  DEVICE_LOOKUP,
  EXPLICIT_ATTACH,
  FALLBACK_ATTACH,
  SPAWN,
  SCRIPTED,
  ACTIVE,
  FAILED
}
