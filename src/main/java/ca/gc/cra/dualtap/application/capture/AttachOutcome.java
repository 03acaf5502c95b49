package ca.gc.cra.dualtap.application.capture;

import java.util.List;
import java.util.Optional;

/**
 * Result of {@link InstrumentationCaptureUseCase#attach(String)}.
 *
 * @param success whether the adapter reached {@link AttachState#ACTIVE}
 * @param target process name or {@code pid:<n>} the session is bound to; {@code null} on failure
 * @param spawned whether the target was spawned rather than found running
 * @param attempts process names tried by name, in order
 * @param fault failure detail; {@code null} on success
 * @since 0.1.0
 */
public record AttachOutcome(
    boolean success, String target, boolean spawned, List<String> attempts, AttachFault fault) {

  public AttachOutcome {
    attempts = attempts == null ? List.of() : List.copyOf(attempts);
  }

  static AttachOutcome attached(String target, boolean spawned, List<String> attempts) {
    return new AttachOutcome(true, target, spawned, attempts, null);
  }

  static AttachOutcome failed(AttachFault fault, List<String> attempts) {
    return new AttachOutcome(false, null, false, attempts, fault);
  }

  /** @return the fault when the attempt failed */
  public Optional<AttachFault> failure() {
    return Optional.ofNullable(fault);
  }
}
