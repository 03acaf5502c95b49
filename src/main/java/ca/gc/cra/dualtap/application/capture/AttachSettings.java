package ca.gc.cra.dualtap.application.capture;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Immutable attach parameters.
 *
 * @param deviceTimeout bound on device lookup
 * @param fallbackProcesses candidates tried in order when no process name is given
 * @param spawnTarget program spawned when every fallback candidate is absent
 * @param hookSource hook script source injected after attach
 * @since 0.1.0
 */
public record AttachSettings(
    Duration deviceTimeout, List<String> fallbackProcesses, String spawnTarget, String hookSource) {

  /** Browsers tried when no process is named. */
  public static final List<String> DEFAULT_FALLBACKS =
      List.of("com.android.chrome", "org.mozilla.firefox", "com.opera.browser");
  /** Program spawned when no fallback candidate is running. */
  public static final String DEFAULT_SPAWN_TARGET = "com.android.chrome";
  /** Default device lookup bound. */
  public static final Duration DEFAULT_DEVICE_TIMEOUT = Duration.ofSeconds(10);

  public AttachSettings {
    Objects.requireNonNull(deviceTimeout, "deviceTimeout");
    fallbackProcesses = List.copyOf(Objects.requireNonNull(fallbackProcesses, "fallbackProcesses"));
    Objects.requireNonNull(spawnTarget, "spawnTarget");
    Objects.requireNonNull(hookSource, "hookSource");
  }
}
