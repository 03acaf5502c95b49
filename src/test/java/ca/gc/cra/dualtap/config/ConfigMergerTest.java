package ca.gc.cra.dualtap.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void cliOverridesYamlAndEmitsWarning() {
    Map<String, String> defaults = Map.of("listenPort", "8080", "metricsExporter", "otlp");
    Map<String, String> yaml = Map.of("listenPort", "9090", "reportIntervalMs", "500");
    Map<String, String> cli = Map.of("listenPort", "9191");
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "run", Optional.of(yaml), cli, defaults, warnings::add);

    assertEquals("9191", merged.get("listenPort"));
    assertEquals("500", merged.get("reportIntervalMs"));
    assertEquals("otlp", merged.get("metricsExporter"));
    assertEquals(List.of("CLI overrides YAML for key: listenPort"), warnings);
  }

  @Test
  void yamlOverridesDefaultsSilently() {
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        "proxy", Optional.of(Map.of("listenHost", "0.0.0.0")), Map.of(),
        DefaultsForMode.asFlatMap("proxy"), warnings::add);

    assertEquals("0.0.0.0", merged.get("listenHost"));
    assertTrue(warnings.isEmpty());
  }

  @Test
  void replayRequiresRecordingPath() {
    assertThrows(IllegalArgumentException.class, () -> ConfigMerger.buildEffectiveConfig(
        "run", Optional.empty(), Map.of("instrumentation", "Replay"), DefaultsForMode.asFlatMap("run"), msg -> {}));
  }

  @Test
  void proxyCommandRejectsProcess() {
    assertThrows(IllegalArgumentException.class, () -> ConfigMerger.buildEffectiveConfig(
        "proxy", Optional.of(Map.of("process", "com.android.chrome")), Map.of(),
        DefaultsForMode.asFlatMap("proxy"), msg -> {}));
  }
}
