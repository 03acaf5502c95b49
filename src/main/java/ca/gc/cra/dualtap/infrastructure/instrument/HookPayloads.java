package ca.gc.cra.dualtap.infrastructure.instrument;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads the hook script injected into target processes.
 * <p>The bundled script hooks {@code WebView.loadUrl} and the OkHttp request builder and reports each call with
 * {@code send()}.</p>
 *
 * @since 0.1.0
 */
public final class HookPayloads {
  /** Classpath location of the bundled hook script. */
  public static final String DEFAULT_RESOURCE = "/hooks/default-hooks.js";

  private HookPayloads() {}

  /**
   * Loads a hook script from {@code file}, or the bundled script when {@code file} is {@code null}.
   *
   * @param file script path, may be {@code null}
   * @return script source
   * @throws IOException if the script cannot be read
   */
  public static String load(Path file) throws IOException {
    if (file != null) {
      return Files.readString(file, StandardCharsets.UTF_8);
    }
    try (InputStream in = HookPayloads.class.getResourceAsStream(DEFAULT_RESOURCE)) {
      if (in == null) {
        throw new FileNotFoundException("bundled hook script missing: " + DEFAULT_RESOURCE);
      }
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }
  }
}
