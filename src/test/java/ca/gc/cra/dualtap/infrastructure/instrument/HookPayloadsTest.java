package ca.gc.cra.dualtap.infrastructure.instrument;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class HookPayloadsTest {

  @Test
  void bundledScriptHooksWebViewAndOkHttp() throws IOException {
    String script = HookPayloads.load(null);

    assertTrue(script.contains("webview_load"));
    assertTrue(script.contains("okhttp_request"));
  }

  @Test
  void customScriptIsReadFromDisk(@TempDir Path dir) throws IOException {
    Path custom = dir.resolve("hooks.js");
    Files.writeString(custom, "send({type:'custom'});", StandardCharsets.UTF_8);

    assertEquals("send({type:'custom'});", HookPayloads.load(custom));
  }

  @Test
  void missingCustomScriptFails(@TempDir Path dir) {
    assertThrows(IOException.class, () -> HookPayloads.load(dir.resolve("absent.js")));
  }
}
