package ca.gc.cra.dualtap.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class CaptureCliTest {
  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(CaptureCliSupport.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer, true));
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    CliPrinter.clearTestWriter();
  }

  private String db() {
    return "db=" + tempDir.resolve("data/capture");
  }

  @Test
  void proxyDryRunPrintsPlanWithoutCreatingDatabase() {
    ExitCode code = CaptureCli.run(CaptureCli.MODE_PROXY, new String[] {
        db(), "listenPort=0", "targetDomains=example.com", "metricsExporter=none", "--dry-run"});

    assertEquals(ExitCode.SUCCESS, code);
    String out = buffer.toString();
    assertTrue(out.contains("DUALTAP proxy dry-run"));
    assertTrue(out.contains("Target domains   : example.com"));
    assertTrue(out.contains("Instrumentation  : <disabled>"));
    assertFalse(Files.exists(tempDir.resolve("data")));
  }

  @Test
  void runDryRunShowsInstrumentationPlan() throws IOException {
    Path recording = Files.writeString(tempDir.resolve("rec.ndjson"), "");

    ExitCode code = CaptureCli.run(CaptureCli.MODE_RUN, new String[] {
        db(), "instrumentation=replay", "replayFile=" + recording, "process=com.example.app",
        "metricsExporter=none", "--dry-run"});

    assertEquals(ExitCode.SUCCESS, code);
    String out = buffer.toString();
    assertTrue(out.contains("Instrumentation  : REPLAY"));
    assertTrue(out.contains("Process          : com.example.app"));
  }

  @Test
  void yamlConfigIsHonoured() throws IOException {
    Path yaml = Files.writeString(tempDir.resolve("dualtap.yaml"), """
        common:
          metricsExporter: none
        proxy:
          listenPort: 9191
          targetDomains:
            - example.org
        """);

    ExitCode code = CaptureCli.run(CaptureCli.MODE_PROXY, new String[] {"config=" + yaml, db(), "--dry-run"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("Proxy            : 127.0.0.1:9191"));
    assertTrue(buffer.toString().contains("Target domains   : example.org"));
  }

  @Test
  void missingConfigFileIsInvalidArgs() {
    ExitCode code = CaptureCli.run(CaptureCli.MODE_RUN, new String[] {
        "config=" + tempDir.resolve("absent.yaml"), "--dry-run"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(hasLogContaining("Configuration file does not exist"));
  }

  @Test
  void processIsRejectedByProxyCommand() {
    ExitCode code = CaptureCli.run(CaptureCli.MODE_PROXY, new String[] {
        db(), "process=com.android.chrome", "--dry-run"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: proxy"));
  }

  @Test
  void invalidValuesAreInvalidArgs() {
    assertEquals(ExitCode.INVALID_ARGS,
        CaptureCli.run(CaptureCli.MODE_PROXY, new String[] {db(), "listenPort=99999", "--dry-run"}));
    assertEquals(ExitCode.INVALID_ARGS,
        CaptureCli.run(CaptureCli.MODE_PROXY, new String[] {db(), "notAKeyValue", "--dry-run"}));
  }

  @Test
  void unreadableReplayFileIsIoError() {
    ExitCode code = CaptureCli.run(CaptureCli.MODE_RUN, new String[] {
        db(), "instrumentation=replay", "replayFile=" + tempDir.resolve("absent.ndjson"), "--dry-run"});

    assertEquals(ExitCode.IO_ERROR, code);
    assertTrue(hasLogContaining("replayFile does not exist"));
  }

  @Test
  void helpPrintsCommandOptions() {
    assertEquals(ExitCode.SUCCESS, CaptureCli.run(CaptureCli.MODE_RUN, new String[] {"--help"}));
    assertTrue(buffer.toString().contains("fallbackProcesses=a,b"));
  }

  private boolean hasLogContaining(String fragment) {
    return appender.list.stream().anyMatch(event -> event.getFormattedMessage().contains(fragment));
  }
}
