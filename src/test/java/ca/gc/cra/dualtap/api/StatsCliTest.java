package ca.gc.cra.dualtap.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.dualtap.application.port.MetricsPort;
import ca.gc.cra.dualtap.domain.capture.NetworkTrafficRecord;
import ca.gc.cra.dualtap.domain.capture.ScrapedArtifactRecord;
import ca.gc.cra.dualtap.infrastructure.persistence.jdbc.JdbcEventStore;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class StatsCliTest {
  @TempDir Path tempDir;

  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer, true));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void reportsExistingDatabase() {
    Path db = tempDir.resolve("capture");
    try (JdbcEventStore store = JdbcEventStore.forFile(db, MetricsPort.NO_OP)) {
      store.initialize();
      store.append(NetworkTrafficRecord.request(Instant.EPOCH, "GET", "http://dawn.com/", Map.of(), null));
      store.append(new ScrapedArtifactRecord(
          Instant.EPOCH, "Hello World Example", "http://example.com/", null, null, "html_title"));
    }

    ExitCode code = StatsCli.run(new String[] {"db=" + db, "metricsExporter=none"});

    assertEquals(ExitCode.SUCCESS, code);
    String out = buffer.toString();
    assertTrue(out.contains("Network requests: 1"));
    assertTrue(out.contains("Hook events: 0"));
    assertTrue(out.contains("Scraped articles: 1"));
    assertTrue(out.contains("- Hello World Example"));
  }

  @Test
  void missingDatabaseReportsEmptyStore() {
    ExitCode code = StatsCli.run(new String[] {"db=" + tempDir.resolve("fresh/capture"), "metricsExporter=none"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("Network requests: 0"));
  }

  @Test
  void invalidArgumentIsRejected() {
    assertEquals(ExitCode.INVALID_ARGS, StatsCli.run(new String[] {"db"}));
  }
}
