package ca.gc.cra.dualtap.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LogsTest {

  @Test
  void truncateKeepsShortValues() {
    assertEquals("https://dawn.com/", Logs.truncate("https://dawn.com/", 32));
    assertEquals("<null>", Logs.truncate(null, 32));
  }

  @Test
  void truncateReportsOriginalLength() {
    assertEquals("abcde... (truncated, 5 of 10)", Logs.truncate("abcdefghij", 5));
  }

  @Test
  void truncateDoesNotSplitSurrogatePairs() {
    String value = "ab😀cd";

    assertTrue(Logs.truncate(value, 3).startsWith("ab..."));
  }

  @Test
  void truncateRejectsNonPositiveBudget() {
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("x", 0));
  }

  @Test
  void setLevelUpdatesLogbackLogger() {
    String name = "ca.gc.cra.dualtap.logging.test";

    assertTrue(LoggingConfigurator.setLevel(name, Level.TRACE));
    assertEquals(Level.TRACE, ((Logger) LoggerFactory.getLogger(name)).getLevel());
  }
}
