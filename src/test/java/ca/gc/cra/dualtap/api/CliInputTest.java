package ca.gc.cra.dualtap.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Set;
import org.junit.jupiter.api.Test;

class CliInputTest {

  @Test
  void separatesFlagsFromKeyValueArguments() {
    CliInput input = CliInput.parse(new String[] {"run", "db=/tmp/x", "--Dry-Run", "--listenPort=9"});

    assertArrayEquals(new String[] {"run", "db=/tmp/x", "--listenPort=9"}, input.keyValueArgs());
    assertTrue(input.dryRun());
    assertTrue(input.hasFlag("--DRY-RUN"));
    assertFalse(input.help());
  }

  @Test
  void normalizesHelpAndVerboseAliases() {
    CliInput input = CliInput.parse(new String[] {"-h", "-v"});

    assertTrue(input.help());
    assertTrue(input.verbose());
    assertEquals(Set.of("--help", "--verbose"), input.flags());
    assertEquals(0, input.keyValueArgs().length);
  }

  @Test
  void helpWordCountsAsFlag() {
    assertTrue(CliInput.parse(new String[] {"help"}).help());
  }

  @Test
  void nullArgumentsAreEmpty() {
    CliInput input = CliInput.parse(null);

    assertEquals(0, input.keyValueArgs().length);
    assertFalse(input.hasFlag(null));
    assertFalse(input.hasFlag(" "));
  }
}
