package ca.gc.cra.dualtap.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Parsed representation of CLI arguments split into bare flags and {@code key=value} pairs.
 *
 * <p>Arguments of the form {@code --key=value} are kept as key/value pairs; {@link CliArgsParser} strips the dashes.
 * Anything else starting with {@code -} is treated as a flag.</p>
 */
public final class CliInput {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");

  private final String[] positional;
  private final Set<String> flags;

  private CliInput(String[] positional, Set<String> flags) {
    this.positional = positional;
    this.flags = flags;
  }

  /**
   * Parses raw arguments into flag and key/value partitions.
   *
   * @param args raw CLI arguments (may be {@code null})
   * @return parsed representation of the arguments
   */
  public static CliInput parse(String[] args) {
    if (args == null || args.length == 0) {
      return new CliInput(new String[0], Set.of());
    }

    List<String> kv = new ArrayList<>();
    Set<String> flags = new LinkedHashSet<>();
    for (String raw : args) {
      if (raw == null) {
        continue;
      }
      String arg = raw.trim();
      if (arg.isEmpty()) {
        continue;
      }
      String lower = arg.toLowerCase(Locale.ROOT);
      if (HELP_FLAGS.contains(lower)) {
        flags.add("--help");
      } else if (VERBOSE_FLAGS.contains(lower)) {
        flags.add("--verbose");
      } else if (arg.startsWith("-") && !arg.contains("=")) {
        flags.add(lower);
      } else {
        kv.add(arg);
      }
    }
    return new CliInput(kv.toArray(String[]::new), Set.copyOf(flags));
  }

  /**
   * Returns a copy of the non-flag arguments in command-line order.
   *
   * @return command token (for the dispatcher) and {@code key=value} arguments
   */
  public String[] keyValueArgs() {
    return Arrays.copyOf(positional, positional.length);
  }

  /** @return {@code true} if help output was requested */
  public boolean help() {
    return flags.contains("--help");
  }

  /** @return {@code true} when {@code --verbose} (or an alias) was present */
  public boolean verbose() {
    return flags.contains("--verbose");
  }

  /** @return {@code true} when {@code --dry-run} was present */
  public boolean dryRun() {
    return flags.contains("--dry-run");
  }

  /**
   * Checks whether a flag such as {@code --dry-run} was provided.
   *
   * @param flag flag to query (case-insensitive)
   * @return {@code true} if the flag was supplied
   */
  public boolean hasFlag(String flag) {
    if (flag == null || flag.isBlank()) {
      return false;
    }
    return flags.contains(flag.trim().toLowerCase(Locale.ROOT));
  }

  /** @return all normalized flags supplied on the command line */
  public Set<String> flags() {
    return flags;
  }
}
