package ca.gc.cra.dualtap.api;

import ca.gc.cra.dualtap.logging.LoggingConfigurator;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * DUALTAP CLI dispatcher that routes to subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: dualtap <run|proxy|stats> [options]";
  private static final String HELP_TEXT = """
      DUALTAP dual-channel capture

      Usage:
        dualtap <command> [options]

      Commands:
        run         Forward proxy plus instrumentation, periodic reports until Ctrl+C
        proxy       Forward proxy only, periodic reports until Ctrl+C
        stats       Print one report for an existing capture database

      Global flags:
        --help      Show this message (or <command> --help for command options)
        --verbose   Enable DEBUG logging before dispatching to the command
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Dispatches a subcommand and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments (first non-flag token is the subcommand)
   * @return exit code reported by the delegated command
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    String[] remainder = input.keyValueArgs();
    if (remainder.length == 0) {
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }

    String command = remainder[0].toLowerCase(Locale.ROOT);
    String[] delegateArgs = delegateArgs(args, remainder[0]);

    return switch (command) {
      case CaptureCli.MODE_RUN -> CaptureCli.run(CaptureCli.MODE_RUN, delegateArgs);
      case CaptureCli.MODE_PROXY -> CaptureCli.run(CaptureCli.MODE_PROXY, delegateArgs);
      case StatsCli.MODE_STATS -> StatsCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  // Flags such as --dry-run and --help are passed through to the command
  private static String[] delegateArgs(String[] args, String commandToken) {
    int index = -1;
    for (int i = 0; i < args.length; i++) {
      if (args[i] != null && args[i].trim().equals(commandToken)) {
        index = i;
        break;
      }
    }
    String[] delegate = new String[args.length - 1];
    System.arraycopy(args, 0, delegate, 0, index);
    System.arraycopy(args, index + 1, delegate, index, args.length - index - 1);
    return delegate;
  }
}
