package ca.gc.cra.prism.api;

import ca.gc.cra.prism.logging.LoggingConfigurator;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * PRISM CLI dispatcher that routes to subcommands.
 *
 * @since PRISM 0.1
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: prism <aggregate|analyze|results> [options]";
  private static final String HELP_TEXT = """
      PRISM command dispatcher

      Usage:
        prism <command> [options]

      Commands:
        aggregate   Fetch a block range and print the plaintext aggregate (aggregate --help for details)
        analyze     Run an encoded analysis job end to end and print its summary
        results     List, show or delete stored results

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching to subcommand
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
   * @param args dispatcher arguments (first positional word is the subcommand)
   * @return exit code reported by the delegated CLI
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    String command = input.positional(0);
    if (command == null) {
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

    String[] delegateArgs = withoutFirst(args, command);
    return switch (command.toLowerCase(Locale.ROOT)) {
      case "aggregate" -> AggregateCli.run(delegateArgs);
      case "analyze" -> AnalyzeCli.run(delegateArgs);
      case "results" -> ResultsCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  // Flags may precede the command, so drop the command token itself rather than args[0].
  private static String[] withoutFirst(String[] args, String command) {
    List<String> remaining = new ArrayList<>();
    boolean dropped = false;
    for (String arg : args) {
      if (!dropped && arg != null && arg.trim().equals(command)) {
        dropped = true;
        continue;
      }
      remaining.add(arg);
    }
    return remaining.toArray(String[]::new);
  }
}
