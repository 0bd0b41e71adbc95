package ca.gc.cra.parley.api;

import ca.gc.cra.parley.api.tools.RulesDryRunCli;
import ca.gc.cra.parley.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * PARLEY CLI dispatcher that routes to subcommands.
 *
 * @since PARLEY 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: parley <replay|rules> [options]";
  private static final String HELP_TEXT = """
      PARLEY command dispatcher

      Usage:
        parley <command> [options]

      Commands:
        replay      Replay a recorded conversation and gate on its latency (replay --help)
        rules       Dry-run the classification rule table over sample lines (rules --help)

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
   * @param args dispatcher arguments (first token is the subcommand)
   * @return exit code reported by the delegated CLI
   */
  static ExitCode run(String[] args) {
    String[] safeArgs = args == null ? new String[0] : args;
    if (safeArgs.length == 0) {
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String command = safeArgs[0] == null ? "" : safeArgs[0].trim().toLowerCase(Locale.ROOT);
    String[] delegateArgs = Arrays.copyOfRange(safeArgs, 1, safeArgs.length);
    if (command.startsWith("-") || command.equals("help")) {
      CliInput input = CliInput.parse(safeArgs);
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      if (input.verbose() && input.keyValueArgs().length > 0) {
        LoggingConfigurator.enableVerboseLogging();
        log.debug("Verbose logging enabled for dispatcher");
        return run(input.keyValueArgs());
      }
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    return switch (command) {
      case "replay" -> ReplayCli.run(delegateArgs);
      case "rules" -> RulesDryRunCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
