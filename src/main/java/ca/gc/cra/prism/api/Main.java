package ca.gc.cra.prism.api;

import ca.gc.cra.prism.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * PRISM CLI dispatcher that routes to subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: prism <ship|sample-config> [options]";
  private static final String HELP_TEXT = """
      PRISM command dispatcher

      Usage:
        prism <command> [options]

      Commands:
        ship           Ship NDJSON metric records to a Prometheus remote-write endpoint
        sample-config  Print an annotated prism.yaml

      Global flags:
        --help      Show this message (ship --help for command options)
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
   * @param args dispatcher arguments (first non-flag token is the command)
   * @return exit code reported by the command
   */
  static ExitCode run(String[] args) {
    String[] safeArgs = args == null ? new String[0] : args;
    int commandIndex = -1;
    for (int i = 0; i < safeArgs.length; i++) {
      if (safeArgs[i] != null && !safeArgs[i].isBlank() && !safeArgs[i].trim().startsWith("-")) {
        commandIndex = i;
        break;
      }
    }
    CliInput globals = CliInput.parse(
        Arrays.copyOfRange(safeArgs, 0, commandIndex < 0 ? safeArgs.length : commandIndex));
    if (commandIndex < 0) {
      if (globals.help()) {
        CliPrinter.printBlock(HELP_TEXT);
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (globals.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }

    String command = safeArgs[commandIndex].trim().toLowerCase(Locale.ROOT);
    String[] delegateArgs = Arrays.copyOfRange(safeArgs, commandIndex + 1, safeArgs.length);
    if (globals.help()) {
      delegateArgs = prepend("--help", delegateArgs);
    }
    return switch (command) {
      case "ship" -> ShipCli.run(delegateArgs);
      case "sample-config" -> SampleConfigCli.run(delegateArgs);
      case "help" -> {
        CliPrinter.printBlock(HELP_TEXT);
        yield ExitCode.SUCCESS;
      }
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  private static String[] prepend(String first, String[] rest) {
    String[] result = new String[rest.length + 1];
    result[0] = first;
    System.arraycopy(rest, 0, result, 1, rest.length);
    return result;
  }
}
