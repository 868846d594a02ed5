package ca.gc.cra.sentinel.api;

import ca.gc.cra.sentinel.logging.LoggingConfigurator;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * SENTINEL command dispatcher.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: sentinel <serve|replay|waterfall|watch> [options]";
  private static final String HELP_TEXT = """
      SENTINEL HTTP traffic monitor

      Usage:
        sentinel <command> [options]

      Commands:
        serve       Run the monitoring pipeline with the HTTP pull and stream interfaces
        replay      Feed a HAR capture through the pipeline and print statistics and detections
        waterfall   Reconstruct a HAR capture into a waterfall table
        watch       Print live events from a running serve instance

      Global flags:
        --help      Show this message (or the command's help after the command name)
        --verbose   Enable DEBUG logging
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    if (exit.failed()) {
      log.debug("sentinel exiting with status {} ({})", exit.code(), exit.description());
    }
    System.exit(exit.code());
  }

  /**
   * Dispatches a subcommand and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments (first non-flag token is the subcommand)
   * @return exit code reported by the delegated command
   */
  static ExitCode run(String[] args) {
    String[] safeArgs = args == null ? new String[0] : args;
    int commandIndex = firstCommandIndex(safeArgs);
    if (commandIndex < 0) {
      CliInput input = CliInput.parse(safeArgs);
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    CliInput global = CliInput.parse(Arrays.copyOfRange(safeArgs, 0, commandIndex));
    if (global.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }
    if (global.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }

    String command = safeArgs[commandIndex].trim().toLowerCase(Locale.ROOT);
    List<String> delegate = new ArrayList<>(Arrays.asList(safeArgs).subList(commandIndex + 1, safeArgs.length));
    if (global.verbose()) {
      delegate.add("--verbose");
    }
    String[] delegateArgs = delegate.toArray(String[]::new);

    return switch (command) {
      case "serve" -> ServeCli.run(delegateArgs);
      case "replay" -> ReplayCli.run(delegateArgs);
      case "waterfall" -> WaterfallCli.run(delegateArgs);
      case "watch" -> WatchCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  private static int firstCommandIndex(String[] args) {
    for (int i = 0; i < args.length; i++) {
      String arg = args[i] == null ? "" : args[i].trim();
      if (!arg.isEmpty() && !arg.startsWith("-") && !arg.contains("=") && !"help".equalsIgnoreCase(arg)) {
        return i;
      }
    }
    return -1;
  }
}
