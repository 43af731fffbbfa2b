package ca.gc.nrc.pyxis.api;

import ca.gc.nrc.pyxis.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * PYXIS command dispatcher.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: pyxis <run|inspect> [options]";
  private static final String HELP_TEXT = """
      PYXIS data-reduction pipeline

      Usage:
        pyxis <command> [options]

      Commands:
        run         Run the modules of a recipe against a working directory (run --help for details)
        inspect     List datasets and attributes of a storage container

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging
      """;

  private Main() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  /**
   * Dispatches a command and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments; the first non-flag token is the command
   * @return exit code of the command
   */
  static ExitCode run(String[] args) {
    String[] tokens = args == null ? new String[0] : args;
    int commandIndex = -1;
    for (int i = 0; i < tokens.length; i++) {
      if (tokens[i] != null && !tokens[i].isBlank() && !tokens[i].trim().startsWith("-")) {
        commandIndex = i;
        break;
      }
    }
    if (commandIndex < 0) {
      CliInput input = CliInput.parse(tokens);
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String command = tokens[commandIndex].trim().toLowerCase(Locale.ROOT);
    String[] delegateArgs = new String[tokens.length - 1];
    System.arraycopy(tokens, 0, delegateArgs, 0, commandIndex);
    System.arraycopy(tokens, commandIndex + 1, delegateArgs, commandIndex, tokens.length - commandIndex - 1);
    if (CliInput.parse(delegateArgs).verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Dispatching '{}' with {}", command, Arrays.toString(delegateArgs));
    }

    return switch (command) {
      case "run" -> RunCli.run(delegateArgs);
      case "inspect" -> InspectCli.run(delegateArgs);
      case "help" -> {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        yield ExitCode.SUCCESS;
      }
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
