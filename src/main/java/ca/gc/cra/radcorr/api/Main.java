package ca.gc.cra.radcorr.api;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * RADCORR CLI dispatcher that routes to subcommands.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: radcorr <correct|inspect> [options]";
  private static final String HELP_TEXT = """
      RADCORR command dispatcher

      Usage:
        radcorr <command> [options]

      Commands:
        correct     Radiometrically correct a reflectance cube (correct --help for details)
        inspect     Summarize a header, band statistics or a pixel spectrum

      Global flags:
        --help      Show this message, or the command's help when a command is given
        --verbose   Enable DEBUG logging
      """;

  private Main() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  /**
   * Dispatches to a subcommand without terminating the JVM. Every argument other than the command name,
   * flags included, is passed through to the subcommand.
   *
   * @param args dispatcher arguments
   * @return exit code reported by the subcommand
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    String[] positional = input.keyValueArgs();
    if (positional.length == 0 || positional[0].contains("=")) {
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String command = positional[0];
    String[] delegateArgs = without(args, command);
    return switch (command.toLowerCase(Locale.ROOT)) {
      case "correct" -> CorrectCli.run(delegateArgs);
      case "inspect" -> InspectCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  private static String[] without(String[] args, String command) {
    List<String> rest = new ArrayList<>(args.length);
    boolean removed = false;
    for (String arg : args) {
      if (!removed && arg != null && arg.trim().equals(command)) {
        removed = true;
        continue;
      }
      rest.add(arg);
    }
    return rest.toArray(String[]::new);
  }
}
