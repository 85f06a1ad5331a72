package ca.gc.cra.scribe.api;

import ca.gc.cra.scribe.diagnostics.DiagnosticsConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * SCRIBE command-line dispatcher.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  static final String USAGE =
      "usage: scribe demo [env=<environment>] [logDir=<dir>] [config=<yaml>] [metrics=none|otel] [--verbose]";
  private static final String HELP_TEXT = """
      SCRIBE structured logging

      Usage:
        scribe <command> [options]

      Commands:
        demo        Emit sample records through the selected environment preset

      Demo options:
        env=...     development | testing | staging | production (default: ENVIRONMENT or development)
        logDir=...  Directory for file handlers (default: LOG_DIR or logs)
        config=...  YAML overrides file (default: SCRIBE_CONFIG)
        metrics=... none | otel

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG diagnostics for SCRIBE internals
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      DiagnosticsConfigurator.enableVerboseDiagnostics();
      log.debug("Verbose diagnostics enabled");
    }
    if (input.command() == null) {
      log.error("Missing command");
      CliPrinter.println(USAGE);
      return ExitCode.INVALID_ARGS;
    }
    try {
      return switch (input.command()) {
        case "demo" -> DemoCli.run(input.arguments(), System.out);
        default -> {
          log.error("Unknown command: {}", input.command());
          CliPrinter.println(USAGE);
          yield ExitCode.INVALID_ARGS;
        }
      };
    } catch (RuntimeException ex) {
      log.error("Command {} failed", input.command(), ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
