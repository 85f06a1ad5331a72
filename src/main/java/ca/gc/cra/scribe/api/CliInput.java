package ca.gc.cra.scribe.api;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Command-line arguments split into the command, global flags and remaining {@code key=value} arguments.
 *
 * @param command first non-flag argument, or {@code null}
 * @param arguments arguments after the command
 * @param help {@code true} when a help flag was present
 * @param verbose {@code true} when a verbose flag was present
 */
record CliInput(String command, List<String> arguments, boolean help, boolean verbose) {
  private static final Set<String> HELP_FLAGS = Set.of("--help", "-h", "help");
  private static final Set<String> VERBOSE_FLAGS = Set.of("--verbose", "-v", "--debug");

  CliInput {
    arguments = List.copyOf(arguments);
  }

  static CliInput parse(String[] args) {
    String command = null;
    List<String> rest = new ArrayList<>();
    boolean help = false;
    boolean verbose = false;
    if (args != null) {
      for (String raw : args) {
        String arg = raw == null ? "" : raw.trim();
        String lower = arg.toLowerCase(Locale.ROOT);
        if (arg.isEmpty()) {
          continue;
        } else if (HELP_FLAGS.contains(lower)) {
          help = true;
        } else if (VERBOSE_FLAGS.contains(lower)) {
          verbose = true;
        } else if (command == null) {
          command = lower;
        } else {
          rest.add(arg);
        }
      }
    }
    return new CliInput(command, rest, help, verbose);
  }
}
