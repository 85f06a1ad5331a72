package ca.gc.cra.scribe.api;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns {@code key=value} arguments into a map, rejecting unknown keys.
 *
 * @since 0.1.0
 */
public final class CliArgsParser {
  private static final Pattern KEY_PATTERN = Pattern.compile("^[A-Za-z][A-Za-z0-9._-]*$");

  private CliArgsParser() {}

  /**
   * Parses arguments split on the first {@code '='}.
   *
   * @param args arguments; {@code null} yields an empty map
   * @param allowedKeys accepted keys
   * @return ordered map of arguments
   * @throws IllegalArgumentException if an argument is not {@code key=value}, repeats a key, names an unknown key
   *     or contains control characters
   */
  public static Map<String, String> toMap(Iterable<String> args, Set<String> allowedKeys) {
    Map<String, String> map = new LinkedHashMap<>();
    if (args == null) {
      return map;
    }
    for (String raw : args) {
      String arg = raw == null ? "" : raw.trim();
      if (arg.isEmpty()) {
        continue;
      }
      int idx = arg.indexOf('=');
      if (idx <= 0) {
        throw new IllegalArgumentException("argument must be key=value (was '" + raw + "')");
      }
      String key = arg.substring(0, idx).trim();
      String value = arg.substring(idx + 1).trim();
      if (!KEY_PATTERN.matcher(key).matches()) {
        throw new IllegalArgumentException("invalid argument name: " + key);
      }
      if (!allowedKeys.contains(key)) {
        throw new IllegalArgumentException("unknown argument '" + key + "'; expected one of " + allowedKeys);
      }
      for (int i = 0; i < value.length(); i++) {
        if (Character.isISOControl(value.charAt(i))) {
          throw new IllegalArgumentException("argument " + key + " must not contain control characters");
        }
      }
      if (map.put(key, value) != null) {
        throw new IllegalArgumentException("argument " + key + " given more than once");
      }
    }
    return map;
  }
}
