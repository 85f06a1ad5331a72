package ca.gc.cra.scribe.validation;

import java.util.Objects;

/**
 * <strong>What:</strong> String validation helpers for configuration and filter construction.
 * <p><strong>Why:</strong> Logger names, redaction fragments and file names come from environment variables and
 * YAML files; blank or control-character values are rejected before any sink is opened.</p>
 * <p><strong>Thread-safety:</strong> Stateless utility.</p>
 * <p><strong>Observability:</strong> No logs; violations raise {@link IllegalArgumentException}.</p>
 *
 * @since 0.1.0
 * @see Numbers
 * @see Paths
 */
public final class Strings {
  private Strings() {
    // Utility
  }

  /**
   * Ensures a value is non-null, non-blank and free of control characters.
   *
   * @param name parameter name used in diagnostics; {@code null} defaults to {@code "value"}
   * @param value candidate text
   * @return trimmed value
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, label(name));
    if (containsControl(raw)) {
      throw new IllegalArgumentException(label(name) + " must not contain control characters");
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(label(name) + " must not be blank");
    }
    return trimmed;
  }

  /**
   * Returns the first argument that is neither {@code null} nor blank, trimmed.
   *
   * @param candidates values in priority order
   * @return first non-blank candidate, or {@code null} when none qualifies
   */
  public static String firstNonBlank(String... candidates) {
    if (candidates == null) {
      return null;
    }
    for (String candidate : candidates) {
      if (candidate != null && !candidate.isBlank()) {
        return candidate.trim();
      }
    }
    return null;
  }

  /**
   * Replaces characters that are unsafe in file names with {@code '_'}.
   *
   * @param value logger or file name
   * @return name composed of letters, digits, {@code '.'}, {@code '-'} and {@code '_'}; {@code "app"} when empty
   */
  public static String toFileName(String value) {
    if (value == null) {
      return "app";
    }
    StringBuilder sb = new StringBuilder(value.length());
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      sb.append(Character.isLetterOrDigit(c) || c == '-' || c == '_' || c == '.' ? c : '_');
    }
    return sb.length() == 0 ? "app" : sb.toString();
  }

  static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
