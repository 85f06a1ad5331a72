package ca.gc.cra.scribe.config;

import ca.gc.cra.scribe.validation.Strings;
import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Deployment environments selecting a logging preset.
 *
 * @since 0.1.0
 */
public enum Environment {
  DEVELOPMENT,
  TESTING,
  STAGING,
  PRODUCTION;

  /** Environment variable naming the active environment. */
  public static final String ENV_VARIABLE = "ENVIRONMENT";
  /** System property naming the active environment; wins over {@value #ENV_VARIABLE}. */
  public static final String PROPERTY = "scribe.environment";

  /**
   * Returns the lower-case name used in configuration files and variables.
   *
   * @return key such as {@code "production"}
   */
  public String key() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Parses an environment name, ignoring case and surrounding whitespace.
   *
   * @param value environment name
   * @return matching environment
   * @throws IllegalArgumentException if {@code value} is blank or names no environment
   */
  public static Environment fromString(String value) {
    String normalized = Strings.requireNonBlank("environment", value).trim().toUpperCase(Locale.ROOT);
    for (Environment candidate : values()) {
      if (candidate.name().equals(normalized)) {
        return candidate;
      }
    }
    throw new IllegalArgumentException("Unknown environment '" + value + "'; expected one of "
        + Arrays.stream(values()).map(Environment::key).collect(Collectors.joining(", ")));
  }

  /**
   * Resolves the active environment from {@value #PROPERTY}, then {@value #ENV_VARIABLE}, defaulting to
   * {@link #DEVELOPMENT}.
   *
   * @return active environment
   * @throws IllegalArgumentException if a configured value names no environment
   */
  public static Environment detect() {
    return resolve(System.getProperty(PROPERTY), System.getenv(ENV_VARIABLE));
  }

  static Environment resolve(String property, String variable) {
    String value = Strings.firstNonBlank(property, variable);
    return value == null ? DEVELOPMENT : fromString(value);
  }
}
