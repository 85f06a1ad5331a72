package ca.gc.cra.scribe.config;

import ca.gc.cra.scribe.validation.Strings;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Process-level logging settings: environment, log directory and YAML overrides.
 * <p><strong>Sources:</strong> system properties win over environment variables:
 * {@code scribe.environment}/{@code ENVIRONMENT}, {@code scribe.log.dir}/{@code LOG_DIR} (default {@code logs})
 * and {@code scribe.config}/{@code SCRIBE_CONFIG} naming an optional YAML file.</p>
 * <p><strong>Errors:</strong> an unknown environment, a malformed YAML file or an invalid override raises
 * {@link IllegalArgumentException}; an unreadable file raises {@link UncheckedIOException}.</p>
 *
 * @param environment active environment
 * @param logDir directory for file handlers
 * @param overrides YAML overrides for the active environment
 * @since 0.1.0
 */
public record LoggingSettings(Environment environment, Path logDir, PresetOverrides overrides) {
  private static final Logger log = LoggerFactory.getLogger(LoggingSettings.class);

  /** System property naming the log directory. */
  public static final String LOG_DIR_PROPERTY = "scribe.log.dir";
  /** Environment variable naming the log directory. */
  public static final String LOG_DIR_VARIABLE = "LOG_DIR";
  /** System property naming the YAML overrides file. */
  public static final String CONFIG_PROPERTY = "scribe.config";
  /** Environment variable naming the YAML overrides file. */
  public static final String CONFIG_VARIABLE = "SCRIBE_CONFIG";
  /** Log directory used when none is configured. */
  public static final String DEFAULT_LOG_DIR = "logs";

  public LoggingSettings {
    Objects.requireNonNull(environment, "environment");
    Objects.requireNonNull(logDir, "logDir");
    overrides = overrides == null ? PresetOverrides.NONE : overrides;
  }

  /**
   * Reads settings from system properties and environment variables.
   *
   * @return resolved settings
   */
  public static LoggingSettings fromEnvironment() {
    return resolve(null, null, null);
  }

  /**
   * Resolves settings, preferring explicit arguments over system properties and environment variables.
   *
   * @param environment explicit environment name, or {@code null}
   * @param logDir explicit log directory, or {@code null}
   * @param configFile explicit YAML file, or {@code null}
   * @return resolved settings
   */
  public static LoggingSettings resolve(String environment, String logDir, String configFile) {
    Environment env = Strings.firstNonBlank(environment) != null
        ? Environment.fromString(environment)
        : Environment.detect();
    String config = Strings.firstNonBlank(
        configFile, System.getProperty(CONFIG_PROPERTY), System.getenv(CONFIG_VARIABLE));
    PresetOverrides overrides = config == null ? PresetOverrides.NONE : loadOverrides(Path.of(config), env);
    String dir = Strings.firstNonBlank(
        logDir, System.getProperty(LOG_DIR_PROPERTY), System.getenv(LOG_DIR_VARIABLE), DEFAULT_LOG_DIR);
    return new LoggingSettings(env, Path.of(dir), overrides);
  }

  /**
   * Builds the preset configuration for {@code name}.
   *
   * @param name logger name
   * @return configuration
   */
  public LoggerConfig configFor(String name) {
    return LoggerPresets.forEnvironment(name, environment, logDir, overrides);
  }

  private static PresetOverrides loadOverrides(Path file, Environment env) {
    try {
      Map<String, String> flat = YamlConfigLoader.load(file, env).orElse(null);
      if (flat == null) {
        log.warn("Logging config {} not found; using {} preset defaults", file, env.key());
        return PresetOverrides.NONE;
      }
      log.debug("Loaded {} logging settings from {}", flat.size(), file);
      return PresetOverrides.from(flat);
    } catch (IOException ex) {
      throw new UncheckedIOException("Unable to read logging config " + file, ex);
    }
  }
}
