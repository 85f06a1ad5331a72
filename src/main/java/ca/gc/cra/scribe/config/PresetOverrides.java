package ca.gc.cra.scribe.config;

import ca.gc.cra.scribe.domain.log.LogLevel;
import ca.gc.cra.scribe.validation.Numbers;
import ca.gc.cra.scribe.validation.Strings;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Operator overrides applied on top of an environment preset. {@code null} components keep the preset value.
 *
 * @param level logger level
 * @param logDir directory for file handlers
 * @param consoleFormat console output format
 * @param consoleColors console ANSI colors
 * @param fileMaxBytes size limit of size-rotating files
 * @param fileBackupCount numbered backups kept
 * @param dailyBackupDays dated backups kept
 * @param redactionKeys blocklist entries added to the defaults
 * @param redactionSentinel replacement text for redacted values
 * @since 0.1.0
 */
public record PresetOverrides(
    LogLevel level,
    Path logDir,
    OutputFormat consoleFormat,
    Boolean consoleColors,
    Long fileMaxBytes,
    Integer fileBackupCount,
    Integer dailyBackupDays,
    List<String> redactionKeys,
    String redactionSentinel) {
  private static final Logger log = LoggerFactory.getLogger(PresetOverrides.class);

  /** Overrides that change nothing. */
  public static final PresetOverrides NONE =
      new PresetOverrides(null, null, null, null, null, null, null, List.of(), null);

  private static final Set<String> KNOWN_KEYS = Set.of(
      "level",
      "logDir",
      "console.format",
      "console.colors",
      "file.maxBytes",
      "file.backupCount",
      "daily.backupDays",
      "redaction.keys",
      "redaction.sentinel");

  public PresetOverrides {
    redactionKeys = redactionKeys == null ? List.of() : List.copyOf(redactionKeys);
  }

  /**
   * Parses a flat key/value map as produced by {@link YamlConfigLoader}. Unknown keys are logged and ignored;
   * blank values are treated as absent.
   *
   * @param settings flat settings
   * @return parsed overrides
   * @throws IllegalArgumentException when a value is malformed or out of range
   */
  public static PresetOverrides from(Map<String, String> settings) {
    if (settings == null || settings.isEmpty()) {
      return NONE;
    }
    for (String key : settings.keySet()) {
      if (!KNOWN_KEYS.contains(key)) {
        log.warn("Ignoring unknown logging setting '{}'", key);
      }
    }
    String level = value(settings, "level");
    String logDir = value(settings, "logDir");
    String format = value(settings, "console.format");
    String colors = value(settings, "console.colors");
    String maxBytes = value(settings, "file.maxBytes");
    String backupCount = value(settings, "file.backupCount");
    String backupDays = value(settings, "daily.backupDays");
    return new PresetOverrides(
        level == null ? null : LogLevel.fromString(level),
        logDir == null ? null : Path.of(logDir),
        format == null ? null : OutputFormat.fromString(format),
        colors == null ? null : parseBoolean("console.colors", colors),
        maxBytes == null
            ? null
            : Numbers.requireRange("file.maxBytes", Numbers.parseLong("file.maxBytes", maxBytes), 1, Long.MAX_VALUE),
        backupCount == null ? null : intSetting("file.backupCount", backupCount, 1_000),
        backupDays == null ? null : intSetting("daily.backupDays", backupDays, 36_500),
        splitKeys(value(settings, "redaction.keys")),
        value(settings, "redaction.sentinel"));
  }

  private static String value(Map<String, String> settings, String key) {
    return Strings.firstNonBlank(settings.get(key));
  }

  private static int intSetting(String name, String raw, int max) {
    return (int) Numbers.requireRange(name, Numbers.parseLong(name, raw), 0, max);
  }

  private static Boolean parseBoolean(String name, String raw) {
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "true", "yes", "on" -> Boolean.TRUE;
      case "false", "no", "off" -> Boolean.FALSE;
      default -> throw new IllegalArgumentException(name + " must be true or false (was " + raw + ")");
    };
  }

  private static List<String> splitKeys(String raw) {
    if (raw == null) {
      return List.of();
    }
    List<String> keys = new ArrayList<>();
    for (String token : raw.split(",")) {
      if (!token.isBlank()) {
        keys.add(token.trim());
      }
    }
    return keys;
  }
}
