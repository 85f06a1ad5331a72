package ca.gc.cra.scribe.config;

import ca.gc.cra.scribe.application.port.LogFilter;
import ca.gc.cra.scribe.domain.log.LogLevel;
import ca.gc.cra.scribe.infrastructure.filter.LevelFilter;
import ca.gc.cra.scribe.infrastructure.filter.SensitiveDataFilter;
import ca.gc.cra.scribe.validation.Strings;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Maps a deployment {@link Environment} to a {@link LoggerConfig}.
 * <p><strong>Presets:</strong>
 * <ul>
 *   <li>{@code development}: DEBUG, text console (colors when interactive).</li>
 *   <li>{@code testing}: WARNING, text console without colors.</li>
 *   <li>{@code staging}: INFO, JSON console plus size-rotating {@code <logDir>/<name>.log}.</li>
 *   <li>{@code production}: INFO, JSON console at WARNING, daily-rotating {@code <logDir>/<name>.log} and
 *       size-rotating {@code <logDir>/<name>.error.log} at ERROR.</li>
 * </ul>
 * Every preset filters with {@code [LevelFilter(level), SensitiveDataFilter]}. Presets differ in thresholds,
 * sinks and rotation only, never in pipeline shape.</p>
 * <p><strong>Thread-safety:</strong> Stateless; selection is a pure function of its arguments.</p>
 *
 * @since 0.1.0
 */
public final class LoggerPresets {
  /** Size limit of size-rotating files. */
  public static final long DEFAULT_MAX_BYTES = 10L * 1024 * 1024;
  /** Numbered backups kept by size-rotating files. */
  public static final int DEFAULT_BACKUP_COUNT = 5;
  /** Dated backups kept by the production daily file. */
  public static final int DEFAULT_BACKUP_DAYS = 30;

  private LoggerPresets() {}

  /**
   * Builds the preset without overrides.
   *
   * @param name logger name; also names the log files
   * @param environment deployment environment
   * @param logDir directory for file handlers
   * @return configuration
   */
  public static LoggerConfig forEnvironment(String name, Environment environment, Path logDir) {
    return forEnvironment(name, environment, logDir, PresetOverrides.NONE);
  }

  /**
   * Builds the preset with operator overrides.
   *
   * @param name logger name; also names the log files
   * @param environment deployment environment
   * @param logDir directory for file handlers; replaced by {@link PresetOverrides#logDir()} when set
   * @param overrides overrides; {@code null} means none
   * @return configuration
   * @throws IllegalArgumentException if the name is blank
   */
  public static LoggerConfig forEnvironment(
      String name, Environment environment, Path logDir, PresetOverrides overrides) {
    Strings.requireNonBlank("name", name);
    Objects.requireNonNull(environment, "environment");
    PresetOverrides o = overrides == null ? PresetOverrides.NONE : overrides;
    Path dir = o.logDir() != null ? o.logDir() : Objects.requireNonNull(logDir, "logDir");
    String fileName = Strings.toFileName(name);
    long maxBytes = o.fileMaxBytes() != null ? o.fileMaxBytes() : DEFAULT_MAX_BYTES;
    int backupCount = o.fileBackupCount() != null ? o.fileBackupCount() : DEFAULT_BACKUP_COUNT;

    LogLevel level;
    List<HandlerSpec> handlers;
    switch (environment) {
      case DEVELOPMENT -> {
        level = or(o.level(), LogLevel.DEBUG);
        handlers = List.of(console(o, LogLevel.DEBUG, OutputFormat.TEXT, System.console() != null));
      }
      case TESTING -> {
        level = or(o.level(), LogLevel.WARNING);
        handlers = List.of(console(o, LogLevel.WARNING, OutputFormat.TEXT, false));
      }
      case STAGING -> {
        level = or(o.level(), LogLevel.INFO);
        handlers = List.of(
            console(o, LogLevel.INFO, OutputFormat.JSON, false),
            new SizeRotatingFileSpec(
                dir.resolve(fileName + ".log"), maxBytes, backupCount, LogLevel.INFO, OutputFormat.JSON));
      }
      case PRODUCTION -> {
        level = or(o.level(), LogLevel.INFO);
        int backupDays = o.dailyBackupDays() != null ? o.dailyBackupDays() : DEFAULT_BACKUP_DAYS;
        handlers = List.of(
            console(o, LogLevel.WARNING, OutputFormat.JSON, false),
            new DailyRotatingFileSpec(dir.resolve(fileName + ".log"), backupDays, LogLevel.INFO, OutputFormat.JSON),
            new SizeRotatingFileSpec(
                dir.resolve(fileName + ".error.log"), maxBytes, backupCount, LogLevel.ERROR, OutputFormat.JSON));
      }
      default -> throw new IllegalArgumentException("Unsupported environment " + environment);
    }
    List<LogFilter> filters = List.of(new LevelFilter(level), redaction(o));
    return new LoggerConfig(name, level, handlers, filters);
  }

  private static ConsoleHandlerSpec console(
      PresetOverrides o, LogLevel threshold, OutputFormat format, boolean colors) {
    OutputFormat effective = o.consoleFormat() != null ? o.consoleFormat() : format;
    boolean effectiveColors = o.consoleColors() != null ? o.consoleColors() : colors;
    return new ConsoleHandlerSpec(threshold, effective, effectiveColors);
  }

  private static SensitiveDataFilter redaction(PresetOverrides o) {
    SensitiveDataFilter filter = o.redactionSentinel() == null
        ? new SensitiveDataFilter()
        : new SensitiveDataFilter(SensitiveDataFilter.DEFAULT_KEYS, o.redactionSentinel());
    return o.redactionKeys().isEmpty() ? filter : filter.withAdditionalKeys(o.redactionKeys());
  }

  private static LogLevel or(LogLevel override, LogLevel preset) {
    return override != null ? override : preset;
  }
}
