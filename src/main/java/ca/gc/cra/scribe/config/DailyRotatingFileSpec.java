package ca.gc.cra.scribe.config;

import ca.gc.cra.scribe.application.port.LogHandler;
import ca.gc.cra.scribe.domain.log.LogLevel;
import ca.gc.cra.scribe.infrastructure.handler.DailyRotatingFileHandler;
import ca.gc.cra.scribe.validation.Numbers;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * File handler rotating at local midnight into dated backups.
 *
 * @param file active log file
 * @param backupDays dated backups kept; {@code 0} keeps all
 * @param threshold minimum level written
 * @param format output format
 * @since 0.1.0
 */
public record DailyRotatingFileSpec(Path file, int backupDays, LogLevel threshold, OutputFormat format)
    implements HandlerSpec {
  public DailyRotatingFileSpec {
    Objects.requireNonNull(file, "file");
    Numbers.requireRange("backupDays", backupDays, 0, 36_500);
    Objects.requireNonNull(threshold, "threshold");
    Objects.requireNonNull(format, "format");
  }

  @Override
  public Optional<Path> target() {
    return Optional.of(file);
  }

  @Override
  public LogHandler open(HandlerContext context) {
    return new DailyRotatingFileHandler(
        file,
        backupDays,
        context.zone(),
        context.clock(),
        threshold,
        format.create(false, context.zone()),
        context.metrics());
  }
}
