package ca.gc.cra.scribe.config;

import ca.gc.cra.scribe.application.port.LogHandler;
import ca.gc.cra.scribe.domain.log.LogLevel;
import ca.gc.cra.scribe.infrastructure.handler.RotatingFileHandler;
import ca.gc.cra.scribe.validation.Numbers;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * File handler rotating by size into numbered backups.
 *
 * @param file active log file
 * @param maxBytes size limit in bytes
 * @param backupCount numbered backups kept
 * @param threshold minimum level written
 * @param format output format
 * @since 0.1.0
 */
public record SizeRotatingFileSpec(Path file, long maxBytes, int backupCount, LogLevel threshold, OutputFormat format)
    implements HandlerSpec {
  public SizeRotatingFileSpec {
    Objects.requireNonNull(file, "file");
    Numbers.requireRange("maxBytes", maxBytes, 1, Long.MAX_VALUE);
    Numbers.requireRange("backupCount", backupCount, 0, 1_000);
    Objects.requireNonNull(threshold, "threshold");
    Objects.requireNonNull(format, "format");
  }

  @Override
  public Optional<Path> target() {
    return Optional.of(file);
  }

  @Override
  public LogHandler open(HandlerContext context) {
    return new RotatingFileHandler(
        file, maxBytes, backupCount, threshold, format.create(false, context.zone()), context.metrics());
  }
}
