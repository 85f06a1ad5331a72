package ca.gc.cra.scribe.infrastructure.filter;

import ca.gc.cra.scribe.application.port.LogFilter;
import ca.gc.cra.scribe.domain.log.LogLevel;
import ca.gc.cra.scribe.domain.log.LogRecord;
import java.util.Objects;

/**
 * Vetoes records below a minimum level, comparing by {@link LogLevel} ordinal.
 *
 * @param minimum lowest level that passes
 * @since 0.1.0
 */
public record LevelFilter(LogLevel minimum) implements LogFilter {
  public LevelFilter {
    Objects.requireNonNull(minimum, "minimum");
  }

  @Override
  public FilterDecision apply(LogRecord record) {
    return record.level().isAtLeast(minimum) ? FilterDecision.keep(record) : FilterDecision.drop(record);
  }
}
