package ca.gc.cra.scribe.config;

import ca.gc.cra.scribe.application.port.LogFilter;
import ca.gc.cra.scribe.domain.log.LogLevel;
import ca.gc.cra.scribe.infrastructure.filter.LevelFilter;
import ca.gc.cra.scribe.infrastructure.filter.SensitiveDataFilter;
import ca.gc.cra.scribe.validation.Strings;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable bundle of logger name, level, handler specs and filters.
 * <p><strong>Redaction:</strong> A configuration without a {@link SensitiveDataFilter} gets a default one
 * appended, so sensitive keys are redacted whatever the caller configured.</p>
 * <p><strong>Identity:</strong> Value equality over every component; {@link #fingerprint()} summarizes the
 * content for diagnostics and cache keys.</p>
 *
 * @param name logger name
 * @param level logger level threshold
 * @param handlers handler specs in dispatch order
 * @param filters filters in evaluation order
 * @since 0.1.0
 */
public record LoggerConfig(String name, LogLevel level, List<HandlerSpec> handlers, List<LogFilter> filters) {
  public LoggerConfig {
    name = Strings.requireNonBlank("name", name);
    Objects.requireNonNull(level, "level");
    handlers = List.copyOf(Objects.requireNonNull(handlers, "handlers"));
    filters = withRedaction(List.copyOf(Objects.requireNonNull(filters, "filters")));
  }

  /**
   * Creates a configuration whose filters are a {@link LevelFilter} at {@code level} and the default
   * {@link SensitiveDataFilter}.
   *
   * @param name logger name
   * @param level logger level
   * @param handlers handler specs
   * @return configuration
   */
  public static LoggerConfig of(String name, LogLevel level, List<HandlerSpec> handlers) {
    return new LoggerConfig(name, level, handlers, List.of(new LevelFilter(level), new SensitiveDataFilter()));
  }

  /**
   * Returns a copy bound to another logger name.
   *
   * @param replacement new name
   * @return renamed configuration
   */
  public LoggerConfig withName(String replacement) {
    return new LoggerConfig(replacement, level, handlers, filters);
  }

  /**
   * Returns a hexadecimal digest of the name, level, handlers and filters, stable within one JVM.
   *
   * @return content fingerprint
   */
  public String fingerprint() {
    return Integer.toHexString(Objects.hash(name, level, handlers, filters));
  }

  private static List<LogFilter> withRedaction(List<LogFilter> filters) {
    for (LogFilter filter : filters) {
      if (filter instanceof SensitiveDataFilter) {
        return filters;
      }
    }
    List<LogFilter> extended = new ArrayList<>(filters);
    extended.add(new SensitiveDataFilter());
    return List.copyOf(extended);
  }
}
