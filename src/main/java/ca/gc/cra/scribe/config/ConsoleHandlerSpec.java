package ca.gc.cra.scribe.config;

import ca.gc.cra.scribe.application.port.LogHandler;
import ca.gc.cra.scribe.domain.log.LogLevel;
import ca.gc.cra.scribe.infrastructure.handler.ConsoleHandler;
import java.util.Objects;

/**
 * Console stream handler.
 *
 * @param threshold minimum level written
 * @param format output format
 * @param colors ANSI colors for {@link OutputFormat#TEXT}; ignored for JSON
 * @since 0.1.0
 */
public record ConsoleHandlerSpec(LogLevel threshold, OutputFormat format, boolean colors) implements HandlerSpec {
  public ConsoleHandlerSpec {
    Objects.requireNonNull(threshold, "threshold");
    Objects.requireNonNull(format, "format");
    colors = colors && format == OutputFormat.TEXT;
  }

  @Override
  public LogHandler open(HandlerContext context) {
    return new ConsoleHandler(context.console(), threshold, format.create(colors, context.zone()), context.metrics());
  }
}
