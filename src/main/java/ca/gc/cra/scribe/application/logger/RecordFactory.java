package ca.gc.cra.scribe.application.logger;

import ca.gc.cra.scribe.application.context.ContextStore;
import ca.gc.cra.scribe.application.port.ClockPort;
import ca.gc.cra.scribe.domain.log.CapturedError;
import ca.gc.cra.scribe.domain.log.LogLevel;
import ca.gc.cra.scribe.domain.log.LogRecord;
import ca.gc.cra.scribe.domain.log.ReservedAttributes;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Builds {@link LogRecord}s from call arguments and the caller's context.
 * <p><strong>Invariant:</strong> Reserved attribute names are stripped from both context and extra before the
 * record exists; construction never throws for caller data.</p>
 *
 * @since 0.1.0
 */
final class RecordFactory {
  private final ContextStore context;
  private final ClockPort clock;

  RecordFactory(ContextStore context, ClockPort clock) {
    this.context = Objects.requireNonNull(context, "context");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  LogRecord create(LogLevel level, String loggerName, String message, Map<String, ?> extra, Throwable error) {
    return new LogRecord(
        clock.now(),
        level,
        loggerName,
        message,
        CallSiteResolver.resolve(),
        ReservedAttributes.strip(context.current()),
        ReservedAttributes.strip(extra),
        CapturedError.from(error));
  }
}
