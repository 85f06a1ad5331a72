package ca.gc.cra.scribe.domain.log;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Immutable snapshot of one log event.
 * <p><strong>Why:</strong> Filters, formatters and handlers all observe the same value, so a sanitizing
 * filter produces a modified copy rather than mutating shared state.</p>
 * <p><strong>Role:</strong> Domain value flowing from the orchestrator through the filter chain to every
 * handler.</p>
 * <p><strong>Thread-safety:</strong> Immutable; maps are defensive, unmodifiable, insertion-ordered copies.
 * Field values themselves are caller objects and are only read.</p>
 *
 * @param timestamp instant the record was constructed (UTC)
 * @param level severity
 * @param loggerName dot-separated logger name
 * @param message human-authored text
 * @param origin call site
 * @param context merged scope context captured at construction
 * @param extra fields supplied for this call only
 * @param error captured application error, or {@code null}
 * @since 0.1.0
 */
public record LogRecord(
    Instant timestamp,
    LogLevel level,
    String loggerName,
    String message,
    Origin origin,
    Map<String, Object> context,
    Map<String, Object> extra,
    CapturedError error) {

  public LogRecord {
    Objects.requireNonNull(timestamp, "timestamp");
    Objects.requireNonNull(level, "level");
    loggerName = loggerName == null ? "" : loggerName;
    message = message == null ? "" : message;
    origin = origin == null ? Origin.UNKNOWN : origin;
    context = ordered(context);
    extra = ordered(extra);
  }

  /**
   * Returns the captured error when present.
   *
   * @return optional error snapshot
   */
  public Optional<CapturedError> capturedError() {
    return Optional.ofNullable(error);
  }

  /**
   * Returns a copy carrying a replacement context map.
   *
   * @param replacement new context fields
   * @return new record; {@code this} is unchanged
   */
  public LogRecord withContext(Map<String, ?> replacement) {
    return new LogRecord(timestamp, level, loggerName, message, origin, copy(replacement), extra, error);
  }

  /**
   * Returns a copy carrying a replacement extra map.
   *
   * @param replacement new extra fields
   * @return new record; {@code this} is unchanged
   */
  public LogRecord withExtra(Map<String, ?> replacement) {
    return new LogRecord(timestamp, level, loggerName, message, origin, context, copy(replacement), error);
  }

  private static Map<String, Object> ordered(Map<String, Object> source) {
    if (source == null || source.isEmpty()) {
      return Map.of();
    }
    return Collections.unmodifiableMap(new LinkedHashMap<>(source));
  }

  private static Map<String, Object> copy(Map<String, ?> source) {
    return source == null ? Map.of() : new LinkedHashMap<>(source);
  }
}
