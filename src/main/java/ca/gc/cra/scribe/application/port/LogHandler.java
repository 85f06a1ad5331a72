package ca.gc.cra.scribe.application.port;

import ca.gc.cra.scribe.domain.log.LogLevel;
import ca.gc.cra.scribe.domain.log.LogRecord;

/**
 * <strong>What:</strong> Sink-owning consumer that formats and writes records.
 * <p><strong>Why:</strong> Handlers may be stricter than the logger (for example an error-only file) but are
 * never consulted for records the filter chain already vetoed.</p>
 * <p><strong>Role:</strong> Port implemented by console and rotating file adapters.</p>
 * <p><strong>Thread-safety:</strong> Implementations serialize writes to their sink so concurrent callers
 * never interleave partial entries.</p>
 * <p><strong>Failure policy:</strong> {@link #publish(LogRecord)} must not throw for sink failures; a failing
 * handler drops the record so other handlers keep working.</p>
 *
 * @since 0.1.0
 */
public interface LogHandler extends AutoCloseable {
  /**
   * Returns the minimum level this handler writes.
   *
   * @return handler threshold
   */
  LogLevel threshold();

  /**
   * Returns whether a record at {@code level} would be written.
   *
   * @param level candidate level
   * @return {@code true} when {@code level} meets the threshold
   */
  default boolean isEnabled(LogLevel level) {
    return level != null && level.isAtLeast(threshold());
  }

  /**
   * Formats and writes the record when it meets the threshold.
   *
   * @param record filtered record; never {@code null}
   */
  void publish(LogRecord record);

  /**
   * Releases the sink. Further publishes are dropped.
   */
  @Override
  void close();
}
