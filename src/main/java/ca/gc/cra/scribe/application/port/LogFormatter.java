package ca.gc.cra.scribe.application.port;

import ca.gc.cra.scribe.domain.log.LogRecord;

/**
 * <strong>What:</strong> Renders a filtered {@link LogRecord} into one output entry.
 * <p><strong>Role:</strong> Port implemented by {@code JsonFormatter} and {@code ConsoleFormatter}; handlers own
 * exactly one formatter each.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate concurrent {@link #render(LogRecord)} calls.</p>
 * <p><strong>Output:</strong> The returned text excludes the trailing line separator; handlers append it.</p>
 *
 * @since 0.1.0
 */
public interface LogFormatter {
  /**
   * Renders the record.
   *
   * @param record record that already passed the filter chain; never {@code null}
   * @return rendered entry without a trailing newline
   */
  String render(LogRecord record);
}
