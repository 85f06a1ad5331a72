package ca.gc.cra.scribe.config;

import ca.gc.cra.scribe.application.port.LogFormatter;
import ca.gc.cra.scribe.infrastructure.format.ConsoleFormatter;
import ca.gc.cra.scribe.infrastructure.format.JsonFormatter;
import java.time.ZoneId;
import java.util.Locale;

/**
 * Formatter choice carried by a {@link HandlerSpec}.
 *
 * @since 0.1.0
 */
public enum OutputFormat {
  /** One JSON object per line. */
  JSON,
  /** Human-readable {@code [time] LEVEL logger: message | k=v} lines. */
  TEXT;

  LogFormatter create(boolean colors, ZoneId zone) {
    return switch (this) {
      case JSON -> new JsonFormatter();
      case TEXT -> new ConsoleFormatter(colors, zone, ConsoleFormatter.DEFAULT_MAX_VALUE_BYTES);
    };
  }

  /**
   * Parses {@code json} or {@code text}, ignoring case.
   *
   * @param value format name
   * @return matching format
   * @throws IllegalArgumentException if the value is not a known format
   */
  public static OutputFormat fromString(String value) {
    String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "json" -> JSON;
      case "text", "console" -> TEXT;
      default -> throw new IllegalArgumentException("Unknown output format '" + value + "'; expected json or text");
    };
  }
}
