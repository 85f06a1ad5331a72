package ca.gc.cra.scribe.domain.log;

import java.util.Locale;

/**
 * <strong>What:</strong> Ordered severities understood by the SCRIBE pipeline.
 * <p><strong>Why:</strong> Level filters and handler thresholds compare records by ordinal so that
 * suppression is monotonic: anything kept at one level is kept at every higher level.</p>
 * <p><strong>Role:</strong> Domain enum carried by every {@link LogRecord}.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum LogLevel {
  /** Diagnostic detail intended for developers. */
  DEBUG,
  /** Normal operational events. */
  INFO,
  /** Unexpected but recoverable conditions. */
  WARNING,
  /** Failures of a single operation. */
  ERROR,
  /** Failures that compromise the service. */
  CRITICAL;

  /**
   * Returns whether this level is at least as severe as {@code minimum}.
   *
   * @param minimum threshold to compare against; must not be {@code null}
   * @return {@code true} when {@code this} ranks at or above {@code minimum}
   */
  public boolean isAtLeast(LogLevel minimum) {
    return compareTo(minimum) >= 0;
  }

  /**
   * Parses a level name, accepting {@code WARN} and {@code FATAL} as aliases.
   *
   * @param value textual level such as {@code "info"}; blank returns {@link #INFO}
   * @return parsed level
   * @throws IllegalArgumentException if the value does not name a level
   */
  public static LogLevel fromString(String value) {
    if (value == null || value.isBlank()) {
      return INFO;
    }
    String normalized = value.trim().toUpperCase(Locale.ROOT);
    return switch (normalized) {
      case "WARN" -> WARNING;
      case "FATAL" -> CRITICAL;
      default -> {
        try {
          yield LogLevel.valueOf(normalized);
        } catch (IllegalArgumentException ex) {
          throw new IllegalArgumentException("Unknown log level: " + value, ex);
        }
      }
    };
  }
}
