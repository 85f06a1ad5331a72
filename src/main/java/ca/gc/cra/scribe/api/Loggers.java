package ca.gc.cra.scribe.api;

import ca.gc.cra.scribe.application.logger.AppLogger;
import ca.gc.cra.scribe.config.LoggerConfig;
import java.util.Objects;

/**
 * Process-wide entry point over a shared {@link LoggerRegistry}.
 *
 * <pre>{@code
 * private static final AppLogger log = Loggers.get(InvoiceService.class);
 * }</pre>
 *
 * <p>Tests needing isolation should call {@link #clear()} or build their own {@link LoggerRegistry}.</p>
 *
 * @since 0.1.0
 */
public final class Loggers {
  private static volatile LoggerRegistry registry = new LoggerRegistry();

  private Loggers() {}

  /**
   * Returns the cached logger for {@code name}, built from the environment preset on first use.
   *
   * @param name logger name
   * @return logger
   */
  public static AppLogger get(String name) {
    return registry.get(name);
  }

  /**
   * Returns the cached logger named after {@code type}.
   *
   * @param type owning class
   * @return logger named with the class's fully qualified name
   */
  public static AppLogger get(Class<?> type) {
    return registry.get(Objects.requireNonNull(type, "type").getName());
  }

  /**
   * Returns a logger built from an explicit configuration.
   *
   * @param name logger name
   * @param config configuration
   * @return logger
   */
  public static AppLogger get(String name, LoggerConfig config) {
    return registry.get(name, config);
  }

  /** Removes every cached logger and closes its handlers; references already handed out keep logging. */
  public static void clear() {
    registry.clear();
  }

  /**
   * Returns the registry backing this facade.
   *
   * @return shared registry
   */
  public static LoggerRegistry registry() {
    return registry;
  }

  /**
   * Replaces the shared registry, clearing the previous one. Loggers handed out by the previous registry
   * forward to the replacement.
   *
   * @param replacement new registry
   */
  public static void install(LoggerRegistry replacement) {
    LoggerRegistry previous = registry;
    registry = Objects.requireNonNull(replacement, "replacement");
    if (previous != replacement) {
      previous.transferTo(replacement);
    }
  }
}
