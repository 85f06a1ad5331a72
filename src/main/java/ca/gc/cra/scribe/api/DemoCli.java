package ca.gc.cra.scribe.api;

import ca.gc.cra.scribe.application.context.ContextScope;
import ca.gc.cra.scribe.application.context.ContextStore;
import ca.gc.cra.scribe.application.context.LogContext;
import ca.gc.cra.scribe.application.logger.AppLogger;
import ca.gc.cra.scribe.application.port.ClockPort;
import ca.gc.cra.scribe.application.port.MetricsPort;
import ca.gc.cra.scribe.config.HandlerContext;
import ca.gc.cra.scribe.config.LoggingSettings;
import ca.gc.cra.scribe.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.time.ZoneId;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code scribe demo}: emits basic, contextual, exception and timing records through the configured preset.
 *
 * <p>Arguments: {@code env=<development|testing|staging|production>}, {@code logDir=<path>},
 * {@code config=<yaml>}, {@code metrics=<none|otel>}.</p>
 */
final class DemoCli {
  private static final Logger log = LoggerFactory.getLogger(DemoCli.class);
  private static final Set<String> KEYS = Set.of("env", "logDir", "config", "metrics");
  static final String LOGGER_NAME = "scribe.demo";

  private DemoCli() {}

  static ExitCode run(Iterable<String> args, OutputStream console) {
    Map<String, String> options;
    try {
      options = CliArgsParser.toMap(args, KEYS);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid demo arguments: {}", ex.getMessage());
      CliPrinter.println(Main.USAGE);
      return ExitCode.INVALID_ARGS;
    }
    String metricsMode = options.getOrDefault("metrics", "none").toLowerCase(Locale.ROOT);
    if (!metricsMode.equals("none") && !metricsMode.equals("otel")) {
      log.error("metrics must be none or otel (was {})", metricsMode);
      return ExitCode.INVALID_ARGS;
    }

    LoggingSettings settings;
    try {
      settings = LoggingSettings.resolve(options.get("env"), options.get("logDir"), options.get("config"));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid logging configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (UncheckedIOException ex) {
      log.error("Unable to read logging configuration", ex);
      return ExitCode.IO_ERROR;
    }

    OpenTelemetryMetricsAdapter otel = metricsMode.equals("otel") ? new OpenTelemetryMetricsAdapter() : null;
    MetricsPort metrics = otel == null ? MetricsPort.NO_OP : otel;
    HandlerContext handlers = new HandlerContext(metrics, ClockPort.SYSTEM, ZoneId.systemDefault(), console);
    LoggerRegistry registry = new LoggerRegistry(settings::configFor, handlers, ContextStore.shared());
    try {
      AppLogger logger = registry.get(LOGGER_NAME);
      log.debug("Running demo in {} with log directory {}", settings.environment().key(), settings.logDir());
      basicUsage(logger);
      withContext(logger);
      exceptionHandling(logger);
      performanceTracking(logger);
      CliPrinter.println("Demo completed in " + settings.environment().key() + " environment");
      return ExitCode.SUCCESS;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid logging configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (IllegalStateException ex) {
      log.error("Unable to open log sink", ex);
      return ExitCode.IO_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return ExitCode.INTERRUPTED;
    } finally {
      registry.clear();
      if (otel != null) {
        otel.close();
      }
    }
  }

  private static void basicUsage(AppLogger logger) {
    logger.info("Application started");
    logger.debug("Debug information", "component", "example");
    logger.warning("Warning message", "threshold", 80);
  }

  private static void withContext(AppLogger logger) {
    try (ContextScope scope = LogContext.forRequest("req-12345", "user-67890")) {
      logger.info("Received user request");
      logger.info("Processing order", "order_id", "ord-999", "password", "not-for-logs");
    }
  }

  private static void exceptionHandling(AppLogger logger) {
    try {
      riskyOperation();
    } catch (IllegalStateException ex) {
      logger.exception("Failed to process", ex, "operation", "risky");
    }
  }

  private static void performanceTracking(AppLogger logger) throws InterruptedException {
    logger.measureTime("database_query", Map.of("table", "users"), () -> Thread.sleep(50));
  }

  private static void riskyOperation() {
    throw new IllegalStateException("Something went wrong!");
  }
}
