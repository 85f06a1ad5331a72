package ca.gc.cra.scribe.application.logger;

import ca.gc.cra.scribe.application.context.ContextStore;
import ca.gc.cra.scribe.application.port.ClockPort;
import ca.gc.cra.scribe.application.port.LogFilter;
import ca.gc.cra.scribe.application.port.LogFilter.FilterDecision;
import ca.gc.cra.scribe.application.port.LogHandler;
import ca.gc.cra.scribe.application.port.MetricsPort;
import ca.gc.cra.scribe.domain.log.Fields;
import ca.gc.cra.scribe.domain.log.LogLevel;
import ca.gc.cra.scribe.domain.log.LogRecord;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Logger orchestrator user code calls to emit structured records.
 * <p><strong>Flow:</strong> build record (context merge, reserved-key stripping, call site) &rarr; filter chain
 * &rarr; every handler whose threshold admits the level. Everything runs synchronously on the caller's thread.</p>
 * <p><strong>Fields:</strong> Each level method accepts either alternating {@code key, value} arguments or a
 * {@code Map}. Malformed pairs and reserved keys are dropped.</p>
 * <p><strong>Failure policy:</strong> Logging calls never throw. Internal failures are reported through SLF4J
 * and counted as {@value #RECORDS_FAILED}; a failing handler does not stop the others. The only exception a
 * caller sees is its own, rethrown unchanged by {@link #measureTime(String, CheckedRunnable)}.</p>
 * <p><strong>Lifecycle:</strong> {@link #close()} closes the handlers and discards later records, reporting the
 * first discarded one through SLF4J. {@link #retire(Supplier)} also closes the handlers but forwards later calls
 * to a replacement, so references held in fields keep working after the registry rebuilds the logger.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use; handlers serialize their own writes.</p>
 *
 * <pre>{@code
 * AppLogger log = Loggers.get("billing");
 * log.info("Invoice issued", "invoice_id", id, "amount", 42.5);
 * log.measureTime("reconcile", () -> reconciler.run());
 * }</pre>
 *
 * @since 0.1.0
 */
public final class AppLogger implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(AppLogger.class);

  /** Counter of records handed to at least the handler stage. */
  public static final String RECORDS_EMITTED = "scribe.records.emitted";
  /** Counter of records dropped by the logger level or the filter chain. */
  public static final String RECORDS_SUPPRESSED = "scribe.records.suppressed";
  /** Counter of records lost to an internal failure. */
  public static final String RECORDS_FAILED = "scribe.records.failed";
  /** Histogram of timed operation durations in milliseconds. */
  public static final String OPERATION_DURATION = "scribe.operation.durationMillis";
  /** Extra field carrying elapsed milliseconds on timing records. */
  public static final String DURATION_MS = "duration_ms";
  /** Extra field carrying the timed operation name. */
  public static final String OPERATION = "operation";

  private final String name;
  private final LogLevel level;
  private final List<LogHandler> handlers;
  private final FilterChain filters;
  private final RecordFactory records;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final AtomicBoolean reportedClosed = new AtomicBoolean();
  private volatile Supplier<AppLogger> replacement;
  private volatile boolean closed;

  /**
   * Creates a logger.
   *
   * @param name logger name, dot-separated by convention
   * @param level minimum level; lower records are discarded before a record is built
   * @param handlers sinks receiving every kept record
   * @param filters filter stages in evaluation order
   * @param context context store merged into every record
   * @param clock time source for timestamps and elapsed time
   * @param metrics metrics sink; {@code null} disables metrics
   */
  public AppLogger(
      String name,
      LogLevel level,
      List<? extends LogHandler> handlers,
      List<? extends LogFilter> filters,
      ContextStore context,
      ClockPort clock,
      MetricsPort metrics) {
    this.name = Objects.requireNonNull(name, "name");
    this.level = Objects.requireNonNull(level, "level");
    this.handlers = List.copyOf(Objects.requireNonNull(handlers, "handlers"));
    this.filters = new FilterChain(filters);
    this.clock = Objects.requireNonNull(clock, "clock");
    this.records = new RecordFactory(Objects.requireNonNull(context, "context"), clock);
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Returns the logger name.
   *
   * @return name
   */
  public String name() {
    return name;
  }

  /**
   * Returns the minimum level.
   *
   * @return level threshold
   */
  public LogLevel level() {
    return level;
  }

  /**
   * Returns the handlers in dispatch order.
   *
   * @return immutable handler list
   */
  public List<LogHandler> handlers() {
    return handlers;
  }

  /**
   * Returns the filter stages in evaluation order.
   *
   * @return immutable filter list
   */
  public List<LogFilter> filters() {
    return filters.filters();
  }

  /**
   * Returns whether a record at {@code candidate} could reach at least one handler. Use it to skip building
   * expensive fields.
   *
   * @param candidate level to test
   * @return {@code true} when the logger and at least one handler admit the level
   */
  public boolean isEnabled(LogLevel candidate) {
    if (closed) {
      AppLogger next = successor();
      return next != null && next.isEnabled(candidate);
    }
    if (candidate == null || !candidate.isAtLeast(level)) {
      return false;
    }
    for (LogHandler handler : handlers) {
      if (handler.isEnabled(candidate)) {
        return true;
      }
    }
    return false;
  }

  public void debug(String message, Object... keyValues) {
    log(LogLevel.DEBUG, message, null, Fields.of(keyValues));
  }

  public void debug(String message, Map<String, ?> fields) {
    log(LogLevel.DEBUG, message, null, fields);
  }

  public void info(String message, Object... keyValues) {
    log(LogLevel.INFO, message, null, Fields.of(keyValues));
  }

  public void info(String message, Map<String, ?> fields) {
    log(LogLevel.INFO, message, null, fields);
  }

  public void warning(String message, Object... keyValues) {
    log(LogLevel.WARNING, message, null, Fields.of(keyValues));
  }

  public void warning(String message, Map<String, ?> fields) {
    log(LogLevel.WARNING, message, null, fields);
  }

  public void error(String message, Object... keyValues) {
    log(LogLevel.ERROR, message, null, Fields.of(keyValues));
  }

  public void error(String message, Map<String, ?> fields) {
    log(LogLevel.ERROR, message, null, fields);
  }

  /**
   * Logs at ERROR attaching a captured error.
   *
   * @param message record message
   * @param error error to capture; {@code null} logs without one
   * @param keyValues alternating keys and values
   */
  public void error(String message, Throwable error, Object... keyValues) {
    log(LogLevel.ERROR, message, error, Fields.of(keyValues));
  }

  public void error(String message, Throwable error, Map<String, ?> fields) {
    log(LogLevel.ERROR, message, error, fields);
  }

  public void critical(String message, Object... keyValues) {
    log(LogLevel.CRITICAL, message, null, Fields.of(keyValues));
  }

  public void critical(String message, Map<String, ?> fields) {
    log(LogLevel.CRITICAL, message, null, fields);
  }

  /**
   * Logs at CRITICAL attaching a captured error.
   *
   * @param message record message
   * @param error error to capture; {@code null} logs without one
   * @param keyValues alternating keys and values
   */
  public void critical(String message, Throwable error, Object... keyValues) {
    log(LogLevel.CRITICAL, message, error, Fields.of(keyValues));
  }

  public void critical(String message, Throwable error, Map<String, ?> fields) {
    log(LogLevel.CRITICAL, message, error, fields);
  }

  /**
   * Logs the error being handled at ERROR. Intended for {@code catch} blocks.
   *
   * @param message record message
   * @param error caught error; always captured when non-null
   * @param keyValues alternating keys and values
   */
  public void exception(String message, Throwable error, Object... keyValues) {
    log(LogLevel.ERROR, message, error, Fields.of(keyValues));
  }

  public void exception(String message, Throwable error, Map<String, ?> fields) {
    log(LogLevel.ERROR, message, error, fields);
  }

  /**
   * Builds, filters and dispatches one record. Never throws.
   *
   * @param recordLevel record severity
   * @param message record message
   * @param error error to capture, or {@code null}
   * @param fields per-call fields, or {@code null}
   */
  public void log(LogLevel recordLevel, String message, Throwable error, Map<String, ?> fields) {
    if (closed) {
      logAfterClose(recordLevel, message, error, fields);
      return;
    }
    if (recordLevel == null || !recordLevel.isAtLeast(level)) {
      metrics.increment(RECORDS_SUPPRESSED);
      return;
    }
    try {
      LogRecord record = records.create(recordLevel, name, message, fields, error);
      FilterDecision decision = filters.apply(record);
      if (!decision.keep()) {
        metrics.increment(RECORDS_SUPPRESSED);
        return;
      }
      dispatch(decision.record());
      metrics.increment(RECORDS_EMITTED);
    } catch (RuntimeException ex) {
      metrics.increment(RECORDS_FAILED);
      log.warn("Logger {} dropped a {} record after an internal failure", name, recordLevel, ex);
    }
  }

  /**
   * Times {@code body}, logging DEBUG {@code "Starting <operation>"} before it and either INFO
   * {@code "Completed <operation>"} or ERROR {@code "Failed <operation>"} (with the captured error) after it.
   * Both closing records carry {@value #DURATION_MS} measured on the monotonic clock.
   *
   * @param operation operation name
   * @param body work to time
   * @param <E> failure type of {@code body}
   * @throws E the failure raised by {@code body}, unchanged
   */
  public <E extends Throwable> void measureTime(String operation, CheckedRunnable<E> body) throws E {
    measureTime(operation, Map.of(), body);
  }

  /**
   * Times {@code body}, adding {@code fields} to each of the three records.
   *
   * @param operation operation name
   * @param fields extra fields for every timing record
   * @param body work to time
   * @param <E> failure type of {@code body}
   * @throws E the failure raised by {@code body}, unchanged
   */
  public <E extends Throwable> void measureTime(String operation, Map<String, ?> fields, CheckedRunnable<E> body)
      throws E {
    Objects.requireNonNull(body, "body");
    this.<Void, E>measureTimeAndGet(operation, fields, () -> {
      body.run();
      return null;
    });
  }

  /**
   * Times {@code body} and returns its result.
   *
   * @param operation operation name
   * @param body work to time
   * @param <T> result type
   * @param <E> failure type of {@code body}
   * @return value produced by {@code body}
   * @throws E the failure raised by {@code body}, unchanged
   */
  public <T, E extends Throwable> T measureTimeAndGet(String operation, CheckedSupplier<T, E> body) throws E {
    return measureTimeAndGet(operation, Map.of(), body);
  }

  /**
   * Times {@code body}, adding {@code fields} to each record, and returns its result.
   *
   * @param operation operation name
   * @param fields extra fields for every timing record
   * @param body work to time
   * @param <T> result type
   * @param <E> failure type of {@code body}
   * @return value produced by {@code body}
   * @throws E the failure raised by {@code body}, unchanged
   */
  public <T, E extends Throwable> T measureTimeAndGet(
      String operation, Map<String, ?> fields, CheckedSupplier<T, E> body) throws E {
    Objects.requireNonNull(body, "body");
    String op = operation == null || operation.isBlank() ? OPERATION : operation;
    Map<String, Object> base = new LinkedHashMap<>(Fields.copyOf(fields));
    base.put(OPERATION, op);
    log(LogLevel.DEBUG, "Starting " + op, null, base);
    long start = clock.monotonicNanos();
    T result;
    try {
      result = body.get();
    } catch (Throwable failure) {
      long elapsedNanos = elapsedSince(start);
      log(LogLevel.ERROR, "Failed " + op, failure, withDuration(base, elapsedNanos));
      metrics.observe(OPERATION_DURATION, elapsedNanos / 1_000_000L);
      throw failure;
    }
    long elapsedNanos = elapsedSince(start);
    log(LogLevel.INFO, "Completed " + op, null, withDuration(base, elapsedNanos));
    metrics.observe(OPERATION_DURATION, elapsedNanos / 1_000_000L);
    return result;
  }

  /**
   * Closes every handler. Later calls are discarded.
   */
  @Override
  public void close() {
    closed = true;
    for (LogHandler handler : handlers) {
      try {
        handler.close();
      } catch (RuntimeException ex) {
        log.warn("Failed to close handler {} of logger {}", handler, name, ex);
      }
    }
  }

  /**
   * Closes every handler and forwards later calls to the logger {@code successor} supplies. The supplier is
   * consulted on every forwarded call, so it may resolve a logger that does not exist yet.
   *
   * @param successor resolves the logger that replaces this one
   */
  public void retire(Supplier<AppLogger> successor) {
    this.replacement = Objects.requireNonNull(successor, "successor");
    close();
  }

  /**
   * Returns whether {@link #close()} or {@link #retire(Supplier)} has been called.
   *
   * @return {@code true} once closed
   */
  public boolean isClosed() {
    return closed;
  }

  @Override
  public String toString() {
    return "AppLogger[" + name + ", level=" + level + ", handlers=" + handlers.size() + "]";
  }

  private void logAfterClose(LogLevel recordLevel, String message, Throwable error, Map<String, ?> fields) {
    AppLogger next = successor();
    if (next != null) {
      next.log(recordLevel, message, error, fields);
      return;
    }
    if (replacement != null) {
      metrics.increment(RECORDS_FAILED);
      return;
    }
    metrics.increment(RECORDS_SUPPRESSED);
    if (reportedClosed.compareAndSet(false, true)) {
      log.warn("Logger {} is closed; dropping a {} record (later drops are not reported)", name, recordLevel);
    }
  }

  private AppLogger successor() {
    Supplier<AppLogger> supplier = replacement;
    if (supplier == null) {
      return null;
    }
    try {
      return supplier.get();
    } catch (RuntimeException ex) {
      log.warn("Logger {} could not resolve its replacement", name, ex);
      return null;
    }
  }

  private void dispatch(LogRecord record) {
    for (LogHandler handler : handlers) {
      if (!handler.isEnabled(record.level())) {
        continue;
      }
      try {
        handler.publish(record);
      } catch (RuntimeException ex) {
        metrics.increment(RECORDS_FAILED);
        log.warn("Handler {} of logger {} failed; continuing with remaining handlers", handler, name, ex);
      }
    }
  }

  private long elapsedSince(long startNanos) {
    return Math.max(0L, clock.monotonicNanos() - startNanos);
  }

  private static Map<String, Object> withDuration(Map<String, Object> base, long elapsedNanos) {
    Map<String, Object> fields = new LinkedHashMap<>(base);
    fields.put(DURATION_MS, elapsedNanos / 1_000_000.0d);
    return fields;
  }
}
