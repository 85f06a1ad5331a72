package ca.gc.cra.scribe.infrastructure.handler;

import ca.gc.cra.scribe.application.port.LogFormatter;
import ca.gc.cra.scribe.application.port.LogHandler;
import ca.gc.cra.scribe.application.port.MetricsPort;
import ca.gc.cra.scribe.domain.log.LogLevel;
import ca.gc.cra.scribe.domain.log.LogRecord;
import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Base handler applying the threshold check, formatting and serialized sink writes.
 * <p><strong>Why:</strong> Concrete handlers only implement {@link #write(String)}; rotation checks and the write
 * itself run inside one critical section so concurrent callers never interleave partial entries.</p>
 * <p><strong>Failure policy:</strong> Formatting and sink failures drop the record. The first failure is logged at
 * WARN through SLF4J, later ones at DEBUG, and each is counted ({@code scribe.handler.format.failed},
 * {@code scribe.handler.write.failed}).</p>
 *
 * @since 0.1.0
 */
public abstract class AbstractLogHandler implements LogHandler {
  private static final Logger log = LoggerFactory.getLogger(AbstractLogHandler.class);

  /** Counter incremented when a sink write fails. */
  public static final String WRITE_FAILED = "scribe.handler.write.failed";
  /** Counter incremented when the formatter throws. */
  public static final String FORMAT_FAILED = "scribe.handler.format.failed";

  private final String name;
  private final LogLevel threshold;
  private final LogFormatter formatter;
  private final MetricsPort metrics;
  private final Object lock = new Object();
  private final AtomicBoolean warned = new AtomicBoolean();
  private volatile boolean closed;

  protected AbstractLogHandler(String name, LogLevel threshold, LogFormatter formatter, MetricsPort metrics) {
    this.name = Objects.requireNonNull(name, "name");
    this.threshold = Objects.requireNonNull(threshold, "threshold");
    this.formatter = Objects.requireNonNull(formatter, "formatter");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  @Override
  public final LogLevel threshold() {
    return threshold;
  }

  /**
   * Returns the formatter applied before each write.
   *
   * @return formatter
   */
  public final LogFormatter formatter() {
    return formatter;
  }

  /**
   * Returns whether {@link #close()} has been called.
   *
   * @return {@code true} once closed
   */
  public final boolean isClosed() {
    return closed;
  }

  @Override
  public final void publish(LogRecord record) {
    if (closed || record == null || !isEnabled(record.level())) {
      return;
    }
    String line;
    try {
      line = formatter.render(record);
    } catch (RuntimeException ex) {
      metrics.increment(FORMAT_FAILED);
      report("format", ex);
      return;
    }
    synchronized (lock) {
      if (closed) {
        return;
      }
      try {
        write(line);
      } catch (IOException | RuntimeException ex) {
        metrics.increment(WRITE_FAILED);
        report("write", ex);
      }
    }
  }

  @Override
  public final void close() {
    synchronized (lock) {
      if (closed) {
        return;
      }
      closed = true;
      try {
        closeSink();
      } catch (IOException ex) {
        log.warn("Failed to close log handler {}", name, ex);
      }
    }
  }

  /**
   * Writes one rendered entry. Called with the handler lock held.
   *
   * @param line rendered entry without a trailing newline
   * @throws IOException when the sink rejects the write
   */
  protected abstract void write(String line) throws IOException;

  /**
   * Releases the sink. Called once, with the handler lock held.
   *
   * @throws IOException when the sink fails to close
   */
  protected abstract void closeSink() throws IOException;

  /**
   * Returns the metrics sink shared with subclasses.
   *
   * @return metrics port
   */
  protected final MetricsPort metrics() {
    return metrics;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "[" + name + ", threshold=" + threshold + "]";
  }

  private void report(String stage, Exception ex) {
    if (warned.compareAndSet(false, true)) {
      log.warn("Log handler {} failed to {} a record; dropping it (further failures logged at DEBUG)",
          name, stage, ex);
    } else {
      log.debug("Log handler {} failed to {} a record", name, stage, ex);
    }
  }
}
