package ca.gc.cra.scribe.infrastructure.handler;

import ca.gc.cra.scribe.application.port.LogFormatter;
import ca.gc.cra.scribe.application.port.MetricsPort;
import ca.gc.cra.scribe.domain.log.LogLevel;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Stream handler writing UTF-8 entries to a fixed output stream, flushing after each entry.
 *
 * <p>The stream is only flushed on close, never closed, so {@code System.out} and {@code System.err} survive
 * the handler.</p>
 *
 * @since 0.1.0
 */
public final class ConsoleHandler extends AbstractLogHandler {
  private final Writer writer;

  /**
   * Creates a handler bound to {@code out}.
   *
   * @param out destination stream; typically {@code System.out}
   * @param threshold minimum level written
   * @param formatter entry formatter
   * @param metrics metrics sink; {@code null} disables metrics
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "Handler intentionally writes to the caller-owned stream")
  public ConsoleHandler(OutputStream out, LogLevel threshold, LogFormatter formatter, MetricsPort metrics) {
    super("console", threshold, formatter, metrics);
    this.writer = new OutputStreamWriter(Objects.requireNonNull(out, "out"), StandardCharsets.UTF_8);
  }

  @Override
  protected void write(String line) throws IOException {
    writer.write(line);
    writer.write('\n');
    writer.flush();
  }

  @Override
  protected void closeSink() throws IOException {
    writer.flush();
  }
}
