package ca.gc.cra.scribe.config;

import ca.gc.cra.scribe.application.port.LogHandler;
import ca.gc.cra.scribe.domain.log.LogLevel;
import java.nio.file.Path;
import java.util.Optional;

/**
 * <strong>What:</strong> Declarative description of a handler: sink, threshold and formatter choice.
 * <p><strong>Why:</strong> {@link LoggerConfig} stays a comparable value; sinks are only opened when a logger is
 * built, so two equal specs describe the same output.</p>
 * <p><strong>Identity:</strong> Implementations must be value types ({@code equals}/{@code hashCode} over every
 * setting); the logger cache compares them.</p>
 * <p><strong>Files:</strong> Specs writing a file report it through {@link #target()}. The registry keeps one open
 * handler per file, so every logger writing that file shares one lock and one rotation state.</p>
 *
 * @since 0.1.0
 */
public interface HandlerSpec {
  /**
   * Returns the minimum level the handler writes.
   *
   * @return threshold
   */
  LogLevel threshold();

  /**
   * Returns the file this handler writes, if any.
   *
   * @return target file; empty for streams
   */
  default Optional<Path> target() {
    return Optional.empty();
  }

  /**
   * Opens the described handler.
   *
   * @param context runtime collaborators
   * @return open handler
   * @throws IllegalArgumentException if the path is invalid
   * @throws IllegalStateException if the sink cannot be opened
   */
  LogHandler open(HandlerContext context);
}
