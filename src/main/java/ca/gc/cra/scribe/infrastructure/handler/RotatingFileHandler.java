package ca.gc.cra.scribe.infrastructure.handler;

import ca.gc.cra.scribe.application.port.LogFormatter;
import ca.gc.cra.scribe.application.port.MetricsPort;
import ca.gc.cra.scribe.domain.log.LogLevel;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> File handler that rotates once the next entry would push the file past a byte limit.
 * <p><strong>Rotation:</strong> {@code app.log} becomes {@code app.log.1}, existing backups shift up by one and
 * the backup beyond {@code backupCount} is deleted. With {@code backupCount == 0} the file is truncated
 * instead. A lone entry larger than the limit is still written to an empty file.</p>
 * <p><strong>Thread-safety:</strong> The size check, rotation and write share the handler lock.</p>
 *
 * @since 0.1.0
 */
public final class RotatingFileHandler extends AbstractFileHandler {
  private static final Logger log = LoggerFactory.getLogger(RotatingFileHandler.class);

  private final long maxBytes;
  private final int backupCount;

  /**
   * Opens the handler.
   *
   * @param file log file; parent directories are created
   * @param maxBytes size limit in bytes; must be positive
   * @param backupCount numbered backups kept; must not be negative
   * @param threshold minimum level written
   * @param formatter entry formatter
   * @param metrics metrics sink; {@code null} disables metrics
   * @throws IllegalArgumentException if the limits or path are invalid
   * @throws IllegalStateException if the file cannot be opened
   */
  public RotatingFileHandler(
      Path file,
      long maxBytes,
      int backupCount,
      LogLevel threshold,
      LogFormatter formatter,
      MetricsPort metrics) {
    super(checkLimits(file, maxBytes, backupCount), threshold, formatter, metrics);
    this.maxBytes = maxBytes;
    this.backupCount = backupCount;
  }

  private static Path checkLimits(Path file, long maxBytes, int backupCount) {
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    if (backupCount < 0) {
      throw new IllegalArgumentException("backupCount must not be negative");
    }
    return file;
  }

  /**
   * Returns the configured size limit.
   *
   * @return bytes
   */
  public long maxBytes() {
    return maxBytes;
  }

  /**
   * Returns how many numbered backups are retained.
   *
   * @return backup count
   */
  public int backupCount() {
    return backupCount;
  }

  @Override
  protected void write(String line) throws IOException {
    if (size() > 0 && size() + encodedLength(line) > maxBytes) {
      rotate();
    }
    append(line);
  }

  private void rotate() throws IOException {
    closeChannel();
    try {
      if (backupCount == 0) {
        openChannel(true);
      } else {
        Files.deleteIfExists(backup(backupCount));
        for (int i = backupCount - 1; i >= 1; i--) {
          Path source = backup(i);
          if (Files.exists(source)) {
            moveReplacing(source, backup(i + 1));
          }
        }
        moveReplacing(file(), backup(1));
        openChannel(false);
      }
    } catch (IOException ex) {
      recover(ex);
      throw ex;
    }
    metrics().increment(ROTATIONS);
    log.debug("Rotated {} (limit {} bytes, {} backups)", file(), maxBytes, backupCount);
  }

  Path backup(int index) {
    return file().resolveSibling(file().getFileName() + "." + index);
  }
}
