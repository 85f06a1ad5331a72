package ca.gc.cra.scribe.infrastructure.handler;

import ca.gc.cra.scribe.application.port.LogFormatter;
import ca.gc.cra.scribe.application.port.MetricsPort;
import ca.gc.cra.scribe.domain.log.LogLevel;
import ca.gc.cra.scribe.validation.Paths;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Shared plumbing for handlers that append UTF-8 entries to a file.
 * <p><strong>Role:</strong> Opens the file in append mode, tracks its size for rotation decisions and offers the
 * rename helper used when rotating.</p>
 * <p><strong>Thread-safety:</strong> Every method below is called with the handler lock held.</p>
 *
 * @since 0.1.0
 */
abstract class AbstractFileHandler extends AbstractLogHandler {
  private static final Logger log = LoggerFactory.getLogger(AbstractFileHandler.class);

  /** Counter incremented after every successful rotation. */
  static final String ROTATIONS = "scribe.handler.rotations";

  private final Path file;
  private FileChannel channel;
  private long size;

  AbstractFileHandler(Path file, LogLevel threshold, LogFormatter formatter, MetricsPort metrics) {
    super(file == null ? "file" : file.toString(), threshold, formatter, metrics);
    this.file = Paths.requireWritableFile(file);
    try {
      openChannel(false);
    } catch (IOException ex) {
      throw new IllegalStateException("Unable to open log file " + this.file, ex);
    }
  }

  /**
   * Returns the active log file.
   *
   * @return absolute path of the file being written
   */
  public final Path file() {
    return file;
  }

  /** Returns the current size of the active file in bytes. */
  final long size() {
    return size;
  }

  final void append(String line) throws IOException {
    if (channel == null) {
      openChannel(false);
    }
    ByteBuffer buffer = ByteBuffer.wrap((line + '\n').getBytes(StandardCharsets.UTF_8));
    while (buffer.hasRemaining()) {
      size += channel.write(buffer);
    }
  }

  static int encodedLength(String line) {
    return line.getBytes(StandardCharsets.UTF_8).length + 1;
  }

  final void closeChannel() throws IOException {
    if (channel != null) {
      try {
        channel.force(false);
      } finally {
        channel.close();
        channel = null;
      }
    }
  }

  final void openChannel(boolean truncate) throws IOException {
    channel = truncate
        ? FileChannel.open(file, StandardOpenOption.CREATE, StandardOpenOption.WRITE,
            StandardOpenOption.TRUNCATE_EXISTING)
        : FileChannel.open(file, StandardOpenOption.CREATE, StandardOpenOption.WRITE,
            StandardOpenOption.APPEND);
    size = channel.size();
  }

  /** Reopens the active file after a failed rotation so later writes still land somewhere. */
  final void recover(IOException cause) {
    try {
      if (channel == null) {
        openChannel(false);
      }
    } catch (IOException reopen) {
      cause.addSuppressed(reopen);
      log.debug("Unable to reopen {} after failed rotation", file, reopen);
    }
  }

  static void moveReplacing(Path source, Path target) throws IOException {
    try {
      Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException ex) {
      Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  @Override
  protected final void closeSink() throws IOException {
    closeChannel();
  }
}
