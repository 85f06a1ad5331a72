package ca.gc.cra.scribe.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem checks performed before a file handler opens its sink.
 * <p><strong>Why:</strong> An unwritable log path is a configuration error; it must surface when the logger is
 * requested, not as silently dropped records later.</p>
 * <p><strong>Thread-safety:</strong> Stateless; filesystem state may change between checks.</p>
 * <p><strong>Observability:</strong> No logs; failures raise {@link IllegalArgumentException} naming the path.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Ensures the parent directory of {@code file} exists (creating it when missing) and that the file is
   * writable or creatable.
   *
   * @param file target log file
   * @return absolute normalized file path
   * @throws IllegalArgumentException if the path contains control characters, names a directory, or cannot be
   *     created or written
   */
  public static Path requireWritableFile(Path file) {
    if (file == null) {
      throw new IllegalArgumentException("log file path must not be null");
    }
    String raw = file.toString();
    if (raw.isBlank() || Strings.containsControl(raw)) {
      throw new IllegalArgumentException("log file path must be printable and non-blank");
    }
    Path normalized = file.toAbsolutePath().normalize();
    Path parent = normalized.getParent();
    try {
      if (parent != null) {
        Files.createDirectories(parent);
        if (!Files.isWritable(parent)) {
          throw new IllegalArgumentException("log directory is not writable: " + parent);
        }
      }
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to create log directory " + parent + ": " + ex.getMessage(), ex);
    }
    if (Files.isDirectory(normalized, LinkOption.NOFOLLOW_LINKS)) {
      throw new IllegalArgumentException("log file path is a directory: " + normalized);
    }
    if (Files.exists(normalized, LinkOption.NOFOLLOW_LINKS) && !Files.isWritable(normalized)) {
      throw new IllegalArgumentException("log file is not writable: " + normalized);
    }
    return normalized;
  }
}
