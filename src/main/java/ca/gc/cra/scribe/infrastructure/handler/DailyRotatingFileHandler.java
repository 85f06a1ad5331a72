package ca.gc.cra.scribe.infrastructure.handler;

import ca.gc.cra.scribe.application.port.ClockPort;
import ca.gc.cra.scribe.application.port.LogFormatter;
import ca.gc.cra.scribe.application.port.MetricsPort;
import ca.gc.cra.scribe.domain.log.LogLevel;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> File handler that rotates at local midnight regardless of size.
 * <p><strong>Rotation:</strong> The first write on a new day renames {@code app.log} to
 * {@code app.log.yyyy-MM-dd} (the day that ended) and starts a fresh file. Dated backups beyond
 * {@code backupDays} are deleted oldest first; {@code 0} keeps every backup.</p>
 * <p><strong>Clock:</strong> Day boundaries come from {@link ClockPort#now()} in the configured zone. An existing
 * file is attributed to the day of its last modification, so a restart after midnight still rotates it.</p>
 *
 * @since 0.1.0
 */
public final class DailyRotatingFileHandler extends AbstractFileHandler {
  private static final Logger log = LoggerFactory.getLogger(DailyRotatingFileHandler.class);
  private static final DateTimeFormatter SUFFIX = DateTimeFormatter.ISO_LOCAL_DATE;
  private static final Pattern SUFFIX_PATTERN = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");

  private final int backupDays;
  private final ZoneId zone;
  private final ClockPort clock;
  private LocalDate period;

  /**
   * Opens the handler.
   *
   * @param file log file; parent directories are created
   * @param backupDays dated backups kept; {@code 0} keeps all, negative values are rejected
   * @param zone zone whose midnight ends a period
   * @param clock wall-clock source
   * @param threshold minimum level written
   * @param formatter entry formatter
   * @param metrics metrics sink; {@code null} disables metrics
   * @throws IllegalArgumentException if {@code backupDays} is negative or the path is invalid
   * @throws IllegalStateException if the file cannot be opened
   */
  public DailyRotatingFileHandler(
      Path file,
      int backupDays,
      ZoneId zone,
      ClockPort clock,
      LogLevel threshold,
      LogFormatter formatter,
      MetricsPort metrics) {
    super(checkBackupDays(file, backupDays), threshold, formatter, metrics);
    this.backupDays = backupDays;
    this.zone = Objects.requireNonNull(zone, "zone");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.period = initialPeriod();
  }

  private static Path checkBackupDays(Path file, int backupDays) {
    if (backupDays < 0) {
      throw new IllegalArgumentException("backupDays must not be negative");
    }
    return file;
  }

  /**
   * Returns how many dated backups are retained.
   *
   * @return backup days, {@code 0} meaning unlimited
   */
  public int backupDays() {
    return backupDays;
  }

  @Override
  protected void write(String line) throws IOException {
    LocalDate today = LocalDate.ofInstant(clock.now(), zone);
    if (today.isAfter(period)) {
      rotate(period);
      period = today;
    }
    append(line);
  }

  Path backupFor(LocalDate day) {
    return file().resolveSibling(file().getFileName() + "." + SUFFIX.format(day));
  }

  private LocalDate initialPeriod() {
    LocalDate today = LocalDate.ofInstant(clock.now(), zone);
    if (size() == 0) {
      return today;
    }
    try {
      LocalDate modified = LocalDate.ofInstant(Files.getLastModifiedTime(file()).toInstant(), zone);
      return modified.isBefore(today) ? modified : today;
    } catch (IOException ex) {
      log.debug("Unable to read modification time of {}", file(), ex);
      return today;
    }
  }

  private void rotate(LocalDate ended) throws IOException {
    if (size() == 0) {
      return;
    }
    closeChannel();
    try {
      moveReplacing(file(), backupFor(ended));
      openChannel(false);
    } catch (IOException ex) {
      recover(ex);
      throw ex;
    }
    metrics().increment(ROTATIONS);
    log.debug("Rotated {} for {}", file(), ended);
    prune();
  }

  private void prune() {
    if (backupDays == 0) {
      return;
    }
    String prefix = file().getFileName() + ".";
    List<Path> backups = new ArrayList<>();
    try (DirectoryStream<Path> entries = Files.newDirectoryStream(file().getParent(), prefix + "*")) {
      for (Path entry : entries) {
        String suffix = entry.getFileName().toString().substring(prefix.length());
        if (SUFFIX_PATTERN.matcher(suffix).matches()) {
          backups.add(entry);
        }
      }
    } catch (IOException ex) {
      log.warn("Unable to list backups of {}", file(), ex);
      return;
    }
    // ISO dates sort chronologically by name
    Collections.sort(backups);
    for (int i = 0; i < backups.size() - backupDays; i++) {
      try {
        Files.deleteIfExists(backups.get(i));
      } catch (IOException ex) {
        log.warn("Unable to delete expired backup {}", backups.get(i), ex);
      }
    }
  }
}
