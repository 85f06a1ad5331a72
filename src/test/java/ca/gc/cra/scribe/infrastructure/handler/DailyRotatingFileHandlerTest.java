package ca.gc.cra.scribe.infrastructure.handler;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.scribe.application.port.ClockPort;
import ca.gc.cra.scribe.application.port.LogFormatter;
import ca.gc.cra.scribe.domain.log.LogLevel;
import ca.gc.cra.scribe.testutil.ManualClock;
import ca.gc.cra.scribe.testutil.RecordingMetricsPort;
import ca.gc.cra.scribe.testutil.TestRecords;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DailyRotatingFileHandlerTest {
  private static final LogFormatter MESSAGE_ONLY = record -> record.message();
  private static final Instant START = Instant.parse("2024-03-01T10:00:00Z");

  @TempDir Path tempDir;

  @Test
  void renamesFileToEndedDayOnFirstWriteOfNewDay() throws IOException {
    ManualClock clock = new ManualClock(START);
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    DailyRotatingFileHandler handler = open(clock, 7, metrics);
    try {
      handler.publish(TestRecords.record(LogLevel.INFO, "friday"));
      clock.advance(Duration.ofHours(13));
      handler.publish(TestRecords.record(LogLevel.INFO, "saturday"));

      assertEquals("saturday\n", read(handler.file()));
      assertEquals("friday\n", read(handler.backupFor(LocalDate.of(2024, 3, 1))));
      assertEquals(1, metrics.count(AbstractFileHandler.ROTATIONS));
    } finally {
      handler.close();
    }
  }

  @Test
  void sameDayWritesDoNotRotate() throws IOException {
    ManualClock clock = new ManualClock(START);
    DailyRotatingFileHandler handler = open(clock, 7, null);
    try {
      handler.publish(TestRecords.record(LogLevel.INFO, "morning"));
      clock.advance(Duration.ofHours(13).minusSeconds(1));
      handler.publish(TestRecords.record(LogLevel.INFO, "late"));

      assertEquals("morning\nlate\n", read(handler.file()));
      assertEquals(List.of("app.log"), listNames());
    } finally {
      handler.close();
    }
  }

  @Test
  void prunesBackupsBeyondRetention() throws IOException {
    ManualClock clock = new ManualClock(START);
    DailyRotatingFileHandler handler = open(clock, 2, null);
    try {
      for (int day = 0; day < 4; day++) {
        handler.publish(TestRecords.record(LogLevel.INFO, "day" + day));
        clock.advance(Duration.ofDays(1));
      }
      handler.publish(TestRecords.record(LogLevel.INFO, "today"));

      assertEquals(List.of("app.log", "app.log.2024-03-03", "app.log.2024-03-04"), listNames());
      assertEquals("day3\n", read(handler.backupFor(LocalDate.of(2024, 3, 4))));
    } finally {
      handler.close();
    }
  }

  @Test
  void zeroRetentionKeepsEveryBackup() throws IOException {
    ManualClock clock = new ManualClock(START);
    DailyRotatingFileHandler handler = open(clock, 0, null);
    try {
      for (int day = 0; day < 4; day++) {
        handler.publish(TestRecords.record(LogLevel.INFO, "day" + day));
        clock.advance(Duration.ofDays(1));
      }
      handler.publish(TestRecords.record(LogLevel.INFO, "today"));

      assertEquals(5, listNames().size());
    } finally {
      handler.close();
    }
  }

  @Test
  void emptyFileIsNotBackedUp() throws IOException {
    ManualClock clock = new ManualClock(START);
    DailyRotatingFileHandler handler = open(clock, 7, null);
    try {
      clock.advance(Duration.ofDays(1));
      handler.publish(TestRecords.record(LogLevel.INFO, "first"));

      assertEquals(List.of("app.log"), listNames());
      assertEquals("first\n", read(handler.file()));
    } finally {
      handler.close();
    }
  }

  @Test
  void existingFileIsAttributedToItsModificationDay() throws IOException {
    Path file = tempDir.resolve("app.log");
    Files.writeString(file, "stale\n", StandardCharsets.UTF_8);
    Files.setLastModifiedTime(file, FileTime.from(Instant.parse("2024-02-27T08:00:00Z")));

    DailyRotatingFileHandler handler = open(new ManualClock(START), 7, null);
    try {
      handler.publish(TestRecords.record(LogLevel.INFO, "fresh"));

      assertEquals("fresh\n", read(file));
      assertEquals("stale\n", read(handler.backupFor(LocalDate.of(2024, 2, 27))));
    } finally {
      handler.close();
    }
  }

  @Test
  void dayBoundaryFollowsConfiguredZone() throws IOException {
    // 10:00Z is 05:00 in Toronto; 06:00Z the next day is 01:00 there
    ManualClock clock = new ManualClock(START);
    DailyRotatingFileHandler handler = new DailyRotatingFileHandler(tempDir.resolve("app.log"), 7,
        ZoneId.of("America/Toronto"), clock, LogLevel.DEBUG, MESSAGE_ONLY, null);
    try {
      handler.publish(TestRecords.record(LogLevel.INFO, "before"));
      clock.advance(Duration.ofHours(20));
      handler.publish(TestRecords.record(LogLevel.INFO, "after"));

      assertTrue(Files.exists(handler.backupFor(LocalDate.of(2024, 3, 1))));
    } finally {
      handler.close();
    }
  }

  @Test
  void rejectsNegativeRetention() {
    assertThrows(IllegalArgumentException.class, () -> open(new ManualClock(START), -1, null));
    assertFalse(Files.exists(tempDir.resolve("app.log")));
  }

  @Test
  void concurrentWritersAcrossMidnightsLoseNoEntries() throws Exception {
    AtomicLong reads = new AtomicLong();
    // every reading is one hour later than the previous one
    ClockPort hourly = new ClockPort() {
      @Override
      public Instant now() {
        return START.plus(Duration.ofHours(reads.getAndIncrement()));
      }

      @Override
      public long monotonicNanos() {
        return 0L;
      }
    };
    int writers = 4;
    int perWriter = 50;
    DailyRotatingFileHandler handler = new DailyRotatingFileHandler(
        tempDir.resolve("app.log"), 0, ZoneOffset.UTC, hourly, LogLevel.DEBUG, MESSAGE_ONLY, null);
    ExecutorService executor = Executors.newFixedThreadPool(writers);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<?>> results = new ArrayList<>();
      for (int w = 0; w < writers; w++) {
        int writer = w;
        results.add(executor.submit(() -> {
          assertTrue(start.await(5, TimeUnit.SECONDS));
          for (int i = 0; i < perWriter; i++) {
            handler.publish(TestRecords.record(LogLevel.INFO, String.format("t%d-%04d", writer, i)));
          }
          return null;
        }));
      }
      start.countDown();
      for (Future<?> result : results) {
        result.get(30, TimeUnit.SECONDS);
      }
    } finally {
      executor.shutdownNow();
      handler.close();
    }

    Set<String> entries = new HashSet<>();
    List<String> names = listNames();
    for (String name : names) {
      for (String line : Files.readAllLines(tempDir.resolve(name), StandardCharsets.UTF_8)) {
        assertTrue(line.matches("t\\d-\\d{4}"), "torn entry: " + line);
        assertTrue(entries.add(line), "duplicate entry: " + line);
      }
    }
    assertEquals(writers * perWriter, entries.size());
    // 200 hourly readings from 10:00 on 2024-03-01 span nine calendar days
    assertEquals(9, names.size());
  }

  private DailyRotatingFileHandler open(ManualClock clock, int backupDays, RecordingMetricsPort metrics) {
    return new DailyRotatingFileHandler(tempDir.resolve("app.log"), backupDays, ZoneOffset.UTC, clock,
        LogLevel.DEBUG, MESSAGE_ONLY, metrics);
  }

  private List<String> listNames() throws IOException {
    try (Stream<Path> files = Files.list(tempDir)) {
      return files.map(path -> path.getFileName().toString()).sorted().toList();
    }
  }

  private static String read(Path path) throws IOException {
    return Files.readString(path, StandardCharsets.UTF_8);
  }
}
