package ca.gc.cra.scribe.api;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.scribe.application.context.ContextStore;
import ca.gc.cra.scribe.application.logger.AppLogger;
import ca.gc.cra.scribe.application.port.LogHandler;
import ca.gc.cra.scribe.config.Environment;
import ca.gc.cra.scribe.config.HandlerContext;
import ca.gc.cra.scribe.config.HandlerSpec;
import ca.gc.cra.scribe.config.LoggerConfig;
import ca.gc.cra.scribe.config.LoggerPresets;
import ca.gc.cra.scribe.config.PresetOverrides;
import ca.gc.cra.scribe.domain.log.LogLevel;
import ca.gc.cra.scribe.testutil.ManualClock;
import ca.gc.cra.scribe.testutil.RecordingHandler;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LoggerRegistryTest {
  private static final PresetOverrides SMALL_FILES =
      PresetOverrides.from(Map.of("file.maxBytes", "3000", "file.backupCount", "50"));

  @TempDir Path tempDir;

  private ByteArrayOutputStream console;
  private HandlerContext handlerContext;
  private LoggerRegistry registry;

  @BeforeEach
  void setUp() {
    console = new ByteArrayOutputStream();
    handlerContext = new HandlerContext(
        null, new ManualClock(Instant.parse("2024-01-15T09:30:00Z")), ZoneOffset.UTC, console);
    registry = new LoggerRegistry(
        name -> LoggerPresets.forEnvironment(name, Environment.TESTING, tempDir), handlerContext, new ContextStore());
  }

  @Test
  void sameNameReturnsSameInstance() {
    AppLogger first = registry.get("orders");

    assertSame(first, registry.get("orders"));
    assertNotSame(first, registry.get("payments"));
    assertEquals(2, registry.size());
  }

  @Test
  void testingPresetWritesOnlyWarningsAsText() {
    AppLogger logger = registry.get("orders");

    logger.info("x");
    logger.warning("y", "code", 1);

    String output = console.toString(StandardCharsets.UTF_8);
    List<String> lines = output.lines().toList();
    assertEquals(1, lines.size(), output);
    assertTrue(lines.get(0).contains("WARNING  orders: y"), output);
    assertTrue(lines.get(0).contains("code=1"), output);
    assertFalse(output.contains("x\n"));
  }

  @Test
  void clearClosesHandlersAndLaterLookupsRebuild() {
    List<RecordingHandler> opened = new CopyOnWriteArrayList<>();
    registry = new LoggerRegistry(
        name -> LoggerConfig.of(name, LogLevel.DEBUG, List.of(new RecordingSpec(opened))),
        handlerContext,
        new ContextStore());
    AppLogger before = registry.get("orders");

    registry.clear();

    assertTrue(opened.get(0).isClosed());
    assertTrue(before.isClosed());
    assertEquals(0, registry.size());
    AppLogger after = registry.get("orders");
    assertNotSame(before, after);
    assertEquals(2, opened.size());
    assertFalse(opened.get(1).isClosed());
  }

  @Test
  void equalConfigurationReusesInstanceAndDifferentOneBuildsSeparateInstance() {
    LoggerConfig quiet = LoggerPresets.forEnvironment("orders", Environment.TESTING, tempDir);
    LoggerConfig chatty = LoggerPresets.forEnvironment("orders", Environment.DEVELOPMENT, tempDir);

    AppLogger primary = registry.get("orders");
    AppLogger same = registry.get("orders", quiet);
    AppLogger separate = registry.get("orders", chatty);

    assertSame(primary, same);
    assertNotSame(primary, separate);
    assertFalse(primary.isClosed());
    assertEquals(LogLevel.WARNING, primary.level());
    assertEquals(LogLevel.DEBUG, separate.level());
    assertSame(separate, registry.get("orders", chatty));
    assertSame(primary, registry.get("orders"));
    assertEquals(quiet, registry.configOf("orders"));
  }

  @Test
  void configurationForAnotherNameIsRejected() {
    LoggerConfig other = LoggerPresets.forEnvironment("payments", Environment.TESTING, tempDir);

    assertThrows(IllegalArgumentException.class, () -> registry.get("orders", other));
    assertNull(registry.configOf("orders"));
  }

  @Test
  void failedBuildClosesHandlersAlreadyOpenedAndRegistersNothing() {
    List<RecordingHandler> opened = new CopyOnWriteArrayList<>();
    HandlerSpec broken = new HandlerSpec() {
      @Override
      public LogLevel threshold() {
        return LogLevel.DEBUG;
      }

      @Override
      public LogHandler open(HandlerContext context) {
        throw new IllegalStateException("cannot open sink");
      }
    };
    LoggerConfig config = LoggerConfig.of("orders", LogLevel.DEBUG, List.of(new RecordingSpec(opened), broken));

    assertThrows(IllegalStateException.class, () -> registry.get("orders", config));
    assertTrue(opened.get(0).isClosed());
    assertEquals(0, registry.size());
  }

  @Test
  void blankNameIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> registry.get(" "));
  }

  @Test
  void selfReferencingFieldIsRenderedWithoutEscapingTheCaller() {
    Map<String, Object> payload = new HashMap<>();
    payload.put("self", payload);
    AppLogger logger = registry.get("svc");

    assertDoesNotThrow(() -> logger.warning("y", "payload", payload));

    String output = console.toString(StandardCharsets.UTF_8);
    assertEquals(1, output.lines().count(), output);
    assertTrue(output.contains("WARNING  svc: y | payload.self."), output);
    assertTrue(output.contains("<max depth exceeded>"), output);
  }

  @Test
  void heldLoggerKeepsWritingAfterClear() {
    AppLogger held = registry.get("svc");

    registry.clear();
    held.warning("after-clear", "code", 7);

    assertTrue(held.isClosed());
    assertEquals(1, registry.size());
    assertNotSame(held, registry.get("svc"));
    String output = console.toString(StandardCharsets.UTF_8);
    assertTrue(output.contains("WARNING  svc: after-clear | code=7"), output);
  }

  @Test
  void heldLoggerWithCustomConfigurationIsRebuiltWithThatConfiguration() {
    LoggerConfig chatty = LoggerPresets.forEnvironment("orders", Environment.DEVELOPMENT, tempDir);
    AppLogger held = registry.get("orders", chatty);

    registry.clear();
    held.info("still chatty");

    assertTrue(console.toString(StandardCharsets.UTF_8).contains("orders: still chatty"));
    assertEquals(chatty, registry.configOf("orders"));
    assertEquals(1, registry.size());
  }

  @Test
  void namesSanitizedToOneFileShareOneHandler() throws IOException {
    registry = stagingRegistry(SMALL_FILES);
    AppLogger slash = registry.get("orders/api");
    AppLogger underscore = registry.get("orders_api");

    for (int i = 0; i < 20; i++) {
      slash.info("from slash", "i", i);
      underscore.info("from underscore", "i", i);
    }

    assertEquals(1, registry.openFiles());
    List<Path> parts;
    try (Stream<Path> files = Files.list(tempDir)) {
      parts = files.filter(path -> path.getFileName().toString().startsWith("orders_api.log")).toList();
    }
    assertTrue(parts.size() > 1, "expected rotation: " + parts);
    long lines = 0;
    for (Path part : parts) {
      assertTrue(Files.size(part) <= 3000, part + " holds " + Files.size(part) + " bytes");
      lines += Files.readAllLines(part, StandardCharsets.UTF_8).size();
    }
    assertEquals(40, lines);

    registry.clear();
    assertEquals(0, registry.openFiles());
  }

  @Test
  void secondConfigurationWithSameFileSettingsSharesTheHandler() {
    registry = stagingRegistry(PresetOverrides.NONE);
    LoggerConfig debug = LoggerPresets.forEnvironment(
        "orders", Environment.STAGING, tempDir, PresetOverrides.from(Map.of("level", "DEBUG")));

    AppLogger primary = registry.get("orders");
    AppLogger separate = registry.get("orders", debug);
    separate.close();

    assertNotSame(primary, separate);
    assertEquals(1, registry.openFiles(), "primary still holds the file");
    primary.info("kept");
    assertTrue(Files.exists(tempDir.resolve("orders.log")));
  }

  @Test
  void fileClaimedWithDifferentSettingsIsRejected() {
    registry = stagingRegistry(PresetOverrides.NONE);
    registry.get("orders");
    LoggerConfig smaller = LoggerPresets.forEnvironment("orders", Environment.STAGING, tempDir, SMALL_FILES);

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> registry.get("orders", smaller));

    assertTrue(ex.getMessage().contains("orders.log"), ex.getMessage());
    assertEquals(1, registry.size());
    assertEquals(1, registry.openFiles());
  }

  @Test
  void concurrentLookupsAndClearsNeverFailOrTearLines() throws Exception {
    int writers = 4;
    int perWriter = 200;
    ExecutorService executor = Executors.newFixedThreadPool(writers + 1);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<?>> results = new ArrayList<>();
      for (int w = 0; w < writers; w++) {
        int writer = w;
        results.add(executor.submit(() -> {
          assertTrue(start.await(5, TimeUnit.SECONDS));
          for (int i = 0; i < perWriter; i++) {
            AppLogger logger = registry.get("orders");
            assertEquals("orders", logger.name());
            logger.warning("tick", "writer", writer, "i", i);
          }
          return null;
        }));
      }
      results.add(executor.submit(() -> {
        assertTrue(start.await(5, TimeUnit.SECONDS));
        for (int i = 0; i < 50; i++) {
          registry.clear();
        }
        return null;
      }));
      start.countDown();
      for (Future<?> result : results) {
        result.get(30, TimeUnit.SECONDS);
      }
    } finally {
      executor.shutdownNow();
    }

    assertFalse(registry.get("orders").isClosed());
    assertEquals(1, registry.size());
    List<String> lines = console.toString(StandardCharsets.UTF_8).lines().toList();
    assertFalse(lines.isEmpty());
    assertTrue(lines.size() <= writers * perWriter);
    for (String line : lines) {
      assertTrue(line.matches("\\[[^\\]]+\\] WARNING  orders: tick \\| writer=\\d i=\\d+"), line);
    }
  }

  private LoggerRegistry stagingRegistry(PresetOverrides overrides) {
    return new LoggerRegistry(
        name -> LoggerPresets.forEnvironment(name, Environment.STAGING, tempDir, overrides),
        handlerContext,
        new ContextStore());
  }

  private record RecordingSpec(List<RecordingHandler> opened) implements HandlerSpec {
    @Override
    public LogLevel threshold() {
      return LogLevel.DEBUG;
    }

    @Override
    public LogHandler open(HandlerContext context) {
      RecordingHandler handler = new RecordingHandler();
      opened.add(handler);
      return handler;
    }
  }
}
