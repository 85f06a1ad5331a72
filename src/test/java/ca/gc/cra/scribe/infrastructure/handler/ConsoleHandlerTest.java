package ca.gc.cra.scribe.infrastructure.handler;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.scribe.application.port.LogFormatter;
import ca.gc.cra.scribe.domain.log.LogLevel;
import ca.gc.cra.scribe.testutil.RecordingMetricsPort;
import ca.gc.cra.scribe.testutil.TestRecords;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class ConsoleHandlerTest {
  private static final LogFormatter MESSAGE_ONLY = record -> record.level() + " " + record.message();

  @Test
  void writesOneUtf8LinePerRecordAtOrAboveThreshold() {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    ConsoleHandler handler = new ConsoleHandler(out, LogLevel.WARNING, MESSAGE_ONLY, null);

    handler.publish(TestRecords.record(LogLevel.INFO, "quiet"));
    handler.publish(TestRecords.record(LogLevel.WARNING, "café"));
    handler.publish(TestRecords.record(LogLevel.CRITICAL, "down"));

    assertEquals("WARNING café\nCRITICAL down\n", out.toString(StandardCharsets.UTF_8));
  }

  @Test
  void closeFlushesWithoutClosingStreamAndDropsLaterRecords() {
    CloseTrackingStream out = new CloseTrackingStream();
    ConsoleHandler handler = new ConsoleHandler(out, LogLevel.DEBUG, MESSAGE_ONLY, null);

    handler.close();
    handler.publish(TestRecords.record(LogLevel.ERROR, "after close"));

    assertTrue(handler.isClosed());
    assertEquals(0, out.size());
    assertFalse(out.closed);
  }

  @Test
  void sinkFailureIsCountedAndWarnedOnce() {
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    OutputStream failing = new OutputStream() {
      @Override
      public void write(int b) throws IOException {
        throw new IOException("disk full");
      }
    };
    ConsoleHandler handler = new ConsoleHandler(failing, LogLevel.DEBUG, MESSAGE_ONLY, metrics);

    Logger logger = (Logger) LoggerFactory.getLogger(AbstractLogHandler.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    boolean originalAdditive = logger.isAdditive();
    logger.setAdditive(false);
    appender.start();
    logger.addAppender(appender);
    try {
      handler.publish(TestRecords.record(LogLevel.INFO, "one"));
      handler.publish(TestRecords.record(LogLevel.INFO, "two"));
    } finally {
      logger.detachAppender(appender);
      logger.setAdditive(originalAdditive);
      appender.stop();
    }

    assertEquals(2, metrics.count(AbstractLogHandler.WRITE_FAILED));
    List<ILoggingEvent> warnings = appender.list.stream()
        .filter(event -> event.getLevel() == ch.qos.logback.classic.Level.WARN)
        .toList();
    assertEquals(1, warnings.size());
  }

  @Test
  void formatterFailureDropsRecordAndCounts() {
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    ConsoleHandler handler = new ConsoleHandler(out, LogLevel.DEBUG, record -> {
      throw new IllegalStateException("bad template");
    }, metrics);

    handler.publish(TestRecords.record(LogLevel.INFO, "m"));

    assertEquals(0, out.size());
    assertEquals(1, metrics.count(AbstractLogHandler.FORMAT_FAILED));
  }

  private static final class CloseTrackingStream extends ByteArrayOutputStream {
    private boolean closed;

    @Override
    public void close() {
      closed = true;
    }
  }
}
