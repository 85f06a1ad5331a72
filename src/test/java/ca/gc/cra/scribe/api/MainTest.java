package ca.gc.cra.scribe.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class MainTest {
  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private StringWriter printed;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(Main.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    printed = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(printed, true));
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    CliPrinter.clearTestWriter();
  }

  @Test
  void helpPrintsCommandsAndSucceeds() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    assertTrue(printed.toString().contains("demo        Emit sample records"));
  }

  @Test
  void missingCommandPrintsUsage() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertTrue(printed.toString().contains("usage: scribe demo"));
  }

  @Test
  void unknownCommandIsLoggedAndRejected() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"replay"}));
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.ERROR
            && event.getFormattedMessage().contains("Unknown command: replay")));
  }

  @Test
  void parsesFlagsAnywhereAndKeepsArgumentOrder() {
    CliInput input = CliInput.parse(new String[] {"--verbose", "DEMO", "env=testing", "-h", "logDir=/tmp"});

    assertEquals("demo", input.command());
    assertEquals(List.of("env=testing", "logDir=/tmp"), input.arguments());
    assertTrue(input.help());
    assertTrue(input.verbose());
  }
}
