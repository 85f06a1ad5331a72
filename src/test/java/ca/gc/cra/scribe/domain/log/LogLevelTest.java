package ca.gc.cra.scribe.domain.log;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LogLevelTest {

  @Test
  void isAtLeastFollowsSeverityOrder() {
    assertTrue(LogLevel.ERROR.isAtLeast(LogLevel.WARNING));
    assertTrue(LogLevel.INFO.isAtLeast(LogLevel.INFO));
    assertFalse(LogLevel.DEBUG.isAtLeast(LogLevel.INFO));
    assertTrue(LogLevel.CRITICAL.isAtLeast(LogLevel.ERROR));
  }

  @Test
  void fromStringAcceptsAliasesAndCase() {
    assertEquals(LogLevel.WARNING, LogLevel.fromString("warn"));
    assertEquals(LogLevel.CRITICAL, LogLevel.fromString(" FATAL "));
    assertEquals(LogLevel.DEBUG, LogLevel.fromString("debug"));
    assertEquals(LogLevel.INFO, LogLevel.fromString(""));
  }

  @Test
  void fromStringRejectsUnknownNames() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> LogLevel.fromString("verbose"));
    assertTrue(ex.getMessage().contains("verbose"));
  }
}
