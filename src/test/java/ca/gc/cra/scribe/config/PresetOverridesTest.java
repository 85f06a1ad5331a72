package ca.gc.cra.scribe.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.scribe.domain.log.LogLevel;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PresetOverridesTest {

  @Test
  void parsesEveryKnownSetting() {
    PresetOverrides overrides = PresetOverrides.from(Map.of(
        "level", "warning",
        "logDir", "/data/logs",
        "console.format", "text",
        "console.colors", "off",
        "file.maxBytes", "4096",
        "file.backupCount", "0",
        "daily.backupDays", "14",
        "redaction.keys", "employee_number, iban,,",
        "redaction.sentinel", "[hidden]"));

    assertEquals(LogLevel.WARNING, overrides.level());
    assertEquals(Path.of("/data/logs"), overrides.logDir());
    assertEquals(OutputFormat.TEXT, overrides.consoleFormat());
    assertEquals(Boolean.FALSE, overrides.consoleColors());
    assertEquals(4096L, overrides.fileMaxBytes());
    assertEquals(0, overrides.fileBackupCount());
    assertEquals(14, overrides.dailyBackupDays());
    assertEquals(List.of("employee_number", "iban"), overrides.redactionKeys());
    assertEquals("[hidden]", overrides.redactionSentinel());
  }

  @Test
  void emptyOrUnknownSettingsChangeNothing() {
    assertSame(PresetOverrides.NONE, PresetOverrides.from(Map.of()));
    assertEquals(PresetOverrides.NONE, PresetOverrides.from(Map.of("colour", "blue", "level", " ")));
  }

  @Test
  void malformedValuesAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> PresetOverrides.from(Map.of("file.maxBytes", "ten")));
    assertThrows(IllegalArgumentException.class, () -> PresetOverrides.from(Map.of("file.maxBytes", "0")));
    assertThrows(IllegalArgumentException.class, () -> PresetOverrides.from(Map.of("file.backupCount", "-1")));
    assertThrows(IllegalArgumentException.class, () -> PresetOverrides.from(Map.of("console.colors", "maybe")));
    assertThrows(IllegalArgumentException.class, () -> PresetOverrides.from(Map.of("console.format", "xml")));
    assertThrows(IllegalArgumentException.class, () -> PresetOverrides.from(Map.of("level", "verbose")));
  }

  @Test
  void nullRedactionKeysBecomeEmpty() {
    PresetOverrides overrides = new PresetOverrides(null, null, null, null, null, null, null, null, null);

    assertEquals(List.of(), overrides.redactionKeys());
    assertNull(overrides.level());
  }
}
