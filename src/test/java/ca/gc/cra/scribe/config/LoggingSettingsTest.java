package ca.gc.cra.scribe.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.scribe.domain.log.LogLevel;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LoggingSettingsTest {

  @TempDir Path tempDir;

  @Test
  void explicitArgumentsWinAndYamlOverridesApply() throws IOException {
    Path yaml = tempDir.resolve("logging.yaml");
    Files.writeString(yaml, """
        common:
          file:
            backupCount: 2
        staging:
          level: warning
        """);

    LoggingSettings settings = LoggingSettings.resolve("staging", tempDir.toString(), yaml.toString());
    LoggerConfig config = settings.configFor("orders");

    assertEquals(Environment.STAGING, settings.environment());
    assertEquals(tempDir, settings.logDir());
    assertEquals(LogLevel.WARNING, config.level());
    SizeRotatingFileSpec file = assertInstanceOf(SizeRotatingFileSpec.class, config.handlers().get(1));
    assertEquals(tempDir.resolve("orders.log"), file.file());
    assertEquals(2, file.backupCount());
  }

  @Test
  void missingConfigFileFallsBackToPresetDefaults() {
    LoggingSettings settings =
        LoggingSettings.resolve("testing", tempDir.toString(), tempDir.resolve("absent.yaml").toString());

    assertSame(PresetOverrides.NONE, settings.overrides());
    assertEquals(LogLevel.WARNING, settings.configFor("orders").level());
  }

  @Test
  void unknownEnvironmentIsFatal() {
    assertThrows(IllegalArgumentException.class, () -> LoggingSettings.resolve("qa", null, null));
  }

  @Test
  void invalidOverrideIsFatal() throws IOException {
    Path yaml = tempDir.resolve("logging.yaml");
    Files.writeString(yaml, """
        production:
          file:
            maxBytes: lots
        """);

    assertThrows(IllegalArgumentException.class,
        () -> LoggingSettings.resolve("production", tempDir.toString(), yaml.toString()));
  }
}
