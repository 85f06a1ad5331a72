package ca.gc.cra.scribe.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeIsInclusive() {
    assertEquals(0L, Numbers.requireRange("backupCount", 0, 0, 10));
    assertEquals(10L, Numbers.requireRange("backupCount", 10, 0, 10));
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("backupCount", 11, 0, 10));
    assertEquals("backupCount must be between 0 and 10 (was 11)", ex.getMessage());
  }

  @Test
  void parseLongNamesTheSettingOnFailure() {
    assertEquals(4096L, Numbers.parseLong("file.maxBytes", " 4096 "));
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Numbers.parseLong("file.maxBytes", "4k"));
    assertEquals("file.maxBytes must be numeric (was 4k)", ex.getMessage());
  }
}
