package ca.gc.cra.scribe.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {
  private static final Set<String> KEYS = Set.of("env", "logDir");

  @Test
  void parsesKeyValuePairsSplitOnFirstEquals() {
    Map<String, String> map = CliArgsParser.toMap(List.of("env=staging", " logDir=/tmp/a=b "), KEYS);

    assertEquals("staging", map.get("env"));
    assertEquals("/tmp/a=b", map.get("logDir"));
  }

  @Test
  void skipsBlankArguments() {
    assertTrue(CliArgsParser.toMap(Arrays.asList("", null, "  "), KEYS).isEmpty());
    assertTrue(CliArgsParser.toMap(null, KEYS).isEmpty());
  }

  @Test
  void rejectsMalformedUnknownAndRepeatedArguments() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(List.of("invalid"), KEYS));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(List.of("=value"), KEYS));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(List.of("color=red"), KEYS));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(List.of("env=a", "env=b"), KEYS));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(List.of("env=a\u0007"), KEYS));
  }
}
