package ca.gc.cra.scribe.domain.log;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ReservedAttributesTest {

  @Test
  void stripDropsEveryReservedNameAndKeepsOrder() {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("zeta", 1);
    for (String reserved : ReservedAttributes.NAMES) {
      fields.put(reserved, "collides");
    }
    fields.put("alpha", 2);

    Map<String, Object> safe = ReservedAttributes.strip(fields);

    assertEquals(List.of("zeta", "alpha"), List.copyOf(safe.keySet()));
  }

  @Test
  void comparisonIsCaseSensitive() {
    assertTrue(ReservedAttributes.isReserved("message"));
    assertFalse(ReservedAttributes.isReserved("Message"));
    assertTrue(ReservedAttributes.isReserved(null));
  }

  @Test
  void strippedMapIsUnmodifiableAndAllowsNullValues() {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("optional", null);

    Map<String, Object> safe = ReservedAttributes.strip(fields);

    assertTrue(safe.containsKey("optional"));
    assertThrows(UnsupportedOperationException.class, () -> safe.put("x", 1));
  }
}
