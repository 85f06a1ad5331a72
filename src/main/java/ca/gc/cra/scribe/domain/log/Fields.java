package ca.gc.cra.scribe.domain.log;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts keyword-style arguments into ordered field maps.
 * <p>Malformed input is dropped rather than rejected: a trailing key without a value, a {@code null} key or a
 * non-{@link String} key never reaches a record. Logging calls therefore cannot fail on field shape.</p>
 *
 * @since 0.1.0
 */
public final class Fields {
  private Fields() {
    // Utility
  }

  /**
   * Builds a field map from alternating {@code key, value} arguments.
   *
   * @param keyValues alternating keys and values; may be {@code null}
   * @return unmodifiable ordered map; later duplicates win
   */
  public static Map<String, Object> of(Object... keyValues) {
    if (keyValues == null || keyValues.length < 2) {
      return Map.of();
    }
    Map<String, Object> fields = new LinkedHashMap<>();
    for (int i = 0; i + 1 < keyValues.length; i += 2) {
      if (keyValues[i] instanceof String key && !key.isEmpty()) {
        fields.put(key, keyValues[i + 1]);
      }
    }
    return Collections.unmodifiableMap(fields);
  }

  /**
   * Copies a caller map, dropping {@code null} or empty keys.
   *
   * @param source caller map; may be {@code null}
   * @return unmodifiable ordered copy
   */
  public static Map<String, Object> copyOf(Map<String, ?> source) {
    if (source == null || source.isEmpty()) {
      return Map.of();
    }
    Map<String, Object> fields = new LinkedHashMap<>();
    for (Map.Entry<String, ?> entry : source.entrySet()) {
      String key = entry.getKey();
      if (key != null && !key.isEmpty()) {
        fields.put(key, entry.getValue());
      }
    }
    return Collections.unmodifiableMap(fields);
  }
}
