package ca.gc.cra.scribe.domain.log;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * <strong>What:</strong> Field names owned by {@link LogRecord} itself.
 * <p><strong>Why:</strong> Caller-supplied context or extra keys must never shadow the fields the record
 * renders at top level; colliding keys are dropped at construction instead of overwriting data.</p>
 * <p><strong>Thread-safety:</strong> Stateless utility.</p>
 *
 * @since 0.1.0
 */
public final class ReservedAttributes {
  /** Exhaustive list of record-owned names, compared case-sensitively. */
  public static final Set<String> NAMES = Set.of(
      "timestamp",
      "level",
      "logger",
      "message",
      "module",
      "function",
      "line",
      "context",
      "extra",
      "error");

  private ReservedAttributes() {
    // Utility
  }

  /**
   * Returns whether {@code key} is a record-owned name.
   *
   * @param key candidate field name; {@code null} is treated as reserved
   * @return {@code true} when the key must be dropped
   */
  public static boolean isReserved(String key) {
    return key == null || NAMES.contains(key);
  }

  /**
   * Copies {@code fields} without reserved keys, preserving insertion order.
   *
   * @param fields caller-supplied fields; {@code null} yields an empty map
   * @return unmodifiable ordered copy containing only permitted keys
   */
  public static Map<String, Object> strip(Map<String, ?> fields) {
    if (fields == null || fields.isEmpty()) {
      return Map.of();
    }
    Map<String, Object> safe = new LinkedHashMap<>();
    for (Map.Entry<String, ?> entry : fields.entrySet()) {
      if (!isReserved(entry.getKey())) {
        safe.put(entry.getKey(), entry.getValue());
      }
    }
    return Collections.unmodifiableMap(safe);
  }
}
