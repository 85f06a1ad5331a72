package ca.gc.cra.scribe.infrastructure.filter;

import ca.gc.cra.scribe.application.port.LogFilter;
import ca.gc.cra.scribe.domain.log.LogRecord;
import ca.gc.cra.scribe.validation.Strings;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Redacts context and extra values whose key names look sensitive.
 * <p><strong>Why:</strong> Credentials and personal identifiers must never reach a sink, whichever formatter
 * renders the record.</p>
 * <p><strong>Policy:</strong>
 * <ul>
 *   <li>A key matches when its lower-cased name contains any blocklisted fragment
 *   ({@code user_password_hint} matches {@code password}).</li>
 *   <li>Matching values become {@link #REDACTED}; the key itself is kept so consumers see the field existed.</li>
 *   <li>Nested map values are sanitized recursively. Values are never inspected.</li>
 *   <li>Maps nested deeper than {@value #MAX_DEPTH} levels (including self-referencing maps) are replaced by
 *   {@link #DEPTH_EXCEEDED} since their keys cannot be checked.</li>
 *   <li>The filter never vetoes a record.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class SensitiveDataFilter implements LogFilter {
  /** Replacement written in place of sensitive values. */
  public static final String REDACTED = "***REDACTED***";

  /** Built-in blocklist of key fragments. */
  public static final List<String> DEFAULT_KEYS = List.of(
      "password",
      "passwd",
      "token",
      "secret",
      "api_key",
      "apikey",
      "authorization",
      "credential",
      "private_key",
      "ssn",
      "credit_card",
      "card_number",
      "cvv",
      "pin",
      "session_id",
      "cookie",
      "csrf_token");

  /** Placeholder for nested maps beyond {@link #MAX_DEPTH}. */
  public static final String DEPTH_EXCEEDED = "<max depth exceeded>";

  /** Deepest nested map level inspected. */
  public static final int MAX_DEPTH = 16;

  private final Set<String> keys;
  private final String sentinel;

  /** Creates a filter using {@link #DEFAULT_KEYS} and {@link #REDACTED}. */
  public SensitiveDataFilter() {
    this(DEFAULT_KEYS, REDACTED);
  }

  /**
   * Creates a filter with an explicit blocklist.
   *
   * @param keys key fragments matched case-insensitively; blank entries are rejected
   * @param sentinel replacement value; must not be blank
   * @throws IllegalArgumentException if a fragment or the sentinel is blank
   */
  public SensitiveDataFilter(Collection<String> keys, String sentinel) {
    Objects.requireNonNull(keys, "keys");
    Set<String> normalized = new LinkedHashSet<>();
    for (String key : keys) {
      normalized.add(Strings.requireNonBlank("redaction key", key).toLowerCase(Locale.ROOT));
    }
    this.keys = Collections.unmodifiableSet(normalized);
    this.sentinel = Strings.requireNonBlank("sentinel", sentinel);
  }

  /**
   * Returns a filter matching this blocklist plus {@code additional} fragments.
   *
   * @param additional organization-specific fragments
   * @return new filter; {@code this} is unchanged
   */
  public SensitiveDataFilter withAdditionalKeys(Collection<String> additional) {
    Set<String> merged = new LinkedHashSet<>(keys);
    merged.addAll(additional);
    return new SensitiveDataFilter(merged, sentinel);
  }

  /**
   * Returns the normalized blocklist.
   *
   * @return unmodifiable lower-case fragments
   */
  public Set<String> keys() {
    return keys;
  }

  /**
   * Returns the replacement value.
   *
   * @return sentinel string
   */
  public String sentinel() {
    return sentinel;
  }

  /**
   * Returns whether {@code key} contains a blocklisted fragment.
   *
   * @param key field name; {@code null} never matches
   * @return {@code true} when the value must be redacted
   */
  public boolean isSensitive(String key) {
    if (key == null) {
      return false;
    }
    String lower = key.toLowerCase(Locale.ROOT);
    for (String fragment : keys) {
      if (lower.contains(fragment)) {
        return true;
      }
    }
    return false;
  }

  @Override
  public FilterDecision apply(LogRecord record) {
    if (!containsSensitive(record.context(), 0) && !containsSensitive(record.extra(), 0)) {
      return FilterDecision.keep(record);
    }
    return FilterDecision.keep(record.withContext(sanitize(record.context())).withExtra(sanitize(record.extra())));
  }

  /**
   * Returns a copy of {@code data} with sensitive values replaced.
   *
   * @param data fields to sanitize; {@code null} yields an empty map
   * @return ordered sanitized copy
   */
  public Map<String, Object> sanitize(Map<String, ?> data) {
    Map<String, Object> sanitized = new LinkedHashMap<>();
    if (data == null) {
      return sanitized;
    }
    for (Map.Entry<String, ?> entry : data.entrySet()) {
      sanitized.put(entry.getKey(), sanitizeValue(entry.getKey(), entry.getValue(), 1));
    }
    return sanitized;
  }

  private Object sanitizeValue(Object key, Object value, int depth) {
    if (key instanceof String name && isSensitive(name)) {
      return sentinel;
    }
    if (value instanceof Map<?, ?> nested) {
      if (depth > MAX_DEPTH) {
        return DEPTH_EXCEEDED;
      }
      Map<Object, Object> copy = new LinkedHashMap<>();
      for (Map.Entry<?, ?> entry : nested.entrySet()) {
        copy.put(entry.getKey(), sanitizeValue(entry.getKey(), entry.getValue(), depth + 1));
      }
      return copy;
    }
    return value;
  }

  private boolean containsSensitive(Map<?, ?> data, int depth) {
    if (depth > MAX_DEPTH) {
      return true;
    }
    for (Map.Entry<?, ?> entry : data.entrySet()) {
      if (entry.getKey() instanceof String name && isSensitive(name)) {
        return true;
      }
      if (entry.getValue() instanceof Map<?, ?> nested && containsSensitive(nested, depth + 1)) {
        return true;
      }
    }
    return false;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof SensitiveDataFilter that
        && keys.equals(that.keys)
        && sentinel.equals(that.sentinel);
  }

  @Override
  public int hashCode() {
    return Objects.hash(keys, sentinel);
  }

  @Override
  public String toString() {
    return "SensitiveDataFilter" + keys;
  }
}
