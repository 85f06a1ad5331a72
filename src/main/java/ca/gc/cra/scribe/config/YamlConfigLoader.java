package ca.gc.cra.scribe.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.StringJoiner;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads logging overrides from YAML, merging the {@code common} section with the section named after the
 * environment into a flat dotted-key map.
 *
 * <pre>{@code
 * common:
 *   redaction:
 *     keys: [employee_number]
 * production:
 *   file:
 *     maxBytes: 52428800
 * }</pre>
 */
public final class YamlConfigLoader {

  private YamlConfigLoader() {}

  /**
   * Loads and flattens the document.
   *
   * @param path YAML file
   * @param environment environment whose section overrides {@code common}
   * @return flat map, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the document is not a mapping of mappings
   */
  public static Optional<Map<String, String>> load(Path path, Environment environment) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(environment, "environment");
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      Object document = new Yaml().load(reader);
      if (document == null) {
        return Optional.of(Map.of());
      }
      Map<String, Object> root = asMap(document, "root");
      Map<String, String> flat = new LinkedHashMap<>();
      Object common = section(root, "common");
      if (common != null) {
        flatten(asMap(common, "common"), "", flat);
      }
      Object specific = section(root, environment.key());
      if (specific != null) {
        flatten(asMap(specific, environment.key()), "", flat);
      }
      return Optional.of(Map.copyOf(flat));
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse logging config at " + path, ex);
    }
  }

  private static Map<String, Object> asMap(Object node, String where) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(where + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key) || key.isBlank()) {
        throw new IllegalArgumentException(where + " section contains a blank or non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static Object section(Map<String, Object> root, String name) {
    for (Map.Entry<String, Object> entry : root.entrySet()) {
      if (entry.getKey().trim().toLowerCase(Locale.ROOT).equals(name)) {
        return entry.getValue();
      }
    }
    return null;
  }

  private static void flatten(Map<String, Object> source, String prefix, Map<String, String> target) {
    for (Map.Entry<String, Object> entry : source.entrySet()) {
      String key = prefix.isEmpty() ? entry.getKey() : prefix + '.' + entry.getKey();
      Object value = entry.getValue();
      if (value == null) {
        target.put(key, "");
      } else if (value instanceof Map<?, ?> nested) {
        flatten(asMap(nested, key), key, target);
      } else if (value instanceof Iterable<?> items) {
        // lists become comma-separated values
        StringJoiner joined = new StringJoiner(",");
        for (Object item : items) {
          if (item instanceof Map<?, ?> || item instanceof Iterable<?>) {
            throw new IllegalArgumentException("Nested structures are not supported in list " + key);
          }
          joined.add(String.valueOf(item));
        }
        target.put(key, joined.toString());
      } else {
        target.put(key, value.toString());
      }
    }
  }
}
