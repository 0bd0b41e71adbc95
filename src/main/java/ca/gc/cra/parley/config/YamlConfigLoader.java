package ca.gc.cra.parley.config;

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
 * Loads gate configuration from a YAML document and flattens sections into dotted key/value maps.
 * Lists of scalars are joined with commas.
 */
public final class YamlConfigLoader {

  private YamlConfigLoader() {}

  /**
   * Loads YAML from {@code path} and merges the {@code common} section with the requested
   * {@code profile} section; profile keys win.
   *
   * @param path location of the YAML configuration
   * @param profile profile section name such as {@code ci} or {@code nightly}
   * @return flat map, empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML structure is invalid
   */
  public static Optional<Map<String, String>> load(Path path, String profile) throws IOException {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(profile, "profile");
    if (!Files.exists(path)) {
      return Optional.empty();
    }

    String normalizedProfile = profile.trim().toLowerCase(Locale.ROOT);
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      Object document = new Yaml().load(reader);
      if (document == null) {
        return Optional.of(Map.of());
      }
      Map<String, Object> root = asMap(document, "root");

      Map<String, String> flattened = new LinkedHashMap<>();
      Object commonSection = findSection(root, "common");
      if (commonSection != null) {
        flatten(asMap(commonSection, "common"), "", flattened);
      }
      Object profileSection = findSection(root, normalizedProfile);
      if (profileSection instanceof Map<?, ?> profileMap) {
        flatten(asMap(profileMap, normalizedProfile), "", flattened);
      } else if (profileSection != null) {
        throw new IllegalArgumentException(normalizedProfile + " section must be a mapping");
      }

      return Optional.of(Map.copyOf(flattened));
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + path, ex);
    }
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " section contains non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static Object findSection(Map<String, Object> root, String key) {
    for (Map.Entry<String, Object> entry : root.entrySet()) {
      if (entry.getKey().trim().toLowerCase(Locale.ROOT).equals(key)) {
        return entry.getValue();
      }
    }
    return null;
  }

  private static void flatten(Map<String, Object> source, String prefix, Map<String, String> target) {
    for (Map.Entry<String, Object> entry : source.entrySet()) {
      String key = entry.getKey();
      if (key.isBlank()) {
        throw new IllegalArgumentException("YAML contains blank keys");
      }
      String composite = prefix.isEmpty() ? key : prefix + '.' + key;
      Object value = entry.getValue();
      if (value == null) {
        target.put(composite, "");
      } else if (value instanceof Map<?, ?> nested) {
        flatten(asMap(nested, composite), composite, target);
      } else if (value instanceof Iterable<?> items) {
        StringJoiner joined = new StringJoiner(",");
        for (Object item : items) {
          if (item instanceof Map<?, ?> || item instanceof Iterable<?>) {
            throw new IllegalArgumentException("Only lists of scalars are supported for key " + composite);
          }
          joined.add(String.valueOf(item));
        }
        target.put(composite, joined.toString());
      } else {
        target.put(composite, value.toString());
      }
    }
  }
}
