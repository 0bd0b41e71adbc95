package ca.gc.cra.parley.application.events.rules;

import ca.gc.cra.parley.domain.events.EventKind;
import ca.gc.cra.parley.domain.telemetry.RecordLevel;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads classification rules from YAML documents into intermediate definitions.
 *
 * @since PARLEY 0.1.0
 */
final class RuleSetLoader {
  private final Set<String> ids = new LinkedHashSet<>();
  private final List<RuleDefinition> rules = new ArrayList<>();

  /**
   * Appends the rules of every file in order.
   *
   * @param sources rule files
   * @throws IOException when a file is missing or unreadable
   */
  void addFiles(List<Path> sources) throws IOException {
    Objects.requireNonNull(sources, "sources");
    for (Path path : sources) {
      if (!Files.exists(path)) {
        throw new IOException("Rule file not found: " + path);
      }
      try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
        addDocument(reader, path.toString());
      }
    }
  }

  /**
   * Appends the rules of a classpath resource.
   *
   * @param resource resource name such as {@code parley/default-rules.yaml}
   * @throws IOException when the resource is missing or unreadable
   */
  void addResource(String resource) throws IOException {
    ClassLoader loader = RuleSetLoader.class.getClassLoader();
    try (InputStream in = loader.getResourceAsStream(resource)) {
      if (in == null) {
        throw new IOException("Rule resource not found on classpath: " + resource);
      }
      addDocument(new InputStreamReader(in, StandardCharsets.UTF_8), "classpath:" + resource);
    }
  }

  List<RuleDefinition> rules() {
    return List.copyOf(rules);
  }

  private void addDocument(Reader reader, String origin) {
    try {
      Object rootObj = new Yaml().load(reader);
      if (rootObj == null) {
        return;
      }
      Map<String, Object> root = asMap(rootObj, "root");
      int version = toInt(root.get("version"), "version");
      if (version != 1) {
        throw new IllegalArgumentException("Unsupported rule version " + version + " in " + origin);
      }
      Object rulesNode = root.get("rules");
      if (rulesNode == null) {
        return;
      }
      if (!(rulesNode instanceof Iterable<?> iterable)) {
        throw new IllegalArgumentException("rules must be a list in " + origin);
      }
      for (Object ruleNode : iterable) {
        RuleDefinition rule = parseRule(asMap(ruleNode, "rule"), origin);
        if (!ids.add(rule.id())) {
          throw new IllegalArgumentException("Duplicate rule id detected: " + rule.id() + " (" + origin + ")");
        }
        rules.add(rule);
      }
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML rules at " + origin, ex);
    }
  }

  private RuleDefinition parseRule(Map<String, Object> map, String origin) {
    String id = requireString(map, "id");
    String description = toOptionalString(map.get("description"));
    String category = requireString(map, "category").trim().toLowerCase(Locale.ROOT);
    EventKind event;
    try {
      event = EventKind.parse(requireString(map, "event"));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Rule " + id + ": " + ex.getMessage(), ex);
    }
    RecordLevel level = parseLevel(map.get("level"), id);
    MatchDefinition match = map.get("match") == null
        ? MatchDefinition.empty()
        : parseMatch(asMap(map.get("match"), "match"));
    Map<String, String> extract = parseStringMap(map.get("extract"), "extract");
    Map<String, String> attributes = parseStringMap(map.get("attributes"), "attributes");
    if (level == null && match.contains().isEmpty() && match.regex() == null) {
      throw new IllegalArgumentException("Rule " + id + " has no level, contains or regex condition");
    }
    return new RuleDefinition(id, description, category, event, level, match, extract, attributes, origin);
  }

  private RecordLevel parseLevel(Object node, String id) {
    if (node == null) {
      return null;
    }
    String value = toString(node).trim().toUpperCase(Locale.ROOT);
    try {
      return RecordLevel.valueOf(value);
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Rule " + id + ": unsupported level " + node, ex);
    }
  }

  private MatchDefinition parseMatch(Map<String, Object> map) {
    boolean ignoreCase = map.containsKey("ignoreCase") && toBoolean(map.get("ignoreCase"), "ignoreCase");
    List<List<String>> contains = new ArrayList<>();
    Object containsNode = map.get("contains");
    if (containsNode instanceof String single) {
      contains.add(List.of(single));
    } else if (containsNode instanceof Iterable<?> groups) {
      for (Object group : groups) {
        contains.add(toStringList(group, "contains"));
      }
    } else if (containsNode != null) {
      throw new IllegalArgumentException("contains must be string or list");
    }
    List<String> excludes = map.get("excludes") == null ? List.of() : toStringList(map.get("excludes"), "excludes");
    String regex = toOptionalString(map.get("regex"));
    return new MatchDefinition(List.copyOf(contains), excludes, regex, ignoreCase);
  }

  private List<String> toStringList(Object node, String context) {
    List<String> values = new ArrayList<>();
    if (node instanceof Iterable<?> iterable) {
      for (Object value : iterable) {
        values.add(toString(value));
      }
    } else if (node != null) {
      values.add(toString(node));
    }
    for (String value : values) {
      if (value.isEmpty()) {
        throw new IllegalArgumentException(context + " entries must not be empty");
      }
    }
    if (values.isEmpty()) {
      throw new IllegalArgumentException(context + " group must not be empty");
    }
    return List.copyOf(values);
  }

  private Map<String, Object> asMap(Object node, String context) {
    if (node == null) {
      throw new IllegalArgumentException(context + " section is missing");
    }
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      Object keyObj = entry.getKey();
      if (!(keyObj instanceof String key)) {
        throw new IllegalArgumentException(context + " contains non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private String requireString(Map<String, Object> map, String key) {
    Object value = map.get(key);
    if (value == null || toString(value).isBlank()) {
      throw new IllegalArgumentException("Missing required field: " + key);
    }
    return toString(value);
  }

  private String toOptionalString(Object value) {
    if (value == null) {
      return null;
    }
    String str = toString(value);
    return str.isBlank() ? null : str;
  }

  private String toString(Object value) {
    if (value == null) {
      return "";
    }
    return value.toString();
  }

  private int toInt(Object value, String context) {
    if (value instanceof Number number) {
      return number.intValue();
    }
    if (value instanceof String str && !str.isBlank()) {
      try {
        return Integer.parseInt(str.trim());
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException("Invalid integer for " + context + ": '" + str + "'");
      }
    }
    throw new IllegalArgumentException("Invalid integer for " + context + ": " + value);
  }

  private boolean toBoolean(Object value, String context) {
    if (value instanceof Boolean bool) {
      return bool;
    }
    if (value instanceof String str) {
      return Boolean.parseBoolean(str.trim());
    }
    throw new IllegalArgumentException("Invalid boolean for " + context + ": " + value);
  }

  private Map<String, String> parseStringMap(Object node, String context) {
    if (node == null) {
      return Map.of();
    }
    Map<String, Object> map = asMap(node, context);
    Map<String, String> result = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : map.entrySet()) {
      result.put(entry.getKey(), toString(entry.getValue()));
    }
    return result;
  }
}
