package ca.gc.cra.parley.application.events.rules;

import ca.gc.cra.parley.domain.events.EventKind;
import ca.gc.cra.parley.domain.telemetry.RecordLevel;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Compiled classification rule with pre-built matchers and extraction plan.
 *
 * @since PARLEY 0.1.0
 */
final class CompiledRule {
  private final String id;
  private final String category;
  private final EventKind kind;
  private final RecordLevel level;
  private final boolean ignoreCase;
  private final List<List<String>> containsGroups;
  private final List<String> excludes;
  private final RegexMatcher regex;
  private final Map<String, Pattern> extractors;
  private final Map<String, String> attributes;

  CompiledRule(
      String id,
      String category,
      EventKind kind,
      RecordLevel level,
      boolean ignoreCase,
      List<List<String>> containsGroups,
      List<String> excludes,
      RegexMatcher regex,
      Map<String, Pattern> extractors,
      Map<String, String> attributes) {
    this.id = Objects.requireNonNull(id, "id");
    this.category = Objects.requireNonNull(category, "category");
    this.kind = Objects.requireNonNull(kind, "kind");
    this.level = level;
    this.ignoreCase = ignoreCase;
    this.containsGroups = containsGroups;
    this.excludes = excludes;
    this.regex = regex;
    this.extractors = extractors;
    this.attributes = attributes;
  }

  String id() {
    return id;
  }

  String category() {
    return category;
  }

  Optional<RuleMatchResult> evaluate(String text, RecordLevel recordLevel) {
    if (level != null && level != recordLevel) {
      return Optional.empty();
    }
    String haystack = ignoreCase ? text.toLowerCase(Locale.ROOT) : text;
    for (List<String> group : containsGroups) {
      if (!anyContained(haystack, group)) {
        return Optional.empty();
      }
    }
    for (String exclude : excludes) {
      if (haystack.contains(exclude)) {
        return Optional.empty();
      }
    }

    Map<String, String> values = new LinkedHashMap<>(attributes);
    if (regex != null && !regex.matches(text, values)) {
      return Optional.empty();
    }
    for (Map.Entry<String, Pattern> entry : extractors.entrySet()) {
      Matcher matcher = entry.getValue().matcher(text);
      if (matcher.find()) {
        String value = matcher.group("value");
        if (value != null) {
          values.put(entry.getKey(), value.strip());
        }
      }
    }
    return Optional.of(new RuleMatchResult(id, category, kind, values));
  }

  private static boolean anyContained(String haystack, List<String> group) {
    for (String needle : group) {
      if (haystack.contains(needle)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Required regex whose named groups become attributes.
   */
  record RegexMatcher(Pattern pattern, List<String> groupNames) {
    boolean matches(String text, Map<String, String> sink) {
      Matcher matcher = pattern.matcher(text);
      if (!matcher.find()) {
        return false;
      }
      for (String name : groupNames) {
        String value = matcher.group(name);
        if (value != null) {
          sink.put(name, value);
        }
      }
      return true;
    }
  }
}
