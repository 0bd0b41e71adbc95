package ca.gc.cra.parley.application.events.rules;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Compiles parsed rule definitions into executable rules.
 *
 * @since PARLEY 0.1.0
 */
final class RuleSetCompiler {
  private static final String VALUE_GROUP = "value";

  CompiledRuleSet compile(List<RuleDefinition> definitions) {
    Objects.requireNonNull(definitions, "definitions");
    List<CompiledRule> compiled = new ArrayList<>(definitions.size());
    for (RuleDefinition definition : definitions) {
      compiled.add(compileRule(definition));
    }
    return new CompiledRuleSet(List.copyOf(compiled));
  }

  private CompiledRule compileRule(RuleDefinition definition) {
    MatchDefinition match = definition.match();
    boolean ignoreCase = match.ignoreCase();

    List<List<String>> groups = new ArrayList<>(match.contains().size());
    for (List<String> group : match.contains()) {
      groups.add(normalizeAll(group, ignoreCase));
    }
    List<String> excludes = normalizeAll(match.excludes(), ignoreCase);

    CompiledRule.RegexMatcher regex = null;
    if (match.regex() != null) {
      regex = compileRegex(definition.id(), match.regex(), ignoreCase);
    }

    Map<String, Pattern> extractors = new LinkedHashMap<>();
    for (Map.Entry<String, String> entry : definition.extract().entrySet()) {
      Pattern pattern = compile(definition.id(), convertGroups(entry.getValue()), ignoreCase);
      if (!groupNames(pattern.pattern()).contains(VALUE_GROUP)) {
        throw new IllegalArgumentException(
            "Rule " + definition.id() + ": extract." + entry.getKey() + " needs a (?<value>...) group");
      }
      extractors.put(entry.getKey(), pattern);
    }

    return new CompiledRule(
        definition.id(),
        definition.category(),
        definition.event(),
        definition.level(),
        ignoreCase,
        List.copyOf(groups),
        excludes,
        regex,
        Map.copyOf(extractors),
        Map.copyOf(definition.attributes()));
  }

  private List<String> normalizeAll(List<String> values, boolean ignoreCase) {
    List<String> out = new ArrayList<>(values.size());
    for (String value : values) {
      out.add(ignoreCase ? value.toLowerCase(Locale.ROOT) : value);
    }
    return List.copyOf(out);
  }

  private CompiledRule.RegexMatcher compileRegex(String ruleId, String expression, boolean ignoreCase) {
    String javaRegex = convertGroups(expression);
    Pattern pattern = compile(ruleId, javaRegex, ignoreCase);
    return new CompiledRule.RegexMatcher(pattern, groupNames(javaRegex));
  }

  private Pattern compile(String ruleId, String regex, boolean ignoreCase) {
    try {
      return ignoreCase
          ? Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE)
          : Pattern.compile(regex);
    } catch (PatternSyntaxException ex) {
      throw new IllegalArgumentException("Rule " + ruleId + ": invalid regex " + regex, ex);
    }
  }

  private String convertGroups(String expression) {
    StringBuilder converted = new StringBuilder();
    Matcher pythonStyle = PYTHON_GROUP.matcher(expression);
    int index = 0;
    while (pythonStyle.find()) {
      converted.append(expression, index, pythonStyle.start());
      converted.append("(?<").append(pythonStyle.group(1)).append(">");
      index = pythonStyle.end();
    }
    converted.append(expression.substring(index));
    return converted.toString();
  }

  private List<String> groupNames(String javaRegex) {
    List<String> names = new ArrayList<>();
    Matcher javaStyle = JAVA_GROUP.matcher(javaRegex);
    while (javaStyle.find()) {
      names.add(javaStyle.group(1));
    }
    return List.copyOf(names);
  }

  private static final Pattern PYTHON_GROUP = Pattern.compile("\\(\\?P<([A-Za-z][A-Za-z0-9_]*)>");
  private static final Pattern JAVA_GROUP = Pattern.compile("\\(\\?<([A-Za-z][A-Za-z0-9_]*)>");
}
