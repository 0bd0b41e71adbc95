package ca.gc.cra.parley.application.events.rules;

import ca.gc.cra.parley.domain.telemetry.RecordLevel;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Executable rule table. Categories are evaluated in order of first appearance; within a category
 * the first matching rule wins, so a record yields at most one match per category.
 *
 * @since PARLEY 0.1.0
 */
public final class CompiledRuleSet {
  private final Map<String, List<CompiledRule>> byCategory;
  private final int size;

  CompiledRuleSet(List<CompiledRule> rules) {
    Objects.requireNonNull(rules, "rules");
    Map<String, List<CompiledRule>> grouped = new LinkedHashMap<>();
    for (CompiledRule rule : rules) {
      grouped.computeIfAbsent(rule.category(), k -> new ArrayList<>()).add(rule);
    }
    grouped.replaceAll((k, v) -> List.copyOf(v));
    this.byCategory = grouped;
    this.size = rules.size();
  }

  /**
   * Indicates whether the rule set contains zero active rules.
   *
   * @return {@code true} for an empty rule set
   */
  public boolean isEmpty() {
    return size == 0;
  }

  /**
   * Reports the number of compiled rules contained within this set.
   *
   * @return number of individual rules
   */
  public int size() {
    return size;
  }

  /**
   * @return categories in evaluation order
   */
  public Set<String> categories() {
    return new LinkedHashSet<>(byCategory.keySet());
  }

  /**
   * @param category category name
   * @return rule ids of the category in priority order
   */
  public List<String> ruleIds(String category) {
    List<CompiledRule> rules = byCategory.getOrDefault(category, List.of());
    List<String> ids = new ArrayList<>(rules.size());
    for (CompiledRule rule : rules) {
      ids.add(rule.id());
    }
    return ids;
  }

  /**
   * Evaluates the table against one free-text record.
   *
   * @param text record text; {@code null} yields no matches
   * @param level record level
   * @return first match per category, in category order
   */
  public List<RuleMatchResult> evaluate(String text, RecordLevel level) {
    if (text == null || text.isEmpty()) {
      return List.of();
    }
    List<RuleMatchResult> matches = new ArrayList<>();
    for (List<CompiledRule> rules : byCategory.values()) {
      for (CompiledRule rule : rules) {
        Optional<RuleMatchResult> match = rule.evaluate(text, level);
        if (match.isPresent()) {
          matches.add(match.get());
          break;
        }
      }
    }
    return matches;
  }
}
