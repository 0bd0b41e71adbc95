package ca.gc.cra.parley.application.events.rules;

import ca.gc.cra.parley.domain.events.EventKind;
import java.util.Map;
import java.util.Objects;

/**
 * Result produced when a rule matches a telemetry record.
 *
 * @since PARLEY 0.1.0
 */
public record RuleMatchResult(
    String ruleId,
    String category,
    EventKind kind,
    Map<String, String> attributes) {

  /**
   * Validates required fields and protects internal state from external mutation.
   *
   * @param ruleId identifier of the rule that produced the match
   * @param category rule category; at most one match per category per record
   * @param kind event kind to emit
   * @param attributes attributes to copy; static values first, then extracted groups
   */
  public RuleMatchResult {
    ruleId = Objects.requireNonNull(ruleId, "ruleId");
    category = Objects.requireNonNull(category, "category");
    kind = Objects.requireNonNull(kind, "kind");
    attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
  }

  /**
   * @param name attribute name
   * @return attribute value or {@code null}
   */
  public String attribute(String name) {
    return attributes.get(name);
  }
}
