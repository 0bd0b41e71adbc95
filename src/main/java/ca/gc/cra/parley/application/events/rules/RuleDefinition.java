package ca.gc.cra.parley.application.events.rules;

import ca.gc.cra.parley.domain.events.EventKind;
import ca.gc.cra.parley.domain.telemetry.RecordLevel;
import java.util.List;
import java.util.Map;

/**
 * Raw classification rule parsed from YAML prior to compilation.
 *
 * @since PARLEY 0.1.0
 */
record RuleDefinition(
    String id,
    String description,
    String category,
    EventKind event,
    RecordLevel level,
    MatchDefinition match,
    Map<String, String> extract,
    Map<String, String> attributes,
    String origin) {}

/**
 * Text conditions of a rule. Every {@code contains} group needs at least one hit; no
 * {@code excludes} entry may appear.
 */
record MatchDefinition(
    List<List<String>> contains,
    List<String> excludes,
    String regex,
    boolean ignoreCase) {

  static MatchDefinition empty() {
    return new MatchDefinition(List.of(), List.of(), null, false);
  }
}
