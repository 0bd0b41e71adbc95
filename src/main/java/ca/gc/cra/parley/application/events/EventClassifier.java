package ca.gc.cra.parley.application.events;

import ca.gc.cra.parley.application.events.json.JsonSupport;
import ca.gc.cra.parley.application.events.rules.CompiledRuleSet;
import ca.gc.cra.parley.application.events.rules.RuleMatchResult;
import ca.gc.cra.parley.domain.events.DomainEvent;
import ca.gc.cra.parley.domain.telemetry.RawRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Turns raw telemetry records into canonical {@link DomainEvent}s.
 * <p><strong>How:</strong> Free-text records run through the ordered rule table, which yields at
 * most one event per category. Structured messages bypass text matching and are mapped by their
 * {@code type} field.</p>
 * <p><strong>Errors:</strong> Never throws for bad input. Unparseable or shapeless structured
 * messages are reported through {@link ClassificationResult#malformed()}.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; the structured mapper remembers the last
 * reported voice state. One classifier per engine.</p>
 *
 * @since PARLEY 0.1.0
 */
public final class EventClassifier {
  private final CompiledRuleSet rules;
  private final JsonSupport json;
  private final StructuredMessageMapper structured = new StructuredMessageMapper();

  /**
   * Creates a classifier backed by a compiled rule table.
   *
   * @param rules rule table for free-text records
   */
  public EventClassifier(CompiledRuleSet rules) {
    this(rules, new JsonSupport());
  }

  EventClassifier(CompiledRuleSet rules, JsonSupport json) {
    this.rules = Objects.requireNonNull(rules, "rules");
    this.json = Objects.requireNonNull(json, "json");
  }

  /**
   * Classifies one record.
   *
   * @param record raw record
   * @return events in priority order; empty when nothing matched
   */
  public List<DomainEvent> classify(RawRecord record) {
    return classifyDetailed(record).events();
  }

  /**
   * Classifies one record and reports how it was classified.
   *
   * @param record raw record
   * @return events plus matched rule ids and the malformed flag
   */
  public ClassificationResult classifyDetailed(RawRecord record) {
    Objects.requireNonNull(record, "record");
    if (record.structured()) {
      Map<String, Object> message = record.payload();
      if (message == null) {
        Optional<Map<String, Object>> parsed = json.parseObject(record.text());
        if (parsed.isEmpty()) {
          return ClassificationResult.malformedRecord();
        }
        message = parsed.get();
      }
      return structured.map(message, record.receivedAt());
    }
    return classifyText(record);
  }

  private ClassificationResult classifyText(RawRecord record) {
    List<RuleMatchResult> matches = rules.evaluate(record.text(), record.level());
    if (matches.isEmpty()) {
      return ClassificationResult.empty();
    }
    List<DomainEvent> events = new ArrayList<>(matches.size());
    List<String> ruleIds = new ArrayList<>(matches.size());
    for (RuleMatchResult match : matches) {
      DomainEventFactory.fromMatch(match, record.receivedAt(), record.text()).ifPresent(event -> {
        events.add(event);
        ruleIds.add(match.ruleId());
      });
    }
    return new ClassificationResult(events, false, ruleIds);
  }

  /**
   * @return rule table backing free-text classification
   */
  public CompiledRuleSet rules() {
    return rules;
  }
}
