package ca.gc.cra.parley.application.events;

import ca.gc.cra.parley.domain.events.DomainEvent;
import java.util.List;

/**
 * Events produced for one record plus the bookkeeping needed for counters and diagnostics.
 *
 * @param events classified events in priority order; possibly empty
 * @param malformed {@code true} when a structured message could not be interpreted
 * @param ruleIds ids of the matched rules, or the structured message type
 * @since PARLEY 0.1.0
 */
public record ClassificationResult(List<DomainEvent> events, boolean malformed, List<String> ruleIds) {
  private static final ClassificationResult EMPTY = new ClassificationResult(List.of(), false, List.of());
  private static final ClassificationResult MALFORMED = new ClassificationResult(List.of(), true, List.of());

  /**
   * Freezes the lists.
   */
  public ClassificationResult {
    events = List.copyOf(events);
    ruleIds = List.copyOf(ruleIds);
  }

  /**
   * @return result with no events
   */
  public static ClassificationResult empty() {
    return EMPTY;
  }

  /**
   * @return result for a record that could not be interpreted
   */
  public static ClassificationResult malformedRecord() {
    return MALFORMED;
  }
}
