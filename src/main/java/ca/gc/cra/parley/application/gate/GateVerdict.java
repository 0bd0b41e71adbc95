package ca.gc.cra.parley.application.gate;

import java.util.List;

/**
 * Outcome of a quality gate check. Never thrown; callers decide whether a failure is fatal.
 *
 * @param pass {@code true} when no bound was breached
 * @param failures one message per breached bound
 * @param notes bounds that could not be checked, such as averages without samples
 * @param checked number of bounds actually compared
 * @since PARLEY 0.1.0
 */
public record GateVerdict(boolean pass, List<String> failures, List<String> notes, int checked) {
  /**
   * Freezes the message lists.
   */
  public GateVerdict {
    failures = List.copyOf(failures);
    notes = List.copyOf(notes);
  }
}
