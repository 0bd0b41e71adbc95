package ca.gc.cra.parley.application.pipeline;

import ca.gc.cra.parley.domain.conversation.StuckDiagnosis;
import ca.gc.cra.parley.domain.conversation.Turn;
import java.util.List;

/**
 * Partial session state captured when a turn wait ends.
 *
 * @param outcome how the wait ended
 * @param completedTurns turns completed at that moment
 * @param currentTurn open turn at that moment
 * @param diagnosis missing field of the open turn; {@code null} when the wait was satisfied
 * @since PARLEY 0.1.0
 */
public record TurnWaitResult(
    WaitOutcome outcome,
    List<Turn> completedTurns,
    Turn currentTurn,
    StuckDiagnosis diagnosis) {

  /**
   * Freezes the turn list.
   */
  public TurnWaitResult {
    completedTurns = List.copyOf(completedTurns);
  }

  /**
   * @return {@code true} when the awaited condition held
   */
  public boolean satisfied() {
    return outcome.satisfied();
  }
}
