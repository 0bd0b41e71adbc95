package ca.gc.cra.parley.domain.conversation;

import ca.gc.cra.parley.domain.events.StateTransition;
import java.util.List;
import java.util.OptionalLong;

/**
 * Immutable snapshot of one user-utterance-to-assistant-response cycle.
 *
 * @param index 1-based turn number
 * @param speechStartedAt time speech was first detected; {@code null} when not observed
 * @param transcriptCompleteAt time of the accepted final transcript; {@code null} when not observed
 * @param transcriptText accepted transcript text; may be {@code null}
 * @param responseStartedAt time the response started; {@code null} when not observed
 * @param responseCompleteAt time the response completed; {@code null} while the turn is open
 * @param transitions state transitions observed while this turn was open, in arrival order
 * @since PARLEY 0.1.0
 */
public record Turn(
    int index,
    Long speechStartedAt,
    Long transcriptCompleteAt,
    String transcriptText,
    Long responseStartedAt,
    Long responseCompleteAt,
    List<StateTransition> transitions) {

  /**
   * Validates the index and freezes the transition list.
   */
  public Turn {
    if (index < 1) {
      throw new IllegalArgumentException("index must be >= 1 (was " + index + ')');
    }
    transitions = transitions == null ? List.of() : List.copyOf(transitions);
  }

  /**
   * @return furthest phase this turn reached
   */
  public TurnPhase phase() {
    if (responseCompleteAt != null) {
      return TurnPhase.RESPONSE_COMPLETE;
    }
    if (responseStartedAt != null) {
      return TurnPhase.RESPONSE_STARTED;
    }
    if (transcriptCompleteAt != null) {
      return TurnPhase.TRANSCRIPT_RECEIVED;
    }
    if (speechStartedAt != null) {
      return TurnPhase.SPEECH_DETECTED;
    }
    return TurnPhase.WAITING_FOR_SPEECH;
  }

  /**
   * @return {@code true} once the turn moved to the completed list
   */
  public boolean sealed() {
    return responseCompleteAt != null;
  }

  /**
   * Speech start to response completion.
   *
   * @return latency in milliseconds, empty when either end is missing
   */
  public OptionalLong turnLatencyMs() {
    return between(speechStartedAt, responseCompleteAt);
  }

  /**
   * Final transcript to response start.
   *
   * @return latency in milliseconds, empty when either end is missing
   */
  public OptionalLong responseLatencyMs() {
    return between(transcriptCompleteAt, responseStartedAt);
  }

  private static OptionalLong between(Long start, Long end) {
    if (start == null || end == null) {
      return OptionalLong.empty();
    }
    return OptionalLong.of(end - start);
  }
}
