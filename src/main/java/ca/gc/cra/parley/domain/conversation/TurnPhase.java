package ca.gc.cra.parley.domain.conversation;

/**
 * Progress of a single conversation turn. Declaration order is the order a turn moves through.
 *
 * @since PARLEY 0.1.0
 */
public enum TurnPhase {
  WAITING_FOR_SPEECH,
  SPEECH_DETECTED,
  TRANSCRIPT_RECEIVED,
  RESPONSE_STARTED,
  RESPONSE_COMPLETE;

  /**
   * @param other phase to compare against
   * @return {@code true} when this phase is {@code other} or later
   */
  public boolean atLeast(TurnPhase other) {
    return compareTo(other) >= 0;
  }
}
