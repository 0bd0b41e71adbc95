package ca.gc.cra.parley.domain.conversation;

/**
 * Names the event a turn is still waiting for when a caller's deadline elapses.
 *
 * @since PARLEY 0.1.0
 */
public enum StuckDiagnosis {
  SPEECH_STARTED_NOT_OBSERVED("speechStarted", "Waiting for speech detection"),
  TRANSCRIPT_COMPLETE_NOT_OBSERVED("transcriptComplete", "Waiting for transcript.complete"),
  RESPONSE_STARTED_NOT_OBSERVED("responseStarted", "Waiting for the assistant response to start"),
  RESPONSE_COMPLETE_NOT_OBSERVED("responseComplete", "Waiting for the assistant to finish speaking");

  private final String missingField;
  private final String description;

  StuckDiagnosis(String missingField, String description) {
    this.missingField = missingField;
    this.description = description;
  }

  /**
   * Maps the phase an open turn reached to the field it is missing.
   *
   * @param phase phase of the open turn
   * @return diagnosis for that phase
   * @throws IllegalArgumentException for {@link TurnPhase#RESPONSE_COMPLETE}, which is never open
   */
  public static StuckDiagnosis forPhase(TurnPhase phase) {
    return switch (phase) {
      case WAITING_FOR_SPEECH -> SPEECH_STARTED_NOT_OBSERVED;
      case SPEECH_DETECTED -> TRANSCRIPT_COMPLETE_NOT_OBSERVED;
      case TRANSCRIPT_RECEIVED -> RESPONSE_STARTED_NOT_OBSERVED;
      case RESPONSE_STARTED -> RESPONSE_COMPLETE_NOT_OBSERVED;
      case RESPONSE_COMPLETE -> throw new IllegalArgumentException("sealed turns are never stuck");
    };
  }

  /**
   * @return name of the turn field that was never set, e.g. {@code transcriptComplete}
   */
  public String missingField() {
    return missingField;
  }

  /**
   * @return operator-facing sentence, e.g. {@code STUCK AT: Waiting for transcript.complete}
   */
  public String describe() {
    return "STUCK AT: " + description + " (" + missingField + " not observed)";
  }
}
