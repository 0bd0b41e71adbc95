package ca.gc.cra.parley.domain.conversation;

import ca.gc.cra.parley.domain.events.DomainEvent;
import ca.gc.cra.parley.domain.events.ResponseComplete;
import ca.gc.cra.parley.domain.events.ResponseStarted;
import ca.gc.cra.parley.domain.events.SpeechStarted;
import ca.gc.cra.parley.domain.events.StateTransition;
import ca.gc.cra.parley.domain.events.TranscriptComplete;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * <strong>What:</strong> Reconstructs discrete conversation turns from classified events.
 * <p><strong>Why:</strong> A turn only counts once the user's transcript was received before the
 * assistant finished speaking, so setup handshakes such as {@code idle -> listening} or an initial
 * greeting can never be reported as completed turns.</p>
 * <p><strong>Role:</strong> Owns the session state (completed turns, open turn, start time) for one
 * test execution.</p>
 * <p><strong>Transitions:</strong>
 * <ul>
 *   <li>{@code SpeechStarted}: WAITING_FOR_SPEECH to SPEECH_DETECTED; repeats are no-ops. Speech
 *   heard while a response is playing is held for the next turn.</li>
 *   <li>{@code TranscriptComplete}: requires SPEECH_DETECTED or later; the latest transcript before
 *   the response starts wins.</li>
 *   <li>{@code ResponseStarted}/{@code ResponseComplete}: ignored until the transcript arrived, and
 *   ignored when stamped earlier than the transcript.</li>
 *   <li>Accepted {@code ResponseComplete}: seals the turn and opens index + 1.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe. Each instance must be owned by the single
 * thread feeding the engine.</p>
 *
 * @since PARLEY 0.1.0
 */
public final class TurnStateMachine {
  private final long startedAt;
  private final List<Turn> completed = new ArrayList<>();
  private OpenTurn current;
  private Long carriedSpeechAt;

  /**
   * Creates a session whose first turn has index 1.
   *
   * @param startedAt session start in epoch milliseconds
   */
  public TurnStateMachine(long startedAt) {
    this.startedAt = startedAt;
    this.current = new OpenTurn(1);
  }

  /**
   * Applies one classified event.
   *
   * @param event event to apply; events that do not drive turns return {@link TurnUpdate#UNCHANGED}
   * @return effect of the event on the session
   */
  public TurnUpdate apply(DomainEvent event) {
    if (event instanceof SpeechStarted speech) {
      return onSpeechStarted(speech.timestamp());
    }
    if (event instanceof TranscriptComplete transcript) {
      return onTranscriptComplete(transcript);
    }
    if (event instanceof ResponseStarted started) {
      return onResponseStarted(started.timestamp());
    }
    if (event instanceof ResponseComplete complete) {
      return onResponseComplete(complete.timestamp());
    }
    if (event instanceof StateTransition transition) {
      current.transitions.add(transition);
      return TurnUpdate.ADVANCED;
    }
    return TurnUpdate.UNCHANGED;
  }

  private TurnUpdate onSpeechStarted(long at) {
    TurnPhase phase = current.phase();
    if (phase == TurnPhase.WAITING_FOR_SPEECH) {
      current.speechStartedAt = at;
      return TurnUpdate.ADVANCED;
    }
    if (phase == TurnPhase.RESPONSE_STARTED && carriedSpeechAt == null) {
      carriedSpeechAt = at;
      return TurnUpdate.ADVANCED;
    }
    return TurnUpdate.UNCHANGED;
  }

  private TurnUpdate onTranscriptComplete(TranscriptComplete transcript) {
    TurnPhase phase = current.phase();
    if (!phase.atLeast(TurnPhase.SPEECH_DETECTED)) {
      return TurnUpdate.IGNORED;
    }
    if (phase.atLeast(TurnPhase.RESPONSE_STARTED)) {
      return TurnUpdate.UNCHANGED;
    }
    current.transcriptCompleteAt = transcript.timestamp();
    current.transcriptText = transcript.text();
    return TurnUpdate.ADVANCED;
  }

  private TurnUpdate onResponseStarted(long at) {
    TurnPhase phase = current.phase();
    if (!phase.atLeast(TurnPhase.TRANSCRIPT_RECEIVED)) {
      return TurnUpdate.IGNORED;
    }
    if (phase != TurnPhase.TRANSCRIPT_RECEIVED) {
      return TurnUpdate.UNCHANGED;
    }
    if (precedesTranscript(at)) {
      return TurnUpdate.IGNORED;
    }
    current.responseStartedAt = at;
    return TurnUpdate.ADVANCED;
  }

  private TurnUpdate onResponseComplete(long at) {
    if (!current.phase().atLeast(TurnPhase.TRANSCRIPT_RECEIVED) || precedesTranscript(at)) {
      return TurnUpdate.IGNORED;
    }
    if (current.responseStartedAt == null) {
      current.responseStartedAt = at;
    }
    current.responseCompleteAt = at;
    completed.add(current.snapshot());
    current = new OpenTurn(current.index + 1);
    if (carriedSpeechAt != null) {
      current.speechStartedAt = carriedSpeechAt;
      carriedSpeechAt = null;
    }
    return TurnUpdate.SEALED;
  }

  // Sources are clamped independently, so a socket message can carry an earlier time than a log line.
  private boolean precedesTranscript(long at) {
    return current.transcriptCompleteAt != null && at < current.transcriptCompleteAt;
  }

  /**
   * @return completed turns in order; unmodifiable
   */
  public List<Turn> completedTurns() {
    return Collections.unmodifiableList(completed);
  }

  /**
   * @return number of sealed turns
   */
  public int completedCount() {
    return completed.size();
  }

  /**
   * @return snapshot of the open turn
   */
  public Turn currentTurn() {
    return current.snapshot();
  }

  /**
   * Names the field the open turn is still missing. Never blocks and never throws; whether this is
   * a failure is up to the caller.
   *
   * @return diagnosis for the open turn
   */
  public StuckDiagnosis diagnose() {
    return StuckDiagnosis.forPhase(current.phase());
  }

  /**
   * @return session start in epoch milliseconds
   */
  public long startedAt() {
    return startedAt;
  }

  private static final class OpenTurn {
    private final int index;
    private final List<StateTransition> transitions = new ArrayList<>();
    private Long speechStartedAt;
    private Long transcriptCompleteAt;
    private String transcriptText;
    private Long responseStartedAt;
    private Long responseCompleteAt;

    private OpenTurn(int index) {
      this.index = index;
    }

    private TurnPhase phase() {
      return snapshot().phase();
    }

    private Turn snapshot() {
      return new Turn(index, speechStartedAt, transcriptCompleteAt, transcriptText,
          responseStartedAt, responseCompleteAt, transitions);
    }
  }
}
