package ca.gc.cra.parley.domain.bargein;

import ca.gc.cra.parley.domain.events.BargeInClassification;
import java.util.OptionalLong;

/**
 * Interruption classification for a session so far.
 *
 * <p>{@code confirmed} and {@code attempted} are independent: a session can show an attempt that was
 * never confirmed, and a confirmed interruption with no observed heuristic signal. Callers decide
 * which of the two their gate requires.</p>
 *
 * @param confirmed an explicit {@code reason=barge_in} transition was observed
 * @param attempted heuristic evidence (speech during a response, or a probe that would trigger)
 * @param latencyMs most recently measured gap from qualifying speech to the nearest following
 *     stop/transition; an episode without qualifying speech does not reset it; {@code null} until one
 *     is measured
 * @param confirmedCount number of explicit {@code barge_in} transitions
 * @param attemptCount number of attempt episodes
 * @param classification most recent client verdict; {@code null} when none was reported
 * @since PARLEY 0.1.0
 */
public record BargeInOutcome(
    boolean confirmed,
    boolean attempted,
    Long latencyMs,
    int confirmedCount,
    int attemptCount,
    BargeInClassification classification) {

  /** Outcome before any interruption evidence arrived. */
  public static final BargeInOutcome NONE = new BargeInOutcome(false, false, null, 0, 0, null);

  /**
   * @return latency as an optional
   */
  public OptionalLong latency() {
    return latencyMs == null ? OptionalLong.empty() : OptionalLong.of(latencyMs);
  }
}
