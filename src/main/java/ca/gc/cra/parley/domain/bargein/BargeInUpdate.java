package ca.gc.cra.parley.domain.bargein;

/**
 * What a single event changed in the {@link BargeInDetector}, for counter bookkeeping.
 *
 * @param attemptOpened a new attempt episode started
 * @param confirmedNow the event was an explicit {@code barge_in} transition
 * @param latencyMs latency resolved by this event; {@code null} when none was resolved
 * @since PARLEY 0.1.0
 */
public record BargeInUpdate(boolean attemptOpened, boolean confirmedNow, Long latencyMs) {
  /** No change. */
  public static final BargeInUpdate NONE = new BargeInUpdate(false, false, null);
}
