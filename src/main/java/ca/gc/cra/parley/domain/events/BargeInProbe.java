package ca.gc.cra.parley.domain.events;

/**
 * Client-side playback check made when speech was heard, reporting whether an interruption would
 * fire and, when the client classified the speech, how. Lower confidence than an explicit
 * {@code barge_in} transition.
 *
 * @param timestamp event time in epoch milliseconds
 * @param isActiveRef playback reference flag at check time; {@code null} when not reported
 * @param activeSourceCount number of audio sources still playing
 * @param willTrigger whether the client decided to interrupt
 * @param classification client verdict on the speech; {@code null} when not reported
 * @since PARLEY 0.1.0
 */
public record BargeInProbe(
    long timestamp,
    Boolean isActiveRef,
    int activeSourceCount,
    boolean willTrigger,
    BargeInClassification classification) implements DomainEvent {

  /**
   * Rejects negative source counts.
   */
  public BargeInProbe {
    if (activeSourceCount < 0) {
      throw new IllegalArgumentException("activeSourceCount must be >= 0 (was " + activeSourceCount + ')');
    }
  }

  /**
   * Creates an unclassified probe.
   *
   * @param timestamp event time in epoch milliseconds
   * @param isActiveRef playback reference flag; may be {@code null}
   * @param activeSourceCount number of audio sources still playing
   * @param willTrigger whether the client decided to interrupt
   */
  public BargeInProbe(long timestamp, Boolean isActiveRef, int activeSourceCount, boolean willTrigger) {
    this(timestamp, isActiveRef, activeSourceCount, willTrigger, null);
  }

  @Override
  public EventKind kind() {
    return EventKind.BARGE_IN_PROBE;
  }

  @Override
  public BargeInProbe withTimestamp(long timestamp) {
    return new BargeInProbe(timestamp, isActiveRef, activeSourceCount, willTrigger, classification);
  }
}
