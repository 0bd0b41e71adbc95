package ca.gc.cra.parley.domain.events;

/**
 * User speech detected by a voice activity detector.
 *
 * @param timestamp event time in epoch milliseconds
 * @since PARLEY 0.1.0
 */
public record SpeechStarted(long timestamp) implements DomainEvent {
  @Override
  public EventKind kind() {
    return EventKind.SPEECH_STARTED;
  }

  @Override
  public SpeechStarted withTimestamp(long timestamp) {
    return new SpeechStarted(timestamp);
  }
}
