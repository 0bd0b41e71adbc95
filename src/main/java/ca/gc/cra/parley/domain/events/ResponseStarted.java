package ca.gc.cra.parley.domain.events;

/**
 * Assistant response playback began.
 *
 * @param timestamp event time in epoch milliseconds
 * @since PARLEY 0.1.0
 */
public record ResponseStarted(long timestamp) implements DomainEvent {
  @Override
  public EventKind kind() {
    return EventKind.RESPONSE_STARTED;
  }

  @Override
  public ResponseStarted withTimestamp(long timestamp) {
    return new ResponseStarted(timestamp);
  }
}
