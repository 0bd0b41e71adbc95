package ca.gc.cra.parley.domain.events;

/**
 * Assistant response playback ended and the pipeline returned to listening.
 *
 * @param timestamp event time in epoch milliseconds
 * @since PARLEY 0.1.0
 */
public record ResponseComplete(long timestamp) implements DomainEvent {
  @Override
  public EventKind kind() {
    return EventKind.RESPONSE_COMPLETE;
  }

  @Override
  public ResponseComplete withTimestamp(long timestamp) {
    return new ResponseComplete(timestamp);
  }
}
