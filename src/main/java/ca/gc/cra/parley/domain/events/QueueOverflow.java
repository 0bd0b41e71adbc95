package ca.gc.cra.parley.domain.events;

/**
 * Audio playback queue overflowed or was trimmed.
 *
 * @param timestamp event time in epoch milliseconds
 * @since PARLEY 0.1.0
 */
public record QueueOverflow(long timestamp) implements DomainEvent {
  @Override
  public EventKind kind() {
    return EventKind.QUEUE_OVERFLOW;
  }

  @Override
  public QueueOverflow withTimestamp(long timestamp) {
    return new QueueOverflow(timestamp);
  }
}
