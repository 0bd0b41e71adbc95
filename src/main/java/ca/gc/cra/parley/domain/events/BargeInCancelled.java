package ca.gc.cra.parley.domain.events;

/**
 * A triggered interruption was cancelled or rolled back as a misfire.
 *
 * @param timestamp event time in epoch milliseconds
 * @since PARLEY 0.1.0
 */
public record BargeInCancelled(long timestamp) implements DomainEvent {
  @Override
  public EventKind kind() {
    return EventKind.BARGE_IN_CANCELLED;
  }

  @Override
  public BargeInCancelled withTimestamp(long timestamp) {
    return new BargeInCancelled(timestamp);
  }
}
