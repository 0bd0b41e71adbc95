package ca.gc.cra.parley.domain.events;

/**
 * Audio scheduling was reset after drifting from expected timing.
 *
 * @param timestamp event time in epoch milliseconds
 * @since PARLEY 0.1.0
 */
public record ScheduleReset(long timestamp) implements DomainEvent {
  @Override
  public EventKind kind() {
    return EventKind.SCHEDULE_RESET;
  }

  @Override
  public ScheduleReset withTimestamp(long timestamp) {
    return new ScheduleReset(timestamp);
  }
}
