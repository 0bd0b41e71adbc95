package ca.gc.cra.parley.domain.events;

/**
 * Error reported by the system under test.
 *
 * @param timestamp event time in epoch milliseconds
 * @param message error text; never {@code null}
 * @since PARLEY 0.1.0
 */
public record ErrorEvent(long timestamp, String message) implements DomainEvent {
  /**
   * Replaces a missing message with an empty string.
   */
  public ErrorEvent {
    message = message == null ? "" : message;
  }

  @Override
  public EventKind kind() {
    return EventKind.ERROR;
  }

  @Override
  public ErrorEvent withTimestamp(long timestamp) {
    return new ErrorEvent(timestamp, message);
  }
}
