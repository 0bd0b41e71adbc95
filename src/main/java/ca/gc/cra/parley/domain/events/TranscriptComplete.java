package ca.gc.cra.parley.domain.events;

/**
 * Final user transcript for the current utterance.
 *
 * @param timestamp event time in epoch milliseconds
 * @param text recognised text; {@code null} when the line carried no extractable text
 * @since PARLEY 0.1.0
 */
public record TranscriptComplete(long timestamp, String text) implements DomainEvent {
  @Override
  public EventKind kind() {
    return EventKind.TRANSCRIPT_COMPLETE;
  }

  @Override
  public TranscriptComplete withTimestamp(long timestamp) {
    return new TranscriptComplete(timestamp, text);
  }
}
