package ca.gc.cra.parley.domain.events;

import java.util.Locale;

/**
 * Discriminator for {@link DomainEvent} variants, also used as the {@code event} value in rule files.
 *
 * @since PARLEY 0.1.0
 */
public enum EventKind {
  SPEECH_STARTED,
  TRANSCRIPT_COMPLETE,
  RESPONSE_STARTED,
  RESPONSE_COMPLETE,
  STATE_TRANSITION,
  BARGE_IN_PROBE,
  BARGE_IN_CANCELLED,
  ERROR,
  QUEUE_OVERFLOW,
  SCHEDULE_RESET;

  /**
   * Resolves a kind from its rule-file spelling ({@code speech_started}, {@code SpeechStarted} or
   * {@code SPEECH_STARTED}).
   *
   * @param raw kind token
   * @return matching kind
   * @throws IllegalArgumentException when the token names no kind
   */
  public static EventKind parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("event kind must not be blank");
    }
    String normalized = raw.trim()
        .replaceAll("([a-z])([A-Z])", "$1_$2")
        .replace('-', '_')
        .replace('.', '_')
        .toUpperCase(Locale.ROOT);
    for (EventKind kind : values()) {
      if (kind.name().equals(normalized)) {
        return kind;
      }
    }
    throw new IllegalArgumentException("Unknown event kind: " + raw);
  }
}
