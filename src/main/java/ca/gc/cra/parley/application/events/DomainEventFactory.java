package ca.gc.cra.parley.application.events;

import ca.gc.cra.parley.application.events.rules.RuleMatchResult;
import ca.gc.cra.parley.domain.events.BargeInCancelled;
import ca.gc.cra.parley.domain.events.BargeInClassification;
import ca.gc.cra.parley.domain.events.BargeInProbe;
import ca.gc.cra.parley.domain.events.DomainEvent;
import ca.gc.cra.parley.domain.events.ErrorEvent;
import ca.gc.cra.parley.domain.events.QueueOverflow;
import ca.gc.cra.parley.domain.events.ResponseComplete;
import ca.gc.cra.parley.domain.events.ResponseStarted;
import ca.gc.cra.parley.domain.events.ScheduleReset;
import ca.gc.cra.parley.domain.events.SpeechStarted;
import ca.gc.cra.parley.domain.events.StateTransition;
import ca.gc.cra.parley.domain.events.TranscriptComplete;
import ca.gc.cra.parley.validation.Numbers;
import ca.gc.cra.parley.validation.Strings;
import java.util.Optional;

/**
 * Builds {@link DomainEvent}s from rule matches. Attribute names follow the event's fields:
 * {@code text}, {@code from}, {@code to}, {@code reason}, {@code isActiveRef},
 * {@code activeSourceCount}, {@code willTrigger}, {@code classification} and {@code message}.
 *
 * @since PARLEY 0.1.0
 */
final class DomainEventFactory {
  private DomainEventFactory() {
    // Utility
  }

  /**
   * @param match rule match
   * @param timestamp event time in epoch milliseconds
   * @param recordText original line, used as the error message when none was extracted
   * @return event, or empty when the match lacks a required attribute such as a target state
   */
  static Optional<DomainEvent> fromMatch(RuleMatchResult match, long timestamp, String recordText) {
    return Optional.ofNullable(switch (match.kind()) {
      case SPEECH_STARTED -> new SpeechStarted(timestamp);
      case TRANSCRIPT_COMPLETE -> new TranscriptComplete(timestamp, Strings.nullToEmpty(match.attribute("text")));
      case RESPONSE_STARTED -> new ResponseStarted(timestamp);
      case RESPONSE_COMPLETE -> new ResponseComplete(timestamp);
      case STATE_TRANSITION -> transition(match, timestamp);
      case BARGE_IN_PROBE -> new BargeInProbe(
          timestamp,
          Strings.parseBoolean(match.attribute("isActiveRef")),
          Numbers.parseNonNegativeInt(match.attribute("activeSourceCount"), 0),
          Boolean.TRUE.equals(Strings.parseBoolean(match.attribute("willTrigger"))),
          classification(match.attribute("classification")));
      case BARGE_IN_CANCELLED -> new BargeInCancelled(timestamp);
      case ERROR -> new ErrorEvent(timestamp,
          match.attribute("message") != null ? match.attribute("message") : recordText);
      case QUEUE_OVERFLOW -> new QueueOverflow(timestamp);
      case SCHEDULE_RESET -> new ScheduleReset(timestamp);
    });
  }

  private static BargeInClassification classification(String raw) {
    return raw == null ? null : BargeInClassification.parse(raw);
  }

  private static StateTransition transition(RuleMatchResult match, long timestamp) {
    String to = match.attribute("to");
    if (Strings.isBlank(to)) {
      return null;
    }
    return new StateTransition(timestamp, match.attribute("from"), to, match.attribute("reason"));
  }
}
