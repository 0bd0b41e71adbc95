package ca.gc.cra.parley.application.events;

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
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * <strong>What:</strong> Maps structured messages ({@code type}, {@code timestamp},
 * {@code direction}, {@code payload}) to domain events by their {@code type} field.
 * <p><strong>Why:</strong> Structured messages bypass text matching entirely, so a message type is
 * never re-interpreted through keywords in its payload.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe. Remembers the last reported voice state so a
 * state message without an explicit {@code from} still yields a transition.</p>
 *
 * @since PARLEY 0.1.0
 */
final class StructuredMessageMapper {
  private static final Set<String> SPEECH_TYPES = Set.of(
      "input_audio_buffer.speech_started", "speech_started", "speech_start", "speech.started");
  private static final Set<String> STATE_TYPES = Set.of("voice.state", "state.transition");
  private static final String SPEAKING = "speaking";
  private static final String LISTENING = "listening";

  private String lastState;

  /**
   * @param message structured message
   * @param receivedAt receipt time, used when the message carries no usable timestamp
   * @return events for the message; malformed when {@code type} is missing or {@code payload} is not
   *     an object
   */
  ClassificationResult map(Map<String, Object> message, long receivedAt) {
    Object typeNode = message.get("type");
    if (!(typeNode instanceof String rawType) || rawType.isBlank()) {
      return ClassificationResult.malformedRecord();
    }
    Object payloadNode = message.get("payload");
    if (payloadNode != null && !(payloadNode instanceof Map<?, ?>)) {
      return ClassificationResult.malformedRecord();
    }
    Map<?, ?> payload = payloadNode == null ? Map.of() : (Map<?, ?>) payloadNode;
    String type = rawType.trim().toLowerCase(Locale.ROOT);
    long at = timestampOf(message.get("timestamp"), receivedAt);

    List<DomainEvent> events = new ArrayList<>(2);
    if (SPEECH_TYPES.contains(type)) {
      events.add(new SpeechStarted(at));
    } else if (STATE_TYPES.contains(type)) {
      mapState(payload, at, events);
    } else {
      switch (type) {
        case "transcript.complete" -> events.add(new TranscriptComplete(at,
            Strings.nullToEmpty(text(payload, "text", "transcript"))));
        case "barge_in.check" -> events.add(new BargeInProbe(at,
            Strings.parseBoolean(text(payload, "isActiveRef", "isPlayingRef")),
            Numbers.parseNonNegativeInt(text(payload, "activeSourceCount", "activeSourcesCount"), 0),
            Boolean.TRUE.equals(Strings.parseBoolean(text(payload, "willTrigger"))),
            classification(text(payload, "classification"))));
        case "barge_in" -> events.add(new BargeInProbe(at, null, 0, true));
        case "barge_in.classified" -> events.add(new BargeInProbe(at, null, 0, false,
            BargeInClassification.parse(text(payload, "classification"))));
        case "barge_in.cancelled" -> events.add(new BargeInCancelled(at));
        case "error" -> events.add(new ErrorEvent(at, Strings.nullToEmpty(text(payload, "message", "error"))));
        case "audio.queue_overflow" -> events.add(new QueueOverflow(at));
        case "audio.schedule_reset" -> events.add(new ScheduleReset(at));
        default -> {
          return ClassificationResult.empty();
        }
      }
    }
    return new ClassificationResult(events, false, List.of(type));
  }

  private void mapState(Map<?, ?> payload, long at, List<DomainEvent> events) {
    String to = text(payload, "state", "to");
    if (Strings.isBlank(to)) {
      return;
    }
    String from = text(payload, "from", "previous");
    if (Strings.isBlank(from)) {
      from = lastState;
    }
    StateTransition transition = new StateTransition(at, from, to, text(payload, "reason"));
    lastState = transition.to();
    events.add(transition);
    if (SPEAKING.equals(transition.to()) && !SPEAKING.equals(transition.from())) {
      events.add(new ResponseStarted(at));
    } else if (SPEAKING.equals(transition.from()) && LISTENING.equals(transition.to())) {
      events.add(new ResponseComplete(at));
    }
  }

  private static BargeInClassification classification(String raw) {
    return raw == null ? null : BargeInClassification.parse(raw);
  }

  private static String text(Map<?, ?> payload, String... keys) {
    for (String key : keys) {
      Object value = payload.get(key);
      if (value != null) {
        return value.toString();
      }
    }
    return null;
  }

  private static long timestampOf(Object node, long fallback) {
    if (node instanceof Number number) {
      return number.longValue();
    }
    if (node instanceof String str && !str.isBlank()) {
      try {
        return Instant.parse(str.trim()).toEpochMilli();
      } catch (DateTimeParseException ex) {
        return fallback;
      }
    }
    return fallback;
  }
}
