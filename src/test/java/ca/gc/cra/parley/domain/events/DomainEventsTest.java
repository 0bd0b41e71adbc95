package ca.gc.cra.parley.domain.events;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class DomainEventsTest {

  @Test
  void eventKindAcceptsWireSpellings() {
    assertEquals(EventKind.TRANSCRIPT_COMPLETE, EventKind.parse("transcript.complete"));
    assertEquals(EventKind.QUEUE_OVERFLOW, EventKind.parse("queueOverflow"));
    assertEquals(EventKind.SPEECH_STARTED, EventKind.parse(" speech_started "));
    assertEquals(EventKind.SCHEDULE_RESET, EventKind.parse("schedule-reset"));
    assertThrows(IllegalArgumentException.class, () -> EventKind.parse("thinking"));
    assertThrows(IllegalArgumentException.class, () -> EventKind.parse(""));
  }

  @Test
  void stateTransitionNormalizesStates() {
    StateTransition transition = new StateTransition(10L, null, " Listening ", "Barge_In");

    assertEquals(StateTransition.UNKNOWN_STATE, transition.from());
    assertEquals("listening", transition.to());
    assertTrue(transition.isBargeIn());
    assertEquals(EventKind.STATE_TRANSITION, transition.kind());

    StateTransition natural = new StateTransition(20L, "speaking", "listening", " ");
    assertNull(natural.reason());
    assertFalse(natural.isBargeIn());
  }

  @Test
  void withTimestampKeepsPayload() {
    StateTransition moved = new StateTransition(10L, "thinking", "speaking", null).withTimestamp(99L);

    assertEquals(99L, moved.timestamp());
    assertEquals("thinking", moved.from());
    assertEquals("speaking", moved.to());
  }
}
