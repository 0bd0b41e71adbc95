package ca.gc.cra.parley.application.events;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.parley.application.events.rules.ClassificationRuleSetProvider;
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
import ca.gc.cra.parley.domain.telemetry.RawRecord;
import ca.gc.cra.parley.domain.telemetry.RecordLevel;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class EventClassifierTest {
  private EventClassifier classifier;

  @BeforeEach
  void setUp() throws IOException {
    classifier = new EventClassifier(new ClassificationRuleSetProvider().loadDefaults());
  }

  @Test
  void stateArrowNextToMarkerYieldsTransitionAndResponseStart() {
    ClassificationResult result = classifier.classifyDetailed(
        RawRecord.log(1_000L, "[ThinkerTalker] State: processing → speaking"));

    assertEquals(List.of("transition-arrow", "response-started"), result.ruleIds());
    StateTransition transition = assertInstanceOf(StateTransition.class, result.events().get(0));
    assertEquals("processing", transition.from());
    assertEquals("speaking", transition.to());
    assertInstanceOf(ResponseStarted.class, result.events().get(1));
    assertEquals(1_000L, result.events().get(1).timestamp());
  }

  @Test
  void explicitReasonIsExtracted() {
    List<DomainEvent> events = classifier.classify(
        RawRecord.log(5L, "State transition: speaking -> listening reason=barge_in"));

    StateTransition transition = assertInstanceOf(StateTransition.class, events.get(0));
    assertTrue(transition.isBargeIn());
    assertInstanceOf(ResponseComplete.class, events.get(1));
  }

  @Test
  void arrowWithoutMarkerIsNotATransition() {
    List<DomainEvent> events = classifier.classify(RawRecord.log(5L, "idle -> connecting"));

    assertTrue(events.isEmpty());
  }

  @Test
  void keywordWithoutCoOccurringMarkerProducesNothing() {
    assertTrue(classifier.classify(RawRecord.log(1L, "buffer overflow in parser")).isEmpty());
    assertTrue(classifier.classify(RawRecord.log(1L, "barge in considered")).isEmpty());
    assertTrue(classifier.classify(RawRecord.log(1L, "schedule updated")).isEmpty());
    assertTrue(classifier.classify(
        RawRecord.log(1L, "[WebSocket] reconnect schedule reset after backoff")).isEmpty());

    assertInstanceOf(QueueOverflow.class,
        classifier.classify(RawRecord.log(1L, "Playback queue overflow, trimming")).get(0));
    assertInstanceOf(ScheduleReset.class,
        classifier.classify(RawRecord.log(1L, "Audio schedule reset after drift")).get(0));
  }

  @Test
  void transcriptTextIsExtracted() {
    List<DomainEvent> events = classifier.classify(
        RawRecord.log(10L, "transcript.complete: \"hello world\""));

    TranscriptComplete transcript = assertInstanceOf(TranscriptComplete.class, events.get(0));
    assertEquals("hello world", transcript.text());
  }

  @Test
  void probeAttributesAreParsed() {
    List<DomainEvent> events = classifier.classify(RawRecord.log(10L,
        "BARGE_IN_CHECK: isPlayingRef=true activeSourcesCount=2 willTrigger=false"));

    BargeInProbe probe = assertInstanceOf(BargeInProbe.class, events.get(0));
    assertEquals(Boolean.TRUE, probe.isActiveRef());
    assertEquals(2, probe.activeSourceCount());
    assertFalse(probe.willTrigger());

    BargeInProbe triggered = assertInstanceOf(BargeInProbe.class,
        classifier.classify(RawRecord.log(11L, "BARGE_IN_TRIGGERED: stopping playback")).get(0));
    assertTrue(triggered.willTrigger());
  }

  @Test
  void bargeInClassificationIsExtracted() {
    ClassificationResult soft = classifier.classifyDetailed(
        RawRecord.log(10L, "[BargeIn] classified speech as soft interruption"));
    BargeInProbe probe = assertInstanceOf(BargeInProbe.class, soft.events().get(0));

    assertEquals(List.of("barge-in-classified"), soft.ruleIds());
    assertEquals(BargeInClassification.SOFT_BARGE, probe.classification());
    assertFalse(probe.willTrigger());

    BargeInProbe unclear = assertInstanceOf(BargeInProbe.class,
        classifier.classify(RawRecord.log(11L, "Barge-in classification: ???")).get(0));
    assertEquals(BargeInClassification.UNCLEAR, unclear.classification());

    BargeInProbe backchannel = assertInstanceOf(BargeInProbe.class, classifier.classify(
        RawRecord.message(12L, Map.of("type", "barge_in.classified",
            "payload", Map.of("classification", "backchannel")))).get(0));
    assertEquals(BargeInClassification.BACKCHANNEL, backchannel.classification());
  }

  @Test
  void errorLevelLinesBecomeErrors() {
    List<DomainEvent> events = classifier.classify(
        RawRecord.log(10L, RecordLevel.ERROR, "socket closed unexpectedly"));

    ErrorEvent error = assertInstanceOf(ErrorEvent.class, events.get(0));
    assertEquals("socket closed unexpectedly", error.message());
  }

  @Test
  void speechStartMarkers() {
    assertInstanceOf(SpeechStarted.class,
        classifier.classify(RawRecord.log(1L, "input_audio_buffer.speech_started")).get(0));
    assertInstanceOf(SpeechStarted.class,
        classifier.classify(RawRecord.log(1L, "VAD: Speech started")).get(0));
  }

  @Test
  void structuredStateMessagesDeriveResponseEvents() {
    ClassificationResult speaking = classifier.classifyDetailed(RawRecord.messageJson(1_000L,
        "{\"type\":\"voice.state\",\"timestamp\":1200,\"payload\":{\"state\":\"speaking\",\"from\":\"thinking\"}}"));
    ClassificationResult listening = classifier.classifyDetailed(RawRecord.message(2_000L,
        Map.of("type", "voice.state", "payload", Map.of("state", "listening", "reason", "natural"))));

    assertEquals(2, speaking.events().size());
    assertEquals(1_200L, speaking.events().get(0).timestamp());
    assertInstanceOf(ResponseStarted.class, speaking.events().get(1));

    StateTransition back = assertInstanceOf(StateTransition.class, listening.events().get(0));
    assertEquals("speaking", back.from());
    assertEquals(2_000L, back.timestamp());
    assertInstanceOf(ResponseComplete.class, listening.events().get(1));
  }

  @Test
  void clientBargeInMessageIsATriggeredProbe() {
    List<DomainEvent> events = classifier.classify(RawRecord.message(10L, Map.of("type", "barge_in")));

    assertTrue(assertInstanceOf(BargeInProbe.class, events.get(0)).willTrigger());
  }

  @Test
  void malformedMessagesAreFlagged() {
    assertTrue(classifier.classifyDetailed(RawRecord.messageJson(1L, "{not json")).malformed());
    assertTrue(classifier.classifyDetailed(RawRecord.messageJson(1L, "[1,2]")).malformed());
    assertTrue(classifier.classifyDetailed(RawRecord.messageJson(1L, "{\"payload\":{}}")).malformed());
    assertTrue(classifier.classifyDetailed(
        RawRecord.messageJson(1L, "{\"type\":\"error\",\"payload\":\"oops\"}")).malformed());
  }

  @Test
  void unknownMessageTypeIsIgnoredNotMalformed() {
    ClassificationResult result = classifier.classifyDetailed(
        RawRecord.messageJson(1L, "{\"type\":\"session.updated\",\"payload\":{}}"));

    assertFalse(result.malformed());
    assertTrue(result.events().isEmpty());
  }

  @Test
  void operatorRulesTakePriorityOverDefaults(@TempDir Path dir)
      throws IOException {
    Path file = dir.resolve("extra.yaml");
    Files.writeString(file, """
        version: 1
        rules:
          - id: custom-speech
            category: speech
            event: speech_started
            match:
              contains: "mic open"
        """);
    EventClassifier custom = new EventClassifier(
        new ClassificationRuleSetProvider().load(List.of(file), true));

    ClassificationResult result = custom.classifyDetailed(RawRecord.log(1L, "mic open, Speech started"));

    assertEquals(List.of("custom-speech"), result.ruleIds());
    assertEquals(List.of("speech", "error", "transition"),
        List.copyOf(custom.rules().categories()).subList(0, 3));
  }
}
