package ca.gc.cra.parley.domain.bargein;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.parley.domain.events.BargeInClassification;
import ca.gc.cra.parley.domain.events.BargeInProbe;
import ca.gc.cra.parley.domain.events.ResponseComplete;
import ca.gc.cra.parley.domain.events.ResponseStarted;
import ca.gc.cra.parley.domain.events.SpeechStarted;
import ca.gc.cra.parley.domain.events.StateTransition;
import org.junit.jupiter.api.Test;

class BargeInDetectorTest {

  @Test
  void explicitReasonConfirmsAfterProbes() {
    BargeInDetector detector = new BargeInDetector();

    detector.apply(new BargeInProbe(100L, true, 2, false));
    BargeInUpdate attempt = detector.apply(new BargeInProbe(200L, true, 2, true));
    BargeInUpdate confirm = detector.apply(new StateTransition(300L, "speaking", "listening", "barge_in"));

    assertTrue(attempt.attemptOpened());
    assertTrue(confirm.confirmedNow());
    BargeInOutcome outcome = detector.outcome();
    assertTrue(outcome.confirmed());
    assertTrue(outcome.attempted());
    assertEquals(1, outcome.confirmedCount());
    assertEquals(1, outcome.attemptCount());
  }

  @Test
  void naturalReasonNeverConfirms() {
    BargeInDetector detector = new BargeInDetector();
    detector.apply(new ResponseStarted(0L));
    detector.apply(new SpeechStarted(500L));
    detector.apply(new BargeInProbe(510L, true, 1, true));
    detector.apply(new StateTransition(700L, "speaking", "listening", "natural"));

    BargeInOutcome outcome = detector.outcome();
    assertFalse(outcome.confirmed());
    assertTrue(outcome.attempted());
    assertEquals(200L, outcome.latencyMs());
  }

  @Test
  void speechOutsideResponseIsNotAnAttempt() {
    BargeInDetector detector = new BargeInDetector();
    detector.apply(new SpeechStarted(0L));
    detector.apply(new ResponseStarted(100L));
    detector.apply(new ResponseComplete(900L));
    detector.apply(new SpeechStarted(1000L));

    assertEquals(BargeInOutcome.NONE, detector.outcome());
  }

  @Test
  void latencyUsesNearestStopEvent() {
    BargeInDetector detector = new BargeInDetector();
    detector.apply(new ResponseStarted(0L));
    detector.apply(new SpeechStarted(1000L));
    BargeInUpdate stop = detector.apply(new ResponseComplete(1080L));
    detector.apply(new StateTransition(5000L, "listening", "processing", null));

    assertEquals(80L, stop.latencyMs());
    assertEquals(80L, detector.outcome().latency().getAsLong());
  }

  @Test
  void attemptsAreCountedPerEpisode() {
    BargeInDetector detector = new BargeInDetector();
    detector.apply(new ResponseStarted(0L));
    detector.apply(new SpeechStarted(100L));
    detector.apply(new BargeInProbe(110L, true, 1, true));
    detector.apply(new ResponseComplete(200L));
    detector.apply(new ResponseStarted(300L));
    detector.apply(new SpeechStarted(400L));
    detector.apply(new ResponseComplete(450L));

    assertEquals(2, detector.outcome().attemptCount());
    assertFalse(detector.responseActive());
  }

  @Test
  void episodeWithoutQualifyingSpeechKeepsLastMeasuredLatency() {
    BargeInDetector detector = new BargeInDetector();
    detector.apply(new ResponseStarted(0L));
    detector.apply(new SpeechStarted(1000L));
    detector.apply(new ResponseComplete(1080L));
    BargeInUpdate probeOnly = detector.apply(new BargeInProbe(2000L, false, 0, true));
    BargeInUpdate resolved = detector.apply(new StateTransition(2100L, "listening", "processing", null));

    assertTrue(probeOnly.attemptOpened());
    assertNull(resolved.latencyMs());
    assertEquals(80L, detector.outcome().latencyMs());
    assertEquals(2, detector.outcome().attemptCount());
  }

  @Test
  void latestClassificationIsReported() {
    BargeInDetector detector = new BargeInDetector();
    assertNull(detector.outcome().classification());

    detector.apply(new BargeInProbe(100L, null, 0, false, BargeInClassification.BACKCHANNEL));
    detector.apply(new BargeInProbe(200L, true, 1, false));
    assertEquals(BargeInClassification.BACKCHANNEL, detector.outcome().classification());
    assertFalse(detector.outcome().attempted());

    detector.apply(new BargeInProbe(300L, true, 1, true, BargeInClassification.HARD_BARGE));
    assertEquals(BargeInClassification.HARD_BARGE, detector.outcome().classification());
    assertTrue(detector.outcome().attempted());
  }
}
