package ca.gc.cra.parley.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.parley.application.events.rules.ClassificationRuleSetProvider;
import ca.gc.cra.parley.application.gate.Counter;
import ca.gc.cra.parley.application.port.ClockPort;
import ca.gc.cra.parley.application.port.MetricsPort;
import ca.gc.cra.parley.domain.conversation.StuckDiagnosis;
import ca.gc.cra.parley.domain.telemetry.RawRecord;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TurnAwaiterTest {
  private FakeClock clock;
  private RecordInbox inbox;
  private TelemetryEngine engine;
  private TurnAwaiter awaiter;

  @BeforeEach
  void setUp() throws IOException {
    clock = new FakeClock(10_000L);
    inbox = new RecordInbox();
    engine = TelemetryEngine.create(new ClassificationRuleSetProvider().loadDefaults(), MetricsPort.NO_OP, clock);
    awaiter = new TurnAwaiter(new BoundedPoller(engine, inbox, clock, Duration.ofMillis(100)));
  }

  @Test
  void recordsArrivingWhileWaitingSatisfyTheWait() {
    inbox.offer(RawRecord.log(10_000L, "Speech started"));
    clock.thenOnSleep(() -> inbox.offer(RawRecord.log(10_100L, "transcript.complete: hi")));
    clock.thenOnSleep(() -> inbox.offer(RawRecord.log(10_200L, "Natural completion mode")));

    TurnWaitResult result = awaiter.awaitNextTurn(Duration.ofSeconds(5));

    assertTrue(result.satisfied());
    assertEquals(1, result.completedTurns().size());
    assertEquals(200L, result.outcome().elapsedMs());
    assertNull(result.diagnosis());
    assertEquals(0, inbox.pending());
  }

  @Test
  void hugeTimeoutWaitsInsteadOfExpiring() {
    BoundedPoller poller = new BoundedPoller(engine, inbox, clock, Duration.ofMillis(100));
    clock.thenOnSleep(() -> inbox.offer(RawRecord.log(10_100L, "Speech started")));

    WaitOutcome maxMillis = poller.await(e -> e.getCurrentTurn().speechStartedAt() != null,
        Duration.ofMillis(Long.MAX_VALUE));

    assertEquals(WaitOutcome.Status.SATISFIED, maxMillis.status());
    assertEquals(100L, maxMillis.elapsedMs());
    assertEquals(1, clock.sleeps());

    clock.thenOnSleep(() -> inbox.offer(RawRecord.log(10_200L, "transcript.complete: hi")));
    WaitOutcome maxSeconds = poller.await(e -> e.getCurrentTurn().transcriptCompleteAt() != null,
        Duration.ofSeconds(Long.MAX_VALUE));

    assertEquals(WaitOutcome.Status.SATISFIED, maxSeconds.status());
  }

  @Test
  void timeoutReturnsPartialStateAndDiagnosis() {
    inbox.offer(RawRecord.log(10_000L, "Speech started"));

    TurnWaitResult result = awaiter.awaitCompletedTurns(1, Duration.ofMillis(250));

    assertFalse(result.satisfied());
    assertEquals(WaitOutcome.Status.TIMED_OUT, result.outcome().status());
    assertEquals(250L, result.outcome().elapsedMs());
    assertEquals(3, clock.sleeps());
    assertEquals(StuckDiagnosis.TRANSCRIPT_COMPLETE_NOT_OBSERVED, result.diagnosis());
    assertEquals(10_000L, result.currentTurn().speechStartedAt());
  }

  @Test
  void lateEventsAfterTimeoutAreStillProcessed() {
    inbox.offer(RawRecord.log(10_000L, "Speech started"));
    assertFalse(awaiter.awaitCompletedTurns(1, Duration.ZERO).satisfied());

    inbox.offer(RawRecord.log(10_500L, "transcript.complete: late"));
    inbox.offer(RawRecord.log(10_900L, "Natural completion mode"));

    assertTrue(awaiter.awaitCompletedTurns(1, Duration.ZERO).satisfied());
  }

  @Test
  void confirmedBargeInWait() {
    inbox.offer(RawRecord.log(1L, "BARGE_IN_TRIGGERED: user spoke"));
    TurnWaitResult heuristicOnly = awaiter.awaitConfirmedBargeIn(Duration.ofMillis(100));
    assertFalse(heuristicOnly.satisfied());
    assertTrue(engine.getBargeInOutcome().attempted());

    inbox.offer(RawRecord.log(2L, "State transition: speaking -> listening reason=barge_in"));
    assertTrue(awaiter.awaitConfirmedBargeIn(Duration.ofMillis(100)).satisfied());
  }

  @Test
  void interruptIsReportedAndRestored() {
    ClockPort interrupting = new ClockPort() {
      @Override
      public long nowMillis() {
        return 0L;
      }

      @Override
      public void sleep(long millis) throws InterruptedException {
        throw new InterruptedException("stop");
      }
    };
    BoundedPoller poller = new BoundedPoller(engine, inbox, interrupting, Duration.ofMillis(10));

    WaitOutcome outcome = poller.await(e -> false, Duration.ofSeconds(1));

    assertEquals(WaitOutcome.Status.INTERRUPTED, outcome.status());
    assertTrue(Thread.interrupted());
  }

  @Test
  void inboxAcceptsRecordsFromOtherThreads() throws InterruptedException {
    CountDownLatch done = new CountDownLatch(4);
    for (int t = 0; t < 4; t++) {
      Thread producer = new Thread(() -> {
        for (int i = 0; i < 250; i++) {
          inbox.offer(RawRecord.log(i, "noise " + i));
        }
        done.countDown();
      });
      producer.start();
    }
    assertTrue(done.await(5, TimeUnit.SECONDS));

    assertEquals(1000, inbox.drainTo(engine));
    assertEquals(1000L, engine.getMetrics().count(Counter.RECORDS_PROCESSED));
  }

  @Test
  void rejectsNonPositiveInterval() {
    assertThrows(IllegalArgumentException.class,
        () -> new BoundedPoller(engine, inbox, clock, Duration.ZERO));
  }
}
