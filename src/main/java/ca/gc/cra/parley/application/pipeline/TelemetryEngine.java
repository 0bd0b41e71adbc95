package ca.gc.cra.parley.application.pipeline;

import ca.gc.cra.parley.application.events.ClassificationResult;
import ca.gc.cra.parley.application.events.EventClassifier;
import ca.gc.cra.parley.application.events.rules.CompiledRuleSet;
import ca.gc.cra.parley.application.gate.ConversationMetrics;
import ca.gc.cra.parley.application.gate.Counter;
import ca.gc.cra.parley.application.gate.GateVerdict;
import ca.gc.cra.parley.application.gate.MetricsAggregator;
import ca.gc.cra.parley.application.gate.QualityGate;
import ca.gc.cra.parley.application.gate.QualityThresholds;
import ca.gc.cra.parley.application.gate.SummaryRenderer;
import ca.gc.cra.parley.application.port.ClockPort;
import ca.gc.cra.parley.application.port.MetricsPort;
import ca.gc.cra.parley.domain.bargein.BargeInDetector;
import ca.gc.cra.parley.domain.bargein.BargeInOutcome;
import ca.gc.cra.parley.domain.bargein.BargeInUpdate;
import ca.gc.cra.parley.domain.conversation.StuckDiagnosis;
import ca.gc.cra.parley.domain.conversation.Turn;
import ca.gc.cra.parley.domain.conversation.TurnStateMachine;
import ca.gc.cra.parley.domain.conversation.TurnUpdate;
import ca.gc.cra.parley.domain.events.BargeInCancelled;
import ca.gc.cra.parley.domain.events.DomainEvent;
import ca.gc.cra.parley.domain.events.ErrorEvent;
import ca.gc.cra.parley.domain.events.QueueOverflow;
import ca.gc.cra.parley.domain.events.ResponseComplete;
import ca.gc.cra.parley.domain.events.ScheduleReset;
import ca.gc.cra.parley.domain.events.TranscriptComplete;
import ca.gc.cra.parley.domain.latency.LatencyHistograms;
import ca.gc.cra.parley.domain.latency.LatencyStats;
import ca.gc.cra.parley.domain.latency.LatencyTargets;
import ca.gc.cra.parley.domain.latency.TargetAssessment;
import ca.gc.cra.parley.domain.telemetry.RawRecord;
import ca.gc.cra.parley.domain.telemetry.RecordSource;
import ca.gc.cra.parley.logging.Logs;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Single owner of one conversation session: classifier, turn state machine,
 * barge-in detector and metrics aggregator.
 * <p><strong>Why:</strong> Everything a test execution observes flows through one explicitly owned
 * object, so parallel executions never share counters or session state.</p>
 * <p><strong>Ordering:</strong> Event timestamps are clamped to the maximum already seen on the same
 * {@link RecordSource}, so a late or skewed record never moves a session backwards.</p>
 * <p><strong>Errors:</strong> {@link #recordEvent(RawRecord)} never throws for bad telemetry.
 * Malformed structured messages are counted and skipped; events rejected by the turn guards are
 * counted as ignored.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe and performs no locking. Producers on other
 * threads go through {@link RecordInbox}.</p>
 *
 * @since PARLEY 0.1.0
 */
public final class TelemetryEngine {
  private static final Logger log = LoggerFactory.getLogger(TelemetryEngine.class);

  private final EventClassifier classifier;
  private final MetricsAggregator aggregator;
  private final TurnStateMachine turns;
  private final BargeInDetector bargeIn = new BargeInDetector();
  private final Map<RecordSource, Long> lastSeen = new EnumMap<>(RecordSource.class);

  /**
   * @param classifier classifier owned by this engine
   * @param aggregator aggregator owned by this engine
   * @param startedAt session start in epoch milliseconds
   */
  public TelemetryEngine(EventClassifier classifier, MetricsAggregator aggregator, long startedAt) {
    this.classifier = Objects.requireNonNull(classifier, "classifier");
    this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
    this.turns = new TurnStateMachine(startedAt);
  }

  /**
   * Creates an engine with built-in latency targets.
   *
   * @param rules rule table for free-text records
   * @param metrics mirror for counters and samples
   * @param clock source of the session start time
   * @return new engine
   */
  public static TelemetryEngine create(CompiledRuleSet rules, MetricsPort metrics, ClockPort clock) {
    MetricsAggregator aggregator = new MetricsAggregator(new LatencyHistograms(), metrics);
    return new TelemetryEngine(new EventClassifier(rules), aggregator, clock.nowMillis());
  }

  /**
   * Classifies one record and applies its events to the session.
   *
   * @param record raw record
   * @return events applied, with clamped timestamps
   */
  public List<DomainEvent> recordEvent(RawRecord record) {
    Objects.requireNonNull(record, "record");
    aggregator.increment(Counter.RECORDS_PROCESSED);
    ClassificationResult result = classifier.classifyDetailed(record);
    if (result.malformed()) {
      aggregator.increment(Counter.MALFORMED_RECORDS);
      if (log.isDebugEnabled()) {
        log.debug("Skipping malformed {} record: {}", record.source(), Logs.truncate(String.valueOf(
            record.text() != null ? record.text() : record.payload())));
      }
      return List.of();
    }
    List<DomainEvent> applied = new ArrayList<>(result.events().size());
    for (DomainEvent event : result.events()) {
      DomainEvent clamped = clamp(record.source(), event);
      apply(clamped);
      applied.add(clamped);
    }
    return applied;
  }

  private DomainEvent clamp(RecordSource source, DomainEvent event) {
    Long previous = lastSeen.get(source);
    if (previous != null && event.timestamp() < previous) {
      log.debug("Clamping {} timestamp {} to {}", event.kind(), event.timestamp(), previous);
      return event.withTimestamp(previous);
    }
    lastSeen.put(source, event.timestamp());
    return event;
  }

  private void apply(DomainEvent event) {
    TurnUpdate update = turns.apply(event);
    if (update == TurnUpdate.IGNORED) {
      aggregator.increment(Counter.IGNORED_EVENTS);
      log.debug("Ignored {} at {} while turn {} is {}", event.kind(), event.timestamp(),
          turns.currentTurn().index(), turns.currentTurn().phase());
    } else if (update == TurnUpdate.SEALED) {
      onTurnSealed(turns.completedTurns().get(turns.completedCount() - 1));
    }

    BargeInUpdate barge = bargeIn.apply(event);
    if (barge.attemptOpened()) {
      aggregator.increment(Counter.BARGE_IN_ATTEMPTS);
    }
    if (barge.confirmedNow()) {
      aggregator.increment(Counter.SUCCESSFUL_BARGE_INS);
      if (barge.latencyMs() != null) {
        aggregator.addLatency(MetricsAggregator.BARGE_IN, barge.latencyMs());
      }
      log.debug("Barge-in confirmed at {} (latencyMs={})", event.timestamp(), barge.latencyMs());
    }

    if (event instanceof ErrorEvent error) {
      aggregator.increment(Counter.ERRORS);
      log.debug("Error event: {}", Logs.truncate(error.message()));
    } else if (event instanceof QueueOverflow) {
      aggregator.increment(Counter.QUEUE_OVERFLOWS);
    } else if (event instanceof ScheduleReset) {
      aggregator.increment(Counter.SCHEDULE_RESETS);
    } else if (event instanceof BargeInCancelled) {
      aggregator.increment(Counter.FALSE_BARGE_INS);
    } else if (event instanceof TranscriptComplete) {
      aggregator.increment(Counter.USER_UTTERANCES);
    } else if (event instanceof ResponseComplete) {
      aggregator.increment(Counter.AI_RESPONSES);
    }
  }

  private void onTurnSealed(Turn turn) {
    aggregator.increment(Counter.TOTAL_TURNS);
    turn.turnLatencyMs().ifPresent(ms -> addTurnLatency(turn, MetricsAggregator.TURN, ms));
    turn.responseLatencyMs().ifPresent(ms -> addTurnLatency(turn, MetricsAggregator.RESPONSE, ms));
    log.debug("Turn {} sealed (turnLatencyMs={})", turn.index(), turn.turnLatencyMs());
  }

  private void addTurnLatency(Turn turn, String metric, long ms) {
    if (ms < 0) {
      log.debug("Skipping negative {} latency {}ms on turn {}", metric, ms, turn.index());
      return;
    }
    aggregator.addLatency(metric, ms);
  }

  /**
   * @return completed turns in order; unmodifiable
   */
  public List<Turn> getTurns() {
    return turns.completedTurns();
  }

  /**
   * @return snapshot of the open turn
   */
  public Turn getCurrentTurn() {
    return turns.currentTurn();
  }

  /**
   * @return barge-in classification so far; confirmed and attempted are reported separately
   */
  public BargeInOutcome getBargeInOutcome() {
    return bargeIn.outcome();
  }

  /**
   * @return metrics snapshot
   */
  public ConversationMetrics getMetrics() {
    return aggregator.snapshot();
  }

  /**
   * @return deterministic multi-line report
   */
  public String getSummary() {
    return SummaryRenderer.render(aggregator.snapshot(), turns.completedTurns(), turns.currentTurn(),
        bargeIn.outcome());
  }

  /**
   * @param metric latency metric name
   * @return statistics computed now
   */
  public LatencyStats getStats(String metric) {
    return aggregator.stats(metric);
  }

  /**
   * Compares a latency metric against targets overlaid on the built-in targets.
   *
   * @param metric latency metric name
   * @param targets caller targets; may be {@code null}
   * @return assessment; never thrown
   */
  public TargetAssessment assertTargets(String metric, LatencyTargets targets) {
    TargetAssessment assessment = aggregator.assess(metric, targets);
    if (!assessment.pass()) {
      log.warn("Latency targets failed for {}: {}", metric, assessment.failures());
    }
    return assessment;
  }

  /**
   * Compares counters and averages against thresholds.
   *
   * @param thresholds bounds
   * @return verdict; never thrown
   */
  public GateVerdict assertQualityThresholds(QualityThresholds thresholds) {
    GateVerdict verdict = QualityGate.evaluate(aggregator.snapshot(), thresholds);
    if (!verdict.pass()) {
      log.warn("Quality thresholds failed: {}", verdict.failures());
    }
    return verdict;
  }

  /**
   * @return the field the open turn is still missing
   */
  public StuckDiagnosis diagnose() {
    return turns.diagnose();
  }

  /**
   * @return session start in epoch milliseconds
   */
  public long startedAt() {
    return turns.startedAt();
  }
}
