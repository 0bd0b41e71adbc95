package ca.gc.cra.parley.application.gate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.parley.domain.latency.LatencyHistograms;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class QualityGateTest {

  @Test
  void breachedBoundsAreReported() {
    MetricsAggregator aggregator = new MetricsAggregator(new LatencyHistograms(), new RecordingMetricsPort());
    aggregator.increment(Counter.ERRORS);
    aggregator.increment(Counter.ERRORS);
    aggregator.increment(Counter.TOTAL_TURNS);
    aggregator.addLatency(MetricsAggregator.RESPONSE, 1250.5);

    QualityThresholds thresholds = QualityThresholds.builder()
        .max("errors", 0)
        .min("totalTurns", 3)
        .max("averageResponseLatencyMs", 1500)
        .build();
    GateVerdict verdict = QualityGate.evaluate(aggregator.snapshot(), thresholds);

    assertFalse(verdict.pass());
    assertEquals(3, verdict.checked());
    assertEquals(List.of("errors=2 exceeds max 0", "totalTurns=1 below min 3"), verdict.failures());
  }

  @Test
  void missingAverageIsNotedNotFailed() {
    MetricsAggregator aggregator = new MetricsAggregator(new LatencyHistograms(), new RecordingMetricsPort());

    GateVerdict verdict = QualityGate.evaluate(aggregator.snapshot(),
        QualityThresholds.of(Map.of("averageBargeInLatencyMs", 300), Map.of()));

    assertTrue(verdict.pass());
    assertEquals(0, verdict.checked());
    assertEquals(List.of("averageBargeInLatencyMs: no data"), verdict.notes());
  }

  @Test
  void emptyThresholdsAlwaysPass() {
    MetricsAggregator aggregator = new MetricsAggregator(new LatencyHistograms(), new RecordingMetricsPort());
    aggregator.increment(Counter.ERRORS);

    assertTrue(QualityGate.evaluate(aggregator.snapshot(), QualityThresholds.none()).pass());
  }

  @Test
  void unknownThresholdNameIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> QualityThresholds.builder().max("latency", 1));
  }

  @Test
  void formatsWholeAndFractionalValues() {
    assertEquals("3", QualityGate.format(3.0));
    assertEquals("2.5", QualityGate.format(2.5));
  }
}
