package ca.gc.cra.parley.application.gate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.parley.domain.bargein.BargeInOutcome;
import ca.gc.cra.parley.domain.conversation.Turn;
import ca.gc.cra.parley.domain.events.BargeInClassification;
import ca.gc.cra.parley.domain.latency.LatencyHistograms;
import java.util.List;
import org.junit.jupiter.api.Test;

class SummaryRendererTest {

  @Test
  void emptySessionRendersPlaceholders() {
    ConversationMetrics metrics =
        new MetricsAggregator(new LatencyHistograms(), new RecordingMetricsPort()).snapshot();

    String summary = SummaryRenderer.render(metrics, List.of(),
        new Turn(1, null, null, null, null, null, List.of()), BargeInOutcome.NONE);

    assertTrue(summary.startsWith("=== Conversation Summary ===\nCounters:\n  recordsProcessed: 0\n"));
    assertTrue(summary.contains("  averageTurnLatencyMs: n/a\n"));
    assertTrue(summary.contains("Latency:\n  (no samples)\n"));
    assertTrue(summary.contains("attemptCount=0 classification=n/a\n"));
    assertTrue(summary.contains("Turns:\n  (none completed)\n"));
    assertTrue(summary.endsWith("Open turn: #1 WAITING_FOR_SPEECH\n"));
  }

  @Test
  void renderingIsDeterministic() {
    MetricsAggregator aggregator = new MetricsAggregator(new LatencyHistograms(), new RecordingMetricsPort());
    aggregator.addLatency(MetricsAggregator.TURN, 4200);
    aggregator.addLatency(MetricsAggregator.RESPONSE, 200);
    aggregator.increment(Counter.TOTAL_TURNS);
    Turn done = new Turn(1, 0L, 500L, "hello", 700L, 4200L, List.of());
    Turn open = new Turn(2, 5000L, null, null, null, null, List.of());
    BargeInOutcome outcome = new BargeInOutcome(false, true, 80L, 0, 1, BargeInClassification.SOFT_BARGE);

    String first = SummaryRenderer.render(aggregator.snapshot(), List.of(done), open, outcome);
    String second = SummaryRenderer.render(aggregator.snapshot(), List.of(done), open, outcome);

    assertEquals(first, second);
    assertTrue(first.contains("  response: n=1 p50=200.0 p90=200.0 p99=200.0 mean=200.0\n  turn: n=1"));
    assertTrue(first.contains(
        "  #1 transcript=\"hello\" turnLatencyMs=4200 responseLatencyMs=200 transitions=0\n"));
    assertTrue(first.contains(
        "Barge-in: confirmed=false attempted=true latencyMs=80 confirmedCount=0 attemptCount=1 classification=soft_barge\n"));
    assertTrue(first.endsWith("Open turn: #2 SPEECH_DETECTED\n"));
  }
}
