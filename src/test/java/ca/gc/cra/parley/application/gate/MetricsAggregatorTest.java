package ca.gc.cra.parley.application.gate;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.parley.domain.latency.LatencyHistograms;
import java.util.List;
import org.junit.jupiter.api.Test;

class MetricsAggregatorTest {

  @Test
  void countersAndSamplesAreMirrored() {
    RecordingMetricsPort port = new RecordingMetricsPort();
    MetricsAggregator aggregator = new MetricsAggregator(new LatencyHistograms(), port);

    aggregator.increment(Counter.ERRORS);
    aggregator.increment(Counter.ERRORS);
    aggregator.addLatency(MetricsAggregator.RESPONSE, 200.4);

    assertEquals(2L, aggregator.count(Counter.ERRORS));
    assertEquals(2L, port.counters.get("parley.errors"));
    assertEquals(List.of(200L), port.observations.get("parley.latency.response"));
  }

  @Test
  void averagesComeFromHistogramMeans() {
    MetricsAggregator aggregator = new MetricsAggregator(new LatencyHistograms(), new RecordingMetricsPort());
    aggregator.addLatency(MetricsAggregator.TURN, 1000);
    aggregator.addLatency(MetricsAggregator.TURN, 3000);

    ConversationMetrics snapshot = aggregator.snapshot();

    assertEquals(2000.0, snapshot.averageTurnLatencyMs());
    assertNull(snapshot.averageResponseLatencyMs());
    assertNull(snapshot.averageBargeInLatencyMs());
    assertEquals(0L, snapshot.count(Counter.TOTAL_TURNS));
    assertEquals(2000.0, snapshot.value("averageTurnLatencyMs").getAsDouble());
    assertEquals(0.0, snapshot.value("errors").getAsDouble());
  }

  @Test
  void snapshotRejectsUnknownNames() {
    ConversationMetrics snapshot =
        new MetricsAggregator(new LatencyHistograms(), new RecordingMetricsPort()).snapshot();

    assertThrows(IllegalArgumentException.class, () -> snapshot.value("latencyOfDoom"));
  }

  @Test
  void negativeSampleIsRejectedBeforeMirroring() {
    RecordingMetricsPort port = new RecordingMetricsPort();
    MetricsAggregator aggregator = new MetricsAggregator(new LatencyHistograms(), port);

    assertThrows(IllegalArgumentException.class, () -> aggregator.addLatency(MetricsAggregator.TURN, -5));
    assertEquals(0, port.observations.size());
  }
}
