package ca.gc.cra.parley.application.gate;

import ca.gc.cra.parley.application.port.MetricsPort;
import ca.gc.cra.parley.domain.latency.LatencyHistograms;
import ca.gc.cra.parley.domain.latency.LatencyStats;
import ca.gc.cra.parley.domain.latency.LatencyTargets;
import ca.gc.cra.parley.domain.latency.TargetAssessment;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Owns the counters and latency histograms of one session.
 * <p><strong>Why:</strong> Replaces counters scattered across event handlers with a single object
 * passed to whoever needs it, so parallel sessions never share state.</p>
 * <p><strong>Metrics:</strong> Every increment and sample is mirrored to the {@link MetricsPort}
 * as {@code parley.<counter>} and {@code parley.latency.<metric>}.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; owned by the engine thread.</p>
 *
 * @since PARLEY 0.1.0
 */
public final class MetricsAggregator {
  /** Speech start to response complete. */
  public static final String TURN = "turn";
  /** Transcript complete to response start. */
  public static final String RESPONSE = "response";
  /** Qualifying speech to the confirming transition. */
  public static final String BARGE_IN = "bargeIn";

  private final EnumMap<Counter, Long> counters = new EnumMap<>(Counter.class);
  private final LatencyHistograms histograms;
  private final MetricsPort metrics;

  /**
   * @param histograms sample store; also used for target assessment
   * @param metrics mirror for counters and samples
   */
  public MetricsAggregator(LatencyHistograms histograms, MetricsPort metrics) {
    this.histograms = Objects.requireNonNull(histograms, "histograms");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * @param counter counter to bump by one
   */
  public void increment(Counter counter) {
    counters.merge(counter, 1L, Long::sum);
    metrics.increment(counter.metricKey());
  }

  /**
   * Records one latency sample.
   *
   * @param metric metric name
   * @param valueMs latency in milliseconds
   * @throws IllegalArgumentException when the value is negative or not finite
   */
  public void addLatency(String metric, double valueMs) {
    histograms.addSample(metric, valueMs);
    metrics.observe("parley.latency." + metric, Math.round(valueMs));
  }

  /**
   * @param counter counter
   * @return current value
   */
  public long count(Counter counter) {
    return counters.getOrDefault(counter, 0L);
  }

  /**
   * @param metric metric name
   * @return statistics computed now
   */
  public LatencyStats stats(String metric) {
    return histograms.stats(metric);
  }

  /**
   * @param metric metric name
   * @param targets caller targets, overlaid on the built-in targets
   * @return assessment; never thrown
   */
  public TargetAssessment assess(String metric, LatencyTargets targets) {
    return histograms.assess(metric, targets);
  }

  /**
   * @return snapshot of counters, averages and latency statistics
   */
  public ConversationMetrics snapshot() {
    Map<String, LatencyStats> latency = histograms.allStats();
    return new ConversationMetrics(
        counters,
        mean(latency.get(RESPONSE)),
        mean(latency.get(BARGE_IN)),
        mean(latency.get(TURN)),
        latency);
  }

  private static Double mean(LatencyStats stats) {
    return stats == null || stats.isEmpty() ? null : stats.mean();
  }
}
