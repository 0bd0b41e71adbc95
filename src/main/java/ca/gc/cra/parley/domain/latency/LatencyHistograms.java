package ca.gc.cra.parley.domain.latency;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * <strong>What:</strong> Keeps named latency sample sets and derives percentile statistics from them.
 * <p><strong>Why:</strong> Statistics are recomputed from the full sorted set on every request, so a
 * sample added after a read is always reflected in the next read.</p>
 * <p><strong>Targets:</strong> Caller targets are overlaid on the built-in targets for the metric,
 * so a partial target such as {@code {p50: 150}} still enforces the built-in p90 and p99.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; owned by the engine thread.</p>
 *
 * @since PARLEY 0.1.0
 */
public final class LatencyHistograms {
  private final Map<String, List<Double>> samples = new TreeMap<>();
  private final Map<String, LatencyTargets> builtIn;

  /**
   * Creates histograms backed by {@link LatencyTargets#BUILT_IN}.
   */
  public LatencyHistograms() {
    this(LatencyTargets.BUILT_IN);
  }

  /**
   * Creates histograms with a custom target catalogue.
   *
   * @param builtIn targets per metric applied beneath caller targets; copied
   */
  public LatencyHistograms(Map<String, LatencyTargets> builtIn) {
    this.builtIn = Map.copyOf(Objects.requireNonNull(builtIn, "builtIn"));
  }

  /**
   * Records one sample, keeping the metric's list sorted.
   *
   * @param metric metric name
   * @param valueMs latency in milliseconds; finite and non-negative
   * @throws IllegalArgumentException when the value is negative or not finite
   */
  public void addSample(String metric, double valueMs) {
    add(new LatencySample(metric, valueMs));
  }

  /**
   * Records one validated sample.
   *
   * @param sample sample to record
   */
  public void add(LatencySample sample) {
    List<Double> sorted = samples.computeIfAbsent(sample.metric(), k -> new ArrayList<>());
    int index = Collections.binarySearch(sorted, sample.valueMs());
    if (index < 0) {
      index = -index - 1;
    }
    sorted.add(index, sample.valueMs());
  }

  /**
   * @param metric metric name
   * @return statistics, {@link LatencyStats#empty()} when the metric has no samples
   */
  public LatencyStats stats(String metric) {
    List<Double> sorted = samples.get(metric);
    return sorted == null ? LatencyStats.empty() : LatencyStats.fromSorted(sorted);
  }

  /**
   * @return statistics for every metric that has samples, ordered by metric name
   */
  public Map<String, LatencyStats> allStats() {
    Map<String, LatencyStats> out = new LinkedHashMap<>();
    samples.forEach((metric, sorted) -> out.put(metric, LatencyStats.fromSorted(sorted)));
    return Collections.unmodifiableMap(out);
  }

  /**
   * @param metric metric name
   * @return number of samples recorded for the metric
   */
  public int sampleCount(String metric) {
    List<Double> sorted = samples.get(metric);
    return sorted == null ? 0 : sorted.size();
  }

  /**
   * Compares a metric against targets overlaid on its built-in targets.
   *
   * @param metric metric name
   * @param targets caller targets; {@code null} applies the built-in targets only
   * @return assessment; never thrown
   */
  public TargetAssessment assess(String metric, LatencyTargets targets) {
    LatencyTargets base = builtIn.get(metric);
    LatencyTargets effective = targets == null
        ? (base == null ? LatencyTargets.NONE : base)
        : targets.over(base);
    LatencyStats stats = stats(metric);
    List<String> failures = new ArrayList<>();
    List<String> notes = new ArrayList<>();
    if (stats.isEmpty()) {
      notes.add(metric + ": no samples recorded");
      return new TargetAssessment(metric, true, failures, 0, notes, stats);
    }
    check(metric, "p50", stats.p50(), effective.p50(), stats, failures);
    check(metric, "p90", stats.p90(), effective.p90(), stats, failures);
    check(metric, "p99", stats.p99(), effective.p99(), stats, failures);
    check(metric, "mean", stats.mean(), effective.mean(), stats, failures);
    check(metric, "max", stats.max(), effective.max(), stats, failures);
    if (effective.isEmpty()) {
      notes.add(metric + ": no targets defined");
    }
    return new TargetAssessment(metric, failures.isEmpty(), failures, stats.count(), notes, stats);
  }

  private static void check(String metric, String name, double actual, Double limit,
      LatencyStats stats, List<String> failures) {
    if (limit == null || actual <= limit) {
      return;
    }
    failures.add(String.format(Locale.ROOT, "%s %s=%.1fms exceeds target %.1fms [%s]",
        metric, name, actual, limit, stats.describe()));
  }
}
