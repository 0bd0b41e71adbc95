package ca.gc.cra.parley.domain.latency;

import java.util.List;
import java.util.Locale;

/**
 * Summary statistics for one metric, computed from the sorted samples on request.
 *
 * @param count number of samples
 * @param min smallest sample (0 when empty)
 * @param max largest sample (0 when empty)
 * @param mean arithmetic mean (0 when empty)
 * @param p50 nearest-rank 50th percentile
 * @param p90 nearest-rank 90th percentile
 * @param p99 nearest-rank 99th percentile
 * @since PARLEY 0.1.0
 */
public record LatencyStats(int count, double min, double max, double mean, double p50, double p90, double p99) {
  private static final LatencyStats EMPTY = new LatencyStats(0, 0, 0, 0, 0, 0, 0);

  /**
   * @return statistics for an empty sample set
   */
  public static LatencyStats empty() {
    return EMPTY;
  }

  /**
   * Computes statistics from samples already sorted ascending.
   *
   * @param sorted ascending samples; not modified
   * @return statistics, {@link #empty()} when {@code sorted} is empty
   */
  public static LatencyStats fromSorted(List<Double> sorted) {
    if (sorted.isEmpty()) {
      return EMPTY;
    }
    double sum = 0;
    for (double value : sorted) {
      sum += value;
    }
    return new LatencyStats(
        sorted.size(),
        sorted.get(0),
        sorted.get(sorted.size() - 1),
        sum / sorted.size(),
        percentile(sorted, 50),
        percentile(sorted, 90),
        percentile(sorted, 99));
  }

  /**
   * Nearest-rank percentile: index {@code ceil(p / 100 * n) - 1}, clamped into {@code [0, n - 1]}.
   *
   * @param sorted ascending, non-empty samples
   * @param p percentile in {@code [0, 100]}
   * @return sample at the nearest rank
   */
  public static double percentile(List<Double> sorted, double p) {
    if (sorted.isEmpty()) {
      throw new IllegalArgumentException("percentile of an empty sample set");
    }
    if (p < 0 || p > 100) {
      throw new IllegalArgumentException("p must be between 0 and 100 (was " + p + ')');
    }
    int n = sorted.size();
    int index = (int) Math.ceil(p / 100.0 * n) - 1;
    index = Math.max(0, Math.min(n - 1, index));
    return sorted.get(index);
  }

  /**
   * @return {@code true} when no samples were recorded
   */
  public boolean isEmpty() {
    return count == 0;
  }

  /**
   * Renders a compact one-line form used in failure messages and summaries.
   *
   * @return e.g. {@code n=4 p50=120.0 p90=900.0 p99=900.0 mean=312.5}
   */
  public String describe() {
    if (isEmpty()) {
      return "n=0";
    }
    return String.format(Locale.ROOT, "n=%d p50=%.1f p90=%.1f p99=%.1f mean=%.1f",
        count, p50, p90, p99, mean);
  }
}
