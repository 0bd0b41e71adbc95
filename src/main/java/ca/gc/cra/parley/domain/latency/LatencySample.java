package ca.gc.cra.parley.domain.latency;

import java.util.Objects;

/**
 * One latency observation for a named metric.
 *
 * @param metric metric name such as {@code bargeIn} or {@code turn}; never blank
 * @param valueMs observed latency in milliseconds; finite and non-negative
 * @since PARLEY 0.1.0
 */
public record LatencySample(String metric, double valueMs) {
  /**
   * Validates the metric name and value.
   */
  public LatencySample {
    Objects.requireNonNull(metric, "metric");
    if (metric.isBlank()) {
      throw new IllegalArgumentException("metric must not be blank");
    }
    if (!Double.isFinite(valueMs) || valueMs < 0) {
      throw new IllegalArgumentException("valueMs must be finite and >= 0 (was " + valueMs + ')');
    }
  }
}
