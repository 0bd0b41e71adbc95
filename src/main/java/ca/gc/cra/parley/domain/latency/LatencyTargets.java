package ca.gc.cra.parley.domain.latency;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Upper bounds for one metric's statistics. Any bound may be {@code null}, meaning unconstrained.
 *
 * @param p50 maximum acceptable p50 in milliseconds
 * @param p90 maximum acceptable p90 in milliseconds
 * @param p99 maximum acceptable p99 in milliseconds
 * @param mean maximum acceptable mean in milliseconds
 * @param max maximum acceptable single sample in milliseconds
 * @since PARLEY 0.1.0
 */
public record LatencyTargets(Double p50, Double p90, Double p99, Double mean, Double max) {
  /** No constraints. */
  public static final LatencyTargets NONE = new LatencyTargets(null, null, null, null, null);

  /**
   * Built-in targets per metric: interruption to silence, user speech end to first audio, and
   * user speech end to first word.
   */
  public static final Map<String, LatencyTargets> BUILT_IN = Map.of(
      "bargeIn", new LatencyTargets(100d, 150d, 250d, null, null),
      "ttfa", new LatencyTargets(800d, 1500d, 2500d, null, null),
      "e2e", new LatencyTargets(1200d, 2000d, 3500d, null, null));

  /**
   * Rejects negative or non-finite bounds.
   */
  public LatencyTargets {
    check("p50", p50);
    check("p90", p90);
    check("p99", p99);
    check("mean", mean);
    check("max", max);
  }

  /**
   * Builds targets from a partial map such as {@code {p50: 150}}.
   *
   * @param raw keys among {@code p50, p90, p99, mean, max}; values numeric
   * @return parsed targets
   * @throws IllegalArgumentException for unknown keys or invalid values
   */
  public static LatencyTargets fromMap(Map<String, ? extends Number> raw) {
    Objects.requireNonNull(raw, "raw");
    Map<String, Double> values = new LinkedHashMap<>();
    for (Map.Entry<String, ? extends Number> entry : raw.entrySet()) {
      String key = entry.getKey() == null ? "" : entry.getKey().trim().toLowerCase(Locale.ROOT);
      if (!key.equals("p50") && !key.equals("p90") && !key.equals("p99")
          && !key.equals("mean") && !key.equals("max")) {
        throw new IllegalArgumentException("Unknown latency target: " + entry.getKey());
      }
      Number number = Objects.requireNonNull(entry.getValue(), "target " + key);
      values.put(key, number.doubleValue());
    }
    return new LatencyTargets(values.get("p50"), values.get("p90"), values.get("p99"),
        values.get("mean"), values.get("max"));
  }

  /**
   * Overlays these targets on {@code base}: bounds set here win, unset ones fall back.
   *
   * @param base fallback targets; may be {@code null}
   * @return merged targets
   */
  public LatencyTargets over(LatencyTargets base) {
    if (base == null) {
      return this;
    }
    return new LatencyTargets(
        p50 != null ? p50 : base.p50,
        p90 != null ? p90 : base.p90,
        p99 != null ? p99 : base.p99,
        mean != null ? mean : base.mean,
        max != null ? max : base.max);
  }

  /**
   * @return {@code true} when no bound is set
   */
  public boolean isEmpty() {
    return p50 == null && p90 == null && p99 == null && mean == null && max == null;
  }

  private static void check(String name, Double value) {
    if (value != null && (!Double.isFinite(value) || value < 0)) {
      throw new IllegalArgumentException(name + " target must be finite and >= 0 (was " + value + ')');
    }
  }
}
