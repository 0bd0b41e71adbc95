package ca.gc.cra.parley.application.gate;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Compares a metrics snapshot against quality thresholds.
 *
 * @since PARLEY 0.1.0
 */
public final class QualityGate {
  private QualityGate() {
    // Utility
  }

  /**
   * @param metrics snapshot to check
   * @param thresholds bounds; an empty set always passes
   * @return verdict; an average without samples is noted, never failed
   */
  public static GateVerdict evaluate(ConversationMetrics metrics, QualityThresholds thresholds) {
    Objects.requireNonNull(metrics, "metrics");
    Objects.requireNonNull(thresholds, "thresholds");
    List<String> failures = new ArrayList<>();
    List<String> notes = new ArrayList<>();
    int checked = 0;
    for (QualityThresholds.Bound bound : thresholds.bounds()) {
      OptionalDouble actual = metrics.value(bound.name());
      if (actual.isEmpty()) {
        notes.add(bound.name() + ": no data");
        continue;
      }
      checked++;
      double value = actual.getAsDouble();
      boolean breached = bound.direction() == QualityThresholds.Direction.MAX
          ? value > bound.limit()
          : value < bound.limit();
      if (breached) {
        failures.add(String.format(Locale.ROOT, "%s=%s %s %s",
            bound.name(),
            format(value),
            bound.direction() == QualityThresholds.Direction.MAX ? "exceeds max" : "below min",
            format(bound.limit())));
      }
    }
    return new GateVerdict(failures.isEmpty(), failures, notes, checked);
  }

  static String format(double value) {
    if (value == Math.rint(value) && Math.abs(value) < 1e15) {
      return Long.toString((long) value);
    }
    return String.format(Locale.ROOT, "%.1f", value);
  }
}
