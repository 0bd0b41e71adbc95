package ca.gc.cra.parley.application.gate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Named bounds on counters and averages. Partial sets are legal: unnamed metrics are unconstrained.
 *
 * @since PARLEY 0.1.0
 */
public final class QualityThresholds {
  /** Whether a bound is an upper or lower limit. */
  public enum Direction {
    MAX,
    MIN
  }

  /**
   * One bound.
   *
   * @param name counter key or average name
   * @param direction upper or lower limit
   * @param limit bound value, inclusive
   */
  public record Bound(String name, Direction direction, double limit) {}

  private static final QualityThresholds NONE = new QualityThresholds(List.of());

  private final List<Bound> bounds;

  private QualityThresholds(List<Bound> bounds) {
    this.bounds = List.copyOf(bounds);
  }

  /**
   * @return thresholds with no bounds
   */
  public static QualityThresholds none() {
    return NONE;
  }

  /**
   * @return new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builds thresholds from upper and lower bound maps such as {@code {errors: 0}}.
   *
   * @param max upper bounds; may be empty
   * @param min lower bounds; may be empty
   * @return thresholds
   * @throws IllegalArgumentException for unknown names
   */
  public static QualityThresholds of(Map<String, ? extends Number> max, Map<String, ? extends Number> min) {
    Builder builder = builder();
    max.forEach((name, value) -> builder.max(name, Objects.requireNonNull(value, name).doubleValue()));
    min.forEach((name, value) -> builder.min(name, Objects.requireNonNull(value, name).doubleValue()));
    return builder.build();
  }

  /**
   * @return bounds in declaration order
   */
  public List<Bound> bounds() {
    return bounds;
  }

  /**
   * @return {@code true} when no bound is declared
   */
  public boolean isEmpty() {
    return bounds.isEmpty();
  }

  /**
   * @return upper bounds keyed by name
   */
  public Map<String, Double> maxima() {
    return byDirection(Direction.MAX);
  }

  /**
   * @return lower bounds keyed by name
   */
  public Map<String, Double> minima() {
    return byDirection(Direction.MIN);
  }

  private Map<String, Double> byDirection(Direction direction) {
    Map<String, Double> out = new LinkedHashMap<>();
    for (Bound bound : bounds) {
      if (bound.direction() == direction) {
        out.put(bound.name(), bound.limit());
      }
    }
    return Collections.unmodifiableMap(out);
  }

  /** Accumulates bounds; a later bound for the same name and direction replaces the earlier one. */
  public static final class Builder {
    private final Map<String, Bound> bounds = new LinkedHashMap<>();

    private Builder() {}

    /**
     * @param name counter key or average name
     * @param limit inclusive upper bound
     * @return this builder
     */
    public Builder max(String name, double limit) {
      return add(name, Direction.MAX, limit);
    }

    /**
     * @param name counter key or average name
     * @param limit inclusive lower bound
     * @return this builder
     */
    public Builder min(String name, double limit) {
      return add(name, Direction.MIN, limit);
    }

    private Builder add(String name, Direction direction, double limit) {
      Objects.requireNonNull(name, "name");
      if (!ConversationMetrics.isKnown(name)) {
        throw new IllegalArgumentException("Unknown quality threshold: " + name);
      }
      if (!Double.isFinite(limit)) {
        throw new IllegalArgumentException("Threshold " + name + " must be finite (was " + limit + ")");
      }
      bounds.put(direction + ":" + name, new Bound(name, direction, limit));
      return this;
    }

    /**
     * @return immutable thresholds
     */
    public QualityThresholds build() {
      return new QualityThresholds(new ArrayList<>(bounds.values()));
    }
  }
}
