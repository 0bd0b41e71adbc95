package ca.gc.cra.parley.application.gate;

import ca.gc.cra.parley.domain.latency.LatencyStats;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Immutable snapshot of the aggregator: counters, derived averages and per-metric latency statistics.
 *
 * @param counters value of every counter
 * @param averageResponseLatencyMs mean transcript-to-response latency, {@code null} without samples
 * @param averageBargeInLatencyMs mean confirmed barge-in latency, {@code null} without samples
 * @param averageTurnLatencyMs mean speech-to-response-complete latency, {@code null} without samples
 * @param latency statistics per latency metric, ordered by metric name
 * @since PARLEY 0.1.0
 */
public record ConversationMetrics(
    Map<Counter, Long> counters,
    Double averageResponseLatencyMs,
    Double averageBargeInLatencyMs,
    Double averageTurnLatencyMs,
    Map<String, LatencyStats> latency) {

  /** Names of the derived averages, in summary order. */
  public static final List<String> AVERAGES = List.of(
      "averageResponseLatencyMs", "averageBargeInLatencyMs", "averageTurnLatencyMs");

  /**
   * Freezes the maps.
   */
  public ConversationMetrics {
    EnumMap<Counter, Long> copy = new EnumMap<>(Counter.class);
    for (Counter counter : Counter.values()) {
      copy.put(counter, counters.getOrDefault(counter, 0L));
    }
    counters = Collections.unmodifiableMap(copy);
    latency = Collections.unmodifiableMap(new LinkedHashMap<>(latency));
  }

  /**
   * @param counter counter
   * @return its value
   */
  public long count(Counter counter) {
    return counters.get(counter);
  }

  /**
   * Looks up a counter or average by its threshold name.
   *
   * @param name counter key or average name
   * @return value, empty for an average without samples
   * @throws IllegalArgumentException when the name is unknown
   */
  public OptionalDouble value(String name) {
    Counter counter = Counter.fromKey(name);
    if (counter != null) {
      return OptionalDouble.of(count(counter));
    }
    Double average = switch (name) {
      case "averageResponseLatencyMs" -> averageResponseLatencyMs;
      case "averageBargeInLatencyMs" -> averageBargeInLatencyMs;
      case "averageTurnLatencyMs" -> averageTurnLatencyMs;
      default -> throw new IllegalArgumentException("Unknown metric: " + name);
    };
    return average == null ? OptionalDouble.empty() : OptionalDouble.of(average);
  }

  /**
   * @param name candidate threshold name
   * @return {@code true} when {@link #value(String)} accepts it
   */
  public static boolean isKnown(String name) {
    return Counter.fromKey(name) != null || AVERAGES.contains(name);
  }
}
