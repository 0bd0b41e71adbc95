package ca.gc.cra.parley.config;

import ca.gc.cra.parley.application.gate.QualityThresholds;
import ca.gc.cra.parley.domain.latency.LatencyTargets;
import ca.gc.cra.parley.validation.Numbers;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Typed view of a flattened gate configuration.
 * <p><strong>Keys:</strong>
 * <ul>
 *   <li>{@code thresholds.max.<name>} and {@code thresholds.min.<name>}: counter or average bounds.</li>
 *   <li>{@code targets.<metric>.<p50|p90|p99|mean|max>}: latency targets in milliseconds.</li>
 *   <li>{@code rules.files}: comma-separated operator rule files, resolved against the base
 *   directory.</li>
 *   <li>{@code rules.includeDefaults}: whether the built-in table follows them (default
 *   {@code true}).</li>
 * </ul>
 * Any other key is rejected so a typo never silently disables a gate.</p>
 *
 * @param thresholds counter and average bounds
 * @param targets latency targets per metric
 * @param ruleFiles operator rule files
 * @param includeDefaultRules whether the built-in rule table is loaded after {@code ruleFiles}
 * @since PARLEY 0.1.0
 */
public record GateConfig(
    QualityThresholds thresholds,
    Map<String, LatencyTargets> targets,
    List<Path> ruleFiles,
    boolean includeDefaultRules) {

  /**
   * Freezes collections.
   */
  public GateConfig {
    Objects.requireNonNull(thresholds, "thresholds");
    targets = Collections.unmodifiableMap(new LinkedHashMap<>(targets));
    ruleFiles = List.copyOf(ruleFiles);
  }

  /**
   * @return configuration with no thresholds, no caller targets and the built-in rules only
   */
  public static GateConfig defaults() {
    return new GateConfig(QualityThresholds.none(), Map.of(), List.of(), true);
  }

  /**
   * Parses a flattened configuration.
   *
   * @param values flat key/value map, e.g. from {@link YamlConfigLoader}
   * @param baseDir directory relative rule files are resolved against
   * @return typed configuration
   * @throws IllegalArgumentException for unknown keys or invalid values
   */
  public static GateConfig fromMap(Map<String, String> values, Path baseDir) {
    Objects.requireNonNull(values, "values");
    Map<String, Double> max = new LinkedHashMap<>();
    Map<String, Double> min = new LinkedHashMap<>();
    Map<String, Map<String, Double>> targetValues = new LinkedHashMap<>();
    List<Path> ruleFiles = new ArrayList<>();
    boolean includeDefaults = true;

    for (Map.Entry<String, String> entry : values.entrySet()) {
      String key = entry.getKey().trim();
      String value = entry.getValue() == null ? "" : entry.getValue().trim();
      String[] parts = key.split("\\.");
      if (parts.length == 3 && parts[0].equals("thresholds") && parts[1].equals("max")) {
        max.put(parts[2], Numbers.toDouble(key, value));
      } else if (parts.length == 3 && parts[0].equals("thresholds") && parts[1].equals("min")) {
        min.put(parts[2], Numbers.toDouble(key, value));
      } else if (parts.length == 3 && parts[0].equals("targets")) {
        targetValues.computeIfAbsent(parts[1], k -> new LinkedHashMap<>())
            .put(parts[2].toLowerCase(Locale.ROOT), Numbers.toDouble(key, value));
      } else if (key.equals("rules.files")) {
        for (String file : value.split(",")) {
          if (!file.isBlank()) {
            Path path = Path.of(file.trim());
            ruleFiles.add(path.isAbsolute() || baseDir == null ? path : baseDir.resolve(path));
          }
        }
      } else if (key.equals("rules.includeDefaults")) {
        includeDefaults = parseBoolean(key, value);
      } else {
        throw new IllegalArgumentException("Unknown gate configuration key: " + key);
      }
    }

    Map<String, LatencyTargets> targets = new LinkedHashMap<>();
    targetValues.forEach((metric, bounds) -> targets.put(metric, LatencyTargets.fromMap(bounds)));
    return new GateConfig(QualityThresholds.of(max, min), targets, ruleFiles, includeDefaults);
  }

  private static boolean parseBoolean(String key, String value) {
    return switch (value.toLowerCase(Locale.ROOT)) {
      case "true", "yes" -> true;
      case "false", "no" -> false;
      default -> throw new IllegalArgumentException(key + " must be true or false (was '" + value + "')");
    };
  }
}
