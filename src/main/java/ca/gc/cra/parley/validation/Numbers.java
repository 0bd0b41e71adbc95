package ca.gc.cra.parley.validation;

/**
 * <strong>What:</strong> Numeric validation and lenient parsing helpers.
 * <p><strong>Why:</strong> Telemetry attributes arrive as text extracted from log lines, while CLI and
 * configuration values must be rejected early with a readable message.</p>
 * <p><strong>Thread-safety:</strong> Immutable stateless utility.</p>
 *
 * @since PARLEY 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Parses a non-negative integer extracted from telemetry text.
   *
   * @param raw digits, possibly surrounded by whitespace; may be {@code null}
   * @param fallback value returned when {@code raw} is missing, malformed or negative
   * @return parsed value or {@code fallback}
   */
  public static int parseNonNegativeInt(String raw, int fallback) {
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    try {
      int value = Integer.parseInt(raw.trim());
      return value < 0 ? fallback : value;
    } catch (NumberFormatException ex) {
      return fallback;
    }
  }

  /**
   * Parses a number from configuration, accepting YAML numbers and numeric strings.
   *
   * @param name logical parameter name included in diagnostics
   * @param node YAML node
   * @return parsed value
   * @throws IllegalArgumentException when the node is not numeric
   */
  public static double toDouble(String name, Object node) {
    if (node instanceof Number number) {
      return number.doubleValue();
    }
    if (node instanceof String str && !str.isBlank()) {
      try {
        return Double.parseDouble(str.trim());
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException(label(name) + " must be numeric (was '" + str + "')", ex);
      }
    }
    throw new IllegalArgumentException(label(name) + " must be numeric (was " + node + ")");
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
