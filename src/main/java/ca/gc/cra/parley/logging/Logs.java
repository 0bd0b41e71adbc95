package ca.gc.cra.parley.logging;

/**
 * <strong>What:</strong> Logging hygiene helpers for raw telemetry.
 * <p><strong>Why:</strong> Transcript lines and websocket frames can be long and may contain user
 * speech, so DEBUG logs only ever carry a bounded prefix.</p>
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 *
 * @since PARLEY 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";

  /** Default character budget for telemetry text in log messages. */
  public static final int DEFAULT_MAX_CHARS = 160;

  private Logs() {
    // Utility
  }

  /**
   * Truncates a string to the requested number of characters, appending the original length.
   *
   * @param value string to truncate; {@code null} results in {@code "<null>"}
   * @param maxChars maximum number of characters to retain; must be positive
   * @return truncated string when the input exceeds {@code maxChars}; otherwise the original value
   * @throws IllegalArgumentException if {@code maxChars} is not positive
   */
  public static String truncate(String value, int maxChars) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxChars <= 0) {
      throw new IllegalArgumentException("maxChars must be positive");
    }
    String singleLine = value.replace('\n', ' ').replace('\r', ' ');
    if (singleLine.length() <= maxChars) {
      return singleLine;
    }
    int end = maxChars;
    if (Character.isHighSurrogate(singleLine.charAt(end - 1))) {
      end--;
    }
    return singleLine.substring(0, end) + "... (truncated, " + end + " of " + singleLine.length() + ")";
  }

  /**
   * Truncates with {@link #DEFAULT_MAX_CHARS}.
   *
   * @param value string to truncate
   * @return bounded single-line text
   */
  public static String truncate(String value) {
    return truncate(value, DEFAULT_MAX_CHARS);
  }
}
