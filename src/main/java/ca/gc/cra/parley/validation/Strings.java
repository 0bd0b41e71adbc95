package ca.gc.cra.parley.validation;

import java.util.Locale;
import java.util.Objects;

/**
 * String validation and normalization helpers shared by the classifier, configuration and CLI layers.
 *
 * @since PARLEY 0.1.0
 * @see Numbers
 */
public final class Strings {
  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    for (int i = 0; i < trimmed.length(); i++) {
      if (Character.isISOControl(trimmed.charAt(i))) {
        throw new IllegalArgumentException(message(name, "must not contain control characters"));
      }
    }
    return trimmed;
  }

  /**
   * @param value candidate text
   * @return {@code true} for {@code null} or whitespace-only text
   */
  public static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  /**
   * @param value candidate text
   * @return {@code value}, or the empty string for {@code null}
   */
  public static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }

  /**
   * Parses a tri-state boolean from telemetry text.
   *
   * @param raw {@code true}/{@code false} in any case; may be {@code null}
   * @return parsed value, or {@code null} when {@code raw} is absent or not a boolean literal
   */
  public static Boolean parseBoolean(String raw) {
    if (raw == null) {
      return null;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "true" -> Boolean.TRUE;
      case "false" -> Boolean.FALSE;
      default -> null;
    };
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
