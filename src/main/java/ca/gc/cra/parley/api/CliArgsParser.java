package ca.gc.cra.parley.api;

import ca.gc.cra.parley.validation.Strings;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Utility for turning {@code key=value} CLI arguments into a lookup map.
 * <p>Stateless and thread-safe.</p>
 *
 * @since PARLEY 0.1.0
 */
public final class CliArgsParser {
  private static final Pattern KEY_PATTERN = Pattern.compile("^[A-Za-z0-9._-]+$");

  private CliArgsParser() {
    // Utility
  }

  /**
   * Converts command-line arguments into a mutable map split on the first {@code '='}.
   *
   * @param args raw CLI arguments; {@code null} returns an empty map
   * @return mutable map in argument order; a repeated key keeps its last value
   * @throws IllegalArgumentException when an argument is not {@code key=value} or carries control
   *     characters
   */
  public static Map<String, String> toMap(String[] args) {
    Map<String, String> map = new LinkedHashMap<>();
    if (args == null) {
      return map;
    }
    for (String raw : args) {
      if (raw == null) {
        continue;
      }
      String arg = raw.trim();
      if (arg.isEmpty()) {
        continue;
      }
      int idx = arg.indexOf('=');
      if (idx <= 0 || idx == arg.length() - 1) {
        throw new IllegalArgumentException("argument must be key=value (was '" + raw + "')");
      }
      String key = arg.substring(0, idx).trim();
      String value = arg.substring(idx + 1).trim();
      validateKey(key);
      validateValue(key, value);
      map.put(key, value);
    }
    return map;
  }

  private static void validateKey(String key) {
    if (!KEY_PATTERN.matcher(key).matches()) {
      throw new IllegalArgumentException("invalid argument name: " + key);
    }
  }

  private static void validateValue(String key, String value) {
    if (containsControl(value)) {
      throw new IllegalArgumentException("argument " + key + " must not contain control characters");
    }
    Strings.requireNonBlank(key, value);
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }
}
