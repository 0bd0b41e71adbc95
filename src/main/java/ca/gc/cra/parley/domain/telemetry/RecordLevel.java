package ca.gc.cra.parley.domain.telemetry;

import java.util.Locale;

/**
 * Severity reported by the emitting process for a diagnostic line.
 *
 * @since PARLEY 0.1.0
 */
public enum RecordLevel {
  DEBUG,
  INFO,
  WARN,
  ERROR;

  /**
   * Parses a console/log level token, tolerating the common aliases emitted by browsers and
   * logging frameworks.
   *
   * @param raw level token such as {@code error}, {@code warning} or {@code log}; may be {@code null}
   * @return parsed level, {@link #INFO} when the token is blank or unknown
   */
  public static RecordLevel parse(String raw) {
    if (raw == null || raw.isBlank()) {
      return INFO;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "debug", "trace", "verbose" -> DEBUG;
      case "warn", "warning" -> WARN;
      case "error", "err", "fatal", "severe" -> ERROR;
      default -> INFO;
    };
  }
}
