package ca.gc.cra.parley.domain.events;

import java.util.Locale;

/**
 * How the client judged an interruption once it heard the user.
 *
 * @since PARLEY 0.1.0
 */
public enum BargeInClassification {
  /** Short acknowledgement such as "mm-hm"; playback continues. */
  BACKCHANNEL("backchannel"),
  /** Tentative interruption; playback ducks. */
  SOFT_BARGE("soft_barge"),
  /** Full interruption; playback stops. */
  HARD_BARGE("hard_barge"),
  /** Classifier reported no usable verdict. */
  UNCLEAR("unclear");

  private final String wireName;

  BargeInClassification(String wireName) {
    this.wireName = wireName;
  }

  /**
   * @return lower-case name used in telemetry and summaries
   */
  public String wireName() {
    return wireName;
  }

  /**
   * Reads a classification token. Matching is by keyword so that {@code soft}, {@code soft_barge}
   * and {@code SOFT-BARGE} are all accepted.
   *
   * @param raw token; may be {@code null}
   * @return parsed classification, {@link #UNCLEAR} when blank or unrecognised
   */
  public static BargeInClassification parse(String raw) {
    if (raw == null || raw.isBlank()) {
      return UNCLEAR;
    }
    String lower = raw.trim().toLowerCase(Locale.ROOT);
    if (lower.contains("backchannel")) {
      return BACKCHANNEL;
    }
    if (lower.contains("soft")) {
      return SOFT_BARGE;
    }
    if (lower.contains("hard")) {
      return HARD_BARGE;
    }
    return UNCLEAR;
  }
}
