package ca.gc.cra.parley.application.gate;

import java.util.Locale;

/**
 * Conversation counters in summary order. {@link #key()} is the name used in thresholds, summaries
 * and metric keys.
 *
 * @since PARLEY 0.1.0
 */
public enum Counter {
  RECORDS_PROCESSED("recordsProcessed"),
  MALFORMED_RECORDS("malformedRecords"),
  IGNORED_EVENTS("ignoredEvents"),
  TOTAL_TURNS("totalTurns"),
  USER_UTTERANCES("userUtterances"),
  AI_RESPONSES("aiResponses"),
  BARGE_IN_ATTEMPTS("bargeInAttempts"),
  SUCCESSFUL_BARGE_INS("successfulBargeIns"),
  FALSE_BARGE_INS("falseBargeIns"),
  ERRORS("errors"),
  QUEUE_OVERFLOWS("queueOverflows"),
  SCHEDULE_RESETS("scheduleResets");

  private final String key;

  Counter(String key) {
    this.key = key;
  }

  /**
   * @return camel-case name such as {@code queueOverflows}
   */
  public String key() {
    return key;
  }

  /**
   * @return metric key such as {@code parley.queue_overflows}
   */
  public String metricKey() {
    return "parley." + name().toLowerCase(Locale.ROOT);
  }

  /**
   * @param key camel-case name
   * @return matching counter, or {@code null}
   */
  public static Counter fromKey(String key) {
    for (Counter counter : values()) {
      if (counter.key.equals(key)) {
        return counter;
      }
    }
    return null;
  }
}
