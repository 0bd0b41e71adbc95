package ca.gc.cra.parley.application.gate;

import ca.gc.cra.parley.domain.bargein.BargeInOutcome;
import ca.gc.cra.parley.domain.conversation.Turn;
import ca.gc.cra.parley.domain.latency.LatencyStats;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Renders the multi-line session report. Output depends only on its inputs: counters in
 * {@link Counter} order, latency metrics sorted by name, turns in index order.
 *
 * @since PARLEY 0.1.0
 */
public final class SummaryRenderer {
  private static final int MAX_TRANSCRIPT_CHARS = 60;

  private SummaryRenderer() {
    // Utility
  }

  /**
   * @param metrics metrics snapshot
   * @param turns completed turns
   * @param openTurn turn still in progress
   * @param bargeIn barge-in classification
   * @return report ending with a newline
   */
  public static String render(ConversationMetrics metrics, List<Turn> turns, Turn openTurn, BargeInOutcome bargeIn) {
    StringBuilder out = new StringBuilder(512);
    out.append("=== Conversation Summary ===\n");
    out.append("Counters:\n");
    for (Map.Entry<Counter, Long> entry : metrics.counters().entrySet()) {
      out.append("  ").append(entry.getKey().key()).append(": ").append(entry.getValue()).append('\n');
    }
    out.append("Averages:\n");
    for (String name : ConversationMetrics.AVERAGES) {
      out.append("  ").append(name).append(": ");
      metrics.value(name).ifPresentOrElse(
          value -> out.append(String.format(Locale.ROOT, "%.1f", value)),
          () -> out.append("n/a"));
      out.append('\n');
    }
    out.append("Latency:\n");
    if (metrics.latency().isEmpty()) {
      out.append("  (no samples)\n");
    }
    for (Map.Entry<String, LatencyStats> entry : metrics.latency().entrySet()) {
      out.append("  ").append(entry.getKey()).append(": ").append(entry.getValue().describe()).append('\n');
    }
    out.append("Barge-in: confirmed=").append(bargeIn.confirmed())
        .append(" attempted=").append(bargeIn.attempted())
        .append(" latencyMs=").append(bargeIn.latencyMs() == null ? "n/a" : bargeIn.latencyMs().toString())
        .append(" confirmedCount=").append(bargeIn.confirmedCount())
        .append(" attemptCount=").append(bargeIn.attemptCount())
        .append(" classification=")
        .append(bargeIn.classification() == null ? "n/a" : bargeIn.classification().wireName())
        .append('\n');
    out.append("Turns:\n");
    if (turns.isEmpty()) {
      out.append("  (none completed)\n");
    }
    for (Turn turn : turns) {
      out.append("  #").append(turn.index())
          .append(" transcript=\"").append(clip(turn.transcriptText())).append('"')
          .append(" turnLatencyMs=").append(format(turn.turnLatencyMs()))
          .append(" responseLatencyMs=").append(format(turn.responseLatencyMs()))
          .append(" transitions=").append(turn.transitions().size())
          .append('\n');
    }
    out.append("Open turn: #").append(openTurn.index()).append(' ').append(openTurn.phase()).append('\n');
    return out.toString();
  }

  private static String clip(String text) {
    if (text == null) {
      return "";
    }
    String single = text.replace('\n', ' ').replace('"', '\'');
    return single.length() <= MAX_TRANSCRIPT_CHARS ? single : single.substring(0, MAX_TRANSCRIPT_CHARS) + "...";
  }

  private static String format(OptionalLong value) {
    return value.isPresent() ? Long.toString(value.getAsLong()) : "n/a";
  }
}
