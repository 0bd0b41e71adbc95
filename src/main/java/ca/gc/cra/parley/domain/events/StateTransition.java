package ca.gc.cra.parley.domain.events;

import java.util.Locale;
import java.util.Objects;

/**
 * Pipeline state change such as {@code speaking -> listening}, optionally tagged with the reason
 * reported by the system.
 *
 * @param timestamp event time in epoch milliseconds
 * @param from previous state, lower case; never {@code null} ({@code unknown} when not reported)
 * @param to new state, lower case; never {@code null}
 * @param reason reported reason such as {@code barge_in} or {@code natural}; {@code null} when absent
 * @since PARLEY 0.1.0
 */
public record StateTransition(long timestamp, String from, String to, String reason) implements DomainEvent {
  /** Reason tag reported when user speech interrupted the response. */
  public static final String REASON_BARGE_IN = "barge_in";
  /** Reason tag reported when the response finished on its own. */
  public static final String REASON_NATURAL = "natural";
  /** Placeholder for a previous state that was never observed. */
  public static final String UNKNOWN_STATE = "unknown";

  /**
   * Normalises state names and the reason tag.
   */
  public StateTransition {
    from = from == null || from.isBlank() ? UNKNOWN_STATE : from.trim().toLowerCase(Locale.ROOT);
    to = Objects.requireNonNull(to, "to").trim().toLowerCase(Locale.ROOT);
    reason = reason == null || reason.isBlank() ? null : reason.trim().toLowerCase(Locale.ROOT);
  }

  @Override
  public EventKind kind() {
    return EventKind.STATE_TRANSITION;
  }

  @Override
  public StateTransition withTimestamp(long timestamp) {
    return new StateTransition(timestamp, from, to, reason);
  }

  /**
   * @return {@code true} only for an explicit {@code reason=barge_in} tag
   */
  public boolean isBargeIn() {
    return REASON_BARGE_IN.equals(reason);
  }
}
