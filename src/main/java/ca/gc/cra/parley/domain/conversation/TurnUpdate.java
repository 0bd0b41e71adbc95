package ca.gc.cra.parley.domain.conversation;

/**
 * Effect of one event on the {@link TurnStateMachine}.
 *
 * @since PARLEY 0.1.0
 */
public enum TurnUpdate {
  /** The open turn moved forward or recorded new data. */
  ADVANCED,
  /** The event was irrelevant or a repeat of something already recorded. */
  UNCHANGED,
  /** The event arrived before its precondition and was rejected by a guard. */
  IGNORED,
  /** The open turn was sealed and a new turn opened. */
  SEALED
}
