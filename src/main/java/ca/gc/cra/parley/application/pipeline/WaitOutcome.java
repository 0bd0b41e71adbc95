package ca.gc.cra.parley.application.pipeline;

/**
 * Result of a bounded wait.
 *
 * @param status how the wait ended
 * @param elapsedMs time spent waiting
 * @since PARLEY 0.1.0
 */
public record WaitOutcome(Status status, long elapsedMs) {
  /** How a wait ended. */
  public enum Status {
    SATISFIED,
    TIMED_OUT,
    INTERRUPTED
  }

  /**
   * @return {@code true} when the condition held before the deadline
   */
  public boolean satisfied() {
    return status == Status.SATISFIED;
  }
}
