package ca.gc.cra.parley.application.pipeline;

import java.time.Duration;
import java.util.Objects;

/**
 * Turn-level waits for the external driver. Whether a timeout fails the test is the caller's call;
 * this class only reports where the conversation stopped.
 *
 * @since PARLEY 0.1.0
 */
public final class TurnAwaiter {
  private final BoundedPoller poller;

  /**
   * @param poller poller bound to the engine
   */
  public TurnAwaiter(BoundedPoller poller) {
    this.poller = Objects.requireNonNull(poller, "poller");
  }

  /**
   * Waits until at least {@code count} turns are sealed.
   *
   * @param count turns required
   * @param timeout maximum wait
   * @return partial state plus the stuck diagnosis on timeout
   */
  public TurnWaitResult awaitCompletedTurns(int count, Duration timeout) {
    WaitOutcome outcome = poller.await(engine -> engine.getTurns().size() >= count, timeout);
    return snapshot(outcome);
  }

  /**
   * Waits until one more turn than currently completed is sealed.
   *
   * @param timeout maximum wait
   * @return partial state plus the stuck diagnosis on timeout
   */
  public TurnWaitResult awaitNextTurn(Duration timeout) {
    return awaitCompletedTurns(poller.engine().getTurns().size() + 1, timeout);
  }

  /**
   * Waits until a barge-in is confirmed by an explicit {@code reason=barge_in} transition.
   *
   * @param timeout maximum wait
   * @return partial state; the diagnosis describes the open turn when the wait failed
   */
  public TurnWaitResult awaitConfirmedBargeIn(Duration timeout) {
    WaitOutcome outcome = poller.await(engine -> engine.getBargeInOutcome().confirmed(), timeout);
    return snapshot(outcome);
  }

  private TurnWaitResult snapshot(WaitOutcome outcome) {
    TelemetryEngine engine = poller.engine();
    return new TurnWaitResult(
        outcome,
        engine.getTurns(),
        engine.getCurrentTurn(),
        outcome.satisfied() ? null : engine.diagnose());
  }
}
