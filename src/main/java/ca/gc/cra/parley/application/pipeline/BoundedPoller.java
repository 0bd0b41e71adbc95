package ca.gc.cra.parley.application.pipeline;

import ca.gc.cra.parley.application.port.ClockPort;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Waits for a condition on the engine without the engine ever blocking: drains the inbox, checks the
 * condition, then sleeps one interval, until the deadline.
 *
 * <p>Timeouts are reported through {@link WaitOutcome}, never thrown. An interrupt ends the wait
 * and restores the thread's interrupt flag.</p>
 *
 * @since PARLEY 0.1.0
 */
public final class BoundedPoller {
  /** Default pause between checks. */
  public static final Duration DEFAULT_INTERVAL = Duration.ofMillis(50);

  private final TelemetryEngine engine;
  private final RecordInbox inbox;
  private final ClockPort clock;
  private final long intervalMs;

  /**
   * @param engine engine owned by the calling thread
   * @param inbox inbox producers write to
   * @param clock time source; tests supply a virtual clock
   * @param interval pause between checks; must be positive
   */
  public BoundedPoller(TelemetryEngine engine, RecordInbox inbox, ClockPort clock, Duration interval) {
    this.engine = Objects.requireNonNull(engine, "engine");
    this.inbox = Objects.requireNonNull(inbox, "inbox");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.intervalMs = Objects.requireNonNull(interval, "interval").toMillis();
    if (intervalMs <= 0) {
      throw new IllegalArgumentException("interval must be positive (was " + interval + ")");
    }
  }

  /**
   * @param condition condition evaluated on the engine after each drain
   * @param timeout maximum wait; zero checks once; values past the clock's range wait indefinitely
   * @return how the wait ended
   */
  public WaitOutcome await(Predicate<TelemetryEngine> condition, Duration timeout) {
    Objects.requireNonNull(condition, "condition");
    Objects.requireNonNull(timeout, "timeout");
    long start = clock.nowMillis();
    long deadline = deadline(start, timeout);
    while (true) {
      inbox.drainTo(engine);
      long now = clock.nowMillis();
      if (condition.test(engine)) {
        return new WaitOutcome(WaitOutcome.Status.SATISFIED, now - start);
      }
      if (now >= deadline) {
        return new WaitOutcome(WaitOutcome.Status.TIMED_OUT, now - start);
      }
      try {
        clock.sleep(Math.min(intervalMs, deadline - now));
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        return new WaitOutcome(WaitOutcome.Status.INTERRUPTED, clock.nowMillis() - start);
      }
    }
  }

  // Saturates at Long.MAX_VALUE instead of wrapping into the past.
  private static long deadline(long start, Duration timeout) {
    if (timeout.isNegative() || timeout.isZero()) {
      return start;
    }
    try {
      return Math.addExact(start, timeout.toMillis());
    } catch (ArithmeticException ex) {
      return Long.MAX_VALUE;
    }
  }

  /**
   * @return engine this poller feeds
   */
  public TelemetryEngine engine() {
    return engine;
  }
}
