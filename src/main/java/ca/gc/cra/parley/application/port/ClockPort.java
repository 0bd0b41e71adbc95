package ca.gc.cra.parley.application.port;

/**
 * Source of wall-clock time for session start stamps and bounded waits.
 *
 * @since PARLEY 0.1.0
 */
public interface ClockPort {
  /**
   * @return current epoch milliseconds
   */
  long nowMillis();

  /**
   * Pauses the calling thread. Test clocks override this to advance virtual time instead.
   *
   * @param millis pause length; non-positive values return immediately
   * @throws InterruptedException when the thread is interrupted while sleeping
   */
  default void sleep(long millis) throws InterruptedException {
    if (millis > 0) {
      Thread.sleep(millis);
    }
  }

  /** Clock backed by {@link System#currentTimeMillis()}. */
  ClockPort SYSTEM = System::currentTimeMillis;
}
