package ca.gc.cra.parley.domain.events;

/**
 * <strong>What:</strong> Typed conversation event produced by the classifier from one raw record.
 * <p><strong>Why:</strong> Consumers (turn state machine, barge-in detector, counters) switch on a
 * closed set of variants instead of re-inspecting free text.</p>
 * <p><strong>Thread-safety:</strong> All variants are immutable records.</p>
 *
 * @since PARLEY 0.1.0
 */
public sealed interface DomainEvent
    permits SpeechStarted,
        TranscriptComplete,
        ResponseStarted,
        ResponseComplete,
        StateTransition,
        BargeInProbe,
        BargeInCancelled,
        ErrorEvent,
        QueueOverflow,
        ScheduleReset {

  /**
   * @return originating timestamp in epoch milliseconds
   */
  long timestamp();

  /**
   * @return variant discriminator
   */
  EventKind kind();

  /**
   * Returns a copy of this event stamped with a different time. Used when the engine clamps
   * out-of-order timestamps.
   *
   * @param timestamp replacement timestamp in epoch milliseconds
   * @return event with the new timestamp
   */
  DomainEvent withTimestamp(long timestamp);
}
