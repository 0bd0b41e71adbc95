package ca.gc.cra.parley.application.pipeline;

import ca.gc.cra.parley.domain.telemetry.RawRecord;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Thread-safe hand-off between telemetry producers (console and websocket listeners) and the thread
 * that owns a {@link TelemetryEngine}. Producers call {@link #offer(RawRecord)} from any thread;
 * only the owner calls {@link #drainTo(TelemetryEngine)}.
 *
 * @since PARLEY 0.1.0
 */
public final class RecordInbox {
  private final BlockingQueue<RawRecord> queue = new LinkedBlockingQueue<>();

  /**
   * @param record record to enqueue; never blocks
   */
  public void offer(RawRecord record) {
    queue.add(Objects.requireNonNull(record, "record"));
  }

  /**
   * Feeds every queued record into the engine, in arrival order.
   *
   * @param engine engine owned by the calling thread
   * @return number of records drained
   */
  public int drainTo(TelemetryEngine engine) {
    List<RawRecord> batch = new ArrayList<>();
    queue.drainTo(batch);
    for (RawRecord record : batch) {
      engine.recordEvent(record);
    }
    return batch.size();
  }

  /**
   * @return records waiting to be drained
   */
  public int pending() {
    return queue.size();
  }
}
