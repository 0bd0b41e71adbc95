package ca.gc.cra.parley.domain.telemetry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> One timestamped observation pulled from the live conversational system.
 * <p><strong>Why:</strong> The engine only ever sees the telemetry stream through this type, so the
 * external driver can feed console lines and websocket frames without the engine knowing where they
 * came from.</p>
 * <p><strong>Thread-safety:</strong> Immutable; the payload map is copied on construction.</p>
 *
 * @param receivedAt receipt time in epoch milliseconds as seen by the driver
 * @param source channel the record arrived on; never {@code null}
 * @param level severity attached by the emitter; never {@code null}
 * @param text free text (LOG) or raw JSON (MESSAGE without parsed payload); may be {@code null}
 * @param payload parsed structured message; {@code null} for free-text records
 * @since PARLEY 0.1.0
 */
public record RawRecord(
    long receivedAt,
    RecordSource source,
    RecordLevel level,
    String text,
    Map<String, Object> payload) {

  /**
   * Validates required fields and freezes the payload.
   */
  public RawRecord {
    source = Objects.requireNonNull(source, "source");
    level = level == null ? RecordLevel.INFO : level;
    if (payload != null) {
      payload = Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }
    if (text == null && payload == null) {
      throw new IllegalArgumentException("record must carry text or a structured payload");
    }
  }

  /**
   * Creates an INFO-level free-text record.
   *
   * @param receivedAt receipt time in epoch milliseconds
   * @param text diagnostic line
   * @return log record
   */
  public static RawRecord log(long receivedAt, String text) {
    return new RawRecord(receivedAt, RecordSource.LOG, RecordLevel.INFO, Objects.requireNonNull(text, "text"), null);
  }

  /**
   * Creates a free-text record with an explicit level.
   *
   * @param receivedAt receipt time in epoch milliseconds
   * @param level emitter severity
   * @param text diagnostic line
   * @return log record
   */
  public static RawRecord log(long receivedAt, RecordLevel level, String text) {
    return new RawRecord(receivedAt, RecordSource.LOG, level, Objects.requireNonNull(text, "text"), null);
  }

  /**
   * Creates a structured message record from an already parsed payload.
   *
   * @param receivedAt receipt time in epoch milliseconds
   * @param message message map holding {@code type}, {@code timestamp}, {@code direction}, {@code payload}
   * @return message record
   */
  public static RawRecord message(long receivedAt, Map<String, Object> message) {
    return new RawRecord(receivedAt, RecordSource.MESSAGE, RecordLevel.INFO, null,
        Objects.requireNonNull(message, "message"));
  }

  /**
   * Creates a structured message record whose JSON has not been parsed yet.
   *
   * @param receivedAt receipt time in epoch milliseconds
   * @param json raw JSON object text
   * @return message record; the classifier parses (or rejects) the JSON
   */
  public static RawRecord messageJson(long receivedAt, String json) {
    return new RawRecord(receivedAt, RecordSource.MESSAGE, RecordLevel.INFO,
        Objects.requireNonNull(json, "json"), null);
  }

  /**
   * @return {@code true} when this record is a structured message
   */
  public boolean structured() {
    return source == RecordSource.MESSAGE;
  }
}
