package ca.gc.cra.parley.domain.telemetry;

/**
 * Channel a {@link RawRecord} was observed on.
 *
 * @since PARLEY 0.1.0
 */
public enum RecordSource {
  /** Free-text diagnostic line without a fixed schema. */
  LOG,
  /** Structured {@code {type, timestamp, direction, payload}} message. */
  MESSAGE
}
