package ca.gc.cra.parley.application.port;

/**
 * <strong>What:</strong> Port abstracting metrics emission for conversation telemetry.
 * <p><strong>Why:</strong> The aggregator mirrors its counters and latency samples without binding to a
 * vendor SDK, so a replay can export to OpenTelemetry while unit tests use {@link #NO_OP}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate calls from any thread.</p>
 *
 * @implNote Keys use dotted naming such as {@code parley.errors} or {@code parley.latency.turn}.
 * @since PARLEY 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key metric identifier; must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key metric identifier; must not be {@code null}
   * @param value observed value, milliseconds for latency keys
   */
  void observe(String key, long value);

  /**
   * Metrics implementation that ignores all updates.
   */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
