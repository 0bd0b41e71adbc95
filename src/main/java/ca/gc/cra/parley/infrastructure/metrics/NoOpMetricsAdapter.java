package ca.gc.cra.parley.infrastructure.metrics;

import ca.gc.cra.parley.application.port.MetricsPort;

/**
 * Metrics adapter that discards all observations, selected by {@code --metrics=none}.
 *
 * @since PARLEY 0.1.0
 */
public final class NoOpMetricsAdapter implements MetricsPort {
  @Override
  public void increment(String key) {}

  @Override
  public void observe(String key, long value) {}
}
