/**
 * Metrics adapters that bridge {@link ca.gc.cra.parley.application.port.MetricsPort} to
 * OpenTelemetry or a no-op implementation.
 * <p><strong>Metrics:</strong> Counters under {@code parley.*}, latency histograms under
 * {@code parley.latency.*}.</p>
 * <p><strong>Security:</strong> Only metric names are exported, never transcript text.</p>
 */
package ca.gc.cra.parley.infrastructure.metrics;
