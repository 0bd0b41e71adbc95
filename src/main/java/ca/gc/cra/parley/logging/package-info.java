/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and bound telemetry text before emission.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no custom metrics.
 *
 * @since PARLEY 0.1.0
 */
package ca.gc.cra.parley.logging;
