/**
 * <strong>Purpose:</strong> Raw telemetry records exactly as the external driver hands them over.
 * <p><strong>Pipeline role:</strong> Input boundary of the engine; nothing here is interpreted.
 * <p><strong>Concurrency:</strong> Immutable value types.
 *
 * @since PARLEY 0.1.0
 */
package ca.gc.cra.parley.domain.telemetry;
