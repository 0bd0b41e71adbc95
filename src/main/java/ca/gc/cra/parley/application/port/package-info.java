/**
 * Ports through which the engine reaches time and metrics.
 * <p><strong>Role:</strong> Implemented by adapters under {@code ca.gc.cra.parley.infrastructure}.</p>
 */
package ca.gc.cra.parley.application.port;
