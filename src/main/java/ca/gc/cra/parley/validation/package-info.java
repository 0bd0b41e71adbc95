/**
 * <strong>Purpose:</strong> Input validation and lenient parsing helpers.
 * <p><strong>Concurrency:</strong> Stateless; safe from any thread.
 *
 * @since PARLEY 0.1.0
 */
package ca.gc.cra.parley.validation;
