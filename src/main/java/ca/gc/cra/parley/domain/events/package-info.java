/**
 * <strong>Purpose:</strong> Closed set of typed conversation events.
 * <p><strong>Pipeline role:</strong> Output of the classifier and the only input of the turn state
 * machine, barge-in detector and counters.
 * <p><strong>Concurrency:</strong> Immutable records.
 *
 * @since PARLEY 0.1.0
 */
package ca.gc.cra.parley.domain.events;
