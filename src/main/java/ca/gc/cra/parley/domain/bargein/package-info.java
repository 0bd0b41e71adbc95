/**
 * Interruption (barge-in) detection. Confirmed and attempted interruptions are tracked separately
 * and never merged.
 *
 * @since PARLEY 0.1.0
 */
package ca.gc.cra.parley.domain.bargein;
