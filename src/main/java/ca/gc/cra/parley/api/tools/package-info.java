/**
 * Auxiliary CLI tools for PARLEY operators.
 * <p><strong>Role:</strong> Adapter-side utilities built on the classification pipeline.</p>
 * <p><strong>Concurrency:</strong> Commands run single-threaded.</p>
 */
package ca.gc.cra.parley.api.tools;
