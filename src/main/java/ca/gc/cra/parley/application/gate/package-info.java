/**
 * Counters, derived averages, quality thresholds and the session report.
 */
package ca.gc.cra.parley.application.gate;
