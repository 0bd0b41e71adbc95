/**
 * Latency sample sets, nearest-rank percentile statistics and target assessment.
 */
package ca.gc.cra.parley.domain.latency;
