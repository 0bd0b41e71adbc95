/**
 * YAML gate configuration: quality thresholds, latency targets and operator rule files.
 */
package ca.gc.cra.parley.config;
