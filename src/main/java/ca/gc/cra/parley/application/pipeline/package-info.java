/**
 * Session engine facade and the thread-safe inbox and bounded waits used by external drivers.
 */
package ca.gc.cra.parley.application.pipeline;
