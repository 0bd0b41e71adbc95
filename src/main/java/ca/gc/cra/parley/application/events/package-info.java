/**
 * Classification of raw telemetry records into domain events: the free-text rule table and the
 * structured message mapper.
 */
package ca.gc.cra.parley.application.events;
