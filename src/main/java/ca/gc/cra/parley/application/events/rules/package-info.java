/**
 * YAML-declared rule table that classifies free-text telemetry lines.
 */
package ca.gc.cra.parley.application.events.rules;
