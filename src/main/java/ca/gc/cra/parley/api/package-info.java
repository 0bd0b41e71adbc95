/**
 * Command-line entry points: {@code parley replay} runs a recorded conversation through the
 * telemetry engine and gates on the result, {@code parley rules} dry-runs the classification table.
 * <p><strong>Role:</strong> Adapter layer on the driving side; parses arguments, configures logging
 * and metrics export, and maps failures to {@link ca.gc.cra.parley.api.ExitCode} values.</p>
 */
package ca.gc.cra.parley.api;
