/**
 * File-based record source used by the replay CLI.
 */
package ca.gc.cra.parley.infrastructure.replay;
