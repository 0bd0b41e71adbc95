/**
 * <strong>Purpose:</strong> Turn reconstruction for one conversation session.
 * <p><strong>Pipeline role:</strong> Consumes classified events and exposes completed turns plus a
 * stuck diagnosis that callers use when a deadline elapses.
 * <p><strong>Concurrency:</strong> Single-owner mutable state; snapshots are immutable.
 *
 * @since PARLEY 0.1.0
 */
package ca.gc.cra.parley.domain.conversation;
