package ca.gc.cra.parley.domain.bargein;

import ca.gc.cra.parley.domain.events.BargeInClassification;
import ca.gc.cra.parley.domain.events.BargeInProbe;
import ca.gc.cra.parley.domain.events.DomainEvent;
import ca.gc.cra.parley.domain.events.ResponseComplete;
import ca.gc.cra.parley.domain.events.ResponseStarted;
import ca.gc.cra.parley.domain.events.SpeechStarted;
import ca.gc.cra.parley.domain.events.StateTransition;

/**
 * <strong>What:</strong> Separates confirmed interruptions from circumstantial ones.
 * <p><strong>Signals:</strong>
 * <ul>
 *   <li>Confirmed: a {@link StateTransition} whose reason is exactly {@code barge_in}. A
 *   {@code natural} reason never confirms, whatever else was seen.</li>
 *   <li>Attempted: {@link SpeechStarted} while a response is playing (started, not completed), or a
 *   {@link BargeInProbe} with {@code willTrigger=true}.</li>
 * </ul>
 * <p><strong>Latency:</strong> measured from the qualifying speech to the nearest following
 * transition or response completion; later events never stretch it. An episode that resolves without
 * qualifying speech leaves the last measured latency in place.</p>
 * <p><strong>Classification:</strong> the most recent verdict carried by a {@link BargeInProbe}.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; owned by the engine thread.</p>
 *
 * @since PARLEY 0.1.0
 */
public final class BargeInDetector {
  private static final String SPEAKING = "speaking";

  private boolean responseActive;
  private boolean episodeOpen;
  private Long pendingSpeechAt;
  private boolean confirmed;
  private boolean attempted;
  private Long latencyMs;
  private BargeInClassification classification;
  private int confirmedCount;
  private int attemptCount;

  /**
   * Applies one classified event.
   *
   * @param event event to inspect
   * @return bookkeeping delta for counters and histograms
   */
  public BargeInUpdate apply(DomainEvent event) {
    if (event instanceof ResponseStarted) {
      responseActive = true;
      return BargeInUpdate.NONE;
    }
    if (event instanceof SpeechStarted speech) {
      if (!responseActive) {
        return BargeInUpdate.NONE;
      }
      attempted = true;
      if (pendingSpeechAt == null) {
        pendingSpeechAt = speech.timestamp();
      }
      return new BargeInUpdate(openEpisode(), false, null);
    }
    if (event instanceof BargeInProbe probe) {
      if (probe.classification() != null) {
        classification = probe.classification();
      }
      if (!probe.willTrigger()) {
        return BargeInUpdate.NONE;
      }
      attempted = true;
      return new BargeInUpdate(openEpisode(), false, null);
    }
    if (event instanceof StateTransition transition) {
      Long resolved = resolvePending(transition.timestamp());
      if (SPEAKING.equals(transition.from())) {
        responseActive = false;
      } else if (SPEAKING.equals(transition.to())) {
        responseActive = true;
      }
      if (transition.isBargeIn()) {
        confirmed = true;
        confirmedCount++;
        return new BargeInUpdate(false, true, resolved);
      }
      return resolved == null ? BargeInUpdate.NONE : new BargeInUpdate(false, false, resolved);
    }
    if (event instanceof ResponseComplete complete) {
      responseActive = false;
      Long resolved = resolvePending(complete.timestamp());
      return resolved == null ? BargeInUpdate.NONE : new BargeInUpdate(false, false, resolved);
    }
    return BargeInUpdate.NONE;
  }

  private boolean openEpisode() {
    if (episodeOpen) {
      return false;
    }
    episodeOpen = true;
    attemptCount++;
    return true;
  }

  private Long resolvePending(long stopAt) {
    episodeOpen = false;
    if (pendingSpeechAt == null) {
      return null;
    }
    long latency = Math.max(0L, stopAt - pendingSpeechAt);
    pendingSpeechAt = null;
    latencyMs = latency;
    return latency;
  }

  /**
   * @return {@code true} while a response has started and not yet completed
   */
  public boolean responseActive() {
    return responseActive;
  }

  /**
   * @return classification so far
   */
  public BargeInOutcome outcome() {
    return new BargeInOutcome(confirmed, attempted, latencyMs, confirmedCount, attemptCount, classification);
  }
}
