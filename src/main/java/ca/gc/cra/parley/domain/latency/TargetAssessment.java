package ca.gc.cra.parley.domain.latency;

import java.util.List;

/**
 * Result of comparing one metric against its latency targets. Never thrown; callers decide whether
 * a failure is fatal.
 *
 * <p>An empty sample set yields {@code pass=true} with {@code sampleCount=0}. Check {@link #noData()}
 * before reading a pass as evidence: it only means nothing breached a target.</p>
 *
 * @param metric metric that was assessed
 * @param pass {@code true} when no target was breached
 * @param failures one message per breached target
 * @param sampleCount number of samples the verdict rests on
 * @param notes informational messages such as the absence of samples
 * @param stats statistics the verdict was computed from
 * @since PARLEY 0.1.0
 */
public record TargetAssessment(
    String metric,
    boolean pass,
    List<String> failures,
    int sampleCount,
    List<String> notes,
    LatencyStats stats) {

  /**
   * Freezes the message lists.
   */
  public TargetAssessment {
    failures = List.copyOf(failures);
    notes = List.copyOf(notes);
  }

  /**
   * @return {@code true} when the metric had no samples, so the pass carries no evidence
   */
  public boolean noData() {
    return sampleCount == 0;
  }
}
