package ca.gc.cra.parley.application.gate;

import ca.gc.cra.parley.application.port.MetricsPort;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class RecordingMetricsPort implements MetricsPort {
  final Map<String, Long> counters = new LinkedHashMap<>();
  final Map<String, List<Long>> observations = new LinkedHashMap<>();

  @Override
  public void increment(String key) {
    counters.merge(key, 1L, Long::sum);
  }

  @Override
  public void observe(String key, long value) {
    observations.computeIfAbsent(key, k -> new ArrayList<>()).add(value);
  }
}
