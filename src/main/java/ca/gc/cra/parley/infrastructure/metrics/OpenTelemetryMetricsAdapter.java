package ca.gc.cra.parley.infrastructure.metrics;

import ca.gc.cra.parley.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metrics adapter that forwards conversation counters and latency histograms to OpenTelemetry.
 * Keys under {@code parley.latency.} are recorded with unit {@code ms}.
 *
 * @since PARLEY 0.1.0
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY_ATTRIBUTE = AttributeKey.stringKey("parley.metric.key");
  private static final String FALLBACK_METRIC_NAME = "parley.metric";
  private static final String LATENCY_PREFIX = "parley.latency.";

  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;
  private final Meter meter;
  private final ConcurrentMap<String, CounterInstrument> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, HistogramInstrument> histograms = new ConcurrentHashMap<>();

  /**
   * Creates an adapter wired to the environment-configured OpenTelemetry exporter.
   */
  public OpenTelemetryMetricsAdapter() {
    this(OpenTelemetryBootstrap.initialize());
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    this.meter = bootstrap.meter();
    if (bootstrap.isNoop()) {
      log.info("OpenTelemetry metrics adapter running in noop mode");
    }
  }

  @Override
  public void increment(String key) {
    String effectiveKey = Objects.requireNonNull(key, "key");
    CounterInstrument instrument = counters.computeIfAbsent(effectiveKey, this::createCounter);
    instrument.counter().add(1, instrument.attributes());
  }

  @Override
  public void observe(String key, long value) {
    String effectiveKey = Objects.requireNonNull(key, "key");
    HistogramInstrument instrument = histograms.computeIfAbsent(effectiveKey, this::createHistogram);
    instrument.histogram().record(value, instrument.attributes());
  }

  /**
   * Pushes pending measurements to the exporter.
   */
  public void forceFlush() {
    bootstrap.forceFlush();
  }

  /**
   * Shuts the meter provider down.
   */
  @Override
  public void close() {
    bootstrap.close();
  }

  private CounterInstrument createCounter(String key) {
    LongCounter counter = meter
        .counterBuilder(sanitizeName(key))
        .setUnit("1")
        .setDescription("Conversation counter for " + key)
        .build();
    return new CounterInstrument(counter, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  private HistogramInstrument createHistogram(String key) {
    LongHistogram histogram = meter
        .histogramBuilder(sanitizeName(key))
        .ofLongs()
        .setUnit(key.startsWith(LATENCY_PREFIX) ? "ms" : "1")
        .setDescription("Conversation observation for " + key)
        .build();
    return new HistogramInstrument(histogram, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  static String sanitizeName(String key) {
    if (key == null || key.isBlank()) {
      return FALLBACK_METRIC_NAME;
    }
    String lower = key.trim().toLowerCase(Locale.ROOT);
    StringBuilder result = new StringBuilder(lower.length() + 1);
    if (!Character.isLetter(lower.charAt(0))) {
      result.append('m');
    }
    for (int i = 0; i < lower.length(); i++) {
      char c = lower.charAt(i);
      result.append(Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' ? c : '_');
    }
    return result.toString();
  }

  private record CounterInstrument(LongCounter counter, Attributes attributes) {}

  private record HistogramInstrument(LongHistogram histogram, Attributes attributes) {}
}
