package ca.gc.cra.parley.api;

import ca.gc.cra.parley.application.port.MetricsPort;
import ca.gc.cra.parley.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.parley.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies metrics-export CLI settings and builds the matching {@link MetricsPort}.
 * <p>{@code metrics=otlp} exports through OpenTelemetry; {@code otelEndpoint} overrides
 * {@code OTEL_EXPORTER_OTLP_ENDPOINT}. Replays default to {@code metrics=none}.</p>
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);

  private TelemetryConfigurator() {
    // Utility
  }

  /**
   * Consumes {@code metrics} and {@code otelEndpoint} from {@code args}.
   *
   * @param args mutable CLI options; recognised keys are removed
   * @return metrics port to hand to the engine; callers close it when it is {@link AutoCloseable}
   * @throws IllegalArgumentException when a value is invalid
   */
  static MetricsPort configureMetrics(Map<String, String> args) {
    String exporter = args.remove("metrics");
    String normalized = exporter == null ? "none" : exporter.trim().toLowerCase(Locale.ROOT);
    if (!normalized.equals("otlp") && !normalized.equals("none")) {
      throw new IllegalArgumentException("metrics must be 'otlp' or 'none'");
    }

    String endpoint = args.remove("otelEndpoint");
    if (endpoint != null) {
      validateEndpoint(endpoint.trim());
      log.debug("Configuring OTLP endpoint: {}", endpoint.trim());
      System.setProperty("otel.exporter.otlp.endpoint", endpoint.trim());
    }

    if (normalized.equals("none")) {
      return new NoOpMetricsAdapter();
    }
    System.setProperty("otel.metrics.exporter", "otlp");
    return new OpenTelemetryMetricsAdapter();
  }

  private static void validateEndpoint(String raw) {
    try {
      URI uri = new URI(raw);
      String scheme = uri.getScheme();
      if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException("otelEndpoint must include a host");
      }
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
  }
}
