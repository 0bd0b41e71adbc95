package ca.gc.cra.parley.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.MeterProvider;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.resources.Resource;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the OpenTelemetry meter provider from {@code OTEL_*} environment variables or the matching
 * {@code otel.*} system properties.
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  static final String INSTRUMENTATION_SCOPE = "ca.gc.cra.parley";
  private static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  private static final String DEFAULT_VERSION = "0.1.0";
  private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
  private static final AttributeKey<String> SERVICE_NAMESPACE = AttributeKey.stringKey("service.namespace");
  private static final AttributeKey<String> SERVICE_VERSION = AttributeKey.stringKey("service.version");

  private OpenTelemetryBootstrap() {
    // Utility class
  }

  static BootstrapResult initialize() {
    try {
      ExporterMode exporter = ExporterMode.from(setting("otel.metrics.exporter", "OTEL_METRICS_EXPORTER", "otlp"));
      if (exporter == ExporterMode.NONE) {
        log.info("OpenTelemetry metrics exporter disabled (exporter=none)");
        return BootstrapResult.noop();
      }
      String endpoint = setting("otel.exporter.otlp.endpoint", "OTEL_EXPORTER_OTLP_ENDPOINT", DEFAULT_ENDPOINT);
      OtlpGrpcMetricExporter otlp = OtlpGrpcMetricExporter.builder().setEndpoint(endpoint).build();
      MetricReader reader = PeriodicMetricReader.builder(otlp).setInterval(Duration.ofSeconds(30)).build();
      log.info("OpenTelemetry metrics initialized with OTLP exporter targeting {}", endpoint);
      return build(reader);
    } catch (RuntimeException ex) {
      log.error("Failed to initialize OpenTelemetry metrics; using noop adapter", ex);
      return BootstrapResult.noop();
    }
  }

  static BootstrapResult forTesting(MetricReader reader) {
    return build(Objects.requireNonNull(reader, "reader"));
  }

  private static BootstrapResult build(MetricReader reader) {
    String version = serviceVersion();
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(resource(version))
        .registerMetricReader(reader)
        .build();
    Meter meter = provider.meterBuilder(INSTRUMENTATION_SCOPE)
        .setInstrumentationVersion(version)
        .build();
    return BootstrapResult.active(provider, meter);
  }

  private static Resource resource(String version) {
    AttributesBuilder builder = Attributes.builder()
        .put(SERVICE_NAME, "parley")
        .put(SERVICE_NAMESPACE, "ca.gc.cra")
        .put(SERVICE_VERSION, version);
    return Resource.getDefault().merge(Resource.create(builder.build()));
  }

  private static String serviceVersion() {
    Package pkg = OpenTelemetryBootstrap.class.getPackage();
    if (pkg != null) {
      String impl = pkg.getImplementationVersion();
      if (impl != null && !impl.isBlank()) {
        return impl;
      }
    }
    return DEFAULT_VERSION;
  }

  private static String setting(String property, String env, String defaultValue) {
    String fromProperty = System.getProperty(property);
    if (fromProperty != null && !fromProperty.isBlank()) {
      return fromProperty.trim();
    }
    String fromEnv = System.getenv(env);
    if (fromEnv != null && !fromEnv.isBlank()) {
      return fromEnv.trim();
    }
    return defaultValue;
  }

  enum ExporterMode {
    OTLP,
    NONE;

    static ExporterMode from(String raw) {
      if (raw == null || raw.isBlank()) {
        return OTLP;
      }
      return switch (raw.trim().toLowerCase(Locale.ROOT)) {
        case "none" -> NONE;
        case "otlp" -> OTLP;
        default -> {
          log.warn("Unknown OTEL_METRICS_EXPORTER value '{}'; defaulting to otlp", raw);
          yield OTLP;
        }
      };
    }
  }

  static final class BootstrapResult implements AutoCloseable {
    private final Meter meter;
    private final SdkMeterProvider provider;

    private BootstrapResult(Meter meter, SdkMeterProvider provider) {
      this.meter = meter;
      this.provider = provider;
    }

    static BootstrapResult noop() {
      return new BootstrapResult(MeterProvider.noop().get(INSTRUMENTATION_SCOPE), null);
    }

    static BootstrapResult active(SdkMeterProvider provider, Meter meter) {
      return new BootstrapResult(meter, provider);
    }

    Meter meter() {
      return meter;
    }

    boolean isNoop() {
      return provider == null;
    }

    void forceFlush() {
      if (provider == null) {
        return;
      }
      CompletableResultCode result = provider.forceFlush();
      result.join(5, TimeUnit.SECONDS);
      if (!result.isSuccess()) {
        log.warn("OpenTelemetry metrics flush did not complete within timeout");
      }
    }

    @Override
    public void close() {
      if (provider == null) {
        return;
      }
      try {
        CompletableResultCode shutdown = provider.shutdown();
        shutdown.join(5, TimeUnit.SECONDS);
        if (!shutdown.isSuccess()) {
          log.warn("Timed out waiting for OpenTelemetry meter provider shutdown");
        }
      } catch (RuntimeException ex) {
        log.warn("Failed to close OpenTelemetry meter provider cleanly", ex);
      }
    }
  }
}
