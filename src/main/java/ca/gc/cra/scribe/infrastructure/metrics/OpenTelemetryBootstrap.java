package ca.gc.cra.scribe.infrastructure.metrics;

import ca.gc.cra.scribe.validation.Strings;
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
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the OpenTelemetry meter provider backing {@link OpenTelemetryMetricsAdapter}.
 *
 * <p>Settings are read from system properties first, then environment variables:
 * {@code otel.metrics.exporter}/{@code OTEL_METRICS_EXPORTER} ({@code none} by default, or {@code otlp}),
 * {@code otel.exporter.otlp.endpoint}/{@code OTEL_EXPORTER_OTLP_ENDPOINT},
 * {@code otel.metric.export.interval}/{@code OTEL_METRIC_EXPORT_INTERVAL} (milliseconds) and
 * {@code otel.resource.attributes}/{@code OTEL_RESOURCE_ATTRIBUTES}.</p>
 */
final class OpenTelemetryBootstrap {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryBootstrap.class);
  static final String INSTRUMENTATION_SCOPE = "ca.gc.cra.scribe";
  private static final String DEFAULT_ENDPOINT = "http://localhost:4317";
  private static final long DEFAULT_INTERVAL_MILLIS = 60_000L;
  private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
  private static final AttributeKey<String> SERVICE_NAMESPACE = AttributeKey.stringKey("service.namespace");
  private static final AttributeKey<String> SERVICE_VERSION = AttributeKey.stringKey("service.version");

  private OpenTelemetryBootstrap() {
    // Utility
  }

  /**
   * Reads the environment and builds a provider; any failure degrades to a no-op meter.
   *
   * @return bootstrap outcome, never {@code null}
   */
  static BootstrapResult initialize() {
    try {
      Settings settings = Settings.fromEnvironment();
      if (settings.exporter() == Exporter.NONE) {
        log.debug("OpenTelemetry metrics exporter disabled (exporter=none)");
        return BootstrapResult.noop();
      }
      OtlpGrpcMetricExporter exporter =
          OtlpGrpcMetricExporter.builder().setEndpoint(settings.endpoint()).build();
      MetricReader reader = PeriodicMetricReader.builder(exporter)
          .setInterval(Duration.ofMillis(settings.intervalMillis()))
          .build();
      BootstrapResult result = build(reader, settings.resourceAttributes());
      log.info("OpenTelemetry metrics exporting to {} every {} ms", settings.endpoint(), settings.intervalMillis());
      return result;
    } catch (RuntimeException ex) {
      log.error("Failed to initialize OpenTelemetry metrics; continuing without metrics", ex);
      return BootstrapResult.noop();
    }
  }

  /**
   * Builds a provider around a caller-supplied reader, typically an in-memory reader in tests.
   *
   * @param reader metric reader to register
   * @return active bootstrap result
   */
  static BootstrapResult forReader(MetricReader reader) {
    return build(Objects.requireNonNull(reader, "reader"), Attributes.empty());
  }

  private static BootstrapResult build(MetricReader reader, Attributes extra) {
    String version = serviceVersion();
    Resource resource = Resource.getDefault().merge(Resource.create(Attributes.builder()
        .put(SERVICE_NAME, "scribe")
        .put(SERVICE_NAMESPACE, "ca.gc.cra")
        .put(SERVICE_VERSION, version)
        .putAll(extra)
        .build()));
    SdkMeterProvider provider = SdkMeterProvider.builder()
        .setResource(resource)
        .registerMetricReader(reader)
        .build();
    Meter meter = provider.meterBuilder(INSTRUMENTATION_SCOPE).setInstrumentationVersion(version).build();
    return new BootstrapResult(meter, provider);
  }

  static Attributes parseResourceAttributes(String raw) {
    if (raw == null || raw.isBlank()) {
      return Attributes.empty();
    }
    AttributesBuilder builder = Attributes.builder();
    for (String token : raw.split(",")) {
      String entry = token.trim();
      int idx = entry.indexOf('=');
      String key = idx > 0 ? entry.substring(0, idx).trim() : "";
      String value = idx > 0 ? entry.substring(idx + 1).trim() : "";
      if (key.isEmpty() || value.isEmpty()) {
        if (!entry.isEmpty()) {
          log.warn("Ignoring malformed resource attribute '{}'", entry);
        }
        continue;
      }
      builder.put(AttributeKey.stringKey(key), value);
    }
    return builder.build();
  }

  private static String serviceVersion() {
    Package pkg = OpenTelemetryBootstrap.class.getPackage();
    if (pkg != null && pkg.getImplementationVersion() != null) {
      return pkg.getImplementationVersion();
    }
    try (InputStream in = OpenTelemetryBootstrap.class.getResourceAsStream(
        "/META-INF/maven/ca.gc.cra/scribe/pom.properties")) {
      if (in != null) {
        Properties props = new Properties();
        props.load(in);
        String version = Strings.firstNonBlank(props.getProperty("version"));
        if (version != null) {
          return version;
        }
      }
    } catch (IOException ex) {
      log.debug("Unable to read pom.properties for version detection", ex);
    }
    return "0.0.0-dev";
  }

  private static String setting(String property, String env) {
    return Strings.firstNonBlank(System.getProperty(property), System.getenv(env));
  }

  enum Exporter {
    OTLP,
    NONE;

    static Exporter from(String raw) {
      if (raw == null || raw.isBlank()) {
        return NONE;
      }
      return switch (raw.trim().toLowerCase(Locale.ROOT)) {
        case "otlp" -> OTLP;
        case "none" -> NONE;
        default -> {
          log.warn("Unknown metrics exporter '{}'; metrics disabled", raw);
          yield NONE;
        }
      };
    }
  }

  record Settings(Exporter exporter, String endpoint, long intervalMillis, Attributes resourceAttributes) {
    static Settings fromEnvironment() {
      Exporter exporter = Exporter.from(setting("otel.metrics.exporter", "OTEL_METRICS_EXPORTER"));
      String endpoint = Strings.firstNonBlank(
          setting("otel.exporter.otlp.endpoint", "OTEL_EXPORTER_OTLP_ENDPOINT"), DEFAULT_ENDPOINT);
      String interval = setting("otel.metric.export.interval", "OTEL_METRIC_EXPORT_INTERVAL");
      long intervalMillis = DEFAULT_INTERVAL_MILLIS;
      if (interval != null) {
        try {
          intervalMillis = Math.max(1_000L, Long.parseLong(interval));
        } catch (NumberFormatException ex) {
          log.warn("Ignoring non-numeric metric export interval '{}'", interval);
        }
      }
      Attributes attributes =
          parseResourceAttributes(setting("otel.resource.attributes", "OTEL_RESOURCE_ATTRIBUTES"));
      return new Settings(exporter, endpoint, intervalMillis, attributes);
    }
  }

  /** Meter plus the provider that must be flushed and shut down with it. */
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

    Meter meter() {
      return meter;
    }

    boolean isNoop() {
      return provider == null;
    }

    void forceFlush() {
      if (provider != null) {
        await(provider.forceFlush(), "flush");
      }
    }

    @Override
    public void close() {
      if (provider != null) {
        await(provider.shutdown(), "shutdown");
      }
    }

    private static void await(CompletableResultCode code, String action) {
      code.join(5, TimeUnit.SECONDS);
      if (!code.isSuccess()) {
        log.warn("OpenTelemetry meter provider {} did not complete within 5 seconds", action);
      }
    }
  }
}
