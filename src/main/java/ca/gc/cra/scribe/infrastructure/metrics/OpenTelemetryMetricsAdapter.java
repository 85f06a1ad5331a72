package ca.gc.cra.scribe.infrastructure.metrics;

import ca.gc.cra.scribe.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link MetricsPort} forwarding pipeline counters and histograms to OpenTelemetry.
 * <p><strong>Naming:</strong> Keys are sanitized into instrument names (lower case, letters, digits,
 * {@code _ - .}); the original key is kept as the {@code scribe.metric.key} attribute. Keys ending in
 * {@code Millis} produce histograms with unit {@code ms}.</p>
 * <p><strong>Thread-safety:</strong> Instruments are created once per key in concurrent maps.</p>
 *
 * @since 0.1.0
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY = AttributeKey.stringKey("scribe.metric.key");
  private static final String FALLBACK_NAME = "scribe.metric";

  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;
  private final Meter meter;
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Histogram> histograms = new ConcurrentHashMap<>();

  /** Creates an adapter configured from {@code otel.*} system properties or {@code OTEL_*} variables. */
  public OpenTelemetryMetricsAdapter() {
    this(OpenTelemetryBootstrap.initialize());
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    this.meter = bootstrap.meter();
    if (bootstrap.isNoop()) {
      log.debug("OpenTelemetry metrics adapter running without an exporter");
    }
  }

  /**
   * Creates an adapter publishing to the supplied reader.
   *
   * @param reader reader receiving collected metrics, for example an in-memory reader
   * @return adapter backed by a dedicated meter provider
   */
  public static OpenTelemetryMetricsAdapter forReader(MetricReader reader) {
    return new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forReader(reader));
  }

  /**
   * Returns whether metrics are discarded because no exporter is configured.
   *
   * @return {@code true} when running without an exporter
   */
  public boolean isNoop() {
    return bootstrap.isNoop();
  }

  @Override
  public void increment(String key) {
    Objects.requireNonNull(key, "key");
    Counter counter = counters.computeIfAbsent(key, this::counter);
    counter.instrument().add(1, counter.attributes());
  }

  @Override
  public void observe(String key, long value) {
    Objects.requireNonNull(key, "key");
    Histogram histogram = histograms.computeIfAbsent(key, this::histogram);
    histogram.instrument().record(value, histogram.attributes());
  }

  /** Pushes pending measurements to the exporter. */
  public void forceFlush() {
    bootstrap.forceFlush();
  }

  /** Flushes and shuts down the meter provider. */
  @Override
  public void close() {
    bootstrap.close();
  }

  private Counter counter(String key) {
    LongCounter counter = meter.counterBuilder(sanitizeName(key))
        .setUnit("1")
        .setDescription("SCRIBE counter " + key)
        .build();
    return new Counter(counter, Attributes.of(METRIC_KEY, key));
  }

  private Histogram histogram(String key) {
    LongHistogram histogram = meter.histogramBuilder(sanitizeName(key))
        .ofLongs()
        .setUnit(key.endsWith("Millis") ? "ms" : "1")
        .setDescription("SCRIBE observation " + key)
        .build();
    return new Histogram(histogram, Attributes.of(METRIC_KEY, key));
  }

  static String sanitizeName(String key) {
    String trimmed = key == null ? "" : key.trim().toLowerCase(Locale.ROOT);
    if (trimmed.isEmpty()) {
      return FALLBACK_NAME;
    }
    StringBuilder name = new StringBuilder(trimmed.length() + 1);
    if (!Character.isLetter(trimmed.charAt(0))) {
      name.append('m');
    }
    for (int i = 0; i < trimmed.length(); i++) {
      char c = trimmed.charAt(i);
      name.append(Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' ? c : '_');
    }
    if (!name.toString().equals(key)) {
      log.debug("Sanitized metric name '{}' -> '{}'", key, name);
    }
    return name.toString();
  }

  private record Counter(LongCounter instrument, Attributes attributes) {}

  private record Histogram(LongHistogram instrument, Attributes attributes) {}
}
