package ca.gc.cra.scribe.application.port;

/**
 * <strong>What:</strong> Port abstracting pipeline metrics emission.
 * <p><strong>Why:</strong> Lets the orchestrator and handlers count emitted, suppressed and failed records without
 * binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Implemented by {@code OpenTelemetryMetricsAdapter}; {@link #NO_OP} by default.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent updates from every logging thread.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code scribe.handler.write.failed}).</p>
 *
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier; must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram-style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value in the unit implied by the key
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
