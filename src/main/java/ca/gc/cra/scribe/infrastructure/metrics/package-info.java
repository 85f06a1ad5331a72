/**
 * Metrics adapters bridging {@code MetricsPort} to OpenTelemetry.
 * <p><strong>Metrics:</strong> Publishes {@code scribe.records.*}, {@code scribe.handler.*} and
 * {@code scribe.operation.durationMillis}.</p>
 * <p><strong>Security:</strong> Only counts and durations are exported, never record contents.</p>
 */
package ca.gc.cra.scribe.infrastructure.metrics;
