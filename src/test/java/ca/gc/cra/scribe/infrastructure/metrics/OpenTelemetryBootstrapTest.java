package ca.gc.cra.scribe.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryBootstrapTest {

  @AfterEach
  void clearProperties() {
    System.clearProperty("otel.metrics.exporter");
  }

  @Test
  void explicitNoneExporterYieldsNoopAdapter() {
    System.setProperty("otel.metrics.exporter", "none");

    try (OpenTelemetryMetricsAdapter adapter = new OpenTelemetryMetricsAdapter()) {
      assertTrue(adapter.isNoop());
      adapter.increment("scribe.records.emitted");
      adapter.observe("scribe.operation.durationMillis", 5);
      adapter.forceFlush();
    }
  }

  @Test
  void unknownExporterFallsBackToNone() {
    assertEquals(OpenTelemetryBootstrap.Exporter.NONE, OpenTelemetryBootstrap.Exporter.from("zipkin"));
    assertEquals(OpenTelemetryBootstrap.Exporter.NONE, OpenTelemetryBootstrap.Exporter.from(null));
    assertEquals(OpenTelemetryBootstrap.Exporter.OTLP, OpenTelemetryBootstrap.Exporter.from(" OTLP "));
  }

  @Test
  void parsesResourceAttributesSkippingMalformedEntries() {
    Attributes attributes = OpenTelemetryBootstrap.parseResourceAttributes(
        "deployment.environment=prod, team = billing,broken,=novalue,empty=");

    assertEquals(2, attributes.size());
    assertEquals("prod", attributes.get(AttributeKey.stringKey("deployment.environment")));
    assertEquals("billing", attributes.get(AttributeKey.stringKey("team")));
    assertEquals(0, OpenTelemetryBootstrap.parseResourceAttributes("  ").size());
  }
}
