package ca.gc.cra.prism.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryBootstrapTest {
  private static final String EXPORTER = "otel.metrics.exporter";
  private String previousExporter;

  @BeforeEach
  void remember() {
    previousExporter = System.getProperty(EXPORTER);
  }

  @AfterEach
  void restore() {
    if (previousExporter == null) {
      System.clearProperty(EXPORTER);
    } else {
      System.setProperty(EXPORTER, previousExporter);
    }
  }

  @Test
  void exporterNoneFallsBackToNoop() {
    System.setProperty(EXPORTER, "none");

    try (OpenTelemetryBootstrap.BootstrapResult result = OpenTelemetryBootstrap.initialize()) {
      assertTrue(result.isNoop());
    }
  }

  @Test
  void unknownExporterDisablesMetrics() {
    System.setProperty(EXPORTER, "prometheus");

    try (OpenTelemetryBootstrap.BootstrapResult result = OpenTelemetryBootstrap.initialize()) {
      assertTrue(result.isNoop());
    }
  }

  @Test
  void noopAdapterAcceptsMeasurements() {
    System.setProperty(EXPORTER, "none");

    try (OpenTelemetryMetricsAdapter adapter = new OpenTelemetryMetricsAdapter()) {
      adapter.increment("remote_write.deliver.success");
      adapter.observe("remote_write.deliver.latencyNanos", 42L);
      adapter.forceFlush();
    }
  }

  @Test
  void propertiesWinOverEnvironment() {
    Map<String, String> properties = Map.of(
        "otel.metrics.exporter", "OTLP",
        "otel.metric.export.interval", "1500");
    Map<String, String> environment = Map.of(
        "OTEL_METRICS_EXPORTER", "none",
        "OTEL_EXPORTER_OTLP_ENDPOINT", "http://collector:4317",
        "OTEL_RESOURCE_ATTRIBUTES", "team=metrics");

    OpenTelemetryBootstrap.ExportSettings settings =
        OpenTelemetryBootstrap.ExportSettings.read(properties::get, environment::get);

    assertTrue(settings.otlp());
    assertEquals("http://collector:4317", settings.endpoint());
    assertEquals(Duration.ofMillis(1500), settings.interval());
    assertEquals("metrics", settings.resourceAttributes().get(AttributeKey.stringKey("team")));
  }

  @Test
  void invalidIntervalFallsBackToDefault() {
    OpenTelemetryBootstrap.ExportSettings settings = OpenTelemetryBootstrap.ExportSettings.read(
        Map.of("otel.metric.export.interval", "-5")::get, Map.<String, String>of()::get);

    assertFalse(settings.otlp());
    assertEquals(Duration.ofSeconds(30), settings.interval());
    assertEquals("http://localhost:4317", settings.endpoint());
  }

  @Test
  void parsesResourceAttributeList() {
    Attributes attributes = OpenTelemetryBootstrap.parseResourceAttributes(
        "deployment.environment=prod, team = metrics ,broken,=x,trailing=");

    assertEquals(2, attributes.size());
    assertEquals("prod", attributes.get(AttributeKey.stringKey("deployment.environment")));
    assertEquals("metrics", attributes.get(AttributeKey.stringKey("team")));
    assertTrue(OpenTelemetryBootstrap.parseResourceAttributes(" ").isEmpty());
  }
}
