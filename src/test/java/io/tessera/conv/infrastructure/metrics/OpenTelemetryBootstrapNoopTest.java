package io.tessera.conv.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryBootstrapNoopTest {
  private String previousExporter;

  @BeforeEach
  void rememberProperties() {
    previousExporter = System.getProperty("otel.metrics.exporter");
  }

  @AfterEach
  void resetProperties() {
    if (previousExporter == null) {
      System.clearProperty("otel.metrics.exporter");
    } else {
      System.setProperty("otel.metrics.exporter", previousExporter);
    }
  }

  @Test
  void exporterNoneFallsBackToNoop() {
    System.setProperty("otel.metrics.exporter", "none");

    OpenTelemetryBootstrap.BootstrapResult result = OpenTelemetryBootstrap.initialize();
    assertTrue(result.isNoop(), "Expected noop metrics bootstrap when exporter=none");
    result.close();
  }

  @Test
  void unknownExporterAlsoFallsBackToNoop() {
    System.setProperty("otel.metrics.exporter", "prometheus");

    OpenTelemetryBootstrap.BootstrapResult result = OpenTelemetryBootstrap.initialize();
    assertTrue(result.isNoop());
    result.close();
  }
}
