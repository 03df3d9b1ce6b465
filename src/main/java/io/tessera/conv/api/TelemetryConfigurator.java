package io.tessera.conv.api;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies telemetry-related CLI settings to the JVM properties read by the OpenTelemetry bootstrap.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);

  private TelemetryConfigurator() {}

  /**
   * Consumes {@code metrics.exporter} and {@code metrics.endpoint} from the argument map.
   *
   * @param args mutable CLI key/value map; telemetry keys are removed
   * @throws IllegalArgumentException when the exporter or endpoint is invalid
   */
  static void configureMetrics(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return;
    }
    String exporter = args.remove("metrics.exporter");
    if (exporter != null) {
      String normalized = exporter.trim().toLowerCase(Locale.ROOT);
      if (!normalized.equals("otlp") && !normalized.equals("none")) {
        throw new IllegalArgumentException("metrics.exporter must be 'otlp' or 'none'");
      }
      log.debug("Configuring OpenTelemetry metrics exporter: {}", normalized);
      System.setProperty("otel.metrics.exporter", normalized);
    }

    String endpoint = args.remove("metrics.endpoint");
    if (endpoint != null) {
      String trimmed = endpoint.trim();
      validateEndpoint(trimmed);
      log.debug("Configuring OTLP endpoint: {}", trimmed);
      System.setProperty("otel.exporter.otlp.endpoint", trimmed);
    }
  }

  private static void validateEndpoint(String raw) {
    try {
      URI uri = new URI(raw);
      String scheme = uri.getScheme();
      if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException("metrics.endpoint must use http or https scheme");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException("metrics.endpoint must include a host");
      }
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("metrics.endpoint must be a valid URI", ex);
    }
  }
}
