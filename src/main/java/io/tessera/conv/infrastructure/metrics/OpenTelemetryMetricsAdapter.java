package io.tessera.conv.infrastructure.metrics;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import io.tessera.conv.application.port.MetricsPort;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link MetricsPort} forwarding conversion counters and histograms to OpenTelemetry.
 * <p><strong>Role:</strong> Created once per CLI run and shared by the orchestrator, every pipeline, and every
 * target writer.</p>
 * <p><strong>Thread-safety:</strong> Instruments are created lazily in concurrent maps; updates are lock-free.</p>
 *
 * @since 0.1.0
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> METRIC_KEY_ATTRIBUTE = AttributeKey.stringKey("tessera.metric.key");
  private static final String FALLBACK_METRIC_NAME = "tessera.metric";

  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;
  private final Meter meter;
  private final ConcurrentMap<String, Instrument<LongCounter>> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Instrument<LongHistogram>> histograms = new ConcurrentHashMap<>();

  /**
   * Creates an adapter wired to the exporter selected by {@code otel.metrics.exporter} or
   * {@code OTEL_METRICS_EXPORTER}.
   */
  public OpenTelemetryMetricsAdapter() {
    this(OpenTelemetryBootstrap.initialize());
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    this.meter = bootstrap.meter();
    if (bootstrap.isNoop()) {
      log.debug("OpenTelemetry metrics adapter running in noop mode");
    }
  }

  @Override
  public void increment(String key) {
    incrementBy(key, 1L);
  }

  @Override
  public void incrementBy(String key, long delta) {
    if (delta <= 0) {
      return;
    }
    Instrument<LongCounter> instrument = counters.computeIfAbsent(Objects.requireNonNull(key, "key"), this::counter);
    instrument.value().add(delta, instrument.attributes());
  }

  @Override
  public void observe(String key, long value) {
    Instrument<LongHistogram> instrument =
        histograms.computeIfAbsent(Objects.requireNonNull(key, "key"), this::histogram);
    instrument.value().record(value, instrument.attributes());
  }

  /** Pushes pending measurements to the exporter. */
  public void forceFlush() {
    bootstrap.forceFlush();
  }

  @Override
  public void close() {
    bootstrap.close();
  }

  private Instrument<LongCounter> counter(String key) {
    String name = sanitizeName(key);
    LongCounter counter = meter.counterBuilder(name)
        .setUnit(key.endsWith(".bytes") ? "By" : "1")
        .setDescription("Conversion counter " + key)
        .build();
    return new Instrument<>(counter, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  private Instrument<LongHistogram> histogram(String key) {
    String name = sanitizeName(key);
    LongHistogram histogram = meter.histogramBuilder(name)
        .ofLongs()
        .setUnit(key.endsWith("Nanos") ? "ns" : "1")
        .setDescription("Conversion observation " + key)
        .build();
    return new Instrument<>(histogram, Attributes.of(METRIC_KEY_ATTRIBUTE, key));
  }

  static String sanitizeName(String key) {
    if (key == null || key.isBlank()) {
      return FALLBACK_METRIC_NAME;
    }
    String lower = key.trim().toLowerCase(Locale.ROOT);
    StringBuilder result = new StringBuilder(lower.length() + 1);
    if (!Character.isLetter(lower.charAt(0))) {
      result.append('m');
    }
    for (int i = 0; i < lower.length(); i++) {
      char c = lower.charAt(i);
      result.append(Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' ? c : '_');
    }
    String sanitized = result.toString();
    if (!sanitized.equals(key)) {
      log.debug("Sanitized metric name '{}' -> '{}'", key, sanitized);
    }
    return sanitized;
  }

  private record Instrument<T>(T value, Attributes attributes) {}
}
