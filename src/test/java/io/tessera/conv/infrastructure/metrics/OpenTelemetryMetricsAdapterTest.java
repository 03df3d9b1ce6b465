package io.tessera.conv.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private static final AttributeKey<String> KEY_ATTRIBUTE = AttributeKey.stringKey("tessera.metric.key");

  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  @AfterEach
  void tearDown() {
    if (adapter != null) {
      adapter.close();
    }
  }

  @Test
  void incrementRecordsCounterWithKeyAttribute() {
    adapter.increment("convert.session.success");
    adapter.increment("convert.session.success");
    adapter.incrementBy("convert.session.success", 3L);
    adapter.forceFlush();

    MetricData counter = metric("convert.session.success").orElseThrow();
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(5L, point.getValue());
    assertEquals("convert.session.success", point.getAttributes().get(KEY_ATTRIBUTE));
    assertEquals("tessera", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
  }

  @Test
  void byteCountersUseByteUnitAndIgnoreNonPositiveDeltas() {
    adapter.incrementBy("convert.write.bytes", 4_096L);
    adapter.incrementBy("convert.write.bytes", 0L);
    adapter.incrementBy("convert.write.bytes", -5L);
    adapter.forceFlush();

    MetricData counter = metric("convert.write.bytes").orElseThrow();
    assertEquals("By", counter.getUnit());
    assertEquals(4_096L, counter.getLongSumData().getPoints().iterator().next().getValue());
  }

  @Test
  void observeRecordsHistogramUnderSanitizedName() {
    adapter.observe("convert.session.wallTimeNanos", 1_000L);
    adapter.observe("convert.session.wallTimeNanos", 2_000L);
    adapter.forceFlush();

    MetricData histogram = metric("convert.session.walltimenanos").orElseThrow();
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    assertEquals("ns", histogram.getUnit());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(3_000.0, point.getSum());
    assertEquals("convert.session.wallTimeNanos", point.getAttributes().get(KEY_ATTRIBUTE));
  }

  @Test
  void sanitizeNameProducesValidInstrumentNames() {
    assertEquals("convert.chunk.read", OpenTelemetryMetricsAdapter.sanitizeName("convert.chunk.read"));
    assertEquals("m9lives", OpenTelemetryMetricsAdapter.sanitizeName("9lives"));
    assertEquals("a_b_c", OpenTelemetryMetricsAdapter.sanitizeName("a b/c"));
    assertEquals("tessera.metric", OpenTelemetryMetricsAdapter.sanitizeName(" "));
  }

  @Test
  void noopBootstrapAcceptsEverything() {
    OpenTelemetryBootstrap.BootstrapResult noop = OpenTelemetryBootstrap.BootstrapResult.noop();
    assertTrue(noop.isNoop());
    try (OpenTelemetryMetricsAdapter quiet = new OpenTelemetryMetricsAdapter(noop)) {
      quiet.increment("convert.chunk.read");
      quiet.observe("convert.write.flushLatencyNanos", 10L);
      quiet.forceFlush();
    }
  }

  private Optional<MetricData> metric(String name) {
    return reader.collectAllMetrics().stream()
        .filter(metric -> metric.getName().equals(name))
        .findFirst();
  }
}
