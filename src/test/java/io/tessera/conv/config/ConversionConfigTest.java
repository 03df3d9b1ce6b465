package io.tessera.conv.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.tessera.conv.domain.container.CompressionAlgorithm;
import io.tessera.conv.domain.container.CompressionSettings;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConversionConfigTest {

  @Test
  void defaultsMatchDocumentedValues() {
    ConversionConfig config = ConversionConfig.defaults();

    assertEquals(64L * 1_048_576L, config.chunkSizeBytes());
    assertEquals(new CompressionSettings(CompressionAlgorithm.GZIP, 4), config.compression().defaults());
    assertEquals(20d, config.alignment().gapThresholdMs());
    assertEquals(50d, config.alignment().gapErrorThresholdMs());
    assertEquals(50d, config.alignment().driftThresholdMs());
    assertEquals(500d, config.alignment().driftErrorThresholdMs());
    assertEquals(0.01d, config.alignment().rateTolerance());
    assertEquals(0.10d, config.alignment().rateErrorTolerance());
    assertEquals(Optional.empty(), config.alignment().referenceStream());
    assertEquals(1, config.batch().parallelism());
    assertFalse(config.batch().skipErrors());
    assertEquals(0.05d, config.mapping().maxInvalidFraction());
    assertEquals(256, config.mapping().maxRecordedInvalidRuns());
    assertEquals(8L * 1_048_576L, config.writer().flushThresholdBytes());
    assertEquals(64L * 1_048_576L, config.writer().maxBufferedBytes());
    assertEquals(8, config.pipeline().maxInFlightChunks());
    assertEquals(4, config.pipeline().streamWorkers());
    assertTrue(config.output().root().isAbsolute());
    assertTrue(config.output().root().endsWith(Path.of("output")));
    assertFalse(config.output().overwrite());
    assertEquals("INFO", config.loggingLevel());
  }

  @Test
  void fractionalMegabytesUseBinaryUnits() {
    ConversionConfig config = ConversionConfig.fromMap(Map.of(
        "chunk_size_mb", "0.5",
        "writer.flush_threshold_mb", "1"));

    assertEquals(524_288L, config.chunkSizeBytes());
    assertEquals(1_048_576L, config.writer().flushThresholdBytes());
  }

  @Test
  void perStreamCompressionOverridesDefaults() {
    ConversionConfig config = ConversionConfig.fromMap(Map.of(
        "compression.algorithm", "deflate",
        "compression.level", "3",
        "compression.streams.ecog.algorithm", "BZIP2",
        "compression.streams.cursor.level", "8",
        "compression.streams.events.algorithm", "none"));

    assertEquals(new CompressionSettings(CompressionAlgorithm.BZIP2, 9), config.compression().forStream("ecog"));
    assertEquals(new CompressionSettings(CompressionAlgorithm.DEFLATE, 8), config.compression().forStream("cursor"));
    assertEquals(new CompressionSettings(CompressionAlgorithm.NONE, 0), config.compression().forStream("events"));
    assertEquals(new CompressionSettings(CompressionAlgorithm.DEFLATE, 3), config.compression().forStream("gaze"));
  }

  @Test
  void bzip2LevelIsClampedIntoItsBlockSizeRange() {
    ConversionConfig config = ConversionConfig.fromMap(Map.of(
        "compression.algorithm", "bzip2",
        "compression.level", "0"));

    assertEquals(1, config.compression().defaults().level());
  }

  @Test
  void errorThresholdsDefaultFromWarningThresholds() {
    ConversionConfig config = ConversionConfig.fromMap(Map.of(
        "alignment.gap_threshold_ms", "80",
        "alignment.drift_threshold_ms", "30",
        "alignment.reference_stream", "ecog"));

    assertEquals(80d, config.alignment().gapErrorThresholdMs());
    assertEquals(300d, config.alignment().driftErrorThresholdMs());
    assertEquals(Optional.of("ecog"), config.alignment().referenceStream());
  }

  @Test
  void errorThresholdBelowWarningThresholdFails() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> ConversionConfig.fromMap(Map.of(
        "alignment.gap_threshold_ms", "40",
        "alignment.gap_error_threshold_ms", "10")));
    assertTrue(ex.getMessage().contains("gap_error_threshold_ms"));
  }

  @Test
  void malformedValuesAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> ConversionConfig.fromMap(Map.of("batch.parallelism", "0")));
    assertThrows(IllegalArgumentException.class, () -> ConversionConfig.fromMap(Map.of("batch.parallelism", "two")));
    assertThrows(IllegalArgumentException.class, () -> ConversionConfig.fromMap(Map.of("batch.skip_errors", "maybe")));
    assertThrows(IllegalArgumentException.class, () -> ConversionConfig.fromMap(Map.of("compression.algorithm", "lz4")));
    assertThrows(IllegalArgumentException.class, () -> ConversionConfig.fromMap(Map.of("chunk_size_mb", "0")));
    assertThrows(IllegalArgumentException.class,
        () -> ConversionConfig.fromMap(Map.of("mapping.max_invalid_fraction", "1.5")));
    assertThrows(IllegalArgumentException.class,
        () -> ConversionConfig.fromMap(Map.of("compression.streams.ecog.window", "4")));
  }

  @Test
  void booleansAcceptCommonSpellings() {
    assertTrue(ConversionConfig.fromMap(Map.of("batch.skip_errors", "yes")).batch().skipErrors());
    assertTrue(ConversionConfig.fromMap(Map.of("output.overwrite", "ON")).output().overwrite());
    assertFalse(ConversionConfig.fromMap(Map.of("output.overwrite", "0")).output().overwrite());
  }

  @Test
  void withParallelismKeepsEverythingElse() {
    ConversionConfig base = ConversionConfig.fromMap(Map.of("batch.skip_errors", "true", "logging.level", "debug"));
    ConversionConfig adjusted = base.withParallelism(6);

    assertEquals(6, adjusted.batch().parallelism());
    assertTrue(adjusted.batch().skipErrors());
    assertEquals("DEBUG", adjusted.loggingLevel());
    assertEquals(base.compression(), adjusted.compression());
  }
}
