package io.tessera.conv.config;

import io.tessera.conv.domain.container.CompressionAlgorithm;
import io.tessera.conv.domain.container.CompressionSettings;
import io.tessera.conv.validation.Numbers;
import io.tessera.conv.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Immutable configuration of a conversion run.
 * <p><strong>Why:</strong> One explicit value is passed into the orchestrator and every pipeline, so sessions
 * never consult global state.</p>
 * <p><strong>Role:</strong> Built by {@link #fromMap(Map)} from the flat, dotted key map produced by
 * {@link ConfigMerger}; {@link #defaults()} supplies every value when nothing is configured.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share across session workers.</p>
 *
 * @param chunkSizeBytes target size of one source chunk in bytes
 * @param compression block codec defaults and per-stream overrides
 * @param alignment timing validation thresholds
 * @param batch batch scheduling settings
 * @param mapping invalid-sample limits
 * @param writer target writer buffering limits
 * @param pipeline chunk budget and per-session stream workers
 * @param output target container location
 * @param loggingLevel root log level name
 * @since 0.1.0
 */
public record ConversionConfig(
    long chunkSizeBytes,
    Compression compression,
    Alignment alignment,
    Batch batch,
    Mapping mapping,
    Writer writer,
    Pipeline pipeline,
    Output output,
    String loggingLevel) {

  /** Bytes per configured megabyte. */
  public static final long MEGABYTE = 1_024L * 1_024L;

  private static final double DEFAULT_CHUNK_MB = 64d;
  private static final String STREAM_COMPRESSION_PREFIX = "compression.streams.";

  public ConversionConfig {
    if (chunkSizeBytes <= 0) {
      throw new IllegalArgumentException("chunk size must be > 0 bytes");
    }
    Objects.requireNonNull(compression, "compression");
    Objects.requireNonNull(alignment, "alignment");
    Objects.requireNonNull(batch, "batch");
    Objects.requireNonNull(mapping, "mapping");
    Objects.requireNonNull(writer, "writer");
    Objects.requireNonNull(pipeline, "pipeline");
    Objects.requireNonNull(output, "output");
    loggingLevel = Strings.requireNonBlank("logging.level", loggingLevel).toUpperCase(Locale.ROOT);
  }

  /**
   * Returns the flat key map holding every default value, used as the lowest merge layer.
   *
   * @return default key/value pairs
   */
  public static Map<String, String> defaultValues() {
    Map<String, String> values = new LinkedHashMap<>();
    values.put("chunk_size_mb", "64");
    values.put("compression.algorithm", "gzip");
    values.put("compression.level", "4");
    values.put("alignment.gap_threshold_ms", "20");
    values.put("alignment.drift_threshold_ms", "50");
    values.put("alignment.rate_tolerance", "0.01");
    values.put("alignment.rate_error_tolerance", "0.10");
    values.put("batch.parallelism", "1");
    values.put("batch.skip_errors", "false");
    values.put("mapping.max_invalid_fraction", "0.05");
    values.put("mapping.max_recorded_invalid_runs", "256");
    values.put("writer.flush_threshold_mb", "8");
    values.put("writer.max_buffered_mb", "64");
    values.put("pipeline.max_in_flight_chunks", "8");
    values.put("pipeline.stream_workers", "4");
    values.put("output.root", "./output");
    values.put("output.overwrite", "false");
    values.put("logging.level", "INFO");
    return values;
  }

  /**
   * Provides the default configuration.
   *
   * @return configuration built from {@link #defaultValues()}
   */
  public static ConversionConfig defaults() {
    return fromMap(Map.of());
  }

  /**
   * Builds a configuration from flat dotted keys; absent keys fall back to defaults.
   *
   * @param values key/value pairs such as {@code alignment.gap_threshold_ms=20}
   * @return validated configuration
   * @throws IllegalArgumentException if a value is malformed or out of range
   */
  public static ConversionConfig fromMap(Map<String, String> values) {
    Map<String, String> kv = values == null ? Map.of() : values;

    double chunkMb = parseBoundedDouble(kv, "chunk_size_mb", DEFAULT_CHUNK_MB, 1e-6, 4_096d);
    long chunkBytes = Math.max(1L, Math.round(chunkMb * MEGABYTE));

    CompressionAlgorithm algorithm = CompressionAlgorithm.fromName(kv.getOrDefault("compression.algorithm", "gzip"));
    int level = parseBoundedInt(kv, "compression.level", 4, 0, 9);
    Map<String, CompressionSettings> perStream = parseStreamCompression(kv, algorithm, level);
    Compression compression = new Compression(new CompressionSettings(algorithm, level), perStream);

    double gapMs = parseBoundedDouble(kv, "alignment.gap_threshold_ms", 20d, 0d, 3_600_000d);
    double driftMs = parseBoundedDouble(kv, "alignment.drift_threshold_ms", 50d, 0d, 3_600_000d);
    double gapErrorMs = parseBoundedDouble(kv, "alignment.gap_error_threshold_ms", Math.max(gapMs, driftMs), 0d, 3_600_000d);
    double driftErrorMs = parseBoundedDouble(kv, "alignment.drift_error_threshold_ms", driftMs * 10d, 0d, 36_000_000d);
    double rateTolerance = parseBoundedDouble(kv, "alignment.rate_tolerance", 0.01d, 0d, 1d);
    double rateErrorTolerance =
        parseBoundedDouble(kv, "alignment.rate_error_tolerance", Math.max(0.10d, rateTolerance), 0d, 1d);
    Optional<String> reference = optionalString(kv.get("alignment.reference_stream"))
        .map(s -> Strings.requireIdentifier("alignment.reference_stream", s));
    Alignment alignment = new Alignment(
        gapMs, gapErrorMs, driftMs, driftErrorMs, rateTolerance, rateErrorTolerance, reference);

    Batch batch = new Batch(
        parseBoundedInt(kv, "batch.parallelism", 1, 1, 256),
        parseBoolean(kv.get("batch.skip_errors"), false));

    Mapping mapping = new Mapping(
        parseBoundedDouble(kv, "mapping.max_invalid_fraction", 0.05d, 0d, 1d),
        parseBoundedInt(kv, "mapping.max_recorded_invalid_runs", 256, 1, 1_000_000));

    double flushMb = parseBoundedDouble(kv, "writer.flush_threshold_mb", 8d, 1e-6, 4_096d);
    double bufferedMb = parseBoundedDouble(kv, "writer.max_buffered_mb", 64d, 1e-6, 65_536d);
    Writer writer = new Writer(
        Math.max(1L, Math.round(flushMb * MEGABYTE)), Math.max(1L, Math.round(bufferedMb * MEGABYTE)));

    Pipeline pipeline = new Pipeline(
        parseBoundedInt(kv, "pipeline.max_in_flight_chunks", 8, 1, 65_536),
        parseBoundedInt(kv, "pipeline.stream_workers", 4, 1, 256));

    Output output = new Output(
        parsePath("output.root", kv.getOrDefault("output.root", "./output")),
        parseBoolean(kv.get("output.overwrite"), false));

    return new ConversionConfig(chunkBytes, compression, alignment, batch, mapping, writer, pipeline, output,
        kv.getOrDefault("logging.level", "INFO"));
  }

  /**
   * Returns a copy with a different batch parallelism.
   *
   * @param parallelism concurrent sessions
   * @return adjusted configuration
   */
  public ConversionConfig withParallelism(int parallelism) {
    return new ConversionConfig(chunkSizeBytes, compression, alignment,
        new Batch(parallelism, batch.skipErrors()), mapping, writer, pipeline, output, loggingLevel);
  }

  /**
   * Block codec defaults and per-stream overrides.
   *
   * @param defaults codec applied to streams without an override
   * @param streams overrides keyed by stream name
   */
  public record Compression(CompressionSettings defaults, Map<String, CompressionSettings> streams) {
    public Compression {
      Objects.requireNonNull(defaults, "defaults");
      streams = Map.copyOf(Objects.requireNonNullElse(streams, Map.of()));
    }

    /**
     * Resolves the codec for a stream.
     *
     * @param stream stream name
     * @return override when configured, otherwise the defaults
     */
    public CompressionSettings forStream(String stream) {
      return streams.getOrDefault(stream, defaults);
    }
  }

  /**
   * Timing validation thresholds.
   *
   * @param gapThresholdMs gap reporting threshold
   * @param gapErrorThresholdMs gap error threshold
   * @param driftThresholdMs drift reporting threshold
   * @param driftErrorThresholdMs drift error threshold
   * @param rateTolerance relative rate deviation reported as a warning
   * @param rateErrorTolerance relative rate deviation reported as an error
   * @param referenceStream explicit drift reference stream
   */
  public record Alignment(
      double gapThresholdMs,
      double gapErrorThresholdMs,
      double driftThresholdMs,
      double driftErrorThresholdMs,
      double rateTolerance,
      double rateErrorTolerance,
      Optional<String> referenceStream) {
    public Alignment {
      if (gapErrorThresholdMs < gapThresholdMs) {
        throw new IllegalArgumentException("alignment.gap_error_threshold_ms must be >= alignment.gap_threshold_ms");
      }
      if (driftErrorThresholdMs < driftThresholdMs) {
        throw new IllegalArgumentException(
            "alignment.drift_error_threshold_ms must be >= alignment.drift_threshold_ms");
      }
      if (rateErrorTolerance < rateTolerance) {
        throw new IllegalArgumentException("alignment.rate_error_tolerance must be >= alignment.rate_tolerance");
      }
      referenceStream = Objects.requireNonNullElse(referenceStream, Optional.empty());
    }
  }

  /**
   * Batch scheduling.
   *
   * @param parallelism sessions converted concurrently
   * @param skipErrors keep submitting sessions after a failure
   */
  public record Batch(int parallelism, boolean skipErrors) {
    public Batch {
      Numbers.requireRange("batch.parallelism", parallelism, 1, 256);
    }
  }

  /**
   * Invalid-sample limits.
   *
   * @param maxInvalidFraction invalid fraction above which a stream fails its session
   * @param maxRecordedInvalidRuns itemized findings per stream and type before aggregation
   */
  public record Mapping(double maxInvalidFraction, int maxRecordedInvalidRuns) {}

  /**
   * Target writer buffering.
   *
   * @param flushThresholdBytes per-dataset buffer size that triggers a block write
   * @param maxBufferedBytes total buffered bytes above which the largest buffer is flushed early
   */
  public record Writer(long flushThresholdBytes, long maxBufferedBytes) {}

  /**
   * Chunk budget and per-session stream pool.
   *
   * @param maxInFlightChunks batch-wide ceiling of resident chunks
   * @param streamWorkers stream tasks run concurrently inside one session
   */
  public record Pipeline(int maxInFlightChunks, int streamWorkers) {}

  /**
   * Target container location.
   *
   * @param root directory receiving one container per session
   * @param overwrite replace existing complete containers
   */
  public record Output(Path root, boolean overwrite) {
    public Output {
      Objects.requireNonNull(root, "root");
    }
  }

  private static Map<String, CompressionSettings> parseStreamCompression(
      Map<String, String> kv, CompressionAlgorithm defaultAlgorithm, int defaultLevel) {
    Map<String, String[]> raw = new LinkedHashMap<>();
    for (Map.Entry<String, String> entry : kv.entrySet()) {
      String key = entry.getKey();
      if (key == null || !key.startsWith(STREAM_COMPRESSION_PREFIX)) {
        continue;
      }
      String rest = key.substring(STREAM_COMPRESSION_PREFIX.length());
      int dot = rest.lastIndexOf('.');
      if (dot <= 0) {
        throw new IllegalArgumentException("invalid per-stream compression key: " + key);
      }
      String stream = Strings.requireIdentifier(key, rest.substring(0, dot));
      String field = rest.substring(dot + 1);
      String[] slot = raw.computeIfAbsent(stream, s -> new String[2]);
      switch (field) {
        case "algorithm" -> slot[0] = entry.getValue();
        case "level" -> slot[1] = entry.getValue();
        default -> throw new IllegalArgumentException("unknown per-stream compression field: " + key);
      }
    }
    Map<String, CompressionSettings> result = new LinkedHashMap<>();
    for (Map.Entry<String, String[]> entry : raw.entrySet()) {
      String[] slot = entry.getValue();
      CompressionAlgorithm algorithm =
          slot[0] == null || slot[0].isBlank() ? defaultAlgorithm : CompressionAlgorithm.fromName(slot[0]);
      int level = slot[1] == null || slot[1].isBlank()
          ? (slot[0] == null ? defaultLevel : algorithm.defaultLevel())
          : parseInt(STREAM_COMPRESSION_PREFIX + entry.getKey() + ".level", slot[1], 0, 9);
      result.put(entry.getKey(), new CompressionSettings(algorithm, level));
    }
    return result;
  }

  private static int parseBoundedInt(Map<String, String> kv, String key, int defaultValue, int min, int max) {
    String raw = kv.get(key);
    if (raw == null || raw.isBlank()) {
      Numbers.requireRange(key, defaultValue, min, max);
      return defaultValue;
    }
    return parseInt(key, raw, min, max);
  }

  private static int parseInt(String key, String raw, int min, int max) {
    try {
      int parsed = Integer.parseInt(raw.trim());
      Numbers.requireRange(key, parsed, min, max);
      return parsed;
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer between " + min + " and " + max, ex);
    }
  }

  private static double parseBoundedDouble(
      Map<String, String> kv, String key, double defaultValue, double min, double max) {
    String raw = kv.get(key);
    if (raw == null || raw.isBlank()) {
      return Numbers.requireRange(key, defaultValue, min, max);
    }
    try {
      return Numbers.requireRange(key, Double.parseDouble(raw.trim()), min, max);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be a number between " + min + " and " + max, ex);
    }
  }

  private static boolean parseBoolean(String value, boolean fallback) {
    if (value == null || value.isBlank()) {
      return fallback;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "true", "yes", "on", "1" -> true;
      case "false", "no", "off", "0" -> false;
      default -> throw new IllegalArgumentException("expected a boolean but got: " + value);
    };
  }

  private static Optional<String> optionalString(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(value.trim());
  }

  private static Path parsePath(String name, String value) {
    try {
      return Path.of(Strings.requireNonBlank(name, value)).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + value, ex);
    }
  }
}
