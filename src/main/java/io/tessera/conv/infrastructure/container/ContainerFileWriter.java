package io.tessera.conv.infrastructure.container;

import com.fasterxml.jackson.core.JsonGenerator;
import io.tessera.conv.application.port.MetricsPort;
import io.tessera.conv.application.port.TargetWriter;
import io.tessera.conv.config.ConversionConfig;
import io.tessera.conv.domain.alignment.AlignmentFinding;
import io.tessera.conv.domain.container.CompressionSettings;
import io.tessera.conv.domain.container.ContainerMetadata;
import io.tessera.conv.domain.container.ContainerState;
import io.tessera.conv.domain.conversion.StreamSummary;
import io.tessera.conv.domain.error.WriteFailureException;
import io.tessera.conv.domain.record.CanonicalRecord;
import io.tessera.conv.domain.source.RawChunk;
import io.tessera.conv.infrastructure.json.JsonSupport;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.zip.CRC32;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link TargetWriter} producing one {@code .tsc} container file.
 * <p><strong>Why:</strong> Appends compressed blocks as windows arrive so a session never has to be held in
 * memory; the header stays {@link ContainerState#PENDING} until finalize, so an interrupted run is detectable.</p>
 * <p><strong>Role:</strong> Infrastructure adapter created by {@link ContainerFileWriterFactory}.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; driven by the pipeline's single writer thread.</p>
 * <p><strong>Performance:</strong> Buffers each dataset until {@code writer.flush_threshold_mb}; when all
 * buffers together exceed {@code writer.max_buffered_mb} the largest one is flushed early.</p>
 * <p><strong>Observability:</strong> Emits {@code convert.write.blocks}, {@code convert.write.bytes},
 * {@code convert.write.earlyFlush}, and {@code convert.write.flushLatencyNanos}.</p>
 *
 * @see ContainerFormat
 * @since 0.1.0
 */
public final class ContainerFileWriter implements TargetWriter {
  private static final Logger log = LoggerFactory.getLogger(ContainerFileWriter.class);

  private final Path location;
  private final FileChannel channel;
  private final Function<String, CompressionSettings> compression;
  private final ConversionConfig.Writer limits;
  private final MetricsPort metrics;
  private final Map<String, DatasetBuffer> buffers = new LinkedHashMap<>();
  private final List<BlockHeader> catalog = new ArrayList<>();
  private long bufferedBytes;
  private long bytesWritten;
  private boolean finalized;
  private boolean abandoned;
  private boolean closed;

  private ContainerFileWriter(
      Path location,
      FileChannel channel,
      Function<String, CompressionSettings> compression,
      ConversionConfig.Writer limits,
      MetricsPort metrics) {
    this.location = location;
    this.channel = channel;
    this.compression = compression;
    this.limits = limits;
    this.metrics = metrics;
  }

  /**
   * Creates or truncates the container file and writes a {@link ContainerState#PENDING} header.
   *
   * @param location container path
   * @param compression codec resolver keyed by stream name
   * @param limits buffering limits
   * @param metrics metrics sink
   * @return open writer
   * @throws WriteFailureException if the file cannot be created
   */
  public static ContainerFileWriter create(
      Path location,
      Function<String, CompressionSettings> compression,
      ConversionConfig.Writer limits,
      MetricsPort metrics) throws WriteFailureException {
    Objects.requireNonNull(location, "location");
    FileChannel channel;
    try {
      channel = FileChannel.open(location,
          StandardOpenOption.CREATE,
          StandardOpenOption.TRUNCATE_EXISTING,
          StandardOpenOption.READ,
          StandardOpenOption.WRITE);
    } catch (IOException ex) {
      throw new WriteFailureException(null, "cannot create container " + location, ex);
    }
    ContainerFileWriter writer = new ContainerFileWriter(
        location,
        channel,
        Objects.requireNonNull(compression, "compression"),
        Objects.requireNonNull(limits, "limits"),
        metrics == null ? MetricsPort.NO_OP : metrics);
    try {
      writer.writeHeader();
    } catch (IOException ex) {
      try {
        channel.close();
      } catch (IOException closeEx) {
        ex.addSuppressed(closeEx);
      }
      throw new WriteFailureException(null, "cannot initialize container " + location, ex);
    }
    return writer;
  }

  @Override
  public Path location() {
    return location;
  }

  @Override
  public void appendRaw(String stream, RawChunk chunk) throws WriteFailureException {
    ensureWritable(stream);
    Objects.requireNonNull(chunk, "chunk");
    String path = ContainerFormat.acquisitionPath(stream);
    DatasetBuffer buffer = buffers.computeIfAbsent(path, p -> new DatasetBuffer(
        p, stream, ContainerFormat.DATASET_DATA, chunk.type().name().toLowerCase(Locale.ROOT),
        chunk.channels(), compression.apply(stream)));
    append(buffer, chunk.firstRow(), chunk.rows(), chunk.littleEndianBytes(), Double.NaN, Double.NaN);
  }

  @Override
  public void append(CanonicalRecord record) throws WriteFailureException {
    Objects.requireNonNull(record, "record");
    String stream = record.stream();
    ensureWritable(stream);
    int samples = record.sampleCount();
    if (samples == 0) {
      return;
    }
    String section = record.modality().sectionName();
    CompressionSettings settings = compression.apply(stream);
    double first = record.firstTimestamp();
    double last = record.lastTimestamp();

    DatasetBuffer data = buffers.computeIfAbsent(
        ContainerFormat.processingPath(section, stream, ContainerFormat.DATASET_DATA),
        p -> new DatasetBuffer(p, stream, ContainerFormat.DATASET_DATA, "float64", record.channels(), settings));
    if (data.channels != record.channels()) {
      throw new IllegalStateException("stream " + stream + " changed channel count from "
          + data.channels + " to " + record.channels());
    }
    DatasetBuffer timestamps = buffers.computeIfAbsent(
        ContainerFormat.processingPath(section, stream, ContainerFormat.DATASET_TIMESTAMPS),
        p -> new DatasetBuffer(p, stream, ContainerFormat.DATASET_TIMESTAMPS, "float64", 1, settings));
    DatasetBuffer valid = buffers.computeIfAbsent(
        ContainerFormat.processingPath(section, stream, ContainerFormat.DATASET_VALID),
        p -> new DatasetBuffer(p, stream, ContainerFormat.DATASET_VALID, ContainerFormat.BOOL8, 1, settings));

    append(data, record.firstSample(), samples, float64(record.values()), first, last);
    append(timestamps, record.firstSample(), samples, float64(record.timestamps()), first, last);
    append(valid, record.firstSample(), samples, bool8(record.valid()), first, last);
  }

  @Override
  public void finalizeContainer(ContainerMetadata metadata) throws WriteFailureException {
    Objects.requireNonNull(metadata, "metadata");
    ensureWritable(null);
    try {
      for (DatasetBuffer buffer : buffers.values()) {
        flush(buffer);
      }
      byte[] document = renderMetadata(metadata);
      long metadataOffset = channel.position();
      writeFrame(ContainerFormat.FRAME_METADATA, document, new byte[0]);
      channel.force(true);

      ByteBuffer pointer = ByteBuffer.allocate(16).order(ByteOrder.BIG_ENDIAN);
      pointer.putLong(metadataOffset).putLong(document.length).flip();
      writeAt(pointer, ContainerFormat.METADATA_POSITION);
      channel.force(true);

      writeState(ContainerState.COMPLETE);
      channel.force(true);
      finalized = true;
    } catch (IOException | UncheckedIOException ex) {
      throw new WriteFailureException(null, "failed to finalize container " + location, ex);
    }
    log.debug("Finalized container {} ({} blocks, {} bytes)", location, catalog.size(), bytesWritten);
  }

  @Override
  public void abandon() {
    if (finalized || abandoned || closed) {
      return;
    }
    abandoned = true;
    buffers.values().forEach(DatasetBuffer::discard);
    bufferedBytes = 0;
    try {
      writeState(ContainerState.ABORTED);
      channel.force(false);
    } catch (IOException ex) {
      log.warn("Unable to mark container {} aborted; it remains pending", location, ex);
    }
  }

  @Override
  public boolean finalized() {
    return finalized;
  }

  @Override
  public long bytesWritten() {
    return bytesWritten;
  }

  @Override
  public void close() throws IOException {
    if (closed) {
      return;
    }
    closed = true;
    if (!finalized && !abandoned) {
      log.debug("Closing unfinalized container {}; it stays pending", location);
    }
    channel.close();
  }

  private void ensureWritable(String stream) throws WriteFailureException {
    if (closed || abandoned) {
      throw new WriteFailureException(stream, "container " + location + " is no longer writable");
    }
    if (finalized) {
      throw new WriteFailureException(stream, "container " + location + " is already finalized");
    }
  }

  private void append(DatasetBuffer buffer, long firstRow, int rows, byte[] payload, double first, double last)
      throws WriteFailureException {
    if (firstRow != buffer.nextRow) {
      throw new IllegalStateException("out-of-order rows for " + buffer.path
          + ": expected row " + buffer.nextRow + " but got " + firstRow);
    }
    buffer.add(rows, payload, first, last);
    bufferedBytes += payload.length;
    try {
      if (buffer.size() >= limits.flushThresholdBytes()) {
        flush(buffer);
      }
      while (bufferedBytes > limits.maxBufferedBytes()) {
        DatasetBuffer largest = largestBuffer();
        if (largest == null) {
          break;
        }
        metrics.increment("convert.write.earlyFlush");
        flush(largest);
      }
    } catch (IOException | UncheckedIOException ex) {
      throw new WriteFailureException(buffer.stream, "failed to write block of " + buffer.path, ex);
    }
  }

  private DatasetBuffer largestBuffer() {
    DatasetBuffer largest = null;
    for (DatasetBuffer buffer : buffers.values()) {
      if (buffer.size() > 0 && (largest == null || buffer.size() > largest.size())) {
        largest = buffer;
      }
    }
    return largest;
  }

  private void flush(DatasetBuffer buffer) throws IOException {
    if (buffer.rows == 0) {
      return;
    }
    long started = System.nanoTime();
    byte[] raw = buffer.drain();
    byte[] stored = BlockCodec.encode(buffer.settings, raw);
    CRC32 crc = new CRC32();
    crc.update(stored);
    BlockHeader header = new BlockHeader(
        buffer.path,
        buffer.stream,
        buffer.dataset,
        buffer.dtype,
        buffer.channels,
        buffer.blockFirstRow,
        buffer.blockRows,
        buffer.blockFirstTimestamp,
        buffer.blockLastTimestamp,
        buffer.settings.algorithm(),
        buffer.settings.level(),
        raw.length,
        stored.length,
        crc.getValue(),
        -1L);
    long offset = channel.position();
    byte[] json = JsonSupport.render(header::write);
    writeFrame(ContainerFormat.FRAME_BLOCK, json, stored);
    catalog.add(header.at(offset));
    bufferedBytes -= raw.length;
    metrics.increment("convert.write.blocks");
    metrics.observe("convert.write.flushLatencyNanos", System.nanoTime() - started);
  }

  private void writeHeader() throws IOException {
    ByteBuffer header = ByteBuffer.allocate(ContainerFormat.HEADER_BYTES).order(ByteOrder.BIG_ENDIAN);
    header.put(ContainerFormat.MAGIC);
    header.putShort((short) ContainerFormat.VERSION);
    header.put(ContainerState.PENDING.code());
    header.put((byte) 0);
    header.putLong(0L);
    header.putLong(0L);
    header.putLong(0L);
    header.flip();
    writeAt(header, 0L);
    channel.position(ContainerFormat.HEADER_BYTES);
    bytesWritten += ContainerFormat.HEADER_BYTES;
  }

  private void writeState(ContainerState state) throws IOException {
    writeAt(ByteBuffer.wrap(new byte[] {state.code()}), ContainerFormat.STATE_POSITION);
  }

  private void writeAt(ByteBuffer buffer, long position) throws IOException {
    long at = position;
    while (buffer.hasRemaining()) {
      at += channel.write(buffer, at);
    }
  }

  private void writeFrame(byte kind, byte[] header, byte[] payload) throws IOException {
    ByteBuffer prefix = ByteBuffer.allocate(5).order(ByteOrder.BIG_ENDIAN);
    prefix.put(kind).putInt(header.length).flip();
    ByteBuffer[] parts = {prefix, ByteBuffer.wrap(header), ByteBuffer.wrap(payload)};
    long total = 5L + header.length + payload.length;
    long written = 0;
    while (written < total) {
      written += channel.write(parts);
    }
    bytesWritten += total;
    metrics.incrementBy("convert.write.bytes", total);
  }

  private byte[] renderMetadata(ContainerMetadata metadata) {
    return JsonSupport.render(gen -> {
      gen.writeStartObject();
      gen.writeStringField("session_id", metadata.sessionId().toString());
      gen.writeStringField("created_at", metadata.createdAt().toString());
      gen.writeObjectFieldStart(ContainerFormat.SECTION_GENERAL);
      for (Map.Entry<String, String> entry : new TreeMap<>(metadata.metadata()).entrySet()) {
        gen.writeStringField(entry.getKey(), entry.getValue());
      }
      gen.writeEndObject();

      gen.writeArrayFieldStart("streams");
      for (StreamSummary summary : metadata.streams()) {
        writeSummary(gen, summary);
      }
      gen.writeEndArray();

      gen.writeArrayFieldStart("alignment");
      for (AlignmentFinding finding : metadata.report().findings()) {
        gen.writeStartObject();
        gen.writeStringField("stream", finding.stream());
        gen.writeStringField("severity", finding.severity().name());
        gen.writeStringField("type", finding.type().name());
        JsonSupport.writeDouble(gen, "start", finding.interval().startSeconds());
        JsonSupport.writeDouble(gen, "end", finding.interval().endSeconds());
        gen.writeStringField("description", finding.description());
        gen.writeEndObject();
      }
      gen.writeEndArray();

      gen.writeArrayFieldStart("datasets");
      for (DatasetBuffer buffer : buffers.values()) {
        gen.writeStartObject();
        gen.writeStringField("path", buffer.path);
        gen.writeStringField("stream", buffer.stream);
        gen.writeStringField("dataset", buffer.dataset);
        gen.writeStringField("dtype", buffer.dtype);
        gen.writeNumberField("channels", buffer.channels);
        gen.writeNumberField("rows", buffer.nextRow);
        gen.writeEndObject();
      }
      gen.writeEndArray();

      gen.writeArrayFieldStart("blocks");
      for (BlockHeader header : catalog) {
        header.write(gen);
      }
      gen.writeEndArray();
      gen.writeEndObject();
    });
  }

  private static void writeSummary(JsonGenerator gen, StreamSummary summary) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("stream", summary.stream());
    gen.writeStringField("modality", summary.modality().name());
    gen.writeStringField("unit", summary.unit());
    gen.writeNumberField("samples_read", summary.samplesRead());
    gen.writeNumberField("samples_invalid", summary.samplesInvalid());
    gen.writeNumberField("chunks", summary.chunks());
    gen.writeNumberField("bytes_read", summary.bytesRead());
    JsonSupport.writeDouble(gen, "first_timestamp", summary.firstTimestamp());
    JsonSupport.writeDouble(gen, "last_timestamp", summary.lastTimestamp());
    gen.writeEndObject();
  }

  private static byte[] float64(double[] values) {
    ByteBuffer buffer = ByteBuffer.allocate(values.length * Double.BYTES).order(ByteOrder.LITTLE_ENDIAN);
    for (double value : values) {
      buffer.putDouble(value);
    }
    return buffer.array();
  }

  private static byte[] bool8(boolean[] flags) {
    byte[] bytes = new byte[flags.length];
    for (int i = 0; i < flags.length; i++) {
      bytes[i] = flags[i] ? (byte) 1 : (byte) 0;
    }
    return bytes;
  }

  /** Pending rows of one dataset. */
  private static final class DatasetBuffer {
    final String path;
    final String stream;
    final String dataset;
    final String dtype;
    final int channels;
    final CompressionSettings settings;
    private final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    long nextRow;
    int rows;
    long blockFirstRow;
    int blockRows;
    double blockFirstTimestamp = Double.NaN;
    double blockLastTimestamp = Double.NaN;
    private double firstTimestamp = Double.NaN;
    private double lastTimestamp = Double.NaN;

    DatasetBuffer(String path, String stream, String dataset, String dtype, int channels,
        CompressionSettings settings) {
      this.path = path;
      this.stream = stream;
      this.dataset = dataset;
      this.dtype = dtype;
      this.channels = channels;
      this.settings = settings;
    }

    void add(int count, byte[] payload, double first, double last) {
      if (rows == 0) {
        firstTimestamp = first;
      }
      bytes.write(payload, 0, payload.length);
      rows += count;
      nextRow += count;
      lastTimestamp = last;
    }

    int size() {
      return bytes.size();
    }

    byte[] drain() {
      blockFirstRow = nextRow - rows;
      blockRows = rows;
      blockFirstTimestamp = firstTimestamp;
      blockLastTimestamp = lastTimestamp;
      byte[] payload = bytes.toByteArray();
      bytes.reset();
      rows = 0;
      firstTimestamp = Double.NaN;
      lastTimestamp = Double.NaN;
      return payload;
    }

    void discard() {
      bytes.reset();
      rows = 0;
    }
  }
}
