package io.tessera.conv.infrastructure.container;

import io.tessera.conv.domain.container.ContainerState;
import io.tessera.conv.domain.record.CanonicalRecord;
import io.tessera.conv.domain.session.Modality;
import io.tessera.conv.domain.session.SessionId;
import io.tessera.conv.infrastructure.json.JsonSupport;
import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.zip.CRC32;

/**
 * Reads finalized {@code .tsc} containers and inspects interrupted ones.
 *
 * <p>{@link #open(Path)} refuses any container whose header is not {@link ContainerState#COMPLETE};
 * {@link #inspect(Path)} scans frames regardless of state, which is how recovery tooling and tests tell a
 * cleanly aborted file from a torn one.</p>
 *
 * @since 0.1.0
 */
public final class ContainerFileReader implements Closeable {
  private final Path path;
  private final FileChannel channel;
  private final Map<String, Object> metadata;
  private final List<BlockHeader> blocks;

  private ContainerFileReader(Path path, FileChannel channel, Map<String, Object> metadata,
      List<BlockHeader> blocks) {
    this.path = path;
    this.channel = channel;
    this.metadata = metadata;
    this.blocks = blocks;
  }

  /**
   * Reads only the header state.
   *
   * @param path container file
   * @return state, or empty when the file is not a container
   * @throws IOException if the file cannot be read
   */
  public static Optional<ContainerState> readState(Path path) throws IOException {
    try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
      if (channel.size() < ContainerFormat.HEADER_BYTES) {
        return Optional.empty();
      }
      ByteBuffer header = readFully(channel, 0L, ContainerFormat.HEADER_BYTES);
      byte[] magic = new byte[ContainerFormat.MAGIC.length];
      header.get(magic);
      if (!Arrays.equals(magic, ContainerFormat.MAGIC)) {
        return Optional.empty();
      }
      try {
        return Optional.of(ContainerState.fromCode(header.get(ContainerFormat.STATE_POSITION)));
      } catch (IllegalArgumentException ex) {
        return Optional.empty();
      }
    }
  }

  /**
   * Scans every frame of a container.
   *
   * @param path container file
   * @return inspection result
   * @throws IOException if the file is unreadable or has no valid header
   */
  public static ContainerInspection inspect(Path path) throws IOException {
    try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
      ContainerState state = readHeader(path, channel);
      long size = channel.size();
      long position = ContainerFormat.HEADER_BYTES;
      List<BlockHeader> blocks = new ArrayList<>();
      boolean metadataPresent = false;
      boolean torn = false;
      while (position < size) {
        Frame frame = readFrame(channel, position, size);
        if (frame == null) {
          torn = true;
          break;
        }
        if (frame.kind == ContainerFormat.FRAME_METADATA) {
          metadataPresent = true;
          position = frame.end;
          if (position != size) {
            torn = true;
          }
          break;
        }
        blocks.add(frame.header.at(position));
        position = frame.end;
      }
      return new ContainerInspection(path, state, blocks, metadataPresent, torn, position);
    }
  }

  /**
   * Opens a finalized container.
   *
   * @param path container file
   * @return reader; the caller must close it
   * @throws IOException if the file is not a complete container
   */
  public static ContainerFileReader open(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    FileChannel channel = FileChannel.open(path, StandardOpenOption.READ);
    try {
      ContainerState state = readHeader(path, channel);
      if (state != ContainerState.COMPLETE) {
        throw new IOException("container " + path + " is " + state + "; only complete containers can be read");
      }
      ByteBuffer pointer = readFully(channel, ContainerFormat.METADATA_POSITION, 16);
      long offset = pointer.getLong();
      long length = pointer.getLong();
      Frame frame = readFrame(channel, offset, channel.size());
      if (frame == null || frame.kind != ContainerFormat.FRAME_METADATA || frame.json.length != length) {
        throw new IOException("container " + path + " has a corrupt metadata section");
      }
      Map<String, Object> metadata = JsonSupport.parseObject(frame.json);
      List<BlockHeader> blocks = new ArrayList<>();
      for (Object entry : JsonSupport.asArray("blocks", metadata.get("blocks"))) {
        blocks.add(BlockHeader.read(JsonSupport.asObject("block", entry)));
      }
      return new ContainerFileReader(path, channel, metadata, List.copyOf(blocks));
    } catch (IOException | RuntimeException ex) {
      try {
        channel.close();
      } catch (IOException closeEx) {
        ex.addSuppressed(closeEx);
      }
      throw ex;
    }
  }

  public Path path() {
    return path;
  }

  public SessionId sessionId() {
    return SessionId.parse(JsonSupport.requireString(metadata, "session_id"));
  }

  /**
   * Returns the parsed metadata document.
   *
   * @return metadata frame content, including the {@code general} section
   */
  public Map<String, Object> metadata() {
    return metadata;
  }

  /**
   * Returns the descriptive key/value metadata of the session.
   *
   * @return {@code general} section
   */
  public Map<String, Object> general() {
    return JsonSupport.asObject(ContainerFormat.SECTION_GENERAL, metadata.get(ContainerFormat.SECTION_GENERAL));
  }

  public List<BlockHeader> blocks() {
    return blocks;
  }

  /**
   * Returns the dataset paths present in the container.
   *
   * @return dataset paths in catalog order
   */
  public List<String> datasetPaths() {
    List<String> paths = new ArrayList<>();
    for (Object entry : JsonSupport.asArray("datasets", metadata.get("datasets"))) {
      paths.add(JsonSupport.requireString(JsonSupport.asObject("dataset", entry), "path"));
    }
    return paths;
  }

  /**
   * Reads and concatenates every block of a dataset.
   *
   * @param datasetPath dataset path
   * @return uncompressed little-endian payload; empty when the dataset has no blocks
   * @throws IOException if a block is unreadable or fails its checksum
   */
  public byte[] readDataset(String datasetPath) throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    long expectedRow = 0;
    for (BlockHeader block : blocks) {
      if (!block.path().equals(datasetPath)) {
        continue;
      }
      if (block.firstRow() != expectedRow) {
        throw new IOException("dataset " + datasetPath + " is missing rows before " + block.firstRow());
      }
      out.write(readBlock(block));
      expectedRow += block.rows();
    }
    return out.toByteArray();
  }

  /**
   * Reads the raw acquisition mirror of a stream.
   *
   * @param stream stream name
   * @return raw little-endian source bytes
   * @throws IOException if a block is unreadable
   */
  public byte[] readRaw(String stream) throws IOException {
    return readDataset(ContainerFormat.acquisitionPath(stream));
  }

  /**
   * Reassembles the processed data of a stream into one canonical record.
   *
   * @param stream stream name
   * @return record covering every written sample
   * @throws IOException if the stream is unknown or its blocks are unreadable
   */
  public CanonicalRecord readRecord(String stream) throws IOException {
    Map<String, Object> summary = streamSummary(stream);
    Modality modality = Modality.valueOf(JsonSupport.requireString(summary, "modality"));
    String unit = JsonSupport.requireString(summary, "unit");
    String section = modality.sectionName();
    String dataPath = ContainerFormat.processingPath(section, stream, ContainerFormat.DATASET_DATA);
    int channels = channelsOf(dataPath);

    ByteBuffer data = ByteBuffer.wrap(readDataset(dataPath)).order(ByteOrder.LITTLE_ENDIAN);
    ByteBuffer times = ByteBuffer.wrap(
        readDataset(ContainerFormat.processingPath(section, stream, ContainerFormat.DATASET_TIMESTAMPS)))
        .order(ByteOrder.LITTLE_ENDIAN);
    byte[] flags = readDataset(ContainerFormat.processingPath(section, stream, ContainerFormat.DATASET_VALID));

    int samples = flags.length;
    if (times.remaining() != samples * Double.BYTES || data.remaining() != samples * channels * Double.BYTES) {
      throw new IOException("processed datasets of " + stream + " disagree on sample count");
    }
    double[] timestamps = new double[samples];
    double[] values = new double[samples * channels];
    boolean[] valid = new boolean[samples];
    for (int i = 0; i < samples; i++) {
      timestamps[i] = times.getDouble();
      valid[i] = flags[i] != 0;
    }
    for (int i = 0; i < values.length; i++) {
      values[i] = data.getDouble();
    }
    return new CanonicalRecord(stream, modality, unit, 0L, channels, timestamps, values, valid);
  }

  @Override
  public void close() throws IOException {
    channel.close();
  }

  private Map<String, Object> streamSummary(String stream) throws IOException {
    for (Object entry : JsonSupport.asArray("streams", metadata.get("streams"))) {
      Map<String, Object> summary = JsonSupport.asObject("stream", entry);
      if (stream.equals(summary.get("stream"))) {
        return summary;
      }
    }
    throw new IOException("container " + path + " has no stream named " + stream);
  }

  private int channelsOf(String datasetPath) {
    for (Object entry : JsonSupport.asArray("datasets", metadata.get("datasets"))) {
      Map<String, Object> dataset = JsonSupport.asObject("dataset", entry);
      if (datasetPath.equals(dataset.get("path"))) {
        return Math.toIntExact(JsonSupport.requireLong(dataset, "channels"));
      }
    }
    return 1;
  }

  private byte[] readBlock(BlockHeader block) throws IOException {
    Frame frame = readFrame(channel, block.frameOffset(), channel.size());
    if (frame == null || frame.kind != ContainerFormat.FRAME_BLOCK) {
      throw new IOException("block of " + block.path() + " at " + block.frameOffset() + " is corrupt");
    }
    return BlockCodec.decode(block.codec(), frame.payload, block.rawLength());
  }

  private static ContainerState readHeader(Path path, FileChannel channel) throws IOException {
    if (channel.size() < ContainerFormat.HEADER_BYTES) {
      throw new IOException(path + " is too short to be a container");
    }
    ByteBuffer header = readFully(channel, 0L, ContainerFormat.HEADER_BYTES);
    byte[] magic = new byte[ContainerFormat.MAGIC.length];
    header.get(magic);
    if (!Arrays.equals(magic, ContainerFormat.MAGIC)) {
      throw new IOException(path + " is not a container (bad magic)");
    }
    int version = Short.toUnsignedInt(header.getShort());
    if (version != ContainerFormat.VERSION) {
      throw new IOException("Unsupported container version " + version + " in " + path);
    }
    try {
      return ContainerState.fromCode(header.get());
    } catch (IllegalArgumentException ex) {
      throw new IOException(path + " has an unknown state byte", ex);
    }
  }

  /** Returns {@code null} when the frame at {@code position} is incomplete or fails validation. */
  private static Frame readFrame(FileChannel channel, long position, long size) throws IOException {
    if (size - position < 5) {
      return null;
    }
    ByteBuffer prefix = readFully(channel, position, 5);
    byte kind = prefix.get();
    int headerLength = prefix.getInt();
    if ((kind != ContainerFormat.FRAME_BLOCK && kind != ContainerFormat.FRAME_METADATA)
        || headerLength <= 0 || position + 5 + headerLength > size) {
      return null;
    }
    if (kind == ContainerFormat.FRAME_BLOCK && headerLength > ContainerFormat.MAX_FRAME_HEADER_BYTES) {
      return null;
    }
    byte[] json = new byte[headerLength];
    readFully(channel, position + 5, headerLength).get(json);
    long payloadStart = position + 5 + headerLength;
    if (kind == ContainerFormat.FRAME_METADATA) {
      try {
        JsonSupport.parseObject(json);
      } catch (IllegalArgumentException ex) {
        return null;
      }
      return new Frame(kind, json, null, new byte[0], payloadStart);
    }
    BlockHeader header;
    try {
      header = BlockHeader.read(JsonSupport.parseObject(json));
    } catch (IllegalArgumentException | ArithmeticException ex) {
      return null;
    }
    if (payloadStart + header.storedLength() > size) {
      return null;
    }
    byte[] payload = new byte[header.storedLength()];
    readFully(channel, payloadStart, payload.length).get(payload);
    CRC32 crc = new CRC32();
    crc.update(payload);
    if (crc.getValue() != header.crc32()) {
      return null;
    }
    return new Frame(kind, json, header, payload, payloadStart + payload.length);
  }

  private static ByteBuffer readFully(FileChannel channel, long position, int length) throws IOException {
    ByteBuffer buffer = ByteBuffer.allocate(length).order(ByteOrder.BIG_ENDIAN);
    long at = position;
    while (buffer.hasRemaining()) {
      int read = channel.read(buffer, at);
      if (read < 0) {
        throw new EOFException("unexpected end of container at " + at);
      }
      at += read;
    }
    return buffer.flip();
  }

  private static final class Frame {
    final byte kind;
    final byte[] json;
    final BlockHeader header;
    final byte[] payload;
    final long end;

    Frame(byte kind, byte[] json, BlockHeader header, byte[] payload, long end) {
      this.kind = kind;
      this.json = json;
      this.header = header;
      this.payload = payload;
      this.end = end;
    }
  }
}
