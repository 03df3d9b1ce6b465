package io.tessera.conv.infrastructure.source;

import io.tessera.conv.application.port.DatasetHandle;
import io.tessera.conv.application.port.SourceStore;
import io.tessera.conv.domain.error.SchemaMismatchException;
import io.tessera.conv.domain.error.SourceUnavailableException;
import io.tessera.conv.domain.source.DatasetDescriptor;
import io.tessera.conv.infrastructure.json.JsonSupport;
import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Source store over a packed single-file container ({@code .tsrc}).
 * <p><strong>Format:</strong> magic {@code TSRC}, big-endian {@code u16} version, big-endian {@code u32}
 * catalog length, UTF-8 JSON catalog, then dataset payload extents at absolute offsets. The catalog is
 * {@code {"datasets":[{"path", "dtype", "channels", "rows", "byte_order",
 * "extents":[{"offset","length"}]}]}}; a dataset with one extent is contiguous, several extents
 * describe a chunked layout.</p>
 * <p><strong>Thread-safety:</strong> One shared {@link FileChannel} serves every handle through positional reads.</p>
 *
 * @since 0.1.0
 */
public final class PackedSourceStore implements SourceStore {
  private static final Logger log = LoggerFactory.getLogger(PackedSourceStore.class);
  private static final int HEADER_BYTES = 10;
  private static final int MAX_CATALOG_BYTES = 64 * 1024 * 1024;

  private record Entry(DatasetDescriptor descriptor, List<long[]> extents) {}

  private final Path location;
  private final FileChannel channel;
  private final long fileSize;
  private final Map<String, Entry> catalog;

  private PackedSourceStore(Path location, FileChannel channel, long fileSize, Map<String, Entry> catalog) {
    this.location = location;
    this.channel = channel;
    this.fileSize = fileSize;
    this.catalog = catalog;
  }

  /**
   * Opens a packed container and reads its catalog.
   *
   * @param location container file
   * @return open store
   * @throws SourceUnavailableException if the file is missing, not a packed container, or its catalog is corrupt
   */
  public static PackedSourceStore open(Path location) throws SourceUnavailableException {
    FileChannel channel;
    try {
      channel = FileChannel.open(location, StandardOpenOption.READ);
    } catch (IOException ex) {
      throw new SourceUnavailableException(null, "cannot open source " + location + ": " + ex.getMessage(), ex);
    }
    try {
      long size = channel.size();
      ByteBuffer header = ByteBuffer.allocate(HEADER_BYTES).order(ByteOrder.BIG_ENDIAN);
      readFully(channel, header, 0);
      header.flip();
      byte[] magic = new byte[SourceLayout.PACKED_MAGIC.length];
      header.get(magic);
      if (!Arrays.equals(magic, SourceLayout.PACKED_MAGIC)) {
        throw new SourceUnavailableException(null, location + " is not a packed source container");
      }
      int version = Short.toUnsignedInt(header.getShort());
      if (version != SourceLayout.PACKED_VERSION) {
        throw new SourceUnavailableException(null, location + " has unsupported version " + version);
      }
      long catalogLength = Integer.toUnsignedLong(header.getInt());
      if (catalogLength > MAX_CATALOG_BYTES || HEADER_BYTES + catalogLength > size) {
        throw new SourceUnavailableException(null, location + " has a truncated catalog");
      }
      ByteBuffer catalogBytes = ByteBuffer.allocate((int) catalogLength);
      readFully(channel, catalogBytes, HEADER_BYTES);
      Map<String, Entry> catalog = parseCatalog(location, catalogBytes.array());
      log.debug("Opened packed source {} with {} dataset(s)", location, catalog.size());
      return new PackedSourceStore(location, channel, size, catalog);
    } catch (SourceUnavailableException ex) {
      closeQuietly(channel, ex);
      throw ex;
    } catch (EOFException ex) {
      SourceUnavailableException failure =
          new SourceUnavailableException(null, location + " is truncated", ex);
      closeQuietly(channel, failure);
      throw failure;
    } catch (IOException | IllegalArgumentException ex) {
      SourceUnavailableException failure =
          new SourceUnavailableException(null, "corrupt source " + location + ": " + ex.getMessage(), ex);
      closeQuietly(channel, failure);
      throw failure;
    }
  }

  @Override
  public Path location() {
    return location;
  }

  @Override
  public Set<String> datasetPaths() {
    return Collections.unmodifiableSet(catalog.keySet());
  }

  @Override
  public DatasetHandle open(String datasetPath) throws SourceUnavailableException, SchemaMismatchException {
    Entry entry = catalog.get(normalize(datasetPath));
    if (entry == null) {
      throw new SourceUnavailableException(null, "dataset " + datasetPath + " not found in " + location);
    }
    long stored = 0;
    List<ExtentDatasetHandle.Extent> extents = new ArrayList<>(entry.extents().size());
    for (long[] extent : entry.extents()) {
      if (extent[0] + extent[1] > fileSize) {
        throw new SourceUnavailableException(null,
            "dataset " + datasetPath + " in " + location + " is truncated (extent ends at "
                + (extent[0] + extent[1]) + ", file has " + fileSize + " bytes)");
      }
      stored += extent[1];
      extents.add(new ExtentDatasetHandle.Extent(channel, extent[0], extent[1]));
    }
    DatasetDescriptor descriptor = entry.descriptor();
    if (stored != descriptor.byteLength()) {
      throw new SchemaMismatchException(null,
          "dataset " + datasetPath + " stores " + stored + " bytes but its shape requires "
              + descriptor.byteLength());
    }
    return new ExtentDatasetHandle(descriptor, extents, List.of());
  }

  @Override
  public void close() throws IOException {
    channel.close();
  }

  private static Map<String, Entry> parseCatalog(Path location, byte[] json) {
    Map<String, Object> root = JsonSupport.parseObject(json);
    Map<String, Entry> catalog = new LinkedHashMap<>();
    for (Object item : JsonSupport.asArray("datasets", root.get("datasets"))) {
      Map<String, Object> dataset = JsonSupport.asObject("dataset", item);
      String path = normalize(JsonSupport.requireString(dataset, "path"));
      DatasetDescriptor descriptor = SourceLayout.parseDescriptor(path, dataset);
      List<long[]> extents = new ArrayList<>();
      for (Object rawExtent : JsonSupport.asArray("extents", dataset.get("extents"))) {
        Map<String, Object> extent = JsonSupport.asObject("extent", rawExtent);
        long offset = JsonSupport.requireLong(extent, "offset");
        long length = JsonSupport.requireLong(extent, "length");
        if (offset < HEADER_BYTES || length < 0) {
          throw new IllegalArgumentException("dataset " + path + " has an invalid extent");
        }
        extents.add(new long[] {offset, length});
      }
      if (catalog.put(path, new Entry(descriptor, extents)) != null) {
        throw new IllegalArgumentException("dataset " + path + " listed twice in " + location);
      }
    }
    return catalog;
  }

  private static String normalize(String datasetPath) {
    String path = datasetPath == null ? "" : datasetPath.trim();
    while (path.startsWith("/")) {
      path = path.substring(1);
    }
    return path;
  }

  private static void readFully(FileChannel channel, ByteBuffer buffer, long position) throws IOException {
    long cursor = position;
    while (buffer.hasRemaining()) {
      int n = channel.read(buffer, cursor);
      if (n < 0) {
        throw new EOFException("unexpected end of file at " + cursor);
      }
      cursor += n;
    }
  }

  private static void closeQuietly(FileChannel channel, Exception primary) {
    try {
      channel.close();
    } catch (IOException closeEx) {
      primary.addSuppressed(closeEx);
    }
  }
}
