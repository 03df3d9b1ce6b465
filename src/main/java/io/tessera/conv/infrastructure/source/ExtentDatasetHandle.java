package io.tessera.conv.infrastructure.source;

import io.tessera.conv.application.port.DatasetHandle;
import io.tessera.conv.domain.source.DatasetDescriptor;
import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Dataset handle that maps the logical byte space of a dataset onto an ordered
 * list of file extents.
 * <p><strong>Why:</strong> Contiguous, chunked, and multi-file layouts all reduce to "these byte ranges,
 * in this order", so one handle serves every source layout.</p>
 * <p><strong>Thread-safety:</strong> Uses positional {@link FileChannel} reads only; safe for concurrent readers.</p>
 *
 * @since 0.1.0
 */
final class ExtentDatasetHandle implements DatasetHandle {

  /**
   * One contiguous byte range of a file.
   *
   * @param channel open channel
   * @param fileOffset absolute offset of the range
   * @param length range length in bytes
   */
  record Extent(FileChannel channel, long fileOffset, long length) {}

  private final DatasetDescriptor descriptor;
  private final List<Extent> extents;
  private final long[] logicalStarts;
  private final long logicalLength;
  private final List<FileChannel> owned;

  /**
   * Creates a handle.
   *
   * @param descriptor dataset shape
   * @param extents extents in logical order
   * @param owned channels closed together with the handle; shared channels must not be listed
   */
  ExtentDatasetHandle(DatasetDescriptor descriptor, List<Extent> extents, List<FileChannel> owned) {
    this.descriptor = Objects.requireNonNull(descriptor, "descriptor");
    this.extents = List.copyOf(extents);
    this.owned = new ArrayList<>(owned);
    this.logicalStarts = new long[this.extents.size()];
    long cursor = 0;
    for (int i = 0; i < this.extents.size(); i++) {
      logicalStarts[i] = cursor;
      cursor += this.extents.get(i).length();
    }
    this.logicalLength = cursor;
  }

  @Override
  public DatasetDescriptor descriptor() {
    return descriptor;
  }

  @Override
  public void read(long logicalOffset, ByteBuffer target) throws IOException {
    if (logicalOffset < 0) {
      throw new IllegalArgumentException("negative offset");
    }
    if (logicalOffset + target.remaining() > logicalLength) {
      throw new EOFException("read of " + target.remaining() + " bytes at " + logicalOffset
          + " exceeds dataset length " + logicalLength);
    }
    long position = logicalOffset;
    int index = extentIndex(position);
    while (target.hasRemaining()) {
      Extent extent = extents.get(index);
      long within = position - logicalStarts[index];
      long available = extent.length() - within;
      int limit = target.limit();
      if (target.remaining() > available) {
        target.limit(target.position() + (int) available);
      }
      long filePosition = extent.fileOffset() + within;
      while (target.hasRemaining()) {
        int n = extent.channel().read(target, filePosition);
        if (n < 0) {
          throw new EOFException("extent of " + descriptor.path() + " ends early at file offset " + filePosition);
        }
        filePosition += n;
        position += n;
      }
      target.limit(limit);
      index++;
    }
  }

  @Override
  public void close() throws IOException {
    IOException failure = null;
    for (FileChannel channel : owned) {
      try {
        channel.close();
      } catch (IOException ex) {
        if (failure == null) {
          failure = ex;
        } else {
          failure.addSuppressed(ex);
        }
      }
    }
    owned.clear();
    if (failure != null) {
      throw failure;
    }
  }

  private int extentIndex(long position) {
    int low = 0;
    int high = logicalStarts.length - 1;
    while (low < high) {
      int mid = (low + high + 1) >>> 1;
      if (logicalStarts[mid] <= position) {
        low = mid;
      } else {
        high = mid - 1;
      }
    }
    return low;
  }
}
