package io.tessera.conv.application.port;

import io.tessera.conv.domain.source.DatasetDescriptor;
import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * Positional read access to one dataset's logical byte space, independent of how the bytes are
 * laid out on disk (contiguous, chunked, or split across files).
 *
 * @since 0.1.0
 */
public interface DatasetHandle extends Closeable {
  /**
   * Returns the dataset shape.
   *
   * @return descriptor; never {@code null}
   */
  DatasetDescriptor descriptor();

  /**
   * Fills the remaining space of {@code target} with bytes starting at the logical offset.
   *
   * @param logicalOffset byte offset within the dataset
   * @param target destination buffer; filled completely on success
   * @throws java.io.EOFException if the stored bytes end before the buffer is full
   * @throws IOException if the underlying storage cannot be read
   */
  void read(long logicalOffset, ByteBuffer target) throws IOException;
}
