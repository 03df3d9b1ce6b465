package io.tessera.conv.application.source;

import io.tessera.conv.application.port.DatasetHandle;
import io.tessera.conv.application.port.SourceStore;
import io.tessera.conv.domain.error.SchemaMismatchException;
import io.tessera.conv.domain.error.SourceUnavailableException;
import io.tessera.conv.domain.source.DatasetDescriptor;
import io.tessera.conv.domain.source.RawChunk;
import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * <strong>What:</strong> Lazy, chunked access to one named dataset of a source container.
 * <p><strong>Why:</strong> Sources can exceed available memory, so rows are only materialized one bounded
 * chunk at a time.</p>
 * <p><strong>Role:</strong> Leaf of the conversion pipeline; wraps a scoped {@link DatasetHandle}.</p>
 * <p><strong>Thread-safety:</strong> Positional reads are safe from several threads; each {@link ChunkCursor}
 * must stay on one thread.</p>
 * <p><strong>Performance:</strong> Memory per read is bounded by the requested row count times the row width.</p>
 *
 * @since 0.1.0
 */
public final class SourceReader implements AutoCloseable {
  private final String stream;
  private final DatasetHandle handle;
  private final DatasetDescriptor descriptor;
  private final AtomicBoolean closed = new AtomicBoolean();
  private final AtomicLong bytesRead = new AtomicLong();
  private final AtomicLong chunksRead = new AtomicLong();

  private SourceReader(String stream, DatasetHandle handle) {
    this.stream = stream;
    this.handle = handle;
    this.descriptor = handle.descriptor();
  }

  /**
   * Acquires a handle on {@code datasetPath}.
   *
   * @param store open source store
   * @param stream stream name used in diagnostics
   * @param datasetPath dataset path inside the store
   * @return open reader; the caller must close it
   * @throws SourceUnavailableException if the dataset is absent or unreadable
   * @throws SchemaMismatchException if the stored layout contradicts the dataset shape
   */
  public static SourceReader open(SourceStore store, String stream, String datasetPath)
      throws SourceUnavailableException, SchemaMismatchException {
    Objects.requireNonNull(store, "store");
    Objects.requireNonNull(stream, "stream");
    return new SourceReader(stream, store.open(datasetPath));
  }

  public String stream() {
    return stream;
  }

  public DatasetDescriptor descriptor() {
    return descriptor;
  }

  /**
   * Creates a restartable cursor yielding chunks of whole rows.
   *
   * @param chunkBytes target chunk size in bytes; at least one row is always returned per chunk
   * @return cursor positioned at row zero
   */
  public ChunkCursor cursor(long chunkBytes) {
    if (chunkBytes <= 0) {
      throw new IllegalArgumentException("chunkBytes must be > 0");
    }
    long rows = Math.max(1L, chunkBytes / descriptor.rowBytes());
    int rowsPerChunk = (int) Math.min(rows, Integer.MAX_VALUE / descriptor.rowBytes());
    return new ChunkCursor(this, rowsPerChunk);
  }

  /**
   * Reads a run of rows without materializing the rest of the dataset.
   *
   * @param firstRow index of the first row
   * @param count number of rows; trimmed to the dataset end
   * @return chunk holding the rows
   * @throws SourceUnavailableException if the storage cannot supply the bytes
   * @throws IllegalArgumentException if {@code firstRow} lies outside the dataset
   */
  public RawChunk readRows(long firstRow, int count) throws SourceUnavailableException {
    ensureOpen();
    if (firstRow < 0 || firstRow > descriptor.rows()) {
      throw new IllegalArgumentException(
          "row " + firstRow + " outside dataset " + descriptor.path() + " of " + descriptor.rows() + " rows");
    }
    int rows = (int) Math.min(Math.max(0, count), descriptor.rows() - firstRow);
    if ((long) rows * descriptor.rowBytes() > Integer.MAX_VALUE) {
      throw new IllegalArgumentException("read of " + rows + " rows exceeds a single buffer");
    }
    ByteBuffer buffer = ByteBuffer.allocate(rows * descriptor.rowBytes());
    try {
      handle.read(firstRow * descriptor.rowBytes(), buffer);
    } catch (EOFException ex) {
      throw new SourceUnavailableException(stream,
          "dataset " + descriptor.path() + " is truncated at row " + firstRow, ex);
    } catch (IOException ex) {
      throw new SourceUnavailableException(stream,
          "failed to read dataset " + descriptor.path() + ": " + ex.getMessage(), ex);
    }
    buffer.flip();
    bytesRead.addAndGet(buffer.remaining());
    chunksRead.incrementAndGet();
    return new RawChunk(descriptor, firstRow, rows, buffer);
  }

  /**
   * Returns bytes read through this reader so far.
   *
   * @return cumulative byte count
   */
  public long bytesRead() {
    return bytesRead.get();
  }

  /**
   * Returns reads performed through this reader so far.
   *
   * @return cumulative chunk count
   */
  public long chunksRead() {
    return chunksRead.get();
  }

  public boolean isClosed() {
    return closed.get();
  }

  /**
   * Releases the dataset handle. Safe to call more than once.
   *
   * @throws IOException if the handle fails to close
   */
  @Override
  public void close() throws IOException {
    if (closed.compareAndSet(false, true)) {
      handle.close();
    }
  }

  private void ensureOpen() {
    if (closed.get()) {
      throw new IllegalStateException("reader for " + descriptor.path() + " is closed");
    }
  }
}
