package io.tessera.conv.application.source;

import io.tessera.conv.domain.error.SourceUnavailableException;
import io.tessera.conv.domain.source.RawChunk;
import java.util.Optional;

/**
 * Lazy, finite, restartable sequence of fixed-size chunks over one dataset. An empty result from
 * {@link #next()} is the end-of-stream marker, not an error.
 *
 * <p>Not thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class ChunkCursor {
  private final SourceReader reader;
  private final int rowsPerChunk;
  private long nextRow;

  ChunkCursor(SourceReader reader, int rowsPerChunk) {
    this.reader = reader;
    this.rowsPerChunk = rowsPerChunk;
  }

  /**
   * Reads the next chunk.
   *
   * @return next chunk, or empty once every row was returned
   * @throws SourceUnavailableException if the storage fails
   */
  public Optional<RawChunk> next() throws SourceUnavailableException {
    long rows = reader.descriptor().rows();
    if (nextRow >= rows) {
      return Optional.empty();
    }
    RawChunk chunk = reader.readRows(nextRow, rowsPerChunk);
    nextRow += chunk.rows();
    return Optional.of(chunk);
  }

  /** Restarts the cursor at row zero. */
  public void rewind() {
    nextRow = 0;
  }

  /**
   * Repositions the cursor.
   *
   * @param row next row to read; may equal the row count to position at the end
   */
  public void seek(long row) {
    if (row < 0 || row > reader.descriptor().rows()) {
      throw new IllegalArgumentException("cannot seek to row " + row);
    }
    nextRow = row;
  }

  public long position() {
    return nextRow;
  }

  public int rowsPerChunk() {
    return rowsPerChunk;
  }

  public boolean hasNext() {
    return nextRow < reader.descriptor().rows();
  }
}
