package io.tessera.conv.application.port;

import io.tessera.conv.domain.container.ContainerMetadata;
import io.tessera.conv.domain.error.WriteFailureException;
import io.tessera.conv.domain.record.CanonicalRecord;
import io.tessera.conv.domain.source.RawChunk;
import java.io.IOException;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Incremental, crash-safe writer of one target container.
 * <p><strong>Why:</strong> Lets the pipeline append bounded windows as they are produced; the container only
 * becomes valid once {@link #finalizeContainer(ContainerMetadata)} completes.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Mirror raw acquisition chunks into the {@code acquisition} section.</li>
 *   <li>Append canonical records into the {@code processing} section.</li>
 *   <li>Write session metadata into the {@code general} section on finalize.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; the pipeline drives a writer from a single thread.</p>
 * <p><strong>Observability:</strong> Implementations emit {@code convert.write.*} metrics.</p>
 *
 * @since 0.1.0
 */
public interface TargetWriter extends AutoCloseable {
  /**
   * Returns the container location.
   *
   * @return target path
   */
  Path location();

  /**
   * Appends raw rows to the acquisition mirror of a stream.
   *
   * @param stream stream name
   * @param chunk raw rows in source order
   * @throws WriteFailureException if storage fails
   */
  void appendRaw(String stream, RawChunk chunk) throws WriteFailureException;

  /**
   * Appends a canonical window to the processed section of its stream.
   *
   * @param record mapped window in stream order
   * @throws WriteFailureException if storage fails
   */
  void append(CanonicalRecord record) throws WriteFailureException;

  /**
   * Flushes buffers, writes the metadata section, and marks the container complete.
   *
   * @param metadata session-level metadata
   * @throws WriteFailureException if storage fails; the container stays incomplete
   */
  void finalizeContainer(ContainerMetadata metadata) throws WriteFailureException;

  /**
   * Marks the container aborted without flushing buffered data. Never throws; storage errors are logged.
   */
  void abandon();

  /**
   * Indicates whether {@link #finalizeContainer(ContainerMetadata)} completed.
   *
   * @return {@code true} once the container is valid
   */
  boolean finalized();

  /**
   * Returns the bytes written to storage so far.
   *
   * @return byte count including framing
   */
  long bytesWritten();

  /**
   * Releases the underlying file; an unfinalized container is left marked incomplete.
   *
   * @throws IOException if the file cannot be closed
   */
  @Override
  void close() throws IOException;
}
