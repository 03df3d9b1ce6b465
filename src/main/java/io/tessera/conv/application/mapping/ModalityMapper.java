package io.tessera.conv.application.mapping;

import io.tessera.conv.application.port.MappingListener;
import io.tessera.conv.domain.error.SchemaMismatchException;
import io.tessera.conv.domain.record.CanonicalRecord;
import io.tessera.conv.domain.session.Modality;
import io.tessera.conv.domain.session.StreamDescriptor;
import io.tessera.conv.domain.source.DatasetDescriptor;
import io.tessera.conv.domain.source.RawChunk;
import java.util.Optional;

/**
 * <strong>What:</strong> Per-modality transform from raw source rows to canonical records in physical units.
 * <p><strong>Role:</strong> Strategy selected once per stream from its declared modality.</p>
 * <p><strong>Thread-safety:</strong> Implementations are stateless and deterministic; the same inputs always
 * produce an equal record.</p>
 *
 * @since 0.1.0
 */
public interface ModalityMapper {
  /**
   * Returns the modality handled by this mapper.
   *
   * @return modality variant
   */
  Modality modality();

  /**
   * Verifies that the stream's datasets can be mapped, before any chunk is read.
   *
   * @param stream stream declaration
   * @param samples sample dataset shape
   * @param timestamps explicit timestamp dataset shape, when declared
   * @throws SchemaMismatchException if the element type, shape, or calibration is unusable
   */
  void checkSchema(StreamDescriptor stream, DatasetDescriptor samples, Optional<DatasetDescriptor> timestamps)
      throws SchemaMismatchException;

  /**
   * Maps one chunk. Invalid samples are flagged, never dropped.
   *
   * @param stream stream declaration
   * @param samples raw sample rows
   * @param timestamps explicit timestamp rows covering the same row range, when declared
   * @param precedingTimestamp last timestamp of the stream's previous chunk, NaN for the first chunk
   * @param listener receives one mapping event for the chunk
   * @return canonical record with one sample per row
   * @throws SchemaMismatchException if the chunks disagree with each other or with the stream
   */
  CanonicalRecord map(StreamDescriptor stream, RawChunk samples, Optional<RawChunk> timestamps,
      double precedingTimestamp, MappingListener listener) throws SchemaMismatchException;

  /**
   * Maps the first chunk of a stream, or a chunk mapped on its own.
   *
   * @see #map(StreamDescriptor, RawChunk, Optional, double, MappingListener)
   */
  default CanonicalRecord map(StreamDescriptor stream, RawChunk samples, Optional<RawChunk> timestamps,
      MappingListener listener) throws SchemaMismatchException {
    return map(stream, samples, timestamps, Double.NaN, listener);
  }
}
