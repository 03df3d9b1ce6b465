package io.tessera.conv.application.port;

import io.tessera.conv.domain.session.Modality;

/**
 * Receives one event per mapped chunk. Consumed by stream summaries and metrics.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface MappingListener {
  /**
   * Called after a chunk was mapped.
   *
   * @param stream stream name
   * @param modality stream modality
   * @param samples samples mapped
   * @param invalid samples flagged invalid
   */
  void onMapped(String stream, Modality modality, int samples, int invalid);

  /** Listener that ignores events. */
  MappingListener NONE = (stream, modality, samples, invalid) -> { };
}
