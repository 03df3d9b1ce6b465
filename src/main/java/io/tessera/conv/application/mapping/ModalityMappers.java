package io.tessera.conv.application.mapping;

import io.tessera.conv.domain.session.Modality;
import io.tessera.conv.domain.session.StreamDescriptor;
import java.util.EnumMap;
import java.util.Map;

/**
 * Dispatch table from modality to mapper. The variant is fixed per stream, never per chunk.
 *
 * @since 0.1.0
 */
public final class ModalityMappers {
  private final Map<Modality, ModalityMapper> mappers = new EnumMap<>(Modality.class);

  /** Creates the table with the built-in mapper for every modality. */
  public ModalityMappers() {
    register(new ElectrophysiologyMapper());
    register(new KinematicsMapper());
    register(new EyeTrackingMapper());
    register(new BehavioralMapper());
  }

  /**
   * Selects the mapper for a stream's declared modality.
   *
   * @param stream stream declaration
   * @return mapper
   */
  public ModalityMapper forStream(StreamDescriptor stream) {
    return forModality(stream.modality());
  }

  /**
   * Selects the mapper for a modality.
   *
   * @param modality modality
   * @return mapper
   * @throws IllegalStateException if no mapper is registered
   */
  public ModalityMapper forModality(Modality modality) {
    ModalityMapper mapper = mappers.get(modality);
    if (mapper == null) {
      throw new IllegalStateException("no mapper registered for " + modality);
    }
    return mapper;
  }

  private void register(ModalityMapper mapper) {
    mappers.put(mapper.modality(), mapper);
  }
}
