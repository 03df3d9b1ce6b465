package io.tessera.conv.domain.container;

import java.util.Objects;

/**
 * Codec and level applied to the blocks of one stream.
 *
 * @param algorithm block codec
 * @param level codec level, clamped into the codec's range
 * @since 0.1.0
 */
public record CompressionSettings(CompressionAlgorithm algorithm, int level) {

  public CompressionSettings {
    Objects.requireNonNull(algorithm, "algorithm");
    level = algorithm.clampLevel(level);
  }
}
