package io.tessera.conv.domain.container;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class CompressionAlgorithmTest {

  @Test
  void resolvesNamesCaseInsensitively() {
    assertEquals(CompressionAlgorithm.GZIP, CompressionAlgorithm.fromName(" Gzip "));
    assertEquals(CompressionAlgorithm.BZIP2, CompressionAlgorithm.fromName("bzip2"));
    assertThrows(IllegalArgumentException.class, () -> CompressionAlgorithm.fromName("zstd"));
    assertThrows(IllegalArgumentException.class, () -> CompressionAlgorithm.fromName(" "));
  }

  @Test
  void idsAreStable() {
    for (CompressionAlgorithm algorithm : CompressionAlgorithm.values()) {
      assertEquals(algorithm, CompressionAlgorithm.fromId(algorithm.id()));
    }
    assertEquals(3, CompressionAlgorithm.BZIP2.id());
    assertThrows(IllegalArgumentException.class, () -> CompressionAlgorithm.fromId(9));
  }

  @Test
  void settingsClampLevelToCodecRange() {
    assertEquals(1, new CompressionSettings(CompressionAlgorithm.BZIP2, 0).level());
    assertEquals(9, new CompressionSettings(CompressionAlgorithm.GZIP, 12).level());
    assertEquals(0, new CompressionSettings(CompressionAlgorithm.NONE, 5).level());
  }
}
