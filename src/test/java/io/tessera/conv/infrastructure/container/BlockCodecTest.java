package io.tessera.conv.infrastructure.container;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.tessera.conv.domain.container.CompressionAlgorithm;
import io.tessera.conv.domain.container.CompressionSettings;
import java.io.IOException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class BlockCodecTest {
  private static final byte[] REPETITIVE = repetitive(16_384);

  @ParameterizedTest
  @EnumSource(value = CompressionAlgorithm.class, names = {"DEFLATE", "GZIP", "BZIP2"})
  void compressingCodecsShrinkRepetitivePayloads(CompressionAlgorithm algorithm) throws IOException {
    byte[] stored = BlockCodec.encode(new CompressionSettings(algorithm, algorithm.maxLevel()), REPETITIVE);
    assertTrue(stored.length < REPETITIVE.length / 4);
    assertArrayEquals(REPETITIVE, BlockCodec.decode(algorithm, stored, REPETITIVE.length));
  }

  @Test
  void noneStoresPayloadVerbatim() throws IOException {
    byte[] stored = BlockCodec.encode(new CompressionSettings(CompressionAlgorithm.NONE, 0), REPETITIVE);
    assertArrayEquals(REPETITIVE, stored);
  }

  @Test
  void lengthMismatchIsRejected() throws IOException {
    byte[] stored = BlockCodec.encode(new CompressionSettings(CompressionAlgorithm.GZIP, 1), REPETITIVE);
    IOException ex = assertThrows(IOException.class,
        () -> BlockCodec.decode(CompressionAlgorithm.GZIP, stored, REPETITIVE.length + 1));
    assertTrue(ex.getMessage().contains("declares"));
  }

  @Test
  void garbageIsNotDecodable() {
    byte[] garbage = {1, 2, 3, 4, 5, 6, 7, 8};
    assertThrows(IOException.class, () -> BlockCodec.decode(CompressionAlgorithm.GZIP, garbage, 8));
    assertThrows(IOException.class, () -> BlockCodec.decode(CompressionAlgorithm.BZIP2, garbage, 8));
  }

  private static byte[] repetitive(int length) {
    byte[] bytes = new byte[length];
    for (int i = 0; i < length; i++) {
      bytes[i] = (byte) (i % 16);
    }
    return bytes;
  }
}
