package io.tessera.conv.infrastructure.container;

import io.tessera.conv.domain.container.CompressionAlgorithm;
import io.tessera.conv.domain.container.CompressionSettings;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.zip.Deflater;
import java.util.zip.DeflaterOutputStream;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;
import java.util.zip.InflaterInputStream;
import org.apache.commons.compress.compressors.bzip2.BZip2CompressorInputStream;
import org.apache.commons.compress.compressors.bzip2.BZip2CompressorOutputStream;

/**
 * Per-block compression. DEFLATE and GZIP use {@code java.util.zip}; BZIP2 uses Apache Commons Compress
 * with the level as block size (1 to 9, in units of 100k).
 *
 * @since 0.1.0
 */
public final class BlockCodec {
  private BlockCodec() {
    // Utility
  }

  /**
   * Compresses a block payload.
   *
   * @param settings codec and level
   * @param raw uncompressed payload
   * @return stored bytes
   * @throws IOException if the codec fails
   */
  public static byte[] encode(CompressionSettings settings, byte[] raw) throws IOException {
    if (settings.algorithm() == CompressionAlgorithm.NONE) {
      return raw.clone();
    }
    ByteArrayOutputStream buffer = new ByteArrayOutputStream(Math.max(64, raw.length / 2));
    try (OutputStream out = compressor(settings, buffer)) {
      out.write(raw);
    }
    return buffer.toByteArray();
  }

  /**
   * Restores a block payload.
   *
   * @param algorithm codec recorded for the block
   * @param stored stored bytes
   * @param rawLength expected uncompressed length
   * @return uncompressed payload
   * @throws IOException if the codec fails or the length disagrees
   */
  public static byte[] decode(CompressionAlgorithm algorithm, byte[] stored, int rawLength) throws IOException {
    byte[] raw;
    if (algorithm == CompressionAlgorithm.NONE) {
      raw = stored.clone();
    } else {
      try (InputStream in = decompressor(algorithm, new ByteArrayInputStream(stored))) {
        raw = in.readAllBytes();
      }
    }
    if (raw.length != rawLength) {
      throw new IOException("decoded " + raw.length + " bytes, block declares " + rawLength);
    }
    return raw;
  }

  private static OutputStream compressor(CompressionSettings settings, OutputStream target) throws IOException {
    int level = settings.level();
    return switch (settings.algorithm()) {
      case DEFLATE -> new DeflaterOutputStream(target, new Deflater(level), true) {
        @Override
        public void close() throws IOException {
          try {
            super.close();
          } finally {
            def.end();
          }
        }
      };
      case GZIP -> new GZIPOutputStream(target) {
        {
          def.setLevel(level);
        }
      };
      case BZIP2 -> new BZip2CompressorOutputStream(target, level);
      case NONE -> target;
    };
  }

  private static InputStream decompressor(CompressionAlgorithm algorithm, InputStream source) throws IOException {
    return switch (algorithm) {
      case DEFLATE -> new InflaterInputStream(source);
      case GZIP -> new GZIPInputStream(source);
      case BZIP2 -> new BZip2CompressorInputStream(source);
      case NONE -> source;
    };
  }
}
