package io.tessera.conv.domain.container;

import java.util.Locale;

/**
 * Block codecs supported by the target container. Each block records its own codec id, so one
 * container may mix algorithms across streams.
 *
 * @since 0.1.0
 */
public enum CompressionAlgorithm {
  NONE(0, 0, 0, 0),
  DEFLATE(1, 0, 9, 6),
  GZIP(2, 0, 9, 6),
  BZIP2(3, 1, 9, 9);

  private final int id;
  private final int minLevel;
  private final int maxLevel;
  private final int defaultLevel;

  CompressionAlgorithm(int id, int minLevel, int maxLevel, int defaultLevel) {
    this.id = id;
    this.minLevel = minLevel;
    this.maxLevel = maxLevel;
    this.defaultLevel = defaultLevel;
  }

  public int id() {
    return id;
  }

  public int minLevel() {
    return minLevel;
  }

  public int maxLevel() {
    return maxLevel;
  }

  public int defaultLevel() {
    return defaultLevel;
  }

  /**
   * Clamps a configured level into the range this codec accepts.
   *
   * @param level configured level
   * @return level within {@code [minLevel, maxLevel]}
   */
  public int clampLevel(int level) {
    return Math.max(minLevel, Math.min(maxLevel, level));
  }

  /**
   * Parses an algorithm name case-insensitively.
   *
   * @param text algorithm name
   * @return matching algorithm
   * @throws IllegalArgumentException if the name is unknown
   */
  public static CompressionAlgorithm fromName(String text) {
    if (text == null || text.isBlank()) {
      throw new IllegalArgumentException("compression algorithm must not be blank");
    }
    try {
      return CompressionAlgorithm.valueOf(text.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unsupported compression algorithm: " + text, ex);
    }
  }

  /**
   * Resolves a codec from its stored id.
   *
   * @param id stored codec id
   * @return matching algorithm
   * @throws IllegalArgumentException if the id is unknown
   */
  public static CompressionAlgorithm fromId(int id) {
    for (CompressionAlgorithm algorithm : values()) {
      if (algorithm.id == id) {
        return algorithm;
      }
    }
    throw new IllegalArgumentException("Unknown codec id: " + id);
  }
}
