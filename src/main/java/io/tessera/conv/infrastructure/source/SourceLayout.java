package io.tessera.conv.infrastructure.source;

import io.tessera.conv.domain.source.DataType;
import io.tessera.conv.domain.source.DatasetDescriptor;
import io.tessera.conv.infrastructure.json.JsonSupport;
import java.nio.ByteOrder;
import java.util.Locale;
import java.util.Map;

/**
 * Constants and descriptor parsing shared by the packed and directory source layouts.
 *
 * <p>A dataset descriptor is a JSON object with {@code dtype} ({@code int16}, {@code int32},
 * {@code float32}, {@code float64}), {@code channels}, {@code rows}, and an optional
 * {@code byte_order} ({@code little} by default, or {@code big}).</p>
 *
 * @since 0.1.0
 */
public final class SourceLayout {
  /** Magic bytes opening a packed source container. */
  public static final byte[] PACKED_MAGIC = {'T', 'S', 'R', 'C'};
  /** Current packed container version. */
  public static final int PACKED_VERSION = 1;
  /** File extension of packed source containers. */
  public static final String PACKED_EXTENSION = ".tsrc";
  /** Suffix of dataset descriptor files in directory layouts. */
  public static final String DESCRIPTOR_SUFFIX = ".json";
  /** Suffix of dataset payload files in directory layouts. */
  public static final String DATA_SUFFIX = ".bin";

  private SourceLayout() {
    // Utility
  }

  /**
   * Builds a dataset descriptor from its JSON form.
   *
   * @param path dataset path
   * @param json parsed descriptor object
   * @return descriptor
   * @throws IllegalArgumentException if a field is missing or invalid
   */
  public static DatasetDescriptor parseDescriptor(String path, Map<String, Object> json) {
    DataType type = DataType.fromName(JsonSupport.requireString(json, "dtype"));
    long channels = JsonSupport.requireLong(json, "channels");
    if (channels <= 0 || channels > Integer.MAX_VALUE / type.width()) {
      throw new IllegalArgumentException("dataset " + path + " has invalid channel count " + channels);
    }
    long rows = JsonSupport.requireLong(json, "rows");
    ByteOrder order = parseOrder(JsonSupport.optionalString(json, "byte_order", "little"));
    return new DatasetDescriptor(path, type, (int) channels, rows, order);
  }

  /**
   * Renders the byte order the way descriptors store it.
   *
   * @param order byte order
   * @return {@code little} or {@code big}
   */
  public static String orderName(ByteOrder order) {
    return order == ByteOrder.BIG_ENDIAN ? "big" : "little";
  }

  private static ByteOrder parseOrder(String text) {
    switch (text.trim().toLowerCase(Locale.ROOT)) {
      case "little":
        return ByteOrder.LITTLE_ENDIAN;
      case "big":
        return ByteOrder.BIG_ENDIAN;
      default:
        throw new IllegalArgumentException("Unsupported byte_order: " + text);
    }
  }
}
