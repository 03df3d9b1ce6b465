package io.tessera.conv.domain.source;

import java.nio.ByteBuffer;
import java.util.Locale;

/**
 * Element types supported by source and target datasets.
 *
 * @since 0.1.0
 */
public enum DataType {
  INT16(2, true),
  INT32(4, true),
  FLOAT32(4, false),
  FLOAT64(8, false);

  private final int width;
  private final boolean integral;

  DataType(int width, boolean integral) {
    this.width = width;
    this.integral = integral;
  }

  /**
   * Returns the element width in bytes.
   *
   * @return byte width of one element
   */
  public int width() {
    return width;
  }

  /**
   * Indicates whether the type stores integer codes.
   *
   * @return {@code true} for {@link #INT16} and {@link #INT32}
   */
  public boolean integral() {
    return integral;
  }

  /**
   * Returns the smallest representable value; integer rails mark clipped ADC codes.
   *
   * @return minimum value as a double
   */
  public double minValue() {
    return switch (this) {
      case INT16 -> Short.MIN_VALUE;
      case INT32 -> Integer.MIN_VALUE;
      case FLOAT32 -> -Float.MAX_VALUE;
      case FLOAT64 -> -Double.MAX_VALUE;
    };
  }

  /**
   * Returns the largest representable value.
   *
   * @return maximum value as a double
   */
  public double maxValue() {
    return switch (this) {
      case INT16 -> Short.MAX_VALUE;
      case INT32 -> Integer.MAX_VALUE;
      case FLOAT32 -> Float.MAX_VALUE;
      case FLOAT64 -> Double.MAX_VALUE;
    };
  }

  /**
   * Reads one element at an absolute byte index, honouring the buffer's byte order.
   *
   * @param buffer source buffer
   * @param byteIndex absolute index of the first byte of the element
   * @return element widened to a double
   */
  public double read(ByteBuffer buffer, int byteIndex) {
    return switch (this) {
      case INT16 -> buffer.getShort(byteIndex);
      case INT32 -> buffer.getInt(byteIndex);
      case FLOAT32 -> buffer.getFloat(byteIndex);
      case FLOAT64 -> buffer.getDouble(byteIndex);
    };
  }

  /**
   * Writes one element at the buffer's position, narrowing the value to this type.
   *
   * @param buffer target buffer
   * @param value value to store
   */
  public void write(ByteBuffer buffer, double value) {
    switch (this) {
      case INT16 -> buffer.putShort((short) value);
      case INT32 -> buffer.putInt((int) value);
      case FLOAT32 -> buffer.putFloat((float) value);
      case FLOAT64 -> buffer.putDouble(value);
    }
  }

  /**
   * Parses a type name such as {@code int16} or {@code float64} case-insensitively.
   *
   * @param text type name
   * @return matching type
   * @throws IllegalArgumentException if the name is unknown
   */
  public static DataType fromName(String text) {
    if (text == null || text.isBlank()) {
      throw new IllegalArgumentException("dtype must not be blank");
    }
    try {
      return DataType.valueOf(text.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unsupported dtype: " + text, ex);
    }
  }
}
