package io.tessera.conv.domain.source;

import java.nio.ByteOrder;
import java.util.Objects;

/**
 * Shape of a named dataset inside a source container: a two-dimensional array of
 * {@code rows x channels} elements stored row-major.
 *
 * @param path dataset path inside the container
 * @param type element type
 * @param channels number of elements per row
 * @param rows number of rows
 * @param order byte order of the stored elements
 * @since 0.1.0
 */
public record DatasetDescriptor(String path, DataType type, int channels, long rows, ByteOrder order) {

  /**
   * Validates the shape.
   *
   * @throws IllegalArgumentException if channels is not positive or rows is negative
   */
  public DatasetDescriptor {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(order, "order");
    if (channels <= 0) {
      throw new IllegalArgumentException("dataset " + path + " must have at least one channel");
    }
    if (rows < 0) {
      throw new IllegalArgumentException("dataset " + path + " has negative row count");
    }
  }

  /**
   * Returns the number of bytes occupied by one row.
   *
   * @return row width in bytes
   */
  public int rowBytes() {
    return channels * type.width();
  }

  /**
   * Returns the logical byte length of the dataset.
   *
   * @return {@code rows * rowBytes()}
   */
  public long byteLength() {
    return rows * rowBytes();
  }
}
