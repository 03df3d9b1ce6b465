package io.tessera.conv.domain.source;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Objects;

/**
 * <strong>What:</strong> A bounded run of whole rows read from one dataset.
 * <p><strong>Role:</strong> Unit of transfer between the source reader, the mappers, and the raw
 * acquisition mirror of the target writer.</p>
 * <p><strong>Thread-safety:</strong> Effectively immutable; accessors read from a read-only view.</p>
 *
 * @since 0.1.0
 */
public final class RawChunk {
  private final DatasetDescriptor dataset;
  private final long firstRow;
  private final int rows;
  private final ByteBuffer data;

  /**
   * Creates a chunk over the supplied bytes.
   *
   * @param dataset descriptor of the dataset the rows came from
   * @param firstRow index of the first row in the dataset
   * @param rows number of rows held
   * @param data row-major element bytes; exactly {@code rows * rowBytes} long
   * @throws IllegalArgumentException if the byte count does not match the shape
   */
  public RawChunk(DatasetDescriptor dataset, long firstRow, int rows, ByteBuffer data) {
    this.dataset = Objects.requireNonNull(dataset, "dataset");
    if (firstRow < 0 || rows < 0) {
      throw new IllegalArgumentException("firstRow and rows must be >= 0");
    }
    Objects.requireNonNull(data, "data");
    long expected = (long) rows * dataset.rowBytes();
    if (data.remaining() != expected) {
      throw new IllegalArgumentException(
          "chunk of " + dataset.path() + " holds " + data.remaining() + " bytes, expected " + expected);
    }
    this.firstRow = firstRow;
    this.rows = rows;
    this.data = data.slice().asReadOnlyBuffer().order(dataset.order());
  }

  public DatasetDescriptor dataset() {
    return dataset;
  }

  public DataType type() {
    return dataset.type();
  }

  public int channels() {
    return dataset.channels();
  }

  public long firstRow() {
    return firstRow;
  }

  public int rows() {
    return rows;
  }

  /**
   * Returns the number of payload bytes held by the chunk.
   *
   * @return byte count
   */
  public int sizeBytes() {
    return data.capacity();
  }

  /**
   * Reads one element.
   *
   * @param row row index relative to {@link #firstRow()}
   * @param channel channel index
   * @return element widened to a double
   * @throws IndexOutOfBoundsException if either index is outside the chunk
   */
  public double value(int row, int channel) {
    Objects.checkIndex(row, rows);
    Objects.checkIndex(channel, dataset.channels());
    int index = (row * dataset.channels() + channel) * dataset.type().width();
    return dataset.type().read(data, index);
  }

  /**
   * Copies the payload bytes in the stored byte order.
   *
   * @return fresh array owned by the caller
   */
  public byte[] bytes() {
    byte[] copy = new byte[data.capacity()];
    data.duplicate().position(0).get(copy);
    return copy;
  }

  /**
   * Copies the payload bytes converted to little-endian order, the byte order of target containers.
   *
   * @return fresh little-endian array owned by the caller
   */
  public byte[] littleEndianBytes() {
    if (dataset.order() == ByteOrder.LITTLE_ENDIAN) {
      return bytes();
    }
    ByteBuffer out = ByteBuffer.allocate(data.capacity()).order(ByteOrder.LITTLE_ENDIAN);
    int elements = rows * dataset.channels();
    int width = dataset.type().width();
    for (int i = 0; i < elements; i++) {
      dataset.type().write(out, dataset.type().read(data, i * width));
    }
    return out.array();
  }

  @Override
  public String toString() {
    return "RawChunk{" + dataset.path() + ", firstRow=" + firstRow + ", rows=" + rows + '}';
  }
}
