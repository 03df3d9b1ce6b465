package io.tessera.conv.infrastructure.container;

import com.fasterxml.jackson.core.JsonGenerator;
import io.tessera.conv.domain.container.CompressionAlgorithm;
import io.tessera.conv.infrastructure.json.JsonSupport;
import java.io.IOException;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * JSON header of one block frame, also repeated in the finalize catalog with its frame offset.
 *
 * @param path dataset path inside the container, e.g. {@code processing/kinematics/cursor/data}
 * @param stream owning stream
 * @param dataset dataset name ({@code data}, {@code timestamps}, or {@code valid})
 * @param dtype element type name
 * @param channels elements per row
 * @param firstRow index of the first row in the dataset
 * @param rows rows in the block
 * @param firstTimestamp first timestamp covered, NaN when unknown
 * @param lastTimestamp last timestamp covered, NaN when unknown
 * @param codec block codec
 * @param level codec level
 * @param rawLength uncompressed payload length
 * @param storedLength stored payload length
 * @param crc32 CRC-32 of the stored payload
 * @param frameOffset file offset of the frame, {@code -1} inside the frame itself
 * @since 0.1.0
 */
public record BlockHeader(
    String path,
    String stream,
    String dataset,
    String dtype,
    int channels,
    long firstRow,
    int rows,
    double firstTimestamp,
    double lastTimestamp,
    CompressionAlgorithm codec,
    int level,
    int rawLength,
    int storedLength,
    long crc32,
    long frameOffset) {

  public BlockHeader {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(stream, "stream");
    Objects.requireNonNull(dataset, "dataset");
    Objects.requireNonNull(dtype, "dtype");
    Objects.requireNonNull(codec, "codec");
    if (rows < 0 || rawLength < 0 || storedLength < 0 || firstRow < 0) {
      throw new IllegalArgumentException("negative block extent for " + path);
    }
  }

  /**
   * Returns a copy positioned at a frame offset.
   *
   * @param offset frame offset in the container file
   * @return located header
   */
  public BlockHeader at(long offset) {
    return new BlockHeader(path, stream, dataset, dtype, channels, firstRow, rows, firstTimestamp,
        lastTimestamp, codec, level, rawLength, storedLength, crc32, offset);
  }

  void write(JsonGenerator generator) throws IOException {
    generator.writeStartObject();
    generator.writeStringField("path", path);
    generator.writeStringField("stream", stream);
    generator.writeStringField("dataset", dataset);
    generator.writeStringField("dtype", dtype);
    generator.writeNumberField("channels", channels);
    generator.writeNumberField("first_row", firstRow);
    generator.writeNumberField("rows", rows);
    JsonSupport.writeDouble(generator, "first_timestamp", firstTimestamp);
    JsonSupport.writeDouble(generator, "last_timestamp", lastTimestamp);
    generator.writeStringField("codec", codec.name().toLowerCase(Locale.ROOT));
    generator.writeNumberField("level", level);
    generator.writeNumberField("raw_length", rawLength);
    generator.writeNumberField("stored_length", storedLength);
    generator.writeNumberField("crc32", crc32);
    if (frameOffset >= 0) {
      generator.writeNumberField("offset", frameOffset);
    }
    generator.writeEndObject();
  }

  static BlockHeader read(Map<String, Object> json) {
    Object offset = json.get("offset");
    return new BlockHeader(
        JsonSupport.requireString(json, "path"),
        JsonSupport.requireString(json, "stream"),
        JsonSupport.requireString(json, "dataset"),
        JsonSupport.requireString(json, "dtype"),
        Math.toIntExact(JsonSupport.requireLong(json, "channels")),
        JsonSupport.requireLong(json, "first_row"),
        Math.toIntExact(JsonSupport.requireLong(json, "rows")),
        JsonSupport.requireDouble(json, "first_timestamp"),
        JsonSupport.requireDouble(json, "last_timestamp"),
        CompressionAlgorithm.fromName(JsonSupport.requireString(json, "codec")),
        Math.toIntExact(JsonSupport.requireLong(json, "level")),
        Math.toIntExact(JsonSupport.requireLong(json, "raw_length")),
        Math.toIntExact(JsonSupport.requireLong(json, "stored_length")),
        JsonSupport.requireLong(json, "crc32"),
        offset == null ? -1L : JsonSupport.requireLong(json, "offset"));
  }
}
