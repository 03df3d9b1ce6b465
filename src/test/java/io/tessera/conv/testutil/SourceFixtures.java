package io.tessera.conv.testutil;

import io.tessera.conv.domain.session.Calibration;
import io.tessera.conv.domain.session.Modality;
import io.tessera.conv.domain.session.SessionDescriptor;
import io.tessera.conv.domain.session.SessionId;
import io.tessera.conv.domain.session.StreamDescriptor;
import io.tessera.conv.domain.source.DataType;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Writes small source containers for tests, in both the directory and the packed layout.
 */
public final class SourceFixtures {

  /** Dataset content: row-major values narrowed to {@code type} when written. */
  public record Dataset(String path, DataType type, int channels, double[] values) {
    public long rows() {
      return values.length / channels;
    }
  }

  private SourceFixtures() {}

  public static Dataset dataset(String path, DataType type, int channels, double[] values) {
    return new Dataset(path, type, channels, values);
  }

  /**
   * Writes a dataset into a directory layout as {@code <path>.json} plus {@code <path>.bin}.
   */
  public static void writeDirectoryDataset(Path root, Dataset dataset) throws IOException {
    Path descriptor = root.resolve(dataset.path() + ".json");
    Files.createDirectories(descriptor.getParent());
    Files.writeString(descriptor, descriptorJson(dataset), StandardCharsets.UTF_8);
    Files.write(root.resolve(dataset.path() + ".bin"), encode(dataset, ByteOrder.LITTLE_ENDIAN));
  }

  /**
   * Writes a directory-layout source container holding every dataset.
   */
  public static Path writeDirectory(Path root, List<Dataset> datasets) throws IOException {
    Files.createDirectories(root);
    for (Dataset dataset : datasets) {
      writeDirectoryDataset(root, dataset);
    }
    return root;
  }

  /**
   * Writes a packed {@code .tsrc} file holding every dataset contiguously after the catalog.
   */
  public static Path writePacked(Path file, List<Dataset> datasets) throws IOException {
    List<byte[]> payloads = new ArrayList<>();
    for (Dataset dataset : datasets) {
      payloads.add(encode(dataset, ByteOrder.LITTLE_ENDIAN));
    }
    // Offsets depend on the catalog length, which depends on the offsets; widen the digits until stable.
    byte[] catalog = catalog(datasets, payloads, 0);
    for (int i = 0; i < 4; i++) {
      catalog = catalog(datasets, payloads, 10 + catalog.length);
    }
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    ByteBuffer header = ByteBuffer.allocate(10).order(ByteOrder.BIG_ENDIAN);
    header.put(new byte[] {'T', 'S', 'R', 'C'});
    header.putShort((short) 1);
    header.putInt(catalog.length);
    out.write(header.array());
    out.write(catalog);
    for (byte[] payload : payloads) {
      out.write(payload);
    }
    Files.createDirectories(file.toAbsolutePath().getParent());
    Files.write(file, out.toByteArray());
    return file;
  }

  /** Rows {@code 0..rows-1} of {@code channels} channels where value = row * 10 + channel. */
  public static double[] ramp(int rows, int channels) {
    double[] values = new double[rows * channels];
    for (int row = 0; row < rows; row++) {
      for (int ch = 0; ch < channels; ch++) {
        values[row * channels + ch] = row * 10d + ch;
      }
    }
    return values;
  }

  /** Evenly spaced timestamps. */
  public static double[] clock(int rows, double rateHz, double start) {
    double[] times = new double[rows];
    for (int i = 0; i < rows; i++) {
      times[i] = start + i / rateHz;
    }
    return times;
  }

  /**
   * Writes a healthy three-stream session (ephys 1 kHz x 2 ch, kinematics 100 Hz x 2 ch, irregular events)
   * covering one second, and returns its descriptor.
   *
   * @param dir directory receiving the source container
   * @param subject subject code
   * @param index session index
   * @return descriptor pointing at the written directory container
   */
  public static SessionDescriptor healthySession(Path dir, String subject, int index) throws IOException {
    Path source = writeDirectory(dir.resolve(subject + "_" + index), List.of(
        dataset("ecog/samples", DataType.INT16, 2, ramp(1_000, 2)),
        dataset("cursor/position", DataType.FLOAT32, 2, ramp(100, 2)),
        dataset("task/codes", DataType.FLOAT64, 1, new double[] {1, 2, 3, 4}),
        dataset("task/times", DataType.FLOAT64, 1, new double[] {0.05, 0.25, 0.5, 0.9})));
    return new SessionDescriptor(
        new SessionId(subject, LocalDate.of(2024, 3, 1), index),
        List.of(
            new StreamDescriptor("ecog", Modality.ELECTROPHYSIOLOGY, source, "ecog/samples", Optional.empty(),
                1_000d, 0d, new Calibration(0.25d, 0d, "uV", Map.of())),
            new StreamDescriptor("cursor", Modality.KINEMATICS, source, "cursor/position", Optional.empty(),
                100d, 0d, new Calibration(0.001d, 0d, "m", Map.of())),
            new StreamDescriptor("events", Modality.BEHAVIORAL, source, "task/codes", Optional.of("task/times"),
                0d, 0d, Calibration.identity(""))),
        Map.of("experimenter", "lab", "task", "center_out"));
  }

  private static byte[] catalog(List<Dataset> datasets, List<byte[]> payloads, int dataStart) {
    StringBuilder sb = new StringBuilder("{\"datasets\":[");
    long offset = dataStart;
    for (int i = 0; i < datasets.size(); i++) {
      Dataset dataset = datasets.get(i);
      if (i > 0) {
        sb.append(',');
      }
      sb.append(String.format(Locale.ROOT,
          "{\"path\":\"%s\",\"dtype\":\"%s\",\"channels\":%d,\"rows\":%d,\"byte_order\":\"little\","
              + "\"extents\":[{\"offset\":%d,\"length\":%d}]}",
          dataset.path(), dataset.type().name().toLowerCase(Locale.ROOT), dataset.channels(), dataset.rows(),
          offset, payloads.get(i).length));
      offset += payloads.get(i).length;
    }
    sb.append("]}");
    return sb.toString().getBytes(StandardCharsets.UTF_8);
  }

  private static String descriptorJson(Dataset dataset) {
    return String.format(Locale.ROOT, "{\"dtype\":\"%s\",\"channels\":%d,\"rows\":%d}",
        dataset.type().name().toLowerCase(Locale.ROOT), dataset.channels(), dataset.rows());
  }

  private static byte[] encode(Dataset dataset, ByteOrder order) {
    ByteBuffer buffer = ByteBuffer.allocate(dataset.values().length * dataset.type().width()).order(order);
    for (double value : dataset.values()) {
      dataset.type().write(buffer, value);
    }
    return buffer.array();
  }
}
