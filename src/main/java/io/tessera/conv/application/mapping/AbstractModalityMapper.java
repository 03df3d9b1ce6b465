package io.tessera.conv.application.mapping;

import io.tessera.conv.application.port.MappingListener;
import io.tessera.conv.domain.error.SchemaMismatchException;
import io.tessera.conv.domain.record.CanonicalRecord;
import io.tessera.conv.domain.session.Calibration;
import io.tessera.conv.domain.session.StreamDescriptor;
import io.tessera.conv.domain.source.DataType;
import io.tessera.conv.domain.source.DatasetDescriptor;
import io.tessera.conv.domain.source.RawChunk;
import java.util.Optional;

/**
 * <strong>What:</strong> Shared mapping loop: timestamp resolution, per-sample validity, and calibration.
 * <p><strong>Timestamps:</strong> explicit timestamps (FLOAT64 seconds, one channel) win; otherwise
 * {@code start + row / rate}. A NaN or infinite explicit timestamp invalidates its sample and is replaced
 * by the preceding timestamp plus one nominal period (zero for irregular streams), capped at the next known
 * timestamp of the chunk. The preceding timestamp carries over from the stream's previous chunk, so the fill
 * does not depend on chunk boundaries.</p>
 * <p><strong>Validity:</strong> a sample is invalid when any channel fails {@link #rawValid(double, DataType)}
 * or calibrates to a non-finite value.</p>
 *
 * @since 0.1.0
 */
abstract class AbstractModalityMapper implements ModalityMapper {

  @Override
  public final void checkSchema(
      StreamDescriptor stream, DatasetDescriptor samples, Optional<DatasetDescriptor> timestamps)
      throws SchemaMismatchException {
    if (!stream.regular() && timestamps.isEmpty()) {
      throw new SchemaMismatchException(stream.name(), "irregular stream requires explicit timestamps");
    }
    if (timestamps.isPresent()) {
      DatasetDescriptor ts = timestamps.get();
      if (ts.type() != DataType.FLOAT64 || ts.channels() != 1) {
        throw new SchemaMismatchException(stream.name(),
            "timestamps " + ts.path() + " must be one FLOAT64 channel (was " + ts.channels() + " x " + ts.type() + ")");
      }
      if (ts.rows() != samples.rows()) {
        throw new SchemaMismatchException(stream.name(),
            "timestamps hold " + ts.rows() + " rows but samples hold " + samples.rows());
      }
    }
    checkDataset(stream, samples);
  }

  @Override
  public final CanonicalRecord map(StreamDescriptor stream, RawChunk samples, Optional<RawChunk> timestamps,
      double precedingTimestamp, MappingListener listener) throws SchemaMismatchException {
    RawChunk ts = timestamps.orElse(null);
    if (ts != null && (ts.firstRow() != samples.firstRow() || ts.rows() != samples.rows())) {
      throw new SchemaMismatchException(stream.name(), "timestamp chunk does not cover the sample rows");
    }
    if (ts == null && !stream.regular()) {
      throw new SchemaMismatchException(stream.name(), "irregular stream requires explicit timestamps");
    }
    int rows = samples.rows();
    int channels = samples.channels();
    Calibration calibration = stream.calibration();
    DataType type = samples.type();
    double[] times = new double[rows];
    double[] values = new double[rows * channels];
    boolean[] valid = new boolean[rows];
    for (int row = 0; row < rows; row++) {
      boolean ok = true;
      for (int ch = 0; ch < channels; ch++) {
        double raw = samples.value(row, ch);
        double value = rawValid(raw, type) ? calibrate(raw, calibration) : Double.NaN;
        if (!Double.isFinite(value)) {
          ok = false;
        }
        values[row * channels + ch] = value;
      }
      if (ts == null) {
        times[row] = implicitTime(stream, samples.firstRow() + row);
      } else {
        double t = ts.value(row, 0);
        if (Double.isFinite(t)) {
          times[row] = t;
        } else {
          ok = false;
          times[row] = Double.NaN;
        }
      }
      valid[row] = ok;
    }
    if (ts != null) {
      fillMissingTimes(stream, samples.firstRow(), times, precedingTimestamp);
    }
    CanonicalRecord record = new CanonicalRecord(
        stream.name(), modality(), stream.unit(), samples.firstRow(), channels, times, values, valid);
    listener.onMapped(stream.name(), modality(), rows, record.invalidCount());
    return record;
  }

  /**
   * Rejects dataset shapes this modality cannot map.
   *
   * @param stream stream declaration
   * @param samples sample dataset shape
   * @throws SchemaMismatchException if the dataset is unusable
   */
  protected void checkDataset(StreamDescriptor stream, DatasetDescriptor samples) throws SchemaMismatchException {
  }

  /**
   * Tells whether a raw element is a usable measurement.
   *
   * @param raw raw element
   * @param type element type
   * @return {@code false} to flag the sample invalid
   */
  protected abstract boolean rawValid(double raw, DataType type);

  /**
   * Converts a raw element into the stream's physical unit.
   *
   * @param raw raw element
   * @param calibration stream calibration
   * @return calibrated value
   */
  protected abstract double calibrate(double raw, Calibration calibration);

  static double linear(double raw, Calibration calibration) {
    return raw * calibration.scale() + calibration.offset();
  }

  private static double implicitTime(StreamDescriptor stream, long row) {
    return stream.startTimeSeconds() + row / stream.sampleRateHz();
  }

  private static void fillMissingTimes(StreamDescriptor stream, long firstRow, double[] times, double preceding) {
    double step = stream.regular() ? 1d / stream.sampleRateHz() : 0d;
    if (Double.isNaN(preceding)) {
      // start of the stream: step back from the first known timestamp
      int first = 0;
      while (first < times.length && Double.isNaN(times[first])) {
        first++;
      }
      for (int i = 0; i < first; i++) {
        if (first < times.length) {
          times[i] = times[first] - step * (first - i);
        } else {
          times[i] = stream.regular() ? implicitTime(stream, firstRow + i) : stream.startTimeSeconds();
        }
      }
    }
    double[] following = new double[times.length];
    double next = Double.NaN;
    for (int i = times.length - 1; i >= 0; i--) {
      following[i] = next;
      if (!Double.isNaN(times[i])) {
        next = times[i];
      }
    }
    double previous = preceding;
    for (int i = 0; i < times.length; i++) {
      if (Double.isNaN(times[i])) {
        double filled = previous + step;
        // never overtake the next known timestamp of the chunk
        if (following[i] < filled) {
          filled = following[i];
        }
        times[i] = filled;
      }
      previous = times[i];
    }
  }
}
