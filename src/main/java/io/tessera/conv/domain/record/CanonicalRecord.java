package io.tessera.conv.domain.record;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.tessera.conv.domain.session.Modality;
import java.util.Arrays;
import java.util.Objects;

/**
 * <strong>What:</strong> A window of mapped samples for one stream in physical units on the session clock.
 * <p><strong>Why:</strong> Gives the alignment validator and the target writer one representation
 * regardless of the modality or the source layout.</p>
 * <p><strong>Role:</strong> Transient domain value; consumed immediately and never retained by the pipeline.</p>
 * <p><strong>Thread-safety:</strong> Immutable; arrays are copied on construction.</p>
 * <p><strong>Performance:</strong> One copy per array on construction; accessors expose the canonical arrays.</p>
 *
 * @param stream stream name
 * @param modality modality that produced the record
 * @param unit explicit physical unit of {@code values}
 * @param firstSample index of the first sample within the stream
 * @param channels values per sample
 * @param timestamps seconds on the session clock, one per sample
 * @param values row-major calibrated values, {@code timestamps.length * channels} entries
 * @param valid validity flag per sample; {@code false} marks an explicitly invalid sample
 * @since 0.1.0
 */
public record CanonicalRecord(
    String stream,
    Modality modality,
    String unit,
    long firstSample,
    int channels,
    double[] timestamps,
    double[] values,
    boolean[] valid) {

  /**
   * Copies the arrays and enforces matching lengths.
   *
   * @throws IllegalArgumentException if the sample, value, and flag counts disagree
   */
  public CanonicalRecord {
    Objects.requireNonNull(stream, "stream");
    Objects.requireNonNull(modality, "modality");
    if (unit == null || unit.isBlank()) {
      throw new IllegalArgumentException("unit of " + stream + " must be explicit");
    }
    if (channels <= 0) {
      throw new IllegalArgumentException("channels must be > 0");
    }
    if (firstSample < 0) {
      throw new IllegalArgumentException("firstSample must be >= 0");
    }
    timestamps = Objects.requireNonNull(timestamps, "timestamps").clone();
    values = Objects.requireNonNull(values, "values").clone();
    valid = Objects.requireNonNull(valid, "valid").clone();
    if (valid.length != timestamps.length) {
      throw new IllegalArgumentException(
          "validity flags (" + valid.length + ") do not match samples (" + timestamps.length + ")");
    }
    if (values.length != timestamps.length * channels) {
      throw new IllegalArgumentException(
          "values (" + values.length + ") do not match samples x channels ("
              + timestamps.length + " x " + channels + ")");
    }
  }

  /**
   * Returns the number of samples in the window.
   *
   * @return sample count, equal to the timestamp count
   */
  public int sampleCount() {
    return timestamps.length;
  }

  /**
   * Counts samples whose validity flag is set.
   *
   * @return valid sample count
   */
  public int validCount() {
    int count = 0;
    for (boolean flag : valid) {
      if (flag) {
        count++;
      }
    }
    return count;
  }

  /**
   * Counts samples flagged invalid.
   *
   * @return {@code sampleCount() - validCount()}
   */
  public int invalidCount() {
    return sampleCount() - validCount();
  }

  /**
   * Reads one calibrated value.
   *
   * @param sample sample index within the window
   * @param channel channel index
   * @return calibrated value
   */
  public double value(int sample, int channel) {
    Objects.checkIndex(channel, channels);
    return values[sample * channels + channel];
  }

  /**
   * Returns the timestamp of the first sample, or NaN for an empty window.
   *
   * @return first timestamp in seconds
   */
  public double firstTimestamp() {
    return timestamps.length == 0 ? Double.NaN : timestamps[0];
  }

  /**
   * Returns the timestamp of the last sample, or NaN for an empty window.
   *
   * @return last timestamp in seconds
   */
  public double lastTimestamp() {
    return timestamps.length == 0 ? Double.NaN : timestamps[timestamps.length - 1];
  }

  @SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "Copied on construction; records are consumed once and discarded.")
  public double[] timestamps() {
    return timestamps;
  }

  @SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "Copied on construction; records are consumed once and discarded.")
  public double[] values() {
    return values;
  }

  @SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "Copied on construction; records are consumed once and discarded.")
  public boolean[] valid() {
    return valid;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CanonicalRecord)) {
      return false;
    }
    CanonicalRecord other = (CanonicalRecord) o;
    return firstSample == other.firstSample
        && channels == other.channels
        && stream.equals(other.stream)
        && modality == other.modality
        && unit.equals(other.unit)
        && Arrays.equals(timestamps, other.timestamps)
        && Arrays.equals(values, other.values)
        && Arrays.equals(valid, other.valid);
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(stream, modality, unit, firstSample, channels);
    result = 31 * result + Arrays.hashCode(timestamps);
    result = 31 * result + Arrays.hashCode(values);
    result = 31 * result + Arrays.hashCode(valid);
    return result;
  }

  @Override
  public String toString() {
    return "CanonicalRecord{"
        + "stream=" + stream
        + ", modality=" + modality
        + ", unit=" + unit
        + ", firstSample=" + firstSample
        + ", samples=" + timestamps.length
        + ", channels=" + channels
        + '}';
  }
}
