package io.tessera.conv.domain.session;

import io.tessera.conv.validation.Strings;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Declaration of one modality stream inside a session, as supplied by the locator.
 *
 * @param name stream name, unique within the session
 * @param modality declared modality
 * @param source source container holding the dataset
 * @param datasetPath path of the sample dataset inside the source container
 * @param timestampsPath optional path of an explicit timestamp dataset (FLOAT64 seconds)
 * @param sampleRateHz declared sample rate; {@code 0} marks an irregular event stream
 * @param startTimeSeconds session-clock time of the first sample for implicit timestamps
 * @param calibration calibration applied by the mapper
 * @since 0.1.0
 */
public record StreamDescriptor(
    String name,
    Modality modality,
    Path source,
    String datasetPath,
    Optional<String> timestampsPath,
    double sampleRateHz,
    double startTimeSeconds,
    Calibration calibration) {

  /**
   * Validates the declaration.
   *
   * @throws IllegalArgumentException if the rate is negative, an irregular stream lacks timestamps,
   *     or names are malformed
   */
  public StreamDescriptor {
    name = Strings.requireIdentifier("stream name", name);
    Objects.requireNonNull(modality, "modality");
    Objects.requireNonNull(source, "source");
    datasetPath = Strings.requireDatasetPath("datasetPath", datasetPath);
    timestampsPath = Objects.requireNonNullElse(timestampsPath, Optional.<String>empty())
        .filter(s -> !s.isBlank())
        .map(s -> Strings.requireDatasetPath("timestampsPath", s));
    if (!Double.isFinite(sampleRateHz) || sampleRateHz < 0d) {
      throw new IllegalArgumentException(
          "sample rate of " + name + " must be finite and >= 0 (was " + sampleRateHz + ")");
    }
    if (!Double.isFinite(startTimeSeconds)) {
      throw new IllegalArgumentException("start time of " + name + " must be finite");
    }
    if (sampleRateHz == 0d && timestampsPath.isEmpty()) {
      throw new IllegalArgumentException(
          "irregular stream " + name + " requires an explicit timestamps dataset");
    }
    Objects.requireNonNull(calibration, "calibration");
  }

  /**
   * Indicates whether the stream is sampled at a fixed declared rate.
   *
   * @return {@code true} when the declared rate is positive
   */
  public boolean regular() {
    return sampleRateHz > 0d;
  }

  /**
   * Returns the calibrated unit of the stream.
   *
   * @return effective unit symbol
   */
  public String unit() {
    return calibration.unitFor(modality);
  }
}
