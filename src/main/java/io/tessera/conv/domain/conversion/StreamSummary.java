package io.tessera.conv.domain.conversion;

import io.tessera.conv.domain.session.Modality;
import java.util.Objects;

/**
 * Per-stream counters gathered while converting one session.
 *
 * @param stream stream name
 * @param modality stream modality
 * @param unit calibrated unit
 * @param samplesRead samples mapped
 * @param samplesInvalid samples flagged invalid
 * @param chunks chunks read
 * @param bytesRead source bytes read
 * @param firstTimestamp first timestamp in seconds, NaN when the stream is empty
 * @param lastTimestamp last timestamp in seconds, NaN when the stream is empty
 * @since 0.1.0
 */
public record StreamSummary(
    String stream,
    Modality modality,
    String unit,
    long samplesRead,
    long samplesInvalid,
    long chunks,
    long bytesRead,
    double firstTimestamp,
    double lastTimestamp) {

  public StreamSummary {
    Objects.requireNonNull(stream, "stream");
    Objects.requireNonNull(modality, "modality");
    Objects.requireNonNull(unit, "unit");
    if (samplesInvalid > samplesRead) {
      throw new IllegalArgumentException("invalid samples exceed samples read for " + stream);
    }
  }

  /**
   * Returns the number of valid samples.
   *
   * @return {@code samplesRead - samplesInvalid}
   */
  public long samplesValid() {
    return samplesRead - samplesInvalid;
  }
}
