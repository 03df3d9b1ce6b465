package io.tessera.conv.application.alignment;

import io.tessera.conv.domain.session.StreamDescriptor;
import java.util.Objects;

/**
 * First and last timestamps of a stream, either probed before the scan or observed during it.
 *
 * @param stream stream declaration
 * @param samples number of samples
 * @param firstTimestamp first timestamp in seconds
 * @param lastTimestamp last timestamp in seconds
 * @since 0.1.0
 */
public record StreamBounds(StreamDescriptor stream, long samples, double firstTimestamp, double lastTimestamp) {

  public StreamBounds {
    Objects.requireNonNull(stream, "stream");
  }

  /**
   * Returns the time just past the last sample: {@code last + 1 / rate} for regular streams.
   *
   * @return notional end in seconds, NaN for an empty stream
   */
  public double notionalEnd() {
    if (samples == 0 || Double.isNaN(lastTimestamp)) {
      return Double.NaN;
    }
    return stream.regular() ? lastTimestamp + 1d / stream.sampleRateHz() : lastTimestamp;
  }
}
