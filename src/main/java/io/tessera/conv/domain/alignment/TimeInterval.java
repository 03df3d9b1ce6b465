package io.tessera.conv.domain.alignment;

/**
 * Closed interval on the session clock, in seconds.
 *
 * @param startSeconds inclusive start
 * @param endSeconds inclusive end; never before {@code startSeconds}
 * @since 0.1.0
 */
public record TimeInterval(double startSeconds, double endSeconds) {

  /**
   * Normalizes the bounds so that start never exceeds end.
   */
  public TimeInterval {
    if (Double.isNaN(startSeconds) || Double.isNaN(endSeconds)) {
      throw new IllegalArgumentException("interval bounds must not be NaN");
    }
    if (endSeconds < startSeconds) {
      double swap = startSeconds;
      startSeconds = endSeconds;
      endSeconds = swap;
    }
  }

  /**
   * Interval covering a single instant.
   *
   * @param seconds instant
   * @return zero-length interval
   */
  public static TimeInterval at(double seconds) {
    return new TimeInterval(seconds, seconds);
  }

  public double durationSeconds() {
    return endSeconds - startSeconds;
  }
}
