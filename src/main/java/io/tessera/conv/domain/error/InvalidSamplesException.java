package io.tessera.conv.domain.error;

import io.tessera.conv.domain.conversion.FailureKind;

/**
 * Fraction of invalid samples in a stream exceeds the configured ceiling.
 *
 * @since 0.1.0
 */
public final class InvalidSamplesException extends ConversionException {
  private static final long serialVersionUID = 1L;

  public InvalidSamplesException(String stream, String message) {
    super(FailureKind.INVALID_SAMPLES, stream, message);
  }

  public InvalidSamplesException(String stream, String message, Throwable cause) {
    super(FailureKind.INVALID_SAMPLES, stream, message, cause);
  }
}
