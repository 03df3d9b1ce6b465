package io.tessera.conv.domain.error;

import io.tessera.conv.domain.conversion.FailureKind;

/**
 * Timing validation produced at least one ERROR finding.
 *
 * @since 0.1.0
 */
public final class AlignmentException extends ConversionException {
  private static final long serialVersionUID = 1L;

  public AlignmentException(String stream, String message) {
    super(FailureKind.ALIGNMENT_ERROR, stream, message);
  }

  public AlignmentException(String stream, String message, Throwable cause) {
    super(FailureKind.ALIGNMENT_ERROR, stream, message, cause);
  }
}
