package io.tessera.conv.domain.error;

import io.tessera.conv.domain.conversion.FailureKind;

/**
 * Raised between chunks when the batch-level cancellation signal is set.
 *
 * @since 0.1.0
 */
public final class ConversionCancelledException extends ConversionException {
  private static final long serialVersionUID = 1L;

  public ConversionCancelledException(String message) {
    super(FailureKind.CANCELLED, null, message);
  }

  public ConversionCancelledException(String message, Throwable cause) {
    super(FailureKind.CANCELLED, null, message, cause);
  }
}
