package io.tessera.conv.domain.error;

import io.tessera.conv.domain.conversion.FailureKind;

/**
 * Target container could not be written; the container is left incomplete.
 *
 * @since 0.1.0
 */
public final class WriteFailureException extends ConversionException {
  private static final long serialVersionUID = 1L;

  public WriteFailureException(String stream, String message) {
    super(FailureKind.WRITE_FAILURE, stream, message);
  }

  public WriteFailureException(String stream, String message, Throwable cause) {
    super(FailureKind.WRITE_FAILURE, stream, message, cause);
  }
}
