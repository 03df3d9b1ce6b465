package io.tessera.conv.domain.error;

import io.tessera.conv.domain.conversion.FailureKind;

/**
 * Dataset shape, element type, or calibration does not match what the stream's mapper requires.
 *
 * @since 0.1.0
 */
public final class SchemaMismatchException extends ConversionException {
  private static final long serialVersionUID = 1L;

  public SchemaMismatchException(String stream, String message) {
    super(FailureKind.SCHEMA_MISMATCH, stream, message);
  }

  public SchemaMismatchException(String stream, String message, Throwable cause) {
    super(FailureKind.SCHEMA_MISMATCH, stream, message, cause);
  }
}
