package io.tessera.conv.domain.error;

import io.tessera.conv.domain.conversion.FailureKind;

/**
 * Source container or dataset is missing, unreadable, or truncated. Not retried.
 *
 * @since 0.1.0
 */
public final class SourceUnavailableException extends ConversionException {
  private static final long serialVersionUID = 1L;

  public SourceUnavailableException(String stream, String message) {
    super(FailureKind.SOURCE_UNAVAILABLE, stream, message);
  }

  public SourceUnavailableException(String stream, String message, Throwable cause) {
    super(FailureKind.SOURCE_UNAVAILABLE, stream, message, cause);
  }
}
