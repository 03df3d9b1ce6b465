package io.tessera.conv.domain.conversion;

/**
 * Categories of session-fatal failures.
 *
 * @since 0.1.0
 */
public enum FailureKind {
  SOURCE_UNAVAILABLE,
  SCHEMA_MISMATCH,
  ALIGNMENT_ERROR,
  INVALID_SAMPLES,
  WRITE_FAILURE,
  CANCELLED,
  INTERNAL
}
