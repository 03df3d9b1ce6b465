package io.tessera.conv.domain.conversion;

/**
 * Per-session outcome code.
 *
 * @since 0.1.0
 */
public enum ConversionStatus {
  /** Finalized without findings. */
  SUCCESS,
  /** Finalized; the alignment report holds warnings only. */
  WARNING,
  /** Aborted; the target container, if any, is left incomplete. */
  FAILED
}
