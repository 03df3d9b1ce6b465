package io.tessera.conv.domain.alignment;

/**
 * Kinds of timing-consistency problems detected across and within streams.
 *
 * @since 0.1.0
 */
public enum FindingType {
  /** Consecutive samples further apart than the gap threshold. */
  GAP,
  /** Stream end disagrees with the reference stream's end. */
  DRIFT,
  /** Observed sample rate disagrees with the declared rate. */
  RATE_MISMATCH,
  /** A timestamp is smaller than its predecessor. */
  NON_MONOTONIC,
  /** A run of samples flagged invalid by the mapper. */
  INVALID_SAMPLES
}
