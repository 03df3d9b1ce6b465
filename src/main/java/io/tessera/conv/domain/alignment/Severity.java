package io.tessera.conv.domain.alignment;

/**
 * Category of an alignment finding. An {@link #ERROR} aborts the session; a {@link #WARNING} is
 * reported and the session still finalizes.
 *
 * @since 0.1.0
 */
public enum Severity {
  WARNING,
  ERROR
}
