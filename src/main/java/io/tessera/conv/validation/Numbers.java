package io.tessera.conv.validation;

/**
 * <strong>What:</strong> Numeric validation helpers used by configuration parsing.
 * <p><strong>Why:</strong> Guards against invalid chunk sizes, thresholds, and pool sizes before the
 * orchestrator allocates workers or buffers.</p>
 * <p><strong>Thread-safety:</strong> Immutable stateless utility.</p>
 * <p><strong>Observability:</strong> Emits no metrics or logs; throws {@link IllegalArgumentException} when
 * validation fails.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics; defaults to {@code "value"} when blank
   * @param value candidate value expressed in the caller's units (e.g., bytes, ms)
   * @param min minimum inclusive value in the same units as {@code value}
   * @param max maximum inclusive value in the same units as {@code value}
   * @return the validated value for fluent call sites
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Validates that a finite floating-point value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics
   * @param value candidate value
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value
   * @throws IllegalArgumentException if {@code value} is NaN, infinite, or outside {@code [min, max]}
   */
  public static double requireRange(String name, double value, double min, double max) {
    if (!Double.isFinite(value) || value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
