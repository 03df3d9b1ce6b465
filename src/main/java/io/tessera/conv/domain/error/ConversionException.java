package io.tessera.conv.domain.error;

import io.tessera.conv.domain.conversion.FailureKind;
import java.util.Objects;
import java.util.Optional;

/**
 * Checked root of every session-fatal conversion failure. Carries the failure category and,
 * when attributable, the stream that caused it. Nothing in this hierarchy is process-fatal.
 *
 * @since 0.1.0
 */
public class ConversionException extends Exception {
  private static final long serialVersionUID = 1L;

  private final FailureKind kind;
  private final String stream;

  /**
   * Creates an exception.
   *
   * @param kind failure category
   * @param stream offending stream, or {@code null} when not attributable
   * @param message human-readable error
   */
  public ConversionException(FailureKind kind, String stream, String message) {
    super(message);
    this.kind = Objects.requireNonNull(kind, "kind");
    this.stream = stream;
  }

  /**
   * Creates an exception with an underlying cause.
   *
   * @param kind failure category
   * @param stream offending stream, or {@code null} when not attributable
   * @param message human-readable error
   * @param cause root cause
   */
  public ConversionException(FailureKind kind, String stream, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
    this.stream = stream;
  }

  public FailureKind kind() {
    return kind;
  }

  public Optional<String> stream() {
    return Optional.ofNullable(stream);
  }
}
