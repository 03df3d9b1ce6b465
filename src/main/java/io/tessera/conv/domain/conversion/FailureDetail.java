package io.tessera.conv.domain.conversion;

import java.util.Objects;
import java.util.Optional;

/**
 * Describes why a session failed.
 *
 * @param kind failure category
 * @param stream stream involved, when the failure is attributable to one
 * @param failedState pipeline state that was active when the failure occurred
 * @param message human-readable detail
 * @since 0.1.0
 */
public record FailureDetail(FailureKind kind, Optional<String> stream, PipelineState failedState, String message) {

  public FailureDetail {
    Objects.requireNonNull(kind, "kind");
    stream = Objects.requireNonNullElse(stream, Optional.empty());
    Objects.requireNonNull(failedState, "failedState");
    message = message == null ? kind.name() : message;
  }
}
