package io.tessera.conv.domain.container;

import io.tessera.conv.domain.alignment.AlignmentReport;
import io.tessera.conv.domain.conversion.StreamSummary;
import io.tessera.conv.domain.session.SessionId;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Content of the {@code general} section written when a container is finalized.
 *
 * @param sessionId converted session
 * @param metadata descriptive session metadata
 * @param streams per-stream summaries
 * @param report alignment report of the session
 * @param createdAt time the container was finalized
 * @since 0.1.0
 */
public record ContainerMetadata(
    SessionId sessionId,
    Map<String, String> metadata,
    List<StreamSummary> streams,
    AlignmentReport report,
    Instant createdAt) {

  public ContainerMetadata {
    Objects.requireNonNull(sessionId, "sessionId");
    metadata = Map.copyOf(Objects.requireNonNullElse(metadata, Map.of()));
    streams = List.copyOf(Objects.requireNonNullElse(streams, List.of()));
    report = Objects.requireNonNullElse(report, AlignmentReport.empty());
    Objects.requireNonNull(createdAt, "createdAt");
  }
}
