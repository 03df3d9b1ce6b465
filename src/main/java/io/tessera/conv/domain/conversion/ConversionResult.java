package io.tessera.conv.domain.conversion;

import io.tessera.conv.domain.alignment.AlignmentReport;
import io.tessera.conv.domain.session.SessionId;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Immutable outcome of converting one session.
 * <p><strong>Invariants:</strong> {@link ConversionStatus#FAILED} iff the terminal state is
 * {@link PipelineState#ABORTED} iff a failure detail is present.</p>
 *
 * @param sessionId converted session
 * @param status outcome code
 * @param terminalState state the pipeline ended in
 * @param bytesProcessed source bytes read across both passes
 * @param wallTime elapsed time of the pipeline run
 * @param report alignment findings, empty when the session never reached validation
 * @param streams per-stream summaries in declaration order
 * @param failure failure detail for failed sessions
 * @param output target container path; present once a writer was opened
 * @since 0.1.0
 */
public record ConversionResult(
    SessionId sessionId,
    ConversionStatus status,
    PipelineState terminalState,
    long bytesProcessed,
    Duration wallTime,
    AlignmentReport report,
    List<StreamSummary> streams,
    Optional<FailureDetail> failure,
    Optional<Path> output) {

  /**
   * Validates the status invariants.
   *
   * @throws IllegalArgumentException if status, terminal state, and failure detail disagree
   */
  public ConversionResult {
    Objects.requireNonNull(sessionId, "sessionId");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(terminalState, "terminalState");
    Objects.requireNonNull(wallTime, "wallTime");
    report = Objects.requireNonNullElse(report, AlignmentReport.empty());
    streams = List.copyOf(Objects.requireNonNullElse(streams, List.of()));
    failure = Objects.requireNonNullElse(failure, Optional.empty());
    output = Objects.requireNonNullElse(output, Optional.empty());
    boolean failed = status == ConversionStatus.FAILED;
    if (failed != (terminalState == PipelineState.ABORTED) || failed != failure.isPresent()) {
      throw new IllegalArgumentException(
          "inconsistent result for " + sessionId + ": " + status + "/" + terminalState
              + (failure.isPresent() ? " with failure" : " without failure"));
    }
  }

  public boolean failed() {
    return status == ConversionStatus.FAILED;
  }
}
