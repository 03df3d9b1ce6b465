package io.tessera.conv.domain.conversion;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.tessera.conv.domain.session.SessionId;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class BatchReportTest {
  private static final SessionId A = id(1);
  private static final SessionId B = id(2);
  private static final SessionId C = id(3);
  private static final SessionId D = id(4);

  @Test
  void resultsFollowSubmissionOrderRegardlessOfCompletionOrder() {
    BatchReport.Builder builder = BatchReport.builder(List.of(A, B, C, D));
    builder.add(success(C, 30L));
    builder.skip(D);
    builder.add(failed(B));
    builder.add(warning(A, 10L));

    BatchReport report = builder.build(Duration.ofSeconds(1));

    assertEquals(List.of(A, B, C), report.results().stream().map(ConversionResult::sessionId).toList());
    assertEquals(List.of(D), report.skipped());
    assertEquals(1L, report.successCount());
    assertEquals(1L, report.warningCount());
    assertEquals(1L, report.failedCount());
    assertEquals(1, report.skippedCount());
    assertEquals(40L, report.totalBytes());
    assertFalse(report.allSucceeded());
    assertFalse(report.cancelled());
  }

  @Test
  void allSucceededWhenNothingFailedOrSkipped() {
    BatchReport.Builder builder = BatchReport.builder(List.of(A, B));
    builder.add(success(A, 1L));
    builder.add(warning(B, 2L));
    builder.markCancelled();

    BatchReport report = builder.build(Duration.ZERO);

    assertTrue(report.allSucceeded());
    assertTrue(report.cancelled());
  }

  @Test
  void rejectsDuplicateSubmissionAndDoubleRecording() {
    assertThrows(IllegalArgumentException.class, () -> BatchReport.builder(List.of(A, A)));

    BatchReport.Builder builder = BatchReport.builder(List.of(A));
    builder.add(success(A, 1L));
    assertThrows(IllegalStateException.class, () -> builder.skip(A));
    assertThrows(IllegalStateException.class, () -> builder.add(success(B, 1L)));
  }

  @Test
  void incompleteBatchCannotBeBuilt() {
    BatchReport.Builder builder = BatchReport.builder(List.of(A, B));
    builder.add(success(A, 1L));
    assertEquals(1, builder.completed());

    IllegalStateException ex = assertThrows(IllegalStateException.class, () -> builder.build(Duration.ZERO));
    assertTrue(ex.getMessage().contains("1 session(s) outstanding"));

    builder.skip(B);
    builder.build(Duration.ZERO);
    assertThrows(IllegalStateException.class, () -> builder.build(Duration.ZERO));
  }

  private static SessionId id(int index) {
    return new SessionId("m01", LocalDate.of(2024, 3, 1), index);
  }

  private static ConversionResult success(SessionId id, long bytes) {
    return new ConversionResult(id, ConversionStatus.SUCCESS, PipelineState.FINALIZED, bytes,
        Duration.ofMillis(1), null, null, null, null);
  }

  private static ConversionResult warning(SessionId id, long bytes) {
    return new ConversionResult(id, ConversionStatus.WARNING, PipelineState.FINALIZED, bytes,
        Duration.ofMillis(1), null, null, null, null);
  }

  private static ConversionResult failed(SessionId id) {
    FailureDetail detail =
        new FailureDetail(FailureKind.SOURCE_UNAVAILABLE, Optional.empty(), PipelineState.LOCATING, "missing");
    return new ConversionResult(id, ConversionStatus.FAILED, PipelineState.ABORTED, 0L,
        Duration.ZERO, null, null, Optional.of(detail), null);
  }
}
