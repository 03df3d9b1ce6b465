package io.tessera.conv.domain.conversion;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.tessera.conv.domain.alignment.AlignmentReport;
import io.tessera.conv.domain.session.SessionId;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConversionResultTest {
  private static final SessionId ID = new SessionId("m01", LocalDate.of(2024, 3, 1), 1);
  private static final FailureDetail FAILURE =
      new FailureDetail(FailureKind.WRITE_FAILURE, Optional.of("ecog"), PipelineState.WRITING, "disk full");

  @Test
  void nullCollectionsBecomeEmpty() {
    ConversionResult result = new ConversionResult(
        ID, ConversionStatus.SUCCESS, PipelineState.FINALIZED, 10L, Duration.ofMillis(5), null, null, null, null);

    assertEquals(AlignmentReport.empty(), result.report());
    assertTrue(result.streams().isEmpty());
    assertTrue(result.failure().isEmpty());
    assertTrue(result.output().isEmpty());
  }

  @Test
  void failedResultRequiresAbortedStateAndDetail() {
    ConversionResult failed = new ConversionResult(ID, ConversionStatus.FAILED, PipelineState.ABORTED, 0L,
        Duration.ZERO, AlignmentReport.empty(), List.of(), Optional.of(FAILURE), Optional.empty());
    assertTrue(failed.failed());

    assertThrows(IllegalArgumentException.class, () -> new ConversionResult(ID, ConversionStatus.FAILED,
        PipelineState.ABORTED, 0L, Duration.ZERO, null, null, Optional.empty(), null));
    assertThrows(IllegalArgumentException.class, () -> new ConversionResult(ID, ConversionStatus.FAILED,
        PipelineState.FINALIZED, 0L, Duration.ZERO, null, null, Optional.of(FAILURE), null));
  }

  @Test
  void successfulResultMustNotCarryFailure() {
    assertThrows(IllegalArgumentException.class, () -> new ConversionResult(ID, ConversionStatus.WARNING,
        PipelineState.FINALIZED, 0L, Duration.ZERO, null, null, Optional.of(FAILURE), null));
    assertThrows(IllegalArgumentException.class, () -> new ConversionResult(ID, ConversionStatus.SUCCESS,
        PipelineState.ABORTED, 0L, Duration.ZERO, null, null, null, null));
  }
}
