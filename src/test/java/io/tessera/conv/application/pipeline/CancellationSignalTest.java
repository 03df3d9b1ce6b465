package io.tessera.conv.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.tessera.conv.domain.conversion.FailureKind;
import io.tessera.conv.domain.error.ConversionCancelledException;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class CancellationSignalTest {

  @Test
  void childSeesParentCancellation() {
    CancellationSignal batch = CancellationSignal.root();
    CancellationSignal session = batch.child();
    assertFalse(session.isCancelled());

    batch.cancel("SIGINT");

    assertTrue(session.isCancelled());
    assertEquals(Optional.of("SIGINT"), session.reason());
    ConversionCancelledException ex = assertThrows(ConversionCancelledException.class, session::throwIfCancelled);
    assertEquals(FailureKind.CANCELLED, ex.kind());
  }

  @Test
  void childCancellationStaysLocal() {
    CancellationSignal batch = CancellationSignal.root();
    CancellationSignal first = batch.child();
    CancellationSignal second = batch.child();

    first.cancel("stream failed");

    assertTrue(first.isCancelled());
    assertFalse(batch.isCancelled());
    assertFalse(second.isCancelled());
    assertDoesNotThrow(second::throwIfCancelled);
  }

  @Test
  void firstReasonWins() {
    CancellationSignal signal = CancellationSignal.root();
    signal.cancel(" ");
    signal.cancel("later");
    assertEquals(Optional.of("cancelled"), signal.reason());
  }
}
