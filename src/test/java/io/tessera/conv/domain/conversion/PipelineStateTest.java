package io.tessera.conv.domain.conversion;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

class PipelineStateTest {

  @Test
  void happyPathIsLinear() {
    List<PipelineState> path = List.of(
        PipelineState.INIT, PipelineState.LOCATING, PipelineState.READING, PipelineState.MAPPING,
        PipelineState.VALIDATING, PipelineState.WRITING, PipelineState.FINALIZED);
    for (int i = 1; i < path.size(); i++) {
      assertTrue(path.get(i - 1).canTransitionTo(path.get(i)), path.get(i - 1) + " -> " + path.get(i));
    }
  }

  @Test
  void stagesMayAbortButInitMayNot() {
    assertFalse(PipelineState.INIT.canTransitionTo(PipelineState.ABORTED));
    assertTrue(PipelineState.LOCATING.canTransitionTo(PipelineState.ABORTED));
    assertTrue(PipelineState.WRITING.canTransitionTo(PipelineState.ABORTED));
  }

  @Test
  void stagesCannotBeSkippedOrRevisited() {
    assertFalse(PipelineState.READING.canTransitionTo(PipelineState.WRITING));
    assertFalse(PipelineState.MAPPING.canTransitionTo(PipelineState.READING));
    assertFalse(PipelineState.VALIDATING.canTransitionTo(PipelineState.FINALIZED));
  }

  @Test
  void terminalStatesHaveNoSuccessors() {
    assertTrue(PipelineState.FINALIZED.terminal());
    assertTrue(PipelineState.ABORTED.terminal());
    assertTrue(PipelineState.FINALIZED.successors().isEmpty());
    assertTrue(PipelineState.ABORTED.successors().isEmpty());
    assertFalse(PipelineState.WRITING.terminal());
  }
}
