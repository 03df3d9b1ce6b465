package io.tessera.conv.domain.conversion;

import java.util.EnumSet;
import java.util.Set;

/**
 * States of the per-session conversion state machine. Transitions are one-directional and
 * single-use; {@link #ABORTED} is reachable from every working state.
 *
 * @since 0.1.0
 */
public enum PipelineState {
  INIT,
  LOCATING,
  READING,
  MAPPING,
  VALIDATING,
  WRITING,
  FINALIZED,
  ABORTED;

  /**
   * Tells whether the machine may move from this state to {@code next}.
   *
   * @param next candidate successor
   * @return {@code true} when the transition is legal
   */
  public boolean canTransitionTo(PipelineState next) {
    return successors().contains(next);
  }

  /**
   * Returns the legal successors of this state.
   *
   * @return successor set; empty for terminal states
   */
  public Set<PipelineState> successors() {
    return switch (this) {
      case INIT -> EnumSet.of(LOCATING);
      case LOCATING -> EnumSet.of(READING, ABORTED);
      case READING -> EnumSet.of(MAPPING, ABORTED);
      case MAPPING -> EnumSet.of(VALIDATING, ABORTED);
      case VALIDATING -> EnumSet.of(WRITING, ABORTED);
      case WRITING -> EnumSet.of(FINALIZED, ABORTED);
      case FINALIZED, ABORTED -> EnumSet.noneOf(PipelineState.class);
    };
  }

  public boolean terminal() {
    return this == FINALIZED || this == ABORTED;
  }
}
