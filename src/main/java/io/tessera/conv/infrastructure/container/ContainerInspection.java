package io.tessera.conv.infrastructure.container;

import io.tessera.conv.domain.container.ContainerState;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Result of scanning a container file without trusting its header state.
 *
 * @param path inspected file
 * @param state header state
 * @param blocks intact block frames in file order
 * @param metadataPresent whether an intact metadata frame follows the blocks
 * @param tornTail whether trailing bytes form an incomplete or corrupt frame
 * @param intactBytes bytes up to the end of the last intact frame
 * @since 0.1.0
 */
public record ContainerInspection(
    Path path,
    ContainerState state,
    List<BlockHeader> blocks,
    boolean metadataPresent,
    boolean tornTail,
    long intactBytes) {

  public ContainerInspection {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(state, "state");
    blocks = List.copyOf(blocks);
  }

  /**
   * Indicates whether the container can be read as a valid session output.
   *
   * @return {@code true} when the header is complete and the file scans cleanly
   */
  public boolean valid() {
    return state == ContainerState.COMPLETE && metadataPresent && !tornTail;
  }
}
