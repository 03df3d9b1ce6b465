package io.tessera.conv.domain.session;

import java.nio.file.Path;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * <strong>What:</strong> Everything the core needs to convert one session: its identity, its
 * modality streams, and descriptive metadata copied into the target container.
 * <p><strong>Role:</strong> Input value produced by an external locator and owned by exactly one
 * conversion pipeline.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param id session identity
 * @param streams stream declarations in declaration order; names are unique
 * @param metadata descriptive key/value metadata (experimenter, task, notes)
 * @since 0.1.0
 */
public record SessionDescriptor(SessionId id, List<StreamDescriptor> streams, Map<String, String> metadata) {

  /**
   * Copies collections and rejects empty or ambiguous stream sets.
   *
   * @throws IllegalArgumentException if there are no streams or stream names repeat
   */
  public SessionDescriptor {
    Objects.requireNonNull(id, "id");
    streams = List.copyOf(Objects.requireNonNull(streams, "streams"));
    metadata = Map.copyOf(Objects.requireNonNullElse(metadata, Map.of()));
    if (streams.isEmpty()) {
      throw new IllegalArgumentException("session " + id + " declares no streams");
    }
    Set<String> names = new HashSet<>();
    for (StreamDescriptor stream : streams) {
      if (!names.add(stream.name())) {
        throw new IllegalArgumentException("session " + id + " declares stream " + stream.name() + " twice");
      }
    }
  }

  /**
   * Returns the distinct source containers referenced by the streams, in first-use order.
   *
   * @return ordered set of source paths
   */
  public Set<Path> sources() {
    Set<Path> sources = new LinkedHashSet<>();
    for (StreamDescriptor stream : streams) {
      sources.add(stream.source());
    }
    return sources;
  }
}
