package io.tessera.conv.application.port;

import io.tessera.conv.domain.error.SourceUnavailableException;
import java.nio.file.Path;

/**
 * Opens source stores by location.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface SourceStoreFactory {
  /**
   * Opens the store at {@code location}.
   *
   * @param location source container path
   * @return open store; the caller must close it
   * @throws SourceUnavailableException if the container is missing or corrupt
   */
  SourceStore open(Path location) throws SourceUnavailableException;
}
