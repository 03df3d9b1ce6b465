package io.tessera.conv.infrastructure.source;

import io.tessera.conv.application.port.SourceStore;
import io.tessera.conv.application.port.SourceStoreFactory;
import io.tessera.conv.domain.error.SourceUnavailableException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Selects the source adapter from the location type: directories use {@link DirectorySourceStore},
 * regular files use {@link PackedSourceStore}.
 *
 * @since 0.1.0
 */
public final class SourceStores implements SourceStoreFactory {

  @Override
  public SourceStore open(Path location) throws SourceUnavailableException {
    if (location == null || !Files.exists(location)) {
      throw new SourceUnavailableException(null, "source container not found: " + location);
    }
    if (Files.isDirectory(location)) {
      return DirectorySourceStore.open(location);
    }
    return PackedSourceStore.open(location);
  }
}
