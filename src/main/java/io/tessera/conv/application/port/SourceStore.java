package io.tessera.conv.application.port;

import io.tessera.conv.domain.error.SchemaMismatchException;
import io.tessera.conv.domain.error.SourceUnavailableException;
import java.io.Closeable;
import java.nio.file.Path;
import java.util.Set;

/**
 * <strong>What:</strong> Opaque keyed byte container exposing named datasets by path.
 * <p><strong>Role:</strong> Source-side port; adapters cover packed single-file containers and
 * directory layouts.</p>
 * <p><strong>Thread-safety:</strong> Implementations must allow concurrent {@link #open(String)} calls and
 * concurrent reads through distinct handles.</p>
 *
 * @since 0.1.0
 */
public interface SourceStore extends Closeable {
  /**
   * Returns the filesystem location backing the store.
   *
   * @return store path
   */
  Path location();

  /**
   * Lists the dataset paths present in the store.
   *
   * @return dataset paths such as {@code ephys/raw}
   */
  Set<String> datasetPaths();

  /**
   * Opens a dataset for positional reads.
   *
   * @param datasetPath dataset path inside the store
   * @return scoped handle; the caller must close it
   * @throws SourceUnavailableException if the dataset is absent or its storage is unreadable or truncated
   * @throws SchemaMismatchException if the stored layout contradicts the declared shape
   */
  DatasetHandle open(String datasetPath) throws SourceUnavailableException, SchemaMismatchException;
}
