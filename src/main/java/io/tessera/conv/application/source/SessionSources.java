package io.tessera.conv.application.source;

import io.tessera.conv.application.port.SourceStore;
import io.tessera.conv.application.port.SourceStoreFactory;
import io.tessera.conv.domain.error.SchemaMismatchException;
import io.tessera.conv.domain.error.SourceUnavailableException;
import io.tessera.conv.domain.session.SessionDescriptor;
import io.tessera.conv.domain.session.StreamDescriptor;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> The open source stores of one session plus every reader handed out from them.
 * <p><strong>Why:</strong> A single owner for all source handles guarantees they are released on every exit
 * path of a pipeline, including aborts.</p>
 * <p><strong>Thread-safety:</strong> Reader creation and {@link #close()} are synchronized.</p>
 *
 * @since 0.1.0
 */
public final class SessionSources implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(SessionSources.class);

  private final Map<Path, SourceStore> stores;
  private final List<SourceReader> readers = new ArrayList<>();
  private boolean closed;

  private SessionSources(Map<Path, SourceStore> stores) {
    this.stores = stores;
  }

  /**
   * Opens one store per distinct source container referenced by the session.
   *
   * @param session session to locate
   * @param factory store factory
   * @return open sources; the caller must close them
   * @throws SourceUnavailableException if any container is missing or corrupt; stores opened so far are closed
   */
  public static SessionSources open(SessionDescriptor session, SourceStoreFactory factory)
      throws SourceUnavailableException {
    Map<Path, SourceStore> stores = new LinkedHashMap<>();
    try {
      for (StreamDescriptor stream : session.streams()) {
        if (!stores.containsKey(stream.source())) {
          try {
            stores.put(stream.source(), factory.open(stream.source()));
          } catch (SourceUnavailableException ex) {
            throw new SourceUnavailableException(stream.name(), ex.getMessage(), ex);
          }
        }
      }
    } catch (SourceUnavailableException | RuntimeException ex) {
      closeAll(stores.values(), ex);
      throw ex;
    }
    return new SessionSources(stores);
  }

  /**
   * Opens a reader over the stream's sample dataset.
   *
   * @param stream stream declaration
   * @return tracked reader
   * @throws SourceUnavailableException if the dataset is missing or unreadable
   * @throws SchemaMismatchException if the dataset layout is inconsistent
   */
  public SourceReader reader(StreamDescriptor stream) throws SourceUnavailableException, SchemaMismatchException {
    return track(stream, stream.datasetPath());
  }

  /**
   * Opens a reader over the stream's explicit timestamps, when declared.
   *
   * @param stream stream declaration
   * @return tracked reader, or empty when timestamps are implicit
   * @throws SourceUnavailableException if the dataset is missing or unreadable
   * @throws SchemaMismatchException if the dataset layout is inconsistent
   */
  public Optional<SourceReader> timestampsReader(StreamDescriptor stream)
      throws SourceUnavailableException, SchemaMismatchException {
    if (stream.timestampsPath().isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(track(stream, stream.timestampsPath().get()));
  }

  /**
   * Counts readers that are still open.
   *
   * @return open reader count
   */
  public synchronized int openReaders() {
    int open = 0;
    for (SourceReader reader : readers) {
      if (!reader.isClosed()) {
        open++;
      }
    }
    return open;
  }

  /**
   * Closes every reader and store. Safe to call more than once.
   *
   * @throws IOException the first close failure, with later failures attached as suppressed
   */
  @Override
  public synchronized void close() throws IOException {
    if (closed) {
      return;
    }
    closed = true;
    IOException failure = null;
    for (SourceReader reader : readers) {
      try {
        reader.close();
      } catch (IOException ex) {
        failure = chain(failure, ex);
      }
    }
    for (SourceStore store : stores.values()) {
      try {
        store.close();
      } catch (IOException ex) {
        failure = chain(failure, ex);
      }
    }
    if (failure != null) {
      throw failure;
    }
  }

  private synchronized SourceReader track(StreamDescriptor stream, String datasetPath)
      throws SourceUnavailableException, SchemaMismatchException {
    if (closed) {
      throw new IllegalStateException("session sources already closed");
    }
    SourceStore store = stores.get(stream.source());
    if (store == null) {
      throw new SourceUnavailableException(stream.name(), "source " + stream.source() + " was not located");
    }
    try {
      SourceReader reader = SourceReader.open(store, stream.name(), datasetPath);
      readers.add(reader);
      return reader;
    } catch (SourceUnavailableException ex) {
      throw new SourceUnavailableException(stream.name(), ex.getMessage(), ex);
    } catch (SchemaMismatchException ex) {
      throw new SchemaMismatchException(stream.name(), ex.getMessage(), ex);
    }
  }

  private static IOException chain(IOException first, IOException next) {
    if (first == null) {
      return next;
    }
    first.addSuppressed(next);
    return first;
  }

  private static void closeAll(Iterable<SourceStore> stores, Exception primary) {
    for (SourceStore store : stores) {
      try {
        store.close();
      } catch (IOException closeEx) {
        log.warn("Failed to close source store {}", store.location(), closeEx);
        primary.addSuppressed(closeEx);
      }
    }
  }
}
