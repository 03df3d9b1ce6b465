package io.tessera.conv.application.port;

import io.tessera.conv.domain.error.WriteFailureException;
import io.tessera.conv.domain.session.SessionDescriptor;

/**
 * Creates one target writer per session.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface TargetWriterFactory {
  /**
   * Opens a writer for the session's container.
   *
   * @param session session being converted
   * @return open writer; the caller must close it
   * @throws WriteFailureException if the container cannot be created
   */
  TargetWriter open(SessionDescriptor session) throws WriteFailureException;
}
