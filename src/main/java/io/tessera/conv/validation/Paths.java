package io.tessera.conv.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation utilities for the output root and source inputs.
 * <p><strong>Why:</strong> A batch may run for hours; rejecting an unwritable output root or a missing
 * manifest up front is cheaper than failing every session.</p>
 * <p><strong>Thread-safety:</strong> Stateless methods; concurrency limited by underlying filesystem semantics.</p>
 * <p><strong>Observability:</strong> Emits no metrics or logs; callers surface validation exceptions.</p>
 *
 * @since 0.1.0
 * @see Strings
 * @see Numbers
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates a writable directory, optionally creating it (and parents) when absent.
   *
   * @param path candidate directory; must not be {@code null}
   * @param createIfMissing whether to create the directory when absent
   * @return real directory path when it exists, otherwise the absolute normalized path
   * @throws IllegalArgumentException if the path is malformed, not a directory, not writable, or creation fails
   */
  public static Path validateWritableDir(Path path, boolean createIfMissing) {
    Path normalized = normalize(path);
    try {
      if (!Files.exists(normalized, LinkOption.NOFOLLOW_LINKS)) {
        if (!createIfMissing) {
          throw new IllegalArgumentException("directory does not exist: " + normalized);
        }
        Files.createDirectories(normalized);
      }
      Path real = normalized.toRealPath();
      if (!Files.isDirectory(real)) {
        throw new IllegalArgumentException("path is not a directory: " + real);
      }
      if (!Files.isWritable(real)) {
        throw new IllegalArgumentException("directory is not writable: " + real);
      }
      return real;
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to validate directory " + normalized + ": " + ex.getMessage(), ex);
    }
  }

  private static Path normalize(Path path) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    String raw = path.toString();
    for (int i = 0; i < raw.length(); i++) {
      if (Character.isISOControl(raw.charAt(i))) {
        throw new IllegalArgumentException("path must not contain control characters");
      }
    }
    return path.toAbsolutePath().normalize();
  }
}
