package io.tessera.conv.validation;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Validation utilities for strings used by the configuration, manifest, and CLI layers.
 * <p><strong>Why:</strong> Session ids, stream names, and dataset paths end up in file names and container
 * catalogs, so they are sanitized before any pipeline opens a source or writes a target.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject blank or control-character inputs supplied via CLI, manifests, or config files.</li>
 *   <li>Restrict identifiers to a file-name safe character set.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable stateless utilities; safe for concurrent access.</p>
 * <p><strong>Observability:</strong> No metrics or logs; validation failures raise {@link IllegalArgumentException}.</p>
 *
 * @implNote Control characters are detected via {@link Character#isISOControl(char)}.
 * @since 0.1.0
 * @see Numbers
 * @see Paths
 */
public final class Strings {
  private static final Pattern IDENTIFIER_PATTERN = Pattern.compile("^([A-Za-z0-9._-]+)$");

  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input with leading/trailing whitespace removed
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Validates an identifier that may appear in file names or container paths, such as a stream name.
   *
   * @param name logical parameter name included in exception messages
   * @param value candidate identifier; must be non-null
   * @return sanitized identifier matching {@code [A-Za-z0-9._-]+}
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the identifier is blank or contains unsupported characters
   */
  public static String requireIdentifier(String name, String value) {
    String sanitized = requireNonBlank(name, value);
    if (!IDENTIFIER_PATTERN.matcher(sanitized).matches()) {
      throw new IllegalArgumentException(message(name,
          "must only contain letters, digits, dot, underscore, or hyphen (was " + sanitized + ")"));
    }
    return sanitized;
  }

  /**
   * Validates a slash-separated dataset path such as {@code ephys/raw}.
   *
   * @param name logical parameter name included in exception messages
   * @param value candidate path
   * @return path without leading or trailing slashes
   * @throws IllegalArgumentException if any segment is empty, a dot segment, or not an identifier
   */
  public static String requireDatasetPath(String name, String value) {
    String sanitized = requireNonBlank(name, value);
    String stripped = sanitized;
    while (stripped.startsWith("/")) {
      stripped = stripped.substring(1);
    }
    while (stripped.endsWith("/")) {
      stripped = stripped.substring(0, stripped.length() - 1);
    }
    if (stripped.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must name a dataset (was " + sanitized + ")"));
    }
    for (String segment : stripped.split("/", -1)) {
      if (segment.isEmpty() || ".".equals(segment) || "..".equals(segment)
          || !IDENTIFIER_PATTERN.matcher(segment).matches()) {
        throw new IllegalArgumentException(message(name, "has an invalid segment (was " + sanitized + ")"));
      }
    }
    return stripped;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
