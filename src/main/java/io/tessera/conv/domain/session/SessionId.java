package io.tessera.conv.domain.session;

import io.tessera.conv.validation.Strings;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Identity of one recording session: subject, recording date, and session index.
 * <p><strong>Why:</strong> Gives every pipeline, log line, and target container a stable name.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param subject subject code; letters, digits, dot, or hyphen
 * @param date calendar date of the recording
 * @param index zero-based session index within the day
 * @since 0.1.0
 */
public record SessionId(String subject, LocalDate date, int index) {
  private static final Pattern TEXT_FORM =
      Pattern.compile("^([A-Za-z0-9.-]+)_(\\d{4}-\\d{2}-\\d{2})_(\\d+)$");

  /**
   * Validates the components.
   *
   * @throws IllegalArgumentException if the subject is blank or malformed, or the index is negative
   */
  public SessionId {
    subject = Strings.requireIdentifier("subject", subject);
    if (subject.indexOf('_') >= 0) {
      throw new IllegalArgumentException("subject must not contain '_' (was " + subject + ")");
    }
    Objects.requireNonNull(date, "date");
    if (index < 0) {
      throw new IllegalArgumentException("index must be >= 0 (was " + index + ")");
    }
  }

  /**
   * Parses the canonical {@code <subject>_<yyyy-MM-dd>_<index>} form produced by {@link #toString()}.
   *
   * @param text canonical session id text
   * @return parsed session id
   * @throws IllegalArgumentException if the text does not follow the canonical form
   */
  public static SessionId parse(String text) {
    String trimmed = Strings.requireNonBlank("sessionId", text);
    Matcher matcher = TEXT_FORM.matcher(trimmed);
    if (!matcher.matches()) {
      throw new IllegalArgumentException(
          "session id must look like <subject>_<yyyy-MM-dd>_<index> (was " + trimmed + ")");
    }
    try {
      return new SessionId(
          matcher.group(1), LocalDate.parse(matcher.group(2)), Integer.parseInt(matcher.group(3)));
    } catch (DateTimeParseException | NumberFormatException ex) {
      throw new IllegalArgumentException("invalid session id: " + trimmed, ex);
    }
  }

  @Override
  public String toString() {
    return subject + '_' + date + '_' + index;
  }
}
