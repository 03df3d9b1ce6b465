package io.tessera.conv.domain.alignment;

import java.util.Comparator;
import java.util.Objects;

/**
 * One timing-consistency finding.
 *
 * @param stream stream the finding refers to
 * @param severity warning or error
 * @param type finding category
 * @param interval offending interval on the session clock
 * @param description human-readable detail
 * @since 0.1.0
 */
public record AlignmentFinding(
    String stream, Severity severity, FindingType type, TimeInterval interval, String description) {

  /** Report order: stream name, interval start, interval end, then finding type. */
  public static final Comparator<AlignmentFinding> REPORT_ORDER =
      Comparator.comparing(AlignmentFinding::stream)
          .thenComparingDouble(f -> f.interval().startSeconds())
          .thenComparingDouble(f -> f.interval().endSeconds())
          .thenComparing(AlignmentFinding::type)
          .thenComparing(AlignmentFinding::severity);

  public AlignmentFinding {
    Objects.requireNonNull(stream, "stream");
    Objects.requireNonNull(severity, "severity");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(interval, "interval");
    description = description == null ? "" : description;
  }

  public boolean error() {
    return severity == Severity.ERROR;
  }
}
