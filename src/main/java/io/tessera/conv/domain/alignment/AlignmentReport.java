package io.tessera.conv.domain.alignment;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Ordered findings of the time-alignment validator for one session.
 * <p><strong>Role:</strong> Stored in the conversion result and in the target container's metadata section.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param findings findings sorted by {@link AlignmentFinding#REPORT_ORDER}
 * @since 0.1.0
 */
public record AlignmentReport(List<AlignmentFinding> findings) {
  private static final AlignmentReport EMPTY = new AlignmentReport(List.of());

  /**
   * Sorts and copies the findings.
   */
  public AlignmentReport {
    List<AlignmentFinding> sorted = new ArrayList<>(Objects.requireNonNull(findings, "findings"));
    sorted.sort(AlignmentFinding.REPORT_ORDER);
    findings = List.copyOf(sorted);
  }

  /**
   * Returns a report without findings.
   *
   * @return shared empty report
   */
  public static AlignmentReport empty() {
    return EMPTY;
  }

  public boolean hasErrors() {
    return findings.stream().anyMatch(AlignmentFinding::error);
  }

  public boolean hasWarnings() {
    return findings.stream().anyMatch(f -> !f.error());
  }

  /**
   * Filters findings of one severity, keeping report order.
   *
   * @param severity severity to keep
   * @return matching findings
   */
  public List<AlignmentFinding> withSeverity(Severity severity) {
    return findings.stream().filter(f -> f.severity() == severity).toList();
  }

  /**
   * Filters findings of one stream, keeping report order.
   *
   * @param stream stream name
   * @return matching findings
   */
  public List<AlignmentFinding> forStream(String stream) {
    return findings.stream().filter(f -> f.stream().equals(stream)).toList();
  }

  /**
   * Merges two reports into one ordered report.
   *
   * @param other findings to add
   * @return combined report
   */
  public AlignmentReport merge(AlignmentReport other) {
    List<AlignmentFinding> combined = new ArrayList<>(findings);
    combined.addAll(other.findings());
    return new AlignmentReport(combined);
  }
}
